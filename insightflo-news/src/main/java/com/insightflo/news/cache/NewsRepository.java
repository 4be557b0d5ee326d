package com.insightflo.news.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.error.Result;
import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.news.remote.NewsGateway;
import com.insightflo.news.store.LocalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Feed and search reads for the application, served through the cache layer.
 * Fresh remote results are also written into the local store so search and
 * sync see them.
 */
public class NewsRepository {

    private static final Logger log = LoggerFactory.getLogger(NewsRepository.class);

    public static final Duration PERSONALIZED_TTL = Duration.ofHours(1);
    public static final Duration SEARCH_TTL = Duration.ofMinutes(15);

    private static final TypeReference<List<NewsRecord>> RECORD_LIST = new TypeReference<>() {};

    private final StaleWhileRevalidateCache cache;
    private final NewsGateway gateway;
    private final LocalStore store;

    public NewsRepository(StaleWhileRevalidateCache cache, NewsGateway gateway, LocalStore store) {
        this.cache = cache;
        this.gateway = gateway;
        this.store = store;
    }

    public Result<CacheResult<List<NewsRecord>>> getPersonalizedNews(String userId, int page, int limit) {
        String key = CacheKeys.personalizedNews(userId, page, limit);
        Result<CacheResult<List<NewsRecord>>> result = cache.get(key, PERSONALIZED_TTL, RECORD_LIST,
            () -> gateway.fetchPersonalizedNews(userId, page, limit));
        return result.map(r -> afterRead(r, userId));
    }

    public Result<CacheResult<List<NewsRecord>>> searchNews(String userId, String query, int page, int limit) {
        String key = CacheKeys.search(query, page, limit);
        Result<CacheResult<List<NewsRecord>>> result = cache.get(key, SEARCH_TTL, RECORD_LIST,
            () -> gateway.searchNews(query, page, limit));
        return result.map(r -> afterRead(r, userId));
    }

    public Result<Boolean> toggleBookmark(String userId, String articleId, boolean bookmarked) {
        try {
            boolean updated = store.updateBookmark(articleId, userId, bookmarked);
            if (!updated) {
                log.debug("Bookmark toggle for unknown article {} ({})", articleId, userId);
            }
            return Result.ok(updated);
        } catch (StorageException e) {
            log.error("Failed to toggle bookmark {}: {}", articleId, e.getMessage());
            return Result.err(ErrorKind.STORAGE, e.getMessage(), e);
        }
    }

    public List<NewsRecord> getBookmarkedNews(String userId, int limit) {
        return store.getBookmarkedNews(userId, limit);
    }

    private CacheResult<List<NewsRecord>> afterRead(CacheResult<List<NewsRecord>> result, String userId) {
        List<NewsRecord> records = new ArrayList<>(result.data().size());
        for (NewsRecord record : result.data()) {
            NewsRecord owned = userId.equals(record.userId()) ? record : record.withUserId(userId);
            Optional<NewsRecord> local = store.getRecord(owned.id(), userId);
            // Bookmark state is owned locally
            records.add(local.map(l -> owned.withBookmarked(l.bookmarked())).orElse(owned));
        }

        if (result.fromRemote() && !records.isEmpty()) {
            try {
                store.upsertAll(records);
            } catch (StorageException e) {
                log.error("Failed to store {} fetched records for {}: {}", records.size(), userId, e.getMessage());
            }
        }
        return new CacheResult<>(List.copyOf(records), result.isStale(), result.cachedAt(),
            result.expiresAt(), result.fromRemote());
    }
}
