package com.insightflo.news.store;

import com.insightflo.core.model.BookmarkMutation;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SentimentLabel;
import com.insightflo.core.model.SyncMetadata;
import com.insightflo.core.model.SyncStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Embedded storage for cached news, sync metadata, search history and API cache slots.
 * <p>
 * Read methods log failures and return empty results. Writes used by sync
 * ({@link #upsertAll}) and by the cache layer throw
 * {@link com.insightflo.core.error.StorageException}.
 */
public interface LocalStore extends AutoCloseable {

    // News records
    Optional<NewsRecord> getRecord(String id, String userId);
    boolean hasRecord(String id, String userId);
    void upsert(NewsRecord record);
    int upsertAll(List<NewsRecord> records);
    boolean updateBookmark(String id, String userId, boolean bookmarked);
    int updateSentiment(String userId, Map<String, Double> scoresById);
    int cleanupOldRecords(String userId, int keepCount, int retentionDays);

    // Feeds
    List<NewsRecord> getPersonalizedNews(String userId, int limit, int offset);
    List<NewsRecord> getFreshNews(String userId, int limit);
    List<NewsRecord> getBookmarkedNews(String userId, int limit);
    List<NewsRecord> getNewsBySentiment(String userId, double minScore, double maxScore, int limit);
    List<NewsRecord> getNewsByDateRange(String userId, Instant start, Instant end, int limit);
    List<NewsRecord> getTopNewsBySentiment(String userId, SentimentLabel label, int limit);

    // Text search
    List<NewsRecord> searchContaining(String userId, String query, int limit);
    List<NewsRecord> fullTextSearch(String userId, String ftsQuery, int limit);
    int ensureFullTextIndex();

    // Aggregates
    StoreStats getStats(String userId);
    List<SourceStats> getSourceStatistics(String userId, int limit);
    SentimentProfile getUserSentimentProfile(String userId, Instant since);
    List<TextFrequency> getTitleFrequencies(String userId, String prefix, int limit);

    // Pending local mutations
    List<BookmarkMutation> getBookmarkMutations(String userId, Instant since);
    int clearBookmarkMutations(String userId, Instant upTo);

    // Sync metadata
    Optional<SyncMetadata> getSyncMetadata(String tableName, String direction);
    void upsertSyncMetadata(SyncMetadata metadata);
    List<SyncMetadata> getSyncMetadataByStatus(SyncStatus status);
    SyncStatistics getSyncStatistics();
    int cleanupSyncMetadata(Duration retention);

    // Search history
    void insertSearchHistory(SearchHistoryRow row);
    List<SearchHistoryRow> getSearchHistory(String userId, int limit, String queryContains);
    List<TextFrequency> getHistoricalQueries(String userId, String prefix, int limit);
    int deleteSearchHistory(String userId, Instant olderThan);
    int pruneSearchHistory(String userId, Instant cutoff, int maxEntries);
    HistoryAggregate aggregateSearchHistory(String userId, Instant since);
    List<TextFrequency> getTopQueries(String userId, Instant since, int limit);
    Map<Integer, Integer> getSearchesByHour(String userId, Instant since);

    // API cache slots
    Optional<CacheEntry> getCacheEntry(String key);
    void putCacheEntry(CacheEntry entry);
    void invalidateCacheEntry(String key);
    void clearCache();
    int deleteExpiredCacheEntries(Instant expiredBefore);
    int countCacheEntries();

    // Maintenance
    OptimizeResult optimize();

    @Override
    void close();

    // Result records

    record StoreStats(int total, int bookmarked, int fresh) {
        public static final StoreStats EMPTY = new StoreStats(0, 0, 0);
    }

    record SourceStats(
        String source,
        int articleCount,
        double avgSentiment,
        int bookmarkedCount,
        Instant latestArticleDate
    ) {}

    record SentimentProfile(double averageSentiment, int bookmarkedCount, int totalCount) {
        public static final SentimentProfile EMPTY = new SentimentProfile(0.0, 0, 0);

        public double bookmarkRate() {
            return totalCount == 0 ? 0.0 : (double) bookmarkedCount / totalCount;
        }
    }

    record TextFrequency(String text, int frequency) {}

    record SyncStatistics(
        int totalTables,
        Map<SyncStatus, Integer> byStatus,
        long totalRecords,
        Instant lastSyncTime,      // nullable
        int failedSyncs
    ) {
        public static final SyncStatistics EMPTY = new SyncStatistics(0, Map.of(), 0, null, 0);
    }

    record SearchHistoryRow(
        String id,
        String userId,
        String query,
        String filterJson,          // nullable
        Instant timestamp,
        int resultCount,
        long searchDurationMs
    ) {}

    record HistoryAggregate(int totalSearches, double averageResultCount,
                            double averageSearchDurationMs, int uniqueQueries) {
        public static final HistoryAggregate EMPTY = new HistoryAggregate(0, 0.0, 0.0, 0);
    }

    record CacheEntry(String key, String payload, Instant cachedAt, Instant expiresAt) {
        public boolean isStale(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    record OptimizeResult(long pagesBefore, long pagesAfter) {}
}
