package com.insightflo.news.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.error.Result;
import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.news.store.LocalStore;
import com.insightflo.news.store.LocalStore.HistoryAggregate;
import com.insightflo.news.store.LocalStore.SearchHistoryRow;
import com.insightflo.news.store.LocalStore.SentimentProfile;
import com.insightflo.news.store.LocalStore.SourceStats;
import com.insightflo.news.store.LocalStore.TextFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ranked, filtered and suggested search over the local store.
 * <p>
 * Semantic search takes full-text candidates (or substring matches when the index is
 * unusable), keeps those whose TF-IDF reaches the threshold and orders them by a weighted
 * relevance score. History writes run on a background executor and never fail a search.
 */
public class SearchEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int TOP_QUERY_LIMIT = 10;

    static final String INDEX_PUBLISHED_AT = "publishedAt_index";
    static final String INDEX_USER_PUBLISHED_AT = "userId_publishedAt_index";
    static final String INDEX_SOURCE = "source_index";
    static final String INDEX_SENTIMENT = "sentiment_index";
    static final String INDEX_BOOKMARK = "bookmark_index";

    private static final Duration SENTIMENT_WINDOW = Duration.ofDays(30);
    private static final int KEYWORD_SAMPLE_SIZE = 200;
    private static final int SOURCE_SAMPLE_SIZE = 50;

    private final LocalStore store;
    private final SearchConfig config;
    private final Clock clock;
    private final RelevanceScorer scorer;
    private final SuggestionCache suggestionCache;
    private final Debouncer<List<SearchSuggestion>> suggestionDebouncer;
    private final ObjectMapper mapper;
    private final List<SearchListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong historyCounter = new AtomicLong();

    private final ExecutorService ownExecutor;
    private Executor historyExecutor;

    public SearchEngine(LocalStore store) {
        this(store, SearchConfig.DEFAULT, Clock.systemUTC());
    }

    public SearchEngine(LocalStore store, SearchConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.scorer = new RelevanceScorer(clock);
        this.suggestionCache = new SuggestionCache(config.suggestionTtl(), config.suggestionCacheSize(), clock);
        this.suggestionDebouncer = new Debouncer<>(config.suggestionDebounce(), "search-suggest");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.ownExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "search-history");
            t.setDaemon(true);
            return t;
        });
        this.historyExecutor = ownExecutor;
    }

    public SearchEngine withHistoryExecutor(Executor executor) {
        this.historyExecutor = executor;
        return this;
    }

    public void addListener(SearchListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SearchListener listener) {
        listeners.remove(listener);
    }

    /**
     * Create the full-text index if missing and repopulate it when empty.
     */
    public int ensureIndex() {
        return store.ensureFullTextIndex();
    }

    // ========== Semantic search ==========

    public Result<SearchResult<ScoredResult>> semanticSearch(String query, String userId, int limit) {
        return semanticSearch(query, userId, limit, config.relevanceThreshold());
    }

    public Result<SearchResult<ScoredResult>> semanticSearch(String query, String userId, int limit, double threshold) {
        Instant start = clock.instant();
        if (query == null || query.isBlank()) {
            return Result.ok(SearchResult.empty(Duration.ZERO, Map.of("searchMethod", "empty_query")));
        }

        try {
            String method = "fts5_tfidf";
            List<NewsRecord> candidates;
            try {
                candidates = store.fullTextSearch(userId, TextTokenizer.toFtsQuery(query), limit * 3);
            } catch (StorageException e) {
                log.warn("Full-text search unavailable for '{}', falling back to substring search: {}",
                    query, e.getMessage());
                emit(SearchEvent.Type.SEARCH_DEGRADED, userId, query, 0, e.getMessage());
                method = "basic_tfidf";
                candidates = store.searchContaining(userId, query, limit * 3);
            }

            if (candidates.isEmpty()) {
                Duration elapsed = Duration.between(start, clock.instant());
                recordSearchHistory(userId, query, SearchFilter.ofQuery(query), 0, elapsed);
                emit(SearchEvent.Type.SEARCH_COMPLETED, userId, query, 0, method);
                return Result.ok(SearchResult.empty(elapsed,
                    Map.of("searchMethod", "fts5_fallback", "candidateCount", 0)));
            }

            double[] tfidf = TfIdfScorer.score(query, candidates);
            SentimentProfile profile = sentimentProfile(userId);

            List<ScoredResult> scored = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (tfidf[i] < threshold) {
                    continue;
                }
                NewsRecord record = candidates.get(i);
                ScoreBreakdown breakdown = scorer.breakdown(record, tfidf[i], profile);
                scored.add(new ScoredResult(record, RelevanceScorer.combine(breakdown), breakdown));
            }
            scored.sort(Comparator.comparingDouble(ScoredResult::score).reversed());

            int totalCount = scored.size();
            List<ScoredResult> page = scored.subList(0, Math.min(limit, scored.size()));
            double averageScore = page.stream().mapToDouble(ScoredResult::score).average().orElse(0.0);
            Duration elapsed = Duration.between(start, clock.instant());

            recordSearchHistory(userId, query, SearchFilter.ofQuery(query), page.size(), elapsed);
            emit(SearchEvent.Type.SEARCH_COMPLETED, userId, query, page.size(), method);
            log.debug("Semantic search '{}' for {}: {} candidates, {} above {}",
                query, userId, candidates.size(), totalCount, threshold);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("searchMethod", method);
            metadata.put("candidateCount", candidates.size());
            metadata.put("threshold", threshold);
            metadata.put("avgRelevanceScore", averageScore);
            return Result.ok(new SearchResult<>(page, totalCount, elapsed, metadata));
        } catch (RuntimeException e) {
            log.error("Semantic search '{}' failed for {}: {}", query, userId, e.getMessage(), e);
            emit(SearchEvent.Type.SEARCH_FAILED, userId, query, 0, e.getMessage());
            ErrorKind kind = e instanceof StorageException ? ErrorKind.STORAGE : ErrorKind.UNKNOWN;
            return Result.err(kind, "Semantic search failed: " + e.getMessage(), e);
        }
    }

    /**
     * Score and order an existing result list against {@code query}. No threshold is applied.
     */
    public List<ScoredResult> rankByRelevance(List<NewsRecord> results, String query, String userId) {
        if (results.isEmpty()) {
            return List.of();
        }
        double[] tfidf = TfIdfScorer.score(query, results);
        SentimentProfile profile = sentimentProfile(userId);

        List<ScoredResult> scored = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            ScoreBreakdown breakdown = scorer.breakdown(results.get(i), tfidf[i], profile);
            scored.add(new ScoredResult(results.get(i), RelevanceScorer.combine(breakdown), breakdown));
        }
        scored.sort(Comparator.comparingDouble(ScoredResult::score).reversed());
        return scored;
    }

    private SentimentProfile sentimentProfile(String userId) {
        try {
            return store.getUserSentimentProfile(userId, clock.instant().minus(SENTIMENT_WINDOW));
        } catch (RuntimeException e) {
            log.debug("No sentiment profile for {}: {}", userId, e.getMessage());
            return SentimentProfile.EMPTY;
        }
    }

    // ========== Multi-criteria filtering ==========

    /**
     * Apply every criterion of {@code filter} to the user's cached articles.
     * {@code totalCount} is the size of the base set before in-memory filtering.
     * Relevance bounds are reported in the metadata but not applied here.
     */
    public Result<SearchResult<NewsRecord>> filterByMultipleCriteria(SearchFilter filter, String userId) {
        Instant start = clock.instant();
        try {
            List<String> indexesUsed = new ArrayList<>();
            int fetchSize = filter.limit() * 2;

            List<NewsRecord> base;
            if (filter.dateRange() != null) {
                base = store.getNewsByDateRange(userId, filter.dateRange().start(), filter.dateRange().end(), fetchSize);
                indexesUsed.add(INDEX_PUBLISHED_AT);
            } else {
                base = store.getPersonalizedNews(userId, fetchSize, filter.offset());
                indexesUsed.add(INDEX_USER_PUBLISHED_AT);
            }
            int totalCount = base.size();

            List<NewsRecord> filtered = new ArrayList<>(base);
            if (filter.hasQuery()) {
                String needle = filter.query().toLowerCase(Locale.ROOT);
                filtered.removeIf(r -> !(r.title().toLowerCase(Locale.ROOT).contains(needle)
                    || r.summary().toLowerCase(Locale.ROOT).contains(needle)
                    || r.content().toLowerCase(Locale.ROOT).contains(needle)));
            }
            if (!filter.sources().isEmpty()) {
                List<String> sources = filter.sources().stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
                filtered.removeIf(r -> !sources.contains(r.source().toLowerCase(Locale.ROOT)));
                indexesUsed.add(INDEX_SOURCE);
            }
            if (filter.sentimentFilter() != null) {
                SentimentFilter sentiment = filter.sentimentFilter();
                filtered.removeIf(r -> !sentiment.matches(r.sentimentScore(), r.sentimentLabel()));
                indexesUsed.add(INDEX_SENTIMENT);
            }
            if (filter.keywordFilter() != null) {
                KeywordFilter keywords = filter.keywordFilter();
                filtered.removeIf(r -> !keywords.matches(r.keywords(), r.title() + " " + r.summary() + " " + r.content()));
            }
            if (filter.bookmarked() != null) {
                boolean wanted = filter.bookmarked();
                filtered.removeIf(r -> r.bookmarked() != wanted);
                indexesUsed.add(INDEX_BOOKMARK);
            }

            filtered.sort(comparator(filter.sortBy(), filter.sortOrder()));
            List<NewsRecord> page = filtered.subList(0, Math.min(filter.limit(), filtered.size()));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("filterCount", filter.activeFilterCount());
            metadata.put("queryComplexity", filter.queryComplexity());
            metadata.put("indexesUsed", List.copyOf(indexesUsed));
            return Result.ok(new SearchResult<>(page, totalCount, Duration.between(start, clock.instant()), metadata));
        } catch (RuntimeException e) {
            log.error("Filtered search failed for {}: {}", userId, e.getMessage(), e);
            emit(SearchEvent.Type.SEARCH_FAILED, userId, filter.query(), 0, e.getMessage());
            ErrorKind kind = e instanceof StorageException ? ErrorKind.STORAGE : ErrorKind.UNKNOWN;
            return Result.err(kind, "Multi-criteria filtering failed: " + e.getMessage(), e);
        }
    }

    private static Comparator<NewsRecord> comparator(SortBy sortBy, SortOrder order) {
        Comparator<NewsRecord> comparator = switch (sortBy) {
            case PUBLISHED_AT -> Comparator.comparing(NewsRecord::publishedAt);
            case SENTIMENT_SCORE -> Comparator.comparingDouble(NewsRecord::sentimentScore);
            case TITLE -> Comparator.comparing(NewsRecord::title);
            case SOURCE -> Comparator.comparing(NewsRecord::source);
        };
        return order == SortOrder.ASCENDING ? comparator : comparator.reversed();
    }

    // ========== Suggestions ==========

    public List<SearchSuggestion> getSearchSuggestions(String prefix, String userId, int limit) {
        return getSearchSuggestions(prefix, userId, limit, null);
    }

    /**
     * Merge keyword, source, title and historical-query suggestions for {@code prefix}.
     * {@code types} null or empty means all types.
     */
    public List<SearchSuggestion> getSearchSuggestions(String prefix, String userId, int limit,
                                                       List<SuggestionType> types) {
        if (prefix == null || prefix.trim().isEmpty()) {
            return List.of();
        }
        String trimmed = prefix.trim();
        String cacheKey = SuggestionCache.key(userId, trimmed, types);
        List<SearchSuggestion> cached = suggestionCache.get(cacheKey).orElse(null);
        if (cached != null) {
            return cached.subList(0, Math.min(limit, cached.size()));
        }

        String lowerPrefix = trimmed.toLowerCase(Locale.ROOT);
        List<SearchSuggestion> suggestions = new ArrayList<>();
        if (wants(types, SuggestionType.KEYWORD)) {
            suggestions.addAll(keywordSuggestions(userId, lowerPrefix, limit));
        }
        if (wants(types, SuggestionType.SOURCE)) {
            suggestions.addAll(sourceSuggestions(userId, lowerPrefix, limit));
        }
        if (wants(types, SuggestionType.TITLE)) {
            for (TextFrequency title : store.getTitleFrequencies(userId, trimmed, limit)) {
                suggestions.add(new SearchSuggestion(title.text(), SuggestionType.TITLE, 0.6, title.frequency()));
            }
        }
        if (wants(types, SuggestionType.HISTORICAL)) {
            for (TextFrequency query : store.getHistoricalQueries(userId, trimmed, limit)) {
                suggestions.add(new SearchSuggestion(query.text(), SuggestionType.HISTORICAL, 0.5, query.frequency()));
            }
        }

        List<SearchSuggestion> unique = deduplicate(suggestions);
        unique.sort(Comparator.comparingDouble(SearchSuggestion::relevance).reversed()
            .thenComparing(Comparator.comparingInt(SearchSuggestion::frequency).reversed()));
        suggestionCache.put(cacheKey, unique);
        return List.copyOf(unique.subList(0, Math.min(limit, unique.size())));
    }

    /**
     * Debounced {@link #getSearchSuggestions}: calls arriving within the debounce delay
     * replace each other and only the last one queries the store.
     */
    public CompletableFuture<List<SearchSuggestion>> getSearchSuggestionsDebounced(String prefix, String userId,
                                                                                   int limit, List<SuggestionType> types) {
        return suggestionDebouncer.submit(() -> getSearchSuggestions(prefix, userId, limit, types));
    }

    private static boolean wants(List<SuggestionType> types, SuggestionType type) {
        return types == null || types.isEmpty() || types.contains(type);
    }

    private List<SearchSuggestion> keywordSuggestions(String userId, String lowerPrefix, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> display = new HashMap<>();
        for (NewsRecord record : store.getPersonalizedNews(userId, KEYWORD_SAMPLE_SIZE, 0)) {
            for (String keyword : record.keywords()) {
                String lower = keyword.toLowerCase(Locale.ROOT);
                if (lower.startsWith(lowerPrefix)) {
                    counts.merge(lower, 1, Integer::sum);
                    display.putIfAbsent(lower, keyword);
                }
            }
        }
        List<SearchSuggestion> suggestions = new ArrayList<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(limit)
            .forEach(e -> suggestions.add(new SearchSuggestion(display.get(e.getKey()), SuggestionType.KEYWORD,
                0.7 + Math.max(0.0, Math.min(e.getValue() / 100.0, 0.3)), e.getValue())));
        return suggestions;
    }

    private List<SearchSuggestion> sourceSuggestions(String userId, String lowerPrefix, int limit) {
        List<SearchSuggestion> suggestions = new ArrayList<>();
        for (SourceStats stats : store.getSourceStatistics(userId, SOURCE_SAMPLE_SIZE)) {
            if (suggestions.size() >= limit) break;
            if (stats.source().toLowerCase(Locale.ROOT).startsWith(lowerPrefix)) {
                suggestions.add(new SearchSuggestion(stats.source(), SuggestionType.SOURCE, 0.8, stats.articleCount()));
            }
        }
        return suggestions;
    }

    /** Case-insensitive dedup keeping the highest-relevance variant, in first-seen order. */
    static List<SearchSuggestion> deduplicate(List<SearchSuggestion> suggestions) {
        Map<String, SearchSuggestion> best = new LinkedHashMap<>();
        for (SearchSuggestion suggestion : suggestions) {
            best.merge(suggestion.text().toLowerCase(Locale.ROOT), suggestion,
                (existing, candidate) -> candidate.relevance() > existing.relevance() ? candidate : existing);
        }
        return new ArrayList<>(best.values());
    }

    // ========== History ==========

    /**
     * Record a search on the history executor, then apply retention and the per-user cap.
     * The returned future always completes normally.
     */
    public CompletableFuture<Void> recordSearchHistory(String userId, String query, SearchFilter filter,
                                                       int resultCount, Duration searchDuration) {
        Instant timestamp = clock.instant();
        String id = userId + "_" + timestamp.toEpochMilli() + "_" + historyCounter.incrementAndGet();
        try {
            return CompletableFuture.runAsync(
                () -> writeHistory(id, userId, query, filter, timestamp, resultCount, searchDuration),
                historyExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Search history for {} not recorded, engine closed", userId);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void writeHistory(String id, String userId, String query, SearchFilter filter, Instant timestamp,
                              int resultCount, Duration searchDuration) {
        try {
            store.insertSearchHistory(new SearchHistoryRow(id, userId, query, encodeFilter(filter), timestamp,
                resultCount, searchDuration.toMillis()));
            int pruned = store.pruneSearchHistory(userId, clock.instant().minus(config.historyRetention()),
                config.maxHistoryEntries());
            if (pruned > 0) {
                log.debug("Pruned {} search history entries for {}", pruned, userId);
            }
            emit(SearchEvent.Type.HISTORY_RECORDED, userId, query, resultCount, null);
        } catch (RuntimeException e) {
            log.warn("Failed to record search history for {}: {}", userId, e.getMessage());
        }
    }

    public List<SearchHistoryEntry> getSearchHistory(String userId) {
        return getSearchHistory(userId, DEFAULT_HISTORY_LIMIT, null);
    }

    /**
     * Newest-first history, optionally narrowed to queries containing {@code queryFilter}.
     */
    public List<SearchHistoryEntry> getSearchHistory(String userId, int limit, String queryFilter) {
        List<SearchHistoryEntry> entries = new ArrayList<>();
        for (SearchHistoryRow row : store.getSearchHistory(userId, limit, queryFilter)) {
            entries.add(new SearchHistoryEntry(row.id(), row.userId(), row.query(), decodeFilter(row.filterJson()),
                row.timestamp(), row.resultCount(), Duration.ofMillis(row.searchDurationMs())));
        }
        return entries;
    }

    /**
     * Delete the user's history, or only entries older than {@code olderThan} when given.
     */
    public int clearSearchHistory(String userId, Instant olderThan) {
        int deleted = store.deleteSearchHistory(userId, olderThan);
        log.info("Cleared {} search history entries for {}", deleted, userId);
        emit(SearchEvent.Type.HISTORY_CLEARED, userId, null, deleted, null);
        return deleted;
    }

    public SearchAnalytics getSearchAnalytics(String userId) {
        return getSearchAnalytics(userId, null);
    }

    /**
     * Aggregate the user's history since {@code window.start()}, or over all time when
     * {@code window} is null. Storage failures yield {@link SearchAnalytics#EMPTY}.
     */
    public SearchAnalytics getSearchAnalytics(String userId, DateRange window) {
        Instant since = window == null ? null : window.start();
        try {
            HistoryAggregate aggregate = store.aggregateSearchHistory(userId, since);
            List<SearchAnalytics.QueryFrequency> topQueries = store.getTopQueries(userId, since, TOP_QUERY_LIMIT)
                .stream()
                .map(q -> new SearchAnalytics.QueryFrequency(q.text(), q.frequency()))
                .toList();
            return new SearchAnalytics(
                aggregate.totalSearches(),
                aggregate.averageResultCount(),
                aggregate.averageSearchDurationMs(),
                aggregate.uniqueQueries(),
                topQueries,
                store.getSearchesByHour(userId, since));
        } catch (StorageException e) {
            log.warn("Search analytics unavailable for {}: {}", userId, e.getMessage());
            return SearchAnalytics.EMPTY;
        }
    }

    private String encodeFilter(SearchFilter filter) {
        if (filter == null) return null;
        try {
            return mapper.writeValueAsString(filter);
        } catch (JsonProcessingException e) {
            log.debug("Search filter not serializable: {}", e.getMessage());
            return null;
        }
    }

    private SearchFilter decodeFilter(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readValue(json, SearchFilter.class);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable search filter: {}", e.getMessage());
            return null;
        }
    }

    private void emit(SearchEvent.Type type, String userId, String query, int resultCount, String message) {
        if (listeners.isEmpty()) return;
        SearchEvent event = new SearchEvent(type, userId, query, resultCount, message, clock.instant());
        for (SearchListener listener : listeners) {
            try {
                listener.onSearchEvent(event);
            } catch (RuntimeException e) {
                log.warn("Search listener failed on {}: {}", type, e.getMessage());
            }
        }
    }

    /**
     * Stop the debouncer and wait briefly for pending history writes.
     */
    @Override
    public void close() {
        suggestionDebouncer.close();
        suggestionCache.clear();
        listeners.clear();
        ownExecutor.shutdown();
        try {
            if (!ownExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
