package com.insightflo.news.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.insightflo.news.remote.OkHttpNewsGateway;
import com.insightflo.news.search.SearchConfig;
import com.insightflo.news.sync.BackgroundSyncConfig;
import com.insightflo.news.sync.ConflictStrategy;
import com.insightflo.news.sync.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the news data layer.
 * Stored in ~/.insightflo/news-data.yaml
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NewsDataConfig {

    private static final Logger log = LoggerFactory.getLogger(NewsDataConfig.class);

    public static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".insightflo", "news-data.yaml"
    );
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private static NewsDataConfig instance;

    private Api api = new Api();
    private Storage storage = new Storage();
    private Sync sync = new Sync();
    private Search search = new Search();

    public NewsDataConfig() {
        // Default constructor for YAML
    }

    // ==================== Sections ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Api {
        private String baseUrl = OkHttpNewsGateway.DEFAULT_BASE_URL;
        private int timeoutSeconds = (int) OkHttpNewsGateway.DEFAULT_TIMEOUT.toSeconds();

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Storage {
        private String databasePath = Path.of(System.getProperty("user.home"), ".insightflo", "news.db").toString();

        public String getDatabasePath() { return databasePath; }
        public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sync {
        private int maxRetries = RetryConfig.DEFAULT.maxRetries();
        private long baseDelayMillis = RetryConfig.DEFAULT.baseDelay().toMillis();
        private long maxDelayMillis = RetryConfig.DEFAULT.maxDelay().toMillis();
        private double backoffMultiplier = RetryConfig.DEFAULT.backoffMultiplier();
        private boolean jitter = RetryConfig.DEFAULT.jitter();

        private int intervalMinutes = (int) BackgroundSyncConfig.DEFAULT.syncInterval().toMinutes();
        private boolean autoSync = BackgroundSyncConfig.DEFAULT.enableAutoSync();
        private boolean wifiOnly = BackgroundSyncConfig.DEFAULT.syncOnlyOnWifi();
        private int maxBackgroundRetries = BackgroundSyncConfig.DEFAULT.maxBackgroundRetries();

        private String conflictStrategy = "server_wins";

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBaseDelayMillis() { return baseDelayMillis; }
        public void setBaseDelayMillis(long baseDelayMillis) { this.baseDelayMillis = baseDelayMillis; }
        public long getMaxDelayMillis() { return maxDelayMillis; }
        public void setMaxDelayMillis(long maxDelayMillis) { this.maxDelayMillis = maxDelayMillis; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
        public int getIntervalMinutes() { return intervalMinutes; }
        public void setIntervalMinutes(int intervalMinutes) { this.intervalMinutes = intervalMinutes; }
        public boolean isAutoSync() { return autoSync; }
        public void setAutoSync(boolean autoSync) { this.autoSync = autoSync; }
        public boolean isWifiOnly() { return wifiOnly; }
        public void setWifiOnly(boolean wifiOnly) { this.wifiOnly = wifiOnly; }
        public int getMaxBackgroundRetries() { return maxBackgroundRetries; }
        public void setMaxBackgroundRetries(int maxBackgroundRetries) { this.maxBackgroundRetries = maxBackgroundRetries; }
        public String getConflictStrategy() { return conflictStrategy; }
        public void setConflictStrategy(String conflictStrategy) { this.conflictStrategy = conflictStrategy; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Search {
        private int historyRetentionDays = (int) SearchConfig.DEFAULT.historyRetention().toDays();
        private int maxHistoryEntries = SearchConfig.DEFAULT.maxHistoryEntries();
        private int suggestionTtlMinutes = (int) SearchConfig.DEFAULT.suggestionTtl().toMinutes();
        private int suggestionCacheSize = SearchConfig.DEFAULT.suggestionCacheSize();
        private long debounceMillis = SearchConfig.DEFAULT.suggestionDebounce().toMillis();
        private double relevanceThreshold = SearchConfig.DEFAULT.relevanceThreshold();

        public int getHistoryRetentionDays() { return historyRetentionDays; }
        public void setHistoryRetentionDays(int historyRetentionDays) { this.historyRetentionDays = historyRetentionDays; }
        public int getMaxHistoryEntries() { return maxHistoryEntries; }
        public void setMaxHistoryEntries(int maxHistoryEntries) { this.maxHistoryEntries = maxHistoryEntries; }
        public int getSuggestionTtlMinutes() { return suggestionTtlMinutes; }
        public void setSuggestionTtlMinutes(int suggestionTtlMinutes) { this.suggestionTtlMinutes = suggestionTtlMinutes; }
        public int getSuggestionCacheSize() { return suggestionCacheSize; }
        public void setSuggestionCacheSize(int suggestionCacheSize) { this.suggestionCacheSize = suggestionCacheSize; }
        public long getDebounceMillis() { return debounceMillis; }
        public void setDebounceMillis(long debounceMillis) { this.debounceMillis = debounceMillis; }
        public double getRelevanceThreshold() { return relevanceThreshold; }
        public void setRelevanceThreshold(double relevanceThreshold) { this.relevanceThreshold = relevanceThreshold; }
    }

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api != null ? api : new Api(); }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage != null ? storage : new Storage(); }
    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync != null ? sync : new Sync(); }
    public Search getSearch() { return search; }
    public void setSearch(Search search) { this.search = search != null ? search : new Search(); }

    // ==================== Derived settings ====================

    public Duration apiTimeout() {
        return Duration.ofSeconds(api.timeoutSeconds);
    }

    public Path databasePath() {
        return Path.of(storage.databasePath);
    }

    public RetryConfig retryConfig() {
        return new RetryConfig(sync.maxRetries, Duration.ofMillis(sync.baseDelayMillis),
            Duration.ofMillis(sync.maxDelayMillis), sync.backoffMultiplier, sync.jitter);
    }

    public BackgroundSyncConfig backgroundSyncConfig() {
        return new BackgroundSyncConfig(Duration.ofMinutes(sync.intervalMinutes), sync.autoSync,
            sync.wifiOnly, sync.maxBackgroundRetries);
    }

    public ConflictStrategy conflictStrategy() {
        return ConflictStrategy.parse(sync.conflictStrategy);
    }

    public SearchConfig searchConfig() {
        return new SearchConfig(Duration.ofDays(search.historyRetentionDays), search.maxHistoryEntries,
            Duration.ofMinutes(search.suggestionTtlMinutes), search.suggestionCacheSize,
            Duration.ofMillis(search.debounceMillis), search.relevanceThreshold);
    }

    // ==================== Persistence ====================

    public void save(Path path) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            YAML.writeValue(path.toFile(), this);
        } catch (IOException e) {
            log.warn("Failed to save news data config to {}: {}", path, e.getMessage());
        }
    }

    public static synchronized NewsDataConfig get() {
        if (instance == null) {
            instance = load(DEFAULT_PATH);
        }
        return instance;
    }

    /**
     * Read the config at {@code path}. A missing file is created with defaults;
     * an unreadable one is left alone and defaults are used.
     */
    public static NewsDataConfig load(Path path) {
        if (Files.exists(path)) {
            try {
                NewsDataConfig config = YAML.readValue(path.toFile(), NewsDataConfig.class);
                log.debug("Loaded news data config from {}", path);
                return config;
            } catch (IOException e) {
                log.warn("Failed to load news data config from {}: {}", path, e.getMessage());
                return new NewsDataConfig();
            }
        }
        NewsDataConfig config = new NewsDataConfig();
        config.save(path);
        return config;
    }
}
