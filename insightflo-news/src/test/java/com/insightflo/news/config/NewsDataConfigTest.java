package com.insightflo.news.config;

import com.insightflo.news.search.SearchConfig;
import com.insightflo.news.sync.ConflictStrategy;
import com.insightflo.news.sync.RetryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NewsDataConfigTest {

    @TempDir
    Path tempDir;

    private Path copyFixture() throws IOException {
        Path target = tempDir.resolve("news-data.yaml");
        try (InputStream in = getClass().getResourceAsStream("/config/news-data.yaml")) {
            assertNotNull(in, "fixture missing");
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    @DisplayName("Should read every section and ignore unknown keys")
    void loadsFixture() throws IOException {
        // When
        NewsDataConfig config = NewsDataConfig.load(copyFixture());

        // Then
        assertEquals("https://api.insightflo.test", config.getApi().getBaseUrl());
        assertEquals(Duration.ofSeconds(5), config.apiTimeout());
        assertEquals(Path.of("/tmp/insightflo-test/news.db"), config.databasePath());

        RetryConfig retry = config.retryConfig();
        assertEquals(5, retry.maxRetries());
        assertEquals(Duration.ofMillis(500), retry.baseDelay());
        assertEquals(3.0, retry.backoffMultiplier());
        assertFalse(retry.jitter());

        assertEquals(Duration.ofMinutes(30), config.backgroundSyncConfig().syncInterval());
        assertTrue(config.backgroundSyncConfig().syncOnlyOnWifi());
        assertEquals(1, config.backgroundSyncConfig().maxBackgroundRetries());
        assertEquals(ConflictStrategy.MERGE, config.conflictStrategy());

        SearchConfig search = config.searchConfig();
        assertEquals(Duration.ofDays(30), search.historyRetention());
        assertEquals(200, search.maxHistoryEntries());
        assertEquals(0.05, search.relevanceThreshold());
        // Absent keys keep their defaults
        assertEquals(SearchConfig.DEFAULT.suggestionTtl(), search.suggestionTtl());
    }

    @Test
    @DisplayName("A missing file should be created with defaults")
    void createsDefaults() {
        Path path = tempDir.resolve("nested").resolve("news-data.yaml");

        NewsDataConfig config = NewsDataConfig.load(path);

        assertTrue(Files.exists(path));
        assertEquals(RetryConfig.DEFAULT, config.retryConfig());
        assertEquals(SearchConfig.DEFAULT, config.searchConfig());
        assertEquals(ConflictStrategy.SERVER_WINS, config.conflictStrategy());
        assertEquals(RetryConfig.DEFAULT, NewsDataConfig.load(path).retryConfig());
    }

    @Test
    @DisplayName("A malformed file should fall back to defaults and stay untouched")
    void malformedFile() throws IOException {
        Path path = tempDir.resolve("news-data.yaml");
        Files.writeString(path, "sync: [not, a, section");

        NewsDataConfig config = NewsDataConfig.load(path);

        assertEquals(RetryConfig.DEFAULT, config.retryConfig());
        assertEquals("sync: [not, a, section", Files.readString(path));
    }
}
