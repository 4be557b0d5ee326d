package com.insightflo.news.sync;

import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.news.store.SqliteConnection;
import com.insightflo.news.store.SqliteLocalStore;
import com.insightflo.news.support.Articles;
import com.insightflo.news.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolverTest {

    @TempDir
    Path tempDir;

    private SqliteLocalStore store;
    private ConflictResolver resolver;

    private final NewsRecord remote = Articles.of("A1", "u1", "new");

    @BeforeEach
    void setUp() {
        store = new SqliteLocalStore(new SqliteConnection(tempDir.resolve("news.db")), new MutableClock(Articles.NOW));
        resolver = new ConflictResolver(store);
        store.upsert(Articles.article("A1", "u1", "old").bookmarked(true).build());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Server wins should yield the remote content")
    void serverWins() {
        assertEquals(Optional.of(remote), resolver.resolve(remote, ConflictStrategy.SERVER_WINS));
    }

    @Test
    @DisplayName("Client wins should skip an existing record")
    void clientWins() {
        assertTrue(resolver.resolve(remote, ConflictStrategy.CLIENT_WINS).isEmpty());
    }

    @Test
    @DisplayName("Client wins should still accept a record that is not stored yet")
    void clientWinsNewRecord() {
        NewsRecord unseen = Articles.of("B2", "u1", "fresh");

        assertEquals(Optional.of(unseen), resolver.resolve(unseen, ConflictStrategy.CLIENT_WINS));
    }

    @Test
    @DisplayName("Merge should take remote content and keep the local bookmark")
    void merge() {
        NewsRecord merged = resolver.resolve(remote, ConflictStrategy.MERGE).orElseThrow();

        assertEquals("new", merged.title());
        assertTrue(merged.bookmarked());
    }

    @Test
    @DisplayName("Should fall back to the remote record when the store fails")
    void storeFailureFallsBackToRemote() {
        SqliteLocalStore broken = new SqliteLocalStore(new SqliteConnection(tempDir.resolve("broken.db")),
                new MutableClock(Articles.NOW)) {
            @Override
            public Optional<NewsRecord> getRecord(String id, String userId) {
                throw new StorageException("disk I/O error");
            }
        };

        try (broken) {
            assertEquals(Optional.of(remote), new ConflictResolver(broken).resolve(remote, ConflictStrategy.CLIENT_WINS));
        }
    }

    @Test
    @DisplayName("Should parse strategy names leniently")
    void parse() {
        assertEquals(ConflictStrategy.CLIENT_WINS, ConflictStrategy.parse("clientWins"));
        assertEquals(ConflictStrategy.MERGE, ConflictStrategy.parse(" MERGE "));
        assertEquals(ConflictStrategy.SERVER_WINS, ConflictStrategy.parse("server-wins"));
        assertEquals(ConflictStrategy.SERVER_WINS, ConflictStrategy.parse(null));
    }
}
