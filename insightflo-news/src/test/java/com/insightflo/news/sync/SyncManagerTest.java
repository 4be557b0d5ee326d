package com.insightflo.news.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.error.RemoteException;
import com.insightflo.core.model.BookmarkMutation;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SyncMetadata;
import com.insightflo.core.model.SyncStatus;
import com.insightflo.news.net.NetworkType;
import com.insightflo.news.store.SqliteConnection;
import com.insightflo.news.store.SqliteLocalStore;
import com.insightflo.news.support.Articles;
import com.insightflo.news.support.FakeConnectivity;
import com.insightflo.news.support.FakeNewsGateway;
import com.insightflo.news.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.insightflo.news.support.Articles.article;
import static org.junit.jupiter.api.Assertions.*;

class SyncManagerTest {

    // Scheduled retries land far beyond any test; in-call retries do not sleep
    private static final RetryConfig QUICK_RETRY =
        new RetryConfig(2, Duration.ofMinutes(10), Duration.ofMinutes(10), 2.0, false);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteLocalStore store;
    private FakeNewsGateway gateway;
    private FakeConnectivity connectivity;
    private SyncManager manager;
    private final List<SyncState> states = new CopyOnWriteArrayList<>();
    private final List<SyncResult> results = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Articles.NOW);
        store = new SqliteLocalStore(new SqliteConnection(tempDir.resolve("news.db")), clock);
        gateway = new FakeNewsGateway();
        connectivity = FakeConnectivity.online();
        manager = new SyncManager(store, gateway, connectivity)
            .withClock(clock)
            .withRetryConfig(QUICK_RETRY)
            .withSleeper(duration -> { })
            .withResetDelays(Duration.ofMillis(50), Duration.ofMillis(50));
        manager.addListener(new SyncListener() {
            @Override
            public void onStateChanged(SyncState state) {
                states.add(state);
            }

            @Override
            public void onSyncResult(SyncResult result) {
                results.add(result);
            }
        });
    }

    @AfterEach
    void tearDown() {
        gateway.release();
        manager.close();
        store.close();
    }

    private static void await(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("Download Tests")
    class DownloadTests {

        @Test
        @DisplayName("Should store downloaded records and record completed metadata")
        void downloadsAndRecordsMetadata() {
            // Given
            gateway.serve(List.of(Articles.of("n1", null, "One"), Articles.of("n2", null, "Two")));

            // When
            SyncResult result = manager.syncWithRemote("u1");

            // Then
            assertTrue(result.success());
            assertEquals(SyncStatus.COMPLETED, result.status());
            assertEquals(2, result.recordsSynced());
            assertTrue(store.hasRecord("n1", "u1"));
            assertTrue(store.hasRecord("n2", "u1"));

            SyncMetadata metadata = store.getSyncMetadata(SyncManager.NEWS_TABLE, SyncManager.SYNC_DIRECTION).orElseThrow();
            assertEquals(SyncStatus.COMPLETED, metadata.syncStatus());
            assertEquals(2, metadata.recordCount());
            assertEquals(Articles.NOW, metadata.lastSyncTime());
            assertEquals(result, manager.getLastResult().orElseThrow());
        }

        @Test
        @DisplayName("Server wins should overwrite the local title")
        void serverWinsOverwrites() {
            // Given
            store.upsert(Articles.of("A1", "u1", "old"));
            gateway.serve(List.of(Articles.of("A1", null, "new")));
            manager.withConflictStrategy(ConflictStrategy.SERVER_WINS);

            // When
            manager.syncWithRemote("u1");

            // Then
            assertEquals("new", store.getRecord("A1", "u1").orElseThrow().title());
        }

        @Test
        @DisplayName("Client wins should leave the local record untouched")
        void clientWinsKeepsLocal() throws Exception {
            store.upsert(Articles.of("A1", "u1", "old"));
            gateway.serve(List.of(Articles.of("A1", null, "new"), Articles.of("B1", null, "other")));
            manager.withConflictStrategy(ConflictStrategy.CLIENT_WINS);

            SyncResult result = manager.syncWithRemote("u1");

            assertEquals("old", store.getRecord("A1", "u1").orElseThrow().title());
            assertTrue(store.hasRecord("B1", "u1"));
            assertEquals(1, result.recordsSynced());
            JsonNode json = new ObjectMapper().readTree(
                store.getSyncMetadata(SyncManager.NEWS_TABLE, SyncManager.SYNC_DIRECTION).orElseThrow().metadataJson());
            assertEquals(1, json.get("keptLocal").asInt());
            assertEquals("CLIENT_WINS", json.get("conflictStrategy").asText());
        }

        @Test
        @DisplayName("Incremental sync should skip stored articles older than the last sync")
        void incrementalWindow() {
            // Given a completed sync at NOW
            gateway.serve(List.of(article("old", null, "Old title").publishedAt(Articles.NOW.minusSeconds(60)).build()));
            manager.syncWithRemote("u1");
            clock.advance(Duration.ofHours(1));

            // When the backend changes the old article and publishes a new one
            gateway.serve(List.of(
                article("old", null, "Edited title").publishedAt(Articles.NOW.minusSeconds(60)).build(),
                article("fresh", null, "Fresh").publishedAt(Articles.NOW.plusSeconds(60)).build()));
            SyncResult incremental = manager.syncWithRemote("u1");

            // Then only the new article is written
            assertEquals(1, incremental.recordsSynced());
            assertEquals("Old title", store.getRecord("old", "u1").orElseThrow().title());
            assertTrue(store.hasRecord("fresh", "u1"));
        }

        @Test
        @DisplayName("Full sync should ignore the incremental window")
        void fullSyncIgnoresWindow() {
            gateway.serve(List.of(article("old", null, "Old title").publishedAt(Articles.NOW.minusSeconds(60)).build()));
            manager.syncWithRemote("u1");
            clock.advance(Duration.ofHours(1));
            gateway.serve(List.of(article("old", null, "Edited title").publishedAt(Articles.NOW.minusSeconds(60)).build()));

            SyncResult result = manager.forceFullSync("u1");

            assertEquals(1, result.recordsSynced());
            assertEquals("Edited title", store.getRecord("old", "u1").orElseThrow().title());
        }

        @Test
        @DisplayName("Should publish increasing progress through every phase")
        void publishesProgress() {
            List<NewsRecord> many = new ArrayList<>();
            for (int i = 0; i < 45; i++) {
                many.add(Articles.of("n" + i, null, "Article " + i));
            }
            gateway.serve(many);

            manager.syncWithRemote("u1");

            List<SyncState> run = states.stream().filter(s -> s.status() != SyncStatus.IDLE).toList();
            List<String> operations = run.stream().map(SyncState::currentOperation).distinct().toList();
            assertEquals(List.of(SyncManager.PREPARING, SyncManager.DOWNLOADING, SyncManager.UPLOADING,
                SyncManager.UPDATING_METADATA, SyncManager.COMPLETED), operations);
            double previous = -1;
            for (SyncState state : run) {
                assertTrue(state.progress() >= previous, "progress went backwards: " + run);
                previous = state.progress();
            }
            assertTrue(run.stream().anyMatch(s -> s.processedItems() == 20 && s.totalItems() == 45));
            assertEquals(1, results.size());
        }
    }

    @Nested
    @DisplayName("Upload Tests")
    class UploadTests {

        @Test
        @DisplayName("Should upload pending bookmark changes and clear them once accepted")
        void uploadsMutations() {
            // Given
            store.upsert(Articles.of("n1", "u1", "One"));
            store.updateBookmark("n1", "u1", true);
            List<BookmarkMutation> uploaded = new CopyOnWriteArrayList<>();
            manager.withUploader((userId, mutations) -> {
                uploaded.addAll(mutations);
                return mutations.size();
            });

            // When
            SyncResult result = manager.syncWithRemote("u1");

            // Then
            assertEquals(1, result.recordsUploaded());
            assertEquals("n1", uploaded.get(0).articleId());
            assertTrue(store.getBookmarkMutations("u1", null).isEmpty());
        }

        @Test
        @DisplayName("Should keep mutations queued when the backend accepts none")
        void keepsUnacceptedMutations() {
            store.upsert(Articles.of("n1", "u1", "One"));
            store.updateBookmark("n1", "u1", true);

            SyncResult result = manager.syncWithRemote("u1");

            assertTrue(result.success());
            assertEquals(0, result.recordsUploaded());
            assertEquals(1, store.getBookmarkMutations("u1", null).size());
        }
    }

    @Nested
    @DisplayName("Failure Tests")
    class FailureTests {

        @Test
        @DisplayName("Should retry retryable failures then fail and fall back to idle")
        void retriesThenFails() throws Exception {
            // Given
            gateway.failAlways(new RemoteException(503, "unavailable"));

            // When
            SyncResult result = manager.syncWithRemote("u1");

            // Then
            assertFalse(result.success());
            assertEquals(ErrorKind.REMOTE, result.errorKind());
            assertEquals(3, gateway.calls());
            assertEquals(SyncStatus.FAILED, store.getSyncMetadata(SyncManager.NEWS_TABLE, SyncManager.SYNC_DIRECTION)
                .orElseThrow().syncStatus());
            await(() -> manager.getCurrentState().status() == SyncStatus.IDLE, "idle after failure");
        }

        @Test
        @DisplayName("Should not retry client errors")
        void noRetryOnClientError() {
            gateway.failAlways(new RemoteException(404, "not found"));

            SyncResult result = manager.syncWithRemote("u1");

            assertEquals(ErrorKind.REMOTE, result.errorKind());
            assertEquals(1, gateway.calls());
        }

        @Test
        @DisplayName("Should succeed when a transient failure clears within the retry budget")
        void recoversWithinBudget() {
            gateway.serve(List.of(Articles.of("n1", null, "One")))
                .failNext(new RemoteException(RemoteException.NO_RESPONSE, "timeout"));

            SyncResult result = manager.syncWithRemote("u1");

            assertTrue(result.success());
            assertEquals(2, gateway.calls());
        }

        @Test
        @DisplayName("Background syncs should use the smaller background retry budget")
        void backgroundRetryBudget() {
            gateway.failAlways(new RemoteException(500, "boom"));
            manager.withBackgroundConfig(new BackgroundSyncConfig(Duration.ofHours(1), true, false, 1));

            manager.syncWithRemote(SyncRequest.background("u1"));

            assertEquals(2, gateway.calls());
        }

        @Test
        @DisplayName("Should fail with a connectivity error offline without calling the backend")
        void offline() {
            connectivity.set(NetworkType.NONE);

            SyncResult result = manager.syncWithRemote("u1");

            assertEquals(ErrorKind.CONNECTIVITY, result.errorKind());
            assertEquals(0, gateway.calls());
            assertEquals(SyncStatus.FAILED, manager.getCurrentState().status());
        }

        @Test
        @DisplayName("Should resume a failed sync when the network comes back")
        void resumesOnReconnect() throws Exception {
            // Given a sync that failed offline
            manager.withReconnectDelay(Duration.ofMillis(10));
            gateway.serve(List.of(Articles.of("n1", null, "One")));
            connectivity.set(NetworkType.NONE);
            assertFalse(manager.syncWithRemote("u1").success());

            // When
            connectivity.set(NetworkType.WIFI);

            // Then
            await(() -> manager.getLastResult().map(SyncResult::success).orElse(false), "resumed sync");
            assertTrue(store.hasRecord("n1", "u1"));
        }

        @Test
        @DisplayName("Should keep the previous sync time on failure")
        void failureKeepsLastSyncTime() {
            manager.syncWithRemote("u1");
            clock.advance(Duration.ofHours(1));
            gateway.failAlways(new RemoteException(404, "gone"));

            manager.syncWithRemote("u1");

            SyncMetadata metadata = store.getSyncMetadata(SyncManager.NEWS_TABLE, SyncManager.SYNC_DIRECTION).orElseThrow();
            assertEquals(SyncStatus.FAILED, metadata.syncStatus());
            assertEquals(Articles.NOW, metadata.lastSyncTime());
            assertEquals("gone", metadata.errorMessage());
        }
    }

    @Nested
    @DisplayName("State Machine Tests")
    class StateMachineTests {

        @Test
        @DisplayName("Should reject a sync while another is running without touching its state")
        void mutualExclusion() throws Exception {
            // Given a sync blocked inside the download
            gateway.serve(List.of(Articles.of("n1", null, "One"))).block();
            CompletableFuture<SyncResult> running = manager.syncAsync(SyncRequest.foreground("u1"));
            assertTrue(gateway.awaitEntered(3000));
            SyncState inFlight = manager.getCurrentState();

            // When
            SyncResult rejected = manager.syncWithRemote("u1");

            // Then
            assertFalse(rejected.success());
            assertEquals(ErrorKind.SYNC_IN_PROGRESS, rejected.errorKind());
            assertEquals(inFlight, manager.getCurrentState());
            assertEquals(SyncStatus.SYNCING, inFlight.status());

            gateway.release();
            assertTrue(running.get(3, TimeUnit.SECONDS).success());
            assertFalse(results.contains(rejected));
        }

        @Test
        @DisplayName("Should return to idle shortly after completing")
        void resetsAfterCompletion() throws Exception {
            manager.syncWithRemote("u1");
            assertEquals(SyncStatus.COMPLETED, manager.getCurrentState().status());

            await(() -> manager.getCurrentState().status() == SyncStatus.IDLE, "idle after completion");
        }

        @Test
        @DisplayName("Background sync off Wi-Fi should be skipped softly")
        void wifiOnlySkip() {
            connectivity.set(NetworkType.CELLULAR);
            manager.withBackgroundConfig(new BackgroundSyncConfig(Duration.ofHours(1), true, true, 2));

            SyncResult background = manager.syncWithRemote(SyncRequest.background("u1"));

            assertTrue(background.success());
            assertTrue(background.skipped());
            assertEquals(0, gateway.calls());
            assertEquals(SyncStatus.IDLE, manager.getCurrentState().status());
            assertTrue(manager.syncWithRemote("u1").success());
        }

        @Test
        @DisplayName("Should run periodic background syncs after start")
        void periodicSync() throws Exception {
            manager.withBackgroundConfig(new BackgroundSyncConfig(Duration.ofMillis(30), true, false, 2));

            manager.start("u1");
            await(() -> manager.getLastResult().isPresent(), "periodic sync");
            manager.stop();

            assertTrue(manager.getLastResult().orElseThrow().success());
        }

        @Test
        @DisplayName("Should refuse work and detach listeners once closed")
        void closed() throws Exception {
            manager.close();

            assertEquals(ErrorKind.DISPOSED, manager.syncWithRemote("u1").errorKind());
            assertEquals(ErrorKind.DISPOSED, manager.syncAsync(SyncRequest.foreground("u1")).get().errorKind());
            assertEquals(0, connectivity.listenerCount());
        }

        @Test
        @DisplayName("Should summarize sync metadata")
        void statistics() {
            manager.syncWithRemote("u1");

            assertEquals(1, manager.getSyncStatistics().totalTables());
            assertEquals(0, manager.cleanupSyncMetadata(SyncManager.DEFAULT_METADATA_RETENTION));
        }
    }
}
