package com.insightflo.news.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.insightflo.core.error.ConnectivityException;
import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.error.RemoteException;
import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.BookmarkMutation;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SyncMetadata;
import com.insightflo.core.model.SyncStatus;
import com.insightflo.news.net.ConnectivityListener;
import com.insightflo.news.net.ConnectivityMonitor;
import com.insightflo.news.net.NetworkType;
import com.insightflo.news.remote.MutationUploader;
import com.insightflo.news.remote.NewsGateway;
import com.insightflo.news.remote.RemoteCall;
import com.insightflo.news.store.LocalStore;
import com.insightflo.news.store.LocalStore.SyncStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reconciles the local news table with the backend.
 * <p>
 * One sync runs at a time: a call made while the state is {@link SyncStatus#SYNCING} is
 * rejected immediately and leaves the running sync alone. Completed and failed runs fall
 * back to {@link SyncStatus#IDLE} after a short delay. No public method throws; every
 * outcome is a {@link SyncResult}, also delivered to registered {@link SyncListener}s.
 * <p>
 * Scheduled work (periodic background sync, reset-to-idle, retry after failure,
 * resume after reconnect) runs on one daemon thread and is cancelled by {@link #close()}.
 */
public class SyncManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncManager.class);

    public static final String NEWS_TABLE = "news_articles";
    public static final String SYNC_DIRECTION = "bidirectional";
    public static final Duration DEFAULT_METADATA_RETENTION = Duration.ofDays(30);

    static final String PREPARING = "Preparing synchronization...";
    static final String DOWNLOADING = "Downloading from server...";
    static final String UPLOADING = "Uploading to server...";
    static final String UPDATING_METADATA = "Updating sync metadata...";
    static final String COMPLETED = "Sync completed successfully";

    private final LocalStore store;
    private final NewsGateway gateway;
    private final ConnectivityMonitor connectivity;
    private final ConflictResolver resolver;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ScheduledExecutorService scheduler;
    private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.IDLE);
    private final ConnectivityListener connectivityListener = this::onConnectivityChanged;

    private MutationUploader uploader = MutationUploader.NONE;
    private RetryConfig retryConfig = RetryConfig.DEFAULT;
    private BackgroundSyncConfig backgroundConfig = BackgroundSyncConfig.DEFAULT;
    private ConflictStrategy conflictStrategy = ConflictStrategy.SERVER_WINS;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = Sleeper.SYSTEM;
    private Duration completedResetDelay = Duration.ofSeconds(2);
    private Duration failedResetDelay = Duration.ofSeconds(5);
    private Duration reconnectDelay = Duration.ofSeconds(2);
    private int downloadLimit = 100;

    private volatile SyncResult lastResult;
    private volatile SyncRequest lastRequest;
    private volatile String backgroundUserId = SyncRequest.DEFAULT_USER;
    private volatile boolean closed;

    private ScheduledFuture<?> periodicTask;
    private ScheduledFuture<?> resetTask;

    public SyncManager(LocalStore store, NewsGateway gateway, ConnectivityMonitor connectivity) {
        this.store = store;
        this.gateway = gateway;
        this.connectivity = connectivity;
        this.resolver = new ConflictResolver(store);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "news-sync");
            t.setDaemon(true);
            return t;
        });
        connectivity.addListener(connectivityListener);
    }

    // ==================== Configuration ====================

    public SyncManager withUploader(MutationUploader uploader) {
        this.uploader = uploader;
        return this;
    }

    public SyncManager withRetryConfig(RetryConfig retryConfig) {
        this.retryConfig = retryConfig;
        return this;
    }

    public SyncManager withBackgroundConfig(BackgroundSyncConfig backgroundConfig) {
        this.backgroundConfig = backgroundConfig;
        return this;
    }

    public SyncManager withConflictStrategy(ConflictStrategy conflictStrategy) {
        this.conflictStrategy = conflictStrategy;
        return this;
    }

    public SyncManager withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public SyncManager withSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Delays before COMPLETED and FAILED fall back to IDLE (default: 2s and 5s).
     */
    public SyncManager withResetDelays(Duration afterCompleted, Duration afterFailed) {
        this.completedResetDelay = afterCompleted;
        this.failedResetDelay = afterFailed;
        return this;
    }

    /**
     * Delay between the network coming back and the resumed sync (default: 2s).
     */
    public SyncManager withReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = reconnectDelay;
        return this;
    }

    /**
     * Records requested from the backend per sync (default: 100).
     */
    public SyncManager withDownloadLimit(int downloadLimit) {
        this.downloadLimit = downloadLimit;
        return this;
    }

    // ==================== Lifecycle ====================

    /**
     * Start periodic background sync for a user. No-op when auto sync is disabled.
     */
    public synchronized void start(String userId) {
        backgroundUserId = userId == null ? SyncRequest.DEFAULT_USER : userId;
        if (closed || periodicTask != null || !backgroundConfig.enableAutoSync()) return;

        long intervalMs = backgroundConfig.syncInterval().toMillis();
        log.info("Starting background sync for {} (interval: {})", backgroundUserId, backgroundConfig.syncInterval());
        periodicTask = scheduler.scheduleAtFixedRate(this::runPeriodicSync, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
            log.info("Stopped background sync");
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            if (periodicTask != null) periodicTask.cancel(false);
            if (resetTask != null) resetTask.cancel(false);
            periodicTask = null;
            resetTask = null;
        }
        connectivity.removeListener(connectivityListener);
        listeners.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sync scheduler did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Sync manager closed");
    }

    // ==================== Listeners ====================

    public void addListener(SyncListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SyncListener listener) {
        listeners.remove(listener);
    }

    public SyncState getCurrentState() {
        return state.get();
    }

    public Optional<SyncResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    // ==================== Sync ====================

    public SyncResult syncWithRemote(String userId) {
        return syncWithRemote(SyncRequest.foreground(userId));
    }

    public SyncResult forceFullSync(String userId) {
        return syncWithRemote(SyncRequest.fullSync(userId));
    }

    /**
     * Run {@link #syncWithRemote(SyncRequest)} on the sync thread.
     */
    public CompletableFuture<SyncResult> syncAsync(SyncRequest request) {
        if (closed) {
            return CompletableFuture.completedFuture(disposedResult());
        }
        try {
            return CompletableFuture.supplyAsync(() -> syncWithRemote(request), scheduler);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(disposedResult());
        }
    }

    public SyncResult syncWithRemote(SyncRequest request) {
        if (closed) {
            return disposedResult();
        }

        SyncState current = state.get();
        if (current.isSyncing() || !state.compareAndSet(current, SyncState.syncing(0.0, PREPARING))) {
            log.debug("Sync for {} rejected, another sync is running", request.userId());
            return SyncResult.rejected(SyncStatus.SYNCING, clock.instant());
        }
        cancelReset();
        publish(state.get());
        lastRequest = request;

        SyncRun run = new SyncRun(request, clock.instant());
        try {
            return runSync(run);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return fail(run, e);
        }
    }

    private SyncResult runSync(SyncRun run) throws Exception {
        SyncRequest request = run.request;
        String userId = request.userId();

        if (!connectivity.isConnected()) {
            throw new ConnectivityException("No network connection available");
        }
        if (request.background() && backgroundConfig.syncOnlyOnWifi() && connectivity.current() != NetworkType.WIFI) {
            log.debug("Skipping background sync, not on Wi-Fi ({})", connectivity.current());
            SyncResult skipped = SyncResult.skipped("Background sync requires Wi-Fi", clock.instant());
            transition(SyncState.IDLE);
            emit(skipped);
            return skipped;
        }

        run.previous = store.getSyncMetadata(NEWS_TABLE, SYNC_DIRECTION);
        Instant since = request.forceFullSync() ? null : run.previous
            .filter(m -> m.syncStatus() == SyncStatus.COMPLETED)
            .map(SyncMetadata::lastSyncTime)
            .orElse(null);
        run.incremental = since != null;

        // Download
        transition(SyncState.syncing(0.1, DOWNLOADING));
        int maxRetries = request.background()
            ? Math.min(retryConfig.maxRetries(), backgroundConfig.maxBackgroundRetries())
            : retryConfig.maxRetries();
        List<NewsRecord> remote = withRetry(
            () -> gateway.fetchPersonalizedNews(userId, 1, downloadLimit), maxRetries, "download");

        List<NewsRecord> resolved = new ArrayList<>();
        int processed = 0;
        for (NewsRecord record : remote) {
            NewsRecord owned = userId.equals(record.userId()) ? record : record.withUserId(userId);
            processed++;
            // Inside the incremental window only new articles are reconciled
            if (since != null && owned.publishedAt().isBefore(since) && store.hasRecord(owned.id(), userId)) {
                run.unchanged++;
            } else {
                Optional<NewsRecord> winner = resolver.resolve(owned, conflictStrategy);
                if (winner.isPresent()) {
                    resolved.add(winner.get());
                } else {
                    run.keptLocal++;
                }
            }
            if (processed % 20 == 0 || processed == remote.size()) {
                double progress = 0.1 + 0.5 * processed / remote.size();
                transition(SyncState.syncing(progress, DOWNLOADING).withItems(remote.size(), processed));
            }
        }
        store.upsertAll(resolved);
        run.downloaded = resolved.size();
        log.debug("Downloaded {} records for {} ({} kept local, {} unchanged)",
            run.downloaded, userId, run.keptLocal, run.unchanged);

        // Upload
        transition(SyncState.syncing(0.6, UPLOADING));
        run.uploaded = upload(userId, maxRetries);

        // Metadata
        transition(SyncState.syncing(0.9, UPDATING_METADATA));
        Instant finished = clock.instant();
        store.upsertSyncMetadata(new SyncMetadata(
            NEWS_TABLE, SYNC_DIRECTION, finished, SyncStatus.COMPLETED, run.downloaded, null,
            metadataJson(run), run.createdAt(finished), finished));

        SyncResult result = SyncResult.completed(run.downloaded, run.uploaded,
            Duration.between(run.started, finished), finished);
        SyncState done = new SyncState(SyncStatus.COMPLETED, 1.0, COMPLETED, remote.size(), remote.size(), null);
        transition(done);
        lastResult = result;
        emit(result);
        scheduleReset(done, completedResetDelay);

        log.info("Sync completed for {}: {} downloaded, {} uploaded in {}ms",
            userId, run.downloaded, run.uploaded, result.duration().toMillis());
        return result;
    }

    private int upload(String userId, int maxRetries) throws RemoteException, InterruptedException {
        List<BookmarkMutation> pending = store.getBookmarkMutations(userId, null);
        if (pending.isEmpty()) {
            return 0;
        }
        int accepted = withRetry(() -> uploader.upload(userId, pending), maxRetries, "upload");
        if (accepted >= pending.size()) {
            store.clearBookmarkMutations(userId, pending.get(pending.size() - 1).mutatedAt());
        } else {
            log.debug("{} of {} bookmark changes uploaded for {}, rest stay queued",
                accepted, pending.size(), userId);
        }
        return accepted;
    }

    private SyncResult fail(SyncRun run, Exception e) {
        ErrorKind kind = classify(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        Instant now = clock.instant();

        try {
            Instant lastSync = run.previous.map(SyncMetadata::lastSyncTime).orElse(now);
            store.upsertSyncMetadata(new SyncMetadata(
                NEWS_TABLE, SYNC_DIRECTION, lastSync, SyncStatus.FAILED, run.downloaded, message,
                metadataJson(run), run.createdAt(now), now));
        } catch (StorageException se) {
            log.error("Failed to record sync failure: {}", se.getMessage());
        }

        SyncResult result = SyncResult.failed(kind, message, run.downloaded, Duration.between(run.started, now), now);
        SyncState failed = SyncState.failed(message);
        transition(failed);
        lastResult = result;
        emit(result);
        log.error("Sync failed for {} ({}): {}", run.request.userId(), kind, message);

        if (!run.request.background() && !run.request.retry()) {
            scheduleRetry(run.request.asRetry(), retryConfig.calculateDelay(0));
        }
        scheduleReset(failed, failedResetDelay);
        return result;
    }

    private <T> T withRetry(RemoteCall<T> call, int maxRetries, String operation)
            throws RemoteException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                return call.call();
            } catch (RemoteException e) {
                if (attempt >= maxRetries || !e.isRetryable()) {
                    throw e;
                }
                Duration delay = retryConfig.calculateDelay(attempt);
                attempt++;
                log.warn("{} failed (attempt {}/{}): {}, retrying in {}ms",
                    operation, attempt, maxRetries, e.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    private static ErrorKind classify(Exception e) {
        if (e instanceof ConnectivityException) return ErrorKind.CONNECTIVITY;
        if (e instanceof RemoteException) return ErrorKind.REMOTE;
        if (e instanceof StorageException) return ErrorKind.STORAGE;
        return ErrorKind.UNKNOWN;
    }

    private String metadataJson(SyncRun run) {
        ObjectNode node = mapper.createObjectNode();
        node.put("downloadedRecords", run.downloaded);
        node.put("uploadedRecords", run.uploaded);
        node.put("incrementalSync", run.incremental);
        node.put("keptLocal", run.keptLocal);
        node.put("unchanged", run.unchanged);
        node.put("conflictStrategy", conflictStrategy.name());
        return node.toString();
    }

    private SyncResult disposedResult() {
        return SyncResult.failed(ErrorKind.DISPOSED, "Sync manager is closed", 0, Duration.ZERO, clock.instant());
    }

    // ==================== Scheduling ====================

    private void runPeriodicSync() {
        try {
            if (state.get().status() == SyncStatus.IDLE) {
                syncWithRemote(SyncRequest.background(backgroundUserId));
            }
        } catch (RuntimeException e) {
            log.error("Background sync tick failed: {}", e.getMessage(), e);
        }
    }

    private void onConnectivityChanged(NetworkType previous, NetworkType current) {
        if (closed || previous != NetworkType.NONE || !current.isConnected()) return;

        SyncResult last = lastResult;
        boolean lastFailed = state.get().status() == SyncStatus.FAILED || (last != null && !last.success());
        if (!lastFailed) return;

        SyncRequest request = lastRequest != null
            ? lastRequest.asRetry()
            : SyncRequest.foreground(backgroundUserId).asRetry();
        log.info("Network back ({}), resuming failed sync in {}", current, reconnectDelay);
        scheduleRetry(request, reconnectDelay);
    }

    private void scheduleRetry(SyncRequest request, Duration delay) {
        schedule(() -> {
            SyncResult last = lastResult;
            if (!state.get().isSyncing() && last != null && !last.success()) {
                syncWithRemote(request);
            }
        }, delay);
    }

    private synchronized void scheduleReset(SyncState expected, Duration delay) {
        if (resetTask != null) resetTask.cancel(false);
        resetTask = schedule(() -> {
            if (state.compareAndSet(expected, SyncState.IDLE)) {
                publish(SyncState.IDLE);
            }
        }, delay);
    }

    private synchronized void cancelReset() {
        if (resetTask != null) {
            resetTask.cancel(false);
            resetTask = null;
        }
    }

    private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        if (closed) return null;
        try {
            return scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler closed, dropping task");
            return null;
        }
    }

    // ==================== Events ====================

    private void transition(SyncState next) {
        state.set(next);
        publish(next);
    }

    private void publish(SyncState snapshot) {
        if (closed) return;
        for (SyncListener listener : listeners) {
            try {
                listener.onStateChanged(snapshot);
            } catch (RuntimeException e) {
                log.warn("Sync listener failed on state change: {}", e.getMessage());
            }
        }
    }

    private void emit(SyncResult result) {
        if (closed) return;
        for (SyncListener listener : listeners) {
            try {
                listener.onSyncResult(result);
            } catch (RuntimeException e) {
                log.warn("Sync listener failed on result: {}", e.getMessage());
            }
        }
    }

    // ==================== Maintenance ====================

    public SyncStatistics getSyncStatistics() {
        return store.getSyncStatistics();
    }

    /**
     * Remove sync metadata rows not updated within {@code retention}. Rows of a running sync are kept.
     */
    public int cleanupSyncMetadata(Duration retention) {
        return store.cleanupSyncMetadata(retention);
    }

    /**
     * Mutable bookkeeping for one run.
     */
    private static final class SyncRun {
        final SyncRequest request;
        final Instant started;
        Optional<SyncMetadata> previous = Optional.empty();
        boolean incremental;
        int downloaded;
        int uploaded;
        int keptLocal;
        int unchanged;

        SyncRun(SyncRequest request, Instant started) {
            this.request = request;
            this.started = started;
        }

        Instant createdAt(Instant fallback) {
            return previous.map(SyncMetadata::createdAt).orElse(fallback);
        }
    }
}
