package com.insightflo.news.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.error.RemoteException;
import com.insightflo.core.error.Result;
import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.SyncStatus;
import com.insightflo.news.net.ConnectivityMonitor;
import com.insightflo.news.remote.RemoteCall;
import com.insightflo.news.store.LocalStore;
import com.insightflo.news.store.LocalStore.CacheEntry;
import com.insightflo.news.store.LocalStore.OptimizeResult;
import com.insightflo.news.store.LocalStore.StoreStats;
import com.insightflo.news.store.LocalStore.SyncStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

/**
 * Cache slots persisted in the local store, read with a stale-while-revalidate policy.
 * <p>
 * Offline, any cached value is served regardless of age. Online, the remote source is
 * always asked first and the slot overwritten on success; a remote failure falls back
 * to whatever is cached. Staleness alone never blocks a read.
 */
public class StaleWhileRevalidateCache {

    private static final Logger log = LoggerFactory.getLogger(StaleWhileRevalidateCache.class);

    public static final String OFFLINE_NO_CACHE = "No internet connection and no cached data";

    static final int KEEP_RECORDS = 1000;
    static final int FORCED_KEEP_RECORDS = 500;
    static final int RECORD_RETENTION_DAYS = 7;
    static final int FORCED_RECORD_RETENTION_DAYS = 3;
    static final Duration METADATA_RETENTION = Duration.ofDays(30);
    static final Duration FORCED_METADATA_RETENTION = Duration.ofDays(7);
    // Expired slots stay servable offline for this long
    static final Duration EXPIRED_SLOT_GRACE = Duration.ofDays(7);
    static final int OPTIMIZE_DAY_INTERVAL = 7;

    private final LocalStore store;
    private final ConnectivityMonitor connectivity;
    private final ObjectMapper mapper;
    private final Clock clock;

    public StaleWhileRevalidateCache(LocalStore store, ConnectivityMonitor connectivity,
                                     ObjectMapper mapper, Clock clock) {
        this.store = store;
        this.connectivity = connectivity;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Read a slot and refresh it from {@code remote} when the network allows.
     */
    public <T> Result<CacheResult<T>> get(String key, Duration ttl, TypeReference<T> type, RemoteCall<T> remote) {
        Optional<CacheResult<T>> cached = peek(key, type);

        if (!connectivity.isConnected()) {
            if (cached.isPresent()) {
                log.debug("Offline, serving cached {} (stale: {})", key, cached.get().isStale());
                return Result.ok(cached.get());
            }
            return Result.err(ErrorKind.CONNECTIVITY, OFFLINE_NO_CACHE);
        }

        T fresh;
        try {
            fresh = remote.call();
        } catch (RemoteException e) {
            if (cached.isPresent()) {
                log.warn("Remote fetch for {} failed ({}), serving cached data", key, e.getMessage());
                return Result.ok(cached.get());
            }
            return Result.err(ErrorKind.REMOTE, e.getMessage(), e);
        }

        Instant now = clock.instant();
        try {
            put(key, fresh, ttl);
        } catch (StorageException e) {
            log.error("Failed to cache {}: {}", key, e.getMessage());
        }
        return Result.ok(new CacheResult<>(fresh, false, now, now.plus(ttl), true));
    }

    /**
     * Read a slot without contacting the remote source.
     */
    public <T> Optional<CacheResult<T>> peek(String key, TypeReference<T> type) {
        Optional<CacheEntry> entry = store.getCacheEntry(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        CacheEntry e = entry.get();
        try {
            T data = mapper.readValue(e.payload(), type);
            return Optional.of(new CacheResult<>(data, e.isStale(clock.instant()), e.cachedAt(), e.expiresAt(), false));
        } catch (JsonProcessingException ex) {
            log.warn("Dropping unreadable cache slot {}: {}", key, ex.getMessage());
            store.invalidateCacheEntry(key);
            return Optional.empty();
        }
    }

    public <T> void put(String key, T data, Duration ttl) {
        Instant now = clock.instant();
        String payload;
        try {
            payload = mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize cache slot " + key, e);
        }
        store.putCacheEntry(new CacheEntry(key, payload, now, now.plus(ttl)));
    }

    public void invalidate(String key) {
        store.invalidateCacheEntry(key);
    }

    public void clear() {
        store.clearCache();
    }

    /**
     * Trim old records, finished sync metadata and long-expired slots for a user.
     * <p>
     * A forced cleanup keeps fewer records, drops every expired slot and always compacts
     * the store; otherwise compaction runs only on every seventh day of the month.
     * Records inside the newest {@code keepCount} are never removed.
     */
    public CacheCleanupResult performCacheCleanup(String userId, boolean force) {
        Instant start = clock.instant();
        try {
            StoreStats before = store.getStats(userId);

            int deletedRecords = store.cleanupOldRecords(userId,
                force ? FORCED_KEEP_RECORDS : KEEP_RECORDS,
                force ? FORCED_RECORD_RETENTION_DAYS : RECORD_RETENTION_DAYS);
            int deletedMetadata = store.cleanupSyncMetadata(force ? FORCED_METADATA_RETENTION : METADATA_RETENTION);
            int deletedSlots = store.deleteExpiredCacheEntries(force ? start : start.minus(EXPIRED_SLOT_GRACE));

            OptimizeResult optimization = null;
            if (force || start.atZone(ZoneOffset.UTC).getDayOfMonth() % OPTIMIZE_DAY_INTERVAL == 0) {
                optimization = store.optimize();
            }

            StoreStats after = store.getStats(userId);
            Duration duration = Duration.between(start, clock.instant());
            log.info("Cache cleanup for {} (forced: {}): {} records, {} metadata rows, {} slots removed",
                userId, force, deletedRecords, deletedMetadata, deletedSlots);
            return new CacheCleanupResult(true, duration, deletedRecords, deletedMetadata, deletedSlots,
                before.total(), after.total(), optimization, null);
        } catch (StorageException e) {
            log.error("Cache cleanup for {} failed: {}", userId, e.getMessage());
            return CacheCleanupResult.failed(Duration.between(start, clock.instant()), e.getMessage());
        }
    }

    public CacheStatistics getCacheStatistics(String userId) {
        StoreStats stats = store.getStats(userId);
        SyncStatistics sync = store.getSyncStatistics();
        double freshRatio = stats.total() == 0 ? 0.0 : (double) stats.fresh() / stats.total();
        return new CacheStatistics(stats.total(), stats.fresh(), stats.bookmarked(), store.countCacheEntries(),
            sync.lastSyncTime(), syncHealth(sync.byStatus()), freshRatio);
    }

    private static CacheStatistics.SyncHealth syncHealth(Map<SyncStatus, Integer> byStatus) {
        if (byStatus.getOrDefault(SyncStatus.FAILED, 0) > 0) {
            return CacheStatistics.SyncHealth.PARTIALLY_FAILED;
        }
        if (byStatus.getOrDefault(SyncStatus.SYNCING, 0) > 0) {
            return CacheStatistics.SyncHealth.SYNCING;
        }
        if (byStatus.getOrDefault(SyncStatus.COMPLETED, 0) > 0) {
            return CacheStatistics.SyncHealth.UP_TO_DATE;
        }
        return CacheStatistics.SyncHealth.PENDING;
    }
}
