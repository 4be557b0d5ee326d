package com.insightflo.news.cache;

import com.insightflo.news.store.LocalStore.OptimizeResult;

import java.time.Duration;

/**
 * Outcome of {@link StaleWhileRevalidateCache#performCacheCleanup}.
 *
 * @param optimization {@code null} when the store was not compacted
 * @param errorMessage {@code null} on success
 */
public record CacheCleanupResult(
    boolean success,
    Duration duration,
    int deletedRecords,
    int deletedMetadata,
    int deletedCacheSlots,
    int recordsBefore,
    int recordsAfter,
    OptimizeResult optimization,
    String errorMessage
) {
    public boolean optimizationPerformed() {
        return optimization != null;
    }

    public long pagesReclaimed() {
        return optimization == null ? 0 : Math.max(0, optimization.pagesBefore() - optimization.pagesAfter());
    }

    static CacheCleanupResult failed(Duration duration, String message) {
        return new CacheCleanupResult(false, duration, 0, 0, 0, 0, 0, null, message);
    }
}
