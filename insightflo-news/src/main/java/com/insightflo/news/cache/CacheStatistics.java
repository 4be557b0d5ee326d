package com.insightflo.news.cache;

import java.time.Instant;

/**
 * Snapshot of what the local cache holds for one user.
 *
 * @param lastSyncTime {@code null} before the first sync
 * @param freshRatio   fresh records over total records, 0 when empty
 */
public record CacheStatistics(
    int totalRecords,
    int freshRecords,
    int bookmarkedRecords,
    int cacheSlots,
    Instant lastSyncTime,
    SyncHealth syncHealth,
    double freshRatio
) {

    public enum SyncHealth {
        PARTIALLY_FAILED,
        SYNCING,
        UP_TO_DATE,
        PENDING
    }
}
