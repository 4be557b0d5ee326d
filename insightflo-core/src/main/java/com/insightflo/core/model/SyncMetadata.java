package com.insightflo.core.model;

import java.time.Instant;

/**
 * Outcome of the most recent sync for one table and direction.
 * At most one row exists per {@link #id()}; the last write wins.
 */
public record SyncMetadata(
    String tableName,
    String syncDirection,           // "download", "upload", "bidirectional"
    Instant lastSyncTime,
    SyncStatus syncStatus,
    int recordCount,
    String errorMessage,            // nullable
    String metadataJson,            // free-form details, nullable
    Instant createdAt,
    Instant updatedAt
) {
    public String id() {
        return idFor(tableName, syncDirection);
    }

    public static String idFor(String tableName, String syncDirection) {
        return tableName + "_" + syncDirection;
    }
}
