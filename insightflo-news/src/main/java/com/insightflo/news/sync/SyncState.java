package com.insightflo.news.sync;

import com.insightflo.core.model.SyncStatus;

/**
 * Snapshot of the sync state machine, published on every transition.
 */
public record SyncState(
    SyncStatus status,
    double progress,            // 0.0 - 1.0
    String currentOperation,    // nullable
    int totalItems,
    int processedItems,
    String errorMessage         // nullable
) {
    public static final SyncState IDLE = new SyncState(SyncStatus.IDLE, 0.0, null, 0, 0, null);

    public static SyncState syncing(double progress, String operation) {
        return new SyncState(SyncStatus.SYNCING, progress, operation, 0, 0, null);
    }

    public static SyncState failed(String errorMessage) {
        return new SyncState(SyncStatus.FAILED, 0.0, null, 0, 0, errorMessage);
    }

    public SyncState withItems(int total, int processed) {
        return new SyncState(status, progress, currentOperation, total, processed, errorMessage);
    }

    public boolean isSyncing() {
        return status == SyncStatus.SYNCING;
    }
}
