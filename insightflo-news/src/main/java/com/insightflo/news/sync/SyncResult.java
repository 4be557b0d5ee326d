package com.insightflo.news.sync;

import com.insightflo.core.error.ErrorKind;
import com.insightflo.core.model.SyncStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one {@link SyncManager#syncWithRemote} call.
 *
 * @param errorKind {@code null} on success
 * @param skipped   soft no-op, e.g. background sync off Wi-Fi
 */
public record SyncResult(
    boolean success,
    SyncStatus status,
    int recordsSynced,
    int recordsUploaded,
    Duration duration,
    String errorMessage,
    ErrorKind errorKind,
    boolean skipped,
    Instant timestamp
) {
    static SyncResult completed(int downloaded, int uploaded, Duration duration, Instant timestamp) {
        return new SyncResult(true, SyncStatus.COMPLETED, downloaded, uploaded, duration, null, null, false, timestamp);
    }

    static SyncResult failed(ErrorKind kind, String message, int downloaded, Duration duration, Instant timestamp) {
        return new SyncResult(false, SyncStatus.FAILED, downloaded, 0, duration, message, kind, false, timestamp);
    }

    static SyncResult rejected(SyncStatus current, Instant timestamp) {
        return new SyncResult(false, current, 0, 0, Duration.ZERO,
            "Sync already in progress", ErrorKind.SYNC_IN_PROGRESS, false, timestamp);
    }

    static SyncResult skipped(String reason, Instant timestamp) {
        return new SyncResult(true, SyncStatus.IDLE, 0, 0, Duration.ZERO, reason, null, true, timestamp);
    }
}
