package com.insightflo.core.error;

/**
 * Failure categories surfaced by the data layer.
 */
public enum ErrorKind {
    CONNECTIVITY,          // No network and no usable cache
    REMOTE,                // Non-2xx or transport failure from the backend
    CONFLICT_RESOLUTION,   // Local/remote reconciliation failed
    SEARCH_DEGRADATION,    // Full-text index unavailable, fallback used
    STORAGE,               // Local read/write failure
    SYNC_IN_PROGRESS,      // Another sync already owns the state machine
    DISPOSED,              // Component already closed
    UNKNOWN;

    /**
     * Whether the caller can reasonably try again later.
     */
    public boolean isTransient() {
        return this == CONNECTIVITY || this == REMOTE || this == SYNC_IN_PROGRESS;
    }
}
