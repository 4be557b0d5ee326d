package com.insightflo.news.sync;

/**
 * Receives sync state transitions and results.
 */
public interface SyncListener {

    default void onStateChanged(SyncState state) {}

    default void onSyncResult(SyncResult result) {}
}
