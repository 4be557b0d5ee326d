package com.insightflo.news.sync;

/**
 * Parameters of one sync run.
 *
 * @param userId        owner scope, {@code null} means {@link #DEFAULT_USER}
 * @param background    started by the periodic timer
 * @param forceFullSync ignore the incremental window
 * @param retry         scheduled retry of a failed run; never schedules another retry
 */
public record SyncRequest(String userId, boolean background, boolean forceFullSync, boolean retry) {

    public static final String DEFAULT_USER = "default";

    public SyncRequest {
        if (userId == null || userId.isBlank()) {
            userId = DEFAULT_USER;
        }
    }

    public static SyncRequest foreground(String userId) {
        return new SyncRequest(userId, false, false, false);
    }

    public static SyncRequest background(String userId) {
        return new SyncRequest(userId, true, false, false);
    }

    public static SyncRequest fullSync(String userId) {
        return new SyncRequest(userId, false, true, false);
    }

    public SyncRequest asRetry() {
        return new SyncRequest(userId, background, forceFullSync, true);
    }
}
