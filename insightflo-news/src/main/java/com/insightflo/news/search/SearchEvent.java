package com.insightflo.news.search;

import java.time.Instant;

public record SearchEvent(Type type, String userId, String query, int resultCount, String message, Instant timestamp) {

    public enum Type {
        SEARCH_COMPLETED,
        /** Full-text index unusable, answered from the substring fallback. */
        SEARCH_DEGRADED,
        SEARCH_FAILED,
        HISTORY_RECORDED,
        HISTORY_CLEARED
    }
}
