package com.insightflo.news.sync;

import java.util.Locale;

/**
 * How a downloaded record is reconciled with a local record of the same id.
 */
public enum ConflictStrategy {
    SERVER_WINS,    // Remote overwrites local
    CLIENT_WINS,    // Remote update discarded
    MERGE;          // Remote content, locally owned fields kept

    public static ConflictStrategy parse(String value) {
        if (value == null) return SERVER_WINS;
        return switch (value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "")) {
            case "clientwins" -> CLIENT_WINS;
            case "merge" -> MERGE;
            default -> SERVER_WINS;
        };
    }
}
