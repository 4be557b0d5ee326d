package com.insightflo.core.model;

import java.util.Locale;

public enum SyncStatus {
    IDLE,
    SYNCING,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncStatus parse(String value) {
        if (value == null) return IDLE;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return IDLE;
        }
    }
}
