package com.insightflo.core.model;

import java.util.Locale;

public enum SentimentLabel {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    /** Scores at or beyond this distance from zero are no longer neutral. */
    public static final double THRESHOLD = 0.1;

    private final String wireName;

    SentimentLabel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SentimentLabel fromScore(double score) {
        if (score >= THRESHOLD) return POSITIVE;
        if (score <= -THRESHOLD) return NEGATIVE;
        return NEUTRAL;
    }

    /**
     * Lenient parse of a stored or remote label. Unknown values read as neutral.
     */
    public static SentimentLabel parse(String value) {
        if (value == null) return NEUTRAL;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "positive" -> POSITIVE;
            case "negative" -> NEGATIVE;
            default -> NEUTRAL;
        };
    }
}
