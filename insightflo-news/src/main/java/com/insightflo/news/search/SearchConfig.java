package com.insightflo.news.search;

import java.time.Duration;

public record SearchConfig(
    Duration historyRetention,
    int maxHistoryEntries,
    Duration suggestionTtl,
    int suggestionCacheSize,
    Duration suggestionDebounce,
    double relevanceThreshold
) {
    public static final SearchConfig DEFAULT = new SearchConfig(
        Duration.ofDays(90), 1000, Duration.ofMinutes(30), 100, Duration.ofMillis(300), 0.1);
}
