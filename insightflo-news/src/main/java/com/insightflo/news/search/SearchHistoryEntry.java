package com.insightflo.news.search;

import java.time.Duration;
import java.time.Instant;

public record SearchHistoryEntry(
    String id,
    String userId,
    String query,
    SearchFilter filter,        // nullable
    Instant timestamp,
    int resultCount,
    Duration searchDuration
) {
}
