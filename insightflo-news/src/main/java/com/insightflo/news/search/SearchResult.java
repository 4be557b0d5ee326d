package com.insightflo.news.search;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One page of search output plus diagnostics ({@code searchMethod}, {@code indexesUsed}, ...).
 */
public record SearchResult<T>(List<T> results, int totalCount, Duration searchDuration, Map<String, Object> metadata) {

    public SearchResult {
        results = List.copyOf(results);
        metadata = Map.copyOf(metadata);
    }

    public static <T> SearchResult<T> empty(Duration searchDuration, Map<String, Object> metadata) {
        return new SearchResult<>(List.of(), 0, searchDuration, metadata);
    }
}
