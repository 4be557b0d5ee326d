package com.insightflo.news.search;

import java.util.List;
import java.util.Map;

/**
 * Aggregates over a user's search history within a window.
 *
 * @param searchesByHour search count keyed by hour of day (0-23, UTC)
 */
public record SearchAnalytics(
    int totalSearches,
    double averageResultCount,
    double averageSearchDurationMs,
    int uniqueQueries,
    List<QueryFrequency> mostFrequentQueries,
    Map<Integer, Integer> searchesByHour
) {
    public static final SearchAnalytics EMPTY = new SearchAnalytics(0, 0.0, 0.0, 0, List.of(), Map.of());

    public SearchAnalytics {
        mostFrequentQueries = List.copyOf(mostFrequentQueries);
        searchesByHour = Map.copyOf(searchesByHour);
    }

    public record QueryFrequency(String query, int frequency) {}
}
