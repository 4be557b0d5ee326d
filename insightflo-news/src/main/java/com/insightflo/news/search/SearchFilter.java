package com.insightflo.news.search;

import java.util.Set;

/**
 * Multi-criteria filter. Every field is optional; absent criteria match everything.
 * Serialized as JSON alongside each search history entry.
 */
public record SearchFilter(
    String query,
    Set<String> sources,
    DateRange dateRange,
    SentimentFilter sentimentFilter,
    KeywordFilter keywordFilter,
    Double minRelevance,
    Double maxRelevance,
    Boolean bookmarked,
    SortBy sortBy,
    SortOrder sortOrder,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 20;

    public SearchFilter {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        if (sortBy == null) sortBy = SortBy.PUBLISHED_AT;
        if (sortOrder == null) sortOrder = SortOrder.DESCENDING;
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (offset < 0) offset = 0;
    }

    public static SearchFilter ofQuery(String query) {
        return builder().query(query).build();
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public int activeFilterCount() {
        int count = 0;
        if (hasQuery()) count++;
        if (!sources.isEmpty()) count++;
        if (dateRange != null) count++;
        if (sentimentFilter != null) count++;
        if (keywordFilter != null) count++;
        if (minRelevance != null || maxRelevance != null) count++;
        if (bookmarked != null) count++;
        return count;
    }

    /**
     * Weighted estimate of filter cost, reported in search metadata.
     */
    public int queryComplexity() {
        int complexity = 0;
        if (hasQuery()) complexity += 2;
        if (dateRange != null) complexity += 1;
        if (!sources.isEmpty()) complexity += 1;
        if (sentimentFilter != null) complexity += 2;
        if (keywordFilter != null) complexity += 3;
        if (bookmarked != null) complexity += 1;
        if (minRelevance != null || maxRelevance != null) complexity += 2;
        return complexity;
    }

    public Builder toBuilder() {
        return new Builder()
            .query(query)
            .sources(sources)
            .dateRange(dateRange)
            .sentimentFilter(sentimentFilter)
            .keywordFilter(keywordFilter)
            .minRelevance(minRelevance)
            .maxRelevance(maxRelevance)
            .bookmarked(bookmarked)
            .sortBy(sortBy)
            .sortOrder(sortOrder)
            .limit(limit)
            .offset(offset);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String query;
        private Set<String> sources = Set.of();
        private DateRange dateRange;
        private SentimentFilter sentimentFilter;
        private KeywordFilter keywordFilter;
        private Double minRelevance;
        private Double maxRelevance;
        private Boolean bookmarked;
        private SortBy sortBy = SortBy.PUBLISHED_AT;
        private SortOrder sortOrder = SortOrder.DESCENDING;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        public Builder query(String query) { this.query = query; return this; }
        public Builder sources(Set<String> sources) { this.sources = sources; return this; }
        public Builder dateRange(DateRange dateRange) { this.dateRange = dateRange; return this; }
        public Builder sentimentFilter(SentimentFilter filter) { this.sentimentFilter = filter; return this; }
        public Builder keywordFilter(KeywordFilter filter) { this.keywordFilter = filter; return this; }
        public Builder minRelevance(Double minRelevance) { this.minRelevance = minRelevance; return this; }
        public Builder maxRelevance(Double maxRelevance) { this.maxRelevance = maxRelevance; return this; }
        public Builder bookmarked(Boolean bookmarked) { this.bookmarked = bookmarked; return this; }
        public Builder sortBy(SortBy sortBy) { this.sortBy = sortBy; return this; }
        public Builder sortOrder(SortOrder sortOrder) { this.sortOrder = sortOrder; return this; }
        public Builder limit(int limit) { this.limit = limit; return this; }
        public Builder offset(int offset) { this.offset = offset; return this; }

        public SearchFilter build() {
            return new SearchFilter(query, sources, dateRange, sentimentFilter, keywordFilter,
                minRelevance, maxRelevance, bookmarked, sortBy, sortOrder, limit, offset);
        }
    }
}
