package com.insightflo.news.search;

/**
 * Per-factor relevance scores for one article. All factors are in [0, 1] except
 * {@code tfidf}, which is unbounded above.
 */
public record ScoreBreakdown(
    double tfidf,
    double recency,
    double sourceAuthority,
    double engagement,
    double sentimentAlignment
) {
}
