package com.insightflo.news.search;

import com.insightflo.core.model.SentimentLabel;

import java.util.Set;

/**
 * Sentiment predicate: optional label allow-list, optional score bounds and
 * per-polarity inclusion flags (polarity boundaries at +/-0.1, neutral inclusive).
 */
public record SentimentFilter(
    Set<SentimentLabel> labels,     // nullable: any label
    Double minScore,                // nullable
    Double maxScore,                // nullable
    boolean includePositive,
    boolean includeNegative,
    boolean includeNeutral
) {
    private static final double POLARITY = 0.1;

    public static SentimentFilter range(Double minScore, Double maxScore) {
        return new SentimentFilter(null, minScore, maxScore, true, true, true);
    }

    public static SentimentFilter positiveOnly() {
        return new SentimentFilter(Set.of(SentimentLabel.POSITIVE), POLARITY, null, true, false, false);
    }

    public static SentimentFilter negativeOnly() {
        return new SentimentFilter(Set.of(SentimentLabel.NEGATIVE), null, -POLARITY, false, true, false);
    }

    public static SentimentFilter neutralOnly() {
        return new SentimentFilter(Set.of(SentimentLabel.NEUTRAL), -POLARITY, POLARITY, false, false, true);
    }

    public boolean matches(double score, SentimentLabel label) {
        if (labels != null && !labels.isEmpty() && !labels.contains(label)) return false;
        if (minScore != null && score < minScore) return false;
        if (maxScore != null && score > maxScore) return false;

        if (score > POLARITY && !includePositive) return false;
        if (score < -POLARITY && !includeNegative) return false;
        if (score >= -POLARITY && score <= POLARITY && !includeNeutral) return false;
        return true;
    }
}
