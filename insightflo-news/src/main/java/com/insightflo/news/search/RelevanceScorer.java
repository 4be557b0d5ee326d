package com.insightflo.news.search;

import com.insightflo.core.model.NewsRecord;
import com.insightflo.news.store.LocalStore.SentimentProfile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Non-textual relevance factors and their weighted combination.
 */
public class RelevanceScorer {

    public static final double TFIDF_WEIGHT = 0.40;
    public static final double RECENCY_WEIGHT = 0.25;
    public static final double SOURCE_AUTHORITY_WEIGHT = 0.20;
    public static final double ENGAGEMENT_WEIGHT = 0.10;
    public static final double SENTIMENT_ALIGNMENT_WEIGHT = 0.05;

    public static final double DEFAULT_AUTHORITY = 0.50;
    public static final double NEUTRAL_ALIGNMENT = 0.5;

    private static final double RECENCY_DAYS = 30.0;

    private static final Map<String, Double> SOURCE_AUTHORITY = Map.of(
        "reuters", 0.95,
        "bbc", 0.93,
        "ap", 0.92,
        "wall street journal", 0.90,
        "bloomberg", 0.88,
        "new york times", 0.87,
        "cnn", 0.85,
        "washington post", 0.85
    );

    private final Clock clock;

    public RelevanceScorer(Clock clock) {
        this.clock = clock;
    }

    public ScoreBreakdown breakdown(NewsRecord record, double tfidf, SentimentProfile profile) {
        return new ScoreBreakdown(
            tfidf,
            recency(record.publishedAt()),
            sourceAuthority(record.source()),
            engagement(record),
            sentimentAlignment(record, profile));
    }

    /** {@code exp(-days/30)} on whole days since publication; future dates count as today. */
    public double recency(Instant publishedAt) {
        long days = Math.max(0, Duration.between(publishedAt, clock.instant()).toDays());
        return Math.exp(-days / RECENCY_DAYS);
    }

    public static double sourceAuthority(String source) {
        if (source == null) return DEFAULT_AUTHORITY;
        return SOURCE_AUTHORITY.getOrDefault(source.toLowerCase(Locale.ROOT), DEFAULT_AUTHORITY);
    }

    public static double engagement(NewsRecord record) {
        double score = 0.0;
        if (record.bookmarked()) score += 0.4;
        score += Math.abs(record.sentimentScore()) * 0.2;
        score += Math.min(record.keywords().size() / 10.0, 0.3);
        return Math.min(score, 1.0);
    }

    public static double sentimentAlignment(NewsRecord record, SentimentProfile profile) {
        if (profile == null || profile.totalCount() == 0) {
            return NEUTRAL_ALIGNMENT;
        }
        double distance = Math.abs(record.sentimentScore() - profile.averageSentiment());
        double alignment = 1.0 - Math.min(distance / 2.0, 1.0);
        return Math.min(alignment + profile.bookmarkRate() * 0.2, 1.0);
    }

    public static double combine(ScoreBreakdown breakdown) {
        double total = breakdown.tfidf() * TFIDF_WEIGHT
            + breakdown.recency() * RECENCY_WEIGHT
            + breakdown.sourceAuthority() * SOURCE_AUTHORITY_WEIGHT
            + breakdown.engagement() * ENGAGEMENT_WEIGHT
            + breakdown.sentimentAlignment() * SENTIMENT_ALIGNMENT_WEIGHT;
        double weights = TFIDF_WEIGHT + RECENCY_WEIGHT + SOURCE_AUTHORITY_WEIGHT
            + ENGAGEMENT_WEIGHT + SENTIMENT_ALIGNMENT_WEIGHT;
        return Math.max(0.0, Math.min(total / weights, 1.0));
    }
}
