package com.insightflo.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A news article cached for one user. Identity is {@code (id, userId)}.
 */
public record NewsRecord(
    String id,                      // Server-assigned article id
    String title,
    String summary,
    String content,
    String url,
    String source,                  // "Reuters", "BBC"
    Instant publishedAt,
    List<String> keywords,
    String imageUrl,                // nullable
    double sentimentScore,          // -1.0 to +1.0
    SentimentLabel sentimentLabel,
    boolean bookmarked,
    Instant cachedAt,               // Stamped by the local store on write
    String userId
) {
    public NewsRecord {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        if (sentimentLabel == null) {
            sentimentLabel = SentimentLabel.fromScore(sentimentScore);
        }
    }

    /**
     * Title, summary, content and keywords joined for text matching.
     */
    public String searchableText() {
        return nullToEmpty(title) + " " + nullToEmpty(summary) + " "
            + nullToEmpty(content) + " " + String.join(" ", keywords);
    }

    public NewsRecord withBookmarked(boolean bookmarked) {
        return toBuilder().bookmarked(bookmarked).build();
    }

    public NewsRecord withCachedAt(Instant cachedAt) {
        return toBuilder().cachedAt(cachedAt).build();
    }

    public NewsRecord withUserId(String userId) {
        return toBuilder().userId(userId).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).title(title).summary(summary).content(content).url(url).source(source)
            .publishedAt(publishedAt).keywords(keywords).imageUrl(imageUrl)
            .sentimentScore(sentimentScore).sentimentLabel(sentimentLabel)
            .bookmarked(bookmarked).cachedAt(cachedAt).userId(userId);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title = "";
        private String summary = "";
        private String content = "";
        private String url = "";
        private String source = "";
        private Instant publishedAt = Instant.EPOCH;
        private List<String> keywords = List.of();
        private String imageUrl;
        private double sentimentScore;
        private SentimentLabel sentimentLabel;
        private boolean bookmarked;
        private Instant cachedAt;
        private String userId;

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder keywords(List<String> keywords) { this.keywords = keywords; return this; }
        public Builder imageUrl(String imageUrl) { this.imageUrl = imageUrl; return this; }
        public Builder sentimentScore(double sentimentScore) { this.sentimentScore = sentimentScore; return this; }
        public Builder sentimentLabel(SentimentLabel sentimentLabel) { this.sentimentLabel = sentimentLabel; return this; }
        public Builder bookmarked(boolean bookmarked) { this.bookmarked = bookmarked; return this; }
        public Builder cachedAt(Instant cachedAt) { this.cachedAt = cachedAt; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }

        public NewsRecord build() {
            return new NewsRecord(id, title, summary, content, url, source, publishedAt,
                keywords, imageUrl, sentimentScore, sentimentLabel, bookmarked, cachedAt, userId);
        }
    }
}
