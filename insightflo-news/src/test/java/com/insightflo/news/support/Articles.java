package com.insightflo.news.support;

import com.insightflo.core.model.NewsRecord;

import java.time.Instant;
import java.util.List;

public final class Articles {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private Articles() {
    }

    public static NewsRecord.Builder article(String id, String userId, String title) {
        return NewsRecord.builder()
            .id(id)
            .userId(userId)
            .title(title)
            .summary("Summary of " + title)
            .content("")
            .url("https://news.example/" + id)
            .source("Reuters")
            .publishedAt(NOW.minusSeconds(3600))
            .keywords(List.of());
    }

    public static NewsRecord of(String id, String userId, String title) {
        return article(id, userId, title).build();
    }
}
