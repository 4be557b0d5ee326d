package com.insightflo.news.search;

public enum SortBy {
    PUBLISHED_AT,
    SENTIMENT_SCORE,
    TITLE,
    SOURCE
}
