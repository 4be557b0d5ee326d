package com.insightflo.news.search;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
