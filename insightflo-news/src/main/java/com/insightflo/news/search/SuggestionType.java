package com.insightflo.news.search;

public enum SuggestionType {
    KEYWORD,
    SOURCE,
    TITLE,
    HISTORICAL
}
