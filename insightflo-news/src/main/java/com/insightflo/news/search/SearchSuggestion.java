package com.insightflo.news.search;

public record SearchSuggestion(String text, SuggestionType type, double relevance, int frequency) {
}
