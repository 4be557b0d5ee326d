package com.insightflo.news.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword predicate over an article's keyword list and text.
 * <p>
 * Exclusions are checked first and reject outright. Exact keywords match a keyword or a
 * substring of the text; fuzzy keywords also match when either side contains the other.
 * With {@link MatchStrategy#OR} the first hit accepts; with {@link MatchStrategy#AND} the
 * first miss rejects. {@code minMatchCount}, when set, overrides both.
 */
public record KeywordFilter(
    List<String> exactKeywords,
    List<String> fuzzyKeywords,
    List<String> excludeKeywords,
    Integer minMatchCount,          // nullable
    MatchStrategy strategy,
    boolean caseSensitive
) {
    public enum MatchStrategy { OR, AND }

    public KeywordFilter {
        exactKeywords = exactKeywords == null ? List.of() : List.copyOf(exactKeywords);
        fuzzyKeywords = fuzzyKeywords == null ? List.of() : List.copyOf(fuzzyKeywords);
        excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
        if (strategy == null) strategy = MatchStrategy.OR;
    }

    public static KeywordFilter anyOf(String... keywords) {
        return new KeywordFilter(List.of(keywords), null, null, null, MatchStrategy.OR, false);
    }

    public static KeywordFilter allOf(String... keywords) {
        return new KeywordFilter(List.of(keywords), null, null, null, MatchStrategy.AND, false);
    }

    public boolean matches(List<String> articleKeywords, String articleText) {
        String text = normalize(articleText);
        List<String> keywords = new ArrayList<>(articleKeywords.size());
        for (String keyword : articleKeywords) {
            keywords.add(normalize(keyword));
        }

        for (String exclude : excludeKeywords) {
            String keyword = normalize(exclude);
            if (keywords.contains(keyword) || text.contains(keyword)) {
                return false;
            }
        }

        int matchCount = 0;
        for (String exact : exactKeywords) {
            String keyword = normalize(exact);
            if (keywords.contains(keyword) || text.contains(keyword)) {
                matchCount++;
                if (strategy == MatchStrategy.OR && minMatchCount == null) return true;
            } else if (strategy == MatchStrategy.AND && minMatchCount == null) {
                return false;
            }
        }

        for (String fuzzy : fuzzyKeywords) {
            String keyword = normalize(fuzzy);
            boolean hit = text.contains(keyword);
            for (String articleKeyword : keywords) {
                if (hit) break;
                hit = articleKeyword.contains(keyword) || keyword.contains(articleKeyword);
            }
            if (hit) {
                matchCount++;
                if (strategy == MatchStrategy.OR && minMatchCount == null) return true;
            } else if (strategy == MatchStrategy.AND && minMatchCount == null) {
                return false;
            }
        }

        if (minMatchCount != null) {
            return matchCount >= minMatchCount;
        }
        if (strategy == MatchStrategy.AND) {
            return matchCount == exactKeywords.size() + fuzzyKeywords.size();
        }
        return matchCount > 0;
    }

    private String normalize(String value) {
        if (value == null) return "";
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }
}
