package com.insightflo.news.search;

import com.insightflo.core.model.NewsRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lowercases, replaces everything except word characters, whitespace and Hangul
 * syllables with spaces, splits on whitespace and drops one-character tokens.
 */
public final class TextTokenizer {

    private static final Pattern NON_TERM = Pattern.compile("[^\\w\\s\\uAC00-\\uD7A3]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }
        String cleaned = NON_TERM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String term : WHITESPACE.split(cleaned)) {
            if (term.length() > 1) {
                terms.add(term);
            }
        }
        return terms;
    }

    public static List<String> tokenize(NewsRecord record) {
        return tokenize(record.searchableText());
    }

    /**
     * FTS5 MATCH expression: each whitespace-separated term quoted and OR-ed.
     * Quotes are doubled, {@code *} and {@code :} removed.
     */
    public static String toFtsQuery(String query) {
        String clean = query == null ? "" : query
            .replace("\"", "\"\"")
            .replace("*", "")
            .replace(":", "")
            .trim();
        if (clean.isEmpty()) {
            return "\"\"";
        }
        StringBuilder sb = new StringBuilder();
        for (String term : WHITESPACE.split(clean)) {
            if (sb.length() > 0) sb.append(" OR ");
            sb.append('"').append(term).append('"');
        }
        return sb.toString();
    }
}
