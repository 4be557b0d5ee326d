package com.insightflo.news.cache;

/**
 * Fingerprint keys for cache slots.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String personalizedNews(String userId, int page, int limit) {
        return "news_personalized_" + userId + "_p" + page + "_l" + limit;
    }

    public static String search(String query, int page, int limit) {
        return "search_" + query + "_p" + page + "_l" + limit;
    }
}
