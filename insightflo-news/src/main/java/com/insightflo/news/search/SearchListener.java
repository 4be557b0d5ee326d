package com.insightflo.news.search;

/**
 * Observer for search engine activity.
 */
@FunctionalInterface
public interface SearchListener {
    void onSearchEvent(SearchEvent event);
}
