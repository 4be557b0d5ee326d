package com.insightflo.news.search;

import com.insightflo.news.support.Articles;
import com.insightflo.news.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuggestionCacheTest {

    private static final List<SearchSuggestion> ONE =
        List.of(new SearchSuggestion("rates", SuggestionType.KEYWORD, 0.7, 1));

    private final MutableClock clock = new MutableClock(Articles.NOW);

    @Test
    @DisplayName("Entries expire after the TTL")
    void expires() {
        SuggestionCache cache = new SuggestionCache(Duration.ofMinutes(30), 10, clock);
        cache.put("k", ONE);

        clock.advance(Duration.ofMinutes(29));
        assertEquals(ONE, cache.get("k").orElseThrow());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Overflow evicts the oldest entry")
    void evictsOldest() {
        SuggestionCache cache = new SuggestionCache(Duration.ofMinutes(30), 2, clock);
        cache.put("a", ONE);
        clock.advance(Duration.ofSeconds(1));
        cache.put("b", ONE);
        clock.advance(Duration.ofSeconds(1));
        cache.put("c", ONE);

        assertEquals(2, cache.size());
        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("c").isPresent());
    }

    @Test
    @DisplayName("Keys distinguish user, prefix and type selection")
    void keys() {
        assertEquals("u1_ec_all", SuggestionCache.key("u1", "ec", null));
        assertEquals("u1_ec_KEYWORD,SOURCE",
            SuggestionCache.key("u1", "ec", List.of(SuggestionType.KEYWORD, SuggestionType.SOURCE)));
    }
}
