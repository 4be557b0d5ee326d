package com.insightflo.news.search;

import com.insightflo.core.model.SentimentLabel;
import com.insightflo.news.support.Articles;
import com.insightflo.news.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SearchFiltersTest {

    @Nested
    @DisplayName("Keyword Filter Tests")
    class KeywordFilterTests {

        @Test
        @DisplayName("OR accepts on any keyword, AND needs all")
        void strategies() {
            List<String> keywords = List.of("Inflation", "rates");

            assertTrue(KeywordFilter.anyOf("inflation", "oil").matches(keywords, "Central bank meets"));
            assertFalse(KeywordFilter.allOf("inflation", "oil").matches(keywords, "Central bank meets"));
            assertTrue(KeywordFilter.allOf("inflation", "bank").matches(keywords, "Central bank meets"));
        }

        @Test
        @DisplayName("Exclusions reject before anything else")
        void exclusions() {
            KeywordFilter filter = new KeywordFilter(List.of("rates"), null, List.of("crypto"), null, null, false);

            assertFalse(filter.matches(List.of("rates"), "Crypto lenders raise rates"));
            assertTrue(filter.matches(List.of("rates"), "Banks raise rates"));
        }

        @Test
        @DisplayName("Fuzzy keywords match partial keyword overlap")
        void fuzzy() {
            KeywordFilter filter = new KeywordFilter(null, List.of("econom"), null, null, null, false);

            assertTrue(filter.matches(List.of("economics"), ""));
            assertFalse(filter.matches(List.of("sports"), "final score"));
        }

        @Test
        @DisplayName("Minimum match count overrides the strategy")
        void minMatchCount() {
            KeywordFilter filter = new KeywordFilter(List.of("a1", "b2", "c3"), null, null, 2,
                KeywordFilter.MatchStrategy.OR, false);

            assertTrue(filter.matches(List.of("a1", "b2"), ""));
            assertFalse(filter.matches(List.of("a1"), ""));
        }

        @Test
        @DisplayName("Case-sensitive filters compare verbatim")
        void caseSensitive() {
            KeywordFilter filter = new KeywordFilter(List.of("AI"), null, null, null, null, true);

            assertTrue(filter.matches(List.of(), "New AI chip"));
            assertFalse(filter.matches(List.of("ai"), "said nothing"));
        }
    }

    @Nested
    @DisplayName("Sentiment Filter Tests")
    class SentimentFilterTests {

        @Test
        @DisplayName("Polarity presets split at plus or minus 0.1")
        void presets() {
            assertTrue(SentimentFilter.positiveOnly().matches(0.4, SentimentLabel.POSITIVE));
            assertFalse(SentimentFilter.positiveOnly().matches(0.1, SentimentLabel.POSITIVE));
            assertTrue(SentimentFilter.neutralOnly().matches(0.1, SentimentLabel.NEUTRAL));
            assertTrue(SentimentFilter.negativeOnly().matches(-0.3, SentimentLabel.NEGATIVE));
            assertFalse(SentimentFilter.negativeOnly().matches(-0.3, SentimentLabel.NEUTRAL));
        }

        @Test
        @DisplayName("Score range and inclusion flags both apply")
        void rangeAndFlags() {
            SentimentFilter noNeutral = new SentimentFilter(null, -0.8, 0.8, true, true, false);

            assertTrue(noNeutral.matches(0.5, SentimentLabel.POSITIVE));
            assertFalse(noNeutral.matches(0.9, SentimentLabel.POSITIVE));
            assertFalse(noNeutral.matches(0.05, SentimentLabel.NEUTRAL));
            assertTrue(SentimentFilter.range(null, null).matches(-1.0, SentimentLabel.NEGATIVE));
        }

        @Test
        @DisplayName("Labels follow the 0.1 thresholds")
        void labels() {
            assertEquals(SentimentLabel.POSITIVE, SentimentLabel.fromScore(0.1));
            assertEquals(SentimentLabel.NEUTRAL, SentimentLabel.fromScore(0.0));
            assertEquals(SentimentLabel.NEGATIVE, SentimentLabel.fromScore(-0.1));
        }
    }

    @Nested
    @DisplayName("Search Filter Tests")
    class SearchFilterTests {

        @Test
        @DisplayName("Defaults apply to absent fields")
        void defaults() {
            SearchFilter filter = new SearchFilter(null, null, null, null, null, null, null, null, null, null, 0, -5);

            assertEquals(Set.of(), filter.sources());
            assertEquals(SortBy.PUBLISHED_AT, filter.sortBy());
            assertEquals(SortOrder.DESCENDING, filter.sortOrder());
            assertEquals(SearchFilter.DEFAULT_LIMIT, filter.limit());
            assertEquals(0, filter.offset());
            assertEquals(0, filter.activeFilterCount());
            assertEquals(0, filter.queryComplexity());
        }

        @Test
        @DisplayName("toBuilder keeps every field")
        void toBuilder() {
            SearchFilter filter = SearchFilter.builder().query("q").bookmarked(true).limit(5).build();

            assertEquals(filter, filter.toBuilder().build());
            assertEquals(2, filter.activeFilterCount());
        }

        @Test
        @DisplayName("Date ranges are inclusive and validated")
        void dateRange() {
            MutableClock clock = new MutableClock(Articles.NOW);
            DateRange week = DateRange.lastWeek(clock);

            assertTrue(week.contains(Articles.NOW));
            assertTrue(week.contains(Articles.NOW.minus(Duration.ofDays(7))));
            assertFalse(week.contains(Articles.NOW.plusMillis(1)));
            assertEquals(Duration.ofDays(1), DateRange.today(clock).length());
            assertThrows(IllegalArgumentException.class, () -> new DateRange(Articles.NOW, Instant.EPOCH));
        }
    }
}
