package com.insightflo.news.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RemoteArticleDecoderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final RemoteArticleDecoder decoder = new RemoteArticleDecoder(mapper, Clock.fixed(NOW, ZoneOffset.UTC));

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Nested
    @DisplayName("Keyword Decoding Tests")
    class KeywordTests {

        @Test
        @DisplayName("Should accept a JSON array")
        void array() throws Exception {
            assertEquals(List.of("ai", "chips"), decoder.decodeKeywords(json("[\"ai\", \" chips \", null]")));
        }

        @Test
        @DisplayName("Should accept a string holding a JSON array")
        void jsonString() throws Exception {
            assertEquals(List.of("ai", "chips"), decoder.decodeKeywords(json("\"[\\\"ai\\\",\\\"chips\\\"]\"")));
        }

        @Test
        @DisplayName("Should fall back to comma-delimited text")
        void commaDelimited() throws Exception {
            assertEquals(List.of("ai", "chips"), decoder.decodeKeywords(json("\"ai, chips,\"")));
        }

        @Test
        @DisplayName("Should treat a broken JSON array string as comma-delimited")
        void brokenJson() throws Exception {
            assertEquals(List.of("[ai", "chips"), decoder.decodeKeywords(json("\"[ai, chips\"")));
        }

        @Test
        @DisplayName("Should return empty for null, blank or other shapes")
        void empty() throws Exception {
            assertEquals(List.of(), decoder.decodeKeywords(null));
            assertEquals(List.of(), decoder.decodeKeywords(json("\"  \"")));
            assertEquals(List.of(), decoder.decodeKeywords(json("42")));
        }
    }

    @Nested
    @DisplayName("Scalar Decoding Tests")
    class ScalarTests {

        @Test
        @DisplayName("Should read sentiment from numbers and numeric strings")
        void sentimentScore() throws Exception {
            assertEquals(0.5, decoder.decodeScore(json("0.5")));
            assertEquals(-0.25, decoder.decodeScore(json("\"-0.25\"")));
            assertEquals(0.0, decoder.decodeScore(json("\"n/a\"")));
            assertEquals(0.0, decoder.decodeScore(null));
        }

        @Test
        @DisplayName("Should parse the supported date shapes and default to now")
        void publishedAt() throws Exception {
            assertEquals(Instant.parse("2024-05-01T10:00:00Z"), decoder.decodeInstant(json("\"2024-05-01T10:00:00Z\"")));
            assertEquals(Instant.parse("2024-05-01T08:00:00Z"), decoder.decodeInstant(json("\"2024-05-01T10:00:00+02:00\"")));
            assertEquals(Instant.parse("2024-05-01T10:00:00Z"), decoder.decodeInstant(json("\"2024-05-01T10:00:00\"")));
            assertEquals(Instant.parse("2024-05-01T00:00:00Z"), decoder.decodeInstant(json("\"2024-05-01\"")));
            assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), decoder.decodeInstant(json("1700000000000")));
            assertEquals(NOW, decoder.decodeInstant(json("\"yesterday\"")));
            assertEquals(NOW, decoder.decodeInstant(null));
        }
    }

    @Test
    @DisplayName("Should decode an article and skip entries without id")
    void decodeArticles() throws Exception {
        // Given
        JsonNode articles = json("""
            [
              {"id": "n1", "title": "Chip stocks surge", "summary": "Rally", "source": "Reuters",
               "published_at": "2024-05-31T09:00:00Z", "keywords": "chips, ai",
               "sentiment_score": "0.6", "is_bookmarked": 1, "image_url": null},
              {"title": "No id"}
            ]
            """);

        // When
        List<NewsRecord> records = decoder.decodeArticles(articles, "u1");

        // Then
        assertEquals(1, records.size());
        NewsRecord record = records.get(0);
        assertEquals("n1", record.id());
        assertEquals("u1", record.userId());
        assertEquals(List.of("chips", "ai"), record.keywords());
        assertEquals(SentimentLabel.POSITIVE, record.sentimentLabel());
        assertTrue(record.bookmarked());
        assertNull(record.imageUrl());
        assertEquals("", record.content());
        assertNull(record.cachedAt());
    }
}
