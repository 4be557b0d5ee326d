package com.insightflo.news.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SentimentLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Turns loosely typed backend article JSON into {@link NewsRecord}s.
 * <p>
 * Fields that the backend sends in more than one shape are read through a fixed ladder:
 * <ul>
 *   <li>keywords: JSON array, then a string holding a JSON array, then a comma-delimited string, then empty</li>
 *   <li>sentiment_score: number, then numeric string, then 0.0</li>
 *   <li>published_at: ISO instant, offset date-time, local date-time (UTC), date, epoch millis, then now</li>
 *   <li>is_bookmarked: boolean, then "true"/"1", then false</li>
 * </ul>
 */
public class RemoteArticleDecoder {

    private static final Logger log = LoggerFactory.getLogger(RemoteArticleDecoder.class);

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
        Instant::parse,
        s -> OffsetDateTime.parse(s).toInstant(),
        s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
        s -> LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC),
        s -> Instant.ofEpochMilli(Long.parseLong(s))
    );

    private final ObjectMapper mapper;
    private final Clock clock;

    public RemoteArticleDecoder(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public RemoteArticleDecoder() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public List<NewsRecord> decodeArticles(JsonNode articles, String userId) {
        List<NewsRecord> records = new ArrayList<>();
        if (articles == null || !articles.isArray()) {
            return records;
        }
        for (JsonNode node : articles) {
            String id = text(node, "id");
            if (id == null || id.isBlank()) {
                log.debug("Skipping article without id: {}", node);
                continue;
            }
            records.add(decode(node, userId));
        }
        return records;
    }

    public NewsRecord decode(JsonNode node, String userId) {
        double score = decodeScore(node.get("sentiment_score"));
        String label = text(node, "sentiment_label");
        return NewsRecord.builder()
            .id(text(node, "id"))
            .title(textOrEmpty(node, "title"))
            .summary(textOrEmpty(node, "summary"))
            .content(textOrEmpty(node, "content"))
            .url(textOrEmpty(node, "url"))
            .source(textOrEmpty(node, "source"))
            .publishedAt(decodeInstant(node.get("published_at")))
            .keywords(decodeKeywords(node.get("keywords")))
            .imageUrl(text(node, "image_url"))
            .sentimentScore(score)
            .sentimentLabel(label != null ? SentimentLabel.parse(label) : SentimentLabel.fromScore(score))
            .bookmarked(decodeBoolean(node.get("is_bookmarked")))
            .userId(userId)
            .build();
    }

    public List<String> decodeKeywords(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            return stringsOf(node);
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return List.of();
            }
            if (raw.startsWith("[")) {
                try {
                    JsonNode parsed = mapper.readTree(raw);
                    if (parsed.isArray()) {
                        return stringsOf(parsed);
                    }
                } catch (JsonProcessingException e) {
                    log.debug("Keywords look like JSON but do not parse: {}", raw);
                }
            }
            List<String> keywords = new ArrayList<>();
            for (String part : raw.split(",")) {
                String keyword = part.trim();
                if (!keyword.isEmpty()) {
                    keywords.add(keyword);
                }
            }
            return keywords;
        }
        return List.of();
    }

    public double decodeScore(JsonNode node) {
        if (node == null || node.isNull()) return 0.0;
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    public Instant decodeInstant(JsonNode node) {
        if (node == null || node.isNull()) return clock.instant();
        if (node.isNumber()) return Instant.ofEpochMilli(node.asLong());
        String raw = node.asText().trim();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(raw);
            } catch (DateTimeParseException | NumberFormatException e) {
                log.trace("published_at '{}' rejected: {}", raw, e.getMessage());
            }
        }
        log.debug("Unparseable published_at '{}', using current time", raw);
        return clock.instant();
    }

    private static boolean decodeBoolean(JsonNode node) {
        if (node == null || node.isNull()) return false;
        if (node.isBoolean()) return node.asBoolean();
        if (node.isNumber()) return node.asInt() != 0;
        String raw = node.asText().trim();
        return raw.equalsIgnoreCase("true") || raw.equals("1");
    }

    private static List<String> stringsOf(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isNull()) continue;
            String value = element.asText().trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        return value.asText();
    }

    private static String textOrEmpty(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? "" : value;
    }
}
