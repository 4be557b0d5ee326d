package com.insightflo.news.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.error.RemoteException;
import com.insightflo.core.model.NewsRecord;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * HTTP client for the InsightFlo API.
 */
public class OkHttpNewsGateway implements NewsGateway {

    private static final Logger log = LoggerFactory.getLogger(OkHttpNewsGateway.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:3000";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final SessionProvider session;
    private final ObjectMapper mapper;
    private final RemoteArticleDecoder decoder;

    public OkHttpNewsGateway(String baseUrl, Duration timeout, SessionProvider session) {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build(),
            session, new ObjectMapper());
    }

    public OkHttpNewsGateway(String baseUrl, OkHttpClient client, SessionProvider session, ObjectMapper mapper) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid API base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.client = client;
        this.session = session;
        this.mapper = mapper;
        this.decoder = new RemoteArticleDecoder();
    }

    @Override
    public List<NewsRecord> fetchNews(int page, int limit) throws RemoteException {
        HttpUrl url = endpoint("api", "news")
            .addQueryParameter("page", String.valueOf(page))
            .addQueryParameter("limit", String.valueOf(limit))
            .build();
        return decoder.decodeArticles(articlesOf(get(url)), null);
    }

    @Override
    public List<NewsRecord> fetchPersonalizedNews(String userId, int page, int limit) throws RemoteException {
        HttpUrl url = endpoint("api", "news", "personalized")
            .addQueryParameter("limit", String.valueOf(limit))
            .build();
        return decoder.decodeArticles(articlesOf(get(url)), userId);
    }

    /**
     * The backend has no server-side search yet: the general feed is fetched
     * and narrowed to articles whose title or summary contains the query.
     */
    @Override
    public List<NewsRecord> searchNews(String query, int page, int limit) throws RemoteException {
        String needle = query.toLowerCase(Locale.ROOT);
        List<NewsRecord> matches = new ArrayList<>();
        for (NewsRecord record : fetchNews(page, limit)) {
            if (record.title().toLowerCase(Locale.ROOT).contains(needle)
                    || record.summary().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(record);
            }
        }
        return matches;
    }

    @Override
    public List<UserKeyword> fetchUserKeywords(String userId) throws RemoteException {
        HttpUrl url = endpoint("api", "keywords")
            .addQueryParameter("userId", userId)
            .build();
        JsonNode root = get(url);
        JsonNode interests = root.path("data").path("interests");
        if (!interests.isArray()) {
            throw new RemoteException(200, "Invalid keywords response format");
        }

        List<UserKeyword> keywords = new ArrayList<>();
        for (JsonNode node : interests) {
            String keyword = node.hasNonNull("interest_category")
                ? node.get("interest_category").asText()
                : node.path("keyword").asText("");
            double weight = node.hasNonNull("priority_level")
                ? node.get("priority_level").asDouble() / 5.0
                : node.path("weight").asDouble(1.0);
            keywords.add(new UserKeyword(
                node.path("id").asText(),
                node.path("user_id").asText(userId),
                keyword,
                weight,
                node.hasNonNull("category") ? node.get("category").asText() : null,
                decoder.decodeInstant(node.get("created_at"))));
        }
        return keywords;
    }

    private HttpUrl.Builder endpoint(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private JsonNode get(HttpUrl url) throws RemoteException {
        Request.Builder request = new Request.Builder()
            .url(url)
            .header("Accept", "application/json");
        session.accessToken().ifPresentOrElse(
            token -> request.header("Authorization", "Bearer " + token),
            () -> log.debug("No active session, using anonymous access"));

        log.debug("GET {}", url);
        Instant start = Instant.now();
        try (Response response = client.newCall(request.build()).execute()) {
            String body = readBody(response.body());
            log.debug("GET {} -> {} in {}ms", url.encodedPath(), response.code(),
                Duration.between(start, Instant.now()).toMillis());

            if (response.code() != 200) {
                throw new RemoteException(response.code(), "API request failed: " + errorMessage(body));
            }
            try {
                return mapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new RemoteException(response.code(), "Invalid API response format", e);
            }
        } catch (IOException e) {
            throw new RemoteException(RemoteException.NO_RESPONSE,
                "Failed to reach API at " + url.host() + ": " + e.getMessage(), e);
        }
    }

    private JsonNode articlesOf(JsonNode root) throws RemoteException {
        if (!root.path("success").asBoolean(false) || !root.has("articles") || !root.get("articles").isArray()) {
            throw new RemoteException(200, "Invalid API response format");
        }
        return root.get("articles");
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) return "Unknown error";
        try {
            JsonNode node = mapper.readTree(body);
            String message = node.path("message").asText("");
            return message.isEmpty() ? "Unknown error" : message;
        } catch (JsonProcessingException e) {
            return "Unknown error";
        }
    }

    private static String readBody(ResponseBody body) throws IOException {
        return body == null ? "" : body.string();
    }
}
