package com.insightflo.news.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightflo.core.error.StorageException;
import com.insightflo.core.model.BookmarkMutation;
import com.insightflo.core.model.NewsRecord;
import com.insightflo.core.model.SentimentLabel;
import com.insightflo.core.model.SyncMetadata;
import com.insightflo.core.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite implementation of LocalStore.
 */
public class SqliteLocalStore implements LocalStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteLocalStore.class);

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final Duration FRESH_WINDOW = Duration.ofHours(24);
    private static final int SENTIMENT_BATCH_SIZE = 100;

    private static final String UPSERT_NEWS = """
        INSERT INTO news_articles
        (id, user_id, title, summary, content, url, source, published_at, keywords,
         image_url, sentiment_score, sentiment_label, is_bookmarked, cached_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(id, user_id) DO UPDATE SET
            title = excluded.title,
            summary = excluded.summary,
            content = excluded.content,
            url = excluded.url,
            source = excluded.source,
            published_at = excluded.published_at,
            keywords = excluded.keywords,
            image_url = excluded.image_url,
            sentiment_score = excluded.sentiment_score,
            sentiment_label = excluded.sentiment_label,
            is_bookmarked = excluded.is_bookmarked,
            cached_at = excluded.cached_at
        """;

    private final SqliteConnection db;
    private final Clock clock;

    public SqliteLocalStore(Path dbPath) {
        this(new SqliteConnection(dbPath), Clock.systemUTC());
    }

    public SqliteLocalStore(SqliteConnection db, Clock clock) {
        this.db = db;
        this.clock = clock;
        try {
            db.executeInTransaction(this::initSchema);
            ensureFullTextIndex();
            log.info("Opened local news store at {}", db.getDbPath());
        } catch (SQLException e) {
            throw new StorageException("Failed to open database: " + db.getDbPath(), e);
        }
    }

    private void initSchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            // Cached articles, one row per (article, user)
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS news_articles (
                    seq INTEGER PRIMARY KEY AUTOINCREMENT,
                    id TEXT NOT NULL,
                    user_id TEXT NOT NULL,
                    title TEXT NOT NULL,
                    summary TEXT,
                    content TEXT,
                    url TEXT,
                    source TEXT,
                    published_at INTEGER NOT NULL,
                    keywords TEXT DEFAULT '[]',
                    image_url TEXT,
                    sentiment_score REAL DEFAULT 0,
                    sentiment_label TEXT DEFAULT 'neutral',
                    is_bookmarked INTEGER DEFAULT 0,
                    cached_at INTEGER NOT NULL,
                    UNIQUE (id, user_id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS bookmark_mutations (
                    id TEXT NOT NULL,
                    user_id TEXT NOT NULL,
                    is_bookmarked INTEGER NOT NULL,
                    mutated_at INTEGER NOT NULL,
                    PRIMARY KEY (id, user_id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS sync_metadata (
                    id TEXT PRIMARY KEY,
                    table_name TEXT NOT NULL,
                    sync_direction TEXT NOT NULL,
                    last_sync_time INTEGER NOT NULL,
                    sync_status TEXT NOT NULL,
                    record_count INTEGER DEFAULT 0,
                    error_message TEXT,
                    metadata TEXT,
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS search_history (
                    id TEXT PRIMARY KEY,
                    user_id TEXT NOT NULL,
                    query TEXT NOT NULL,
                    filter_json TEXT,
                    timestamp INTEGER NOT NULL,
                    result_count INTEGER DEFAULT 0,
                    search_duration_ms INTEGER DEFAULT 0
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS api_cache (
                    cache_key TEXT PRIMARY KEY,
                    payload TEXT NOT NULL,
                    cached_at INTEGER NOT NULL,
                    expires_at INTEGER NOT NULL
                )
                """);

            // Indexes
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_user_published ON news_articles(user_id, published_at DESC)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_published ON news_articles(published_at DESC)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_source ON news_articles(source)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_sentiment ON news_articles(sentiment_score)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_bookmark ON news_articles(user_id, is_bookmarked)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_news_cached ON news_articles(cached_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_sync_status ON sync_metadata(sync_status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_history_user_time ON search_history(user_id, timestamp DESC)");
        }
    }

    private void createFullTextIndex(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE VIRTUAL TABLE IF NOT EXISTS news_fts
                USING fts5(title, summary, content, keywords)
                """);
            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS news_fts_insert AFTER INSERT ON news_articles BEGIN
                    INSERT INTO news_fts(rowid, title, summary, content, keywords)
                    VALUES (new.seq, new.title, new.summary, new.content, new.keywords);
                END
                """);
            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS news_fts_delete AFTER DELETE ON news_articles BEGIN
                    DELETE FROM news_fts WHERE rowid = old.seq;
                END
                """);
            stmt.execute("""
                CREATE TRIGGER IF NOT EXISTS news_fts_update
                AFTER UPDATE OF title, summary, content, keywords ON news_articles BEGIN
                    DELETE FROM news_fts WHERE rowid = old.seq;
                    INSERT INTO news_fts(rowid, title, summary, content, keywords)
                    VALUES (new.seq, new.title, new.summary, new.content, new.keywords);
                END
                """);
        }
    }

    // === News records ===

    @Override
    public Optional<NewsRecord> getRecord(String id, String userId) {
        List<NewsRecord> rows = queryNews(
            "SELECT * FROM news_articles WHERE id = ? AND user_id = ?", List.of(id, userId));
        return rows.stream().findFirst();
    }

    @Override
    public boolean hasRecord(String id, String userId) {
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT 1 FROM news_articles WHERE id = ? AND user_id = ?")) {
                    ps.setString(1, id);
                    ps.setString(2, userId);
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next();
                    }
                }
            });
        } catch (SQLException e) {
            log.error("Failed to check record {}: {}", id, e.getMessage());
            return false;
        }
    }

    @Override
    public void upsert(NewsRecord record) {
        upsertAll(List.of(record));
    }

    @Override
    public int upsertAll(List<NewsRecord> records) {
        if (records.isEmpty()) return 0;
        Instant now = clock.instant();
        try {
            return db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(UPSERT_NEWS)) {
                    for (NewsRecord record : records) {
                        bindNews(ps, record, now);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return records.size();
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to write " + records.size() + " news records", e);
        }
    }

    private void bindNews(PreparedStatement ps, NewsRecord record, Instant cachedAt) throws SQLException {
        ps.setString(1, record.id());
        ps.setString(2, record.userId());
        ps.setString(3, record.title());
        ps.setString(4, record.summary());
        ps.setString(5, record.content());
        ps.setString(6, record.url());
        ps.setString(7, record.source());
        ps.setLong(8, record.publishedAt().toEpochMilli());
        ps.setString(9, encodeKeywords(record.keywords()));
        if (record.imageUrl() != null) {
            ps.setString(10, record.imageUrl());
        } else {
            ps.setNull(10, Types.VARCHAR);
        }
        ps.setDouble(11, record.sentimentScore());
        ps.setString(12, record.sentimentLabel().wireName());
        ps.setInt(13, record.bookmarked() ? 1 : 0);
        ps.setLong(14, cachedAt.toEpochMilli());
    }

    @Override
    public boolean updateBookmark(String id, String userId, boolean bookmarked) {
        Instant now = clock.instant();
        try {
            return db.executeInTransaction(conn -> {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE news_articles SET is_bookmarked = ? WHERE id = ? AND user_id = ?")) {
                    ps.setInt(1, bookmarked ? 1 : 0);
                    ps.setString(2, id);
                    ps.setString(3, userId);
                    updated = ps.executeUpdate();
                }
                if (updated > 0) {
                    try (PreparedStatement ps = conn.prepareStatement(
                            "INSERT OR REPLACE INTO bookmark_mutations (id, user_id, is_bookmarked, mutated_at) VALUES (?, ?, ?, ?)")) {
                        ps.setString(1, id);
                        ps.setString(2, userId);
                        ps.setInt(3, bookmarked ? 1 : 0);
                        ps.setLong(4, now.toEpochMilli());
                        ps.executeUpdate();
                    }
                }
                return updated > 0;
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to update bookmark for " + id, e);
        }
    }

    @Override
    public int updateSentiment(String userId, Map<String, Double> scoresById) {
        if (scoresById.isEmpty()) return 0;
        List<Map.Entry<String, Double>> entries = new ArrayList<>(scoresById.entrySet());
        int updated = 0;
        try {
            for (int start = 0; start < entries.size(); start += SENTIMENT_BATCH_SIZE) {
                List<Map.Entry<String, Double>> batch =
                    entries.subList(start, Math.min(entries.size(), start + SENTIMENT_BATCH_SIZE));
                updated += db.executeInTransaction(conn -> {
                    int count = 0;
                    try (PreparedStatement ps = conn.prepareStatement(
                            "UPDATE news_articles SET sentiment_score = ?, sentiment_label = ? WHERE id = ? AND user_id = ?")) {
                        for (Map.Entry<String, Double> entry : batch) {
                            double score = entry.getValue();
                            ps.setDouble(1, score);
                            ps.setString(2, SentimentLabel.fromScore(score).wireName());
                            ps.setString(3, entry.getKey());
                            ps.setString(4, userId);
                            count += ps.executeUpdate();
                        }
                    }
                    return count;
                });
            }
            return updated;
        } catch (SQLException e) {
            throw new StorageException("Failed to update sentiment scores", e);
        }
    }

    @Override
    public int cleanupOldRecords(String userId, int keepCount, int retentionDays) {
        long cutoff = clock.instant().minus(Duration.ofDays(retentionDays)).toEpochMilli();
        String sql = """
            DELETE FROM news_articles
            WHERE user_id = ?
              AND cached_at < ?
              AND seq NOT IN (
                  SELECT seq FROM news_articles WHERE user_id = ?
                  ORDER BY published_at DESC LIMIT ?
              )
            """;
        try {
            int deleted = db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setLong(2, cutoff);
                    ps.setString(3, userId);
                    ps.setInt(4, keepCount);
                    return ps.executeUpdate();
                }
            });
            if (deleted > 0) {
                log.info("Removed {} old news records for {}", deleted, userId);
            }
            return deleted;
        } catch (SQLException e) {
            log.error("Failed to clean up news records for {}: {}", userId, e.getMessage());
            return 0;
        }
    }

    // === Feeds ===

    @Override
    public List<NewsRecord> getPersonalizedNews(String userId, int limit, int offset) {
        return queryNews("""
            SELECT * FROM news_articles WHERE user_id = ?
            ORDER BY published_at DESC LIMIT ? OFFSET ?
            """, List.of(userId, limit, offset));
    }

    @Override
    public List<NewsRecord> getFreshNews(String userId, int limit) {
        long since = clock.instant().minus(FRESH_WINDOW).toEpochMilli();
        return queryNews("""
            SELECT * FROM news_articles WHERE user_id = ? AND cached_at >= ?
            ORDER BY published_at DESC LIMIT ?
            """, List.of(userId, since, limit));
    }

    @Override
    public List<NewsRecord> getBookmarkedNews(String userId, int limit) {
        return queryNews("""
            SELECT * FROM news_articles WHERE user_id = ? AND is_bookmarked = 1
            ORDER BY published_at DESC LIMIT ?
            """, List.of(userId, limit));
    }

    @Override
    public List<NewsRecord> getNewsBySentiment(String userId, double minScore, double maxScore, int limit) {
        return queryNews("""
            SELECT * FROM news_articles
            WHERE user_id = ? AND sentiment_score BETWEEN ? AND ?
            ORDER BY published_at DESC LIMIT ?
            """, List.of(userId, minScore, maxScore, limit));
    }

    @Override
    public List<NewsRecord> getNewsByDateRange(String userId, Instant start, Instant end, int limit) {
        return queryNews("""
            SELECT * FROM news_articles
            WHERE user_id = ? AND published_at BETWEEN ? AND ?
            ORDER BY published_at DESC LIMIT ?
            """, List.of(userId, start.toEpochMilli(), end.toEpochMilli(), limit));
    }

    @Override
    public List<NewsRecord> getTopNewsBySentiment(String userId, SentimentLabel label, int limit) {
        String order = label == SentimentLabel.NEGATIVE ? "ASC" : "DESC";
        return queryNews("""
            SELECT * FROM news_articles WHERE user_id = ? AND sentiment_label = ?
            ORDER BY sentiment_score %s, published_at DESC LIMIT ?
            """.formatted(order), List.of(userId, label.wireName(), limit));
    }

    // === Text search ===

    @Override
    public List<NewsRecord> searchContaining(String userId, String query, int limit) {
        String pattern = "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%";
        return queryNews("""
            SELECT * FROM news_articles
            WHERE user_id = ?
              AND (LOWER(title) LIKE ? ESCAPE '\\'
                OR LOWER(summary) LIKE ? ESCAPE '\\'
                OR LOWER(content) LIKE ? ESCAPE '\\'
                OR LOWER(keywords) LIKE ? ESCAPE '\\')
            ORDER BY published_at DESC, sentiment_score DESC LIMIT ?
            """, List.of(userId, pattern, pattern, pattern, pattern, limit));
    }

    @Override
    public List<NewsRecord> fullTextSearch(String userId, String ftsQuery, int limit) {
        String sql = """
            SELECT a.* FROM news_fts
            JOIN news_articles a ON a.seq = news_fts.rowid
            WHERE news_fts MATCH ? AND a.user_id = ?
            ORDER BY bm25(news_fts) LIMIT ?
            """;
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, ftsQuery);
                    ps.setString(2, userId);
                    ps.setInt(3, limit);
                    return readNews(ps);
                }
            });
        } catch (SQLException e) {
            throw new StorageException("Full-text search unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public int ensureFullTextIndex() {
        try {
            return db.executeInTransaction(conn -> {
                createFullTextIndex(conn);
                long indexed = count(conn, "SELECT COUNT(*) FROM news_fts");
                long articles = count(conn, "SELECT COUNT(*) FROM news_articles");
                if (indexed > 0 || articles == 0) {
                    return 0;
                }
                try (Statement stmt = conn.createStatement()) {
                    int rows = stmt.executeUpdate("""
                        INSERT INTO news_fts(rowid, title, summary, content, keywords)
                        SELECT seq, title, summary, content, keywords FROM news_articles
                        """);
                    log.info("Rebuilt full-text index with {} articles", rows);
                    return rows;
                }
            });
        } catch (SQLException e) {
            log.warn("Full-text index unavailable: {}", e.getMessage());
            return 0;
        }
    }

    // === Aggregates ===

    @Override
    public StoreStats getStats(String userId) {
        long freshSince = clock.instant().minus(FRESH_WINDOW).toEpochMilli();
        String sql = """
            SELECT COUNT(*) AS total,
                   COALESCE(SUM(is_bookmarked), 0) AS bookmarked,
                   COALESCE(SUM(CASE WHEN cached_at >= ? THEN 1 ELSE 0 END), 0) AS fresh
            FROM news_articles WHERE user_id = ?
            """;
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, freshSince);
                    ps.setString(2, userId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) return StoreStats.EMPTY;
                        return new StoreStats(rs.getInt("total"), rs.getInt("bookmarked"), rs.getInt("fresh"));
                    }
                }
            });
        } catch (SQLException e) {
            log.error("Failed to read stats for {}: {}", userId, e.getMessage());
            return StoreStats.EMPTY;
        }
    }

    @Override
    public List<SourceStats> getSourceStatistics(String userId, int limit) {
        String sql = """
            SELECT source,
                   COUNT(*) AS article_count,
                   AVG(sentiment_score) AS avg_sentiment,
                   COALESCE(SUM(is_bookmarked), 0) AS bookmarked_count,
                   MAX(published_at) AS latest
            FROM news_articles
            WHERE user_id = ? AND source IS NOT NULL AND source != ''
            GROUP BY source
            ORDER BY article_count DESC, source ASC
            LIMIT ?
            """;
        try {
            return db.query(conn -> {
                List<SourceStats> stats = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setInt(2, limit);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            stats.add(new SourceStats(
                                rs.getString("source"),
                                rs.getInt("article_count"),
                                rs.getDouble("avg_sentiment"),
                                rs.getInt("bookmarked_count"),
                                Instant.ofEpochMilli(rs.getLong("latest"))));
                        }
                    }
                }
                return stats;
            });
        } catch (SQLException e) {
            log.error("Failed to read source statistics for {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public SentimentProfile getUserSentimentProfile(String userId, Instant since) {
        String sql = """
            SELECT AVG(sentiment_score) AS avg_sentiment,
                   COALESCE(SUM(is_bookmarked), 0) AS bookmarked,
                   COUNT(*) AS total
            FROM news_articles WHERE user_id = ? AND cached_at >= ?
            """;
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setLong(2, since.toEpochMilli());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next() || rs.getInt("total") == 0) return SentimentProfile.EMPTY;
                        return new SentimentProfile(
                            rs.getDouble("avg_sentiment"), rs.getInt("bookmarked"), rs.getInt("total"));
                    }
                }
            });
        } catch (SQLException e) {
            log.error("Failed to read sentiment profile for {}: {}", userId, e.getMessage());
            return SentimentProfile.EMPTY;
        }
    }

    @Override
    public List<TextFrequency> getTitleFrequencies(String userId, String prefix, int limit) {
        return queryFrequencies("""
            SELECT title AS text, COUNT(*) AS frequency FROM news_articles
            WHERE user_id = ? AND LOWER(title) LIKE ? ESCAPE '\\'
            GROUP BY LOWER(title) ORDER BY frequency DESC, text ASC LIMIT ?
            """, List.of(userId, escapeLike(prefix.toLowerCase(Locale.ROOT)) + "%", limit));
    }

    // === Pending local mutations ===

    @Override
    public List<BookmarkMutation> getBookmarkMutations(String userId, Instant since) {
        String sql = """
            SELECT * FROM bookmark_mutations WHERE user_id = ? AND mutated_at >= ?
            ORDER BY mutated_at ASC
            """;
        try {
            return db.query(conn -> {
                List<BookmarkMutation> mutations = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setLong(2, since == null ? 0 : since.toEpochMilli());
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            mutations.add(new BookmarkMutation(
                                rs.getString("id"),
                                rs.getString("user_id"),
                                rs.getInt("is_bookmarked") == 1,
                                Instant.ofEpochMilli(rs.getLong("mutated_at"))));
                        }
                    }
                }
                return mutations;
            });
        } catch (SQLException e) {
            log.error("Failed to read bookmark mutations for {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public int clearBookmarkMutations(String userId, Instant upTo) {
        return executeUpdate("DELETE FROM bookmark_mutations WHERE user_id = ? AND mutated_at <= ?",
            List.of(userId, upTo.toEpochMilli()));
    }

    // === Sync metadata ===

    @Override
    public Optional<SyncMetadata> getSyncMetadata(String tableName, String direction) {
        List<SyncMetadata> rows = querySyncMetadata("SELECT * FROM sync_metadata WHERE id = ?",
            List.of(SyncMetadata.idFor(tableName, direction)));
        return rows.stream().findFirst();
    }

    @Override
    public void upsertSyncMetadata(SyncMetadata metadata) {
        String sql = """
            INSERT INTO sync_metadata
            (id, table_name, sync_direction, last_sync_time, sync_status, record_count,
             error_message, metadata, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                last_sync_time = excluded.last_sync_time,
                sync_status = excluded.sync_status,
                record_count = excluded.record_count,
                error_message = excluded.error_message,
                metadata = excluded.metadata,
                updated_at = excluded.updated_at
            """;
        try {
            db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, metadata.id());
                    ps.setString(2, metadata.tableName());
                    ps.setString(3, metadata.syncDirection());
                    ps.setLong(4, metadata.lastSyncTime().toEpochMilli());
                    ps.setString(5, metadata.syncStatus().wireName());
                    ps.setInt(6, metadata.recordCount());
                    ps.setString(7, metadata.errorMessage());
                    ps.setString(8, metadata.metadataJson());
                    ps.setLong(9, metadata.createdAt().toEpochMilli());
                    ps.setLong(10, metadata.updatedAt().toEpochMilli());
                    ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to write sync metadata " + metadata.id(), e);
        }
    }

    @Override
    public List<SyncMetadata> getSyncMetadataByStatus(SyncStatus status) {
        return querySyncMetadata("SELECT * FROM sync_metadata WHERE sync_status = ? ORDER BY updated_at DESC",
            List.of(status.wireName()));
    }

    @Override
    public SyncStatistics getSyncStatistics() {
        try {
            return db.query(conn -> {
                Map<SyncStatus, Integer> byStatus = new EnumMap<>(SyncStatus.class);
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(
                         "SELECT sync_status, COUNT(*) AS n FROM sync_metadata GROUP BY sync_status")) {
                    while (rs.next()) {
                        byStatus.merge(SyncStatus.parse(rs.getString("sync_status")), rs.getInt("n"), Integer::sum);
                    }
                }
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery("""
                         SELECT COUNT(DISTINCT table_name) AS tables,
                                COALESCE(SUM(record_count), 0) AS records,
                                MAX(last_sync_time) AS last_sync
                         FROM sync_metadata
                         """)) {
                    if (!rs.next()) return SyncStatistics.EMPTY;
                    long lastSync = rs.getLong("last_sync");
                    boolean hasLastSync = !rs.wasNull();
                    return new SyncStatistics(
                        rs.getInt("tables"),
                        Map.copyOf(byStatus),
                        rs.getLong("records"),
                        hasLastSync ? Instant.ofEpochMilli(lastSync) : null,
                        byStatus.getOrDefault(SyncStatus.FAILED, 0));
                }
            });
        } catch (SQLException e) {
            log.error("Failed to read sync statistics: {}", e.getMessage());
            return SyncStatistics.EMPTY;
        }
    }

    @Override
    public int cleanupSyncMetadata(Duration retention) {
        long cutoff = clock.instant().minus(retention).toEpochMilli();
        return executeUpdate("DELETE FROM sync_metadata WHERE updated_at < ? AND sync_status != ?",
            List.of(cutoff, SyncStatus.SYNCING.wireName()));
    }

    // === Search history ===

    @Override
    public void insertSearchHistory(SearchHistoryRow row) {
        String sql = """
            INSERT OR REPLACE INTO search_history
            (id, user_id, query, filter_json, timestamp, result_count, search_duration_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, row.id());
                    ps.setString(2, row.userId());
                    ps.setString(3, row.query());
                    ps.setString(4, row.filterJson());
                    ps.setLong(5, row.timestamp().toEpochMilli());
                    ps.setInt(6, row.resultCount());
                    ps.setLong(7, row.searchDurationMs());
                    ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to record search history " + row.id(), e);
        }
    }

    @Override
    public List<SearchHistoryRow> getSearchHistory(String userId, int limit, String queryContains) {
        StringBuilder sql = new StringBuilder("SELECT * FROM search_history WHERE user_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(userId);
        if (queryContains != null && !queryContains.isBlank()) {
            sql.append(" AND LOWER(query) LIKE ? ESCAPE '\\'");
            params.add("%" + escapeLike(queryContains.toLowerCase(Locale.ROOT)) + "%");
        }
        sql.append(" ORDER BY timestamp DESC, rowid DESC LIMIT ?");
        params.add(limit);

        try {
            return db.query(conn -> {
                List<SearchHistoryRow> rows = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                    bind(ps, params);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(new SearchHistoryRow(
                                rs.getString("id"),
                                rs.getString("user_id"),
                                rs.getString("query"),
                                rs.getString("filter_json"),
                                Instant.ofEpochMilli(rs.getLong("timestamp")),
                                rs.getInt("result_count"),
                                rs.getLong("search_duration_ms")));
                        }
                    }
                }
                return rows;
            });
        } catch (SQLException e) {
            log.error("Failed to read search history for {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<TextFrequency> getHistoricalQueries(String userId, String prefix, int limit) {
        return queryFrequencies("""
            SELECT query AS text, COUNT(*) AS frequency FROM search_history
            WHERE user_id = ? AND LOWER(query) LIKE ? ESCAPE '\\'
            GROUP BY query ORDER BY MAX(timestamp) DESC LIMIT ?
            """, List.of(userId, escapeLike(prefix.toLowerCase(Locale.ROOT)) + "%", limit));
    }

    @Override
    public int deleteSearchHistory(String userId, Instant olderThan) {
        if (olderThan == null) {
            return executeUpdate("DELETE FROM search_history WHERE user_id = ?", List.of(userId));
        }
        return executeUpdate("DELETE FROM search_history WHERE user_id = ? AND timestamp < ?",
            List.of(userId, olderThan.toEpochMilli()));
    }

    @Override
    public int pruneSearchHistory(String userId, Instant cutoff, int maxEntries) {
        try {
            return db.executeInTransaction(conn -> {
                int removed;
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM search_history WHERE user_id = ? AND timestamp < ?")) {
                    ps.setString(1, userId);
                    ps.setLong(2, cutoff.toEpochMilli());
                    removed = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        DELETE FROM search_history WHERE user_id = ? AND rowid NOT IN (
                            SELECT rowid FROM search_history WHERE user_id = ?
                            ORDER BY timestamp DESC, rowid DESC LIMIT ?
                        )
                        """)) {
                    ps.setString(1, userId);
                    ps.setString(2, userId);
                    ps.setInt(3, maxEntries);
                    removed += ps.executeUpdate();
                }
                return removed;
            });
        } catch (SQLException e) {
            log.error("Failed to prune search history for {}: {}", userId, e.getMessage());
            return 0;
        }
    }

    @Override
    public HistoryAggregate aggregateSearchHistory(String userId, Instant since) {
        String sql = """
            SELECT COUNT(*) AS total,
                   AVG(result_count) AS avg_results,
                   AVG(search_duration_ms) AS avg_duration,
                   COUNT(DISTINCT query) AS unique_queries
            FROM search_history WHERE user_id = ? AND timestamp >= ?
            """;
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setLong(2, since == null ? 0 : since.toEpochMilli());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) return HistoryAggregate.EMPTY;
                        return new HistoryAggregate(
                            rs.getInt("total"),
                            rs.getDouble("avg_results"),
                            rs.getDouble("avg_duration"),
                            rs.getInt("unique_queries"));
                    }
                }
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to aggregate search history for " + userId, e);
        }
    }

    @Override
    public List<TextFrequency> getTopQueries(String userId, Instant since, int limit) {
        return queryFrequencies("""
            SELECT query AS text, COUNT(*) AS frequency FROM search_history
            WHERE user_id = ? AND timestamp >= ?
            GROUP BY query ORDER BY frequency DESC, MAX(timestamp) DESC LIMIT ?
            """, List.of(userId, since == null ? 0L : since.toEpochMilli(), limit));
    }

    @Override
    public Map<Integer, Integer> getSearchesByHour(String userId, Instant since) {
        String sql = """
            SELECT CAST(strftime('%H', timestamp / 1000, 'unixepoch') AS INTEGER) AS hour,
                   COUNT(*) AS n
            FROM search_history WHERE user_id = ? AND timestamp >= ?
            GROUP BY hour ORDER BY hour
            """;
        try {
            return db.query(conn -> {
                Map<Integer, Integer> byHour = new LinkedHashMap<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, userId);
                    ps.setLong(2, since == null ? 0 : since.toEpochMilli());
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            byHour.put(rs.getInt("hour"), rs.getInt("n"));
                        }
                    }
                }
                return byHour;
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to read hourly search counts for " + userId, e);
        }
    }

    // === API cache slots ===

    @Override
    public Optional<CacheEntry> getCacheEntry(String key) {
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM api_cache WHERE cache_key = ?")) {
                    ps.setString(1, key);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) return Optional.<CacheEntry>empty();
                        return Optional.of(new CacheEntry(
                            rs.getString("cache_key"),
                            rs.getString("payload"),
                            Instant.ofEpochMilli(rs.getLong("cached_at")),
                            Instant.ofEpochMilli(rs.getLong("expires_at"))));
                    }
                }
            });
        } catch (SQLException e) {
            log.error("Failed to read cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void putCacheEntry(CacheEntry entry) {
        String sql = """
            INSERT OR REPLACE INTO api_cache (cache_key, payload, cached_at, expires_at)
            VALUES (?, ?, ?, ?)
            """;
        try {
            db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, entry.key());
                    ps.setString(2, entry.payload());
                    ps.setLong(3, entry.cachedAt().toEpochMilli());
                    ps.setLong(4, entry.expiresAt().toEpochMilli());
                    ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StorageException("Failed to write cache entry " + entry.key(), e);
        }
    }

    @Override
    public void invalidateCacheEntry(String key) {
        executeUpdate("DELETE FROM api_cache WHERE cache_key = ?", List.of(key));
    }

    @Override
    public void clearCache() {
        executeUpdate("DELETE FROM api_cache", List.of());
    }

    @Override
    public int deleteExpiredCacheEntries(Instant expiredBefore) {
        int deleted = executeUpdate("DELETE FROM api_cache WHERE expires_at < ?",
            List.of(expiredBefore.toEpochMilli()));
        if (deleted > 0) {
            log.info("Removed {} expired cache slots", deleted);
        }
        return deleted;
    }

    @Override
    public int countCacheEntries() {
        try {
            return db.query(conn -> (int) count(conn, "SELECT COUNT(*) FROM api_cache"));
        } catch (SQLException e) {
            log.error("Failed to count cache slots: {}", e.getMessage());
            return 0;
        }
    }

    // === Maintenance ===

    @Override
    public OptimizeResult optimize() {
        try {
            return db.query(conn -> {
                long before = count(conn, "PRAGMA page_count");
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("VACUUM");
                    stmt.execute("ANALYZE");
                }
                long after = count(conn, "PRAGMA page_count");
                log.info("Optimized local store: {} -> {} pages", before, after);
                return new OptimizeResult(before, after);
            });
        } catch (SQLException e) {
            log.error("Failed to optimize local store: {}", e.getMessage());
            return new OptimizeResult(0, 0);
        }
    }

    @Override
    public void close() {
        db.close();
        log.info("Closed local news store at {}", db.getDbPath());
    }

    // === Helpers ===

    private List<NewsRecord> queryNews(String sql, List<Object> params) {
        try {
            return db.query(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, params);
                    return readNews(ps);
                }
            });
        } catch (SQLException e) {
            log.error("Failed to query news records: {}", e.getMessage());
            return List.of();
        }
    }

    private List<NewsRecord> readNews(PreparedStatement ps) throws SQLException {
        List<NewsRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapNews(rs));
            }
        }
        return records;
    }

    private NewsRecord mapNews(ResultSet rs) throws SQLException {
        return NewsRecord.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .title(rs.getString("title"))
            .summary(rs.getString("summary"))
            .content(rs.getString("content"))
            .url(rs.getString("url"))
            .source(rs.getString("source"))
            .publishedAt(Instant.ofEpochMilli(rs.getLong("published_at")))
            .keywords(decodeKeywords(rs.getString("keywords")))
            .imageUrl(rs.getString("image_url"))
            .sentimentScore(rs.getDouble("sentiment_score"))
            .sentimentLabel(SentimentLabel.parse(rs.getString("sentiment_label")))
            .bookmarked(rs.getInt("is_bookmarked") == 1)
            .cachedAt(Instant.ofEpochMilli(rs.getLong("cached_at")))
            .build();
    }

    private List<SyncMetadata> querySyncMetadata(String sql, List<Object> params) {
        try {
            return db.query(conn -> {
                List<SyncMetadata> rows = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, params);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(new SyncMetadata(
                                rs.getString("table_name"),
                                rs.getString("sync_direction"),
                                Instant.ofEpochMilli(rs.getLong("last_sync_time")),
                                SyncStatus.parse(rs.getString("sync_status")),
                                rs.getInt("record_count"),
                                rs.getString("error_message"),
                                rs.getString("metadata"),
                                Instant.ofEpochMilli(rs.getLong("created_at")),
                                Instant.ofEpochMilli(rs.getLong("updated_at"))));
                        }
                    }
                }
                return rows;
            });
        } catch (SQLException e) {
            log.error("Failed to read sync metadata: {}", e.getMessage());
            return List.of();
        }
    }

    private List<TextFrequency> queryFrequencies(String sql, List<Object> params) {
        try {
            return db.query(conn -> {
                List<TextFrequency> rows = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, params);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(new TextFrequency(rs.getString("text"), rs.getInt("frequency")));
                        }
                    }
                }
                return rows;
            });
        } catch (SQLException e) {
            log.error("Failed to read frequencies: {}", e.getMessage());
            return List.of();
        }
    }

    private int executeUpdate(String sql, List<Object> params) {
        try {
            return db.executeInTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, params);
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            log.error("Failed to execute update: {}", e.getMessage());
            return 0;
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static long count(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    static String encodeKeywords(List<String> keywords) {
        try {
            return mapper.writeValueAsString(keywords);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot encode keywords", e);
        }
    }

    static List<String> decodeKeywords(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.debug("Stored keywords are not a JSON array: {}", json);
            return List.of();
        }
    }
}
