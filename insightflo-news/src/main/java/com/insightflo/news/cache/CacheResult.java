package com.insightflo.news.cache;

import java.time.Instant;

/**
 * Data served from a cache slot together with its freshness.
 */
public record CacheResult<T>(
    T data,
    boolean isStale,
    Instant cachedAt,
    Instant expiresAt,
    boolean fromRemote
) {}
