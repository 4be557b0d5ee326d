package com.insightflo.news.remote;

import java.time.Instant;

/**
 * An interest keyword configured by the user on the backend.
 */
public record UserKeyword(
    String id,
    String userId,
    String keyword,
    double weight,          // 0.2 - 1.0
    String category,        // nullable
    Instant createdAt
) {}
