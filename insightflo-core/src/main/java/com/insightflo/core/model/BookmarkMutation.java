package com.insightflo.core.model;

import java.time.Instant;

/**
 * A local bookmark change not yet acknowledged by the backend.
 */
public record BookmarkMutation(
    String articleId,
    String userId,
    boolean bookmarked,
    Instant mutatedAt
) {}
