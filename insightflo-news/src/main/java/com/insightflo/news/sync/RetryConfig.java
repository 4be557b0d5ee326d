package com.insightflo.news.sync;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with optional jitter.
 */
public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier,
    boolean jitter
) {
    public static final RetryConfig DEFAULT =
        new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true);

    public RetryConfig {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * {@code min(maxDelay, baseDelay * multiplier^attempt)}, scaled by a factor in [0.9, 1.0] when jitter is on.
     */
    public Duration calculateDelay(int attempt) {
        return calculateDelay(attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    public Duration calculateDelay(int attempt, DoubleSupplier random) {
        double raw = baseDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt));
        double capped = Math.min(maxDelay.toMillis(), raw);
        if (jitter) {
            capped *= 0.9 + random.getAsDouble() * 0.1;
        }
        return Duration.ofMillis(Math.round(capped));
    }
}
