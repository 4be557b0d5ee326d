package com.insightflo.news.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryConfigTest {

    @Test
    @DisplayName("Should grow delays until the cap and never exceed it")
    void monotonicAndCapped() {
        RetryConfig config = new RetryConfig(10, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, false);

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 10; attempt++) {
            Duration delay = config.calculateDelay(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "delay shrank at attempt " + attempt);
            assertTrue(delay.compareTo(config.maxDelay()) <= 0, "delay above cap at attempt " + attempt);
            previous = delay;
        }
        assertEquals(Duration.ofMillis(100), config.calculateDelay(0));
        assertEquals(Duration.ofMillis(400), config.calculateDelay(2));
        assertEquals(Duration.ofSeconds(5), config.calculateDelay(9));
    }

    @Test
    @DisplayName("Should scale by a jitter factor between 0.9 and 1.0")
    void jitterBounds() {
        RetryConfig config = new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true);

        assertEquals(Duration.ofMillis(900), config.calculateDelay(0, () -> 0.0));
        assertEquals(Duration.ofMillis(2000), config.calculateDelay(1, () -> 1.0));
        for (int i = 0; i < 50; i++) {
            long millis = config.calculateDelay(3).toMillis();
            assertTrue(millis >= 7200 && millis <= 8000, "out of range: " + millis);
        }
    }

    @Test
    @DisplayName("Should default to three retries from one second up to thirty")
    void defaults() {
        assertEquals(3, RetryConfig.DEFAULT.maxRetries());
        assertEquals(Duration.ofSeconds(1), RetryConfig.DEFAULT.baseDelay());
        assertEquals(Duration.ofSeconds(30), RetryConfig.DEFAULT.maxDelay());
        assertThrows(IllegalArgumentException.class,
            () -> new RetryConfig(-1, Duration.ZERO, Duration.ZERO, 2.0, false));
    }
}
