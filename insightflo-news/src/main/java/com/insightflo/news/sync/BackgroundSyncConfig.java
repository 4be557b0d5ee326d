package com.insightflo.news.sync;

import java.time.Duration;

public record BackgroundSyncConfig(
    Duration syncInterval,
    boolean enableAutoSync,
    boolean syncOnlyOnWifi,
    int maxBackgroundRetries
) {
    public static final BackgroundSyncConfig DEFAULT =
        new BackgroundSyncConfig(Duration.ofMinutes(15), true, false, 2);
}
