package com.insightflo.news.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Delays a task and lets a newer submission replace it. Only the last call in a burst runs;
 * the futures of superseded calls are cancelled.
 */
public class Debouncer<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Debouncer.class);

    private final Duration delay;
    private final ScheduledExecutorService scheduler;

    private CompletableFuture<T> pendingResult;
    private ScheduledFuture<?> pendingTask;

    public Debouncer(Duration delay, String threadName) {
        this.delay = delay;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule {@code task} after the delay. Once closed, the returned future is already cancelled.
     */
    public synchronized CompletableFuture<T> submit(Supplier<T> task) {
        cancelPending();
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            pendingTask = scheduler.schedule(() -> {
                try {
                    result.complete(task.get());
                } catch (RuntimeException e) {
                    log.warn("Debounced task failed: {}", e.getMessage());
                    result.completeExceptionally(e);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Debouncer is closed, dropping task");
            result.cancel(false);
            return result;
        }
        pendingResult = result;
        return result;
    }

    public synchronized void cancelPending() {
        if (pendingTask != null) {
            pendingTask.cancel(false);
            pendingTask = null;
        }
        if (pendingResult != null) {
            pendingResult.cancel(false);
            pendingResult = null;
        }
    }

    @Override
    public void close() {
        cancelPending();
        scheduler.shutdownNow();
    }
}
