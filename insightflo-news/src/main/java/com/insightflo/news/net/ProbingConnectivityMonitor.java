package com.insightflo.news.net;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Detects connectivity by periodically probing the API host with a HEAD request.
 * Any HTTP response counts as connected; a transport failure counts as {@link NetworkType#NONE}.
 * The probe cannot tell Wi-Fi from cellular, so a reachable host is reported as {@link NetworkType#OTHER}.
 */
public class ProbingConnectivityMonitor implements ConnectivityMonitor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProbingConnectivityMonitor.class);

    private final String probeUrl;
    private final OkHttpClient client;
    private final ScheduledExecutorService scheduler;
    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

    private Duration probeInterval = Duration.ofSeconds(30);
    private volatile NetworkType current = NetworkType.OTHER;
    private ScheduledFuture<?> probeTask;

    public ProbingConnectivityMonitor(String probeUrl, Duration timeout) {
        this.probeUrl = probeUrl;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .callTimeout(timeout)
            .build();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connectivity-probe");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Set probe interval (default: 30 seconds).
     */
    public ProbingConnectivityMonitor withInterval(Duration interval) {
        this.probeInterval = interval;
        return this;
    }

    public synchronized void start() {
        if (probeTask != null) return;
        log.info("Starting connectivity probe against {} every {}", probeUrl, probeInterval);
        probeTask = scheduler.scheduleWithFixedDelay(this::probe, 0,
            probeInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Probe once and publish the result.
     */
    public NetworkType probe() {
        NetworkType observed;
        Request request = new Request.Builder().url(probeUrl).head().build();
        try (Response response = client.newCall(request).execute()) {
            observed = NetworkType.OTHER;
            log.trace("Probe {} -> {}", probeUrl, response.code());
        } catch (IOException e) {
            observed = NetworkType.NONE;
            log.debug("Probe {} failed: {}", probeUrl, e.getMessage());
        }
        update(observed);
        return observed;
    }

    void update(NetworkType observed) {
        NetworkType previous = current;
        if (previous == observed) return;
        current = observed;
        log.info("Connectivity changed: {} -> {}", previous, observed);
        for (ConnectivityListener listener : listeners) {
            try {
                listener.onConnectivityChanged(previous, observed);
            } catch (RuntimeException e) {
                log.warn("Connectivity listener failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public NetworkType current() {
        return current;
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectivityListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        synchronized (this) {
            if (probeTask != null) {
                probeTask.cancel(false);
                probeTask = null;
            }
        }
        listeners.clear();
        scheduler.shutdownNow();
        log.info("Stopped connectivity probe");
    }
}
