package com.propertyintel.leads.scheduler;

import com.propertyintel.leads.config.LeadRadarProperties;
import com.propertyintel.leads.service.PropertyCache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Periodically force-refreshes the property cache on a dedicated thread.
 *
 * The loop refreshes immediately, then waits for the interval or a stop signal.
 * A failed refresh is logged and the loop carries on; readers keep seeing the
 * previous snapshot. {@link #stop()} signals the loop and blocks until the
 * worker thread has exited.
 *
 * Enable/disable with ENABLE_SCHEDULER or lead-radar.scheduling.enabled.
 */
@Component
@Slf4j
public class CacheRefreshScheduler {

    static final long MIN_INTERVAL_SECONDS = 60;

    private final PropertyCache cache;
    private final boolean enabled;
    private final Duration interval;
    private final Duration shutdownAwait;

    private ExecutorService executor;
    private CountDownLatch stopSignal;
    private Future<?> task;

    @Autowired
    public CacheRefreshScheduler(PropertyCache cache, LeadRadarProperties properties) {
        this(cache,
                properties.getScheduling().isEnabled(),
                Duration.ofSeconds(Math.max(MIN_INTERVAL_SECONDS, properties.getScheduling().getRefreshIntervalSeconds())),
                Duration.ofSeconds(properties.getScheduling().getShutdownAwaitSeconds()));
    }

    CacheRefreshScheduler(PropertyCache cache, boolean enabled, Duration interval, Duration shutdownAwait) {
        this.cache = cache;
        this.enabled = enabled;
        this.interval = interval;
        this.shutdownAwait = shutdownAwait;
    }

    @PostConstruct
    public void onStartup() {
        start();
    }

    /**
     * Start the refresh loop if scheduling is enabled. Calling again while the
     * loop is running returns the running task.
     *
     * @return the loop's future, or null when scheduling is disabled
     */
    public synchronized Future<?> start() {
        if (!enabled) {
            log.info("Cache refresh scheduler disabled; skipping background refresh task");
            return null;
        }
        if (task != null && !task.isDone()) {
            return task;
        }

        stopSignal = new CountDownLatch(1);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "property-cache-refresh");
            t.setDaemon(true);
            return t;
        });
        CountDownLatch signal = stopSignal;
        task = executor.submit(() -> runLoop(signal));
        return task;
    }

    /** Signal the loop to stop and wait for the worker to exit. */
    @PreDestroy
    public synchronized void stop() {
        if (task == null) return;

        stopSignal.countDown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownAwait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh loop did not stop within {}s; interrupting", shutdownAwait.toSeconds());
                executor.shutdownNow();
                executor.awaitTermination(shutdownAwait.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            task = null;
            executor = null;
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void runLoop(CountDownLatch signal) {
        log.info("Starting property cache refresh loop (interval={}s)", interval.toSeconds());
        try {
            do {
                try {
                    cache.refresh();
                    log.debug("Property cache refresh complete");
                } catch (Exception e) {
                    log.error("Property cache refresh failed: {}", e.getMessage(), e);
                }
            } while (!signal.await(interval.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopping property cache refresh loop");
    }
}
