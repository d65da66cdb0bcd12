package com.spatial.cache.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CleanupScheduler triggers store cleanups in the background.
 *
 * Two triggers:
 * - a periodic pass every {@code periodic_cleanup_interval_ms}
 * - {@link #requestCleanup()} after viewport changes or completed fetches,
 *   debounced so a burst of events yields a single pass
 */
public class CleanupScheduler {
    private static final Logger logger = LoggerFactory.getLogger(CleanupScheduler.class);

    private final GeoRecordStore store;
    private final long periodMs;
    private final long debounceMs;
    private final ScheduledExecutorService executor;

    private ScheduledFuture<?> pendingRequest;
    private volatile boolean running;

    public CleanupScheduler(GeoRecordStore store) {
        this(store, store.getConfig().getPeriodicCleanupIntervalMs(), store.getConfig().getCleanupDebounceMs());
    }

    public CleanupScheduler(GeoRecordStore store, long periodMs, long debounceMs) {
        this.store = store;
        this.periodMs = periodMs;
        this.debounceMs = debounceMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SpatialCache-Cleanup");
            t.setDaemon(true);
            return t;
        });
        this.running = false;
    }

    /**
     * Start the periodic cleanup. Should be called once during initialization.
     */
    public synchronized void start() {
        if (running) {
            logger.warn("CleanupScheduler already running");
            return;
        }

        running = true;
        executor.scheduleAtFixedRate(this::runCleanup, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("CleanupScheduler started with period {} ms, debounce {} ms", periodMs, debounceMs);
    }

    /**
     * Schedule a cleanup {@code debounceMs} from now, replacing any request
     * still pending.
     *
     * @return false if the scheduler is not running
     */
    public synchronized boolean requestCleanup() {
        if (!running) {
            return false;
        }
        if (pendingRequest != null) {
            pendingRequest.cancel(false);
        }
        pendingRequest = executor.schedule(this::runCleanup, debounceMs, TimeUnit.MILLISECONDS);
        logger.debug("Cleanup scheduled in {} ms", debounceMs);
        return true;
    }

    /**
     * Stop the scheduler, dropping any pending request. Should be called during shutdown.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        if (pendingRequest != null) {
            pendingRequest.cancel(false);
            pendingRequest = null;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
            logger.info("CleanupScheduler stopped");
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void runCleanup() {
        try {
            store.cleanup();
        } catch (Exception e) {
            logger.error("Error during scheduled cleanup", e);
        }
    }
}
