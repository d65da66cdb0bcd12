package com.spatial.cache.store;

import com.spatial.cache.config.CacheConfig;
import com.spatial.cache.model.GeoRecord;
import com.spatial.cache.model.Viewport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CleanupSchedulerTest {

    private GeoRecordStore store;
    private CleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        CacheConfig config = CacheConfig.builder()
                .cleanupDebounceMs(1)
                .recencyWindowMs(0)
                .build();
        store = new GeoRecordStore(config);
        store.updateViewport(Viewport.ofBounds(139.0, 35.0, 140.0, 36.0, 10));
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private void awaitCleanups(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (store.getStats().getCleanupCount() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void testRequestIgnoredBeforeStart() {
        scheduler = new CleanupScheduler(store, 60_000, 10);
        assertFalse(scheduler.requestCleanup());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testRequestedCleanupRuns() throws InterruptedException {
        scheduler = new CleanupScheduler(store, 60_000, 20);
        store.putAll(List.of(GeoRecord.builder("far").position(0.0, 0.0).build()));
        Thread.sleep(5);

        scheduler.start();
        assertTrue(scheduler.requestCleanup());
        awaitCleanups(1);

        assertTrue(store.getStats().getCleanupCount() >= 1);
        assertEquals(0, store.size());
    }

    @Test
    void testBurstOfRequestsIsDebounced() throws InterruptedException {
        scheduler = new CleanupScheduler(store, 60_000, 200);
        scheduler.start();

        for (int i = 0; i < 10; i++) {
            scheduler.requestCleanup();
        }
        awaitCleanups(1);
        Thread.sleep(300);

        assertEquals(1, store.getStats().getCleanupCount());
    }

    @Test
    void testPeriodicCleanup() throws InterruptedException {
        scheduler = new CleanupScheduler(store, 20, 1000);
        scheduler.start();

        awaitCleanups(2);

        assertTrue(store.getStats().getCleanupCount() >= 2);
    }

    @Test
    void testStopIsIdempotent() {
        scheduler = new CleanupScheduler(store);
        scheduler.start();
        scheduler.stop();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertFalse(scheduler.requestCleanup());
    }
}
