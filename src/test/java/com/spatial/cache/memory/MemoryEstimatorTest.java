package com.spatial.cache.memory;

import com.spatial.cache.config.CacheConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEstimatorTest {

    private final MemoryEstimator estimator = new MemoryEstimator(CacheConfig.defaults());

    @Test
    void testEstimateMemoryUsage() {
        // count * 1.8KB / 1024, two decimals
        assertEquals(1.76, estimator.estimateMemoryUsage(1000));
        assertEquals(5.27, estimator.estimateMemoryUsage(3000));
        assertEquals(8.79, estimator.estimateMemoryUsage(5000));
        assertEquals(2.64, estimator.estimateMemoryUsage(1500));
    }

    @Test
    void testZeroRecords() {
        assertEquals(0.0, estimator.estimateMemoryUsage(0));
    }

    @Test
    void testSmallCountsRoundToZero() {
        assertEquals(0.0, estimator.estimateMemoryUsage(2));
    }

    @Test
    void testCustomPerRecordCost() {
        assertEquals(2.0, MemoryEstimator.estimateMemoryUsage(1024, 2.0));
    }

    @Test
    void testPressureLevels() {
        // 8MB ~ 4552 records, 10MB ~ 5689 records at 1.8KB each
        assertEquals(MemoryPressure.NORMAL, estimator.pressure(3000));
        assertEquals(MemoryPressure.WARNING, estimator.pressure(4600));
        assertEquals(MemoryPressure.CRITICAL, estimator.pressure(6000));

        assertFalse(estimator.isMemoryWarning(3000));
        assertTrue(estimator.isMemoryWarning(4600));
        assertFalse(estimator.isMemoryCritical(4600));
        assertTrue(estimator.isMemoryCritical(6000));
    }
}
