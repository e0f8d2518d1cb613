package io.meshroute.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ServiceInstanceTest {

    @Test
    void testHealthRequiresScoreAndFewErrors() {
        ServiceInstance instance = new ServiceInstance("i-1", "localhost", 8001);
        assertTrue(instance.isHealthy());

        instance.setHealthScore(0.5);
        assertFalse(instance.isHealthy(), "score must be strictly above 0.5");

        instance.setHealthScore(0.9);
        instance.addErrors(10);
        assertFalse(instance.isHealthy());

        instance.decayErrors();
        assertTrue(instance.isHealthy());
    }

    @Test
    void testConnectionsNeverNegative() {
        ServiceInstance instance = new ServiceInstance("i-1", "localhost", 8001);

        assertEquals(0, instance.releaseConnection());
        instance.acquireConnection();
        assertEquals(1, instance.getActiveConnections());
        instance.releaseConnection();
        instance.releaseConnection();
        assertEquals(0, instance.getActiveConnections());
    }

    @Test
    void testResponseWindowEvictsOldest() {
        ResponseTimeWindow window = new ResponseTimeWindow();
        for (int i = 1; i <= 150; i++) {
            window.record(i);
        }

        assertEquals(100, window.size());
        List<Double> samples = window.snapshot();
        assertEquals(150.0, samples.get(0), "most recent first");
        assertEquals(51.0, samples.get(99));
        assertEquals(100.5, window.average(), 1e-9);
    }

    @Test
    void testAverageWithoutSamplesIsZero() {
        ServiceInstance instance = new ServiceInstance("i-1", "localhost", 8001, 3);

        assertEquals(0.0, instance.getAverageResponseTime());
        assertEquals("http://localhost:8001", instance.url());
        assertEquals(3, instance.getWeight());
    }

    @Test
    void testRejectsZeroWeight() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceInstance("i-1", "localhost", 8001, 0));
    }

    @Test
    void testConcurrentUpdates() throws InterruptedException {
        ServiceInstance instance = new ServiceInstance("i-1", "localhost", 8001);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);

        for (int t = 0; t < 8; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 1_000; i++) {
                    instance.acquireConnection();
                    instance.recordResponseTime(0.2);
                    instance.releaseConnection();
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(0, instance.getActiveConnections());
        assertEquals(100, instance.getResponseTimes().size());
        assertEquals(0.2, instance.getAverageResponseTime(), 1e-9);
    }
}
