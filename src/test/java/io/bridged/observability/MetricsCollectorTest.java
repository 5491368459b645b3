package io.bridged.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

final class MetricsCollectorTest {

    @Test
    void totalsGrowByExactlyTheNumberOfRecordedRequests() throws Exception {
        MetricsCollector metrics = new MetricsCollector(100);
        long before = metrics.snapshot().totalRequests();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 200; i++) {
                int n = i;
                pool.submit(() -> metrics.record("test", "ping", 1_000_000L * (n % 7), n % 10 != 0));
            }
        } finally {
            pool.shutdown();
            Assertions.assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        MetricsCollector.PerformanceSnapshot perf = metrics.snapshot();
        Assertions.assertEquals(before + 200L, perf.totalRequests());
        Assertions.assertEquals(180L, perf.successfulRequests());
        Assertions.assertEquals(20L, perf.failedRequests());
        Assertions.assertEquals(0.1d, perf.errorRate(), 0.000001d);
        Assertions.assertEquals(100, perf.sampleWindow());
        Assertions.assertEquals(200L, perf.requestsPerMinute());
    }

    @Test
    void percentilesAreOrderedAndErrorRateBounded() {
        MetricsCollector metrics = new MetricsCollector(1000);
        for (int i = 1; i <= 100; i++) {
            metrics.record("database", "execute_statement", i * 1_000_000L, i % 3 != 0);
        }
        MetricsCollector.PerformanceSnapshot perf = metrics.snapshot();
        Assertions.assertEquals(0.095d, perf.p95ResponseTime(), 0.000001d);
        Assertions.assertEquals(0.099d, perf.p99ResponseTime(), 0.000001d);
        Assertions.assertTrue(perf.p95ResponseTime() <= perf.p99ResponseTime());
        Assertions.assertTrue(perf.errorRate() >= 0.0d && perf.errorRate() <= 1.0d);
        Assertions.assertEquals(0.0505d, perf.avgResponseTime(), 0.000001d);
        Assertions.assertEquals(1, perf.moduleBreakdown().size());
        Assertions.assertEquals("database.execute_statement", perf.moduleBreakdown().get(0).moduleFunction());
        Assertions.assertEquals(33L, perf.moduleBreakdown().get(0).failures());
    }

    @Test
    void emptyCollectorReportsZeros() {
        MetricsCollector.PerformanceSnapshot perf = new MetricsCollector(10).snapshot();
        Assertions.assertEquals(0L, perf.totalRequests());
        Assertions.assertEquals(0.0d, perf.errorRate());
        Assertions.assertEquals(0.0d, perf.p99ResponseTime());
        Assertions.assertEquals(0, MetricsCollector.percentileFromSorted(new long[0], 95.0d));
    }

    @Test
    void securityAndConnectionCountersAreSeparate() {
        MetricsCollector metrics = new MetricsCollector(10);
        metrics.recordRejection("unauthorized_capability");
        metrics.recordValidationFailure("input_validation");
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed();
        metrics.connectionRejected();
        metrics.transportError();

        MetricsCollector.SecuritySummary security = metrics.security();
        Assertions.assertEquals(3L, security.totalSecurityEvents());
        Assertions.assertEquals(1L, security.validationFailures());
        Assertions.assertEquals(2L, security.requestsRejected());
        Assertions.assertEquals(1L, security.eventsByType().get("connection_limit"));

        MetricsCollector.ConnectionSummary connections = metrics.connections();
        Assertions.assertEquals(2L, connections.connectionsTotal());
        Assertions.assertEquals(1, connections.activeConnections());
        Assertions.assertEquals(2, connections.peakConnections());
        Assertions.assertEquals(1L, connections.rejectedConnections());
        Assertions.assertEquals(1L, connections.transportErrors());
        Assertions.assertEquals(0L, metrics.snapshot().totalRequests());
    }
}
