package io.bridged.observability;

import io.bridged.config.BridgeSettings;
import io.bridged.pool.HandleStats;
import io.bridged.pool.HandleView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class HealthEvaluatorTest {
    private final HealthEvaluator evaluator = new HealthEvaluator(BridgeSettings.defaults());

    @Test
    void quietDaemonIsHealthy() {
        HealthEvaluator.HealthReport report = evaluator.evaluate(
                new MetricsCollector(100).snapshot(), connections(0, 0), stats(0), List.of(), -1L, 1_000L);
        Assertions.assertEquals("healthy", report.overallStatus());
        Assertions.assertTrue(report.errors().isEmpty());
        Assertions.assertTrue(report.checks().get("error_rate").message().startsWith("Insufficient samples"));
    }

    @Test
    void fewFailuresDoNotTripErrorRate() {
        MetricsCollector metrics = new MetricsCollector(100);
        for (int i = 0; i < 5; i++) {
            metrics.record("test", "ping", 1_000L, false);
        }
        HealthEvaluator.HealthReport report = evaluator.evaluate(
                metrics.snapshot(), connections(0, 0), stats(0), List.of(), 10L, 1_000L);
        Assertions.assertEquals("pass", report.checks().get("error_rate").status());
    }

    @Test
    void highErrorRateAndFullPoolAreUnhealthy() {
        MetricsCollector metrics = new MetricsCollector(100);
        for (int i = 0; i < 20; i++) {
            metrics.record("database", "connect", 1_000L, i % 2 == 0);
        }
        HealthEvaluator.HealthReport report = evaluator.evaluate(
                metrics.snapshot(), connections(0, 0), stats(1000), List.of(), 10L, 1_000L);
        Assertions.assertEquals("unhealthy", report.overallStatus());
        Assertions.assertEquals("fail", report.checks().get("error_rate").status());
        Assertions.assertEquals("fail", report.checks().get("handle_pool").status());
        Assertions.assertEquals(2, report.errors().size());

        HealthEvaluator.PerformanceIndicators indicators = evaluator.indicators(metrics.snapshot());
        Assertions.assertEquals("poor", indicators.overallHealth());
        Assertions.assertTrue(indicators.concerns().stream().anyMatch(c -> c.startsWith("database.connect fails")));
    }

    @Test
    void overdueHandlesAndBusyConnectionsDegrade() {
        HandleView overdue = new HandleView("dbh_1_00000001", "database_connection", "x1", null, 0L, 0L, 400_000L, 3L);
        HealthEvaluator.HealthReport report = evaluator.evaluate(
                new MetricsCollector(100).snapshot(), connections(95, 0), stats(850), List.of(overdue), 10L, 1_000L);
        Assertions.assertEquals("degraded", report.overallStatus());
        Assertions.assertEquals("warn", report.checks().get("handle_age").status());
        Assertions.assertEquals("warn", report.checks().get("connections").status());
        Assertions.assertEquals("warn", report.checks().get("handle_pool").status());
    }

    @Test
    void reaperThatStoppedSweepingFails() {
        HealthEvaluator.HealthReport report = evaluator.evaluate(
                new MetricsCollector(100).snapshot(), connections(0, 0), stats(0), List.of(), 200_000L, 500_000L);
        Assertions.assertEquals("fail", report.checks().get("stale_reaper").status());

        HealthEvaluator.HealthReport neverSwept = evaluator.evaluate(
                new MetricsCollector(100).snapshot(), connections(0, 0), stats(0), List.of(), -1L, 500_000L);
        Assertions.assertEquals("warn", neverSwept.checks().get("stale_reaper").status());
    }

    private static MetricsCollector.ConnectionSummary connections(int active, long rejected) {
        return new MetricsCollector.ConnectionSummary(active, active, active, rejected, 0L, 0L);
    }

    private static HandleStats stats(int total) {
        return new HandleStats(total, 1000, Map.of(), List.of(), total, 0L, 0L);
    }
}
