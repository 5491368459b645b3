package io.bridged.observability;

import io.bridged.config.BridgeSettings;
import io.bridged.model.HandleKind;
import io.bridged.pool.HandleStats;
import io.bridged.pool.HandleView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class HealthEvaluator {
    static final String PASS = "pass";
    static final String WARN = "warn";
    static final String FAIL = "fail";
    private static final long MIN_ERROR_RATE_SAMPLES = 10L;
    private static final double SLOW_P95_SECONDS = 1.0d;
    private static final double CONNECTION_WARN_RATIO = 0.9d;

    private final BridgeSettings settings;

    public HealthEvaluator(BridgeSettings settings) {
        this.settings = settings;
    }

    public HealthReport evaluate(
            MetricsCollector.PerformanceSnapshot perf,
            MetricsCollector.ConnectionSummary connections,
            HandleStats pool,
            List<HandleView> handles,
            long lastSweepAgeMs,
            long uptimeMs
    ) {
        Map<String, HealthCheck> checks = new LinkedHashMap<>();
        checks.put("handle_pool", poolCheck(pool));
        checks.put("error_rate", errorRateCheck(perf));
        checks.put("handle_age", handleAgeCheck(handles));
        checks.put("stale_reaper", reaperCheck(lastSweepAgeMs, uptimeMs));
        checks.put("connections", connectionCheck(connections));

        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, HealthCheck> e : checks.entrySet()) {
            if (WARN.equals(e.getValue().status())) {
                warnings.add(e.getKey() + ": " + e.getValue().message());
            } else if (FAIL.equals(e.getValue().status())) {
                errors.add(e.getKey() + ": " + e.getValue().message());
            }
        }
        String overall = !errors.isEmpty() ? "unhealthy" : (!warnings.isEmpty() ? "degraded" : "healthy");
        return new HealthReport(overall, Instant.now().toString(), checks, warnings, errors);
    }

    public PerformanceIndicators indicators(MetricsCollector.PerformanceSnapshot perf) {
        List<String> concerns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (perf.totalRequests() >= MIN_ERROR_RATE_SAMPLES && perf.errorRate() >= settings.errorRateWarn()) {
            concerns.add("High error rate: " + percent(perf.errorRate()));
            recommendations.add("Inspect failing module functions in module_performance");
        }
        if (perf.p95ResponseTime() > SLOW_P95_SECONDS) {
            concerns.add(String.format(Locale.ROOT, "Slow responses: p95 %.3fs", perf.p95ResponseTime()));
            recommendations.add("Check downstream latency of the slowest module functions");
        }
        for (MetricsCollector.FunctionStats stats : perf.moduleBreakdown()) {
            if (stats.requests() >= MIN_ERROR_RATE_SAMPLES && stats.errorRate() >= settings.errorRateFail()) {
                concerns.add(stats.moduleFunction() + " fails " + percent(stats.errorRate()) + " of calls");
            }
        }
        String overall;
        if (concerns.isEmpty()) {
            overall = "good";
        } else if (perf.errorRate() >= settings.errorRateFail() && perf.totalRequests() >= MIN_ERROR_RATE_SAMPLES) {
            overall = "poor";
        } else {
            overall = "fair";
        }
        return new PerformanceIndicators(overall, concerns, recommendations);
    }

    private HealthCheck poolCheck(HandleStats pool) {
        double ratio = pool.saturation();
        String usage = pool.total() + "/" + pool.maxHandles() + " handles in use";
        if (pool.total() >= pool.maxHandles()) {
            return new HealthCheck(FAIL, "Handle pool exhausted: " + usage);
        }
        if (ratio >= settings.poolWarnRatio()) {
            return new HealthCheck(WARN, "Handle pool near capacity: " + usage);
        }
        return new HealthCheck(PASS, usage);
    }

    private HealthCheck errorRateCheck(MetricsCollector.PerformanceSnapshot perf) {
        if (perf.totalRequests() < MIN_ERROR_RATE_SAMPLES) {
            return new HealthCheck(PASS, "Insufficient samples (" + perf.totalRequests() + " requests)");
        }
        String message = "Error rate " + percent(perf.errorRate()) + " over " + perf.totalRequests() + " requests";
        if (perf.errorRate() >= settings.errorRateFail()) {
            return new HealthCheck(FAIL, message);
        }
        if (perf.errorRate() >= settings.errorRateWarn()) {
            return new HealthCheck(WARN, message);
        }
        return new HealthCheck(PASS, message);
    }

    private HealthCheck handleAgeCheck(List<HandleView> handles) {
        int overdue = 0;
        long oldestIdleMs = 0L;
        for (HandleView view : handles) {
            oldestIdleMs = Math.max(oldestIdleMs, view.idleMs());
            if (view.idleMs() > settings.idleThresholdMs(HandleKind.fromString(view.kind()))) {
                overdue++;
            }
        }
        if (overdue > 0) {
            return new HealthCheck(WARN, overdue + " handle(s) idle past threshold awaiting cleanup");
        }
        return new HealthCheck(PASS, "Oldest idle handle " + (oldestIdleMs / 1000L) + "s");
    }

    private HealthCheck reaperCheck(long lastSweepAgeMs, long uptimeMs) {
        long interval = settings.reaperIntervalMs();
        if (lastSweepAgeMs < 0L) {
            if (uptimeMs > interval * 2L) {
                return new HealthCheck(WARN, "Stale reaper has not completed a sweep yet");
            }
            return new HealthCheck(PASS, "Stale reaper scheduled every " + interval + "ms");
        }
        if (lastSweepAgeMs > interval * 3L) {
            return new HealthCheck(FAIL, "Last reaper sweep " + lastSweepAgeMs + "ms ago");
        }
        return new HealthCheck(PASS, "Last reaper sweep " + lastSweepAgeMs + "ms ago");
    }

    private HealthCheck connectionCheck(MetricsCollector.ConnectionSummary connections) {
        int max = settings.maxConnections();
        String usage = connections.activeConnections() + "/" + max + " active connections";
        if ((double) connections.activeConnections() / (double) max >= CONNECTION_WARN_RATIO) {
            return new HealthCheck(WARN, "Connection load high: " + usage);
        }
        if (connections.rejectedConnections() > 0L) {
            return new HealthCheck(WARN, usage + ", " + connections.rejectedConnections() + " rejected since start");
        }
        return new HealthCheck(PASS, usage);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0d);
    }

    public record HealthCheck(String status, String message) {
    }

    public record HealthReport(
            String overallStatus,
            String timestamp,
            Map<String, HealthCheck> checks,
            List<String> warnings,
            List<String> errors
    ) {
    }

    public record PerformanceIndicators(
            String overallHealth,
            List<String> concerns,
            List<String> recommendations
    ) {
    }
}
