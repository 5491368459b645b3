package io.bridged.runtime;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.Operation;
import io.bridged.config.BridgeConfig;
import io.bridged.config.BridgeSettings;
import io.bridged.model.HandleKind;
import io.bridged.observability.HealthEvaluator;
import io.bridged.observability.MetricsCollector;
import io.bridged.pool.HandleStats;
import io.bridged.pool.HandleView;
import io.bridged.util.Jsons;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SystemModule implements CapabilityModule {
    private static final int TOP_MODULES = 10;

    private final BridgeDaemon daemon;

    SystemModule(BridgeDaemon daemon) {
        this.daemon = daemon;
    }

    @Override
    public String name() {
        return "system";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("health", (params, ctx) -> Jsons.tree(daemon.health()));
        ops.put("performance", (params, ctx) -> performance());
        ops.put("connections", (params, ctx) -> connections());
        ops.put("metrics", (params, ctx) -> metrics());
        ops.put("stats", (params, ctx) -> stats());
        ops.put("cleanup", (params, ctx) -> Jsons.tree(daemon.reaper().sweep()));
        ops.put("info", (params, ctx) -> info());
        ops.put("shutdown", (params, ctx) -> {
            daemon.requestShutdown();
            ObjectNode out = Jsons.object();
            out.put("shutting_down", true);
            out.put("open_handles", daemon.pool().size());
            return out;
        });
        return ops;
    }

    ObjectNode performance() {
        MetricsCollector.PerformanceSnapshot perf = daemon.metrics().snapshot();
        ObjectNode out = Jsons.object();
        out.set("performance_metrics", Jsons.tree(perf));
        ObjectNode modulePerformance = Jsons.object();
        List<MetricsCollector.FunctionStats> top = perf.moduleBreakdown()
                .subList(0, Math.min(TOP_MODULES, perf.moduleBreakdown().size()));
        modulePerformance.set("top_modules", Jsons.wire().valueToTree(top));
        modulePerformance.put("tracked_functions", perf.moduleBreakdown().size());
        out.set("module_performance", modulePerformance);
        HealthEvaluator.PerformanceIndicators indicators = daemon.healthEvaluator().indicators(perf);
        out.set("health_indicators", Jsons.tree(indicators));
        out.put("timestamp", Instant.now().toString());
        return out;
    }

    ObjectNode connections() {
        BridgeSettings settings = daemon.settings();
        List<HandleView> views = daemon.pool().views();
        ArrayNode rows = Jsons.wire().createArrayNode();
        int stale = 0;
        long now = daemon.pool().nowMs();
        for (HandleView view : views) {
            boolean isStale = view.idleMs() > settings.idleThresholdMs(HandleKind.fromString(view.kind()));
            if (isStale) {
                stale++;
            }
            ObjectNode row = rows.addObject();
            row.put("connection_id", view.id());
            row.put("kind", view.kind());
            row.put("parent_id", view.parentId());
            row.put("duration_seconds", Math.max(0L, now - view.createdAtMs()) / 1000.0d);
            row.put("idle_time", view.idleMs() / 1000.0d);
            row.put("requests_count", view.useCount());
            row.put("status", isStale ? "stale" : "active");
        }
        ObjectNode out = Jsons.object();
        out.put("total_connections", views.size());
        out.put("active_connections", views.size() - stale);
        out.put("stale_connections", stale);
        ObjectNode limits = out.putObject("connection_limits");
        limits.put("max_concurrent", settings.maxConnections());
        limits.put("max_handles", settings.maxHandles());
        limits.put("stale_timeout", settings.idleThresholdMs() / 1000L);
        out.set("connections", rows);
        out.set("handles_by_kind", Jsons.wire().valueToTree(daemon.pool().stats().perKindCounts()));
        out.set("socket_connections", Jsons.tree(daemon.metrics().connections()));
        return out;
    }

    ObjectNode metrics() {
        MetricsCollector metrics = daemon.metrics();
        MetricsCollector.PerformanceSnapshot perf = metrics.snapshot();
        ObjectNode out = Jsons.object();
        out.put("timestamp", Instant.now().toString());

        ObjectNode info = out.putObject("daemon_info");
        info.put("version", BridgeConfig.DAEMON_VERSION);
        info.put("uptime_seconds", perf.uptimeSeconds());
        info.put("uptime_formatted", formatUptime(metrics.uptimeMs()));
        info.put("java_version", System.getProperty("java.version"));

        Runtime rt = Runtime.getRuntime();
        ObjectNode resources = out.putObject("resource_status");
        resources.put("memory_mb", (rt.totalMemory() - rt.freeMemory()) / (1024L * 1024L));
        resources.put("memory_max_mb", rt.maxMemory() / (1024L * 1024L));
        resources.put("cpu_percent", processCpuPercent());
        resources.put("requests_per_minute", perf.requestsPerMinute());
        resources.put("handle_count", daemon.pool().size());
        resources.put("threads", Thread.activeCount());

        out.set("performance_metrics", Jsons.tree(perf));
        out.set("security_summary", Jsons.tree(metrics.security()));
        out.set("connection_summary", Jsons.tree(metrics.connections()));
        out.set("handle_pool", Jsons.tree(daemon.pool().stats()));

        ObjectNode modules = out.putObject("module_status");
        modules.set("loaded_modules", Jsons.wire().valueToTree(daemon.registry().allowedModules()));
        modules.set("available_modules", Jsons.wire().valueToTree(daemon.registry().modules()));
        modules.put("allowed_capabilities", daemon.registry().allowedCapabilities().size());
        return out;
    }

    ObjectNode stats() {
        MetricsCollector metrics = daemon.metrics();
        MetricsCollector.PerformanceSnapshot perf = metrics.snapshot();
        MetricsCollector.SecuritySummary security = metrics.security();
        MetricsCollector.ConnectionSummary connections = metrics.connections();
        HandleStats handles = daemon.pool().stats();
        BridgeSettings settings = daemon.settings();

        ObjectNode out = Jsons.object();
        out.put("requests_processed", perf.totalRequests());
        out.put("requests_failed", perf.failedRequests());
        out.put("requests_rejected", security.requestsRejected());
        out.put("validation_failures", security.validationFailures());
        out.put("security_events", security.totalSecurityEvents());
        out.put("connections_total", connections.connectionsTotal());
        out.put("active_connections", connections.activeConnections());
        out.put("peak_connections", connections.peakConnections());
        out.put("handles_open", handles.total());
        out.put("handles_reaped", daemon.reaper().reapedTotal());
        out.put("reaper_sweeps", daemon.reaper().sweeps());
        out.set("performance_summary", Jsons.tree(perf));

        ObjectNode validation = out.putObject("validation_config");
        validation.put("strict_mode", true);
        validation.put("max_string_length", settings.maxStringLength());
        validation.put("max_array_length", settings.maxCollectionLength());
        validation.put("max_object_depth", settings.maxDepth());
        validation.put("max_param_count", settings.maxParamCount());

        ObjectNode securityMetrics = out.putObject("security_metrics");
        securityMetrics.put("total_events", security.totalSecurityEvents());
        securityMetrics.set("events_by_type", Jsons.wire().valueToTree(security.eventsByType()));
        return out;
    }

    ObjectNode info() {
        BridgeSettings settings = daemon.settings();
        ObjectNode out = Jsons.object();
        out.put("daemon_version", BridgeConfig.DAEMON_VERSION);
        out.put("socket_path", daemon.config().socketPath().toString());
        out.put("uptime", daemon.metrics().uptimeMs() / 1000.0d);
        out.put("pid", ProcessHandle.current().pid());
        out.put("java_version", System.getProperty("java.version"));
        ObjectNode configuration = out.putObject("configuration");
        configuration.put("max_connections", settings.maxConnections());
        configuration.put("max_request_size", settings.maxRequestBytes());
        configuration.put("connection_timeout", settings.handlerTimeoutMs() / 1000L);
        configuration.put("read_timeout", settings.requestReadTimeoutMs() / 1000L);
        configuration.put("cleanup_interval", settings.reaperIntervalMs() / 1000L);
        configuration.put("idle_threshold", settings.idleThresholdMs() / 1000L);
        configuration.put("max_handles", settings.maxHandles());
        out.set("modules", Jsons.wire().valueToTree(daemon.registry().allowedModules()));
        return out;
    }

    static String formatUptime(long uptimeMs) {
        long seconds = uptimeMs / 1000L;
        long days = seconds / 86_400L;
        long hours = (seconds % 86_400L) / 3_600L;
        long minutes = (seconds % 3_600L) / 60L;
        long secs = seconds % 60L;
        return String.format("%dd %02dh %02dm %02ds", days, hours, minutes, secs);
    }

    private static double processCpuPercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getProcessCpuLoad();
            return load < 0.0d ? 0.0d : Math.round(load * 10_000.0d) / 100.0d;
        }
        return 0.0d;
    }
}
