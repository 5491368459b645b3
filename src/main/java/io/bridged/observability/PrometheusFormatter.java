package io.bridged.observability;

import io.bridged.pool.HandleStats;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(
            MetricsCollector.PerformanceSnapshot perf,
            MetricsCollector.SecuritySummary security,
            MetricsCollector.ConnectionSummary connections,
            HandleStats handles
    ) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "bridged_requests_total", "Dispatched requests grouped by outcome", "outcome", "success", perf.successfulRequests());
        appendGauge(sb, "bridged_requests_total", "Dispatched requests grouped by outcome", "outcome", "failure", perf.failedRequests());
        appendDouble(sb, "bridged_error_rate", "Failed requests divided by total requests", null, null, perf.errorRate());
        appendDouble(sb, "bridged_response_time_seconds", "Average and percentile response time", "stat", "avg", perf.avgResponseTime());
        appendDouble(sb, "bridged_response_time_seconds", "Average and percentile response time", "stat", "p95", perf.p95ResponseTime());
        appendDouble(sb, "bridged_response_time_seconds", "Average and percentile response time", "stat", "p99", perf.p99ResponseTime());
        appendGauge(sb, "bridged_requests_last_minute", "Requests completed in the last 60 seconds", null, null, perf.requestsPerMinute());
        appendDouble(sb, "bridged_uptime_seconds", "Daemon uptime in seconds", null, null, perf.uptimeSeconds());
        for (MetricsCollector.FunctionStats stats : perf.moduleBreakdown()) {
            appendGauge(sb, "bridged_function_requests_total", "Requests per module function", "function", stats.moduleFunction(), stats.requests());
        }
        for (MetricsCollector.FunctionStats stats : perf.moduleBreakdown()) {
            appendGauge(sb, "bridged_function_failures_total", "Failed requests per module function", "function", stats.moduleFunction(), stats.failures());
        }

        appendGauge(sb, "bridged_security_events_total", "Security events recorded", null, null, security.totalSecurityEvents());
        appendGauge(sb, "bridged_validation_failures_total", "Requests rejected by input validation", null, null, security.validationFailures());
        appendGauge(sb, "bridged_requests_rejected_total", "Requests rejected by authorization or connection limits", null, null, security.requestsRejected());
        appendMapGauge(sb, "bridged_security_events_by_type", "Security events grouped by type", "event_type", security.eventsByType());

        appendGauge(sb, "bridged_connections_active", "Connections currently being served", null, null, connections.activeConnections());
        appendGauge(sb, "bridged_connections_peak", "Peak concurrent connections", null, null, connections.peakConnections());
        appendGauge(sb, "bridged_connections_total", "Accepted connections since start", null, null, connections.connectionsTotal());
        appendGauge(sb, "bridged_connections_rejected_total", "Connections refused at the concurrency limit", null, null, connections.rejectedConnections());
        appendGauge(sb, "bridged_transport_errors_total", "Exchanges that failed before dispatch", null, null, connections.transportErrors());
        appendGauge(sb, "bridged_handler_timeouts_total", "Dispatches abandoned after the handler time budget", null, null, connections.handlerTimeouts());

        appendGauge(sb, "bridged_handles", "Pooled handles currently open", null, null, handles.total());
        appendMapGauge(sb, "bridged_handles_by_kind", "Pooled handles grouped by kind", "kind", handles.perKindCounts());
        appendGauge(sb, "bridged_handles_max", "Configured handle pool capacity", null, null, handles.maxHandles());
        appendGauge(sb, "bridged_handles_rejected_total", "Handle creations refused because the pool was full", null, null, handles.rejectedTotal());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendDouble(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, String.format(Locale.ROOT, "%.6f", value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
