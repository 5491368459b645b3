package io.bridged.observability;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public final class MetricsCollector {
    private static final int MINUTE_BUCKETS = 60;

    private final Clock clock;
    private final long startedAtMs;
    private final long[] window;
    private int windowCursor;
    private int windowFilled;
    private final long[] minuteCounts = new long[MINUTE_BUCKETS];
    private final long[] minuteEpochSeconds = new long[MINUTE_BUCKETS];

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final LongAdder totalNanos = new LongAdder();
    private final ConcurrentMap<String, FunctionCounters> perFunction = new ConcurrentHashMap<>();

    private final AtomicLong validationFailures = new AtomicLong();
    private final AtomicLong requestsRejected = new AtomicLong();
    private final AtomicLong securityEvents = new AtomicLong();
    private final ConcurrentMap<String, AtomicLong> securityEventsByType = new ConcurrentHashMap<>();

    private final AtomicLong connectionsTotal = new AtomicLong();
    private final AtomicLong connectionsRejected = new AtomicLong();
    private final AtomicLong transportErrors = new AtomicLong();
    private final AtomicLong handlerTimeouts = new AtomicLong();
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger peakConnections = new AtomicInteger();

    public MetricsCollector(int windowSize) {
        this(windowSize, Clock.systemUTC());
    }

    public MetricsCollector(int windowSize, Clock clock) {
        this.clock = clock;
        this.startedAtMs = clock.millis();
        this.window = new long[Math.max(1, windowSize)];
    }

    public void record(String module, String function, long durationNanos, boolean success) {
        long safeNanos = Math.max(0L, durationNanos);
        totalRequests.incrementAndGet();
        if (success) {
            successfulRequests.incrementAndGet();
        } else {
            failedRequests.incrementAndGet();
        }
        totalNanos.add(safeNanos);
        perFunction.computeIfAbsent(module + "." + function, k -> new FunctionCounters())
                .record(safeNanos, success);
        synchronized (window) {
            window[windowCursor] = safeNanos;
            windowCursor = (windowCursor + 1) % window.length;
            if (windowFilled < window.length) {
                windowFilled++;
            }
        }
        long second = clock.millis() / 1000L;
        synchronized (minuteCounts) {
            int slot = (int) (second % MINUTE_BUCKETS);
            if (minuteEpochSeconds[slot] != second) {
                minuteEpochSeconds[slot] = second;
                minuteCounts[slot] = 0L;
            }
            minuteCounts[slot]++;
        }
    }

    public void recordValidationFailure(String eventType) {
        validationFailures.incrementAndGet();
        recordSecurityEvent(eventType);
    }

    public void recordRejection(String eventType) {
        requestsRejected.incrementAndGet();
        recordSecurityEvent(eventType);
    }

    private void recordSecurityEvent(String eventType) {
        securityEvents.incrementAndGet();
        securityEventsByType.computeIfAbsent(eventType, k -> new AtomicLong()).incrementAndGet();
    }

    public void connectionOpened() {
        connectionsTotal.incrementAndGet();
        int active = activeConnections.incrementAndGet();
        peakConnections.accumulateAndGet(active, Math::max);
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void connectionRejected() {
        connectionsRejected.incrementAndGet();
        recordRejection("connection_limit");
    }

    public void transportError() {
        transportErrors.incrementAndGet();
    }

    public void handlerTimeout() {
        handlerTimeouts.incrementAndGet();
    }

    public long uptimeMs() {
        return Math.max(0L, clock.millis() - startedAtMs);
    }

    public PerformanceSnapshot snapshot() {
        long total = totalRequests.get();
        long ok = successfulRequests.get();
        long failed = failedRequests.get();
        double uptimeSeconds = uptimeMs() / 1000.0d;

        long[] samples;
        synchronized (window) {
            samples = Arrays.copyOf(window, windowFilled);
        }
        Arrays.sort(samples);

        List<FunctionStats> breakdown = new ArrayList<>();
        for (Map.Entry<String, FunctionCounters> e : perFunction.entrySet()) {
            breakdown.add(e.getValue().stats(e.getKey()));
        }
        breakdown.sort(Comparator.comparingLong(FunctionStats::requests).reversed()
                .thenComparing(FunctionStats::moduleFunction));

        return new PerformanceSnapshot(
                total,
                ok,
                failed,
                round(total == 0L ? 0.0d : nanosToSeconds(totalNanos.sum()) / total),
                round(nanosToSeconds(percentileFromSorted(samples, 95.0d))),
                round(nanosToSeconds(percentileFromSorted(samples, 99.0d))),
                round(total / Math.max(1.0d, uptimeSeconds)),
                requestsLastMinute(),
                round(total == 0L ? 0.0d : (double) failed / (double) total),
                round(uptimeSeconds),
                samples.length,
                List.copyOf(breakdown)
        );
    }

    public SecuritySummary security() {
        Map<String, Long> byType = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> e : securityEventsByType.entrySet()) {
            byType.put(e.getKey(), e.getValue().get());
        }
        return new SecuritySummary(
                securityEvents.get(),
                validationFailures.get(),
                requestsRejected.get(),
                byType
        );
    }

    public ConnectionSummary connections() {
        return new ConnectionSummary(
                connectionsTotal.get(),
                Math.max(0, activeConnections.get()),
                peakConnections.get(),
                connectionsRejected.get(),
                transportErrors.get(),
                handlerTimeouts.get()
        );
    }

    private long requestsLastMinute() {
        long nowSecond = clock.millis() / 1000L;
        long sum = 0L;
        synchronized (minuteCounts) {
            for (int i = 0; i < MINUTE_BUCKETS; i++) {
                if (nowSecond - minuteEpochSeconds[i] < MINUTE_BUCKETS) {
                    sum += minuteCounts[i];
                }
            }
        }
        return sum;
    }

    static long percentileFromSorted(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0L;
        }
        int idx = (int) Math.ceil((percentile / 100.0d) * sorted.length) - 1;
        idx = Math.max(0, Math.min(sorted.length - 1, idx));
        return sorted[idx];
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0d;
    }

    private static double round(double value) {
        return Math.round(value * 1_000_000.0d) / 1_000_000.0d;
    }

    private static final class FunctionCounters {
        private final LongAdder requests = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final LongAdder nanos = new LongAdder();

        void record(long durationNanos, boolean success) {
            requests.increment();
            nanos.add(durationNanos);
            if (!success) {
                failures.increment();
            }
        }

        FunctionStats stats(String name) {
            long count = requests.sum();
            long failed = failures.sum();
            return new FunctionStats(
                    name,
                    count,
                    failed,
                    round(count == 0L ? 0.0d : (nanos.sum() / 1_000_000.0d) / count),
                    round(count == 0L ? 0.0d : (double) failed / (double) count)
            );
        }
    }

    public record PerformanceSnapshot(
            long totalRequests,
            long successfulRequests,
            long failedRequests,
            double avgResponseTime,
            double p95ResponseTime,
            double p99ResponseTime,
            double requestsPerSecond,
            long requestsPerMinute,
            double errorRate,
            double uptimeSeconds,
            int sampleWindow,
            List<FunctionStats> moduleBreakdown
    ) {
    }

    public record FunctionStats(
            String moduleFunction,
            long requests,
            long failures,
            double avgTimeMs,
            double errorRate
    ) {
    }

    public record SecuritySummary(
            long totalSecurityEvents,
            long validationFailures,
            long requestsRejected,
            Map<String, Long> eventsByType
    ) {
    }

    public record ConnectionSummary(
            long connectionsTotal,
            int activeConnections,
            int peakConnections,
            long rejectedConnections,
            long transportErrors,
            long handlerTimeouts
    ) {
    }
}
