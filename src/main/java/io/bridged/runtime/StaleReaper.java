package io.bridged.runtime;

import io.bridged.config.BridgeSettings;
import io.bridged.model.HandleKind;
import io.bridged.pool.HandlePool;
import io.bridged.pool.HandleView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public final class StaleReaper {
    private static final Logger LOG = LoggerFactory.getLogger(StaleReaper.class);

    private final HandlePool pool;
    private final BridgeSettings settings;
    private final AtomicLong lastSweepAtMs = new AtomicLong(-1L);
    private final AtomicLong sweeps = new AtomicLong();
    private final AtomicLong reapedTotal = new AtomicLong();
    private ScheduledFuture<?> schedule;

    public StaleReaper(HandlePool pool, BridgeSettings settings) {
        this.pool = pool;
        this.settings = settings;
    }

    public synchronized void start(ScheduledExecutorService scheduler) {
        if (schedule != null) {
            return;
        }
        long interval = settings.reaperIntervalMs();
        schedule = scheduler.scheduleWithFixedDelay(this::scheduledSweep, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Stale reaper started (interval={}ms, idle threshold={}ms)", interval, settings.idleThresholdMs());
    }

    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }

    public CleanupReport sweep() {
        List<String> cleanedIds = new ArrayList<>();
        List<CleanedHandle> details = new ArrayList<>();
        for (HandleView view : pool.views()) {
            long threshold = settings.idleThresholdMs(HandleKind.fromString(view.kind()));
            if (view.idleMs() <= threshold) {
                continue;
            }
            Optional<HandleView> evicted = pool.evictIfIdle(view.id(), threshold);
            if (evicted.isPresent()) {
                HandleView removed = evicted.get();
                cleanedIds.add(removed.id());
                details.add(new CleanedHandle(removed.id(), removed.kind(), removed.idleMs() / 1000.0d));
            }
        }
        lastSweepAtMs.set(pool.nowMs());
        sweeps.incrementAndGet();
        reapedTotal.addAndGet(cleanedIds.size());
        List<HandleView> remaining = pool.views();
        int remainingConnections = 0;
        for (HandleView view : remaining) {
            if (HandleKind.fromString(view.kind()).isConnection()) {
                remainingConnections++;
            }
        }
        CleanupReport report = new CleanupReport(
                cleanedIds.size(),
                remainingConnections,
                remaining.size(),
                List.copyOf(cleanedIds),
                List.copyOf(details),
                Instant.now().toString()
        );
        if (!cleanedIds.isEmpty()) {
            LOG.info("Reaped {} idle handle(s), {} remaining: {}", cleanedIds.size(), report.remainingHandles(), cleanedIds);
        }
        return report;
    }

    public long lastSweepAgeMs() {
        long last = lastSweepAtMs.get();
        return last < 0L ? -1L : Math.max(0L, pool.nowMs() - last);
    }

    public long sweeps() {
        return sweeps.get();
    }

    public long reapedTotal() {
        return reapedTotal.get();
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // A throwing task would cancel the schedule.
            LOG.error("Stale reaper sweep failed", e);
        }
    }

    public record CleanedHandle(String connectionId, String kind, double idleTime) {
    }

    public record CleanupReport(
            int cleanedConnections,
            int remainingConnections,
            int remainingHandles,
            List<String> cleanedIds,
            List<CleanedHandle> connectionsDetails,
            String timestamp
    ) {
    }
}
