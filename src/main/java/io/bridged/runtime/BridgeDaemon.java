package io.bridged.runtime;

import io.bridged.capability.CapabilityRegistry;
import io.bridged.capability.crypto.CryptoModule;
import io.bridged.capability.database.DatabaseModule;
import io.bridged.capability.ftp.FtpModule;
import io.bridged.capability.http.HttpModule;
import io.bridged.capability.lockfile.LockFileModule;
import io.bridged.capability.xml.XmlDomModule;
import io.bridged.config.BridgeConfig;
import io.bridged.config.BridgeSettings;
import io.bridged.model.HandleKind;
import io.bridged.observability.HealthEvaluator;
import io.bridged.observability.MetricsCollector;
import io.bridged.observability.PrometheusFormatter;
import io.bridged.observability.SecurityAuditLog;
import io.bridged.pool.HandlePool;
import io.bridged.security.InputValidator;
import io.bridged.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every piece of daemon state for the life of the process: the handle pool, metrics,
 * capability registry, reaper and socket listener are created here once and passed by
 * reference.
 */
public final class BridgeDaemon implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BridgeDaemon.class);

    private final BridgeConfig config;
    private final BridgeSettings settings;
    private final HandlePool pool;
    private final MetricsCollector metrics;
    private final StaleReaper reaper;
    private final HealthEvaluator healthEvaluator;
    private final SecurityAuditLog auditLog;
    private final CapabilityRegistry registry;
    private final Dispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final TransportListener listener;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public BridgeDaemon(BridgeConfig config, BridgeSettings settings) {
        this.config = config;
        this.settings = settings;
        this.pool = new HandlePool(settings.maxHandles());
        this.metrics = new MetricsCollector(settings.metricsWindowSize());
        this.reaper = new StaleReaper(pool, settings);
        this.healthEvaluator = new HealthEvaluator(settings);
        this.auditLog = new SecurityAuditLog(config.securityAuditFile());
        this.registry = buildRegistry();
        this.dispatcher = new Dispatcher(registry, new InputValidator(settings.limits()), pool, metrics, auditLog);
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "bridged-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.listener = new TransportListener(config.socketPath(), dispatcher, metrics, settings, scheduler);
    }

    private CapabilityRegistry buildRegistry() {
        SystemModule system = new SystemModule(this);
        List<String> disabled = new ArrayList<>(settings.disabledCapabilities());
        if (!settings.allowRemoteShutdown()) {
            disabled.add("system.shutdown");
        }
        return CapabilityRegistry.builder()
                .register(new TestModule(system))
                .register(system)
                .register(new DatabaseModule())
                .register(new CryptoModule())
                .register(new FtpModule(settings.idleThresholdMs(HandleKind.FTP_SESSION)))
                .register(new HttpModule())
                .register(new XmlDomModule())
                .register(new LockFileModule())
                .disable(disabled)
                .build();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        reaper.start(scheduler);
        listener.start();
        LOG.info("bridged {} started: socket={}, data={}, capabilities={}",
                BridgeConfig.DAEMON_VERSION, config.socketPath(), config.dataDir(), registry.allowedCapabilities().size());
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public boolean awaitShutdown(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    /**
     * Stops the daemon from a separate thread, so a handler can ask for shutdown and still
     * deliver its own response.
     */
    public void requestShutdown() {
        Thread t = new Thread(this::close, "bridged-shutdown");
        t.setDaemon(false);
        t.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Stopping bridged");
        listener.close();
        reaper.stop();
        scheduler.shutdownNow();
        int open = pool.size();
        pool.close();
        LOG.info("bridged stopped, released {} open handle(s)", open);
        stopped.countDown();
    }

    public String metricsText() {
        return PrometheusFormatter.format(metrics.snapshot(), metrics.security(), metrics.connections(), pool.stats());
    }

    public HealthEvaluator.HealthReport health() {
        return healthEvaluator.evaluate(
                metrics.snapshot(),
                metrics.connections(),
                pool.stats(),
                pool.views(),
                reaper.lastSweepAgeMs(),
                metrics.uptimeMs()
        );
    }

    public BridgeConfig config() {
        return config;
    }

    public BridgeSettings settings() {
        return settings;
    }

    public HandlePool pool() {
        return pool;
    }

    public MetricsCollector metrics() {
        return metrics;
    }

    public StaleReaper reaper() {
        return reaper;
    }

    public HealthEvaluator healthEvaluator() {
        return healthEvaluator;
    }

    public SecurityAuditLog auditLog() {
        return auditLog;
    }

    public CapabilityRegistry registry() {
        return registry;
    }
}
