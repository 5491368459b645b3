package io.bridged.transport;

import io.bridged.config.BridgeSettings;
import io.bridged.model.BridgeException;
import io.bridged.model.BridgeRequest;
import io.bridged.model.BridgeResponse;
import io.bridged.model.ErrorCategory;
import io.bridged.observability.MetricsCollector;
import io.bridged.runtime.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unix-domain socket front end. One request and one response per connection: the client writes
 * its JSON request and half-closes, the listener answers and closes.
 */
public final class TransportListener implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TransportListener.class);
    private static final int READ_CHUNK_BYTES = 64 * 1024;

    private final Path socketPath;
    private final Dispatcher dispatcher;
    private final MetricsCollector metrics;
    private final BridgeSettings settings;
    private final ScheduledExecutorService watchdog;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicLong exchangeSequence = new AtomicLong();
    private final ThreadPoolExecutor connectionWorkers;
    private final ThreadPoolExecutor handlerWorkers;
    private volatile boolean running;
    private ServerSocketChannel server;
    private Thread acceptThread;

    public TransportListener(
            Path socketPath,
            Dispatcher dispatcher,
            MetricsCollector metrics,
            BridgeSettings settings,
            ScheduledExecutorService watchdog
    ) {
        this.socketPath = socketPath;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.settings = settings;
        this.watchdog = watchdog;
        int max = settings.maxConnections();
        this.connectionWorkers = boundedPool(max, "bridged-conn-");
        this.handlerWorkers = boundedPool(max, "bridged-handler-");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            Files.createDirectories(socketPath.toAbsolutePath().getParent());
            Files.deleteIfExists(socketPath);
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            server.bind(UnixDomainSocketAddress.of(socketPath), settings.maxConnections());
        } catch (IOException e) {
            throw new RuntimeException("Failed to bind socket: " + socketPath, e);
        }
        restrictPermissions();
        running = true;
        acceptThread = new Thread(this::acceptLoop, "bridged-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOG.info("Listening on {} (max connections={})", socketPath, settings.maxConnections());
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            server.close();
        } catch (IOException e) {
            LOG.warn("Failed to close server socket {}: {}", socketPath, e.getMessage());
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        connectionWorkers.shutdown();
        handlerWorkers.shutdown();
        try {
            if (!connectionWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionWorkers.shutdownNow();
            }
            if (!handlerWorkers.awaitTermination(1, TimeUnit.SECONDS)) {
                handlerWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connectionWorkers.shutdownNow();
            handlerWorkers.shutdownNow();
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOG.warn("Failed to remove socket file {}: {}", socketPath, e.getMessage());
        }
        LOG.info("Listener on {} stopped", socketPath);
    }

    private void acceptLoop() {
        while (running) {
            SocketChannel channel;
            try {
                channel = server.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                LOG.warn("Accept failed on {}: {}", socketPath, e.getMessage());
                continue;
            }
            String exchangeId = "x" + exchangeSequence.incrementAndGet();
            if (inFlight.incrementAndGet() > settings.maxConnections()) {
                inFlight.decrementAndGet();
                metrics.connectionRejected();
                LOG.warn("[{}] Rejected connection: {} exchanges in flight", exchangeId, settings.maxConnections());
                respondAndClose(channel, BridgeResponse.failure(
                        ErrorCategory.TRANSPORT, "Daemon busy: too many concurrent connections"), exchangeId);
                continue;
            }
            try {
                connectionWorkers.execute(() -> serve(channel, exchangeId));
            } catch (RuntimeException e) {
                inFlight.decrementAndGet();
                LOG.warn("[{}] Could not schedule connection: {}", exchangeId, e.getMessage());
                closeQuietly(channel, exchangeId);
            }
        }
    }

    private void serve(SocketChannel channel, String exchangeId) {
        metrics.connectionOpened();
        try {
            byte[] payload;
            try {
                payload = readRequest(channel, exchangeId);
            } catch (BridgeException e) {
                metrics.transportError();
                LOG.warn("[{}] {}", exchangeId, e.getMessage());
                respondAndClose(channel, BridgeResponse.failure(e), exchangeId);
                return;
            } catch (IOException e) {
                metrics.transportError();
                LOG.warn("[{}] Request read aborted: {}", exchangeId, e.getMessage());
                closeQuietly(channel, exchangeId);
                return;
            }

            BridgeRequest request;
            try {
                request = RequestCodec.decode(payload);
            } catch (BridgeException e) {
                metrics.transportError();
                LOG.warn("[{}] Undecodable request: {}", exchangeId, e.getMessage());
                respondAndClose(channel, BridgeResponse.failure(e), exchangeId);
                return;
            }

            respondAndClose(channel, dispatchWithBudget(request, exchangeId), exchangeId);
        } finally {
            metrics.connectionClosed();
            inFlight.decrementAndGet();
        }
    }

    private byte[] readRequest(SocketChannel channel, String exchangeId) throws IOException {
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            LOG.warn("[{}] Request read timed out after {}ms", exchangeId, settings.requestReadTimeoutMs());
            closeQuietly(channel, exchangeId);
        }, settings.requestReadTimeoutMs(), TimeUnit.MILLISECONDS);
        try {
            long limit = settings.maxRequestBytes();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK_BYTES);
            while (true) {
                buffer.clear();
                int n = channel.read(buffer);
                if (n < 0) {
                    break;
                }
                if (out.size() + (long) n > limit) {
                    throw BridgeException.transport("Request too large: exceeds " + limit + " bytes");
                }
                out.write(buffer.array(), 0, n);
            }
            if (out.size() == 0) {
                throw BridgeException.transport("Empty request received");
            }
            return out.toByteArray();
        } finally {
            timer.cancel(false);
        }
    }

    private BridgeResponse dispatchWithBudget(BridgeRequest request, String exchangeId) {
        Future<BridgeResponse> future;
        try {
            future = handlerWorkers.submit(() -> dispatcher.dispatch(request, exchangeId));
        } catch (RuntimeException e) {
            LOG.warn("[{}] Handler pool unavailable: {}", exchangeId, e.getMessage());
            return BridgeResponse.failure(ErrorCategory.INTERNAL, "Daemon is shutting down");
        }
        try {
            return future.get(settings.handlerTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.handlerTimeout();
            LOG.warn("[{}] {} exceeded {}ms, abandoning exchange", exchangeId, request.capability(), settings.handlerTimeoutMs());
            return BridgeResponse.failure(BridgeException.timeout(
                    "Handler timed out after " + settings.handlerTimeoutMs() + "ms: " + request.capability()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return BridgeResponse.failure(BridgeException.timeout("Exchange interrupted: " + request.capability()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("[{}] {} crashed", exchangeId, request.capability(), cause);
            return BridgeResponse.failure(ErrorCategory.INTERNAL, "Internal error: " + cause);
        }
    }

    private void respondAndClose(SocketChannel channel, BridgeResponse response, String exchangeId) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(RequestCodec.encode(response));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            LOG.warn("[{}] Failed to write response: {}", exchangeId, e.getMessage());
        } finally {
            closeQuietly(channel, exchangeId);
        }
    }

    private void closeQuietly(SocketChannel channel, String exchangeId) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.debug("[{}] Close failed: {}", exchangeId, e.getMessage());
        }
    }

    private void restrictPermissions() {
        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            LOG.warn("Could not restrict permissions on {}: {}", socketPath, e.getMessage());
        }
    }

    private static ThreadPoolExecutor boundedPool(int max, String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                max,
                max,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
