package io.bridged.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import io.bridged.config.BridgeConfig;
import io.bridged.config.BridgeSettings;
import io.bridged.model.BridgeResponse;
import io.bridged.observability.SecurityAuditLog;
import io.bridged.runtime.BridgeDaemon;
import io.bridged.transport.BridgeClient;
import io.bridged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "bridged",
        mixinStandardHelpOptions = true,
        version = "bridged " + BridgeConfig.DAEMON_VERSION,
        description = "Bridge daemon serving database, crypto, FTP, HTTP, XML and lock-file capabilities over a Unix socket",
        subcommands = {
                BridgeCommand.ServeCommand.class,
                BridgeCommand.CallCommand.class,
                BridgeCommand.PingCommand.class,
                BridgeCommand.AuditVerifyCommand.class
        }
)
public final class BridgeCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(BridgeCommand.class);

    @Option(names = {"--socket"}, description = "Unix socket path",
            defaultValue = "${env:BRIDGED_SOCKET:-" + BridgeConfig.DEFAULT_SOCKET_PATH + "}")
    String socket;

    @Option(names = {"--data-dir"}, description = "Data directory (settings, audit log)",
            defaultValue = BridgeConfig.DEFAULT_DATA_DIR)
    String dataDir;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | call | ping | audit-verify");
    }

    BridgeConfig config() {
        return BridgeConfig.of(socket, dataDir);
    }

    BridgeClient client() {
        return new BridgeClient(config().socketPath());
    }

    @Command(name = "serve", description = "Run the bridge daemon in the foreground")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        BridgeCommand parent;

        @Option(names = {"--settings"}, description = "Settings JSON file (default: <data-dir>/bridged-settings.json)")
        String settingsFile;

        @Option(names = {"--metrics-port"}, defaultValue = "0", description = "Prometheus metrics port (0 disables)")
        int metricsPort;

        @Override
        public Integer call() throws Exception {
            BridgeConfig config = parent.config();
            Path settingsPath = settingsFile == null ? config.settingsFile() : Path.of(settingsFile);
            BridgeSettings settings = BridgeSettings.load(settingsPath);
            BridgeDaemon daemon = new BridgeDaemon(config, settings);
            daemon.start();

            HttpServer metricsServer = metricsPort > 0 ? startMetricsServer(daemon, metricsPort) : null;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (metricsServer != null) {
                    metricsServer.stop(0);
                }
                daemon.close();
            }, "bridged-shutdown-hook"));

            daemon.awaitShutdown();
            if (metricsServer != null) {
                metricsServer.stop(0);
            }
            return 0;
        }

        private static HttpServer startMetricsServer(BridgeDaemon daemon, int port) throws IOException {
            HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
            server.createContext("/metrics", exchange -> {
                byte[] bytes = daemon.metricsText().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });
            server.setExecutor(null);
            server.start();
            LOG.info("Metrics server listening on http://127.0.0.1:{}/metrics", port);
            return server;
        }
    }

    @Command(name = "call", description = "Send one request to a running daemon and print the response")
    static final class CallCommand implements Callable<Integer> {
        @ParentCommand
        BridgeCommand parent;

        @Parameters(index = "0", description = "Module name")
        String module;

        @Parameters(index = "1", description = "Function name")
        String function;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Parameters as a JSON object")
        String params;

        @Override
        public Integer call() throws Exception {
            JsonNode parsed = Jsons.mapper().readTree(params);
            if (!parsed.isObject()) {
                System.err.println("--params must be a JSON object");
                return 2;
            }
            BridgeResponse response = parent.client().call(module, function, (ObjectNode) parsed);
            System.out.println(Jsons.toJson(response));
            return response.success() ? 0 : 1;
        }
    }

    @Command(name = "ping", description = "Check that a daemon is answering on the socket")
    static final class PingCommand implements Callable<Integer> {
        @ParentCommand
        BridgeCommand parent;

        @Override
        public Integer call() {
            try {
                BridgeResponse response = parent.client().call("test", "ping", Jsons.object());
                System.out.println(Jsons.toJson(response));
                return response.success() ? 0 : 1;
            } catch (IOException e) {
                System.err.println("Daemon not reachable at " + parent.config().socketPath() + ": " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the security audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        BridgeCommand parent;

        @Override
        public Integer call() {
            SecurityAuditLog log = new SecurityAuditLog(parent.config().securityAuditFile());
            ObjectNode out = Jsons.object();
            out.put("audit_file", log.auditFile().toString());
            try {
                out.put("rows", log.verify());
                out.put("valid", true);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (IllegalStateException e) {
                out.put("valid", false);
                out.put("error", e.getMessage());
                System.out.println(Jsons.toJson(out));
                return 1;
            }
        }
    }
}
