package io.bridged.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.config.BridgeConfig;
import io.bridged.config.BridgeSettings;
import io.bridged.model.BridgeResponse;
import io.bridged.transport.BridgeClient;
import io.bridged.transport.RequestCodec;
import io.bridged.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class BridgeDaemonEndToEndTest {
    private Path root;
    private BridgeDaemon daemon;
    private BridgeClient client;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("bridged-e2e-test-");
        Path settingsFile = root.resolve("bridged-settings.json");
        Files.writeString(settingsFile, "{\n"
                + "  \"maxRequestBytes\": 1024,\n"
                + "  \"idleThresholdMs\": 1500,\n"
                + "  \"reaperIntervalMs\": 600000\n"
                + "}\n", StandardCharsets.UTF_8);
        BridgeConfig config = new BridgeConfig(root.resolve("bridged.sock"), root);
        daemon = new BridgeDaemon(config, BridgeSettings.load(settingsFile));
        daemon.start();
        client = new BridgeClient(config.socketPath());
    }

    @AfterEach
    void tearDown() throws IOException {
        if (daemon != null) {
            daemon.close();
        }
        deleteRecursively(root);
    }

    @Test
    void pingAnswersWithVersionAndEchoesInput() throws Exception {
        ObjectNode params = Jsons.object().put("hello", "world");
        BridgeResponse response = client.call("test", "ping", params);
        Assertions.assertTrue(response.success());
        Assertions.assertEquals("pong", response.result().path("message").asText());
        Assertions.assertEquals(BridgeConfig.DAEMON_VERSION, response.result().path("daemon_version").asText());
        Assertions.assertEquals("world", response.result().path("input").path("hello").asText());
    }

    @Test
    void idleDatabaseConnectionsSurviveUntilThresholdThenAreReapedWithTheirStatements() throws Exception {
        List<String> connectionIds = new ArrayList<>();
        List<String> statementIds = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            BridgeResponse connected = client.call("database", "connect",
                    Jsons.object().put("dsn", "dbi:SQLite:dbname=" + root.resolve("e2e-" + i + ".db")));
            Assertions.assertTrue(connected.success(), String.valueOf(connected.error()));
            String connectionId = connected.result().path("connection_id").asText();
            connectionIds.add(connectionId);
            BridgeResponse prepared = client.call("database", "prepare",
                    Jsons.object().put("connection_id", connectionId).put("sql", "SELECT 1"));
            Assertions.assertTrue(prepared.success(), String.valueOf(prepared.error()));
            statementIds.add(prepared.result().path("statement_id").asText());
        }

        JsonNode early = client.call("system", "cleanup", Jsons.object()).result();
        Assertions.assertEquals(0, early.path("cleaned_connections").asInt());
        Assertions.assertEquals(3, early.path("remaining_connections").asInt());
        Assertions.assertEquals(6, early.path("remaining_handles").asInt());

        JsonNode connections = client.call("system", "connections", Jsons.object()).result();
        Assertions.assertEquals(6, connections.path("total_connections").asInt());
        Assertions.assertEquals(3, connections.path("handles_by_kind").path("database_connection").asInt());

        Thread.sleep(2_000L);
        JsonNode late = client.call("system", "cleanup", Jsons.object()).result();
        Assertions.assertEquals(3, late.path("cleaned_connections").asInt());
        Assertions.assertEquals(0, late.path("remaining_connections").asInt());
        Assertions.assertEquals(0, late.path("remaining_handles").asInt());
        List<String> cleaned = new ArrayList<>();
        late.path("cleaned_ids").forEach(id -> cleaned.add(id.asText()));
        Assertions.assertTrue(cleaned.containsAll(connectionIds));

        BridgeResponse afterReap = client.call("database", "execute_statement",
                Jsons.object().put("statement_id", statementIds.get(0)));
        Assertions.assertFalse(afterReap.success());
        Assertions.assertEquals("handle", afterReap.errorType());
    }

    @Test
    void unknownCapabilityIsDeniedAndAudited() throws Exception {
        BridgeResponse denied = client.call("database", "malicious_function",
                Jsons.object().put("password", "hunter2"));
        Assertions.assertFalse(denied.success());
        Assertions.assertEquals("authorization", denied.errorType());
        Assertions.assertEquals("Function 'database.malicious_function' is not allowed (unauthorized capability)", denied.error());

        BridgeResponse shutdown = client.call("system", "shutdown", Jsons.object());
        Assertions.assertEquals("authorization", shutdown.errorType());

        Assertions.assertEquals(2, daemon.auditLog().verify());
        String audit = Files.readString(daemon.config().securityAuditFile(), StandardCharsets.UTF_8);
        Assertions.assertFalse(audit.contains("hunter2"));
        Assertions.assertEquals(2L, daemon.metrics().security().requestsRejected());
    }

    @Test
    void malformedAndOversizedRequestsGetTransportErrors() throws Exception {
        BridgeResponse malformed = RequestCodec.decodeResponse(
                client.exchange("{\"module\": \"test\", ".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertFalse(malformed.success());
        Assertions.assertEquals("transport", malformed.errorType());
        Assertions.assertTrue(malformed.error().startsWith("Invalid JSON"));

        String big = "{\"module\":\"test\",\"function\":\"ping\",\"params\":{\"blob\":\"" + "a".repeat(2048) + "\"}}";
        BridgeResponse oversized = RequestCodec.decodeResponse(client.exchange(big.getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals("transport", oversized.errorType());
        Assertions.assertEquals("Request too large: exceeds 1024 bytes", oversized.error());

        Assertions.assertTrue(client.call("test", "ping", Jsons.object()).success());
        Assertions.assertEquals(2L, daemon.metrics().connections().transportErrors());
    }

    @Test
    void systemReportsAreAvailable() throws Exception {
        client.call("test", "ping", Jsons.object());
        JsonNode health = client.call("system", "health", Jsons.object()).result();
        Assertions.assertEquals("healthy", health.path("overall_status").asText());

        JsonNode stats = client.call("system", "stats", Jsons.object()).result();
        Assertions.assertTrue(stats.path("requests_processed").asLong() >= 1L);

        JsonNode info = client.call("system", "info", Jsons.object()).result();
        Assertions.assertEquals(root.resolve("bridged.sock").toString(), info.path("socket_path").asText());

        Assertions.assertTrue(daemon.metricsText().contains("bridged_requests_total{outcome=\"success\"}"));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
