package io.bridged.capability.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.ErrorCategory;
import io.bridged.pool.HandlePool;
import io.bridged.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

final class HttpModuleTest {
    private final HttpModule module = new HttpModule();
    private final InvocationContext ctx = new InvocationContext("x1", new HandlePool(4));
    private HttpServer server;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/hello", exchange -> respond(exchange, 200, "text/plain; charset=utf-8",
                "hello " + exchange.getRequestMethod() + " " + header(exchange, "X-Trace")));
        server.createContext("/echo", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            respond(exchange, 201, "text/plain", header(exchange, "Content-Type") + "|" + body);
        });
        server.createContext("/latin", exchange -> respond(exchange, 200, "text/plain; charset=ISO-8859-1", "café"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "text/plain", "no such thing"));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().set("Location", "/hello");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void getReturnsStatusBodyAndHeaders() throws Exception {
        ObjectNode params = params().put("url", base + "/hello");
        params.putObject("headers").put("X-Trace", "abc").put("Host", "ignored.example");
        ObjectNode result = call("get", params);
        Assertions.assertEquals(200, result.path("status_code").asInt());
        Assertions.assertEquals("OK", result.path("reason").asText());
        Assertions.assertEquals("200 OK", result.path("status_line").asText());
        Assertions.assertTrue(result.path("is_success").asBoolean());
        Assertions.assertEquals("hello GET abc", result.path("content").asText());
        Assertions.assertTrue(result.path("elapsed").asDouble() >= 0.0);
        Assertions.assertEquals(base + "/hello", result.path("url").asText());
    }

    @Test
    void formPostIsUrlEncoded() throws Exception {
        ObjectNode params = params().put("url", base + "/echo");
        params.putObject("form").put("name", "Ada Lovelace").put("lang", "en&fr");
        ObjectNode result = call("post", params);
        Assertions.assertEquals(201, result.path("status_code").asInt());
        Assertions.assertEquals("application/x-www-form-urlencoded|name=Ada+Lovelace&lang=en%26fr",
                result.path("content").asText());
    }

    @Test
    void lwpRequestSendsRawContentWithCallerContentType() throws Exception {
        ObjectNode params = params().put("method", "put").put("url", base + "/echo").put("content", "{\"a\":1}");
        params.putObject("headers").put("Content-Type", "application/json");
        ObjectNode result = call("lwp_request", params);
        Assertions.assertEquals("application/json|{\"a\":1}", result.path("content").asText());
    }

    @Test
    void nonSuccessStatusIsAResultNotAnError() throws Exception {
        ObjectNode result = call("get", params().put("url", base + "/missing"));
        Assertions.assertEquals(404, result.path("status_code").asInt());
        Assertions.assertEquals("404 Not Found", result.path("status_line").asText());
        Assertions.assertFalse(result.path("is_success").asBoolean());
        Assertions.assertEquals("no such thing", result.path("content").asText());
    }

    @Test
    void redirectsAreFollowedAndCharsetHonoured() throws Exception {
        ObjectNode redirected = call("get", params().put("url", base + "/moved"));
        Assertions.assertEquals(200, redirected.path("status_code").asInt());
        Assertions.assertEquals(base + "/hello", redirected.path("url").asText());

        Assertions.assertEquals("café", call("get", params().put("url", base + "/latin")).path("content").asText());
    }

    @Test
    void invalidInputIsValidationAndRefusedConnectionIsExecution() throws IOException {
        BridgeException scheme = Assertions.assertThrows(BridgeException.class,
                () -> call("get", params().put("url", "ftp://example.com/file")));
        Assertions.assertEquals(ErrorCategory.VALIDATION, scheme.category());

        BridgeException method = Assertions.assertThrows(BridgeException.class,
                () -> call("lwp_request", params().put("url", base + "/hello").put("method", "GE T")));
        Assertions.assertEquals(ErrorCategory.VALIDATION, method.category());

        int closedPort;
        try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = reserved.getLocalPort();
        }
        BridgeException refused = Assertions.assertThrows(BridgeException.class,
                () -> call("get", params().put("url", "http://127.0.0.1:" + closedPort + "/").put("timeout", 5)));
        Assertions.assertEquals(ErrorCategory.EXECUTION, refused.category());
    }

    @Test
    void helpersCoverUnknownReasonsAndCharsets() {
        Assertions.assertEquals("Unknown", HttpModule.reasonPhrase(599));
        Assertions.assertEquals("Gateway Timeout", HttpModule.reasonPhrase(504));
        Assertions.assertEquals("plain", HttpModule.decode("plain".getBytes(StandardCharsets.UTF_8), "text/plain; charset=bogus-xyz"));
    }

    private ObjectNode call(String function, ObjectNode params) throws Exception {
        return module.operations().get(function).invoke(new Params(params), ctx);
    }

    private static ObjectNode params() {
        return Jsons.object();
    }

    private static String header(HttpExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        Charset charset = contentType.contains("ISO-8859-1") ? StandardCharsets.ISO_8859_1 : StandardCharsets.UTF_8;
        byte[] bytes = body.getBytes(charset);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
