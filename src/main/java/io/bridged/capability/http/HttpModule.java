package io.bridged.capability.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless HTTP requests. Non-2xx statuses are ordinary results with {@code is_success=false};
 * only failures to get a response at all become errors.
 */
public final class HttpModule implements CapabilityModule {
    private static final Logger LOG = LoggerFactory.getLogger(HttpModule.class);
    private static final int DEFAULT_TIMEOUT_SECONDS = 180;
    private static final Pattern CHARSET = Pattern.compile("charset=\"?'?([^;\\s\"']+)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "date", "expect", "from", "host", "upgrade", "via", "warning"
    );
    private static final Map<Integer, String> REASONS = reasons();

    private final HttpClient verifyingClient;
    private final HttpClient trustingClient;

    public HttpModule() {
        this.verifyingClient = baseBuilder().build();
        this.trustingClient = baseBuilder().sslContext(trustAll()).sslParameters(noHostnameCheck()).build();
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("lwp_request", this::lwpRequest);
        ops.put("get", (params, ctx) -> send("GET", params, null));
        ops.put("post", (params, ctx) -> send("POST", params, body(params, "form", "content")));
        return ops;
    }

    private ObjectNode lwpRequest(Params params, InvocationContext ctx) throws InterruptedException {
        String method = params.text("method", "GET").trim().toUpperCase(Locale.ROOT);
        if (!method.matches("[A-Z]+")) {
            throw BridgeException.validation("invalid HTTP method: " + method);
        }
        return send(method, params, body(params, "form_encoded_content", "content"));
    }

    private ObjectNode send(String method, Params params, Body body) throws InterruptedException {
        URI uri = parseUri(params.requireNonBlank("url"));
        int timeoutSeconds = Math.max(1, params.integer("timeout", DEFAULT_TIMEOUT_SECONDS));
        boolean verifySsl = params.bool("verify_ssl", true);

        HttpRequest.Builder request = HttpRequest.newBuilder(uri).timeout(Duration.ofSeconds(timeoutSeconds));
        boolean contentTypeSet = false;
        for (Map.Entry<String, String> header : params.stringMap("headers").entrySet()) {
            String headerName = header.getKey().trim();
            if (RESTRICTED_HEADERS.contains(headerName.toLowerCase(Locale.ROOT))) {
                LOG.debug("Skipping restricted header {}", headerName);
                continue;
            }
            contentTypeSet |= headerName.equalsIgnoreCase("Content-Type");
            request.header(headerName, header.getValue());
        }
        if (body != null && body.contentType() != null && !contentTypeSet) {
            request.header("Content-Type", body.contentType());
        }
        request.method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body.text(), StandardCharsets.UTF_8));

        HttpClient client = verifySsl ? verifyingClient : trustingClient;
        long started = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw BridgeException.execution("Request failed: timed out after " + timeoutSeconds + "s", e);
        } catch (ConnectException e) {
            throw BridgeException.execution("Connection failed: " + describe(e), e);
        } catch (IOException e) {
            throw BridgeException.execution("Request failed: " + describe(e), e);
        }
        double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;

        int status = response.statusCode();
        String reason = reasonPhrase(status);
        ObjectNode out = Jsons.object();
        out.put("status_code", status);
        out.put("reason", reason);
        out.put("status_line", status + " " + reason);
        out.put("is_success", status >= 200 && status < 300);
        out.put("content", decode(response.body(), response.headers().firstValue("Content-Type").orElse("")));
        ObjectNode headers = out.putObject("headers");
        for (Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
            if (header.getKey().startsWith(":")) {
                continue;
            }
            headers.put(header.getKey(), String.join(", ", header.getValue()));
        }
        out.put("url", response.uri().toString());
        out.put("elapsed", Math.round(elapsed * 1_000_000.0) / 1_000_000.0);
        return out;
    }

    static Body body(Params params, String formName, String contentName) {
        if (params.has(formName)) {
            JsonNode form = params.raw().get(formName);
            String text = form.isObject() ? urlEncode(form) : form.asText();
            return new Body(text, "application/x-www-form-urlencoded");
        }
        if (params.has(contentName)) {
            return new Body(params.requireText(contentName), null);
        }
        return null;
    }

    static String urlEncode(JsonNode form) {
        StringBuilder out = new StringBuilder();
        Iterator<Map.Entry<String, JsonNode>> it = form.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(URLEncoder.encode(field.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(field.getValue().asText(), StandardCharsets.UTF_8));
        }
        return out.toString();
    }

    static String reasonPhrase(int status) {
        return REASONS.getOrDefault(status, "Unknown");
    }

    static String decode(byte[] body, String contentType) {
        Matcher matcher = CHARSET.matcher(contentType);
        if (matcher.find()) {
            try {
                return new String(body, Charset.forName(matcher.group(1)));
            } catch (IllegalArgumentException unknownCharset) {
                LOG.debug("Unknown response charset {}, using UTF-8", matcher.group(1));
            }
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    private static URI parseUri(String raw) {
        URI uri;
        try {
            uri = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            throw BridgeException.validation("invalid URL: " + raw);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
            throw BridgeException.validation("invalid URL: " + raw);
        }
        return uri;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static HttpClient.Builder baseBuilder() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30));
    }

    private static SSLContext trustAll() {
        TrustManager[] trustManagers = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to build non-verifying TLS context", e);
        }
    }

    private static SSLParameters noHostnameCheck() {
        SSLParameters parameters = new SSLParameters();
        parameters.setEndpointIdentificationAlgorithm("");
        return parameters;
    }

    private static Map<Integer, String> reasons() {
        Map<Integer, String> map = new LinkedHashMap<>();
        map.put(200, "OK");
        map.put(201, "Created");
        map.put(202, "Accepted");
        map.put(204, "No Content");
        map.put(300, "Multiple Choices");
        map.put(301, "Moved Permanently");
        map.put(302, "Found");
        map.put(304, "Not Modified");
        map.put(307, "Temporary Redirect");
        map.put(400, "Bad Request");
        map.put(401, "Unauthorized");
        map.put(403, "Forbidden");
        map.put(404, "Not Found");
        map.put(405, "Method Not Allowed");
        map.put(408, "Request Timeout");
        map.put(409, "Conflict");
        map.put(410, "Gone");
        map.put(500, "Internal Server Error");
        map.put(501, "Not Implemented");
        map.put(502, "Bad Gateway");
        map.put(503, "Service Unavailable");
        map.put(504, "Gateway Timeout");
        map.put(505, "HTTP Version Not Supported");
        return Map.copyOf(map);
    }

    record Body(String text, String contentType) {
    }
}
