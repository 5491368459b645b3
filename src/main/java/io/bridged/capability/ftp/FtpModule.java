package io.bridged.capability.ftp;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import io.bridged.pool.Handle;
import io.bridged.pool.HandlePool;
import io.bridged.pool.HandleView;
import io.bridged.util.Jsons;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class FtpModule implements CapabilityModule {
    private static final int DEFAULT_PORT = 21;
    private static final int DEFAULT_TIMEOUT_SECONDS = 60;
    private static final long DEFAULT_IDLE_THRESHOLD_MS = 300_000L;

    private final long idleThresholdMs;

    public FtpModule() {
        this(DEFAULT_IDLE_THRESHOLD_MS);
    }

    public FtpModule(long idleThresholdMs) {
        this.idleThresholdMs = idleThresholdMs;
    }

    @Override
    public String name() {
        return "ftp";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("new", this::open);
        ops.put("login", this::login);
        ops.put("cwd", (params, ctx) -> session(params, ctx, "cwd", (session, out) -> {
            String dir = params.text("directory", params.text("dir", "/"));
            check(session, session.client().changeWorkingDirectory(dir), "cwd " + dir);
            out.put("directory", dir);
        }));
        ops.put("pwd", (params, ctx) -> session(params, ctx, "pwd", (session, out) -> {
            String dir = session.client().printWorkingDirectory();
            check(session, dir != null, "pwd");
            out.put("directory", dir);
        }));
        ops.put("dir", (params, ctx) -> session(params, ctx, "dir", (session, out) -> {
            String path = params.text("path", null);
            FTPFile[] files = path == null ? session.client().listFiles() : session.client().listFiles(path);
            ArrayNode listing = out.putArray("listing");
            for (FTPFile file : files) {
                listing.add(file.getRawListing());
            }
            out.put("count", files.length);
        }));
        ops.put("ls", (params, ctx) -> session(params, ctx, "ls", (session, out) -> {
            String path = params.text("path", null);
            String[] names = path == null ? session.client().listNames() : session.client().listNames(path);
            check(session, names != null, "ls");
            ArrayNode list = out.putArray("names");
            for (String name : names) {
                list.add(name);
            }
            out.put("count", names.length);
        }));
        ops.put("binary", (params, ctx) -> session(params, ctx, "binary", (session, out) -> {
            check(session, session.client().setFileType(FTP.BINARY_FILE_TYPE), "binary");
            session.transferMode("binary");
            out.put("mode", "binary");
        }));
        ops.put("ascii", (params, ctx) -> session(params, ctx, "ascii", (session, out) -> {
            check(session, session.client().setFileType(FTP.ASCII_FILE_TYPE), "ascii");
            session.transferMode("ascii");
            out.put("mode", "ascii");
        }));
        ops.put("get", (params, ctx) -> session(params, ctx, "get", (session, out) -> {
            String remote = params.requireNonBlank("remote_file");
            Path local = Path.of(params.text("local_file", baseName(remote)));
            boolean ok;
            try (OutputStream os = Files.newOutputStream(local)) {
                ok = session.client().retrieveFile(remote, os);
            }
            if (!ok) {
                Files.deleteIfExists(local);
            }
            check(session, ok, "get " + remote);
            out.put("remote_file", remote);
            out.put("local_file", local.toString());
            out.put("bytes", Files.size(local));
        }));
        ops.put("put", (params, ctx) -> session(params, ctx, "put", (session, out) -> {
            Path local = Path.of(params.requireNonBlank("local_file"));
            if (!Files.isRegularFile(local)) {
                throw BridgeException.execution("Local file not found: " + local);
            }
            String remote = params.text("remote_file", local.getFileName().toString());
            boolean ok;
            try (InputStream is = Files.newInputStream(local)) {
                ok = session.client().storeFile(remote, is);
            }
            check(session, ok, "put " + remote);
            out.put("local_file", local.toString());
            out.put("remote_file", remote);
        }));
        ops.put("delete", (params, ctx) -> session(params, ctx, "delete", (session, out) -> {
            String remote = params.requireNonBlank("remote_file");
            check(session, session.client().deleteFile(remote), "delete " + remote);
            out.put("deleted", remote);
        }));
        ops.put("rename", (params, ctx) -> session(params, ctx, "rename", (session, out) -> {
            String from = params.requireNonBlank("old_name");
            String to = params.requireNonBlank("new_name");
            check(session, session.client().rename(from, to), "rename " + from);
            out.put("old_name", from);
            out.put("new_name", to);
        }));
        ops.put("message", (params, ctx) -> session(params, ctx, "message", (session, out) -> {
            out.put("message", session.lastMessage());
        }));
        ops.put("quit", this::quit);
        ops.put("get_connection_info", this::connectionInfo);
        ops.put("get_pool_stats", (params, ctx) -> poolStats(ctx.pool()));
        ops.put("cleanup_stale_connections", this::cleanupStale);
        return ops;
    }

    private ObjectNode open(Params params, InvocationContext ctx) {
        String host = params.requireNonBlank("host");
        int port = params.integer("port", DEFAULT_PORT);
        int timeoutSeconds = Math.max(1, params.integer("timeout", DEFAULT_TIMEOUT_SECONDS));
        boolean passive = params.bool("passive", true);

        FTPClient client = new FTPClient();
        client.setConnectTimeout(timeoutSeconds * 1000);
        client.setDefaultTimeout(timeoutSeconds * 1000);
        client.setDataTimeout(Duration.ofSeconds(timeoutSeconds));
        try {
            client.connect(host, port);
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                String reply = client.getReplyString();
                BridgeException refused = BridgeException.execution(
                        "Connection failed: " + (reply == null ? "" : reply.trim()));
                disconnect(client, refused);
                throw refused;
            }
            client.setSoTimeout(timeoutSeconds * 1000);
            if (passive) {
                client.enterLocalPassiveMode();
            }
        } catch (IOException e) {
            BridgeException failure = BridgeException.execution(
                    "Connection failed: " + host + ":" + port + ": " + e.getMessage(), e);
            disconnect(client, failure);
            throw failure;
        }
        FtpSession session = new FtpSession(client, host, port);
        String id = ctx.pool().create(HandleKind.FTP_SESSION, session, ctx.exchangeId());
        ObjectNode out = Jsons.object();
        out.put("connection_id", id);
        out.put("host", host);
        out.put("port", port);
        out.put("message", session.lastMessage());
        return out;
    }

    private ObjectNode login(Params params, InvocationContext ctx) throws Exception {
        String user = params.text("user", "anonymous");
        String password = params.text("password", "anonymous@");
        return session(params, ctx, "login", (session, out) -> {
            boolean ok = session.client().login(user, password);
            check(session, ok, "login as " + user);
            session.markLoggedIn();
            session.client().setFileType(FTP.BINARY_FILE_TYPE);
            session.transferMode("binary");
            out.put("logged_in", true);
            out.put("user", user);
        });
    }

    private ObjectNode quit(Params params, InvocationContext ctx) {
        String id = params.requireText("connection_id");
        ctx.pool().removeExpected(id, HandleKind.FTP_SESSION);
        ObjectNode out = Jsons.object();
        out.put("connection_id", id);
        out.put("closed", true);
        return out;
    }

    private ObjectNode connectionInfo(Params params, InvocationContext ctx) throws Exception {
        String id = params.requireText("connection_id");
        HandlePool pool = ctx.pool();
        return pool.withHandle(id, HandleKind.FTP_SESSION, h -> {
            FtpSession session = h.state(FtpSession.class);
            long now = pool.nowMs();
            ObjectNode out = Jsons.object();
            out.put("connection_id", id);
            out.put("host", session.host());
            out.put("port", session.port());
            out.put("state", session.state());
            out.put("transfer_mode", session.transferMode());
            out.put("created_at", h.createdAtMs() / 1000.0d);
            out.put("last_used", h.lastUsedAtMs() / 1000.0d);
            out.put("age", Math.max(0L, now - h.createdAtMs()) / 1000.0d);
            out.put("idle_time", Math.max(0L, now - h.lastUsedAtMs()) / 1000.0d);
            return out;
        });
    }

    static ObjectNode poolStats(HandlePool pool) {
        int total = 0;
        int connected = 0;
        int loggedIn = 0;
        ArrayNode ids = Jsons.wire().createArrayNode();
        for (HandleView view : pool.views()) {
            if (!HandleKind.FTP_SESSION.wireName().equals(view.kind())) {
                continue;
            }
            Optional<Handle> handle = pool.find(view.id());
            if (handle.isEmpty()) {
                continue;
            }
            total++;
            if (handle.get().state(FtpSession.class).loggedIn()) {
                loggedIn++;
            } else {
                connected++;
            }
            ids.add(view.id());
        }
        ObjectNode out = Jsons.object();
        out.put("total_connections", total);
        out.put("connected", connected);
        out.put("logged_in", loggedIn);
        out.set("connection_ids", ids);
        return out;
    }

    private ObjectNode cleanupStale(Params params, InvocationContext ctx) {
        long threshold = params.has("max_idle")
                ? Math.max(0L, params.integer("max_idle", 0)) * 1000L
                : idleThresholdMs;
        HandlePool pool = ctx.pool();
        ArrayNode removedIds = Jsons.wire().createArrayNode();
        for (HandleView view : pool.views()) {
            if (HandleKind.FTP_SESSION.wireName().equals(view.kind())
                    && pool.evictIfIdle(view.id(), threshold).isPresent()) {
                removedIds.add(view.id());
            }
        }
        ObjectNode out = Jsons.object();
        out.put("removed", removedIds.size());
        out.set("removed_ids", removedIds);
        return out;
    }

    private ObjectNode session(Params params, InvocationContext ctx, String action, SessionCall call) throws Exception {
        String id = params.requireText("connection_id");
        return ctx.pool().withHandle(id, HandleKind.FTP_SESSION, h -> {
            FtpSession session = h.state(FtpSession.class);
            ObjectNode out = Jsons.object();
            try {
                call.run(session, out);
            } catch (IOException e) {
                throw BridgeException.execution("FTP " + action + " failed: " + e.getMessage(), e);
            }
            session.recordReply();
            out.put("message", session.lastMessage());
            return out;
        });
    }

    private static void check(FtpSession session, boolean ok, String what) {
        if (!ok) {
            throw BridgeException.execution("FTP " + what + " failed: " + session.recordReply());
        }
    }

    private static void disconnect(FTPClient client, BridgeException failure) {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static String baseName(String remote) {
        int slash = remote.lastIndexOf('/');
        return slash < 0 ? remote : remote.substring(slash + 1);
    }

    @FunctionalInterface
    private interface SessionCall {
        void run(FtpSession session, ObjectNode out) throws IOException;
    }
}
