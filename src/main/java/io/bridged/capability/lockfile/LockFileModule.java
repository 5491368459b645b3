package io.bridged.capability.lockfile;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import io.bridged.pool.HandleView;
import io.bridged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class LockFileModule implements CapabilityModule {
    private static final Logger LOG = LoggerFactory.getLogger(LockFileModule.class);
    private static final int DEFAULT_HOLD_SECONDS = 90;
    private static final Pattern ENV_VAR = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Function<String, String> environment;

    public LockFileModule() {
        this(System::getenv);
    }

    LockFileModule(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public String name() {
        return "lockfile";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("make", this::make);
        ops.put("trylock", this::trylock);
        ops.put("release", this::release);
        ops.put("cleanup_manager", this::cleanupManager);
        return ops;
    }

    private ObjectNode make(Params params, InvocationContext ctx) {
        boolean nfs = params.bool("nfs", false);
        // max_age is the older name for hold
        int hold = params.has("max_age")
                ? params.integer("max_age", DEFAULT_HOLD_SECONDS)
                : params.integer("hold", DEFAULT_HOLD_SECONDS);
        if (hold < 0) {
            throw BridgeException.validation("parameter 'hold' must not be negative");
        }
        String id = ctx.pool().create(
                HandleKind.LOCK_MANAGER, new LockManager(nfs, Duration.ofSeconds(hold)), ctx.exchangeId());
        ObjectNode out = Jsons.object();
        out.put("manager_id", id);
        out.put("nfs", nfs);
        out.put("hold", hold);
        return out;
    }

    private ObjectNode trylock(Params params, InvocationContext ctx) throws Exception {
        String managerId = params.requireText("manager_id");
        String filename = params.requireNonBlank("filename");
        String pattern = params.text("lockfile_pattern", null);
        Path lockfile = Path.of(expand(pattern == null ? filename + ".lock" : pattern.replace("%F", filename)));

        return ctx.pool().withHandle(managerId, HandleKind.LOCK_MANAGER, h -> {
            LockManager manager = h.state(LockManager.class);
            acquire(lockfile, filename, manager);
            String lockId;
            try {
                lockId = ctx.pool().create(
                        HandleKind.LOCK,
                        new LockFile(filename, lockfile),
                        ctx.exchangeId(),
                        managerId
                );
            } catch (BridgeException e) {
                Files.deleteIfExists(lockfile);
                throw e;
            }
            ObjectNode out = Jsons.object();
            out.put("lock_id", lockId);
            out.put("filename", filename);
            out.put("lockfile", lockfile.toString());
            return out;
        });
    }

    private ObjectNode release(Params params, InvocationContext ctx) {
        String lockId = params.requireText("lock_id");
        LockFile lock = ctx.pool().require(lockId, HandleKind.LOCK).state(LockFile.class);
        ctx.pool().removeExpected(lockId, HandleKind.LOCK);
        ObjectNode out = Jsons.object();
        out.put("lock_id", lockId);
        out.put("filename", lock.filename());
        out.put("lockfile", lock.lockfile().toString());
        out.put("released", true);
        return out;
    }

    private ObjectNode cleanupManager(Params params, InvocationContext ctx) {
        String managerId = params.requireText("manager_id");
        ctx.pool().require(managerId, HandleKind.LOCK_MANAGER);
        List<String> locks = ctx.pool().views().stream()
                .filter(view -> managerId.equals(view.parentId()))
                .map(HandleView::id)
                .collect(Collectors.toList());
        ctx.pool().removeExpected(managerId, HandleKind.LOCK_MANAGER);
        ObjectNode out = Jsons.object();
        out.put("manager_id", managerId);
        out.put("locks_released", locks.size());
        ArrayNode ids = out.putArray("lock_ids");
        locks.forEach(ids::add);
        return out;
    }

    private static void acquire(Path lockfile, String filename, LockManager manager) throws IOException {
        Path parent = lockfile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        breakIfStale(lockfile, manager.hold());
        String pid = Long.toString(ProcessHandle.current().pid());
        if (manager.nfs()) {
            // exclusive create is not atomic over NFS; a hard link is
            Path staging = lockfile.resolveSibling(lockfile.getFileName() + "." + pid + "." + System.nanoTime());
            Files.writeString(staging, pid, StandardCharsets.UTF_8);
            try {
                Files.createLink(lockfile, staging);
            } catch (FileAlreadyExistsException e) {
                throw lockExists(filename);
            } finally {
                Files.deleteIfExists(staging);
            }
            return;
        }
        try {
            Files.createFile(lockfile);
        } catch (FileAlreadyExistsException e) {
            throw lockExists(filename);
        }
        Files.writeString(lockfile, pid, StandardCharsets.UTF_8);
    }

    private static BridgeException lockExists(String filename) {
        return BridgeException.execution("Could not acquire lock on " + filename + ": Lock file exists");
    }

    private static void breakIfStale(Path lockfile, Duration hold) throws IOException {
        long modified;
        try {
            modified = Files.getLastModifiedTime(lockfile).toMillis();
        } catch (NoSuchFileException absent) {
            return;
        }
        long ageMs = System.currentTimeMillis() - modified;
        if (ageMs > hold.toMillis()) {
            LOG.info("Breaking stale lock file {} (age {} ms)", lockfile, ageMs);
            Files.deleteIfExists(lockfile);
        }
    }

    String expand(String raw) {
        Matcher matcher = ENV_VAR.matcher(raw);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = environment.apply(name);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
