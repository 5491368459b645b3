package io.bridged.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bridged.security.SensitiveDataMasker;
import io.bridged.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of denied and rejected requests. Each row carries the hash of the
 * previous row so truncation or edits are detectable with {@link #verify()}.
 */
public final class SecurityAuditLog {
    private static final Logger LOG = LoggerFactory.getLogger(SecurityAuditLog.class);
    private static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Path auditFile;
    private String previousHash;

    public SecurityAuditLog(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException raced) {
                    LOG.debug("Audit file {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(SecurityEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("event", event.eventType());
        row.put("module", event.module());
        row.put("function", event.function());
        row.put("exchange_id", event.exchangeId());
        row.put("error_type", event.errorType());
        row.put("message", event.message());
        row.put("params", SensitiveDataMasker.masked(event.params()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write security audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Recomputes the hash chain. Returns the number of verified rows, or throws on the first
     * broken link.
     */
    public synchronized int verify() {
        String expectedPrev = "";
        int rows = 0;
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                rows++;
                @SuppressWarnings("unchecked")
                Map<String, Object> row = COMPACT_MAPPER.readValue(line, LinkedHashMap.class);
                String hash = String.valueOf(row.remove("hash"));
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    throw new IllegalStateException("Audit chain broken at row " + rows + ": prev_hash mismatch");
                }
                if (!hash.equals(Hashing.sha256Hex(toCompactJson(row)))) {
                    throw new IllegalStateException("Audit chain broken at row " + rows + ": hash mismatch");
                }
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read security audit log", e);
        }
        return rows;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = COMPACT_MAPPER.readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Could not read previous audit hash from {}, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record SecurityEvent(
            String eventType,
            String module,
            String function,
            String exchangeId,
            String errorType,
            String message,
            JsonNode params
    ) {
    }
}
