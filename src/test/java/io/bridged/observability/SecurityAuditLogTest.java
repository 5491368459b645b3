package io.bridged.observability;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class SecurityAuditLogTest {
    @Test
    void chainSurvivesReopenAndMasksSecrets() throws Exception {
        Path root = Files.createTempDirectory("bridged-audit-test-");
        try {
            Path file = root.resolve("audit").resolve("security.log");
            SecurityAuditLog first = new SecurityAuditLog(file);
            Assertions.assertEquals("", first.currentHash());
            first.log(event("database", "connect", "hunter2"));
            first.log(event("crypto", "new", "s3cret"));
            String head = first.currentHash();

            SecurityAuditLog reopened = new SecurityAuditLog(file);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(event("ftp", "login", "pw"));
            Assertions.assertEquals(3, reopened.verify());

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(content.contains("hunter2"));
            Assertions.assertFalse(content.contains("s3cret"));
            Assertions.assertTrue(content.contains("\"password\":\"***\""));
            Assertions.assertTrue(content.contains("\"dsn\":\"dbi:SQLite:dbname=x\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedOrRemovedRowsBreakTheChain() throws Exception {
        Path root = Files.createTempDirectory("bridged-audit-test-");
        try {
            Path file = root.resolve("security.log");
            SecurityAuditLog log = new SecurityAuditLog(file);
            for (int i = 0; i < 3; i++) {
                log.log(event("database", "op" + i, "pw"));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));

            List<String> edited = new ArrayList<>(lines);
            edited.set(1, edited.get(1).replace("\"op1\"", "\"opX\""));
            Files.write(file, edited, StandardCharsets.UTF_8);
            IllegalStateException hashMismatch = Assertions.assertThrows(IllegalStateException.class, log::verify);
            Assertions.assertTrue(hashMismatch.getMessage().contains("row 2"));

            List<String> truncated = new ArrayList<>(lines);
            truncated.remove(0);
            Files.write(file, truncated, StandardCharsets.UTF_8);
            IllegalStateException prevMismatch = Assertions.assertThrows(IllegalStateException.class, log::verify);
            Assertions.assertTrue(prevMismatch.getMessage().contains("prev_hash mismatch"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SecurityAuditLog.SecurityEvent event(String module, String function, String password) {
        ObjectNode params = Jsons.object();
        params.put("dsn", "dbi:SQLite:dbname=x");
        params.put("password", password);
        return new SecurityAuditLog.SecurityEvent(
                "authorization_denied", module, function, "x1", "authorization", "denied", params);
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
