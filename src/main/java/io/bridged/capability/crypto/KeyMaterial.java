package io.bridged.capability.crypto;

import io.bridged.model.BridgeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

final class KeyMaterial {
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");
    private static final Pattern HEX = Pattern.compile("^(?:[0-9a-fA-F]{2})+$");

    private KeyMaterial() {
    }

    /**
     * Base64 first, then hex, then the raw UTF-8 bytes of the string.
     */
    static byte[] decode(String key) {
        if (key == null || key.isEmpty()) {
            throw BridgeException.validation("cipher key must not be empty");
        }
        String trimmed = key.trim();
        if (trimmed.length() % 4 == 0 && BASE64.matcher(trimmed).matches()) {
            byte[] decoded = Base64.getDecoder().decode(trimmed);
            if (decoded.length > 0) {
                return decoded;
            }
        }
        if (HEX.matcher(trimmed).matches()) {
            return HexFormat.of().parseHex(trimmed);
        }
        return key.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Reads a key file, dropping PEM armour lines.
     */
    static byte[] fromFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw BridgeException.execution("Key file not found: " + file);
        }
        StringBuilder body = new StringBuilder();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("-----")) {
                continue;
            }
            body.append(trimmed);
        }
        if (body.length() == 0) {
            throw BridgeException.execution("Key file is empty: " + file);
        }
        return decode(body.toString());
    }
}
