package io.bridged.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int MAX_PREVIEW_CHARS = 256;
    private static final int MAX_PREVIEW_ITEMS = 32;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "key", "credential",
            "plaintext", "ciphertext", "cookie"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return Jsons.wire().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.object();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            int kept = 0;
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (kept++ >= MAX_PREVIEW_ITEMS) {
                    out.put("...", (input.size() - MAX_PREVIEW_ITEMS) + " more");
                    break;
                }
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.wire().createArrayNode();
            int kept = 0;
            for (JsonNode value : input) {
                if (kept++ >= MAX_PREVIEW_ITEMS) {
                    out.add((input.size() - MAX_PREVIEW_ITEMS) + " more");
                    break;
                }
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.textValue();
            if (likelySecretValue(text)) {
                return Jsons.wire().getNodeFactory().textNode(MASK);
            }
            if (text.length() > MAX_PREVIEW_CHARS) {
                return Jsons.wire().getNodeFactory().textNode(
                        text.substring(0, MAX_PREVIEW_CHARS) + "...(" + text.length() + " chars)"
                );
            }
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.length() > MAX_PREVIEW_CHARS) {
            return false;
        }
        // Long opaque tokens without separators.
        return v.matches("^[A-Za-z0-9+/=_\\-]{24,}$");
    }
}
