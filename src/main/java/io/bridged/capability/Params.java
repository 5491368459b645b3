package io.bridged.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.model.BridgeException;
import io.bridged.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Params {
    private final ObjectNode raw;

    public Params(ObjectNode raw) {
        this.raw = raw == null ? Jsons.object() : raw;
    }

    public ObjectNode raw() {
        return raw;
    }

    public boolean has(String name) {
        JsonNode node = raw.get(name);
        return node != null && !node.isNull();
    }

    public String requireText(String name) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull()) {
            throw BridgeException.missingParam(name);
        }
        if (!node.isValueNode()) {
            throw BridgeException.validation("parameter '" + name + "' must be a scalar");
        }
        return node.asText();
    }

    public String requireNonBlank(String name) {
        String value = requireText(name);
        if (value.isBlank()) {
            throw BridgeException.validation("parameter '" + name + "' must not be blank");
        }
        return value;
    }

    public String text(String name, String fallback) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return fallback;
        }
        return node.asText();
    }

    /**
     * First present value among several accepted parameter names.
     */
    public String firstText(String... names) {
        for (String name : names) {
            if (has(name)) {
                return requireText(name);
            }
        }
        throw BridgeException.missingParam(names[0]);
    }

    public int integer(String name, int fallback) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw BridgeException.validation("parameter '" + name + "' must be an integer");
            }
        }
        throw BridgeException.validation("parameter '" + name + "' must be an integer");
    }

    public boolean bool(String name, boolean fallback) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asInt() != 0;
        }
        String text = node.asText("").trim();
        return text.equalsIgnoreCase("true") || text.equalsIgnoreCase("yes") || text.equals("1");
    }

    public ObjectNode object(String name) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull()) {
            return Jsons.object();
        }
        if (!node.isObject()) {
            throw BridgeException.validation("parameter '" + name + "' must be a mapping");
        }
        return (ObjectNode) node;
    }

    public ArrayNode array(String name) {
        JsonNode node = raw.get(name);
        if (node == null || node.isNull()) {
            return Jsons.wire().createArrayNode();
        }
        if (!node.isArray()) {
            throw BridgeException.validation("parameter '" + name + "' must be a list");
        }
        return (ArrayNode) node;
    }

    public List<JsonNode> list(String name) {
        List<JsonNode> out = new ArrayList<>();
        array(name).forEach(out::add);
        return out;
    }

    public Map<String, String> stringMap(String name) {
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object(name).fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isNull()) {
                out.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return out;
    }
}
