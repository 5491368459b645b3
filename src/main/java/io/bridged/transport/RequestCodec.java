package io.bridged.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.model.BridgeException;
import io.bridged.model.BridgeRequest;
import io.bridged.model.BridgeResponse;
import io.bridged.util.Jsons;

import java.io.IOException;

public final class RequestCodec {
    private RequestCodec() {
    }

    public static BridgeRequest decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw BridgeException.transport("Empty request received");
        }
        JsonNode root;
        try {
            root = Jsons.wire().readTree(payload);
        } catch (JsonProcessingException e) {
            throw BridgeException.transport("Invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw BridgeException.transport("Invalid JSON: " + e.getMessage());
        }
        if (root == null || root.isMissingNode()) {
            throw BridgeException.transport("Empty request received");
        }
        if (!root.isObject()) {
            throw BridgeException.transport("Request must be a JSON object");
        }
        String module = requiredName(root, "module");
        String function = requiredName(root, "function");
        JsonNode params = root.get("params");
        ObjectNode safeParams;
        if (params == null || params.isNull()) {
            safeParams = Jsons.object();
        } else if (params.isObject()) {
            safeParams = (ObjectNode) params;
        } else {
            throw BridgeException.transport("Request params must be a JSON object");
        }
        double timestamp = root.path("timestamp").asDouble(0.0d);
        return new BridgeRequest(module, function, safeParams, timestamp);
    }

    public static byte[] encode(BridgeRequest request) {
        ObjectNode root = Jsons.object();
        root.put("module", request.module());
        root.put("function", request.function());
        root.set("params", request.params() == null ? Jsons.object() : request.params());
        root.put("timestamp", request.timestamp());
        return Jsons.toWireBytes(root);
    }

    public static byte[] encode(BridgeResponse response) {
        return Jsons.toWireBytes(response);
    }

    public static BridgeResponse decodeResponse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw BridgeException.transport("Empty response received");
        }
        try {
            return BridgeResponse.fromJson(Jsons.wire().readTree(payload));
        } catch (IOException e) {
            throw BridgeException.transport("Invalid response JSON: " + e.getMessage());
        }
    }

    private static String requiredName(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw BridgeException.transport("Request field '" + field + "' must be a non-empty string");
        }
        return node.textValue();
    }
}
