package io.bridged.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeResponse(
        boolean success,
        JsonNode result,
        String error,
        String errorType
) {
    public static BridgeResponse ok(JsonNode result) {
        return new BridgeResponse(true, result, null, null);
    }

    public static BridgeResponse failure(BridgeException error) {
        return failure(error.category(), error.getMessage());
    }

    public static BridgeResponse failure(ErrorCategory category, String message) {
        return new BridgeResponse(false, null, message, category.wireName());
    }

    public static BridgeResponse fromJson(JsonNode node) {
        boolean success = node.path("success").asBoolean(false);
        if (success) {
            return ok(node.path("result"));
        }
        return new BridgeResponse(
                false,
                null,
                node.path("error").asText("Unknown error"),
                node.hasNonNull("error_type") ? node.get("error_type").asText() : null
        );
    }
}
