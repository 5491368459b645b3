package io.bridged.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record BridgeRequest(
        String module,
        String function,
        ObjectNode params,
        double timestamp
) {
    public String capability() {
        return module + "." + function;
    }
}
