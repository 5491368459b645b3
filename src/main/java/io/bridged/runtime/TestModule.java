package io.bridged.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.Operation;
import io.bridged.config.BridgeConfig;
import io.bridged.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

final class TestModule implements CapabilityModule {
    private final SystemModule system;

    TestModule(SystemModule system) {
        this.system = system;
    }

    @Override
    public String name() {
        return "test";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("ping", (params, ctx) -> {
            ObjectNode out = Jsons.object();
            out.put("message", "pong");
            out.put("daemon_version", BridgeConfig.DAEMON_VERSION);
            out.put("uptime", system.info().path("uptime").asDouble());
            out.put("java_version", System.getProperty("java.version"));
            out.put("exchange_id", ctx.exchangeId());
            out.set("input", params.raw());
            return out;
        });
        ops.put("stats", (params, ctx) -> system.stats());
        return ops;
    }
}
