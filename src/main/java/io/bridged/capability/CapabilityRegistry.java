package io.bridged.capability;

import io.bridged.model.BridgeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable whitelist of {@code module.function} capabilities, built once at startup.
 *
 * <p>Anything absent from the registry is denied. Registered entries can still be denied by a
 * disable pattern ({@code module.function} or {@code module.*}); {@code test.ping} cannot be
 * disabled.
 */
public final class CapabilityRegistry {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final String ALWAYS_ALLOWED = "test.ping";

    private final Map<String, Capability> capabilities;

    private CapabilityRegistry(Map<String, Capability> capabilities) {
        this.capabilities = Collections.unmodifiableMap(capabilities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Capability authorize(String module, String function) {
        if (!validName(module) || !validName(function)) {
            throw BridgeException.unauthorized(String.valueOf(module), String.valueOf(function));
        }
        Capability capability = capabilities.get(module + "." + function);
        if (capability == null || !capability.allowed()) {
            throw BridgeException.unauthorized(module, function);
        }
        return capability;
    }

    public boolean isAllowed(String module, String function) {
        if (!validName(module) || !validName(function)) {
            return false;
        }
        Capability capability = capabilities.get(module + "." + function);
        return capability != null && capability.allowed();
    }

    public List<String> modules() {
        Set<String> out = new LinkedHashSet<>();
        for (Capability capability : capabilities.values()) {
            out.add(capability.module());
        }
        return List.copyOf(out);
    }

    public List<String> allowedModules() {
        Set<String> out = new LinkedHashSet<>();
        for (Capability capability : capabilities.values()) {
            if (capability.allowed()) {
                out.add(capability.module());
            }
        }
        return List.copyOf(out);
    }

    public List<String> allowedCapabilities() {
        List<String> out = new ArrayList<>();
        for (Capability capability : capabilities.values()) {
            if (capability.allowed()) {
                out.add(capability.name());
            }
        }
        return out;
    }

    public int size() {
        return capabilities.size();
    }

    private static boolean validName(String raw) {
        return raw != null && NAME.matcher(raw).matches();
    }

    public record Capability(
            String module,
            String function,
            Operation operation,
            boolean allowed
    ) {
        public String name() {
            return module + "." + function;
        }
    }

    public static final class Builder {
        private final Map<String, Capability> entries = new LinkedHashMap<>();
        private final List<String> disabledPatterns = new ArrayList<>();

        private Builder() {
        }

        public Builder register(CapabilityModule module) {
            for (Map.Entry<String, Operation> e : module.operations().entrySet()) {
                register(module.name(), e.getKey(), e.getValue(), true);
            }
            return this;
        }

        public Builder register(String module, String function, Operation operation, boolean allowed) {
            if (!validName(module) || !validName(function)) {
                throw new IllegalArgumentException("Invalid capability name: " + module + "." + function);
            }
            String key = module + "." + function;
            if (entries.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate capability: " + key);
            }
            entries.put(key, new Capability(module, function, operation, allowed));
            return this;
        }

        public Builder disable(List<String> patterns) {
            if (patterns != null) {
                disabledPatterns.addAll(patterns);
            }
            return this;
        }

        public CapabilityRegistry build() {
            Map<String, Capability> out = new LinkedHashMap<>();
            for (Map.Entry<String, Capability> e : entries.entrySet()) {
                Capability c = e.getValue();
                boolean allowed = ALWAYS_ALLOWED.equals(e.getKey()) || (c.allowed() && !disabled(c));
                out.put(e.getKey(), new Capability(c.module(), c.function(), c.operation(), allowed));
            }
            return new CapabilityRegistry(out);
        }

        private boolean disabled(Capability capability) {
            for (String pattern : disabledPatterns) {
                String p = pattern.trim();
                if (p.equals(capability.name()) || p.equals(capability.module() + ".*") || p.equals(capability.module())) {
                    return true;
                }
            }
            return false;
        }
    }
}
