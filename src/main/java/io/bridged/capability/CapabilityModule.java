package io.bridged.capability;

import java.util.Map;

public interface CapabilityModule {
    String name();

    /**
     * Function name to operation, in registration order.
     */
    Map<String, Operation> operations();
}
