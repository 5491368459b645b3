package io.bridged.capability;

import com.fasterxml.jackson.databind.node.ObjectNode;

@FunctionalInterface
public interface Operation {
    ObjectNode invoke(Params params, InvocationContext context) throws Exception;
}
