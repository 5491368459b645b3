package io.bridged.capability;

import io.bridged.pool.HandlePool;

public record InvocationContext(
        String exchangeId,
        HandlePool pool
) {
}
