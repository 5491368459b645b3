package io.bridged.pool;

public record HandleView(
        String id,
        String kind,
        String ownerConnection,
        String parentId,
        long createdAtMs,
        long lastUsedAtMs,
        long idleMs,
        long useCount
) {
}
