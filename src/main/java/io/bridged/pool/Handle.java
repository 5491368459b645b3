package io.bridged.pool;

import io.bridged.model.HandleKind;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

public final class Handle {
    private final String id;
    private final HandleKind kind;
    private final AutoCloseable state;
    private final String ownerConnection;
    private final String parentId;
    private final long createdAtMs;
    private final AtomicLong useCount = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile long lastUsedAtMs;
    private volatile boolean released;

    Handle(String id, HandleKind kind, AutoCloseable state, String ownerConnection, String parentId, long nowMs) {
        this.id = id;
        this.kind = kind;
        this.state = state;
        this.ownerConnection = ownerConnection;
        this.parentId = parentId;
        this.createdAtMs = nowMs;
        this.lastUsedAtMs = nowMs;
    }

    public String id() {
        return id;
    }

    public HandleKind kind() {
        return kind;
    }

    public String parentId() {
        return parentId;
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public long lastUsedAtMs() {
        return lastUsedAtMs;
    }

    public long useCount() {
        return useCount.get();
    }

    public boolean released() {
        return released;
    }

    public <T> T state(Class<T> type) {
        return type.cast(state);
    }

    AutoCloseable rawState() {
        return state;
    }

    ReentrantLock lock() {
        return lock;
    }

    void touch(long nowMs) {
        lastUsedAtMs = Math.max(lastUsedAtMs, nowMs);
        useCount.incrementAndGet();
    }

    void markReleased() {
        released = true;
    }

    HandleView view(long nowMs) {
        return new HandleView(
                id,
                kind.wireName(),
                ownerConnection,
                parentId,
                createdAtMs,
                lastUsedAtMs,
                Math.max(0L, nowMs - lastUsedAtMs),
                useCount.get()
        );
    }
}
