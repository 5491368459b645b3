package io.bridged.pool;

import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class HandlePool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HandlePool.class);

    private final ConcurrentMap<String, Handle> handles = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger reserved = new AtomicInteger();
    private final AtomicLong createdTotal = new AtomicLong();
    private final AtomicLong removedTotal = new AtomicLong();
    private final AtomicLong rejectedTotal = new AtomicLong();
    private final int maxHandles;
    private final Clock clock;

    public HandlePool(int maxHandles) {
        this(maxHandles, Clock.systemUTC());
    }

    public HandlePool(int maxHandles, Clock clock) {
        this.maxHandles = Math.max(1, maxHandles);
        this.clock = clock;
    }

    public String create(HandleKind kind, AutoCloseable state, String ownerConnection) {
        return create(kind, state, ownerConnection, null);
    }

    public String create(HandleKind kind, AutoCloseable state, String ownerConnection, String parentId) {
        if (reserved.incrementAndGet() > maxHandles) {
            reserved.decrementAndGet();
            rejectedTotal.incrementAndGet();
            closeState(kind, "<rejected>", state);
            LOG.warn("Handle pool exhausted, rejected new {} (max={})", kind.wireName(), maxHandles);
            throw BridgeException.poolExhausted(maxHandles);
        }
        if (parentId != null && !handles.containsKey(parentId)) {
            reserved.decrementAndGet();
            closeState(kind, "<orphan>", state);
            throw BridgeException.handleNotFound(parentId);
        }
        String id = String.format("%s_%d_%08x",
                kind.idPrefix(), sequence.incrementAndGet(), ThreadLocalRandom.current().nextInt());
        Handle handle = new Handle(id, kind, state, ownerConnection, parentId, nowMs());
        handles.put(id, handle);
        createdTotal.incrementAndGet();
        if (parentId != null && !handles.containsKey(parentId)) {
            // Parent was removed while this child was being registered.
            remove(id);
            throw BridgeException.handleNotFound(parentId);
        }
        LOG.debug("Created handle {} (kind={}, parent={}, owner={})", id, kind.wireName(), parentId, ownerConnection);
        return id;
    }

    public Optional<Handle> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handles.get(id));
    }

    public Handle require(String id, HandleKind expected) {
        Handle handle = find(id).orElseThrow(() -> BridgeException.handleNotFound(id));
        if (handle.kind() != expected) {
            throw BridgeException.kindMismatch(id, handle.kind(), expected);
        }
        return handle;
    }

    public boolean touch(String id) {
        Handle handle = handles.get(id);
        if (handle == null) {
            return false;
        }
        touch(handle);
        return true;
    }

    public <T> T withHandle(String id, HandleKind expected, HandleOperation<T> operation) throws Exception {
        Handle handle = require(id, expected);
        handle.lock().lock();
        try {
            if (handle.released() || handles.get(id) != handle) {
                throw BridgeException.handleNotFound(id);
            }
            T out = operation.apply(handle);
            touch(handle);
            return out;
        } finally {
            handle.lock().unlock();
        }
    }

    public boolean remove(String id) {
        Handle handle = id == null ? null : handles.remove(id);
        if (handle == null) {
            return false;
        }
        detached(handle);
        return true;
    }

    public void removeExpected(String id, HandleKind expected) {
        require(id, expected);
        if (!remove(id)) {
            throw BridgeException.handleNotFound(id);
        }
    }

    /**
     * Removes the handle if it has been idle longer than {@code thresholdMs}. A handle that is
     * checked out, or that has a checked-out descendant, is left alone; this never blocks.
     */
    public Optional<HandleView> evictIfIdle(String id, long thresholdMs) {
        Handle handle = handles.get(id);
        if (handle == null) {
            return Optional.empty();
        }
        List<Handle> held = new ArrayList<>();
        try {
            if (!tryLockSubtree(handle, held)) {
                return Optional.empty();
            }
            long now = nowMs();
            if (now - handle.lastUsedAtMs() <= thresholdMs) {
                return Optional.empty();
            }
            HandleView view = handle.view(now);
            if (!handles.remove(id, handle)) {
                return Optional.empty();
            }
            detached(handle);
            return Optional.of(view);
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).lock().unlock();
            }
        }
    }

    public List<HandleView> views() {
        long now = nowMs();
        List<HandleView> out = new ArrayList<>(handles.size());
        for (Handle handle : handles.values()) {
            out.add(handle.view(now));
        }
        out.sort(Comparator.comparingLong(HandleView::createdAtMs).thenComparing(HandleView::id));
        return out;
    }

    public HandleStats stats() {
        Map<String, Integer> perKind = new LinkedHashMap<>();
        for (HandleKind kind : HandleKind.values()) {
            perKind.put(kind.wireName(), 0);
        }
        List<String> ids = new ArrayList<>();
        for (HandleView view : views()) {
            perKind.merge(view.kind(), 1, Integer::sum);
            ids.add(view.id());
        }
        return new HandleStats(
                ids.size(),
                maxHandles,
                perKind,
                ids,
                createdTotal.get(),
                removedTotal.get(),
                rejectedTotal.get()
        );
    }

    public int size() {
        return handles.size();
    }

    public int maxHandles() {
        return maxHandles;
    }

    public long nowMs() {
        return clock.millis();
    }

    @Override
    public void close() {
        List<String> roots = new ArrayList<>();
        for (Handle handle : handles.values()) {
            if (handle.parentId() == null) {
                roots.add(handle.id());
            }
        }
        for (String id : roots) {
            remove(id);
        }
        for (String id : new ArrayList<>(handles.keySet())) {
            remove(id);
        }
    }

    private void touch(Handle handle) {
        long now = nowMs();
        Handle current = handle;
        int hops = 0;
        while (current != null && hops++ < 8) {
            current.touch(now);
            current = current.parentId() == null ? null : handles.get(current.parentId());
        }
    }

    private boolean tryLockSubtree(Handle root, List<Handle> held) {
        if (!root.lock().tryLock()) {
            return false;
        }
        held.add(root);
        for (Handle candidate : handles.values()) {
            if (root.id().equals(candidate.parentId()) && !tryLockSubtree(candidate, held)) {
                return false;
            }
        }
        return true;
    }

    private void detached(Handle handle) {
        reserved.decrementAndGet();
        removedTotal.incrementAndGet();
        for (Handle candidate : handles.values()) {
            if (handle.id().equals(candidate.parentId())) {
                remove(candidate.id());
            }
        }
        handle.lock().lock();
        try {
            if (!handle.released()) {
                handle.markReleased();
                closeState(handle.kind(), handle.id(), handle.rawState());
            }
        } finally {
            handle.lock().unlock();
        }
        LOG.debug("Removed handle {} (kind={})", handle.id(), handle.kind().wireName());
    }

    private static void closeState(HandleKind kind, String id, AutoCloseable state) {
        if (state == null) {
            return;
        }
        try {
            state.close();
        } catch (Exception e) {
            LOG.warn("Failed to release {} handle {}: {}", kind.wireName(), id, e.getMessage());
        }
    }
}
