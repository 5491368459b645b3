package io.bridged.capability.lockfile;

import java.time.Duration;

/**
 * Settings shared by the locks taken through one manager. The locks themselves are child
 * handles, so closing the manager releases nothing on its own; the pool cascades.
 */
final class LockManager implements AutoCloseable {
    private final boolean nfs;
    private final Duration hold;

    LockManager(boolean nfs, Duration hold) {
        this.nfs = nfs;
        this.hold = hold;
    }

    boolean nfs() {
        return nfs;
    }

    Duration hold() {
        return hold;
    }

    @Override
    public void close() {
    }
}
