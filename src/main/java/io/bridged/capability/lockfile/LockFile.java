package io.bridged.capability.lockfile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class LockFile implements AutoCloseable {
    private final String filename;
    private final Path lockfile;

    LockFile(String filename, Path lockfile) {
        this.filename = filename;
        this.lockfile = lockfile;
    }

    String filename() {
        return filename;
    }

    Path lockfile() {
        return lockfile;
    }

    @Override
    public void close() throws IOException {
        Files.deleteIfExists(lockfile);
    }
}
