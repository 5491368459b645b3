package io.bridged.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BridgeConfig {
    public static final String DAEMON_VERSION = "1.0.0";
    public static final String DEFAULT_SOCKET_PATH = "/tmp/bridged.sock";
    public static final String DEFAULT_DATA_DIR = "data";
    public static final String SETTINGS_FILE_NAME = "bridged-settings.json";

    private final Path socketPath;
    private final Path dataDir;

    public BridgeConfig(Path socketPath, Path dataDir) {
        this.socketPath = socketPath;
        this.dataDir = dataDir;
    }

    public static BridgeConfig of(String socket, String dataDir) {
        Path resolvedSocket = socket == null || socket.isBlank()
                ? Paths.get(DEFAULT_SOCKET_PATH)
                : Paths.get(socket.trim());
        Path resolvedData = dataDir == null || dataDir.isBlank()
                ? Paths.get(DEFAULT_DATA_DIR)
                : Paths.get(dataDir.trim());
        return new BridgeConfig(
                resolvedSocket.toAbsolutePath().normalize(),
                resolvedData.toAbsolutePath().normalize()
        );
    }

    public Path socketPath() {
        return socketPath;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path settingsFile() {
        return dataDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return dataDir.resolve("audit");
    }

    public Path securityAuditFile() {
        return auditRoot().resolve("security.log");
    }
}
