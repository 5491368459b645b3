package io.bridged.capability.database;

import io.bridged.model.BridgeException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns legacy {@code dbi:Driver:args} data source names into JDBC URLs. JDBC URLs pass through.
 */
final class DsnTranslator {
    private DsnTranslator() {
    }

    record Target(String jdbcUrl, String dbType) {
    }

    static Target translate(String dsn, String username) {
        if (dsn == null || dsn.isBlank()) {
            throw BridgeException.missingParam("dsn");
        }
        String trimmed = dsn.trim();
        if (trimmed.regionMatches(true, 0, "jdbc:", 0, 5)) {
            String rest = trimmed.substring(5);
            int colon = rest.indexOf(':');
            String type = colon < 0 ? rest : rest.substring(0, colon);
            return new Target(trimmed, type.toLowerCase(Locale.ROOT));
        }
        if (!trimmed.regionMatches(true, 0, "dbi:", 0, 4)) {
            throw BridgeException.validation("unsupported DSN format: " + trimmed);
        }
        String rest = trimmed.substring(4);
        int colon = rest.indexOf(':');
        String driver = colon < 0 ? rest : rest.substring(0, colon);
        String args = colon < 0 ? "" : rest.substring(colon + 1);
        switch (driver.toLowerCase(Locale.ROOT)) {
            case "sqlite":
                return new Target("jdbc:sqlite:" + sqlitePath(args), "sqlite");
            case "pg":
                return new Target(postgres(args), "postgresql");
            case "mysql":
                return new Target(mysql(args), "mysql");
            case "oracle":
                return new Target(oracle(args, username), "oracle");
            default:
                throw BridgeException.validation("unsupported DSN driver: " + driver);
        }
    }

    private static String sqlitePath(String args) {
        Map<String, String> kv = parseArgs(args);
        String path = kv.getOrDefault("dbname", kv.getOrDefault("database", null));
        if (path != null) {
            return path;
        }
        if (args.isBlank()) {
            throw BridgeException.validation("SQLite DSN needs a database path");
        }
        return args.trim();
    }

    private static String postgres(String args) {
        Map<String, String> kv = parseArgs(args);
        String db = kv.getOrDefault("dbname", kv.getOrDefault("database", ""));
        String host = kv.getOrDefault("host", "localhost");
        String port = kv.getOrDefault("port", "5432");
        return "jdbc:postgresql://" + host + ":" + port + "/" + db;
    }

    private static String mysql(String args) {
        Map<String, String> kv = parseArgs(args);
        String db = kv.getOrDefault("database", kv.getOrDefault("dbname", ""));
        String host = kv.getOrDefault("host", "localhost");
        String port = kv.getOrDefault("port", "3306");
        return "jdbc:mysql://" + host + ":" + port + "/" + db;
    }

    private static String oracle(String args, String username) {
        if (args.isBlank()) {
            // user@TNSNAME form carries the service in the username.
            if (username != null && username.contains("@")) {
                return "jdbc:oracle:thin:@" + username.substring(username.indexOf('@') + 1);
            }
            throw BridgeException.validation("Oracle DSN needs a service, SID or TNS name");
        }
        if (!args.contains("=")) {
            return "jdbc:oracle:thin:@" + args.trim();
        }
        Map<String, String> kv = parseArgs(args);
        String host = kv.getOrDefault("host", "localhost");
        String port = kv.getOrDefault("port", "1521");
        if (kv.containsKey("service_name")) {
            return "jdbc:oracle:thin:@//" + host + ":" + port + "/" + kv.get("service_name");
        }
        String sid = kv.getOrDefault("sid", kv.getOrDefault("dbname", ""));
        return "jdbc:oracle:thin:@" + host + ":" + port + ":" + sid;
    }

    private static Map<String, String> parseArgs(String args) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : args.split(";")) {
            int eq = part.indexOf('=');
            if (eq > 0) {
                out.put(part.substring(0, eq).trim().toLowerCase(Locale.ROOT), part.substring(eq + 1).trim());
            }
        }
        return out;
    }

    static String stripTnsSuffix(String username) {
        if (username == null) {
            return null;
        }
        int at = username.indexOf('@');
        return at < 0 ? username : username.substring(0, at);
    }
}
