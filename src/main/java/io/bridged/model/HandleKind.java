package io.bridged.model;

public enum HandleKind {
    DATABASE_CONNECTION("database_connection", "dbh"),
    PREPARED_STATEMENT("prepared_statement", "sth"),
    CIPHER_CONTEXT("cipher_context", "cipher"),
    FTP_SESSION("ftp_session", "ftp"),
    DOM_DOCUMENT("dom_document", "doc"),
    LOCK_MANAGER("lock_manager", "lockmgr"),
    LOCK("lock", "lock");

    private final String wireName;
    private final String idPrefix;

    HandleKind(String wireName, String idPrefix) {
        this.wireName = wireName;
        this.idPrefix = idPrefix;
    }

    public String wireName() {
        return wireName;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /** Remote or database sessions, as opposed to local helper state. */
    public boolean isConnection() {
        return this == DATABASE_CONNECTION || this == FTP_SESSION;
    }

    public static HandleKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Handle kind is required");
        }
        for (HandleKind value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown handle kind: " + raw);
    }
}
