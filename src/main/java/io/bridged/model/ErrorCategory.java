package io.bridged.model;

public enum ErrorCategory {
    TRANSPORT("transport"),
    AUTHORIZATION("authorization"),
    VALIDATION("validation"),
    HANDLE("handle"),
    EXECUTION("execution"),
    TIMEOUT("timeout"),
    INTERNAL("internal");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean securityRelevant() {
        return this == AUTHORIZATION || this == VALIDATION;
    }
}
