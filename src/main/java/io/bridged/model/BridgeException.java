package io.bridged.model;

public final class BridgeException extends RuntimeException {
    private final ErrorCategory category;

    private BridgeException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public static BridgeException transport(String message) {
        return new BridgeException(ErrorCategory.TRANSPORT, message, null);
    }

    public static BridgeException unauthorized(String module, String function) {
        return new BridgeException(
                ErrorCategory.AUTHORIZATION,
                "Function '" + module + "." + function + "' is not allowed (unauthorized capability)",
                null
        );
    }

    public static BridgeException validation(String message) {
        return new BridgeException(ErrorCategory.VALIDATION, "Validation failed: " + message, null);
    }

    public static BridgeException missingParam(String name) {
        return validation("missing required parameter '" + name + "'");
    }

    public static BridgeException handleNotFound(String id) {
        return new BridgeException(ErrorCategory.HANDLE, "Handle not found: " + id, null);
    }

    public static BridgeException kindMismatch(String id, HandleKind actual, HandleKind expected) {
        return new BridgeException(
                ErrorCategory.HANDLE,
                "Handle kind mismatch: " + id + " is " + actual.wireName() + ", expected " + expected.wireName(),
                null
        );
    }

    public static BridgeException poolExhausted(int maxHandles) {
        return new BridgeException(
                ErrorCategory.EXECUTION,
                "Handle pool exhausted: " + maxHandles + " handles in use",
                null
        );
    }

    public static BridgeException execution(String message) {
        return new BridgeException(ErrorCategory.EXECUTION, message, null);
    }

    public static BridgeException execution(String message, Throwable cause) {
        return new BridgeException(ErrorCategory.EXECUTION, message, cause);
    }

    public static BridgeException timeout(String message) {
        return new BridgeException(ErrorCategory.TIMEOUT, message, null);
    }

    public static BridgeException internal(String message, Throwable cause) {
        return new BridgeException(ErrorCategory.INTERNAL, message, cause);
    }
}
