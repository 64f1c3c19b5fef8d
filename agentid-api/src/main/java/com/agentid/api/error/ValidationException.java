package com.agentid.api.error;

/**
 * Input has the wrong shape or range. Raised before any storage access.
 */
public class ValidationException extends LedgerException {

    public static final String INVALID_NAME = "INVALID_NAME";

    private final String reason;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String reason, String message) {
        super("AGENT_001", message);
        this.reason = reason;
    }

    public ValidationException(String message, Throwable cause) {
        super("AGENT_001", message, cause);
        this.reason = null;
    }

    /**
     * Machine-readable detail such as {@link #INVALID_NAME}, or null.
     */
    public String getReason() {
        return reason;
    }

    public static ValidationException invalidName(String message) {
        return new ValidationException(INVALID_NAME, message);
    }
}
