package com.agentid.api.error;

/**
 * Base class for every rejection the ledger can report to its callers.
 * The code is stable and is what the HTTP layer returns.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;

    protected LedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
