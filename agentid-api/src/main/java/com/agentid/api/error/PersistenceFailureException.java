package com.agentid.api.error;

/**
 * The backing store was unreachable or timed out. The outcome of the operation
 * is unknown; callers may retry, the ledger never does.
 */
public class PersistenceFailureException extends LedgerException {

    public PersistenceFailureException(String operation, Throwable cause) {
        super("STORE_001", "Store operation failed: " + operation, cause);
    }
}
