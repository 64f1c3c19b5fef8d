package com.agentid.api.error;

public class DuplicateIdentityException extends LedgerException {

    public DuplicateIdentityException(String did, Throwable cause) {
        super("AGENT_005", "Agent with this DID already exists: " + did, cause);
    }
}
