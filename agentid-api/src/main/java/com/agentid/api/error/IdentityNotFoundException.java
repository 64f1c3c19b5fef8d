package com.agentid.api.error;

public class IdentityNotFoundException extends LedgerException {

    public IdentityNotFoundException(String idOrDid) {
        super("AGENT_003", "Agent not found: " + idOrDid);
    }
}
