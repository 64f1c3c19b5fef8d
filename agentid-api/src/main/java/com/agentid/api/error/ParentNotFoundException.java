package com.agentid.api.error;

/**
 * The parent DID of a worker does not resolve to a main agent.
 */
public class ParentNotFoundException extends LedgerException {

    private final String parentDid;

    public ParentNotFoundException(String parentDid, String message) {
        super("AGENT_004", message);
        this.parentDid = parentDid;
    }

    public String getParentDid() {
        return parentDid;
    }
}
