package com.agentid.api.error;

/**
 * A signature was required and is missing or does not match the agent's key.
 */
public class UnauthorizedReportException extends LedgerException {

    public UnauthorizedReportException(String message) {
        super("AGENT_002", message);
    }
}
