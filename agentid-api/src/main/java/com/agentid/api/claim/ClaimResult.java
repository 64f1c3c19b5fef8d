package com.agentid.api.claim;

import com.agentid.api.store.ClaimRecord;

/**
 * @param signatureVerified true when a signature was checked, null when none was supplied
 */
public record ClaimResult(ClaimRecord claim, String did, Boolean signatureVerified) {}
