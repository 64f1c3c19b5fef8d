package com.agentid.api.claim;

/**
 * A claim to attest about an agent.
 *
 * @param message       optional signed message; checked together with {@code signature}
 * @param expiresInDays optional lifetime, null for claims that never lapse
 */
public record ClaimRequest(
        String agentId,
        String claimType,
        String claimValue,
        String message,
        String signature,
        String verifierId,
        Integer expiresInDays
) {
    boolean carriesSignature() {
        return message != null && !message.isEmpty() && signature != null && !signature.isEmpty();
    }
}
