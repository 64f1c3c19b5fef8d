package com.agentid.api.registry;

import java.util.Map;

/**
 * Input to {@link IdentityRegistry#register}.
 *
 * @param publicKey 64 hex chars, or null to have a keypair generated
 * @param parentDid DID of a main agent when registering a worker, else null
 * @param clientIp  address the registration is rate limited on
 */
public record RegistrationRequest(
        String name,
        String publicKey,
        String parentDid,
        String ownerId,
        Map<String, Object> metadata,
        String clientIp
) {
    public static RegistrationRequest main(String name, String clientIp) {
        return new RegistrationRequest(name, null, null, null, Map.of(), clientIp);
    }

    public static RegistrationRequest worker(String name, String parentDid, String clientIp) {
        return new RegistrationRequest(name, null, parentDid, null, Map.of(), clientIp);
    }
}
