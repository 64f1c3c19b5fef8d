package com.agentid.api.registry;

import com.agentid.api.store.IdentityRecord;

/**
 * Outcome of a registration.
 *
 * @param privateKey hex seed when the registry generated the keypair; returned once, never stored
 * @param warning    non-null when the identity was created but a follow-up step failed
 */
public record RegistrationResult(IdentityRecord identity, String privateKey, Warning warning) {

    public enum Warning {
        /**
         * Identity stored, registration event missing. Repair with
         * {@link IdentityRegistry#ensureRegistrationEvent(String)}.
         */
        PARTIAL_REGISTRATION
    }

    public boolean isPartial() {
        return warning == Warning.PARTIAL_REGISTRATION;
    }

    @Override
    public String toString() {
        return "RegistrationResult[identity=" + identity.did() + ", privateKey="
                + (privateKey == null ? "null" : "<redacted>") + ", warning=" + warning + "]";
    }
}
