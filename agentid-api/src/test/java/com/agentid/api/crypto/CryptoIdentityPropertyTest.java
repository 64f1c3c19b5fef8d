package com.agentid.api.crypto;

import com.agentid.api.crypto.CryptoIdentity.AgentKeyPair;
import net.jqwik.api.*;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for Ed25519 keys, DIDs and signatures.
 */
class CryptoIdentityPropertyTest {

    private final CryptoIdentity crypto = new CryptoIdentity();

    // ==================== DID derivation ====================

    @Property(tries = 50)
    @Label("DID is a pure function of the public key")
    void didIsDeterministic(@ForAll("publicKeys") String publicKey) {
        String did = crypto.deriveDid(publicKey);

        assertThat(crypto.deriveDid(publicKey)).isEqualTo(did);
        assertThat(did).startsWith("did:agent:");
        assertThat(did.substring("did:agent:".length())).hasSize(32).matches("[0-9a-f]{32}");
        assertThat(did).isEqualTo("did:agent:" + crypto.sha256Hex(publicKey).substring(0, 32));
    }

    @Property(tries = 50)
    @Label("Distinct keys give distinct DIDs")
    void distinctKeysGiveDistinctDids(@ForAll("publicKeys") String first, @ForAll("publicKeys") String second) {
        Assume.that(!first.equals(second));

        assertThat(crypto.deriveDid(first)).isNotEqualTo(crypto.deriveDid(second));
    }

    @Property(tries = 50)
    @Label("Worker DID extends the parent DID with an 8-char suffix")
    void workerDidExtendsParent(@ForAll("publicKeys") String parentKey, @ForAll("publicKeys") String workerKey) {
        String parentDid = crypto.deriveDid(parentKey);
        String workerDid = crypto.deriveWorkerDid(parentDid, workerKey);

        String expectedSuffix = crypto.deriveDid(workerKey).substring("did:agent:".length(), "did:agent:".length() + 8);
        assertThat(workerDid).isEqualTo(parentDid + ":w:" + expectedSuffix);
    }

    @Test
    void deriveDidRejectsBlankKey() {
        assertThatThrownBy(() -> crypto.deriveDid(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.deriveWorkerDid(null, "ab")).isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Signatures ====================

    @Property(tries = 30)
    @Label("A signature made with the private key verifies with the public key")
    void signThenVerify(@ForAll @StringLength(max = 200) String message) {
        AgentKeyPair keyPair = crypto.generateKeyPair();

        String signature = crypto.sign(message, keyPair.privateKeyHex());

        assertThat(signature).hasSize(128);
        assertThat(crypto.verify(message, signature, keyPair.publicKeyHex())).isTrue();
    }

    @Property(tries = 30)
    @Label("A signature does not verify for another message or another key")
    void signatureIsBoundToMessageAndKey(@ForAll @StringLength(min = 1, max = 100) String message) {
        AgentKeyPair keyPair = crypto.generateKeyPair();
        AgentKeyPair other = crypto.generateKeyPair();
        String signature = crypto.sign(message, keyPair.privateKeyHex());

        assertThat(crypto.verify(message + "x", signature, keyPair.publicKeyHex())).isFalse();
        assertThat(crypto.verify(message, signature, other.publicKeyHex())).isFalse();
    }

    @Property(tries = 100)
    @Label("verify never throws on garbage input")
    void verifyReturnsFalseOnGarbage(@ForAll String message, @ForAll String signature, @ForAll String publicKey) {
        assertThatCode(() -> crypto.verify(message, signature, publicKey)).doesNotThrowAnyException();
        assertThat(crypto.verify(message, signature, publicKey)).isFalse();
    }

    @Test
    void verifyReturnsFalseOnNullsAndWrongLengths() {
        AgentKeyPair keyPair = crypto.generateKeyPair();
        String signature = crypto.sign("ping", keyPair.privateKeyHex());

        assertThat(crypto.verify(null, signature, keyPair.publicKeyHex())).isFalse();
        assertThat(crypto.verify("ping", null, keyPair.publicKeyHex())).isFalse();
        assertThat(crypto.verify("ping", signature, null)).isFalse();
        assertThat(crypto.verify("ping", signature.substring(2), keyPair.publicKeyHex())).isFalse();
        assertThat(crypto.verify("ping", signature, keyPair.publicKeyHex().substring(2))).isFalse();
        assertThat(crypto.verify("ping", "zz" + signature.substring(2), keyPair.publicKeyHex())).isFalse();
    }

    @Test
    void signRejectsMalformedPrivateKey() {
        assertThatThrownBy(() -> crypto.sign("ping", "abcd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> crypto.sign("ping", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generatedKeysAreHexAndRedactedInToString() {
        AgentKeyPair keyPair = crypto.generateKeyPair();

        assertThat(keyPair.publicKeyHex()).matches("[0-9a-f]{64}");
        assertThat(keyPair.privateKeyHex()).matches("[0-9a-f]{64}");
        assertThat(crypto.isWellFormedPublicKey(keyPair.publicKeyHex())).isTrue();
        assertThat(keyPair.toString()).doesNotContain(keyPair.privateKeyHex());
    }

    @Test
    void wellFormedPublicKeyRequires64HexChars() {
        assertThat(crypto.isWellFormedPublicKey(null)).isFalse();
        assertThat(crypto.isWellFormedPublicKey("ab".repeat(31))).isFalse();
        assertThat(crypto.isWellFormedPublicKey("zz".repeat(32))).isFalse();
        assertThat(crypto.isWellFormedPublicKey("AB".repeat(32))).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void didDocumentDefaultsControllerToDid() {
        String publicKey = crypto.generateKeyPair().publicKeyHex();
        String did = crypto.deriveDid(publicKey);

        Map<String, Object> document = crypto.didDocument(did, publicKey, null);

        assertThat(document.get("id")).isEqualTo(did);
        assertThat(document.get("controller")).isEqualTo(did);
        assertThat(document.get("authentication")).isEqualTo(List.of(did + "#key-1"));
        Map<String, Object> method = ((List<Map<String, Object>>) document.get("verificationMethod")).get(0);
        assertThat(method).containsEntry("type", "Ed25519VerificationKey2020").containsEntry("publicKeyHex", publicKey);
        assertThat(crypto.didDocument(did, publicKey, "owner-1").get("controller")).isEqualTo("owner-1");
    }

    @Provide
    Arbitrary<String> publicKeys() {
        return Arbitraries.strings().withChars("0123456789abcdef").ofLength(64);
    }
}
