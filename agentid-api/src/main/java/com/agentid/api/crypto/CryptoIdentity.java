package com.agentid.api.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ed25519 keys, DIDs and signatures for agent identities.
 *
 * Keys travel as hex: the public key is the raw 32-byte point, the private key
 * the raw 32-byte seed. The JCA provider wants DER, so the fixed X.509 and
 * PKCS#8 headers for Ed25519 are added and stripped here.
 */
@Component
public class CryptoIdentity {

    public static final String DID_PREFIX = "did:agent:";
    public static final String WORKER_SEGMENT = ":w:";

    private static final String ALGORITHM = "Ed25519";
    private static final int KEY_LENGTH = 32;
    private static final int SIGNATURE_LENGTH = 64;
    private static final int DID_HASH_CHARS = 32;
    private static final int WORKER_SUFFIX_CHARS = 8;

    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = HexFormat.of().parseHex("302e020100300506032b657004220420");

    private final HexFormat hex = HexFormat.of();

    /**
     * Generates a fresh Ed25519 keypair. The private key must be handed to the
     * caller once and never stored.
     */
    public AgentKeyPair generateKeyPair() {
        try {
            KeyPair keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            byte[] publicRaw = tail(keyPair.getPublic().getEncoded());
            byte[] privateRaw = tail(keyPair.getPrivate().getEncoded());
            return new AgentKeyPair(hex.formatHex(publicRaw), hex.formatHex(privateRaw));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    /**
     * did:agent: followed by the first 32 hex chars of SHA-256 over the hex public key.
     */
    public String deriveDid(String publicKeyHex) {
        if (publicKeyHex == null || publicKeyHex.isBlank()) {
            throw new IllegalArgumentException("Public key cannot be null or blank");
        }
        return DID_PREFIX + sha256Hex(publicKeyHex).substring(0, DID_HASH_CHARS);
    }

    /**
     * Worker DIDs hang off the parent DID with an 8-char suffix of the worker's own key hash.
     */
    public String deriveWorkerDid(String parentDid, String publicKeyHex) {
        if (parentDid == null || parentDid.isBlank()) {
            throw new IllegalArgumentException("Parent DID cannot be null or blank");
        }
        String workerId = deriveDid(publicKeyHex).substring(DID_PREFIX.length(),
                DID_PREFIX.length() + WORKER_SUFFIX_CHARS);
        return parentDid + WORKER_SEGMENT + workerId;
    }

    /**
     * Signs the UTF-8 bytes of a message.
     *
     * @throws IllegalArgumentException if the private key is not a 32-byte hex seed
     */
    public String sign(String message, String privateKeyHex) {
        PrivateKey privateKey = privateKeyFromHex(privateKeyHex);
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(message.getBytes(StandardCharsets.UTF_8));
            return hex.formatHex(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign message", e);
        }
    }

    /**
     * Verifies a hex signature over the UTF-8 bytes of a message.
     * Malformed input of any kind yields false.
     */
    public boolean verify(String message, String signatureHex, String publicKeyHex) {
        if (message == null || signatureHex == null || publicKeyHex == null) {
            return false;
        }
        try {
            byte[] signatureBytes = hex.parseHex(signatureHex);
            if (signatureBytes.length != SIGNATURE_LENGTH) {
                return false;
            }
            PublicKey publicKey = publicKeyFromHex(publicKeyHex);
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(message.getBytes(StandardCharsets.UTF_8));
            return signature.verify(signatureBytes);
        } catch (IllegalArgumentException | GeneralSecurityException | ProviderException e) {
            return false;
        }
    }

    /**
     * True for 64 hex chars, the only public key shape the registry accepts.
     */
    public boolean isWellFormedPublicKey(String publicKeyHex) {
        if (publicKeyHex == null || publicKeyHex.length() != KEY_LENGTH * 2) {
            return false;
        }
        try {
            hex.parseHex(publicKeyHex);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String sha256Hex(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return hex.formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Builds the DID document served with an agent profile.
     */
    public Map<String, Object> didDocument(String did, String publicKeyHex, String controller) {
        String keyId = did + "#key-1";
        Map<String, Object> method = new LinkedHashMap<>();
        method.put("id", keyId);
        method.put("type", "Ed25519VerificationKey2020");
        method.put("controller", did);
        method.put("publicKeyHex", publicKeyHex);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("@context", List.of("https://www.w3.org/ns/did/v1"));
        document.put("id", did);
        document.put("verificationMethod", List.of(method));
        document.put("authentication", List.of(keyId));
        document.put("controller", controller != null && !controller.isBlank() ? controller : did);
        return document;
    }

    private PublicKey publicKeyFromHex(String publicKeyHex) throws GeneralSecurityException {
        byte[] raw = hex.parseHex(publicKeyHex);
        if (raw.length != KEY_LENGTH) {
            throw new InvalidKeyException("Ed25519 public key must be 32 bytes");
        }
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(concat(X509_PREFIX, raw)));
    }

    private PrivateKey privateKeyFromHex(String privateKeyHex) {
        if (privateKeyHex == null) {
            throw new IllegalArgumentException("Private key cannot be null");
        }
        byte[] raw = hex.parseHex(privateKeyHex);
        if (raw.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519 private key must be 32 bytes");
        }
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(concat(PKCS8_PREFIX, raw)));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid Ed25519 private key", e);
        }
    }

    private static byte[] tail(byte[] encoded) {
        return Arrays.copyOfRange(encoded, encoded.length - KEY_LENGTH, encoded.length);
    }

    private static byte[] concat(byte[] prefix, byte[] raw) {
        byte[] out = Arrays.copyOf(prefix, prefix.length + raw.length);
        System.arraycopy(raw, 0, out, prefix.length, raw.length);
        return out;
    }

    /**
     * Hex encoded Ed25519 keypair.
     */
    public record AgentKeyPair(String publicKeyHex, String privateKeyHex) {
        @Override
        public String toString() {
            return "AgentKeyPair[publicKeyHex=" + publicKeyHex + ", privateKeyHex=<redacted>]";
        }
    }
}
