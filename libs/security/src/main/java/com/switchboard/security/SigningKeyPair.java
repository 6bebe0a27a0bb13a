package com.switchboard.security;

/**
 * A hex-encoded Ed25519 key pair. The private key is the 32-byte seed.
 *
 * @param publicKey  hex public key; doubles as the tenant identifier
 * @param privateKey hex private key seed
 */
public record SigningKeyPair(String publicKey, String privateKey) {

    public SigningKeyPair {
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("publicKey must not be null or blank");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("privateKey must not be null or blank");
        }
    }

    /** Keeps the private key out of log output. */
    @Override
    public String toString() {
        return "SigningKeyPair[publicKey=" + publicKey + "]";
    }
}
