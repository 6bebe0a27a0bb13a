package com.switchboard.security;

/**
 * Verifies a detached signature over a message.
 * <p>
 * Implementations return {@code false} for any malformed input instead of throwing,
 * so callers can treat "cannot parse" and "does not verify" the same way.
 */
@FunctionalInterface
public interface SignatureVerifier {

    /**
     * @param message   the signed message
     * @param signature hex-encoded signature
     * @param publicKey hex-encoded public key
     * @return true if the signature is valid for the message under the key
     */
    boolean verify(String message, String signature, String publicKey);
}
