package com.switchboard.security;

/**
 * Credentials a terminal presents on the upgrade request query string.
 * Any component may be null when the client omitted it; {@link ConnectionAuthenticator}
 * decides what is acceptable.
 *
 * @param publicKey  tenant public key ({@code public_key})
 * @param terminalId terminal id within the tenant ({@code terminal_id})
 * @param signature  signature over {@link Ed25519Signatures#CHALLENGE} ({@code signature})
 */
public record ConnectionCredentials(String publicKey, String terminalId, String signature) {

    public static final String PARAM_PUBLIC_KEY = "public_key";
    public static final String PARAM_TERMINAL_ID = "terminal_id";
    public static final String PARAM_SIGNATURE = "signature";

    /** Hides the signature from log output. */
    @Override
    public String toString() {
        return "ConnectionCredentials[publicKey=" + publicKey + ", terminalId=" + terminalId + "]";
    }
}
