package com.switchboard.security;

/**
 * Validates connection credentials before a WebSocket upgrade is accepted.
 * <p>
 * Checks run in a fixed order and the first failure wins, so the logged reason always
 * names the earliest missing or invalid component. The authenticator is stateless;
 * recording the tenant's signature-of-record is the caller's job once this returns.
 */
public final class ConnectionAuthenticator {

    private final SignatureVerifier verifier;

    public ConnectionAuthenticator() {
        this(Ed25519Signatures.VERIFIER);
    }

    public ConnectionAuthenticator(SignatureVerifier verifier) {
        if (verifier == null) {
            throw new IllegalArgumentException("verifier must not be null");
        }
        this.verifier = verifier;
    }

    /**
     * @param credentials the presented credentials
     * @throws AuthenticationException with the reason if the credentials are rejected
     */
    public void authenticate(ConnectionCredentials credentials) {
        if (credentials == null) {
            throw new AuthenticationException("credentials are required");
        }
        if (isBlank(credentials.publicKey())) {
            throw new AuthenticationException("public_key is required");
        }
        if (isBlank(credentials.terminalId())) {
            throw new AuthenticationException("terminal_id is required");
        }
        if (isBlank(credentials.signature())) {
            throw new AuthenticationException("signature is required");
        }
        if (!verifier.verify(Ed25519Signatures.CHALLENGE, credentials.signature(), credentials.publicKey())) {
            throw new AuthenticationException("signature is invalid");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
