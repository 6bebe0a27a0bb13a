package com.switchboard.security.testing;

import com.switchboard.security.ConnectionCredentials;
import com.switchboard.security.Ed25519Signatures;
import com.switchboard.security.SigningKeyPair;

/**
 * Factory for signed {@link ConnectionCredentials} in tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope
 * through a regular dependency. Package {@code testing} marks it as test-only.
 */
public final class TestTerminalCredentials {

    private TestTerminalCredentials() {
        // utility class
    }

    /**
     * Creates valid credentials for {@code terminalId} under a freshly generated tenant key.
     */
    public static ConnectionCredentials create(String terminalId) {
        return createFor(Ed25519Signatures.generateKeyPair(), terminalId);
    }

    /**
     * Creates valid credentials for {@code terminalId} under the given tenant key.
     */
    public static ConnectionCredentials createFor(SigningKeyPair tenant, String terminalId) {
        String signature = Ed25519Signatures.sign(Ed25519Signatures.CHALLENGE, tenant.privateKey());
        return new ConnectionCredentials(tenant.publicKey(), terminalId, signature);
    }

    /**
     * Creates credentials whose signature was made with a different key than the one presented.
     */
    public static ConnectionCredentials createForged(String terminalId) {
        SigningKeyPair claimed = Ed25519Signatures.generateKeyPair();
        SigningKeyPair actual = Ed25519Signatures.generateKeyPair();
        String signature = Ed25519Signatures.sign(Ed25519Signatures.CHALLENGE, actual.privateKey());
        return new ConnectionCredentials(claimed.publicKey(), terminalId, signature);
    }
}
