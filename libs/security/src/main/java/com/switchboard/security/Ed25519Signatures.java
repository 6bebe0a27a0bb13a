package com.switchboard.security;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.Ed25519KeyPairGenerator;
import org.bouncycastle.crypto.params.Ed25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Ed25519 signing primitives over hex-encoded keys and signatures.
 * <p>
 * Terminals prove ownership of a tenant key by signing {@link #CHALLENGE}; the hub only
 * ever calls {@link #verify}. {@link #sign} and key generation exist for the admin key
 * bootstrap and for clients written against this library.
 */
public final class Ed25519Signatures {

    /** The fixed message signed by every connecting terminal. */
    public static final String CHALLENGE = "";

    /** Default {@link SignatureVerifier} backed by {@link #verify}. */
    public static final SignatureVerifier VERIFIER = Ed25519Signatures::verify;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Ed25519Signatures() {
        // utility class
    }

    /**
     * Generates a fresh key pair.
     */
    public static SigningKeyPair generateKeyPair() {
        Ed25519KeyPairGenerator generator = new Ed25519KeyPairGenerator();
        generator.init(new Ed25519KeyGenerationParameters(RANDOM));
        AsymmetricCipherKeyPair pair = generator.generateKeyPair();
        var privateKey = (Ed25519PrivateKeyParameters) pair.getPrivate();
        var publicKey = (Ed25519PublicKeyParameters) pair.getPublic();
        return new SigningKeyPair(Hex.toHexString(publicKey.getEncoded()), Hex.toHexString(privateKey.getEncoded()));
    }

    /**
     * Restores the key pair for a hex-encoded private key seed.
     *
     * @throws IllegalArgumentException if the key is not 32 bytes of hex
     */
    public static SigningKeyPair fromPrivateKey(String privateKeyHex) {
        Ed25519PrivateKeyParameters privateKey = parsePrivateKey(privateKeyHex);
        return new SigningKeyPair(
                Hex.toHexString(privateKey.generatePublicKey().getEncoded()),
                Hex.toHexString(privateKey.getEncoded()));
    }

    /**
     * Signs {@code message} (UTF-8) and returns the hex signature.
     *
     * @throws IllegalArgumentException if the private key cannot be parsed
     */
    public static String sign(String message, String privateKeyHex) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, parsePrivateKey(privateKeyHex));
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        signer.update(bytes, 0, bytes.length);
        return Hex.toHexString(signer.generateSignature());
    }

    /**
     * Verifies a hex signature over {@code message} (UTF-8). Malformed keys or signatures
     * yield {@code false}.
     */
    public static boolean verify(String message, String signatureHex, String publicKeyHex) {
        if (message == null || signatureHex == null || publicKeyHex == null) {
            return false;
        }
        byte[] signature;
        byte[] publicKey;
        try {
            signature = Hex.decode(signatureHex);
            publicKey = Hex.decode(publicKeyHex);
        } catch (DecoderException e) {
            return false;
        }
        if (signature.length != Ed25519PrivateKeyParameters.SIGNATURE_SIZE
                || publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE) {
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        try {
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        verifier.update(bytes, 0, bytes.length);
        return verifier.verifySignature(signature);
    }

    private static Ed25519PrivateKeyParameters parsePrivateKey(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new IllegalArgumentException("private key must not be null or blank");
        }
        byte[] seed;
        try {
            seed = Hex.decode(privateKeyHex.strip());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("private key is not valid hex", e);
        }
        if (seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException(
                    "private key must be %d bytes, got %d".formatted(Ed25519PrivateKeyParameters.KEY_SIZE, seed.length));
        }
        return new Ed25519PrivateKeyParameters(seed, 0);
    }
}
