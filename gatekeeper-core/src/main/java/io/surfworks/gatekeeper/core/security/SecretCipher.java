package io.surfworks.gatekeeper.core.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM encryption for secrets persisted to disk or to the database.
 *
 * <p>Envelope format: {@code base64(iv):base64(ciphertext || tag)}. A fresh
 * 12-byte IV is used for every call, so encrypting the same value twice gives
 * different envelopes.
 */
public final class SecretCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKeySpec key;

    /**
     * @param passphrase key material; hashed with SHA-256 into a 256-bit key
     */
    public SecretCipher(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("passphrase cannot be empty");
        }
        this.key = new SecretKeySpec(Hashes.sha256(passphrase.getBytes(StandardCharsets.UTF_8)), "AES");
    }

    public String encrypt(String plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder b64 = Base64.getEncoder();
            return b64.encodeToString(iv) + ":" + b64.encodeToString(sealed);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM not available", e);
        }
    }

    /**
     * @throws IntegrityException if the envelope is malformed, was produced with
     *         another key, or has been modified
     */
    public String decrypt(String envelope) throws IntegrityException {
        if (envelope == null) {
            throw new IntegrityException(IntegrityException.Reason.CORRUPTED_CIPHERTEXT, "No ciphertext");
        }
        int sep = envelope.indexOf(':');
        if (sep <= 0) {
            throw new IntegrityException(IntegrityException.Reason.CORRUPTED_CIPHERTEXT, "Malformed ciphertext envelope");
        }
        try {
            Base64.Decoder b64 = Base64.getDecoder();
            byte[] iv = b64.decode(envelope.substring(0, sep));
            byte[] sealed = b64.decode(envelope.substring(sep + 1));
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IntegrityException(IntegrityException.Reason.CORRUPTED_CIPHERTEXT,
                "Cannot decrypt secret: " + e.getClass().getSimpleName());
        }
    }
}
