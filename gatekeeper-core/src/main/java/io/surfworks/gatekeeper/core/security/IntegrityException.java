package io.surfworks.gatekeeper.core.security;

/**
 * Thrown when a signed payload fails verification.
 *
 * <p>Integrity failures are fatal to the request that carried them and are
 * never retried.
 */
public class IntegrityException extends Exception {

    public enum Reason {
        MISSING_SIGNATURE,
        BAD_SIGNATURE,
        STALE_TIMESTAMP,
        CORRUPTED_CIPHERTEXT
    }

    private final Reason reason;

    public IntegrityException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
