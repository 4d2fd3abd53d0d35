package io.surfworks.gatekeeper.core.api;

/**
 * Machine-readable reasons a validation did not succeed.
 */
public enum ErrorCode {
    LICENSE_NOT_FOUND,
    LICENSE_REVOKED,
    LICENSE_SUSPENDED,
    LICENSE_EXPIRED,
    MACHINE_LIMIT_EXCEEDED,
    INVALID_FORMAT,
    FINGERPRINT_MISMATCH,
    VALIDATION_ERROR;

    /**
     * Authorization outcomes are final: the client must act on them rather
     * than fall back to a cached grant.
     */
    public boolean isAuthoritative() {
        return this != VALIDATION_ERROR;
    }
}
