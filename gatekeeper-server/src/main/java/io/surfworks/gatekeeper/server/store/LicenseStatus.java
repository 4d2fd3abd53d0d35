package io.surfworks.gatekeeper.server.store;

import java.util.Locale;

/**
 * Lifecycle status of a license record.
 */
public enum LicenseStatus {
    ACTIVE,
    EXPIRED,
    REVOKED,
    SUSPENDED;

    /**
     * Column value ("active", "revoked", ...).
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LicenseStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
