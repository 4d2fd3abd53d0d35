package io.surfworks.gatekeeper.server.store;

import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.core.tier.TierTable;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted license.
 *
 * @param id surrogate id
 * @param licenseKey the key handed to the customer
 * @param userId owning user
 * @param tier licensed tier
 * @param status lifecycle status
 * @param subscriptionId payment-provider subscription, or null for manual licenses
 * @param maxMachines simultaneously active machines allowed
 * @param dailyCallsOverride custom daily quota, or null for the tier default
 * @param concurrentSessionsOverride custom session cap, or null for the tier default
 * @param createdAt creation time
 * @param expiresAt hard expiry, or null for none
 * @param revokedAt revocation time, set only when revoked
 * @param revocationReason free-text reason for revocation or suspension
 */
public record LicenseRecord(
    String id,
    String licenseKey,
    String userId,
    Tier tier,
    LicenseStatus status,
    String subscriptionId,
    int maxMachines,
    Integer dailyCallsOverride,
    Integer concurrentSessionsOverride,
    Instant createdAt,
    Instant expiresAt,
    Instant revokedAt,
    String revocationReason
) {

    public LicenseRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(licenseKey, "licenseKey cannot be null");
        Objects.requireNonNull(tier, "tier cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        if (maxMachines < 1) {
            throw new IllegalArgumentException("maxMachines must be >= 1: " + maxMachines);
        }
    }

    /**
     * Tier limits with this license's overrides applied.
     */
    public TierLimits effectiveLimits(TierTable tiers) {
        return tiers.limits(tier).withOverrides(dailyCallsOverride, maxMachines, concurrentSessionsOverride);
    }

    public boolean isActive() {
        return status == LicenseStatus.ACTIVE;
    }
}
