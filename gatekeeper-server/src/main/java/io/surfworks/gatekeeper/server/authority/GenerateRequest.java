package io.surfworks.gatekeeper.server.authority;

import io.surfworks.gatekeeper.core.tier.Tier;

import java.time.Instant;

/**
 * Parameters for issuing a new license.
 *
 * @param userId owning user, also seeds the key's user hash
 * @param tier licensed tier
 * @param subscriptionId provider subscription, or null for a manual license
 * @param expiresAt hard expiry, or null for none
 * @param maxMachines seat count, or null for the tier default
 * @param dailyCalls custom daily quota, or null for the tier default
 * @param concurrentSessions custom session cap, or null for the tier default
 */
public record GenerateRequest(
    String userId,
    Tier tier,
    String subscriptionId,
    Instant expiresAt,
    Integer maxMachines,
    Integer dailyCalls,
    Integer concurrentSessions
) {

    /**
     * A license with tier defaults and no expiry.
     */
    public static GenerateRequest of(String userId, Tier tier) {
        return new GenerateRequest(userId, tier, null, null, null, null, null);
    }

    public GenerateRequest withSubscription(String newSubscriptionId, Instant newExpiresAt) {
        return new GenerateRequest(userId, tier, newSubscriptionId, newExpiresAt,
            maxMachines, dailyCalls, concurrentSessions);
    }

    public GenerateRequest withMaxMachines(Integer newMaxMachines) {
        return new GenerateRequest(userId, tier, subscriptionId, expiresAt,
            newMaxMachines, dailyCalls, concurrentSessions);
    }
}
