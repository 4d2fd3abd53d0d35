package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.tier.Tier;

import java.time.Instant;

/**
 * Snapshot of the client's license state, for status displays.
 *
 * @param tier tier in effect
 * @param hasLicense whether a license key is configured
 * @param maskedKey masked license key, or null
 * @param featureCount number of features available
 * @param callsToday calls recorded today
 * @param dailyLimit daily quota, -1 for unlimited
 * @param subscriptionStatus standing reported by the last successful validation
 * @param lastValidated last successful validation, or null
 * @param validUntil end of the offline window, or null
 * @param enforcementBypassed whether gating is disabled for this process
 * @param machineId this installation's machine id
 * @param transport name of the transport used to reach the authority
 */
public record ClientStatus(
    Tier tier,
    boolean hasLicense,
    String maskedKey,
    int featureCount,
    int callsToday,
    int dailyLimit,
    SubscriptionStatus subscriptionStatus,
    Instant lastValidated,
    Instant validUntil,
    boolean enforcementBypassed,
    String machineId,
    String transport
) {

    /**
     * Calls left today, or -1 when unlimited.
     */
    public int remainingCalls() {
        if (dailyLimit < 0) {
            return -1;
        }
        return Math.max(0, dailyLimit - callsToday);
    }
}
