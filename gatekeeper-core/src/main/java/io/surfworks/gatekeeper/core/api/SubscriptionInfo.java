package io.surfworks.gatekeeper.core.api;

import java.time.Instant;

/**
 * Subscription block of a validation result.
 *
 * @param status current standing
 * @param expiresAt license expiry (null = perpetual)
 * @param gracePeriodEnds end of the current grace window, if any
 */
public record SubscriptionInfo(
    SubscriptionStatus status,
    Instant expiresAt,
    Instant gracePeriodEnds
) {

    public static SubscriptionInfo of(SubscriptionStatus status) {
        return new SubscriptionInfo(status, null, null);
    }
}
