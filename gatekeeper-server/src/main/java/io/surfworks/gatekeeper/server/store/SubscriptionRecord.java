package io.surfworks.gatekeeper.server.store;

import java.time.Instant;

/**
 * Latest known state of a payment-provider subscription.
 *
 * @param subscriptionId provider subscription id
 * @param userId owning user
 * @param planId provider plan id
 * @param state provider state
 * @param expiresAt end of the paid period, may be null
 * @param gracePeriodEnds end of the grace window after cancellation or payment failure
 * @param updatedAt last change
 */
public record SubscriptionRecord(
    String subscriptionId,
    String userId,
    String planId,
    SubscriptionState state,
    Instant expiresAt,
    Instant gracePeriodEnds,
    Instant updatedAt
) {

    public SubscriptionRecord withState(SubscriptionState newState, Instant newGracePeriodEnds, Instant now) {
        return new SubscriptionRecord(subscriptionId, userId, planId, newState, expiresAt, newGracePeriodEnds, now);
    }
}
