package io.surfworks.gatekeeper.server.subscription;

import java.time.Instant;

/**
 * A webhook delivery from the payment provider.
 *
 * @param id provider event id, may be null
 * @param type wire event type, see {@link EventType}
 * @param timestamp when the provider emitted the event
 * @param data subscription payload
 */
public record SubscriptionEvent(String id, String type, Instant timestamp, Data data) {

    /**
     * @param subscriptionId provider subscription id
     * @param userId owning user, when the provider knows it
     * @param customerEmail customer email
     * @param customerName customer display name
     * @param status provider subscription status
     * @param planId provider plan id
     * @param expiresAt end of the paid period
     */
    public record Data(
        String subscriptionId,
        String userId,
        String customerEmail,
        String customerName,
        String status,
        String planId,
        Instant expiresAt
    ) {}

    public EventType eventType() {
        return EventType.fromWireName(type);
    }

    public String subscriptionId() {
        return data != null ? data.subscriptionId() : null;
    }
}
