package io.surfworks.gatekeeper.server.subscription;

/**
 * What {@link SubscriptionSync} did with an event.
 */
public enum SyncOutcome {
    /** State was updated. */
    PROCESSED,
    /** The event was already processed; nothing changed. */
    DUPLICATE,
    /** Unknown type or subscription; recorded but nothing changed. */
    IGNORED
}
