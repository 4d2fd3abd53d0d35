package io.surfworks.gatekeeper.server.store;

import java.util.Locale;

/**
 * Payment-provider view of a subscription.
 */
public enum SubscriptionState {
    ACTIVE,
    CANCELLED,
    PAST_DUE,
    EXPIRED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a column or provider value. Unknown values map to null.
     */
    public static SubscriptionState fromDbValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "active", "trialing" -> ACTIVE;
            case "cancelled", "canceled" -> CANCELLED;
            case "past_due" -> PAST_DUE;
            case "expired" -> EXPIRED;
            default -> null;
        };
    }

    /**
     * Whether this state starts a grace window rather than ending access at once.
     */
    public boolean hasGracePeriod() {
        return this == CANCELLED || this == PAST_DUE;
    }
}
