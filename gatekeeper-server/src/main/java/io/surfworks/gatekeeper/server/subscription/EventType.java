package io.surfworks.gatekeeper.server.subscription;

/**
 * Subscription lifecycle events sent by the payment provider.
 */
public enum EventType {
    CREATED("subscription.created"),
    UPDATED("subscription.updated"),
    CANCELLED("subscription.cancelled"),
    RENEWED("subscription.renewed"),
    PAYMENT_FAILED("payment.failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Parse a wire name. {@code payment_failed} is accepted for PAYMENT_FAILED.
     *
     * @return the type, or null if unknown
     */
    public static EventType fromWireName(String name) {
        if (name == null) {
            return null;
        }
        if ("payment_failed".equals(name)) {
            return PAYMENT_FAILED;
        }
        for (EventType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
