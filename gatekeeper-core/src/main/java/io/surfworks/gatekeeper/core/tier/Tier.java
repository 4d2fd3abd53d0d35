package io.surfworks.gatekeeper.core.tier;

/**
 * License tiers.
 *
 * <p>Tiers are strictly nested: every feature of a tier is also part of every
 * higher tier. Declaration order is the nesting order, so {@link #ordinal()}
 * comparisons are meaningful. Feature lists and limits live in the shared
 * {@link TierTable}; this enum only carries identity.
 */
public enum Tier {

    /**
     * Free tier - no license key required, daily call quota.
     */
    FREE("Free", "FREE"),

    /**
     * Pro - unlimited calls for individual developers.
     */
    PRO("Pro", "PRO"),

    /**
     * Enterprise - team features and custom limits.
     */
    ENTERPRISE("Enterprise", "ENT");

    private final String displayName;
    private final String keyPrefix;

    Tier(String displayName, String keyPrefix) {
        this.displayName = displayName;
        this.keyPrefix = keyPrefix;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Prefix used as the first segment of license keys for this tier.
     */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    public boolean isPaid() {
        return this != FREE;
    }

    /**
     * Whether this tier includes everything {@code other} includes.
     */
    public boolean includes(Tier other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Resolve a tier from a license key prefix.
     *
     * @param prefix the first key segment ("FREE", "PRO", "ENT")
     * @return the matching tier, or null if the prefix is unknown
     */
    public static Tier fromKeyPrefix(String prefix) {
        if (prefix == null) {
            return null;
        }
        for (Tier tier : values()) {
            if (tier.keyPrefix.equals(prefix)) {
                return tier;
            }
        }
        return null;
    }
}
