package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.tier.Tier;

/**
 * Result of a feature gate check.
 *
 * @param allowed whether the call may proceed
 * @param tier the tier the decision was made under
 * @param reason why the call was denied (null when allowed)
 * @param denial category of the denial (null when allowed)
 * @param requiredTier smallest tier offering the feature, if known
 * @param upgradeUrl where to upgrade (denials only)
 */
public record FeatureAccess(
    boolean allowed,
    Tier tier,
    String reason,
    Denial denial,
    Tier requiredTier,
    String upgradeUrl
) {

    public enum Denial {
        /** The feature exists but needs a higher tier. */
        TIER_REQUIRED,
        /** No tier offers the feature. */
        UNKNOWN_FEATURE,
        /** The daily call quota is used up. */
        DAILY_LIMIT_REACHED
    }

    /**
     * Call allowed.
     */
    public static FeatureAccess allowed(Tier tier) {
        return new FeatureAccess(true, tier, null, null, null, null);
    }

    /**
     * Call denied.
     */
    public static FeatureAccess denied(Tier tier, Denial denial, String reason,
                                       Tier requiredTier, String upgradeUrl) {
        return new FeatureAccess(false, tier, reason, denial, requiredTier, upgradeUrl);
    }
}
