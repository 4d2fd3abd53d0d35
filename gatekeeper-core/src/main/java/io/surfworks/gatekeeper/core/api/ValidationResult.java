package io.surfworks.gatekeeper.core.api;

import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.core.tier.TierTable;

import java.util.List;

/**
 * Outcome of a license validation.
 *
 * <p>Denials carry the FREE tier's features and limits, so a client that
 * applies a denied result ends up in the same state as one without a license.
 *
 * @param success whether the authority processed the request
 * @param isValid whether the license grants its tier
 * @param tier resolved tier
 * @param features features granted by the tier
 * @param limits effective limits (license overrides applied)
 * @param usage usage counters at validation time
 * @param subscription subscription standing
 * @param error human-readable denial reason
 * @param code machine-readable denial reason
 */
public record ValidationResult(
    boolean success,
    boolean isValid,
    Tier tier,
    List<String> features,
    TierLimits limits,
    UsageSnapshot usage,
    SubscriptionInfo subscription,
    String error,
    ErrorCode code
) {

    public ValidationResult {
        features = features != null ? List.copyOf(features) : List.of();
    }

    /**
     * A granted license.
     */
    public static ValidationResult valid(Tier tier, List<String> features, TierLimits limits,
                                         UsageSnapshot usage, SubscriptionInfo subscription) {
        return new ValidationResult(true, true, tier, features, limits, usage, subscription, null, null);
    }

    /**
     * A denial, carrying FREE-tier entitlements from the given table.
     */
    public static ValidationResult denied(ErrorCode code, String error, TierTable tiers) {
        return new ValidationResult(
            false, false, Tier.FREE,
            tiers.features(Tier.FREE),
            tiers.limits(Tier.FREE),
            UsageSnapshot.NONE,
            SubscriptionInfo.of(code == ErrorCode.LICENSE_REVOKED
                ? SubscriptionStatus.CANCELLED
                : SubscriptionStatus.EXPIRED),
            error,
            code
        );
    }

    /**
     * Whether this is a definitive refusal (as opposed to a failure to decide).
     */
    public boolean isAuthoritativeDenial() {
        return !isValid && (code == null || code.isAuthoritative());
    }
}
