package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.ErrorCode;
import io.surfworks.gatekeeper.core.tier.Tier;

/**
 * Result of a license activation.
 *
 * @param success whether the key was accepted
 * @param tier the tier now in effect
 * @param featureCount features unlocked by the tier
 * @param error error message if failed
 * @param errorCode machine-readable error code; {@link ErrorCode#VALIDATION_ERROR}
 *        when the license server could not be reached
 */
public record ActivationResult(
    boolean success,
    Tier tier,
    int featureCount,
    String error,
    ErrorCode errorCode
) {

    /**
     * Successful activation.
     */
    public static ActivationResult success(Tier tier, int featureCount) {
        return new ActivationResult(true, tier, featureCount, null, null);
    }

    /**
     * Failed activation. The tier reported is the one still in effect.
     */
    public static ActivationResult failure(Tier current, String error, ErrorCode code) {
        return new ActivationResult(false, current, 0, error, code);
    }

    /**
     * Whether the failure was the server being unreachable rather than a refusal.
     */
    public boolean isNetworkFailure() {
        return !success && errorCode == ErrorCode.VALIDATION_ERROR;
    }
}
