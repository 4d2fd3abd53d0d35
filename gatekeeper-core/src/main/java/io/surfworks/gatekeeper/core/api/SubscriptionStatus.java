package io.surfworks.gatekeeper.core.api;

import com.google.gson.annotations.SerializedName;

/**
 * Subscription standing as reported in a validation result.
 */
public enum SubscriptionStatus {
    @SerializedName("active")
    ACTIVE,

    @SerializedName("grace_period")
    GRACE_PERIOD,

    @SerializedName("expired")
    EXPIRED,

    @SerializedName("cancelled")
    CANCELLED
}
