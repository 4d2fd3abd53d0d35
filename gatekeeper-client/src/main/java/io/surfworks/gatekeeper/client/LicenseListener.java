package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.tier.Tier;

import java.time.LocalDate;

/**
 * Callbacks for license state changes.
 *
 * <p>Invoked on the thread that caused the change, which may be the client's
 * background thread. Implementations must be quick and must not call back
 * into the client from another thread while blocking.
 */
public interface LicenseListener {

    default void onInitialized(ClientStatus status) {}

    default void onActivated(Tier tier, int featureCount) {}

    /**
     * A validation succeeded and the entitlements were refreshed.
     */
    default void onUpdated(ValidationResult result) {}

    /**
     * The client fell back to the FREE tier.
     */
    default void onDowngraded(Tier previous, String reason) {}

    default void onUsageRecorded(String feature, int callsToday, int dailyLimit) {}

    /**
     * Only a few calls are left on today's quota.
     */
    default void onLowUsage(int remaining) {}

    default void onDailyReset(LocalDate date, Tier tier) {}
}
