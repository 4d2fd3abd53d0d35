package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.core.tier.TierTable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Locally persisted license state. This is the client's offline source of truth.
 *
 * <p>Serialized as JSON by {@link ClientConfigStore}; the license key is held
 * in clear here and encrypted only in the file. Not thread-safe: owned by
 * {@link LicenseClient}, which guards it.
 */
public final class ClientConfig {

    String licenseKey;
    Tier tier;
    List<String> features;
    TierLimits limits;
    Usage usage;
    ValidationCache validationCache;
    SubscriptionStatus subscriptionStatus;
    String machineId;

    static final class Usage {
        int callsToday;
        LocalDate lastResetDate;

        Usage(int callsToday, LocalDate lastResetDate) {
            this.callsToday = callsToday;
            this.lastResetDate = lastResetDate;
        }
    }

    static final class ValidationCache {
        Instant lastValidated;
        Instant validUntil;
        boolean isValid;

        ValidationCache(Instant lastValidated, Instant validUntil, boolean isValid) {
            this.lastValidated = lastValidated;
            this.validUntil = validUntil;
            this.isValid = isValid;
        }
    }

    /**
     * FREE-tier state for a first run.
     */
    static ClientConfig defaults(TierTable tiers, String machineId, LocalDate today) {
        ClientConfig config = new ClientConfig();
        config.applyEntitlements(Tier.FREE, tiers.features(Tier.FREE), tiers.limits(Tier.FREE));
        config.usage = new Usage(0, today);
        config.machineId = machineId;
        return config;
    }

    void applyEntitlements(Tier tier, List<String> features, TierLimits limits) {
        this.tier = tier;
        this.features = new ArrayList<>(features);
        this.limits = limits;
    }

    /**
     * Whether a successful validation is recorded and still inside its window.
     */
    boolean hasUsableValidation(Instant now) {
        return validationCache != null
            && validationCache.isValid
            && validationCache.lastValidated != null
            && validationCache.validUntil != null
            && !now.isBefore(validationCache.lastValidated)
            && now.isBefore(validationCache.validUntil);
    }

    public String getLicenseKey() {
        return licenseKey;
    }

    public Tier getTier() {
        return tier;
    }

    public List<String> getFeatures() {
        return List.copyOf(features);
    }

    public TierLimits getLimits() {
        return limits;
    }

    public int getCallsToday() {
        return usage.callsToday;
    }

    public LocalDate getLastResetDate() {
        return usage.lastResetDate;
    }

    public Instant getLastValidated() {
        return validationCache != null ? validationCache.lastValidated : null;
    }

    public Instant getValidUntil() {
        return validationCache != null ? validationCache.validUntil : null;
    }

    public String getMachineId() {
        return machineId;
    }
}
