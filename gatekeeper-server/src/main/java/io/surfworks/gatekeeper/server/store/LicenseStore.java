package io.surfworks.gatekeeper.server.store;

import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.security.FingerprintComponents;
import io.surfworks.gatekeeper.core.tier.Tier;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of the license authority.
 *
 * <p>Every counter mutation is a single atomic operation at this layer:
 * callers never read a count and then write based on it. All methods throw
 * {@link StoreException} when the backing store fails.
 */
public interface LicenseStore {

    // ===== Licenses =====

    void createLicense(LicenseRecord license);

    Optional<LicenseRecord> getLicenseByKey(String licenseKey);

    /**
     * The license issued for a provider subscription, if any.
     */
    Optional<LicenseRecord> findLicenseBySubscription(String subscriptionId);

    /**
     * Change a license's status and drop its cached validation in the same
     * transaction. Sets {@code revokedAt} when the new status is REVOKED.
     *
     * @return false if no license has this key
     */
    boolean updateLicenseStatus(String licenseKey, LicenseStatus status, String reason, Instant now);

    /**
     * Retarget a license to another tier and seat count. Drops its cached validation.
     */
    void updateLicenseTier(String licenseId, Tier tier, int maxMachines);

    /**
     * Set a new hard expiry. Drops the cached validation.
     */
    void updateLicenseExpiry(String licenseId, Instant expiresAt);

    // ===== Machines =====

    /**
     * Admit, refresh or reject a machine in one atomic step.
     *
     * <p>The seat count is read under a lock on the license row, in the same
     * transaction as the insert, so concurrent registrations for the same
     * license never exceed its {@code maxMachines}. A refresh stores the
     * given fingerprint in place of the previous one.
     */
    MachineRegistration registerMachine(String licenseId, String machineId, String fingerprintHash,
                                        FingerprintComponents components, Instant now);

    /**
     * Soft-deactivate a seat and drop the license's cached validation.
     *
     * @return false if the machine held no active seat
     */
    boolean deactivateMachine(String licenseId, String machineId);

    Optional<MachineRecord> findMachine(String licenseId, String machineId);

    /**
     * Active machines only.
     */
    List<MachineRecord> getMachinesForLicense(String licenseId);

    // ===== Usage =====

    /**
     * Increment the call count for {@code (licenseId, machineId, date)},
     * creating the row on the first call of the day.
     *
     * @return the count after the increment
     */
    int recordUsage(String licenseId, String machineId, List<String> features, LocalDate date);

    /**
     * Total calls across machines on a date.
     */
    int getDailyUsage(String licenseId, LocalDate date);

    /**
     * Usage rows in {@code [from, to]}, oldest first.
     */
    List<UsageRecord> getUsageHistory(String licenseId, LocalDate from, LocalDate to);

    /**
     * Delete usage rows dated before {@code cutoff}.
     *
     * @return rows deleted
     */
    int purgeUsageBefore(LocalDate cutoff);

    // ===== Validation cache =====

    Optional<CachedValidation> getCachedValidation(String licenseKey, Instant now);

    /**
     * Cache a result, but only while the license is still active. The
     * status is checked under the license row lock so a concurrent revoke
     * cannot be followed by this write.
     *
     * @return false if the license was no longer active and nothing was cached
     */
    boolean setCachedValidation(String licenseKey, ValidationResult result, List<String> machineIds,
                                Duration ttl, Instant now);

    void invalidateCachedValidation(String licenseKey);

    /**
     * @return entries removed
     */
    int cleanupExpiredCache(Instant now);

    // ===== Users, subscriptions, webhook events =====

    /**
     * Find a user by email, or create one. A null email always creates a new user.
     */
    UserRecord ensureUser(String email, String name);

    Optional<SubscriptionRecord> findSubscription(String subscriptionId);

    void saveSubscription(SubscriptionRecord subscription);

    /**
     * Record an incoming webhook event under its idempotency key.
     *
     * <p>A key seen before is handed out again only when it was never marked
     * processed and its earlier claim is older than the store's lease, so
     * concurrent redeliveries of one event are processed once.
     *
     * @return true if the caller should process the event, false if an
     *         event with this key was already processed or is being processed
     */
    boolean claimWebhookEvent(String idempotencyKey, String eventType, String subscriptionId,
                              String payload, Instant now);

    void markWebhookProcessed(String idempotencyKey, Instant now);
}
