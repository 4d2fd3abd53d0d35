package io.surfworks.gatekeeper.server.authority;

import io.surfworks.gatekeeper.core.api.ErrorCode;
import io.surfworks.gatekeeper.core.api.SubscriptionInfo;
import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.api.UsageSnapshot;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.security.FingerprintHasher;
import io.surfworks.gatekeeper.core.security.LicenseKeys;
import io.surfworks.gatekeeper.core.security.SecurityEvents;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.core.tier.TierTable;
import io.surfworks.gatekeeper.server.store.CachedValidation;
import io.surfworks.gatekeeper.server.store.LicenseRecord;
import io.surfworks.gatekeeper.server.store.LicenseStatus;
import io.surfworks.gatekeeper.server.store.LicenseStore;
import io.surfworks.gatekeeper.server.store.MachineRecord;
import io.surfworks.gatekeeper.server.store.MachineRegistration;
import io.surfworks.gatekeeper.server.store.StoreException;
import io.surfworks.gatekeeper.server.store.SubscriptionRecord;
import io.surfworks.gatekeeper.server.store.UsageRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server-side authority that issues, validates and revokes licenses.
 *
 * <p>Validation order:
 * <ol>
 *   <li>key format (no I/O)</li>
 *   <li>validation cache, when the requesting machine holds a seat in the entry</li>
 *   <li>license lookup and status: revoked, suspended, expired</li>
 *   <li>expiry and subscription grace windows</li>
 *   <li>fingerprint core match for known machines</li>
 *   <li>atomic seat admission</li>
 *   <li>usage recording, response assembly, caching</li>
 * </ol>
 *
 * <p>Denials are returned as {@link ValidationResult} values. Storage
 * failures become {@link ErrorCode#VALIDATION_ERROR}, which clients treat as
 * transient.
 */
public class LicenseAuthority {

    private static final Logger LOG = Logger.getLogger(LicenseAuthority.class.getName());

    /**
     * Default lifetime of a cached validation.
     */
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    /**
     * How long a license keeps validating after its hard expiry.
     */
    public static final Duration EXPIRY_GRACE = Duration.ofDays(7);

    private static final String UNKNOWN = "unknown";
    private static final int REPORT_DAYS = 30;

    private final LicenseStore store;
    private final TierTable tiers;
    private final FingerprintHasher fingerprints;
    private final Clock clock;
    private final Duration cacheTtl;

    public LicenseAuthority(LicenseStore store, TierTable tiers, FingerprintHasher fingerprints) {
        this(store, tiers, fingerprints, Clock.systemUTC(), DEFAULT_CACHE_TTL);
    }

    public LicenseAuthority(LicenseStore store, TierTable tiers, FingerprintHasher fingerprints,
                            Clock clock, Duration cacheTtl) {
        this.store = store;
        this.tiers = tiers;
        this.fingerprints = fingerprints;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
    }

    public TierTable tiers() {
        return tiers;
    }

    // ===== Validation =====

    /**
     * Validate a license for a machine.
     */
    public ValidationResult validateLicense(ValidationRequest request) {
        if (request == null || request.licenseKey() == null || !LicenseKeys.isValidFormat(request.licenseKey())) {
            return deny(ErrorCode.INVALID_FORMAT, "Invalid license key format");
        }
        if (request.machineId() == null || request.machineId().isBlank()) {
            return deny(ErrorCode.INVALID_FORMAT, "Machine id is required");
        }

        try {
            return validateWellFormed(request);
        } catch (StoreException e) {
            LOG.log(Level.WARNING, "Validation failed for " + LicenseKeys.mask(request.licenseKey()), e);
            return deny(ErrorCode.VALIDATION_ERROR, "License validation failed, please retry");
        }
    }

    private ValidationResult validateWellFormed(ValidationRequest request) {
        String key = request.licenseKey();
        String machineId = request.machineId();
        Instant now = clock.instant();

        Optional<CachedValidation> cached = store.getCachedValidation(key, now);
        if (cached.isPresent() && cached.get().admits(machineId) && isStillCurrent(cached.get().result(), now)) {
            LOG.fine("Cache hit for " + LicenseKeys.mask(key));
            return cached.get().result();
        }

        Optional<LicenseRecord> found = readWithRetry("load license", () -> store.getLicenseByKey(key));
        if (found.isEmpty()) {
            LOG.info("Unknown license " + LicenseKeys.mask(key));
            return deny(ErrorCode.LICENSE_NOT_FOUND, "License not found");
        }
        LicenseRecord license = found.get();

        switch (license.status()) {
            case REVOKED:
                return deny(ErrorCode.LICENSE_REVOKED, "License has been revoked"
                    + (license.revocationReason() != null ? ": " + license.revocationReason() : ""));
            case SUSPENDED:
                return deny(ErrorCode.LICENSE_SUSPENDED, "License is suspended");
            case EXPIRED:
                return deny(ErrorCode.LICENSE_EXPIRED, "License has expired");
            default:
                break;
        }

        Standing standing = standingOf(license, now);
        if (standing.expired()) {
            store.updateLicenseStatus(key, LicenseStatus.EXPIRED, standing.reason(), now);
            LOG.info("License " + LicenseKeys.mask(key) + " expired: " + standing.reason());
            return deny(ErrorCode.LICENSE_EXPIRED, standing.reason());
        }

        String platform = orUnknown(request.platform());
        String arch = orUnknown(request.arch());
        FingerprintHasher.Fingerprint fingerprint =
            fingerprints.fingerprint(platform, arch, machineId, request.version());

        Optional<MachineRecord> known = store.findMachine(license.id(), machineId);
        if (known.isPresent() && known.get().active() && known.get().components() != null
                && !fingerprints.verify(new FingerprintHasher.Fingerprint(
                    known.get().fingerprintHash(), known.get().components()))) {
            // Stored under another secret or altered outside the authority; registration re-issues it
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("license", LicenseKeys.mask(key));
            details.put("machineId", machineId);
            SecurityEvents.record("fingerprint_unverified", SecurityEvents.Severity.MEDIUM, details);
        }
        if (known.isPresent() && known.get().active() && known.get().components() != null
                && !FingerprintHasher.matches(known.get().components(), fingerprint.components())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("license", LicenseKeys.mask(key));
            details.put("machineId", machineId);
            details.put("platform", platform);
            details.put("arch", arch);
            SecurityEvents.record("fingerprint_mismatch", SecurityEvents.Severity.HIGH, details);
            return deny(ErrorCode.FINGERPRINT_MISMATCH, "Machine fingerprint does not match the registered machine");
        }

        MachineRegistration registration = store.registerMachine(
            license.id(), machineId, fingerprint.hash(), fingerprint.components(), now);
        if (!registration.isAdmitted()) {
            LOG.info("Machine limit reached for " + LicenseKeys.mask(key) + " (" + license.maxMachines() + ")");
            return deny(ErrorCode.MACHINE_LIMIT_EXCEEDED,
                "Machine limit exceeded (" + license.maxMachines() + " machines allowed)");
        }
        if (registration == MachineRegistration.ADMITTED) {
            LOG.info("Admitted machine " + machineId + " on " + LicenseKeys.mask(key));
        }

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        store.recordUsage(license.id(), machineId, request.features(), today);
        int callsToday = store.getDailyUsage(license.id(), today);
        List<MachineRecord> machines = store.getMachinesForLicense(license.id());

        TierLimits limits = license.effectiveLimits(tiers);
        ValidationResult result = ValidationResult.valid(
            license.tier(),
            tiers.features(license.tier()),
            limits,
            new UsageSnapshot(callsToday, machines.size(), 0),
            standing.info()
        );

        List<String> machineIds = new ArrayList<>(machines.size());
        for (MachineRecord machine : machines) {
            machineIds.add(machine.machineId());
        }
        if (!store.setCachedValidation(key, result, machineIds, cacheTtl, now)) {
            LOG.fine("Not caching " + LicenseKeys.mask(key) + ": no longer active");
        }
        return result;
    }

    /**
     * Where a license stands against its expiry and subscription.
     */
    private record Standing(SubscriptionInfo info, boolean expired, String reason) {
        static Standing current(SubscriptionInfo info) {
            return new Standing(info, false, null);
        }

        static Standing lapsed(String reason) {
            return new Standing(SubscriptionInfo.of(SubscriptionStatus.EXPIRED), true, reason);
        }
    }

    private Standing standingOf(LicenseRecord license, Instant now) {
        Instant expiresAt = license.expiresAt();
        Instant expiryGraceEnds = expiresAt != null ? expiresAt.plus(EXPIRY_GRACE) : null;
        if (expiryGraceEnds != null && !now.isBefore(expiryGraceEnds)) {
            return Standing.lapsed("License expired on " + expiresAt);
        }

        if (license.subscriptionId() != null) {
            Optional<SubscriptionRecord> subscription =
                readWithRetry("load subscription", () -> store.findSubscription(license.subscriptionId()));
            if (subscription.isPresent() && subscription.get().state() != null) {
                SubscriptionRecord sub = subscription.get();
                switch (sub.state()) {
                    case EXPIRED:
                        return Standing.lapsed("Subscription has expired");
                    case CANCELLED:
                    case PAST_DUE:
                        if (sub.gracePeriodEnds() == null || !now.isBefore(sub.gracePeriodEnds())) {
                            return Standing.lapsed("Subscription grace period ended");
                        }
                        return Standing.current(new SubscriptionInfo(
                            SubscriptionStatus.GRACE_PERIOD, expiresAt, sub.gracePeriodEnds()));
                    default:
                        break;
                }
            }
        }

        if (expiresAt != null && now.isAfter(expiresAt)) {
            return Standing.current(new SubscriptionInfo(SubscriptionStatus.GRACE_PERIOD, expiresAt, expiryGraceEnds));
        }
        return Standing.current(new SubscriptionInfo(SubscriptionStatus.ACTIVE, expiresAt, null));
    }

    /**
     * A cached result stops answering once a grace window it reports has closed.
     */
    private static boolean isStillCurrent(ValidationResult result, Instant now) {
        SubscriptionInfo subscription = result.subscription();
        if (subscription == null) {
            return true;
        }
        if (subscription.gracePeriodEnds() != null && !now.isBefore(subscription.gracePeriodEnds())) {
            return false;
        }
        return subscription.expiresAt() == null || now.isBefore(subscription.expiresAt().plus(EXPIRY_GRACE));
    }

    // ===== Administration =====

    /**
     * Issue and persist a new license.
     */
    public LicenseRecord generateLicense(GenerateRequest request) {
        if (request.userId() == null || request.userId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (request.tier() == null) {
            throw new IllegalArgumentException("tier is required");
        }
        int maxMachines = request.maxMachines() != null
            ? request.maxMachines()
            : tiers.limits(request.tier()).maxMachines();

        LicenseRecord license = new LicenseRecord(
            UUID.randomUUID().toString(),
            LicenseKeys.format(request.tier(), request.userId()),
            request.userId(),
            request.tier(),
            LicenseStatus.ACTIVE,
            request.subscriptionId(),
            maxMachines,
            request.dailyCalls(),
            request.concurrentSessions(),
            clock.instant(),
            request.expiresAt(),
            null,
            null
        );
        store.createLicense(license);
        LOG.info("Generated " + license.tier() + " license " + LicenseKeys.mask(license.licenseKey())
            + " for user " + license.userId());
        return license;
    }

    /**
     * Revoke a license. The cached validation is dropped in the same
     * transaction, so the next validation is denied.
     *
     * @return false if no license has this key
     */
    public boolean revokeLicense(String licenseKey, String reason) {
        boolean updated = store.updateLicenseStatus(licenseKey, LicenseStatus.REVOKED, reason, clock.instant());
        if (updated) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("license", LicenseKeys.mask(licenseKey));
            details.put("reason", reason);
            SecurityEvents.record("license_revoked", SecurityEvents.Severity.MEDIUM, details);
        }
        return updated;
    }

    /**
     * @return false if no license has this key
     */
    public boolean suspendLicense(String licenseKey, String reason) {
        boolean updated = store.updateLicenseStatus(licenseKey, LicenseStatus.SUSPENDED, reason, clock.instant());
        if (updated) {
            LOG.info("Suspended " + LicenseKeys.mask(licenseKey) + (reason != null ? ": " + reason : ""));
        }
        return updated;
    }

    /**
     * Free a machine's seat.
     *
     * @return false if the license or an active seat for the machine does not exist
     */
    public boolean deactivateMachine(String licenseKey, String machineId) {
        Optional<LicenseRecord> license = store.getLicenseByKey(licenseKey);
        if (license.isEmpty()) {
            return false;
        }
        boolean freed = store.deactivateMachine(license.get().id(), machineId);
        if (freed) {
            LOG.info("Deactivated machine " + machineId + " on " + LicenseKeys.mask(licenseKey));
        }
        return freed;
    }

    /**
     * Seats and the last 30 days of usage.
     */
    public Optional<LicenseUsageReport> getLicenseUsage(String licenseKey) {
        Optional<LicenseRecord> found = readWithRetry("load license", () -> store.getLicenseByKey(licenseKey));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        LicenseRecord license = found.get();
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);

        List<LicenseUsageReport.Seat> seats = new ArrayList<>();
        for (MachineRecord machine : store.getMachinesForLicense(license.id())) {
            seats.add(new LicenseUsageReport.Seat(machine.machineId(), machine.firstSeen(), machine.lastSeen()));
        }

        Map<LocalDate, Integer> totals = new LinkedHashMap<>();
        for (UsageRecord row : store.getUsageHistory(license.id(), today.minusDays(REPORT_DAYS - 1L), today)) {
            totals.merge(row.date(), row.callCount(), Integer::sum);
        }
        List<LicenseUsageReport.DayTotal> daily = new ArrayList<>();
        totals.forEach((date, calls) -> daily.add(new LicenseUsageReport.DayTotal(date, calls)));

        return Optional.of(new LicenseUsageReport(
            LicenseKeys.mask(license.licenseKey()),
            license.tier(),
            license.status(),
            license.effectiveLimits(tiers),
            totals.getOrDefault(today, 0),
            seats,
            daily
        ));
    }

    /**
     * Apply the usage retention policy.
     *
     * @return rows deleted
     */
    public int purgeUsageBefore(LocalDate cutoff) {
        return store.purgeUsageBefore(cutoff);
    }

    /**
     * @return cache entries removed
     */
    public int cleanupExpiredCache() {
        int removed = store.cleanupExpiredCache(clock.instant());
        if (removed > 0) {
            LOG.fine("Removed " + removed + " expired cache entries");
        }
        return removed;
    }

    // ===== Helpers =====

    private ValidationResult deny(ErrorCode code, String message) {
        return ValidationResult.denied(code, message, tiers);
    }

    private static <T> T readWithRetry(String operation, Supplier<T> read) {
        try {
            return read.get();
        } catch (StoreException e) {
            LOG.log(Level.FINE, "Retrying " + operation + " after store failure", e);
            return read.get();
        }
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
