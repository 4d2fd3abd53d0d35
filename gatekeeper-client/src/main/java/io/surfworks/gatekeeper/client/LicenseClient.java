package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.ErrorCode;
import io.surfworks.gatekeeper.core.api.LicenseTransport;
import io.surfworks.gatekeeper.core.api.OfflineTransport;
import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.api.TransportException;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.security.LicenseKeys;
import io.surfworks.gatekeeper.core.security.SecurityEvents;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.core.tier.TierTable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * In-process license enforcement.
 *
 * <p>Usage:
 * <pre>{@code
 * LicenseClient license = LicenseClient.create(ClientSettings.fromEnvironment());
 * license.initialize();
 *
 * FeatureAccess access = license.checkFeatureAccess("write_file");
 * if (!access.allowed()) {
 *     System.err.println(access.reason());
 *     return;
 * }
 * doWriteFile();
 * license.recordUsage("write_file");
 * }</pre>
 *
 * <p>Gate decisions are made from the locally persisted {@link ClientConfig} and
 * never wait for the network. The license is revalidated in the background
 * every five minutes; a result from the authority is applied as soon as it
 * arrives, while an unreachable authority leaves the last successful
 * validation in force for up to 24 hours, after which the client falls back
 * to the FREE tier.
 *
 * <p>Public methods are thread-safe. Calls to the authority are made outside
 * the client's lock with a bounded timeout.
 */
public class LicenseClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseClient.class.getName());

    static final Duration REVALIDATION_INTERVAL = Duration.ofMinutes(5);
    static final Duration OFFLINE_WINDOW = Duration.ofHours(24);
    static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(20);
    static final int LOW_USAGE_THRESHOLD = 5;

    private final ClientSettings settings;
    private final LicenseTransport transport;
    private final TierTable tiers;
    private final String machineId;
    private final Clock clock;
    private final Duration callTimeout;
    private final ClientConfigStore store;
    private final List<LicenseListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService remoteCalls;

    private ClientConfig config;
    private boolean initialized;
    private boolean closed;
    private Instant lastRevalidationAttempt = Instant.EPOCH;
    private Future<?> backgroundRevalidation = CompletableFuture.completedFuture(null);
    // Bumped whenever the configured key changes, so late answers for an old key are dropped
    private long keyGeneration;

    /**
     * Create a client with the standard tier table, this machine's id and the system clock.
     */
    public LicenseClient(ClientSettings settings, LicenseTransport transport) {
        this(settings, transport, TierTable.standard(), MachineFingerprint.generate(),
            Clock.systemDefaultZone(), DEFAULT_CALL_TIMEOUT);
    }

    LicenseClient(ClientSettings settings, LicenseTransport transport, TierTable tiers,
                  String machineId, Clock clock, Duration callTimeout) {
        this.settings = settings;
        this.transport = transport;
        this.tiers = tiers;
        this.machineId = machineId;
        this.clock = clock;
        this.callTimeout = callTimeout;
        this.store = new ClientConfigStore(settings.configDir(), machineId, tiers);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("gatekeeper-license"));
        this.remoteCalls = Executors.newCachedThreadPool(new DaemonThreadFactory("gatekeeper-license-call"));
    }

    /**
     * Create a client for the given settings: HTTP when a server URL is set,
     * offline otherwise.
     */
    public static LicenseClient create(ClientSettings settings) {
        LicenseTransport transport = settings.serverUrl() != null
            ? new HttpLicenseTransport(settings.serverUrl())
            : new OfflineTransport();
        return new LicenseClient(settings, transport);
    }

    public void addListener(LicenseListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LicenseListener listener) {
        listeners.remove(listener);
    }

    /**
     * Initialize with the license key from the settings, if any.
     */
    public void initialize() {
        initialize(settings.licenseKey());
    }

    /**
     * Load local state, start the daily reset timer and run the first validation.
     *
     * @param externalKey license key supplied from outside (environment or
     *        command line); used only when no key is configured yet
     */
    public void initialize(String externalKey) {
        boolean activateExternal;
        synchronized (this) {
            if (initialized) {
                return;
            }
            initialized = true;

            config = store.load(today());
            if (!machineId.equals(config.machineId)) {
                config.machineId = machineId;
            }
            if (config.licenseKey == null) {
                if (config.tier != Tier.FREE) {
                    LOG.warning("Config claims tier " + config.tier + " without a license key; using FREE");
                }
                // Keyless is FREE from the tier table, whatever the file lists
                applyFree();
            }
            store.save(config);
            resetDailyUsageIfNeeded();
            auditEnforcementBypass();
            scheduleDailyReset();
            activateExternal = externalKey != null && !externalKey.isBlank() && config.licenseKey == null;
        }

        if (activateExternal) {
            ActivationResult result = activate(externalKey);
            if (!result.success()) {
                LOG.warning("Supplied license key was not activated: " + result.error());
            }
        } else {
            validateLicense(false);
        }

        ClientStatus status = getStatus();
        LOG.info("License client initialized - tier " + status.tier()
            + ", " + status.featureCount() + " features"
            + (status.maskedKey() != null ? ", key " + status.maskedKey() : "")
            + ", daily usage " + status.callsToday() + "/"
            + (status.dailyLimit() < 0 ? "unlimited" : Integer.toString(status.dailyLimit())));
        fire(l -> l.onInitialized(status));
    }

    /**
     * Decide whether {@code feature} may be called now.
     *
     * <p>Never blocks on the network: a due revalidation is started in the background.
     */
    public synchronized FeatureAccess checkFeatureAccess(String feature) {
        requireInitialized();
        if (settings.bypassEnforcement()) {
            return FeatureAccess.allowed(config.tier);
        }

        resetDailyUsageIfNeeded();
        Instant now = clock.instant();
        if (config.tier != Tier.FREE && !config.hasUsableValidation(now)) {
            downgrade("No successful license validation within " + OFFLINE_WINDOW.toHours() + " hours");
        }

        if (!config.features.contains(feature)) {
            Optional<Tier> required = tiers.requiredTierFor(feature);
            if (required.isEmpty()) {
                return FeatureAccess.denied(config.tier, FeatureAccess.Denial.UNKNOWN_FEATURE,
                    "Unknown feature '" + feature + "'", null, null);
            }
            return FeatureAccess.denied(config.tier, FeatureAccess.Denial.TIER_REQUIRED,
                String.format("Feature '%s' requires %s tier. Current tier: %s",
                    feature, required.get(), config.tier),
                required.get(), tiers.upgradeUrl());
        }

        TierLimits limits = config.limits;
        if (!limits.isUnlimited() && config.usage.callsToday >= limits.dailyCalls()) {
            return FeatureAccess.denied(config.tier, FeatureAccess.Denial.DAILY_LIMIT_REACHED,
                String.format("Daily usage limit reached (%d calls). Resets at midnight, "
                    + "or upgrade to %s for unlimited usage.", limits.dailyCalls(), Tier.PRO),
                Tier.PRO, tiers.upgradeUrl());
        }

        if (Duration.between(lastRevalidationAttempt, now).compareTo(REVALIDATION_INTERVAL) > 0) {
            startBackgroundRevalidation();
        }
        return FeatureAccess.allowed(config.tier);
    }

    /**
     * Count one call of {@code feature} against today's quota.
     */
    public synchronized void recordUsage(String feature) {
        requireInitialized();
        resetDailyUsageIfNeeded();

        config.usage.callsToday++;
        store.save(config);

        int callsToday = config.usage.callsToday;
        int limit = config.limits.dailyCalls();
        fire(l -> l.onUsageRecorded(feature, callsToday, limit));

        if (config.tier == Tier.FREE && !config.limits.isUnlimited()) {
            int remaining = limit - callsToday;
            if (remaining <= LOW_USAGE_THRESHOLD && remaining > 0) {
                LOG.warning("Only " + remaining + " calls remaining today. Upgrade at "
                    + tiers.upgradeUrl() + " for unlimited usage.");
                fire(l -> l.onLowUsage(remaining));
            }
        }
    }

    /**
     * Bring the license state up to date.
     *
     * <p>Without {@code force}, a successful validation less than 24 hours old
     * is trusted without contacting the authority. Without a license key the
     * client is on the FREE tier, which is always valid.
     *
     * @return whether the client holds a valid license state (FREE counts as valid)
     */
    public boolean validateLicense(boolean force) {
        Pending pending;
        synchronized (this) {
            requireInitialized();
            Instant now = clock.instant();
            lastRevalidationAttempt = now;
            if (config.licenseKey == null) {
                if (config.tier != Tier.FREE) {
                    downgrade("No license key configured");
                }
                return true;
            }
            if (!force && config.hasUsableValidation(now)) {
                return true;
            }
            pending = new Pending(keyGeneration, request(config.licenseKey));
        }

        ValidationResult result;
        try {
            result = callAuthority(pending.request());
        } catch (TransportException e) {
            synchronized (this) {
                return onUnreachable(pending, e.getMessage());
            }
        }

        synchronized (this) {
            if (pending.generation() != keyGeneration) {
                LOG.fine("Discarding validation for a replaced license key");
                return config.licenseKey == null || config.hasUsableValidation(clock.instant());
            }
            if (result.isValid()) {
                applyValid(result);
                return true;
            }
            if (!result.isAuthoritativeDenial()) {
                return onUnreachable(pending, result.error());
            }
            LOG.warning("License validation failed: " + result.error() + " (" + result.code() + ")");
            config.validationCache = null;
            downgrade(result.error());
            return false;
        }
    }

    /**
     * Activate a license key. The key replaces the configured one only if the
     * authority accepts it; otherwise the current state is kept.
     */
    public ActivationResult activate(String licenseKey) {
        String key = licenseKey != null ? licenseKey.trim() : "";
        Pending pending;
        synchronized (this) {
            requireInitialized();
            if (!LicenseKeys.isValidFormat(key)) {
                return ActivationResult.failure(config.tier, "Invalid license key format", ErrorCode.INVALID_FORMAT);
            }
            pending = new Pending(keyGeneration, request(key));
        }

        ValidationResult result;
        try {
            result = callAuthority(pending.request());
        } catch (TransportException e) {
            synchronized (this) {
                return ActivationResult.failure(config.tier,
                    "License server unreachable: " + e.getMessage(), ErrorCode.VALIDATION_ERROR);
            }
        }

        synchronized (this) {
            if (!result.isValid()) {
                return ActivationResult.failure(config.tier, result.error(), result.code());
            }
            if (pending.generation() != keyGeneration) {
                return ActivationResult.failure(config.tier,
                    "License configuration changed during activation", ErrorCode.VALIDATION_ERROR);
            }
            config.licenseKey = key;
            keyGeneration++;
            applyValid(result);
            LOG.info("License activated - tier " + config.tier + ", " + config.features.size() + " features");
            Tier tier = config.tier;
            int count = config.features.size();
            fire(l -> l.onActivated(tier, count));
            return ActivationResult.success(tier, count);
        }
    }

    /**
     * Remove the license key from this installation and return to the FREE tier.
     */
    public synchronized void deactivate() {
        requireInitialized();
        if (config.licenseKey == null) {
            return;
        }
        config.licenseKey = null;
        config.validationCache = null;
        keyGeneration++;
        downgrade("License deactivated");
    }

    public synchronized ClientStatus getStatus() {
        requireInitialized();
        return new ClientStatus(
            config.tier,
            config.licenseKey != null,
            config.licenseKey != null ? LicenseKeys.mask(config.licenseKey) : null,
            config.features.size(),
            config.usage.callsToday,
            config.limits.dailyCalls(),
            config.subscriptionStatus,
            config.getLastValidated(),
            config.getValidUntil(),
            settings.bypassEnforcement(),
            machineId,
            transport.getName()
        );
    }

    /**
     * Zero the daily counter if the last reset was on another local date.
     * Repeated calls on the same date do nothing.
     *
     * @return whether a reset happened
     */
    public synchronized boolean resetDailyUsageIfNeeded() {
        requireInitialized();
        LocalDate today = today();
        if (today.equals(config.usage.lastResetDate)) {
            return false;
        }
        config.usage.callsToday = 0;
        config.usage.lastResetDate = today;
        store.save(config);
        LOG.fine("Daily usage counter reset for " + today);
        Tier tier = config.tier;
        fire(l -> l.onDailyReset(today, tier));
        return true;
    }

    /**
     * The live config. Callers must not mutate it.
     */
    synchronized ClientConfig config() {
        return config;
    }

    /**
     * The revalidation most recently started in the background.
     */
    synchronized Future<?> backgroundRevalidation() {
        return backgroundRevalidation;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        scheduler.shutdownNow();
        remoteCalls.shutdownNow();
    }

    // ========== Private Methods ==========

    private record Pending(long generation, ValidationRequest request) {}

    private ValidationRequest request(String licenseKey) {
        return new ValidationRequest(licenseKey, machineId, config.features, settings.clientVersion(),
            MachineFingerprint.platform(), MachineFingerprint.arch());
    }

    private ValidationResult callAuthority(ValidationRequest request) throws TransportException {
        Future<ValidationResult> call;
        try {
            call = remoteCalls.submit(() -> transport.validate(request));
        } catch (RejectedExecutionException e) {
            throw new TransportException("License client is closed", e);
        }
        try {
            return call.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TransportException("No answer from " + transport.getName()
                + " within " + callTimeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException te) {
                throw te;
            }
            throw new TransportException("License check failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new TransportException("License check interrupted", e);
        }
    }

    private boolean onUnreachable(Pending pending, String reason) {
        if (pending.generation() != keyGeneration) {
            return config.licenseKey == null;
        }
        if (config.hasUsableValidation(clock.instant())) {
            LOG.warning("License server unavailable (" + reason + "); using cached validation until "
                + config.validationCache.validUntil);
            return true;
        }
        LOG.warning("License server unavailable (" + reason + ") and no usable cached validation");
        if (config.tier != Tier.FREE) {
            downgrade("License could not be validated: " + reason);
        }
        return false;
    }

    private void applyValid(ValidationResult result) {
        Instant now = clock.instant();
        lastRevalidationAttempt = now;
        config.applyEntitlements(result.tier(), result.features(), result.limits());
        config.validationCache = new ClientConfig.ValidationCache(now, now.plus(OFFLINE_WINDOW), true);
        config.subscriptionStatus = result.subscription() != null ? result.subscription().status() : null;
        store.save(config);

        if (config.subscriptionStatus == SubscriptionStatus.GRACE_PERIOD) {
            LOG.warning("Subscription is in its grace period until "
                + result.subscription().gracePeriodEnds() + ". Renew at " + tiers.upgradeUrl());
        }
        fire(l -> l.onUpdated(result));
    }

    private void downgrade(String reason) {
        Tier previous = config.tier;
        applyFree();
        store.save(config);
        LOG.warning("Downgraded to FREE tier: " + reason);
        fire(l -> l.onDowngraded(previous, reason));
    }

    private void applyFree() {
        config.applyEntitlements(Tier.FREE, tiers.features(Tier.FREE), tiers.limits(Tier.FREE));
        config.subscriptionStatus = null;
    }

    private synchronized void startBackgroundRevalidation() {
        if (closed || config.licenseKey == null || !backgroundRevalidation.isDone()) {
            return;
        }
        lastRevalidationAttempt = clock.instant();
        try {
            backgroundRevalidation = scheduler.submit(() -> {
                try {
                    validateLicense(true);
                } catch (RuntimeException e) {
                    LOG.warning("Background license validation failed: " + e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.fine("License client closed; skipping revalidation");
        }
    }

    private void scheduleDailyReset() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime midnight = now.toLocalDate().plusDays(1).atStartOfDay(now.getZone());
        long delay = Math.max(1, Duration.between(now, midnight).toMillis());
        try {
            scheduler.schedule(() -> {
                try {
                    resetDailyUsageIfNeeded();
                } finally {
                    scheduleDailyReset();
                }
            }, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.fine("License client closed; daily reset not rescheduled");
        }
    }

    private void auditEnforcementBypass() {
        if (!settings.enforcementDisabled()) {
            return;
        }
        if (settings.bypassEnforcement()) {
            LOG.warning("License enforcement is DISABLED for environment '" + settings.environment() + "'");
            SecurityEvents.record("enforcement_bypass_enabled", SecurityEvents.Severity.MEDIUM,
                Map.of("environment", settings.environment(), "machineId", machineId));
        } else {
            SecurityEvents.record("enforcement_bypass_refused", SecurityEvents.Severity.HIGH,
                Map.of("environment", settings.environment(), "machineId", machineId));
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("LicenseClient.initialize() has not been called");
        }
    }

    private void fire(Consumer<LicenseListener> event) {
        for (LicenseListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.warning("License listener failed: " + e);
            }
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
