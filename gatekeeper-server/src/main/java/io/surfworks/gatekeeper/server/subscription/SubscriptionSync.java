package io.surfworks.gatekeeper.server.subscription;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;
import io.surfworks.gatekeeper.core.security.Hashes;
import io.surfworks.gatekeeper.core.security.IntegrityException;
import io.surfworks.gatekeeper.core.security.LicenseKeys;
import io.surfworks.gatekeeper.core.security.SecurityEvents;
import io.surfworks.gatekeeper.core.security.WebhookVerifier;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.server.authority.GenerateRequest;
import io.surfworks.gatekeeper.server.authority.LicenseAuthority;
import io.surfworks.gatekeeper.server.store.LicenseRecord;
import io.surfworks.gatekeeper.server.store.LicenseStatus;
import io.surfworks.gatekeeper.server.store.LicenseStore;
import io.surfworks.gatekeeper.server.store.StoreException;
import io.surfworks.gatekeeper.server.store.SubscriptionRecord;
import io.surfworks.gatekeeper.server.store.SubscriptionState;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies payment-provider subscription events to licenses.
 *
 * <p>State per subscription:
 * <pre>
 *   created ──► active ──cancelled──► cancelled (grace 7d) ──► expired
 *                 ▲  └──payment.failed──► past_due (grace 7d) ──► expired
 *                 └──────────── renewed ◄──────────┘
 * </pre>
 * The move to expired happens in {@link LicenseAuthority} when a validation
 * observes that the grace window has closed.
 *
 * <p>Every event is claimed in the store under an idempotency key before any
 * mutation. A redelivered event that was already processed is skipped, and
 * each handler is written so that applying it twice changes nothing.
 */
public class SubscriptionSync {

    private static final Logger LOG = Logger.getLogger(SubscriptionSync.class.getName());

    /**
     * Grace window after cancellation or payment failure.
     */
    public static final Duration GRACE_PERIOD = Duration.ofDays(7);

    private static final Gson GSON = GatekeeperJson.compact();

    private final LicenseStore store;
    private final LicenseAuthority authority;
    private final WebhookVerifier verifier;
    private final PlanMapper planMapper;
    private final Clock clock;

    public SubscriptionSync(LicenseStore store, LicenseAuthority authority, WebhookVerifier verifier) {
        this(store, authority, verifier, PlanMapper.DEFAULT, Clock.systemUTC());
    }

    public SubscriptionSync(LicenseStore store, LicenseAuthority authority, WebhookVerifier verifier,
                            PlanMapper planMapper, Clock clock) {
        this.store = store;
        this.authority = authority;
        this.verifier = verifier;
        this.planMapper = planMapper;
        this.clock = clock;
    }

    /**
     * Verify and apply a raw webhook delivery.
     *
     * @param rawBody body bytes exactly as received
     * @param signatureHeader the provider's signature header
     * @throws IntegrityException if the signature is missing or wrong, or the event is stale
     * @throws IllegalArgumentException if the body is not a subscription event
     */
    public SyncOutcome handleWebhook(byte[] rawBody, String signatureHeader) throws IntegrityException {
        String payload = new String(rawBody, StandardCharsets.UTF_8);
        SubscriptionEvent event;
        try {
            event = GSON.fromJson(payload, SubscriptionEvent.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed webhook body: " + e.getMessage(), e);
        }
        if (event == null || event.type() == null || event.subscriptionId() == null) {
            throw new IllegalArgumentException("Webhook body needs type and data.subscriptionId");
        }

        try {
            verifier.verify(rawBody, signatureHeader, event.timestamp());
        } catch (IntegrityException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", e.getReason());
            details.put("type", event.type());
            details.put("subscriptionId", event.subscriptionId());
            SecurityEvents.record("webhook_rejected", SecurityEvents.Severity.HIGH, details);
            throw e;
        }

        return process(event, payload);
    }

    /**
     * Apply an already-verified event.
     */
    public SyncOutcome process(SubscriptionEvent event, String rawPayload) {
        String key = idempotencyKey(event);
        Instant now = clock.instant();
        if (!store.claimWebhookEvent(key, event.type(), event.subscriptionId(), rawPayload, now)) {
            LOG.info("Skipping duplicate " + event.type() + " for " + event.subscriptionId());
            return SyncOutcome.DUPLICATE;
        }

        EventType type = event.eventType();
        SyncOutcome outcome;
        if (type == null) {
            LOG.warning("Unhandled webhook type: " + event.type());
            outcome = SyncOutcome.IGNORED;
        } else {
            outcome = switch (type) {
                case CREATED -> onCreated(event.data(), now);
                case UPDATED -> onUpdated(event.data(), now);
                case CANCELLED -> onGraceStarted(event.data(), SubscriptionState.CANCELLED, now);
                case RENEWED -> onRenewed(event.data(), now);
                case PAYMENT_FAILED -> onGraceStarted(event.data(), SubscriptionState.PAST_DUE, now);
            };
        }

        store.markWebhookProcessed(key, clock.instant());
        return outcome;
    }

    /**
     * The event id when the provider sends one, otherwise a hash of type,
     * subscription id and timestamp.
     */
    static String idempotencyKey(SubscriptionEvent event) {
        if (event.id() != null && !event.id().isBlank()) {
            return event.id();
        }
        return Hashes.sha256Hex(event.type() + "|" + event.subscriptionId() + "|" + event.timestamp());
    }

    // ===== Handlers =====

    private SyncOutcome onCreated(SubscriptionEvent.Data data, Instant now) {
        Optional<SubscriptionRecord> existing = store.findSubscription(data.subscriptionId());
        String userId = existing.map(SubscriptionRecord::userId).orElseGet(() -> ownerOf(data));
        SubscriptionState state = Objects.requireNonNullElse(
            SubscriptionState.fromDbValue(data.status()), SubscriptionState.ACTIVE);

        store.saveSubscription(new SubscriptionRecord(
            data.subscriptionId(), userId, data.planId(), state, data.expiresAt(), null, now));

        Optional<LicenseRecord> license = store.findLicenseBySubscription(data.subscriptionId());
        if (license.isPresent()) {
            LOG.info("Subscription " + data.subscriptionId() + " already has license "
                + LicenseKeys.mask(license.get().licenseKey()));
            return SyncOutcome.PROCESSED;
        }

        Tier tier = planMapper.mapPlan(data.planId());
        LicenseRecord created;
        try {
            created = authority.generateLicense(
                GenerateRequest.of(userId, tier).withSubscription(data.subscriptionId(), data.expiresAt()));
        } catch (StoreException e) {
            // One license per subscription is a unique constraint; a concurrent event may have won
            Optional<LicenseRecord> winner = store.findLicenseBySubscription(data.subscriptionId());
            if (winner.isEmpty()) {
                throw e;
            }
            LOG.info("Subscription " + data.subscriptionId() + " was issued license "
                + LicenseKeys.mask(winner.get().licenseKey()) + " concurrently");
            return SyncOutcome.PROCESSED;
        }
        LOG.info("Generated " + tier + " license " + LicenseKeys.mask(created.licenseKey())
            + " for subscription " + data.subscriptionId());
        return SyncOutcome.PROCESSED;
    }

    private SyncOutcome onUpdated(SubscriptionEvent.Data data, Instant now) {
        Optional<LicenseRecord> license = store.findLicenseBySubscription(data.subscriptionId());
        Optional<SubscriptionRecord> existing = store.findSubscription(data.subscriptionId());
        if (existing.isEmpty() && license.isEmpty()) {
            LOG.warning("Update for unknown subscription " + data.subscriptionId());
            return SyncOutcome.IGNORED;
        }

        SubscriptionRecord current = existing.orElseGet(() -> adopt(data, license.get(), now));
        SubscriptionState state = SubscriptionState.fromDbValue(data.status());
        if (state == null) {
            state = current.state();
        }
        Instant gracePeriodEnds = current.gracePeriodEnds();
        if (!state.hasGracePeriod()) {
            gracePeriodEnds = null;
        } else if (gracePeriodEnds == null) {
            gracePeriodEnds = now.plus(GRACE_PERIOD);
        }
        Instant expiresAt = data.expiresAt() != null ? data.expiresAt() : current.expiresAt();
        String planId = data.planId() != null ? data.planId() : current.planId();
        store.saveSubscription(new SubscriptionRecord(
            current.subscriptionId(), current.userId(), planId, state, expiresAt, gracePeriodEnds, now));

        if (license.isPresent()) {
            LicenseRecord record = license.get();
            if (data.expiresAt() != null && !data.expiresAt().equals(record.expiresAt())) {
                store.updateLicenseExpiry(record.id(), data.expiresAt());
            }
            if (data.planId() != null) {
                Tier tier = planMapper.mapPlan(data.planId());
                if (tier != record.tier()) {
                    store.updateLicenseTier(record.id(), tier, authority.tiers().limits(tier).maxMachines());
                    LOG.info("Retargeted " + LicenseKeys.mask(record.licenseKey()) + " from "
                        + record.tier() + " to " + tier);
                }
            }
            store.invalidateCachedValidation(record.licenseKey());
        }
        return SyncOutcome.PROCESSED;
    }

    /**
     * Cancellation and payment failure both open a grace window, once.
     */
    private SyncOutcome onGraceStarted(SubscriptionEvent.Data data, SubscriptionState state, Instant now) {
        Optional<LicenseRecord> license = store.findLicenseBySubscription(data.subscriptionId());
        Optional<SubscriptionRecord> existing = store.findSubscription(data.subscriptionId());
        if (existing.isEmpty() && license.isEmpty()) {
            LOG.warning(state.dbValue() + " for unknown subscription " + data.subscriptionId());
            return SyncOutcome.IGNORED;
        }

        SubscriptionRecord current = existing.orElseGet(() -> adopt(data, license.get(), now));
        if (current.state() == state && current.gracePeriodEnds() != null) {
            LOG.info("Subscription " + data.subscriptionId() + " already " + state.dbValue()
                + ", grace period ends " + current.gracePeriodEnds());
            return SyncOutcome.PROCESSED;
        }

        Instant gracePeriodEnds = now.plus(GRACE_PERIOD);
        store.saveSubscription(current.withState(state, gracePeriodEnds, now));
        license.ifPresent(l -> store.invalidateCachedValidation(l.licenseKey()));
        LOG.info("Subscription " + data.subscriptionId() + " " + state.dbValue()
            + ", grace period ends " + gracePeriodEnds);
        return SyncOutcome.PROCESSED;
    }

    private SyncOutcome onRenewed(SubscriptionEvent.Data data, Instant now) {
        Optional<LicenseRecord> license = store.findLicenseBySubscription(data.subscriptionId());
        Optional<SubscriptionRecord> existing = store.findSubscription(data.subscriptionId());
        if (existing.isEmpty() && license.isEmpty()) {
            LOG.warning("Renewal for unknown subscription " + data.subscriptionId());
            return SyncOutcome.IGNORED;
        }

        SubscriptionRecord current = existing.orElseGet(() -> adopt(data, license.get(), now));
        Instant expiresAt = data.expiresAt() != null ? data.expiresAt() : current.expiresAt();
        store.saveSubscription(new SubscriptionRecord(
            current.subscriptionId(), current.userId(), current.planId(),
            SubscriptionState.ACTIVE, expiresAt, null, now));

        if (license.isPresent()) {
            LicenseRecord record = license.get();
            if (data.expiresAt() != null && !data.expiresAt().equals(record.expiresAt())) {
                store.updateLicenseExpiry(record.id(), data.expiresAt());
            }
            if (record.status() == LicenseStatus.EXPIRED) {
                store.updateLicenseStatus(record.licenseKey(), LicenseStatus.ACTIVE, null, now);
                LOG.info("Reactivated " + LicenseKeys.mask(record.licenseKey()) + " on renewal");
            }
            store.invalidateCachedValidation(record.licenseKey());
        }
        LOG.info("Subscription " + data.subscriptionId() + " renewed until " + expiresAt);
        return SyncOutcome.PROCESSED;
    }

    // ===== Helpers =====

    private String ownerOf(SubscriptionEvent.Data data) {
        if (data.userId() != null && !data.userId().isBlank()) {
            return data.userId();
        }
        return store.ensureUser(data.customerEmail(), data.customerName()).id();
    }

    /**
     * A subscription record for a license that predates subscription tracking.
     */
    private static SubscriptionRecord adopt(SubscriptionEvent.Data data, LicenseRecord license, Instant now) {
        return new SubscriptionRecord(data.subscriptionId(), license.userId(), data.planId(),
            SubscriptionState.ACTIVE, license.expiresAt(), null, now);
    }
}
