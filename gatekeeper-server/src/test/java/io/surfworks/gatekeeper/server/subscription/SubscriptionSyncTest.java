package io.surfworks.gatekeeper.server.subscription;

import io.surfworks.gatekeeper.core.api.ErrorCode;
import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;
import io.surfworks.gatekeeper.core.security.FingerprintHasher;
import io.surfworks.gatekeeper.core.security.IntegrityException;
import io.surfworks.gatekeeper.core.security.WebhookVerifier;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierTable;
import io.surfworks.gatekeeper.server.MutableClock;
import io.surfworks.gatekeeper.server.TestDatabase;
import io.surfworks.gatekeeper.server.authority.LicenseAuthority;
import io.surfworks.gatekeeper.server.store.JdbcLicenseStore;
import io.surfworks.gatekeeper.server.store.LicenseRecord;
import io.surfworks.gatekeeper.server.store.LicenseStatus;
import io.surfworks.gatekeeper.server.store.SubscriptionRecord;
import io.surfworks.gatekeeper.server.store.SubscriptionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SubscriptionSync}: webhook verification, idempotency and
 * the subscription lifecycle as seen by validations.
 */
class SubscriptionSyncTest {

    private static final Instant START = Instant.parse("2025-06-01T12:00:00Z");
    private static final String SUB = "sub_123";
    private static final String PRO_PLAN = "gatekeeper_pro_monthly";

    private TestDatabase db;
    private JdbcLicenseStore store;
    private MutableClock clock;
    private LicenseAuthority authority;
    private WebhookVerifier verifier;
    private SubscriptionSync sync;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        store = db.store();
        clock = new MutableClock(START);
        authority = new LicenseAuthority(store, TierTable.standard(), new FingerprintHasher("fp-secret", clock),
            clock, LicenseAuthority.DEFAULT_CACHE_TTL);
        verifier = new WebhookVerifier("whsec_test", WebhookVerifier.DEFAULT_TOLERANCE, clock);
        sync = new SubscriptionSync(store, authority, verifier, PlanMapper.DEFAULT, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        db.close();
    }

    private String event(String id, String type, String status, String planId, Instant expiresAt) {
        SubscriptionEvent event = new SubscriptionEvent(id, type, clock.instant(), new SubscriptionEvent.Data(
            SUB, null, "dev@example.com", "Dev", status, planId, expiresAt));
        return GatekeeperJson.compact().toJson(event);
    }

    private SyncOutcome deliver(String json) throws IntegrityException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        return sync.handleWebhook(body, verifier.sign(body));
    }

    private LicenseRecord created() throws IntegrityException {
        assertEquals(SyncOutcome.PROCESSED,
            deliver(event("evt_created", "subscription.created", "active", PRO_PLAN, START.plus(Duration.ofDays(30)))));
        return store.findLicenseBySubscription(SUB).orElseThrow();
    }

    private ValidationResult validate(LicenseRecord license) {
        return authority.validateLicense(
            new ValidationRequest(license.licenseKey(), "m1", List.of(), "0.1.0", "linux", "amd64"));
    }

    @Test
    @DisplayName("subscription.created issues a license for the plan's tier")
    void created_issuesLicense() throws Exception {
        LicenseRecord license = created();

        assertEquals(Tier.PRO, license.tier());
        assertEquals(START.plus(Duration.ofDays(30)), license.expiresAt());
        assertNotNull(license.userId());
        assertTrue(validate(license).isValid());

        SubscriptionRecord subscription = store.findSubscription(SUB).orElseThrow();
        assertEquals(SubscriptionState.ACTIVE, subscription.state());
        assertEquals(license.userId(), subscription.userId());
    }

    @Test
    @DisplayName("A redelivered event is skipped, and a second created event reuses the license")
    void created_redelivered_noSecondLicense() throws Exception {
        LicenseRecord license = created();

        assertEquals(SyncOutcome.DUPLICATE,
            deliver(event("evt_created", "subscription.created", "active", PRO_PLAN, START.plus(Duration.ofDays(30)))));
        assertEquals(SyncOutcome.PROCESSED,
            deliver(event("evt_created_again", "subscription.created", "active", PRO_PLAN, null)));

        assertEquals(license.licenseKey(), store.findLicenseBySubscription(SUB).orElseThrow().licenseKey());
    }

    private int licenseCount(String subscriptionId) throws SQLException {
        try (Connection c = db.pool().getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM licenses WHERE subscription_id = ?")) {
            ps.setString(1, subscriptionId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Test
    @DisplayName("Concurrent deliveries of subscription.created issue exactly one license")
    void created_concurrentDeliveries_singleLicense() throws Exception {
        String redelivered = event("evt_created", "subscription.created", "active", PRO_PLAN, null);
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SyncOutcome>> sameEvent = new ArrayList<>();
            List<Future<SyncOutcome>> distinctEvents = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                // Half redeliver one event, half are separate created events for the same subscription
                boolean redelivery = i % 2 == 0;
                String json = redelivery
                    ? redelivered
                    : event("evt_created_" + i, "subscription.created", "active", PRO_PLAN, null);
                Callable<SyncOutcome> task = () -> {
                    start.await();
                    return deliver(json);
                };
                (redelivery ? sameEvent : distinctEvents).add(pool.submit(task));
            }
            start.countDown();

            int processed = 0;
            for (Future<SyncOutcome> result : sameEvent) {
                SyncOutcome outcome = result.get(30, TimeUnit.SECONDS);
                if (outcome == SyncOutcome.PROCESSED) {
                    processed++;
                } else {
                    assertEquals(SyncOutcome.DUPLICATE, outcome);
                }
            }
            assertEquals(1, processed);
            for (Future<SyncOutcome> result : distinctEvents) {
                assertEquals(SyncOutcome.PROCESSED, result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, licenseCount(SUB));
        assertTrue(validate(store.findLicenseBySubscription(SUB).orElseThrow()).isValid());
    }

    @Test
    @DisplayName("Events without an id are deduplicated by type, subscription and timestamp")
    void eventWithoutId_dedupedByContent() throws Exception {
        created();
        String cancel = event(null, "subscription.cancelled", "cancelled", null, null);

        assertEquals(SyncOutcome.PROCESSED, deliver(cancel));
        assertEquals(SyncOutcome.DUPLICATE, deliver(cancel));
    }

    @Test
    @DisplayName("Cancellation opens a 7 day grace period, after which validation fails")
    void cancelled_graceThenExpired() throws Exception {
        LicenseRecord license = created();
        assertTrue(validate(license).isValid());

        deliver(event("evt_cancel", "subscription.cancelled", "cancelled", null, null));

        ValidationResult inGrace = validate(license);
        assertTrue(inGrace.isValid());
        assertEquals(SubscriptionStatus.GRACE_PERIOD, inGrace.subscription().status());
        assertEquals(START.plus(SubscriptionSync.GRACE_PERIOD), inGrace.subscription().gracePeriodEnds());

        // A later cancellation does not extend the window
        clock.advance(Duration.ofDays(2));
        deliver(event("evt_cancel_2", "subscription.cancelled", "cancelled", null, null));
        assertEquals(START.plus(SubscriptionSync.GRACE_PERIOD),
            store.findSubscription(SUB).orElseThrow().gracePeriodEnds());

        clock.advance(Duration.ofDays(6));
        ValidationResult lapsed = validate(license);
        assertFalse(lapsed.isValid());
        assertEquals(ErrorCode.LICENSE_EXPIRED, lapsed.code());
        assertEquals(LicenseStatus.EXPIRED, store.getLicenseByKey(license.licenseKey()).orElseThrow().status());
    }

    @Test
    @DisplayName("Renewal reactivates an expired license and clears the grace window")
    void renewed_reactivatesExpiredLicense() throws Exception {
        LicenseRecord license = created();
        deliver(event("evt_cancel", "subscription.cancelled", "cancelled", null, null));
        clock.advance(Duration.ofDays(8));
        assertEquals(ErrorCode.LICENSE_EXPIRED, validate(license).code());

        Instant renewedUntil = clock.instant().plus(Duration.ofDays(30));
        assertEquals(SyncOutcome.PROCESSED,
            deliver(event("evt_renew", "subscription.renewed", "active", null, renewedUntil)));

        ValidationResult result = validate(license);
        assertTrue(result.isValid());
        assertEquals(SubscriptionStatus.ACTIVE, result.subscription().status());
        assertEquals(renewedUntil, result.subscription().expiresAt());
        SubscriptionRecord subscription = store.findSubscription(SUB).orElseThrow();
        assertEquals(SubscriptionState.ACTIVE, subscription.state());
        assertNull(subscription.gracePeriodEnds());
    }

    @Test
    @DisplayName("payment_failed is accepted as an alias and puts the subscription past due")
    void paymentFailed_alias_pastDueGrace() throws Exception {
        LicenseRecord license = created();

        assertEquals(SyncOutcome.PROCESSED, deliver(event("evt_fail", "payment_failed", "past_due", null, null)));

        assertEquals(SubscriptionState.PAST_DUE, store.findSubscription(SUB).orElseThrow().state());
        assertEquals(SubscriptionStatus.GRACE_PERIOD, validate(license).subscription().status());
    }

    @Test
    @DisplayName("A plan change retargets the license tier")
    void updated_planChange_retargetsTier() throws Exception {
        LicenseRecord license = created();
        assertEquals(Tier.PRO, validate(license).tier());

        deliver(event("evt_upgrade", "subscription.updated", "active", "gatekeeper_enterprise_yearly", null));

        LicenseRecord upgraded = store.getLicenseByKey(license.licenseKey()).orElseThrow();
        assertEquals(Tier.ENTERPRISE, upgraded.tier());
        assertEquals(TierTable.standard().limits(Tier.ENTERPRISE).maxMachines(), upgraded.maxMachines());
        assertEquals(Tier.ENTERPRISE, validate(license).tier());
    }

    @Test
    @DisplayName("Events for unknown subscriptions and unknown types change nothing")
    void unknownSubscriptionOrType_ignored() throws Exception {
        assertEquals(SyncOutcome.IGNORED, deliver(event("evt_u", "subscription.updated", "active", PRO_PLAN, null)));
        assertEquals(SyncOutcome.IGNORED, deliver(event("evt_x", "customer.deleted", null, null, null)));
        assertTrue(store.findLicenseBySubscription(SUB).isEmpty());
    }

    @Test
    @DisplayName("Unsigned, mis-signed and stale deliveries are rejected before any change")
    void handleWebhook_badSignatureOrStale_rejected() {
        byte[] body = event("evt_created", "subscription.created", "active", PRO_PLAN, null)
            .getBytes(StandardCharsets.UTF_8);
        WebhookVerifier other = new WebhookVerifier("whsec_other", WebhookVerifier.DEFAULT_TOLERANCE, clock);

        assertEquals(IntegrityException.Reason.MISSING_SIGNATURE,
            assertThrows(IntegrityException.class, () -> sync.handleWebhook(body, null)).getReason());
        assertEquals(IntegrityException.Reason.BAD_SIGNATURE,
            assertThrows(IntegrityException.class, () -> sync.handleWebhook(body, other.sign(body))).getReason());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(IntegrityException.Reason.STALE_TIMESTAMP,
            assertThrows(IntegrityException.class, () -> sync.handleWebhook(body, verifier.sign(body))).getReason());

        assertTrue(store.findLicenseBySubscription(SUB).isEmpty());
    }

    @Test
    @DisplayName("Bodies that are not subscription events are malformed requests")
    void handleWebhook_malformed_illegalArgument() {
        byte[] garbage = "not json".getBytes(StandardCharsets.UTF_8);
        byte[] noType = "{\"data\":{\"subscriptionId\":\"sub_1\"}}".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> sync.handleWebhook(garbage, verifier.sign(garbage)));
        assertThrows(IllegalArgumentException.class, () -> sync.handleWebhook(noType, verifier.sign(noType)));
    }
}
