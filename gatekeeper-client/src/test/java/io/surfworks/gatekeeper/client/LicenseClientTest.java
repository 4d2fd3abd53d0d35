package io.surfworks.gatekeeper.client;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.surfworks.gatekeeper.core.api.ErrorCode;
import io.surfworks.gatekeeper.core.api.LicenseTransport;
import io.surfworks.gatekeeper.core.api.OfflineTransport;
import io.surfworks.gatekeeper.core.api.SubscriptionInfo;
import io.surfworks.gatekeeper.core.api.SubscriptionStatus;
import io.surfworks.gatekeeper.core.api.UsageSnapshot;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.security.LicenseKeys;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LicenseClient}.
 */
class LicenseClientTest {

    private static final String MACHINE_ID = "0123456789abcdef0123456789abcdef";
    private static final TierTable TIERS = TierTable.standard();

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StubTransport transport;
    private final List<LicenseClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));
        transport = new StubTransport();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(LicenseClient::close);
    }

    private LicenseClient client(ClientSettings settings, LicenseTransport t) {
        LicenseClient client = new LicenseClient(settings, t, TIERS, MACHINE_ID, clock, Duration.ofSeconds(2));
        clients.add(client);
        return client;
    }

    private LicenseClient client() {
        return client(ClientSettings.defaults(tempDir), transport);
    }

    private static ValidationResult valid(Tier tier) {
        return ValidationResult.valid(tier, TIERS.features(tier), TIERS.limits(tier),
            new UsageSnapshot(1, 1, 1), SubscriptionInfo.of(SubscriptionStatus.ACTIVE));
    }

    private static String proKey() {
        return LicenseKeys.format(Tier.PRO, "user-1");
    }

    // ========== Quota ==========

    @Test
    @DisplayName("FREE tier allows 50 calls, denies the 51st and recovers after midnight")
    void checkFeatureAccess_freeQuota_deniesAfterFiftyUntilRollover() {
        LicenseClient client = client(ClientSettings.defaults(tempDir), new OfflineTransport());
        client.initialize();

        for (int i = 0; i < 50; i++) {
            FeatureAccess access = client.checkFeatureAccess("read_file");
            assertTrue(access.allowed(), "call " + (i + 1));
            client.recordUsage("read_file");
        }

        FeatureAccess denied = client.checkFeatureAccess("read_file");
        assertFalse(denied.allowed());
        assertEquals(FeatureAccess.Denial.DAILY_LIMIT_REACHED, denied.denial());
        assertTrue(denied.reason().contains("50"));
        assertNotNull(denied.upgradeUrl());

        clock.advance(Duration.ofDays(1));

        assertTrue(client.checkFeatureAccess("read_file").allowed());
        assertEquals(0, client.getStatus().callsToday());
    }

    @Test
    @DisplayName("higher-tier feature is denied with the tier that offers it")
    void checkFeatureAccess_proFeatureOnFree_namesRequiredTier() {
        LicenseClient client = client();
        client.initialize();

        FeatureAccess access = client.checkFeatureAccess("write_file");

        assertFalse(access.allowed());
        assertEquals(FeatureAccess.Denial.TIER_REQUIRED, access.denial());
        assertEquals(Tier.PRO, access.requiredTier());
        assertTrue(access.reason().contains("PRO"));
        assertEquals(TIERS.upgradeUrl(), access.upgradeUrl());
    }

    @Test
    @DisplayName("feature no tier offers is denied as unknown")
    void checkFeatureAccess_unknownFeature_denied() {
        LicenseClient client = client();
        client.initialize();

        FeatureAccess access = client.checkFeatureAccess("teleport");

        assertFalse(access.allowed());
        assertEquals(FeatureAccess.Denial.UNKNOWN_FEATURE, access.denial());
        assertNull(access.requiredTier());
    }

    @Test
    @DisplayName("low-usage warning fires for the last five calls only")
    void recordUsage_nearQuota_warnsWhileRemainingAtMostFive() {
        LicenseClient client = client();
        List<Integer> warnings = new ArrayList<>();
        client.addListener(new LicenseListener() {
            @Override
            public void onLowUsage(int remaining) {
                warnings.add(remaining);
            }
        });
        client.initialize();

        for (int i = 0; i < 50; i++) {
            client.recordUsage("read_file");
        }

        assertEquals(List.of(5, 4, 3, 2, 1), warnings);
    }

    @Test
    @DisplayName("low-usage warning is not raised on unlimited tiers")
    void recordUsage_proTier_noLowUsageWarning() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        List<Integer> warnings = new ArrayList<>();
        client.addListener(new LicenseListener() {
            @Override
            public void onLowUsage(int remaining) {
                warnings.add(remaining);
            }
        });
        client.initialize(proKey());

        for (int i = 0; i < 60; i++) {
            client.recordUsage("write_file");
        }

        assertTrue(warnings.isEmpty());
        assertEquals(60, client.getStatus().callsToday());
    }

    // ========== Daily reset ==========

    @Test
    @DisplayName("daily reset runs once per local date")
    void resetDailyUsageIfNeeded_sameDate_isNoOp() {
        LicenseClient client = client();
        List<LocalDate> resets = new ArrayList<>();
        client.addListener(new LicenseListener() {
            @Override
            public void onDailyReset(LocalDate date, Tier tier) {
                resets.add(date);
            }
        });
        client.initialize();
        client.recordUsage("read_file");

        assertFalse(client.resetDailyUsageIfNeeded());
        assertFalse(client.resetDailyUsageIfNeeded());
        assertEquals(1, client.getStatus().callsToday());

        clock.advance(Duration.ofHours(14));

        assertTrue(client.resetDailyUsageIfNeeded());
        assertFalse(client.resetDailyUsageIfNeeded());
        assertEquals(0, client.getStatus().callsToday());
        assertEquals(List.of(LocalDate.parse("2026-03-11")), resets);
    }

    @Test
    @DisplayName("usage counter follows the clock's local date")
    void resetDailyUsageIfNeeded_localZone_usesLocalMidnight() {
        // 23:30 in New York is already the next day in UTC
        clock = new MutableClock(Instant.parse("2026-03-11T03:30:00Z"), ZoneId.of("America/New_York"));
        LicenseClient client = client();
        client.initialize();
        client.recordUsage("read_file");

        clock.advance(Duration.ofMinutes(20));
        assertFalse(client.resetDailyUsageIfNeeded());

        clock.advance(Duration.ofMinutes(20));
        assertTrue(client.resetDailyUsageIfNeeded());
    }

    // ========== Activation ==========

    @Test
    @DisplayName("activate applies the authority's tier and persists the key")
    void activate_validKey_upgradesAndPersists() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize();

        ActivationResult result = client.activate(proKey());

        assertTrue(result.success());
        assertEquals(Tier.PRO, result.tier());
        assertTrue(client.checkFeatureAccess("write_file").allowed());
        assertEquals(SubscriptionStatus.ACTIVE, client.getStatus().subscriptionStatus());

        client.close();
        LicenseClient restarted = client(ClientSettings.defaults(tempDir), new OfflineTransport());
        restarted.initialize();

        ClientStatus status = restarted.getStatus();
        assertEquals(Tier.PRO, status.tier());
        assertTrue(status.hasLicense());
        assertEquals(LicenseKeys.mask(proKey()), status.maskedKey());
    }

    @Test
    @DisplayName("malformed key is rejected without contacting the authority")
    void activate_malformedKey_noNetworkCall() {
        LicenseClient client = client();
        client.initialize();

        ActivationResult result = client.activate("PRO-NOT-A-KEY");

        assertFalse(result.success());
        assertEquals(ErrorCode.INVALID_FORMAT, result.errorCode());
        assertTrue(transport.requests.isEmpty());
    }

    @Test
    @DisplayName("refused key leaves the current state in place")
    void activate_refusedKey_keepsFreeTier() {
        transport.answer(ValidationResult.denied(ErrorCode.LICENSE_NOT_FOUND, "License not found", TIERS));
        LicenseClient client = client();
        client.initialize();

        ActivationResult result = client.activate(proKey());

        assertFalse(result.success());
        assertEquals(ErrorCode.LICENSE_NOT_FOUND, result.errorCode());
        assertFalse(result.isNetworkFailure());
        assertEquals(Tier.FREE, client.getStatus().tier());
        assertFalse(client.getStatus().hasLicense());
    }

    @Test
    @DisplayName("unreachable authority reports a network failure")
    void activate_unreachable_networkFailure() {
        transport.fail("connection refused");
        LicenseClient client = client();
        client.initialize();

        ActivationResult result = client.activate(proKey());

        assertFalse(result.success());
        assertTrue(result.isNetworkFailure());
        assertFalse(client.getStatus().hasLicense());
    }

    @Test
    @DisplayName("stalled authority call is abandoned after the timeout")
    void activate_stalledAuthority_timesOut() {
        CountDownLatch never = new CountDownLatch(1);
        LicenseTransport stalled = new LicenseTransport() {
            @Override
            public ValidationResult validate(ValidationRequest request) {
                try {
                    never.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return valid(Tier.PRO);
            }

            @Override
            public String getName() {
                return "Stalled";
            }
        };
        LicenseClient client = new LicenseClient(ClientSettings.defaults(tempDir), stalled, TIERS,
            MACHINE_ID, clock, Duration.ofMillis(200));
        clients.add(client);
        client.initialize();

        long start = System.nanoTime();
        ActivationResult result = client.activate(proKey());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(result.isNetworkFailure());
        assertTrue(elapsedMillis < 10_000, "took " + elapsedMillis + "ms");
        assertEquals(Tier.FREE, client.getStatus().tier());
    }

    @Test
    @DisplayName("externally supplied key is used only when none is configured")
    void initialize_externalKey_onlyWhenNoneConfigured() {
        transport.answer(valid(Tier.PRO));
        LicenseClient first = client();
        first.initialize(proKey());
        assertEquals(Tier.PRO, first.getStatus().tier());
        first.close();

        String otherKey = LicenseKeys.format(Tier.ENTERPRISE, "user-2");
        transport.requests.clear();
        LicenseClient second = client();
        second.initialize(otherKey);

        assertEquals(LicenseKeys.mask(proKey()), second.getStatus().maskedKey());
        assertTrue(transport.requests.stream().noneMatch(r -> r.licenseKey().equals(otherKey)));
    }

    @Test
    @DisplayName("deactivate drops the key and returns to FREE")
    void deactivate_removesKey() {
        transport.answer(valid(Tier.ENTERPRISE));
        LicenseClient client = client();
        client.initialize(LicenseKeys.format(Tier.ENTERPRISE, "user-3"));
        assertEquals(Tier.ENTERPRISE, client.getStatus().tier());

        client.deactivate();

        ClientStatus status = client.getStatus();
        assertEquals(Tier.FREE, status.tier());
        assertFalse(status.hasLicense());
        assertNull(status.validUntil());
        assertFalse(client.checkFeatureAccess("team_collaboration").allowed());
    }

    // ========== Revalidation ==========

    @Test
    @DisplayName("offline client keeps its tier inside the 24 hour window")
    void validateLicense_offlineWithinWindow_keepsTier() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize(proKey());

        transport.fail("network down");
        clock.advance(Duration.ofHours(23));

        assertTrue(client.validateLicense(true));
        assertEquals(Tier.PRO, client.getStatus().tier());
        assertTrue(client.checkFeatureAccess("write_file").allowed());
    }

    @Test
    @DisplayName("offline client falls back to FREE once the window lapses")
    void validateLicense_offlinePastWindow_failsClosed() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize(proKey());

        transport.fail("network down");
        clock.advance(Duration.ofHours(25));

        assertFalse(client.validateLicense(true));
        assertEquals(Tier.FREE, client.getStatus().tier());
        assertTrue(client.getStatus().hasLicense());
        assertFalse(client.checkFeatureAccess("write_file").allowed());
    }

    @Test
    @DisplayName("gate falls back to FREE when the window lapsed without any revalidation")
    void checkFeatureAccess_windowLapsed_deniesPaidFeature() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize(proKey());
        transport.fail("network down");

        clock.advance(Duration.ofHours(24).plusMinutes(1));

        FeatureAccess access = client.checkFeatureAccess("write_file");
        assertFalse(access.allowed());
        assertEquals(Tier.FREE, access.tier());
    }

    @Test
    @DisplayName("restart inside the window trusts the cached validation without a network call")
    void initialize_cachedValidation_trustedWithoutNetwork() {
        transport.answer(valid(Tier.PRO));
        LicenseClient first = client();
        first.initialize(proKey());
        first.close();

        clock.advance(Duration.ofHours(3));
        transport.requests.clear();
        LicenseClient second = client();
        second.initialize();

        assertEquals(Tier.PRO, second.getStatus().tier());
        assertTrue(transport.requests.isEmpty());
    }

    @Test
    @DisplayName("authoritative denial downgrades immediately despite a fresh cache")
    void validateLicense_revoked_downgradesImmediately() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        List<Tier> downgradedFrom = new ArrayList<>();
        client.addListener(new LicenseListener() {
            @Override
            public void onDowngraded(Tier previous, String reason) {
                downgradedFrom.add(previous);
            }
        });
        client.initialize(proKey());

        transport.answer(ValidationResult.denied(ErrorCode.LICENSE_REVOKED, "License has been revoked", TIERS));

        assertFalse(client.validateLicense(true));
        assertEquals(Tier.FREE, client.getStatus().tier());
        assertNull(client.getStatus().validUntil());
        assertEquals(List.of(Tier.PRO), downgradedFrom);
    }

    @Test
    @DisplayName("VALIDATION_ERROR from the authority is treated as a transient failure")
    void validateLicense_validationError_keepsCachedTier() {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize(proKey());

        transport.answer(ValidationResult.denied(ErrorCode.VALIDATION_ERROR, "Storage unavailable", TIERS));

        assertTrue(client.validateLicense(true));
        assertEquals(Tier.PRO, client.getStatus().tier());
    }

    @Test
    @DisplayName("due revalidation runs in the background and applies the answer")
    void checkFeatureAccess_revalidationDue_runsInBackground() throws Exception {
        transport.answer(valid(Tier.PRO));
        LicenseClient client = client();
        client.initialize(proKey());

        transport.answer(ValidationResult.denied(ErrorCode.LICENSE_SUSPENDED, "License has been suspended", TIERS));
        clock.advance(Duration.ofMinutes(6));

        assertTrue(client.checkFeatureAccess("write_file").allowed());
        client.backgroundRevalidation().get(5, TimeUnit.SECONDS);

        assertEquals(Tier.FREE, client.getStatus().tier());
        assertFalse(client.checkFeatureAccess("write_file").allowed());
    }

    @Test
    @DisplayName("grace period is reported in the status")
    void validateLicense_gracePeriod_reported() {
        Instant graceEnds = clock.instant().plus(Duration.ofDays(7));
        transport.answer(ValidationResult.valid(Tier.PRO, TIERS.features(Tier.PRO), TIERS.limits(Tier.PRO),
            UsageSnapshot.NONE, new SubscriptionInfo(SubscriptionStatus.GRACE_PERIOD, null, graceEnds)));
        LicenseClient client = client();
        client.initialize(proKey());

        assertEquals(SubscriptionStatus.GRACE_PERIOD, client.getStatus().subscriptionStatus());
        assertTrue(client.checkFeatureAccess("write_file").allowed());
    }

    // ========== Config and bypass ==========

    @Test
    @DisplayName("config file claiming a paid tier without a key is reset to FREE")
    void initialize_paidTierWithoutKey_resetToFree() throws Exception {
        Files.writeString(tempDir.resolve(ClientConfigStore.CONFIG_FILE), """
            {
              "tier": "ENTERPRISE",
              "features": ["team_collaboration"],
              "limits": {"dailyCalls": -1, "maxMachines": 10, "concurrentSessions": 20},
              "usage": {"callsToday": 0, "lastResetDate": "2026-03-10"}
            }
            """);
        LicenseClient client = client();
        client.initialize();

        assertEquals(Tier.FREE, client.getStatus().tier());
        assertFalse(client.checkFeatureAccess("team_collaboration").allowed());
    }

    @Test
    @DisplayName("keyless config takes FREE features and limits from the tier table, not the file")
    void initialize_keylessFreeWithPaidEntitlements_usesTierTable() throws Exception {
        Files.writeString(tempDir.resolve(ClientConfigStore.CONFIG_FILE), """
            {
              "tier": "FREE",
              "features": ["read_file", "write_file", "audit_logging"],
              "limits": {"dailyCalls": -1, "maxMachines": 10, "concurrentSessions": 20},
              "usage": {"callsToday": 0, "lastResetDate": "2026-03-10"}
            }
            """);
        LicenseClient client = client(ClientSettings.defaults(tempDir), new OfflineTransport());
        client.initialize();

        assertFalse(client.checkFeatureAccess("audit_logging").allowed());
        assertFalse(client.checkFeatureAccess("write_file").allowed());
        assertEquals(TIERS.limits(Tier.FREE).dailyCalls(), client.getStatus().dailyLimit());

        for (int i = 0; i < 50; i++) {
            assertTrue(client.checkFeatureAccess("read_file").allowed(), "call " + (i + 1));
            client.recordUsage("read_file");
        }
        assertEquals(FeatureAccess.Denial.DAILY_LIMIT_REACHED, client.checkFeatureAccess("read_file").denial());
    }

    @Test
    @DisplayName("an edited validUntil cannot stretch the offline window past 24 hours")
    void initialize_stretchedValidUntil_clampedToOfflineWindow() throws Exception {
        transport.answer(valid(Tier.PRO));
        LicenseClient first = client();
        first.initialize(proKey());
        first.close();

        Path file = tempDir.resolve(ClientConfigStore.CONFIG_FILE);
        JsonObject json = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        json.getAsJsonObject("validationCache")
            .addProperty("validUntil", clock.instant().plus(Duration.ofDays(30)).toString());
        Files.writeString(file, json.toString());

        clock.advance(Duration.ofHours(25));
        transport.fail("offline");
        LicenseClient second = client();
        second.initialize();

        assertEquals(Tier.FREE, second.getStatus().tier());
        assertFalse(second.checkFeatureAccess("write_file").allowed());
    }

    @Test
    @DisplayName("enforcement bypass is honoured outside production")
    void checkFeatureAccess_bypassInDevelopment_allowsEverything() {
        ClientSettings settings = ClientSettings.defaults(tempDir).withEnforcementDisabled("development", true);
        LicenseClient client = client(settings, transport);
        client.initialize();

        assertTrue(client.getStatus().enforcementBypassed());
        assertTrue(client.checkFeatureAccess("team_collaboration").allowed());
    }

    @Test
    @DisplayName("enforcement bypass is ignored in production")
    void checkFeatureAccess_bypassInProduction_stillEnforced() {
        ClientSettings settings = ClientSettings.defaults(tempDir).withEnforcementDisabled("production", true);
        LicenseClient client = client(settings, transport);
        client.initialize();

        assertFalse(client.getStatus().enforcementBypassed());
        assertFalse(client.checkFeatureAccess("team_collaboration").allowed());
    }

    @Test
    @DisplayName("methods require initialize")
    void checkFeatureAccess_beforeInitialize_throws() {
        LicenseClient client = client();

        assertThrows(IllegalStateException.class, () -> client.checkFeatureAccess("read_file"));
    }
}
