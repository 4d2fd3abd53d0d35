package io.surfworks.gatekeeper.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link HmacSigner}.
 */
class HmacSignerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final HmacSigner signer =
        new HmacSigner("admin-secret", HmacSigner.DEFAULT_TOLERANCE, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Signature verifies for the same payload and timestamp")
    void verifyRequest_roundTrip() {
        long ts = NOW.toEpochMilli();
        String sig = signer.signRequest("{\"licenseId\":\"abc\"}", ts);
        assertEquals(64, sig.length());
        assertDoesNotThrow(() -> signer.verifyRequest("{\"licenseId\":\"abc\"}", ts, sig));
    }

    @Test
    @DisplayName("Signature is bound to the timestamp")
    void signRequest_dependsOnTimestamp() {
        long ts = NOW.toEpochMilli();
        String sig = signer.signRequest("payload", ts);
        assertNotEquals(sig, signer.signRequest("payload", ts + 1));
        IntegrityException e = assertThrows(IntegrityException.class,
            () -> signer.verifyRequest("payload", ts + 1, sig));
        assertEquals(IntegrityException.Reason.BAD_SIGNATURE, e.getReason());
    }

    @Test
    @DisplayName("Stale and unsigned requests are rejected")
    void verifyRequest_staleOrMissing_rejected() {
        long old = NOW.minus(Duration.ofMinutes(30)).toEpochMilli();
        String sig = signer.signRequest("payload", old);
        assertEquals(IntegrityException.Reason.STALE_TIMESTAMP,
            assertThrows(IntegrityException.class, () -> signer.verifyRequest("payload", old, sig)).getReason());
        assertEquals(IntegrityException.Reason.MISSING_SIGNATURE,
            assertThrows(IntegrityException.class,
                () -> signer.verifyRequest("payload", NOW.toEpochMilli(), "")).getReason());
    }

    @Test
    @DisplayName("Upper-case hex signatures verify whatever the default locale")
    void verifyRequest_upperCaseSignature_localeIndependent() {
        long ts = NOW.toEpochMilli();
        String sig = signer.signRequest("payload", ts).toUpperCase(Locale.ROOT);
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertDoesNotThrow(() -> signer.verifyRequest("payload", ts, " " + sig + " "));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
