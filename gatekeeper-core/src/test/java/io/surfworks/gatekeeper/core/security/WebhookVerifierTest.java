package io.surfworks.gatekeeper.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WebhookVerifier}.
 */
class WebhookVerifierTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final byte[] BODY = "{\"type\":\"subscription.created\"}".getBytes(StandardCharsets.UTF_8);

    private final WebhookVerifier verifier =
        new WebhookVerifier("whsec_test", WebhookVerifier.DEFAULT_TOLERANCE, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("A correctly signed fresh payload verifies, with or without prefix")
    void verify_validSignature_accepted() {
        String header = verifier.sign(BODY);
        assertTrue(header.startsWith("sha256="));
        assertDoesNotThrow(() -> verifier.verify(BODY, header, NOW));
        assertDoesNotThrow(() -> verifier.verify(BODY, header.substring("sha256=".length()), NOW.minusSeconds(60)));
    }

    @Test
    @DisplayName("A modified body is rejected")
    void verify_tamperedBody_rejected() {
        String header = verifier.sign(BODY);
        byte[] tampered = "{\"type\":\"subscription.deleted\"}".getBytes(StandardCharsets.UTF_8);
        IntegrityException e = assertThrows(IntegrityException.class, () -> verifier.verify(tampered, header, NOW));
        assertEquals(IntegrityException.Reason.BAD_SIGNATURE, e.getReason());
    }

    @Test
    @DisplayName("A signature from another secret is rejected")
    void verify_otherSecret_rejected() {
        var other = new WebhookVerifier("whsec_other", Duration.ofMinutes(5), Clock.fixed(NOW, ZoneOffset.UTC));
        IntegrityException e = assertThrows(IntegrityException.class,
            () -> verifier.verify(BODY, other.sign(BODY), NOW));
        assertEquals(IntegrityException.Reason.BAD_SIGNATURE, e.getReason());
    }

    @Test
    @DisplayName("Missing and non-hex signatures are rejected")
    void verify_missingOrGarbage_rejected() {
        assertEquals(IntegrityException.Reason.MISSING_SIGNATURE,
            assertThrows(IntegrityException.class, () -> verifier.verify(BODY, null, NOW)).getReason());
        assertEquals(IntegrityException.Reason.BAD_SIGNATURE,
            assertThrows(IntegrityException.class, () -> verifier.verify(BODY, "sha256=zz", NOW)).getReason());
    }

    @Test
    @DisplayName("Timestamps older than the tolerance are replays")
    void verify_staleTimestamp_rejected() {
        String header = verifier.sign(BODY);
        IntegrityException e = assertThrows(IntegrityException.class,
            () -> verifier.verify(BODY, header, NOW.minus(Duration.ofMinutes(6))));
        assertEquals(IntegrityException.Reason.STALE_TIMESTAMP, e.getReason());
        assertFalse(verifier.isFresh(NOW.plus(Duration.ofMinutes(10))));
        assertTrue(verifier.isFresh(NOW.plus(Duration.ofMinutes(5))));
    }
}
