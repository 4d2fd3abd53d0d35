package io.surfworks.gatekeeper.core.security;

import io.surfworks.gatekeeper.core.tier.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LicenseKeys}.
 */
class LicenseKeysTest {

    private static final Instant ISSUED = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    @DisplayName("Generated keys pass the format check for every tier")
    void format_generatedKeysAreValid() {
        for (Tier tier : Tier.values()) {
            String key = LicenseKeys.format(tier, "user-42");
            assertTrue(LicenseKeys.isValidFormat(key), key);
            assertTrue(key.startsWith(tier.getKeyPrefix() + "-"));
            assertEquals(tier, LicenseKeys.tierOf(key));
        }
    }

    @Test
    @DisplayName("Same inputs and randomness produce the same key")
    void format_isDeterministicForFixedInputs() {
        String a = LicenseKeys.format(Tier.PRO, "user-1", ISSUED, new Random(7));
        String b = LicenseKeys.format(Tier.PRO, "user-1", ISSUED, new Random(7));
        assertEquals(a, b);
        assertNotEquals(a, LicenseKeys.format(Tier.PRO, "user-2", ISSUED, new Random(7)));
    }

    @Test
    @DisplayName("Changing any single character breaks the format check")
    void isValidFormat_singleCharacterMutation_rejected() {
        String key = LicenseKeys.format(Tier.PRO, "user-1", ISSUED, new Random(11));
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '-') {
                continue;
            }
            char replacement = c == 'A' ? 'B' : 'A';
            String mutated = key.substring(0, i) + replacement + key.substring(i + 1);
            assertFalse(LicenseKeys.isValidFormat(mutated), "accepted mutation at " + i + ": " + mutated);
        }
    }

    @Test
    @DisplayName("Malformed keys are rejected")
    void isValidFormat_malformed_rejected() {
        assertFalse(LicenseKeys.isValidFormat(null));
        assertFalse(LicenseKeys.isValidFormat(""));
        assertFalse(LicenseKeys.isValidFormat("GOLD-ABC-12345678-0123456789ABCDEF-ABCD"));
        assertFalse(LicenseKeys.isValidFormat("pro-abc-12345678-0123456789abcdef-abcd"));
        assertFalse(LicenseKeys.isValidFormat("PRO-ABC-1234-0123456789ABCDEF-ABCD"));
    }

    @Test
    @DisplayName("format rejects a blank user seed")
    void format_blankSeed_throws() {
        assertThrows(IllegalArgumentException.class, () -> LicenseKeys.format(Tier.PRO, " "));
    }

    @Test
    @DisplayName("mask keeps the first 8 and last 4 characters")
    void mask_hidesMiddle() {
        String key = LicenseKeys.format(Tier.ENTERPRISE, "user-1", ISSUED, new Random(3));
        String masked = LicenseKeys.mask(key);
        assertEquals(key.substring(0, 8) + "..." + key.substring(key.length() - 4), masked);
        assertEquals("****", LicenseKeys.mask("short"));
        assertEquals("****", LicenseKeys.mask(null));
        assertNull(LicenseKeys.tierOf("nodash"));
    }
}
