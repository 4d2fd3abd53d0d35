package io.surfworks.gatekeeper.core.security;

import io.surfworks.gatekeeper.core.tier.Tier;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * License key construction and offline format checks.
 *
 * <p>Keys look like {@code PRO-LZ3K9F2A-1A2B3C4D-0123456789ABCDEF-9F3C}:
 * <ol>
 *   <li>tier prefix ({@code FREE}, {@code PRO}, {@code ENT})</li>
 *   <li>issue time in epoch millis, base 36</li>
 *   <li>first 8 hex chars of SHA-256 of the user seed</li>
 *   <li>16 random hex chars</li>
 *   <li>first 4 hex chars of SHA-256 over the segments before it</li>
 * </ol>
 *
 * <p>The checksum lets obviously forged or mistyped keys be rejected before
 * any database lookup. It is not a signature: only the authority's records
 * decide whether a well-formed key is real.
 */
public final class LicenseKeys {

    private static final Pattern KEY_PATTERN =
        Pattern.compile("^(FREE|PRO|ENT)-[A-Z0-9]+-[A-F0-9]{8}-[A-F0-9]{16}-[A-F0-9]{4}$");

    private static final SecureRandom RANDOM = new SecureRandom();

    private LicenseKeys() {}

    /**
     * Create a new key for a tier, bound to a user seed (typically the user id).
     */
    public static String format(Tier tier, String userSeed) {
        return format(tier, userSeed, Instant.now(), RANDOM);
    }

    /**
     * Create a key with an explicit issue time and randomness source.
     */
    public static String format(Tier tier, String userSeed, Instant issuedAt, Random random) {
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (userSeed == null || userSeed.isBlank()) {
            throw new IllegalArgumentException("userSeed cannot be blank");
        }

        String timestamp = Long.toString(issuedAt.toEpochMilli(), 36);
        String userHash = Hashes.sha256Hex(userSeed).substring(0, 8);
        byte[] randomBytes = new byte[8];
        random.nextBytes(randomBytes);
        String randomPart = HexFormat.of().formatHex(randomBytes);

        String body = (tier.getKeyPrefix() + "-" + timestamp + "-" + userHash + "-" + randomPart)
            .toUpperCase(Locale.ROOT);
        return body + "-" + checksum(body);
    }

    /**
     * Check pattern and checksum. Does no I/O.
     */
    public static boolean isValidFormat(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            return false;
        }
        int lastDash = key.lastIndexOf('-');
        String body = key.substring(0, lastDash);
        String provided = key.substring(lastDash + 1);
        return ConstantTime.equals(provided, checksum(body));
    }

    /**
     * The tier encoded in a key's prefix.
     *
     * @return the tier, or null if the key has no recognizable prefix
     */
    public static Tier tierOf(String key) {
        if (key == null) {
            return null;
        }
        int dash = key.indexOf('-');
        return dash > 0 ? Tier.fromKeyPrefix(key.substring(0, dash)) : null;
    }

    /**
     * Masked form for logs and status output (e.g., "PRO-LZ3K...9F3C").
     */
    public static String mask(String key) {
        if (key == null || key.length() < 12) {
            return "****";
        }
        return key.substring(0, 8) + "..." + key.substring(key.length() - 4);
    }

    private static String checksum(String body) {
        return Hashes.sha256Hex(body).substring(0, 4).toUpperCase(Locale.ROOT);
    }
}
