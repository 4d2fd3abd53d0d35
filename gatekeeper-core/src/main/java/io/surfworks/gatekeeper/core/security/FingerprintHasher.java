package io.surfworks.gatekeeper.core.security;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Server-side machine fingerprinting.
 *
 * <p>The hash is an HMAC keyed with a secret only the authority holds, so a
 * client cannot compute a fingerprint for a machine it does not control.
 * Comparison follows a "core match" policy: see
 * {@link FingerprintComponents#coreMatches(FingerprintComponents)}.
 */
public final class FingerprintHasher {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String secret;
    private final Clock clock;

    public FingerprintHasher(String secret) {
        this(secret, Clock.systemUTC());
    }

    public FingerprintHasher(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("fingerprint secret cannot be empty");
        }
        this.secret = secret;
        this.clock = clock;
    }

    /**
     * A fingerprint hash together with the components it was derived from.
     */
    public record Fingerprint(String hash, FingerprintComponents components) {}

    /**
     * Fingerprint a machine, adding a fresh salt and the current time.
     */
    public Fingerprint fingerprint(String platform, String arch, String machineId, String version) {
        byte[] salt = new byte[16];
        RANDOM.nextBytes(salt);
        var components = new FingerprintComponents(
            platform, arch, machineId, version,
            HexFormat.of().formatHex(salt),
            clock.millis()
        );
        return new Fingerprint(hash(components), components);
    }

    /**
     * Recompute the hash for known components.
     */
    public String hash(FingerprintComponents components) {
        return Hashes.hmacSha256Hex(secret, components.canonical().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Whether a stored fingerprint was issued by this authority for these components.
     */
    public boolean verify(Fingerprint stored) {
        return stored != null && ConstantTime.equals(stored.hash(), hash(stored.components()));
    }

    /**
     * Core-match comparison between a stored and a freshly taken fingerprint.
     */
    public static boolean matches(FingerprintComponents stored, FingerprintComponents current) {
        return stored != null && stored.coreMatches(current);
    }
}
