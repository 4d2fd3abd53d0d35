package io.surfworks.gatekeeper.core.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * HMAC-SHA256 request signing for calls between trusted services.
 *
 * <p>The signed message is the canonical payload followed by the decimal
 * timestamp, so a signature cannot be replayed with a different time.
 */
public final class HmacSigner {

    /**
     * Default window within which a request timestamp is accepted.
     */
    public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(5);

    private final String secret;
    private final Duration tolerance;
    private final Clock clock;

    public HmacSigner(String secret) {
        this(secret, DEFAULT_TOLERANCE, Clock.systemUTC());
    }

    public HmacSigner(String secret, Duration tolerance, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("signing secret cannot be empty");
        }
        this.secret = secret;
        this.tolerance = tolerance;
        this.clock = clock;
    }

    /**
     * Sign a payload at the given epoch-millis timestamp.
     *
     * @return lowercase hex signature
     */
    public String signRequest(String payload, long timestamp) {
        return Hashes.hmacSha256Hex(secret, message(payload, timestamp));
    }

    /**
     * Verify a signature and the freshness of its timestamp.
     *
     * @throws IntegrityException if the signature is missing, wrong, or stale
     */
    public void verifyRequest(String payload, long timestamp, String signature) throws IntegrityException {
        if (signature == null || signature.isBlank()) {
            throw new IntegrityException(IntegrityException.Reason.MISSING_SIGNATURE, "Missing request signature");
        }
        Instant sentAt = Instant.ofEpochMilli(timestamp);
        if (Duration.between(sentAt, clock.instant()).abs().compareTo(tolerance) > 0) {
            throw new IntegrityException(IntegrityException.Reason.STALE_TIMESTAMP,
                "Request timestamp outside tolerance: " + sentAt);
        }
        if (!ConstantTime.equals(signRequest(payload, timestamp), signature.trim().toLowerCase(Locale.ROOT))) {
            throw new IntegrityException(IntegrityException.Reason.BAD_SIGNATURE, "Request signature mismatch");
        }
    }

    private static byte[] message(String payload, long timestamp) {
        String body = payload != null ? payload : "";
        return (body + timestamp).getBytes(StandardCharsets.UTF_8);
    }
}
