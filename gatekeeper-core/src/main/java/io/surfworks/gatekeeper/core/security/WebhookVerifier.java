package io.surfworks.gatekeeper.core.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Signs and verifies payment-provider webhook bodies.
 *
 * <p>Signatures are HMAC-SHA256 over the raw body bytes, hex encoded, with an
 * optional {@code sha256=} prefix. Verification also rejects events whose
 * timestamp is further than the tolerance from now, which blocks replays of
 * captured deliveries.
 */
public final class WebhookVerifier {

    /**
     * Default accepted clock distance between event timestamp and now.
     */
    public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(5);

    private static final String PREFIX = "sha256=";

    private final byte[] secret;
    private final Duration tolerance;
    private final Clock clock;

    public WebhookVerifier(String secret) {
        this(secret, DEFAULT_TOLERANCE, Clock.systemUTC());
    }

    public WebhookVerifier(String secret, Duration tolerance, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("webhook secret cannot be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.tolerance = tolerance;
        this.clock = clock;
    }

    /**
     * Signature header value for a body, including the {@code sha256=} prefix.
     */
    public String sign(byte[] payload) {
        return PREFIX + HexFormat.of().formatHex(Hashes.hmacSha256(secret, payload));
    }

    /**
     * Verify a delivery.
     *
     * @param payload raw body bytes exactly as received
     * @param signatureHeader signature header value, with or without prefix
     * @param timestamp the event's timestamp
     * @throws IntegrityException if the signature is missing or wrong, or the timestamp is stale
     */
    public void verify(byte[] payload, String signatureHeader, Instant timestamp) throws IntegrityException {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new IntegrityException(IntegrityException.Reason.MISSING_SIGNATURE, "Missing webhook signature");
        }
        if (timestamp == null || !isFresh(timestamp)) {
            throw new IntegrityException(IntegrityException.Reason.STALE_TIMESTAMP,
                "Webhook timestamp outside tolerance: " + timestamp);
        }

        String provided = signatureHeader.trim();
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }
        byte[] providedBytes;
        try {
            providedBytes = HexFormat.of().parseHex(provided.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IntegrityException(IntegrityException.Reason.BAD_SIGNATURE, "Webhook signature is not hex");
        }
        if (!ConstantTime.equals(Hashes.hmacSha256(secret, payload), providedBytes)) {
            throw new IntegrityException(IntegrityException.Reason.BAD_SIGNATURE, "Webhook signature mismatch");
        }
    }

    /**
     * Whether a timestamp lies within the tolerance window around now.
     */
    public boolean isFresh(Instant timestamp) {
        return Duration.between(timestamp, clock.instant()).abs().compareTo(tolerance) <= 0;
    }
}
