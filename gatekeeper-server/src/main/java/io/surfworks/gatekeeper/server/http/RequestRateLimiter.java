package io.surfworks.gatekeeper.server.http;

import io.surfworks.gatekeeper.server.config.ServerSettings;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per client address.
 *
 * <p>Each address may make {@code maxRequests} requests per window; the
 * window starts with the address's first request. Expired windows are
 * dropped once the table grows past {@link #PRUNE_THRESHOLD} entries.
 */
public class RequestRateLimiter {

    static final int PRUNE_THRESHOLD = 10_000;

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    private record Window(Instant start, int count) {}

    public RequestRateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Clock.systemUTC());
    }

    public RequestRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1: " + maxRequests);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * The limiter for {@code POST /api/validate-license}.
     */
    public static RequestRateLimiter forValidation() {
        return new RequestRateLimiter(ServerSettings.DEFAULT_VALIDATIONS_PER_MINUTE, Duration.ofMinutes(1));
    }

    /**
     * Count a request from {@code address}.
     *
     * @return false if the address has used up its current window
     */
    public boolean tryAcquire(String address) {
        Instant now = clock.instant();
        if (windows.size() > PRUNE_THRESHOLD) {
            windows.values().removeIf(w -> !now.isBefore(w.start().plus(window)));
        }
        Window updated = windows.compute(address, (key, current) -> {
            if (current == null || !now.isBefore(current.start().plus(window))) {
                return new Window(now, 1);
            }
            return new Window(current.start(), current.count() + 1);
        });
        return updated.count() <= maxRequests;
    }

    /**
     * Seconds until {@code address} may make requests again, at least 1.
     */
    public long retryAfterSeconds(String address) {
        Window current = windows.get(address);
        if (current == null) {
            return 1;
        }
        long seconds = Duration.between(clock.instant(), current.start().plus(window)).toSeconds();
        return Math.max(1, seconds);
    }
}
