package io.surfworks.gatekeeper.core.tier;

/**
 * Quantitative limits attached to a tier or a license.
 *
 * @param dailyCalls maximum feature calls per day, {@link #UNLIMITED} for no cap
 * @param maxMachines maximum simultaneously active machines
 * @param concurrentSessions maximum concurrent sessions
 */
public record TierLimits(
    int dailyCalls,
    int maxMachines,
    int concurrentSessions
) {

    /**
     * Marker for an uncapped daily call count.
     */
    public static final int UNLIMITED = -1;

    public TierLimits {
        if (dailyCalls < UNLIMITED) {
            throw new IllegalArgumentException("dailyCalls must be >= -1: " + dailyCalls);
        }
        if (maxMachines < 1) {
            throw new IllegalArgumentException("maxMachines must be >= 1: " + maxMachines);
        }
        if (concurrentSessions < 1) {
            throw new IllegalArgumentException("concurrentSessions must be >= 1: " + concurrentSessions);
        }
    }

    public boolean isUnlimited() {
        return dailyCalls == UNLIMITED;
    }

    /**
     * Whether every limit here is at least as generous as in {@code other}.
     */
    public boolean covers(TierLimits other) {
        boolean calls = isUnlimited()
            || (!other.isUnlimited() && dailyCalls >= other.dailyCalls);
        return calls
            && maxMachines >= other.maxMachines
            && concurrentSessions >= other.concurrentSessions;
    }

    /**
     * Apply per-license overrides. Null values keep the tier default.
     */
    public TierLimits withOverrides(Integer dailyCallsOverride, Integer maxMachinesOverride,
                                    Integer concurrentSessionsOverride) {
        return new TierLimits(
            dailyCallsOverride != null ? dailyCallsOverride : dailyCalls,
            maxMachinesOverride != null ? maxMachinesOverride : maxMachines,
            concurrentSessionsOverride != null ? concurrentSessionsOverride : concurrentSessions
        );
    }

    /**
     * Human-readable daily quota ("50" or "unlimited").
     */
    public String describeDailyCalls() {
        return isUnlimited() ? "unlimited" : Integer.toString(dailyCalls);
    }
}
