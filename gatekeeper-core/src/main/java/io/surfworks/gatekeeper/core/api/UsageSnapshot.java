package io.surfworks.gatekeeper.core.api;

/**
 * Usage block of a validation result.
 *
 * @param callsToday calls recorded for the license today, across machines
 * @param machinesUsed active machines bound to the license
 * @param activeSessions sessions currently open
 */
public record UsageSnapshot(
    int callsToday,
    int machinesUsed,
    int activeSessions
) {

    public static final UsageSnapshot NONE = new UsageSnapshot(0, 0, 0);
}
