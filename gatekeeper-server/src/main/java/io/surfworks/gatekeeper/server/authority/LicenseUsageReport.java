package io.surfworks.gatekeeper.server.authority;

import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.core.tier.TierLimits;
import io.surfworks.gatekeeper.server.store.LicenseStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Admin view of a license's seats and recent usage.
 *
 * @param maskedKey license key, masked
 * @param tier licensed tier
 * @param status lifecycle status
 * @param limits effective limits
 * @param callsToday calls across all machines today (UTC)
 * @param machines active seats
 * @param daily call totals per day, oldest first
 */
public record LicenseUsageReport(
    String maskedKey,
    Tier tier,
    LicenseStatus status,
    TierLimits limits,
    int callsToday,
    List<Seat> machines,
    List<DayTotal> daily
) {

    public record Seat(String machineId, Instant firstSeen, Instant lastSeen) {}

    public record DayTotal(LocalDate date, int calls) {}
}
