package io.surfworks.gatekeeper.server.store;

import java.time.LocalDate;
import java.util.List;

/**
 * Calls made by one machine on one (UTC) date.
 */
public record UsageRecord(
    String licenseId,
    String machineId,
    LocalDate date,
    int callCount,
    List<String> features
) {

    public UsageRecord {
        features = features != null ? List.copyOf(features) : List.of();
    }
}
