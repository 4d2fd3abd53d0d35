package io.surfworks.gatekeeper.server.store;

import io.surfworks.gatekeeper.core.security.FingerprintComponents;

import java.time.Instant;

/**
 * A machine seat on a license.
 */
public record MachineRecord(
    String licenseId,
    String machineId,
    String fingerprintHash,
    FingerprintComponents components,
    Instant firstSeen,
    Instant lastSeen,
    boolean active
) {}
