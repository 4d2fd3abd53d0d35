package io.surfworks.gatekeeper.server.store;

import io.surfworks.gatekeeper.core.api.ValidationResult;

import java.time.Instant;
import java.util.List;

/**
 * A cached validation result and the machines it was computed for.
 *
 * @param result the result as returned to the client
 * @param machineIds machines holding an active seat when the result was cached
 * @param expiresAt end of the entry's lifetime
 */
public record CachedValidation(
    ValidationResult result,
    List<String> machineIds,
    Instant expiresAt
) {

    public CachedValidation {
        machineIds = machineIds != null ? List.copyOf(machineIds) : List.of();
    }

    /**
     * Whether the entry may answer a request from {@code machineId}.
     */
    public boolean admits(String machineId) {
        return machineIds.contains(machineId);
    }
}
