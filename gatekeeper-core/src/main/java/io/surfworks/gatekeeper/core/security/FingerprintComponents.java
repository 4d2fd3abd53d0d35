package io.surfworks.gatekeeper.core.security;

import java.util.Objects;

/**
 * Inputs to a machine fingerprint.
 *
 * <p>{@code platform}, {@code arch} and {@code machineId} are the core fields:
 * two fingerprints describe the same installation only if these match exactly.
 * The remaining fields may drift (client upgrades, re-registration).
 *
 * @param platform operating system name
 * @param arch CPU architecture
 * @param machineId stable machine identifier reported by the client
 * @param version client version
 * @param salt random salt chosen when the fingerprint was taken
 * @param timestamp epoch millis when the fingerprint was taken
 */
public record FingerprintComponents(
    String platform,
    String arch,
    String machineId,
    String version,
    String salt,
    long timestamp
) {

    public FingerprintComponents {
        Objects.requireNonNull(platform, "platform cannot be null");
        Objects.requireNonNull(arch, "arch cannot be null");
        Objects.requireNonNull(machineId, "machineId cannot be null");
    }

    /**
     * Exact equality on the core fields only.
     */
    public boolean coreMatches(FingerprintComponents other) {
        return other != null
            && platform.equals(other.platform)
            && arch.equals(other.arch)
            && machineId.equals(other.machineId);
    }

    String canonical() {
        return "platform=" + platform
            + "|arch=" + arch
            + "|machineId=" + machineId
            + "|version=" + (version != null ? version : "")
            + "|salt=" + (salt != null ? salt : "")
            + "|timestamp=" + timestamp;
    }
}
