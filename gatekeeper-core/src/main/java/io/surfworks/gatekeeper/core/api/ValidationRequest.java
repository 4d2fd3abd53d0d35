package io.surfworks.gatekeeper.core.api;

import java.util.List;

/**
 * A client's request to validate its license.
 *
 * @param licenseKey the key to validate
 * @param machineId stable id of the requesting installation
 * @param features features the client intends to use (may be empty)
 * @param version client version
 * @param platform client operating system
 * @param arch client CPU architecture
 */
public record ValidationRequest(
    String licenseKey,
    String machineId,
    List<String> features,
    String version,
    String platform,
    String arch
) {

    public ValidationRequest {
        features = features != null ? List.copyOf(features) : List.of();
    }

    public ValidationRequest(String licenseKey, String machineId, List<String> features, String version) {
        this(licenseKey, machineId, features, version, null, null);
    }

    /**
     * Whether the mandatory fields are present.
     */
    public boolean isWellFormed() {
        return licenseKey != null && !licenseKey.isBlank()
            && machineId != null && !machineId.isBlank();
    }
}
