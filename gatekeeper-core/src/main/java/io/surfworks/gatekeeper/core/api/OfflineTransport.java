package io.surfworks.gatekeeper.core.api;

/**
 * Transport used when no license server is configured.
 *
 * <p>Every call fails as a transport error, so clients keep running on their
 * cached validation and otherwise stay on the FREE tier.
 */
public class OfflineTransport implements LicenseTransport {

    @Override
    public ValidationResult validate(ValidationRequest request) throws TransportException {
        throw new TransportException("No license server configured");
    }

    @Override
    public String getName() {
        return "Offline (no server configured)";
    }
}
