package io.surfworks.gatekeeper.server.authority;

import io.surfworks.gatekeeper.core.api.LicenseTransport;
import io.surfworks.gatekeeper.core.api.TransportException;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;

/**
 * In-process transport that calls a {@link LicenseAuthority} directly.
 *
 * <p>Used when the authority is embedded in the same JVM as the client, and
 * in tests.
 */
public class DirectLicenseTransport implements LicenseTransport {

    private final LicenseAuthority authority;

    public DirectLicenseTransport(LicenseAuthority authority) {
        this.authority = authority;
    }

    @Override
    public ValidationResult validate(ValidationRequest request) throws TransportException {
        try {
            return authority.validateLicense(request);
        } catch (RuntimeException e) {
            throw new TransportException("License authority failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "Direct (in-process)";
    }
}
