package io.surfworks.gatekeeper.core.api;

/**
 * How a client reaches the license authority.
 *
 * <p>Implementations:
 * <ul>
 *   <li>an HTTP client for deployed clients</li>
 *   <li>a direct, in-process call for embedded servers and tests</li>
 *   <li>{@link OfflineTransport} when no authority is configured</li>
 * </ul>
 *
 * <p>A returned result, valid or denied, is the authority's answer. Anything
 * that prevents getting an answer is a {@link TransportException}.
 */
public interface LicenseTransport {

    /**
     * Ask the authority to validate a license.
     *
     * @throws TransportException if no answer could be obtained
     */
    ValidationResult validate(ValidationRequest request) throws TransportException;

    /**
     * Name for display/logging.
     */
    String getName();
}
