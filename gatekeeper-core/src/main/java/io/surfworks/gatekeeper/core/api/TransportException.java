package io.surfworks.gatekeeper.core.api;

/**
 * The license authority could not be reached or did not answer usably.
 *
 * <p>This is a transient failure: callers fall back to cached state instead
 * of treating it as a denial.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
