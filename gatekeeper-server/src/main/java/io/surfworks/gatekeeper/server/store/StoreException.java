package io.surfworks.gatekeeper.server.store;

/**
 * The license store could not complete an operation.
 *
 * <p>Always transient from the caller's point of view: the underlying
 * database was unreachable, timed out on a lock, or rejected a statement.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
