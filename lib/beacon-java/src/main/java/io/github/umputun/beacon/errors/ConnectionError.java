package io.github.umputun.beacon.errors;

/**
 * Thrown when a network connection fails or times out.
 */
public class ConnectionError extends BeaconException {

    /**
     * Creates a new ConnectionError.
     *
     * @param message the error message
     */
    public ConnectionError(String message) {
        super(ErrorReason.CONNECTION_FAILURE, message);
    }

    /**
     * Creates a new ConnectionError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public ConnectionError(String message, Throwable cause) {
        super(ErrorReason.CONNECTION_FAILURE, message, cause);
    }

    /**
     * Creates a new ConnectionError with an explicit reason, e.g. TIMED_OUT.
     *
     * @param reason  the error reason
     * @param message the error message
     * @param cause   the underlying cause
     */
    public ConnectionError(ErrorReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
