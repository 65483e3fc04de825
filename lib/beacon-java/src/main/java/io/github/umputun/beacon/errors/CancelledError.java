package io.github.umputun.beacon.errors;

/**
 * Thrown when an in-flight request was cancelled by the client.
 */
public class CancelledError extends BeaconException {

    /**
     * Creates a new CancelledError.
     *
     * @param message the error message
     * @param cause   the underlying cause, may be null
     */
    public CancelledError(String message, Throwable cause) {
        super(ErrorReason.CLIENT_CANCELLED, message, cause);
    }
}
