package io.github.umputun.beacon.errors;

/**
 * Base exception for all Beacon client errors.
 */
public class BeaconException extends RuntimeException {

    private final ErrorReason reason;

    /**
     * Creates a new BeaconException for an invalid argument.
     *
     * @param message the error message
     */
    public BeaconException(String message) {
        this(ErrorReason.INVALID_ARGUMENTS, message);
    }

    /**
     * Creates a new BeaconException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public BeaconException(String message, Throwable cause) {
        this(ErrorReason.UNKNOWN, message, cause);
    }

    /**
     * Creates a new BeaconException with an explicit reason.
     *
     * @param reason  the error reason
     * @param message the error message
     */
    public BeaconException(ErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Creates a new BeaconException with an explicit reason and cause.
     *
     * @param reason  the error reason
     * @param message the error message
     * @param cause   the underlying cause
     */
    public BeaconException(ErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Returns the reason for this error.
     *
     * @return the reason
     */
    public ErrorReason getReason() {
        return reason;
    }
}
