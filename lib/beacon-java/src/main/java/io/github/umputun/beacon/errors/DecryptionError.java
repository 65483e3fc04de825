package io.github.umputun.beacon.errors;

/**
 * Thrown when payload decryption fails.
 */
public class DecryptionError extends BeaconException {

    /**
     * Creates a new DecryptionError.
     *
     * @param message the error message
     */
    public DecryptionError(String message) {
        super(ErrorReason.DECRYPTION_FAILURE, message);
    }

    /**
     * Creates a new DecryptionError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public DecryptionError(String message, Throwable cause) {
        super(ErrorReason.DECRYPTION_FAILURE, message, cause);
    }
}
