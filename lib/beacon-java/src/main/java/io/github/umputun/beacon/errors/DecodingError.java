package io.github.umputun.beacon.errors;

/**
 * Thrown when a whole response body cannot be decoded.
 */
public class DecodingError extends BeaconException {

    /**
     * Creates a new DecodingError.
     *
     * @param message the error message
     */
    public DecodingError(String message) {
        super(ErrorReason.JSON_DATA_DECODING_FAILURE, message);
    }

    /**
     * Creates a new DecodingError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public DecodingError(String message, Throwable cause) {
        super(ErrorReason.JSON_DATA_DECODING_FAILURE, message, cause);
    }
}
