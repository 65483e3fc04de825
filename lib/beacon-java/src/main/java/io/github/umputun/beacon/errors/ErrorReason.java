package io.github.umputun.beacon.errors;

/**
 * Machine-readable cause attached to every {@link BeaconException}.
 */
public enum ErrorReason {
    INVALID_ARGUMENTS,
    MISSING_SUBSCRIBE_KEY,
    MISSING_USER_ID,
    CONNECTION_FAILURE,
    TIMED_OUT,
    BAD_REQUEST,
    UNAUTHORIZED,
    FORBIDDEN,
    RESOURCE_NOT_FOUND,
    REQUEST_URI_TOO_LONG,
    TOO_MANY_REQUESTS,
    MALFORMED_FILTER_EXPRESSION,
    INTERNAL_SERVICE_ERROR,
    SERVICE_UNAVAILABLE,
    UNRECOGNIZED_STATUS_CODE,
    JSON_DATA_DECODING_FAILURE,
    DECRYPTION_FAILURE,
    CLIENT_CANCELLED,
    REQUEST_RETRY_FAILED,
    UNKNOWN;

    /**
     * Maps an HTTP status code returned by the service to a reason.
     *
     * @param statusCode the HTTP status code
     * @return the matching reason, or UNRECOGNIZED_STATUS_CODE
     */
    public static ErrorReason fromStatusCode(int statusCode) {
        switch (statusCode) {
            case 400:
                return BAD_REQUEST;
            case 401:
                return UNAUTHORIZED;
            case 403:
                return FORBIDDEN;
            case 404:
                return RESOURCE_NOT_FOUND;
            case 414:
                return REQUEST_URI_TOO_LONG;
            case 429:
                return TOO_MANY_REQUESTS;
            case 481:
                return MALFORMED_FILTER_EXPRESSION;
            case 500:
                return INTERNAL_SERVICE_ERROR;
            case 503:
                return SERVICE_UNAVAILABLE;
            default:
                return UNRECOGNIZED_STATUS_CODE;
        }
    }
}
