package io.github.umputun.beacon.errors;

/**
 * Thrown when the service answers with a non-2xx HTTP status.
 */
public class HttpStatusError extends BeaconException {

    private final int statusCode;
    private final String body;

    /**
     * Creates a new HttpStatusError.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body, may be empty
     */
    public HttpStatusError(int statusCode, String body) {
        this(statusCode, body, "HTTP " + statusCode + ": " + body);
    }

    /**
     * Creates a new HttpStatusError with a custom message.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body, may be empty
     * @param message    the error message
     */
    protected HttpStatusError(int statusCode, String body, String message) {
        super(ErrorReason.fromStatusCode(statusCode), message);
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * Returns the HTTP status code.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the response body.
     *
     * @return the body
     */
    public String getBody() {
        return body;
    }
}
