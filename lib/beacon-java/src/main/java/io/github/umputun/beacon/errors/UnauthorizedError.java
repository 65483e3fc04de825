package io.github.umputun.beacon.errors;

/**
 * Thrown when authentication fails (HTTP 401).
 */
public class UnauthorizedError extends HttpStatusError {

    /**
     * Creates a new UnauthorizedError.
     */
    public UnauthorizedError() {
        this("unauthorized: missing or invalid auth key");
    }

    /**
     * Creates a new UnauthorizedError with a custom message.
     *
     * @param message the error message
     */
    public UnauthorizedError(String message) {
        super(401, "", message);
    }
}
