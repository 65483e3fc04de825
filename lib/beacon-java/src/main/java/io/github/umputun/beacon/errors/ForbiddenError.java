package io.github.umputun.beacon.errors;

/**
 * Thrown when access is denied (HTTP 403).
 */
public class ForbiddenError extends HttpStatusError {

    private final String resource;

    /**
     * Creates a new ForbiddenError.
     *
     * @param resource the request path that access was denied to
     * @param body     the response body
     */
    public ForbiddenError(String resource, String body) {
        super(403, body, "forbidden: access denied for " + resource);
        this.resource = resource;
    }

    /**
     * Returns the request path that access was denied to.
     *
     * @return the resource
     */
    public String getResource() {
        return resource;
    }
}
