package io.github.umputun.beacon.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A GET request against the service origin: an already encoded path, query parameters and a timeout.
 */
public final class TransportRequest {

    /**
     * Which endpoint the request targets.
     */
    public enum Operation {
        SUBSCRIBE,
        HEARTBEAT,
        LEAVE
    }

    private final Operation operation;
    private final String path;
    private final Map<String, String> query;
    private final Duration timeout;

    /**
     * Creates a new request.
     *
     * @param operation the endpoint
     * @param path      encoded path starting with a slash
     * @param query     query parameters in order, values not encoded
     * @param timeout   response timeout
     */
    public TransportRequest(Operation operation, String path, Map<String, String> query, Duration timeout) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        this.path = Objects.requireNonNull(path, "path cannot be null");
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    }

    public Operation getOperation() {
        return operation;
    }

    public String getPath() {
        return path;
    }

    public Map<String, String> getQuery() {
        return query;
    }

    /**
     * Returns a query parameter.
     *
     * @param name the parameter name
     * @return the raw value, or null if absent
     */
    public String queryParam(String name) {
        return query.get(name);
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Resolves this request against an origin.
     *
     * @param origin base URL without trailing slash
     * @return the full URI
     */
    public URI toUri(String origin) {
        StringBuilder sb = new StringBuilder(origin).append(path);
        char sep = '?';
        for (Map.Entry<String, String> e : query.entrySet()) {
            sb.append(sep).append(encode(e.getKey())).append('=').append(encode(e.getValue()));
            sep = '&';
        }
        return URI.create(sb.toString());
    }

    /**
     * URI-encodes a value: spaces become %20 rather than form-style +.
     *
     * @param value raw value
     * @return encoded value
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransportRequest that = (TransportRequest) o;
        return operation == that.operation &&
                path.equals(that.path) &&
                query.equals(that.query) &&
                timeout.equals(that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, path, query, timeout);
    }

    @Override
    public String toString() {
        return "TransportRequest{" +
                "operation=" + operation +
                ", path='" + path + '\'' +
                ", query=" + query +
                '}';
    }
}
