package io.github.umputun.beacon.transport;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.CancelledError;
import io.github.umputun.beacon.errors.ConnectionError;
import io.github.umputun.beacon.errors.ErrorReason;
import io.github.umputun.beacon.errors.ForbiddenError;
import io.github.umputun.beacon.errors.HttpStatusError;
import io.github.umputun.beacon.errors.UnauthorizedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link Transport} on top of {@link HttpClient}.
 */
public final class HttpTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransport.class);

    private static final String HEADER_USER_AGENT = "User-Agent";
    private static final String USER_AGENT = "beacon-java";

    private final String origin;
    private final HttpClient httpClient;

    /**
     * Creates a new transport.
     *
     * @param origin         base URL of the service
     * @param connectTimeout TCP connect timeout
     */
    public HttpTransport(String origin, Duration connectTimeout) {
        if (origin == null || origin.isEmpty()) {
            throw new BeaconException("origin cannot be empty");
        }
        this.origin = origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public CompletableFuture<byte[]> execute(TransportRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(request.toUri(origin))
                .timeout(request.getTimeout())
                .header(HEADER_USER_AGENT, USER_AGENT)
                .GET()
                .build();
        LOGGER.debug("{} {}", request.getOperation(), httpRequest.uri());

        CompletableFuture<byte[]> result = new CompletableFuture<>();
        CompletableFuture<HttpResponse<byte[]>> sent =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        sent.whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(mapError(unwrap(error)));
                return;
            }
            try {
                result.complete(handleResponse(request, response));
            } catch (BeaconException e) {
                result.completeExceptionally(e);
            }
        });
        // cancelling the caller's future aborts the exchange
        result.whenComplete((body, error) -> {
            if (result.isCancelled()) {
                sent.cancel(true);
            }
        });
        return result;
    }

    private static byte[] handleResponse(TransportRequest request, HttpResponse<byte[]> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }

        String errorBody = response.body() != null ? new String(response.body(), StandardCharsets.UTF_8) : "";
        switch (status) {
            case 401:
                throw new UnauthorizedError();
            case 403:
                throw new ForbiddenError(request.getPath(), errorBody);
            default:
                throw new HttpStatusError(status, errorBody);
        }
    }

    static BeaconException mapError(Throwable error) {
        if (error instanceof BeaconException) {
            return (BeaconException) error;
        }
        if (error instanceof CancellationException) {
            return new CancelledError("request cancelled", error);
        }
        if (error instanceof HttpTimeoutException) {
            return new ConnectionError(ErrorReason.TIMED_OUT, "request timeout", error);
        }
        if (error instanceof IOException) {
            return new ConnectionError("connection failed: " + error.getMessage(), error);
        }
        return new BeaconException("request failed: " + error.getMessage(), error);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
