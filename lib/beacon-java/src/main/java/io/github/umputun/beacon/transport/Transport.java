package io.github.umputun.beacon.transport;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * Executes requests built by the router. Implementations complete the returned future with the
 * response body on 2xx, or exceptionally with a {@link io.github.umputun.beacon.errors.BeaconException}.
 * Cancelling the future aborts the request.
 */
public interface Transport extends Closeable {

    /**
     * Sends a request.
     *
     * @param request the request
     * @return future with the raw response body
     */
    CompletableFuture<byte[]> execute(TransportRequest request);

    @Override
    default void close() {
    }
}
