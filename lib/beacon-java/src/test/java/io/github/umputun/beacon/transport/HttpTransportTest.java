package io.github.umputun.beacon.transport;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.CancelledError;
import io.github.umputun.beacon.errors.ConnectionError;
import io.github.umputun.beacon.errors.ErrorReason;
import io.github.umputun.beacon.errors.ForbiddenError;
import io.github.umputun.beacon.errors.HttpStatusError;
import io.github.umputun.beacon.errors.UnauthorizedError;
import io.github.umputun.beacon.transport.TransportRequest.Operation;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTransportTest {

    private MockWebServer server;
    private HttpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new HttpTransport(server.url("/").toString(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.close();
        server.shutdown();
    }

    private static TransportRequest request(Duration timeout) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("uuid", "user 1");
        query.put("tt", "0");
        return new TransportRequest(Operation.SUBSCRIBE, "/v2/subscribe/demo/chat,news/0", query, timeout);
    }

    private static Throwable failure(CompletableFuture<byte[]> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (Exception e) {
            throw new AssertionError("unexpected outcome", e);
        }
        throw new AssertionError("expected failure");
    }

    @Test
    void returnsBody() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"t\":{\"t\":\"1\",\"r\":1},\"m\":[]}"));

        byte[] body = transport.execute(request(Duration.ofSeconds(5))).get(5, TimeUnit.SECONDS);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"t\":{\"t\":\"1\",\"r\":1},\"m\":[]}");
        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/v2/subscribe/demo/chat,news/0?uuid=user%201&tt=0");
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("beacon-java");
    }

    @Test
    void unauthorized() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThat(failure(transport.execute(request(Duration.ofSeconds(5)))))
                .isInstanceOf(UnauthorizedError.class);
    }

    @Test
    void forbiddenCarriesPathAndBody() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"status\":403}"));

        Throwable error = failure(transport.execute(request(Duration.ofSeconds(5))));

        assertThat(error).isInstanceOf(ForbiddenError.class).hasMessageContaining("/v2/subscribe/demo/chat,news/0");
        assertThat(((ForbiddenError) error).getBody()).isEqualTo("{\"status\":403}");
        assertThat(((ForbiddenError) error).getReason()).isEqualTo(ErrorReason.FORBIDDEN);
    }

    @Test
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        Throwable error = failure(transport.execute(request(Duration.ofSeconds(5))));

        assertThat(error).isInstanceOf(HttpStatusError.class);
        assertThat(((HttpStatusError) error).getStatusCode()).isEqualTo(500);
        assertThat(((HttpStatusError) error).getBody()).isEqualTo("oops");
        assertThat(((HttpStatusError) error).getReason()).isEqualTo(ErrorReason.INTERNAL_SERVICE_ERROR);
    }

    @Test
    void connectionRefused() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/").toString();
        closed.shutdown();
        HttpTransport unreachable = new HttpTransport(url, Duration.ofSeconds(2));

        Throwable error = failure(unreachable.execute(request(Duration.ofSeconds(2))));

        assertThat(error).isInstanceOf(ConnectionError.class);
        assertThat(((ConnectionError) error).getReason()).isEqualTo(ErrorReason.CONNECTION_FAILURE);
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        Throwable error = failure(transport.execute(request(Duration.ofMillis(200))));

        assertThat(error).isInstanceOf(ConnectionError.class);
        assertThat(((ConnectionError) error).getReason()).isEqualTo(ErrorReason.TIMED_OUT);
    }

    @Test
    void cancelAbortsRequest() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));

        CompletableFuture<byte[]> future = transport.execute(request(Duration.ofSeconds(10)));
        assertThat(future.cancel(true)).isTrue();

        assertThat(future).isCancelled();
        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
    }

    @Test
    void mapsErrors() {
        assertThat(HttpTransport.mapError(new CancellationException())).isInstanceOf(CancelledError.class);
        assertThat(HttpTransport.mapError(new HttpTimeoutException("slow")).getReason())
                .isEqualTo(ErrorReason.TIMED_OUT);
        assertThat(HttpTransport.mapError(new ConnectException("refused")))
                .isInstanceOf(ConnectionError.class);
        BeaconException own = new BeaconException("own");
        assertThat(HttpTransport.mapError(own)).isSameAs(own);
        assertThat(HttpTransport.mapError(new IllegalStateException("bug")).getReason())
                .isEqualTo(ErrorReason.UNKNOWN);

        Throwable root = new ConnectException("refused");
        assertThat(HttpTransport.unwrap(new CompletionException(new ExecutionException("wrapped", root)))).isSameAs(root);
    }

    @Test
    void rejectsEmptyOrigin() {
        assertThatThrownBy(() -> new HttpTransport("", Duration.ofSeconds(1)))
                .isInstanceOf(BeaconException.class);
    }
}
