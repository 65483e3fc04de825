package io.github.umputun.beacon.transport;

import io.github.umputun.beacon.transport.TransportRequest.Operation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportRequestTest {

    @Test
    void encodeUsesPercentTwenty() {
        assertThat(TransportRequest.encode("a b")).isEqualTo("a%20b");
        assertThat(TransportRequest.encode("a+b")).isEqualTo("a%2Bb");
        assertThat(TransportRequest.encode("{\"k\":1}")).isEqualTo("%7B%22k%22%3A1%7D");
        assertThat(TransportRequest.encode("ünï")).isEqualTo("%C3%BCn%C3%AF");
    }

    @Test
    void toUriKeepsQueryOrder() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("uuid", "u");
        query.put("tt", "0");
        query.put("heartbeat", "300");
        TransportRequest request = new TransportRequest(Operation.SUBSCRIBE, "/v2/subscribe/k/c/0", query,
                Duration.ofSeconds(1));

        assertThat(request.toUri("http://localhost").toString())
                .isEqualTo("http://localhost/v2/subscribe/k/c/0?uuid=u&tt=0&heartbeat=300");
    }

    @Test
    void queryIsCopied() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("uuid", "u");
        TransportRequest request = new TransportRequest(Operation.LEAVE, "/p", query, Duration.ofSeconds(1));

        query.put("auth", "x");

        assertThat(request.queryParam("auth")).isNull();
        assertThatThrownBy(() -> request.getQuery().put("a", "b")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equalsAndHashCode() {
        TransportRequest a = new TransportRequest(Operation.LEAVE, "/p", Map.of("uuid", "u"), Duration.ofSeconds(1));
        TransportRequest b = new TransportRequest(Operation.LEAVE, "/p", Map.of("uuid", "u"), Duration.ofSeconds(1));
        TransportRequest c = new TransportRequest(Operation.HEARTBEAT, "/p", Map.of("uuid", "u"), Duration.ofSeconds(1));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toString()).contains("LEAVE").contains("/p");
    }
}
