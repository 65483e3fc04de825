package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.DecodingError;
import io.github.umputun.beacon.errors.ErrorReason;
import io.github.umputun.beacon.event.FileEvent;
import io.github.umputun.beacon.event.MessageActionEvent;
import io.github.umputun.beacon.event.MessageEvent;
import io.github.umputun.beacon.event.ObjectEvent;
import io.github.umputun.beacon.event.PresenceEvent;
import io.github.umputun.beacon.event.SignalEvent;
import io.github.umputun.beacon.event.SubscribeEvent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeDecoderTest {

    private final EnvelopeDecoder decoder = new EnvelopeDecoder(TestSupport.options().build());

    private SubscribeResponse decode(EnvelopeDecoder d, String body) {
        return d.decode(body.getBytes(StandardCharsets.UTF_8));
    }

    private SubscribeEvent single(String envelope) {
        SubscribeResponse response = decode(decoder, Fixtures.response("100", 1, envelope));
        assertThat(response.getEvents()).hasSize(1);
        return response.getEvents().get(0);
    }

    @Test
    void emptyBatch() {
        SubscribeResponse response = decode(decoder, "{\"t\":{\"t\":\"16000000000000000\",\"r\":12},\"m\":[]}");

        assertThat(response.getCursor()).isEqualTo(new Cursor(16000000000000000L, 12));
        assertThat(response.getEvents()).isEmpty();
        assertThat(response.getEnvelopeCount()).isZero();
    }

    @Test
    void missingMessagesIsEmptyBatch() {
        SubscribeResponse response = decode(decoder, "{\"t\":{\"t\":\"5\"}}");

        assertThat(response.getCursor()).isEqualTo(new Cursor(5, 0));
        assertThat(response.getEvents()).isEmpty();
    }

    @Test
    void message() {
        String envelope = "{\"a\":\"1\",\"f\":0,\"i\":\"alice\",\"p\":{\"t\":\"90\",\"r\":2},\"k\":\"demo\","
                + "\"c\":\"chat\",\"b\":\"chat.*\",\"u\":{\"lang\":\"en\"},\"cmt\":\"text\",\"d\":{\"text\":\"hi\"}}";

        MessageEvent event = (MessageEvent) single(envelope);

        assertThat(event.getChannel()).isEqualTo("chat");
        assertThat(event.getSubscription()).isEqualTo("chat.*");
        assertThat(event.getTimetoken()).isEqualTo(new Cursor(90, 2));
        assertThat(event.getPublisher()).isEqualTo("alice");
        assertThat(event.getPayload().getAsJsonObject().get("text").getAsString()).isEqualTo("hi");
        assertThat(event.getUserMetadata().getAsJsonObject().get("lang").getAsString()).isEqualTo("en");
        assertThat(event.getCustomMessageType()).isEqualTo("text");
        assertThat(event.getDecryptionError()).isNull();
    }

    @Test
    void signal() {
        SignalEvent event = (SignalEvent) single(Fixtures.typed(1, "chat", "\"typing\"", "91"));

        assertThat(event.getChannel()).isEqualTo("chat");
        assertThat(event.getPayload().getAsString()).isEqualTo("typing");
    }

    @Test
    void file() {
        String payload = "{\"message\":\"look\",\"file\":{\"id\":\"f-1\",\"name\":\"cat photo.png\"}}";

        FileEvent event = (FileEvent) single(Fixtures.typed(4, "chat", payload, "92"));

        assertThat(event.getFileId()).isEqualTo("f-1");
        assertThat(event.getFileName()).isEqualTo("cat photo.png");
        assertThat(event.getMessage().getAsString()).isEqualTo("look");
        assertThat(event.getFileUrl())
                .isEqualTo("https://ps.pndsn.com/v1/files/demo/channels/chat/files/f-1/cat%20photo.png");
    }

    @Test
    void presenceJoinExpandsUuid() {
        String payload = "{\"action\":\"join\",\"uuid\":\"bob\",\"occupancy\":3,\"timestamp\":1700000000}";

        PresenceEvent event = (PresenceEvent) single(Fixtures.presence("chat", payload, "93"));

        assertThat(event.getChannel()).isEqualTo("chat");
        assertThat(event.getAction()).isEqualTo(PresenceEvent.Action.JOIN);
        assertThat(event.getUuid()).isEqualTo("bob");
        assertThat(event.getJoined()).containsExactly("bob");
        assertThat(event.getLeft()).isEmpty();
        assertThat(event.getOccupancy()).isEqualTo(3);
        assertThat(event.getTimestamp()).isEqualTo(1700000000L);
    }

    @Test
    void presenceStateChangeAndDefaults() {
        String payload = "{\"action\":\"state-change\",\"uuid\":\"bob\",\"data\":{\"mood\":\"busy\"}}";

        PresenceEvent event = (PresenceEvent) single(Fixtures.presence("chat", payload, "94"));

        assertThat(event.getAction()).isEqualTo(PresenceEvent.Action.STATE_CHANGE);
        assertThat(event.getState().getAsJsonObject().get("mood").getAsString()).isEqualTo("busy");
        assertThat(event.getOccupancy()).isZero();
        assertThat(event.getTimestamp()).isZero();
        assertThat(event.getJoined()).isEmpty();
    }

    @Test
    void presenceIntervalWithRefresh() {
        String payload = "{\"action\":\"interval\",\"occupancy\":40,\"here_now_refresh\":true,\"timeout\":[\"x\"]}";

        PresenceEvent event = (PresenceEvent) single(Fixtures.presence("chat", payload, "95"));

        assertThat(event.isRefreshHereNow()).isTrue();
        assertThat(event.getTimedOut()).containsExactly("x");
    }

    @Test
    void objectEvents() {
        String channelSet = "{\"source\":\"objects\",\"version\":\"2.0\",\"event\":\"set\",\"type\":\"channel\","
                + "\"data\":{\"id\":\"chat\",\"name\":\"Chat\"}}";
        String membership = "{\"source\":\"objects\",\"version\":\"2.0\",\"event\":\"delete\",\"type\":\"membership\","
                + "\"data\":{\"channel\":{\"id\":\"chat\"},\"uuid\":{\"id\":\"bob\"}}}";

        ObjectEvent set = (ObjectEvent) single(Fixtures.typed(2, "chat", channelSet, "96"));
        ObjectEvent removed = (ObjectEvent) single(Fixtures.typed(2, "chat", membership, "97"));

        assertThat(set.getKind()).isEqualTo(ObjectEvent.Kind.CHANNEL_SET);
        assertThat(set.getMetadataId()).isEqualTo("chat");
        assertThat(set.getChangeset().get("name").getAsString()).isEqualTo("Chat");
        assertThat(set.getSource()).isEqualTo("objects");
        assertThat(set.getVersion()).isEqualTo("2.0");
        assertThat(removed.getKind()).isEqualTo(ObjectEvent.Kind.MEMBERSHIP_REMOVED);
        assertThat(removed.getMetadataId()).isEqualTo("bob");
    }

    @Test
    void messageAction() {
        String payload = "{\"event\":\"added\",\"data\":{\"type\":\"reaction\",\"value\":\"smile\","
                + "\"actionTimetoken\":\"200\",\"messageTimetoken\":\"150\"}}";

        MessageActionEvent event = (MessageActionEvent) single(Fixtures.typed(3, "chat", payload, "98"));

        assertThat(event.getKind()).isEqualTo(MessageActionEvent.Kind.ADDED);
        assertThat(event.getType()).isEqualTo("reaction");
        assertThat(event.getValue()).isEqualTo("smile");
        assertThat(event.getActionTimetoken().timetokenString()).isEqualTo("200");
        assertThat(event.getMessageTimetoken().timetokenString()).isEqualTo("150");
        assertThat(event.getPublisher()).isEqualTo("publisher-1");
    }

    @Test
    void badEnvelopesAreSkipped() {
        SubscribeResponse response = decode(decoder, Fixtures.response("100", 1,
                "42",
                "{\"c\":\"chat\",\"p\":{\"t\":\"1\",\"r\":1}}",
                Fixtures.typed(9, "chat", "1", "2"),
                Fixtures.presence("chat", "{\"action\":\"dance\"}", "3"),
                Fixtures.typed(3, "chat", "{\"event\":\"added\"}", "4"),
                Fixtures.message("chat", "\"ok\"", "5")));

        assertThat(response.getEnvelopeCount()).isEqualTo(6);
        assertThat(response.getEvents()).hasSize(1);
        assertThat(((MessageEvent) response.getEvents().get(0)).getPayload().getAsString()).isEqualTo("ok");
    }

    @Test
    void malformedBodies() {
        assertThatThrownBy(() -> decode(decoder, "not json"))
                .isInstanceOf(DecodingError.class);
        assertThatThrownBy(() -> decode(decoder, "[1,2]"))
                .isInstanceOf(DecodingError.class);
        assertThatThrownBy(() -> decode(decoder, "{\"m\":[]}"))
                .isInstanceOf(DecodingError.class)
                .hasMessageContaining("cursor");
        assertThatThrownBy(() -> decode(decoder, "{\"t\":{\"t\":\"abc\"},\"m\":[]}"))
                .isInstanceOf(DecodingError.class);
        assertThatThrownBy(() -> decode(decoder, "{\"t\":{\"t\":\"1\"},\"m\":{}}"))
                .isInstanceOf(DecodingError.class)
                .hasMessageContaining("not an array");
        assertThatThrownBy(() -> decoder.decode(new byte[0]))
                .isInstanceOf(DecodingError.class);
    }

    @Test
    void invalidUtf8Rejected() {
        byte[] body = {'{', '"', 't', '"', ':', (byte) 0xC3, (byte) 0x28, '}'};

        assertThatThrownBy(() -> decoder.decode(body))
                .isInstanceOf(DecodingError.class)
                .extracting(e -> ((DecodingError) e).getReason())
                .isEqualTo(ErrorReason.JSON_DATA_DECODING_FAILURE);
    }

    @Test
    void decryptsWithCipher() {
        EnvelopeDecoder encrypted = new EnvelopeDecoder(TestSupport.options().cipherKey("enigma").build());

        SubscribeResponse response = decode(encrypted, Fixtures.response("100", 1,
                Fixtures.message("chat", "\"AAECAwQFBgcICQoLDA0OD6Agstr0csEI/fU0/3f+dxk=\"", "1"),
                Fixtures.message("chat", "\"AAECAwQFBgcICQoLDA0OD7NT3eBnafq0H53waELuQ8w=\"", "2")));

        MessageEvent json = (MessageEvent) response.getEvents().get(0);
        MessageEvent text = (MessageEvent) response.getEvents().get(1);
        assertThat(json.getPayload().getAsString()).isEqualTo("Test Message");
        // not JSON after decryption, delivered as a string
        assertThat(text.getPayload().getAsString()).isEqualTo("hello world");
    }

    @Test
    void decryptionFailureKeepsOriginalPayload() {
        EnvelopeDecoder encrypted = new EnvelopeDecoder(TestSupport.options().cipherKey("enigma").build());

        SubscribeResponse response = decode(encrypted, Fixtures.response("100", 1,
                Fixtures.message("chat", "\"s3+CcEE2QZ/Lh9CaPieJnQ==\"", "1"),
                Fixtures.message("chat", "{\"plain\":true}", "2")));

        assertThat(response.getEvents()).hasSize(2);
        MessageEvent first = (MessageEvent) response.getEvents().get(0);
        MessageEvent second = (MessageEvent) response.getEvents().get(1);
        assertThat(first.getPayload().getAsString()).isEqualTo("s3+CcEE2QZ/Lh9CaPieJnQ==");
        assertThat(first.getDecryptionError().getReason()).isEqualTo(ErrorReason.DECRYPTION_FAILURE);
        assertThat(second.getPayload().getAsJsonObject().get("plain").getAsBoolean()).isTrue();
        assertThat(second.getDecryptionError()).isNotNull();
    }

    @Test
    void presenceIsNeverDecrypted() {
        EnvelopeDecoder encrypted = new EnvelopeDecoder(TestSupport.options().cipherKey("enigma").build());

        SubscribeResponse response = decode(encrypted, Fixtures.response("100", 1,
                Fixtures.presence("chat", "{\"action\":\"leave\",\"uuid\":\"bob\",\"occupancy\":1}", "1")));

        PresenceEvent event = (PresenceEvent) response.getEvents().get(0);
        assertThat(event.getLeft()).containsExactly("bob");
    }

    @Test
    void duplicatesDroppedWithinWindow() {
        EnvelopeDecoder deduping = new EnvelopeDecoder(TestSupport.options()
                .dedupeOnSubscribe(true)
                .maximumMessagesCacheSize(2)
                .build());
        String a = Fixtures.message("chat", "\"a\"", "1");
        String b = Fixtures.message("chat", "\"b\"", "2");
        String c = Fixtures.message("chat", "\"c\"", "3");

        assertThat(decode(deduping, Fixtures.response("10", 1, a, a, b)).getEvents()).hasSize(2);
        assertThat(decode(deduping, Fixtures.response("20", 1, b, c)).getEvents()).hasSize(1);
        // "a" fell out of the window
        assertThat(decode(deduping, Fixtures.response("30", 1, a)).getEvents()).hasSize(1);

        deduping.resetDuplicates();
        assertThat(decode(deduping, Fixtures.response("40", 1, c)).getEvents()).hasSize(1);
    }

    @Test
    void duplicatesKeptWhenDisabled() {
        String a = Fixtures.message("chat", "\"a\"", "1");

        assertThat(decode(decoder, Fixtures.response("10", 1, a, a)).getEvents()).hasSize(2);
    }
}
