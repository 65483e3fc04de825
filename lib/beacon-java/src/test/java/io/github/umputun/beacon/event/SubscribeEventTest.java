package io.github.umputun.beacon.event;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;
import io.github.umputun.beacon.errors.DecryptionError;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubscribeEventTest {

    private static final Cursor TT = new Cursor(100, 1);

    @Test
    void presenceActionsRoundTripWireValues() {
        for (PresenceEvent.Action action : PresenceEvent.Action.values()) {
            assertThat(PresenceEvent.Action.fromValue(action.getValue())).isEqualTo(action);
        }
        assertThat(PresenceEvent.Action.fromValue("state-change")).isEqualTo(PresenceEvent.Action.STATE_CHANGE);
        assertThat(PresenceEvent.Action.fromValue("dance")).isNull();
    }

    @Test
    void objectKinds() {
        assertThat(ObjectEvent.Kind.of("uuid", "set")).isEqualTo(ObjectEvent.Kind.UUID_SET);
        assertThat(ObjectEvent.Kind.of("uuid", "delete")).isEqualTo(ObjectEvent.Kind.UUID_REMOVED);
        assertThat(ObjectEvent.Kind.of("channel", "delete")).isEqualTo(ObjectEvent.Kind.CHANNEL_REMOVED);
        assertThat(ObjectEvent.Kind.of("membership", "set")).isEqualTo(ObjectEvent.Kind.MEMBERSHIP_SET);
        assertThat(ObjectEvent.Kind.of("space", "set")).isNull();
        assertThat(ObjectEvent.Kind.of("uuid", "update")).isNull();
    }

    @Test
    void eachEventReachesItsCallback() {
        List<String> calls = new ArrayList<>();
        SubscriptionListener listener = new SubscriptionListener() {
            @Override
            public void onMessage(MessageEvent event) {
                calls.add("message");
            }

            @Override
            public void onSignal(SignalEvent event) {
                calls.add("signal");
            }

            @Override
            public void onPresence(PresenceEvent event) {
                calls.add("presence");
            }

            @Override
            public void onObject(ObjectEvent event) {
                calls.add("object");
            }

            @Override
            public void onMessageAction(MessageActionEvent event) {
                calls.add("action");
            }

            @Override
            public void onFile(FileEvent event) {
                calls.add("file");
            }
        };

        new MessageEvent("c", null, TT, "p", new JsonPrimitive(1), null, null, null).dispatchTo(listener);
        new SignalEvent("c", null, TT, "p", new JsonPrimitive(1), null, null, null).dispatchTo(listener);
        new PresenceEvent("c", null, TT, PresenceEvent.Action.JOIN, "u", 1, 0, List.of("u"), List.of(), List.of(),
                null, false).dispatchTo(listener);
        new ObjectEvent("c", null, TT, ObjectEvent.Kind.CHANNEL_SET, "c", new JsonObject(), "objects", "2.0")
                .dispatchTo(listener);
        new MessageActionEvent("c", null, TT, MessageActionEvent.Kind.REMOVED, "reaction", "smile",
                new Cursor(2, 0), new Cursor(1, 0), "p").dispatchTo(listener);
        new FileEvent("c", null, TT, "p", new JsonObject(), null, null, null, "id", "name", "url", null)
                .dispatchTo(listener);

        assertThat(calls).containsExactly("message", "signal", "presence", "object", "action", "file");
    }

    @Test
    void messageEquality() {
        MessageEvent a = new MessageEvent("c", "c.*", TT, "p", new JsonPrimitive("x"), null, "text", null);
        MessageEvent b = new MessageEvent("c", "c.*", TT, "p", new JsonPrimitive("x"), null, "text", null);
        MessageEvent other = new MessageEvent("c", "c.*", new Cursor(101, 1), "p", new JsonPrimitive("x"),
                null, "text", null);
        SignalEvent signal = new SignalEvent("c", "c.*", TT, "p", new JsonPrimitive("x"), null, "text", null);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(other);
        assertThat(a).isNotEqualTo(signal);
        assertThat(a.toString()).contains("channel='c'");
    }

    @Test
    void decryptionErrorIsExposed() {
        DecryptionError error = new DecryptionError("bad key");
        MessageEvent event = new MessageEvent("c", null, TT, "p", new JsonPrimitive("enc"), null, null, error);

        assertThat(event.getDecryptionError()).isSameAs(error);
        assertThat(event.getPayload().getAsString()).isEqualTo("enc");
    }

    @Test
    void presenceListsAreImmutableCopies() {
        List<String> joined = new ArrayList<>(List.of("a"));
        PresenceEvent event = new PresenceEvent("c", null, TT, PresenceEvent.Action.INTERVAL, null, 1, 0,
                joined, List.of(), List.of(), null, false);

        joined.add("b");

        assertThat(event.getJoined()).containsExactly("a");
    }

    @Test
    void objectChangesetIsCopied() {
        JsonObject data = new JsonObject();
        data.addProperty("name", "Chat");
        ObjectEvent event = new ObjectEvent("c", null, TT, ObjectEvent.Kind.CHANNEL_SET, "c", data, null, null);

        event.getChangeset().addProperty("name", "changed");

        assertThat(event.getChangeset().get("name").getAsString()).isEqualTo("Chat");
    }
}
