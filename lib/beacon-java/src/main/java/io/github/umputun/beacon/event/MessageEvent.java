package io.github.umputun.beacon.event;

import com.google.gson.JsonElement;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;
import io.github.umputun.beacon.errors.DecryptionError;

/**
 * A message published to a subscribed channel.
 */
public final class MessageEvent extends PublishedEvent {

    public MessageEvent(String channel, String subscription, Cursor timetoken, String publisher, JsonElement payload,
                  JsonElement userMetadata, String customMessageType, DecryptionError decryptionError) {
        super(channel, subscription, timetoken, publisher, payload, userMetadata, customMessageType, decryptionError);
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onMessage(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return baseEquals((MessageEvent) o);
    }

    @Override
    public int hashCode() {
        return baseHashCode();
    }

    @Override
    public String toString() {
        return "MessageEvent{" + baseFields() + '}';
    }
}
