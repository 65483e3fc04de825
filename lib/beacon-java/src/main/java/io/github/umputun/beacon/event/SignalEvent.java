package io.github.umputun.beacon.event;

import com.google.gson.JsonElement;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;
import io.github.umputun.beacon.errors.DecryptionError;

/**
 * A signal published to a subscribed channel. Signals are small and never stored by the service.
 */
public final class SignalEvent extends PublishedEvent {

    public SignalEvent(String channel, String subscription, Cursor timetoken, String publisher, JsonElement payload,
                  JsonElement userMetadata, String customMessageType, DecryptionError decryptionError) {
        super(channel, subscription, timetoken, publisher, payload, userMetadata, customMessageType, decryptionError);
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onSignal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return baseEquals((SignalEvent) o);
    }

    @Override
    public int hashCode() {
        return baseHashCode();
    }

    @Override
    public String toString() {
        return "SignalEvent{" + baseFields() + '}';
    }
}
