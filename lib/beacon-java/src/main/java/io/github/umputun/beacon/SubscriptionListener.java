package io.github.umputun.beacon;

import io.github.umputun.beacon.event.FileEvent;
import io.github.umputun.beacon.event.MessageActionEvent;
import io.github.umputun.beacon.event.MessageEvent;
import io.github.umputun.beacon.event.ObjectEvent;
import io.github.umputun.beacon.event.PresenceEvent;
import io.github.umputun.beacon.event.SignalEvent;

/**
 * Receives events and status changes of a session. Override only the methods you need.
 * <p>
 * Events and poll outcomes (CONNECTED, retries, errors) are delivered on the subscribe thread, one at a
 * time and in arrival order; the next poll starts only after every listener returned. Statuses caused
 * by a control call, such as SUBSCRIPTION_CHANGED, CONNECTING or DISCONNECTED, are delivered on the
 * thread making that call before it returns.
 */
public interface SubscriptionListener {

    default void onMessage(MessageEvent event) {
    }

    default void onSignal(SignalEvent event) {
    }

    default void onPresence(PresenceEvent event) {
    }

    default void onObject(ObjectEvent event) {
    }

    default void onMessageAction(MessageActionEvent event) {
    }

    default void onFile(FileEvent event) {
    }

    default void onStatus(SubscribeStatus status) {
    }
}
