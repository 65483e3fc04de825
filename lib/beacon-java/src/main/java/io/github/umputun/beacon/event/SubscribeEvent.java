package io.github.umputun.beacon.event;

import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;

import java.util.Objects;

/**
 * Event delivered by a subscription. The set of subclasses is closed: message, signal, file,
 * presence, object and message action events.
 */
public abstract class SubscribeEvent {

    private final String channel;
    private final String subscription;
    private final Cursor timetoken;

    SubscribeEvent(String channel, String subscription, Cursor timetoken) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.subscription = subscription;
        this.timetoken = Objects.requireNonNull(timetoken, "timetoken cannot be null");
    }

    /**
     * Returns the channel the event was published to, without the presence suffix.
     *
     * @return the channel name
     */
    public String getChannel() {
        return channel;
    }

    /**
     * Returns the group or wildcard subscription that matched, if the event was not
     * received through a direct channel subscription.
     *
     * @return the subscription name, or null
     */
    public String getSubscription() {
        return subscription;
    }

    /**
     * Returns the publish cursor of the event.
     *
     * @return the cursor
     */
    public Cursor getTimetoken() {
        return timetoken;
    }

    /**
     * Calls the listener method matching this event's type.
     *
     * @param listener the receiver
     */
    public abstract void dispatchTo(SubscriptionListener listener);

    boolean baseEquals(SubscribeEvent that) {
        return channel.equals(that.channel) &&
                Objects.equals(subscription, that.subscription) &&
                timetoken.equals(that.timetoken);
    }

    int baseHashCode() {
        return Objects.hash(channel, subscription, timetoken);
    }

    String baseFields() {
        return "channel='" + channel + '\'' +
                (subscription != null ? ", subscription='" + subscription + '\'' : "") +
                ", timetoken=" + timetoken;
    }
}
