package io.github.umputun.beacon.event;

import com.google.gson.JsonElement;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;

import java.util.List;
import java.util.Objects;

/**
 * Change of occupancy or state on a channel subscribed with presence.
 */
public final class PresenceEvent extends SubscribeEvent {

    /**
     * Kind of presence change.
     */
    public enum Action {
        JOIN("join"),
        LEAVE("leave"),
        TIMEOUT("timeout"),
        STATE_CHANGE("state-change"),
        INTERVAL("interval");

        private final String value;

        Action(String value) {
            this.value = value;
        }

        /**
         * Returns the wire value.
         *
         * @return the action string as sent by the service
         */
        public String getValue() {
            return value;
        }

        /**
         * Parses a wire value.
         *
         * @param value the action string
         * @return the action, or null if unknown
         */
        public static Action fromValue(String value) {
            for (Action action : values()) {
                if (action.value.equals(value)) {
                    return action;
                }
            }
            return null;
        }
    }

    private final Action action;
    private final String uuid;
    private final int occupancy;
    private final long timestamp;
    private final List<String> joined;
    private final List<String> left;
    private final List<String> timedOut;
    private final JsonElement state;
    private final boolean refreshHereNow;

    public PresenceEvent(String channel, String subscription, Cursor timetoken, Action action, String uuid,
                         int occupancy, long timestamp, List<String> joined, List<String> left,
                         List<String> timedOut, JsonElement state, boolean refreshHereNow) {
        super(channel, subscription, timetoken);
        this.action = Objects.requireNonNull(action, "action cannot be null");
        this.uuid = uuid;
        this.occupancy = occupancy;
        this.timestamp = timestamp;
        this.joined = List.copyOf(joined);
        this.left = List.copyOf(left);
        this.timedOut = List.copyOf(timedOut);
        this.state = state;
        this.refreshHereNow = refreshHereNow;
    }

    public Action getAction() {
        return action;
    }

    /**
     * Returns the user the change is about. Null for INTERVAL events.
     *
     * @return the user id, or null
     */
    public String getUuid() {
        return uuid;
    }

    /**
     * Returns the number of users on the channel after the change.
     *
     * @return the occupancy
     */
    public int getOccupancy() {
        return occupancy;
    }

    /**
     * Returns the server time of the change in seconds.
     *
     * @return unix timestamp
     */
    public long getTimestamp() {
        return timestamp;
    }

    public List<String> getJoined() {
        return joined;
    }

    public List<String> getLeft() {
        return left;
    }

    public List<String> getTimedOut() {
        return timedOut;
    }

    /**
     * Returns the presence state attached to the change.
     *
     * @return the state, or null
     */
    public JsonElement getState() {
        return state;
    }

    /**
     * Checks if the interval was too large to list and a here-now call is needed.
     *
     * @return true if the lists are incomplete
     */
    public boolean isRefreshHereNow() {
        return refreshHereNow;
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onPresence(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PresenceEvent that = (PresenceEvent) o;
        return baseEquals(that) &&
                action == that.action &&
                occupancy == that.occupancy &&
                timestamp == that.timestamp &&
                refreshHereNow == that.refreshHereNow &&
                Objects.equals(uuid, that.uuid) &&
                joined.equals(that.joined) &&
                left.equals(that.left) &&
                timedOut.equals(that.timedOut) &&
                Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), action, uuid, occupancy, timestamp, joined, left, timedOut, state,
                refreshHereNow);
    }

    @Override
    public String toString() {
        return "PresenceEvent{" + baseFields() +
                ", action=" + action +
                (uuid != null ? ", uuid='" + uuid + '\'' : "") +
                ", occupancy=" + occupancy +
                ", joined=" + joined +
                ", left=" + left +
                ", timedOut=" + timedOut +
                '}';
    }
}
