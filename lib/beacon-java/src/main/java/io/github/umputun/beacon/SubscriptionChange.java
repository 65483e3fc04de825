package io.github.umputun.beacon;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Channels and groups that were added to or removed from the subscription set by one call.
 */
public final class SubscriptionChange {

    /**
     * Direction of the change.
     */
    public enum Kind {
        SUBSCRIBED,
        UNSUBSCRIBED
    }

    private final Kind kind;
    private final List<String> channels;
    private final List<String> groups;

    /**
     * Creates a new change.
     *
     * @param kind     the direction
     * @param channels affected channel names
     * @param groups   affected group names
     */
    public SubscriptionChange(Kind kind, List<String> channels, List<String> groups) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.channels = List.copyOf(channels);
        this.groups = List.copyOf(groups);
    }

    static SubscriptionChange subscribed(List<String> channels, List<String> groups) {
        return new SubscriptionChange(Kind.SUBSCRIBED, channels, groups);
    }

    static SubscriptionChange unsubscribed(List<String> channels, List<String> groups) {
        return new SubscriptionChange(Kind.UNSUBSCRIBED, channels, groups);
    }

    static SubscriptionChange none(Kind kind) {
        return new SubscriptionChange(kind, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Returns the direction of the change.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the channels added or removed.
     *
     * @return channel names, in request order
     */
    public List<String> getChannels() {
        return channels;
    }

    /**
     * Returns the groups added or removed.
     *
     * @return group names, in request order
     */
    public List<String> getGroups() {
        return groups;
    }

    /**
     * Checks if nothing actually changed.
     *
     * @return true if no channel or group was affected
     */
    public boolean isEmpty() {
        return channels.isEmpty() && groups.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionChange that = (SubscriptionChange) o;
        return kind == that.kind &&
                Objects.equals(channels, that.channels) &&
                Objects.equals(groups, that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, channels, groups);
    }

    @Override
    public String toString() {
        return "SubscriptionChange{" +
                "kind=" + kind +
                ", channels=" + channels +
                ", groups=" + groups +
                '}';
    }
}
