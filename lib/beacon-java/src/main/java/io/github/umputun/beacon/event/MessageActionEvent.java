package io.github.umputun.beacon.event;

import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;

import java.util.Objects;

/**
 * A reaction or receipt added to, or removed from, an earlier message.
 */
public final class MessageActionEvent extends SubscribeEvent {

    /**
     * Whether the action was added or removed.
     */
    public enum Kind {
        ADDED,
        REMOVED
    }

    private final Kind kind;
    private final String type;
    private final String value;
    private final Cursor actionTimetoken;
    private final Cursor messageTimetoken;
    private final String publisher;

    public MessageActionEvent(String channel, String subscription, Cursor timetoken, Kind kind, String type,
                              String value, Cursor actionTimetoken, Cursor messageTimetoken, String publisher) {
        super(channel, subscription, timetoken);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.type = type;
        this.value = value;
        this.actionTimetoken = actionTimetoken;
        this.messageTimetoken = messageTimetoken;
        this.publisher = publisher;
    }

    public Kind getKind() {
        return kind;
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /**
     * Returns when the action was recorded.
     *
     * @return the action timetoken
     */
    public Cursor getActionTimetoken() {
        return actionTimetoken;
    }

    /**
     * Returns the timetoken of the message the action belongs to.
     *
     * @return the message timetoken
     */
    public Cursor getMessageTimetoken() {
        return messageTimetoken;
    }

    public String getPublisher() {
        return publisher;
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onMessageAction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageActionEvent that = (MessageActionEvent) o;
        return baseEquals(that) &&
                kind == that.kind &&
                Objects.equals(type, that.type) &&
                Objects.equals(value, that.value) &&
                Objects.equals(actionTimetoken, that.actionTimetoken) &&
                Objects.equals(messageTimetoken, that.messageTimetoken) &&
                Objects.equals(publisher, that.publisher);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), kind, type, value, actionTimetoken, messageTimetoken, publisher);
    }

    @Override
    public String toString() {
        return "MessageActionEvent{" + baseFields() +
                ", kind=" + kind +
                ", type='" + type + '\'' +
                ", value='" + value + '\'' +
                ", messageTimetoken=" + messageTimetoken +
                '}';
    }
}
