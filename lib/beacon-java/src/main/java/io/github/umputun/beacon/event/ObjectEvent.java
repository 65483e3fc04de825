package io.github.umputun.beacon.event;

import com.google.gson.JsonObject;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;

import java.util.Objects;

/**
 * App context change: user metadata, channel metadata or a membership was set or removed.
 * The changeset is delivered as sent; nothing is merged into local state.
 */
public final class ObjectEvent extends SubscribeEvent {

    /**
     * What was changed and how.
     */
    public enum Kind {
        UUID_SET,
        UUID_REMOVED,
        CHANNEL_SET,
        CHANNEL_REMOVED,
        MEMBERSHIP_SET,
        MEMBERSHIP_REMOVED;

        /**
         * Resolves the wire pair (type, event).
         *
         * @param type  uuid, channel or membership
         * @param event set or delete
         * @return the kind, or null if either value is unknown
         */
        public static Kind of(String type, String event) {
            boolean set;
            if ("set".equals(event)) {
                set = true;
            } else if ("delete".equals(event)) {
                set = false;
            } else {
                return null;
            }
            if ("uuid".equals(type)) {
                return set ? UUID_SET : UUID_REMOVED;
            }
            if ("channel".equals(type)) {
                return set ? CHANNEL_SET : CHANNEL_REMOVED;
            }
            if ("membership".equals(type)) {
                return set ? MEMBERSHIP_SET : MEMBERSHIP_REMOVED;
            }
            return null;
        }
    }

    private final Kind kind;
    private final String metadataId;
    private final JsonObject changeset;
    private final String source;
    private final String version;

    public ObjectEvent(String channel, String subscription, Cursor timetoken, Kind kind, String metadataId,
                       JsonObject changeset, String source, String version) {
        super(channel, subscription, timetoken);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.metadataId = metadataId;
        this.changeset = changeset;
        this.source = source;
        this.version = version;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the id of the changed entity; for memberships, the id of the user.
     *
     * @return the id, or null
     */
    public String getMetadataId() {
        return metadataId;
    }

    /**
     * Returns the raw changed fields.
     *
     * @return a copy of the data object
     */
    public JsonObject getChangeset() {
        return changeset == null ? null : changeset.deepCopy();
    }

    public String getSource() {
        return source;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onObject(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectEvent that = (ObjectEvent) o;
        return baseEquals(that) &&
                kind == that.kind &&
                Objects.equals(metadataId, that.metadataId) &&
                Objects.equals(changeset, that.changeset) &&
                Objects.equals(source, that.source) &&
                Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), kind, metadataId, changeset, source, version);
    }

    @Override
    public String toString() {
        return "ObjectEvent{" + baseFields() +
                ", kind=" + kind +
                ", metadataId='" + metadataId + '\'' +
                '}';
    }
}
