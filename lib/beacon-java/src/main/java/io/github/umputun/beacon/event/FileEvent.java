package io.github.umputun.beacon.event;

import com.google.gson.JsonElement;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.SubscriptionListener;
import io.github.umputun.beacon.errors.DecryptionError;

import java.util.Objects;

/**
 * Notification that a file was shared on a subscribed channel.
 * {@link #getPayload()} holds the whole notification; the accessors below expose its parts.
 */
public final class FileEvent extends PublishedEvent {

    private final String fileId;
    private final String fileName;
    private final String fileUrl;
    private final JsonElement message;

    public FileEvent(String channel, String subscription, Cursor timetoken, String publisher, JsonElement payload,
                     JsonElement userMetadata, String customMessageType, DecryptionError decryptionError,
                     String fileId, String fileName, String fileUrl, JsonElement message) {
        super(channel, subscription, timetoken, publisher, payload, userMetadata, customMessageType, decryptionError);
        this.fileId = fileId;
        this.fileName = fileName;
        this.fileUrl = fileUrl;
        this.message = message;
    }

    /**
     * Returns the file identifier, null if the payload could not be read.
     *
     * @return the file id
     */
    public String getFileId() {
        return fileId;
    }

    /**
     * Returns the file name, null if the payload could not be read.
     *
     * @return the file name
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * Returns the download location of the file.
     *
     * @return the URL, or null without id and name
     */
    public String getFileUrl() {
        return fileUrl;
    }

    /**
     * Returns the text or object sent along with the file.
     *
     * @return the message, or null
     */
    public JsonElement getMessage() {
        return message;
    }

    @Override
    public void dispatchTo(SubscriptionListener listener) {
        listener.onFile(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileEvent that = (FileEvent) o;
        return baseEquals(that) &&
                Objects.equals(fileId, that.fileId) &&
                Objects.equals(fileName, that.fileName) &&
                Objects.equals(fileUrl, that.fileUrl) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHashCode(), fileId, fileName, fileUrl, message);
    }

    @Override
    public String toString() {
        return "FileEvent{" + baseFields() +
                ", fileId='" + fileId + '\'' +
                ", fileName='" + fileName + '\'' +
                '}';
    }
}
