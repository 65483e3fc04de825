package io.github.umputun.beacon.event;

import com.google.gson.JsonElement;
import io.github.umputun.beacon.Cursor;
import io.github.umputun.beacon.errors.DecryptionError;

import java.util.Objects;

/**
 * Event carrying a payload sent by a publisher: messages, signals and file notifications.
 */
public abstract class PublishedEvent extends SubscribeEvent {

    private final String publisher;
    private final JsonElement payload;
    private final JsonElement userMetadata;
    private final String customMessageType;
    private final DecryptionError decryptionError;

    PublishedEvent(String channel, String subscription, Cursor timetoken, String publisher, JsonElement payload,
                   JsonElement userMetadata, String customMessageType, DecryptionError decryptionError) {
        super(channel, subscription, timetoken);
        this.publisher = publisher;
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
        this.userMetadata = userMetadata;
        this.customMessageType = customMessageType;
        this.decryptionError = decryptionError;
    }

    /**
     * Returns the user id of the publisher.
     *
     * @return the publisher, or null if the server did not report one
     */
    public String getPublisher() {
        return publisher;
    }

    /**
     * Returns the payload. When decryption failed this is the payload as the server sent it.
     *
     * @return the payload
     */
    public JsonElement getPayload() {
        return payload;
    }

    /**
     * Returns metadata attached by the publisher.
     *
     * @return the metadata, or null
     */
    public JsonElement getUserMetadata() {
        return userMetadata;
    }

    /**
     * Returns the publisher-defined message type.
     *
     * @return the type, or null
     */
    public String getCustomMessageType() {
        return customMessageType;
    }

    /**
     * Returns the error raised while decrypting the payload.
     *
     * @return the error, or null if the payload was plain or decrypted successfully
     */
    public DecryptionError getDecryptionError() {
        return decryptionError;
    }

    @Override
    boolean baseEquals(SubscribeEvent other) {
        if (!super.baseEquals(other)) {
            return false;
        }
        PublishedEvent that = (PublishedEvent) other;
        return Objects.equals(publisher, that.publisher) &&
                payload.equals(that.payload) &&
                Objects.equals(userMetadata, that.userMetadata) &&
                Objects.equals(customMessageType, that.customMessageType) &&
                Objects.equals(decryptionError, that.decryptionError);
    }

    @Override
    int baseHashCode() {
        return Objects.hash(super.baseHashCode(), publisher, payload, userMetadata, customMessageType,
                decryptionError);
    }

    @Override
    String baseFields() {
        return super.baseFields() +
                ", publisher='" + publisher + '\'' +
                ", payload=" + payload +
                (userMetadata != null ? ", userMetadata=" + userMetadata : "") +
                (customMessageType != null ? ", customMessageType='" + customMessageType + '\'' : "") +
                (decryptionError != null ? ", decryptionError='" + decryptionError.getMessage() + '\'' : "");
    }
}
