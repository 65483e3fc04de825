package io.github.umputun.beacon;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.github.umputun.beacon.errors.DecodingError;
import io.github.umputun.beacon.errors.DecryptionError;
import io.github.umputun.beacon.event.FileEvent;
import io.github.umputun.beacon.event.MessageActionEvent;
import io.github.umputun.beacon.event.MessageEvent;
import io.github.umputun.beacon.event.ObjectEvent;
import io.github.umputun.beacon.event.PresenceEvent;
import io.github.umputun.beacon.event.SignalEvent;
import io.github.umputun.beacon.event.SubscribeEvent;
import io.github.umputun.beacon.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Parses a long-poll response body into a cursor and typed events.
 * <p>
 * Body layout: {@code {"t":{"t":"<timetoken>","r":<region>},"m":[envelope...]}}. A body that is not
 * valid UTF-8 JSON or has no cursor fails the whole poll with {@link DecodingError}; a single bad
 * envelope is logged and skipped.
 */
final class EnvelopeDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeDecoder.class);

    static final int TYPE_MESSAGE = 0;
    static final int TYPE_SIGNAL = 1;
    static final int TYPE_OBJECT = 2;
    static final int TYPE_MESSAGE_ACTION = 3;
    static final int TYPE_FILE = 4;
    // not a server type, inferred from the -pnpres channel suffix
    static final int TYPE_PRESENCE = 99;

    private final String origin;
    private final String subscribeKey;
    private final PayloadCipher cipher;
    private final DuplicateFilter duplicates;

    EnvelopeDecoder(ClientOptions options) {
        this(options, options.isCipherEnabled()
                ? new LegacyCipher(options.getCipherKey(), options.isRandomIv())
                : null);
    }

    EnvelopeDecoder(ClientOptions options, PayloadCipher cipher) {
        this.origin = options.getOrigin();
        this.subscribeKey = options.getSubscribeKey();
        this.cipher = cipher;
        this.duplicates = options.isDedupeOnSubscribe()
                ? new DuplicateFilter(options.getMaximumMessagesCacheSize())
                : null;
    }

    /**
     * Decodes a response body.
     *
     * @param body raw response bytes
     * @return cursor and events
     * @throws DecodingError if the body is not a valid subscribe response
     */
    SubscribeResponse decode(byte[] body) {
        JsonObject root = parseBody(body);

        Cursor cursor;
        try {
            cursor = parseCursor(root.get("t"));
        } catch (RuntimeException e) {
            throw new DecodingError("invalid response cursor: " + e.getMessage(), e);
        }

        JsonElement messages = root.get("m");
        if (messages == null || messages.isJsonNull()) {
            return new SubscribeResponse(cursor, Collections.emptyList(), 0);
        }
        if (!messages.isJsonArray()) {
            throw new DecodingError("invalid response: \"m\" is not an array");
        }

        JsonArray envelopes = messages.getAsJsonArray();
        List<SubscribeEvent> events = new ArrayList<>(envelopes.size());
        for (int i = 0; i < envelopes.size(); i++) {
            try {
                SubscribeEvent event = decodeEnvelope(envelopes.get(i));
                if (event != null) {
                    events.add(event);
                }
            } catch (RuntimeException e) {
                LOGGER.warn("skipping envelope {} of {}: {}", i, envelopes.size(), e.toString());
            }
        }
        return new SubscribeResponse(cursor, events, envelopes.size());
    }

    /** forgets remembered envelopes so a restarted subscription sees them again */
    void resetDuplicates() {
        if (duplicates != null) {
            duplicates.clear();
        }
    }

    private static JsonObject parseBody(byte[] body) {
        if (body == null || body.length == 0) {
            throw new DecodingError("empty response body");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodingError("response body is not valid UTF-8", e);
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new DecodingError("response body is not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new DecodingError("response body is not a JSON object");
        }
        return root.getAsJsonObject();
    }

    static Cursor parseCursor(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new IllegalArgumentException("cursor is missing");
        }
        JsonObject obj = element.getAsJsonObject();
        JsonElement tt = obj.get("t");
        if (tt == null || !tt.isJsonPrimitive()) {
            throw new IllegalArgumentException("cursor timetoken is missing");
        }
        JsonElement region = obj.get("r");
        int r = region == null || region.isJsonNull() ? 0 : region.getAsInt();
        return Cursor.parse(tt.getAsString(), r);
    }

    private SubscribeEvent decodeEnvelope(JsonElement element) {
        JsonObject envelope = element.getAsJsonObject();
        String fullChannel = requireString(envelope, "c");
        JsonElement payload = envelope.get("d");
        if (payload == null) {
            throw new IllegalArgumentException("envelope has no payload");
        }
        Cursor publishCursor = parseCursor(envelope.get("p"));

        if (duplicates != null && duplicates.seen(publishCursor.timetokenString() + ":" + fullChannel + ":" + payload)) {
            LOGGER.debug("dropping duplicate envelope on {} at {}", fullChannel, publishCursor);
            return null;
        }

        int type = resolveType(envelope, fullChannel);
        String channel = SubscriptionSet.trimPresence(fullChannel);
        String subscription = optString(envelope, "b");
        if (subscription != null) {
            subscription = SubscriptionSet.trimPresence(subscription);
        }
        String publisher = optString(envelope, "i");

        switch (type) {
            case TYPE_MESSAGE:
            case TYPE_SIGNAL:
            case TYPE_FILE:
                return decodePublished(type, envelope, channel, subscription, publishCursor, publisher, payload);
            case TYPE_PRESENCE:
                return decodePresence(channel, subscription, publishCursor, payload.getAsJsonObject());
            case TYPE_OBJECT:
                return decodeObject(channel, subscription, publishCursor, payload.getAsJsonObject());
            case TYPE_MESSAGE_ACTION:
                return decodeMessageAction(channel, subscription, publishCursor, publisher,
                        payload.getAsJsonObject());
            default:
                throw new IllegalArgumentException("unknown envelope type " + type);
        }
    }

    private static int resolveType(JsonObject envelope, String fullChannel) {
        JsonElement e = envelope.get("e");
        if (e == null || e.isJsonNull()) {
            return SubscriptionSet.isPresenceName(fullChannel) ? TYPE_PRESENCE : TYPE_MESSAGE;
        }
        return e.getAsInt();
    }

    private SubscribeEvent decodePublished(int type, JsonObject envelope, String channel, String subscription,
                                           Cursor timetoken, String publisher, JsonElement payload) {
        JsonElement userMetadata = envelope.get("u");
        String customMessageType = optString(envelope, "cmt");

        DecryptionError decryptionError = null;
        JsonElement content = payload;
        if (cipher != null) {
            try {
                content = decrypt(payload);
            } catch (DecryptionError e) {
                LOGGER.warn("failed to decrypt payload on {} at {}: {}", channel, timetoken, e.getMessage());
                decryptionError = e;
            }
        }

        if (type == TYPE_MESSAGE) {
            return new MessageEvent(channel, subscription, timetoken, publisher, content, userMetadata,
                    customMessageType, decryptionError);
        }
        if (type == TYPE_SIGNAL) {
            return new SignalEvent(channel, subscription, timetoken, publisher, content, userMetadata,
                    customMessageType, decryptionError);
        }

        String fileId = null;
        String fileName = null;
        String fileUrl = null;
        JsonElement message = null;
        if (decryptionError == null) {
            JsonObject filePayload = content.getAsJsonObject();
            message = filePayload.get("message");
            JsonObject file = filePayload.getAsJsonObject("file");
            if (file != null) {
                fileId = optString(file, "id");
                fileName = optString(file, "name");
            }
            if (fileId != null && fileName != null) {
                fileUrl = origin + "/v1/files/" + TransportRequest.encode(subscribeKey)
                        + "/channels/" + TransportRequest.encode(channel)
                        + "/files/" + TransportRequest.encode(fileId) + "/" + TransportRequest.encode(fileName);
            }
        }
        return new FileEvent(channel, subscription, timetoken, publisher, content, userMetadata,
                customMessageType, decryptionError, fileId, fileName, fileUrl, message);
    }

    private JsonElement decrypt(JsonElement payload) {
        if (!payload.isJsonPrimitive() || !payload.getAsJsonPrimitive().isString()) {
            throw new DecryptionError("payload is not an encrypted string");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(payload.getAsString());
        } catch (IllegalArgumentException e) {
            throw new DecryptionError("payload is not valid base64", e);
        }

        byte[] plain = cipher.decrypt(data);
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plain))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecryptionError("decrypted payload is not valid UTF-8", e);
        }

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            LOGGER.debug("decrypted payload is plain text: {}", e.getMessage());
            return new JsonPrimitive(text);
        }
        // an empty document parses as JSON null
        if (parsed.isJsonNull() && !"null".equals(text.trim())) {
            return new JsonPrimitive(text);
        }
        return parsed;
    }

    private static PresenceEvent decodePresence(String channel, String subscription, Cursor timetoken,
                                                JsonObject payload) {
        String actionValue = requireString(payload, "action");
        PresenceEvent.Action action = PresenceEvent.Action.fromValue(actionValue);
        if (action == null) {
            throw new IllegalArgumentException("unknown presence action " + actionValue);
        }
        String uuid = optString(payload, "uuid");
        int occupancy = payload.has("occupancy") ? payload.get("occupancy").getAsInt() : 0;
        long timestamp = payload.has("timestamp") ? payload.get("timestamp").getAsLong() : 0L;
        JsonElement state = payload.get("data");
        boolean refresh = payload.has("here_now_refresh") && payload.get("here_now_refresh").getAsBoolean();

        List<String> joined = stringList(payload, "join");
        List<String> left = stringList(payload, "leave");
        List<String> timedOut = stringList(payload, "timeout");
        if (uuid != null) {
            if (action == PresenceEvent.Action.JOIN && joined.isEmpty()) {
                joined = List.of(uuid);
            } else if (action == PresenceEvent.Action.LEAVE && left.isEmpty()) {
                left = List.of(uuid);
            } else if (action == PresenceEvent.Action.TIMEOUT && timedOut.isEmpty()) {
                timedOut = List.of(uuid);
            }
        }
        return new PresenceEvent(channel, subscription, timetoken, action, uuid, occupancy, timestamp,
                joined, left, timedOut, state, refresh);
    }

    private static ObjectEvent decodeObject(String channel, String subscription, Cursor timetoken,
                                            JsonObject payload) {
        String type = requireString(payload, "type");
        String event = requireString(payload, "event");
        ObjectEvent.Kind kind = ObjectEvent.Kind.of(type, event);
        if (kind == null) {
            throw new IllegalArgumentException("unknown object event " + type + "/" + event);
        }
        JsonObject data = payload.getAsJsonObject("data");
        String metadataId = null;
        if (data != null) {
            if (kind == ObjectEvent.Kind.MEMBERSHIP_SET || kind == ObjectEvent.Kind.MEMBERSHIP_REMOVED) {
                JsonElement uuid = data.get("uuid");
                if (uuid != null && uuid.isJsonObject()) {
                    metadataId = optString(uuid.getAsJsonObject(), "id");
                }
            } else {
                metadataId = optString(data, "id");
            }
        }
        return new ObjectEvent(channel, subscription, timetoken, kind, metadataId, data,
                optString(payload, "source"), optString(payload, "version"));
    }

    private static MessageActionEvent decodeMessageAction(String channel, String subscription, Cursor timetoken,
                                                          String publisher, JsonObject payload) {
        String event = requireString(payload, "event");
        MessageActionEvent.Kind kind;
        if ("added".equals(event)) {
            kind = MessageActionEvent.Kind.ADDED;
        } else if ("removed".equals(event)) {
            kind = MessageActionEvent.Kind.REMOVED;
        } else {
            throw new IllegalArgumentException("unknown message action event " + event);
        }
        JsonObject data = payload.getAsJsonObject("data");
        if (data == null) {
            throw new IllegalArgumentException("message action has no data");
        }
        Cursor actionTimetoken = Cursor.parse(requireString(data, "actionTimetoken"), 0);
        Cursor messageTimetoken = Cursor.parse(requireString(data, "messageTimetoken"), 0);
        return new MessageActionEvent(channel, subscription, timetoken, kind, requireString(data, "type"),
                requireString(data, "value"), actionTimetoken, messageTimetoken, publisher);
    }

    private static String requireString(JsonObject obj, String key) {
        String value = optString(obj, key);
        if (value == null) {
            throw new IllegalArgumentException("missing \"" + key + "\"");
        }
        return value;
    }

    private static String optString(JsonObject obj, String key) {
        JsonElement value = obj.get(key);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        return value.getAsString();
    }

    private static List<String> stringList(JsonObject obj, String key) {
        JsonElement value = obj.get(key);
        if (value == null || !value.isJsonArray()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (JsonElement item : value.getAsJsonArray()) {
            result.add(item.getAsString());
        }
        return result;
    }
}
