package io.github.umputun.beacon;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.transport.HttpTransport;
import io.github.umputun.beacon.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Continuous subscription to channels and channel groups for one configuration.
 * <p>
 * Example usage:
 * <pre>{@code
 * ClientOptions options = ClientOptions.builder()
 *         .subscribeKey("sub-c-...")
 *         .userId("user-1")
 *         .build();
 * try (SubscriptionSession session = new SubscriptionSession(options)) {
 *     session.addListener(new SubscriptionListener() {
 *         public void onMessage(MessageEvent event) {
 *             System.out.println(event.getChannel() + ": " + event.getPayload());
 *         }
 *     });
 *     session.subscribe(List.of("chat"), List.of());
 * }
 * }</pre>
 * All methods are thread-safe. Listener callbacks run on the session's subscribe thread.
 */
public final class SubscriptionSession implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionSession.class);

    private final ClientOptions options;
    private final Transport transport;
    private final boolean ownsTransport;
    private final SubscriptionSet set = new SubscriptionSet();
    private final ListenerHub hub = new ListenerHub();
    private final Endpoints endpoints;
    private final LongPollLoop loop;
    private final HeartbeatScheduler heartbeat;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a session talking HTTP to the configured origin.
     *
     * @param options the configuration
     */
    public SubscriptionSession(ClientOptions options) {
        this(options, new HttpTransport(options.getOrigin(), options.getTimeout()), true);
    }

    /**
     * Creates a session on a caller-provided transport. The transport is not closed with the session.
     *
     * @param options   the configuration
     * @param transport the transport
     */
    public SubscriptionSession(ClientOptions options, Transport transport) {
        this(options, transport, false);
    }

    SubscriptionSession(ClientOptions options, Transport transport, boolean ownsTransport) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.ownsTransport = ownsTransport;
        this.endpoints = new Endpoints(options);
        this.loop = new LongPollLoop(set, endpoints, transport, new EnvelopeDecoder(options), hub,
                options.getReconnectPolicy(), options.getRequestMessageCountThreshold());
        this.heartbeat = new HeartbeatScheduler(set, endpoints, transport, options.getHeartbeatInterval());
    }

    /**
     * Subscribes to channels and groups without presence.
     *
     * @param channels channel names, may be empty if groups are given
     * @param groups   group names, may be empty if channels are given
     * @throws BeaconException if both are empty or the session is closed
     */
    public void subscribe(Collection<String> channels, Collection<String> groups) {
        subscribe(channels, groups, false, null);
    }

    /**
     * Subscribes to channels and groups.
     *
     * @param channels     channel names, may be empty if groups are given
     * @param groups       group names, may be empty if channels are given
     * @param withPresence true to also receive presence events
     * @throws BeaconException if both are empty or the session is closed
     */
    public void subscribe(Collection<String> channels, Collection<String> groups, boolean withPresence) {
        subscribe(channels, groups, withPresence, null);
    }

    /**
     * Subscribes to channels and groups and sets presence state on the channels.
     * <p>
     * New names are reported with a SUBSCRIPTION_CHANGED status. An idle or unexpectedly
     * disconnected session starts polling; an active one reissues its poll with the same cursor.
     *
     * @param channels     channel names, may be empty if groups are given
     * @param groups       group names, may be empty if channels are given
     * @param withPresence true to also receive presence events
     * @param state        presence state for the channels, or null
     * @throws BeaconException if both are empty or the session is closed
     */
    public void subscribe(Collection<String> channels, Collection<String> groups, boolean withPresence,
                          JsonObject state) {
        requireOpen();
        validateNames(channels, groups);

        long before = set.version();
        SubscriptionChange change = set.add(channels, groups, withPresence);
        if (state != null) {
            set.putState(channels, state);
        }
        boolean changed = set.version() != before;
        if (!change.isEmpty()) {
            LOGGER.info("subscribed to channels {} groups {}", change.getChannels(), change.getGroups());
            loop.emit(SubscribeStatus.subscriptionChanged(change));
        }

        if (!loop.currentState().isActive()) {
            loop.start();
        } else if (changed) {
            loop.refresh();
        }
        if (!set.isEmpty()) {
            heartbeat.start();
        }
    }

    /**
     * Unsubscribes from channels and groups. Sends a leave notification unless suppressed,
     * and stops polling when nothing remains subscribed.
     *
     * @param channels channel names
     * @param groups   group names
     * @throws BeaconException if both are empty or the session is closed
     */
    public void unsubscribe(Collection<String> channels, Collection<String> groups) {
        requireOpen();
        validateNames(channels, groups);

        SubscriptionChange change = set.remove(channels, groups);
        if (change.isEmpty()) {
            return;
        }
        LOGGER.info("unsubscribed from channels {} groups {}", change.getChannels(), change.getGroups());
        loop.emit(SubscribeStatus.subscriptionChanged(change));
        sendLeave(change);

        if (set.isEmpty()) {
            heartbeat.stop();
            loop.stop(true);
        } else {
            loop.refresh();
        }
    }

    /**
     * Stops presence events for channels and groups while keeping their subscriptions.
     *
     * @param channels channel names
     * @param groups   group names
     */
    public void unsubscribePresence(Collection<String> channels, Collection<String> groups) {
        requireOpen();
        validateNames(channels, groups);

        SubscriptionChange change = set.removePresence(channels, groups);
        if (change.isEmpty()) {
            return;
        }
        loop.emit(SubscribeStatus.subscriptionChanged(change));
        loop.refresh();
    }

    /**
     * Unsubscribes from everything, resets the cursor and moves to IDLE.
     */
    public void unsubscribeAll() {
        requireOpen();
        SubscriptionChange change = set.removeAll();
        if (!change.isEmpty()) {
            LOGGER.info("unsubscribed from all: channels {} groups {}", change.getChannels(), change.getGroups());
            loop.emit(SubscribeStatus.subscriptionChanged(change));
            sendLeave(change);
        }
        heartbeat.stop();
        loop.stop(true);
    }

    /**
     * Sets presence state for subscribed channels. The state is sent with the next subscribe
     * request and with heartbeats.
     *
     * @param channels subscribed channel names
     * @param state    the state, JSON null to clear it
     */
    public void setPresenceState(Collection<String> channels, JsonElement state) {
        requireOpen();
        Objects.requireNonNull(channels, "channels cannot be null");
        List<String> updated = set.putState(channels, state);
        if (!updated.isEmpty() && options.isMaintainPresenceState()) {
            loop.refresh();
        }
    }

    /**
     * Registers a listener for events and status changes.
     *
     * @param listener the listener
     * @return handle to remove the listener
     */
    public ListenerRegistration addListener(SubscriptionListener listener) {
        return hub.add(listener);
    }

    /**
     * Removes a listener.
     *
     * @param registration handle returned by {@link #addListener(SubscriptionListener)}
     * @return true if the listener was registered
     */
    public boolean removeListener(ListenerRegistration registration) {
        return hub.remove(registration);
    }

    /**
     * Returns the connection state.
     *
     * @return the state
     */
    public ConnectionState currentStatus() {
        return loop.currentState();
    }

    /**
     * Returns the cursor the next poll will start from.
     *
     * @return the cursor
     */
    public Cursor currentCursor() {
        return loop.currentCursor();
    }

    public List<String> subscribedChannels() {
        return set.channels();
    }

    public List<String> subscribedChannelGroups() {
        return set.groups();
    }

    /**
     * Resumes polling from the retained cursor after an unexpected disconnect.
     */
    public void reconnect() {
        requireOpen();
        loop.reconnect();
        if (!set.isEmpty()) {
            heartbeat.start();
        }
    }

    /**
     * Stops polling while keeping the subscriptions and the cursor. {@link #reconnect()} or another
     * subscribe call resumes from where it stopped.
     */
    public void disconnect() {
        requireOpen();
        heartbeat.stop();
        loop.stop(false);
    }

    public ClientOptions getOptions() {
        return options;
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops polling and heartbeats and releases the transport if the session created it.
     * Safe to call multiple times.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        heartbeat.shutdown();
        loop.close();
        hub.removeAll();
        if (ownsTransport) {
            transport.close();
        }
        LOGGER.debug("session closed");
    }

    private void sendLeave(SubscriptionChange change) {
        if (options.isSuppressLeaveEvents()) {
            return;
        }
        List<String> channels = change.getChannels();
        List<String> groups = change.getGroups();
        try {
            transport.execute(endpoints.leave(channels, groups))
                    .whenComplete((body, error) -> {
                        if (error != null) {
                            LOGGER.warn("leave for {} {} failed: {}", channels, groups, error.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            LOGGER.warn("leave for {} {} failed: {}", channels, groups, e.getMessage());
        }
    }

    private void requireOpen() {
        if (closed.get()) {
            throw new BeaconException("session is closed");
        }
    }

    private static void validateNames(Collection<String> channels, Collection<String> groups) {
        Objects.requireNonNull(channels, "channels cannot be null");
        Objects.requireNonNull(groups, "groups cannot be null");
        if (channels.isEmpty() && groups.isEmpty()) {
            throw new BeaconException("channels and groups cannot both be empty");
        }
        for (String name : channels) {
            if (name == null || name.isEmpty()) {
                throw new BeaconException("channel name cannot be empty");
            }
        }
        for (String name : groups) {
            if (name == null || name.isEmpty()) {
                throw new BeaconException("group name cannot be empty");
            }
        }
    }
}
