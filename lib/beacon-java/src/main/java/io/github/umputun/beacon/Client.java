package io.github.umputun.beacon;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.transport.Transport;

import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client for the real-time subscribe service.
 * <p>
 * Use {@link #builder(String, String)} to create instances.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (Client client = Client.builder("sub-c-key", "user-1")
 *         .cipherKey("secret")
 *         .heartbeatInterval(Duration.ofSeconds(60))
 *         .build()) {
 *     client.addListener(new SubscriptionListener() {
 *         public void onMessage(MessageEvent event) {
 *             System.out.println(event.getPayload());
 *         }
 *     });
 *     client.subscribe(List.of("chat"), List.of(), true);
 * }
 * }</pre>
 * Clients built with the same {@link SessionRegistry} and equivalent options share one session;
 * closing a client removes only its own listeners.
 */
public final class Client implements Closeable {

    private final SubscriptionSession session;
    private final SessionRegistry registry;
    private final List<ListenerRegistration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Client(SubscriptionSession session, SessionRegistry registry) {
        this.session = session;
        this.registry = registry;
    }

    /**
     * Creates a new builder for the Client.
     *
     * @param subscribeKey the subscribe key
     * @param userId       identifier this client announces to the service
     * @return a new builder
     */
    public static Builder builder(String subscribeKey, String userId) {
        return new Builder(subscribeKey, userId);
    }

    /**
     * Subscribes to channels and groups.
     *
     * @param channels channel names
     * @param groups   group names
     * @see SubscriptionSession#subscribe(Collection, Collection)
     */
    public void subscribe(Collection<String> channels, Collection<String> groups) {
        session.subscribe(channels, groups);
    }

    /**
     * Subscribes to channels and groups, optionally with presence.
     *
     * @param channels     channel names
     * @param groups       group names
     * @param withPresence true to also receive presence events
     */
    public void subscribe(Collection<String> channels, Collection<String> groups, boolean withPresence) {
        session.subscribe(channels, groups, withPresence);
    }

    /**
     * Subscribes to channels and groups with presence state.
     *
     * @param channels     channel names
     * @param groups       group names
     * @param withPresence true to also receive presence events
     * @param state        presence state for the channels
     */
    public void subscribe(Collection<String> channels, Collection<String> groups, boolean withPresence,
                          JsonObject state) {
        session.subscribe(channels, groups, withPresence, state);
    }

    public void unsubscribe(Collection<String> channels, Collection<String> groups) {
        session.unsubscribe(channels, groups);
    }

    public void unsubscribePresence(Collection<String> channels, Collection<String> groups) {
        session.unsubscribePresence(channels, groups);
    }

    public void unsubscribeAll() {
        session.unsubscribeAll();
    }

    public void setPresenceState(Collection<String> channels, JsonElement state) {
        session.setPresenceState(channels, state);
    }

    /**
     * Registers a listener. It is removed when this client is closed.
     *
     * @param listener the listener
     * @return handle to remove the listener earlier
     */
    public ListenerRegistration addListener(SubscriptionListener listener) {
        if (closed.get()) {
            throw new BeaconException("client is closed");
        }
        ListenerRegistration registration = session.addListener(listener);
        registrations.add(registration);
        return registration;
    }

    public boolean removeListener(ListenerRegistration registration) {
        registrations.remove(registration);
        return session.removeListener(registration);
    }

    public ConnectionState currentStatus() {
        return session.currentStatus();
    }

    public Cursor currentCursor() {
        return session.currentCursor();
    }

    public List<String> subscribedChannels() {
        return session.subscribedChannels();
    }

    public List<String> subscribedChannelGroups() {
        return session.subscribedChannelGroups();
    }

    public void reconnect() {
        session.reconnect();
    }

    public void disconnect() {
        session.disconnect();
    }

    /**
     * Returns the underlying session, possibly shared with other clients.
     *
     * @return the session
     */
    public SubscriptionSession getSession() {
        return session;
    }

    /**
     * Removes this client's listeners and releases the session. A session from a registry is
     * closed when its last client is closed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        registrations.forEach(ListenerRegistration::cancel);
        registrations.clear();
        if (registry != null) {
            registry.release(session);
        } else {
            session.close();
        }
    }

    /**
     * Builder for creating Client instances.
     */
    public static final class Builder {
        private final ClientOptions.Builder optionsBuilder = ClientOptions.builder();
        private Transport transport;
        private SessionRegistry registry;

        private Builder(String subscribeKey, String userId) {
            optionsBuilder.subscribeKey(subscribeKey).userId(userId);
        }

        public Builder origin(String origin) {
            optionsBuilder.origin(origin);
            return this;
        }

        public Builder authKey(String authKey) {
            optionsBuilder.authKey(authKey);
            return this;
        }

        /**
         * Enables payload decryption.
         *
         * @param cipherKey the shared passphrase
         * @return this builder
         */
        public Builder cipherKey(String cipherKey) {
            optionsBuilder.cipherKey(cipherKey);
            return this;
        }

        public Builder randomIv(boolean randomIv) {
            optionsBuilder.randomIv(randomIv);
            return this;
        }

        public Builder timeout(Duration timeout) {
            optionsBuilder.timeout(timeout);
            return this;
        }

        public Builder subscribeTimeout(Duration subscribeTimeout) {
            optionsBuilder.subscribeTimeout(subscribeTimeout);
            return this;
        }

        public Builder presenceTimeout(Duration presenceTimeout) {
            optionsBuilder.presenceTimeout(presenceTimeout);
            return this;
        }

        /**
         * Enables periodic heartbeats.
         *
         * @param heartbeatInterval the period, zero disables heartbeats
         * @return this builder
         */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            optionsBuilder.heartbeatInterval(heartbeatInterval);
            return this;
        }

        public Builder filterExpression(String filterExpression) {
            optionsBuilder.filterExpression(filterExpression);
            return this;
        }

        public Builder suppressLeaveEvents(boolean suppressLeaveEvents) {
            optionsBuilder.suppressLeaveEvents(suppressLeaveEvents);
            return this;
        }

        public Builder maintainPresenceState(boolean maintainPresenceState) {
            optionsBuilder.maintainPresenceState(maintainPresenceState);
            return this;
        }

        public Builder dedupeOnSubscribe(boolean dedupeOnSubscribe) {
            optionsBuilder.dedupeOnSubscribe(dedupeOnSubscribe);
            return this;
        }

        public Builder maximumMessagesCacheSize(int maximumMessagesCacheSize) {
            optionsBuilder.maximumMessagesCacheSize(maximumMessagesCacheSize);
            return this;
        }

        public Builder requestMessageCountThreshold(int requestMessageCountThreshold) {
            optionsBuilder.requestMessageCountThreshold(requestMessageCountThreshold);
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            optionsBuilder.reconnectPolicy(reconnectPolicy);
            return this;
        }

        /**
         * Uses a custom transport instead of HTTP. Ignored when a registry is set.
         *
         * @param transport the transport, not closed by the client
         * @return this builder
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Shares the session with other clients built on the same registry.
         *
         * @param registry the registry
         * @return this builder
         */
        public Builder registry(SessionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Builds the Client instance.
         *
         * @return the configured client
         * @throws BeaconException if the options are invalid
         */
        public Client build() {
            ClientOptions options = optionsBuilder.build();
            if (registry != null) {
                return new Client(registry.acquire(options), registry);
            }
            SubscriptionSession session = transport != null
                    ? new SubscriptionSession(options, transport)
                    : new SubscriptionSession(options);
            return new Client(session, null);
        }
    }
}
