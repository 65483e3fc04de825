package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.transport.HttpTransport;
import io.github.umputun.beacon.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Shares one {@link SubscriptionSession} between all holders of equivalent {@link ClientOptions}.
 * Sessions are reference counted: created on the first {@link #acquire(ClientOptions)} and
 * closed by the last {@link #release(SubscriptionSession)}.
 */
public final class SessionRegistry implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final Function<ClientOptions, Transport> transportFactory;
    private final Map<String, Entry> entries = new HashMap<>();
    private boolean closed;

    /**
     * Creates a registry whose sessions talk HTTP to their configured origin.
     */
    public SessionRegistry() {
        this(options -> new HttpTransport(options.getOrigin(), options.getTimeout()));
    }

    /**
     * Creates a registry with a custom transport factory. Each session closes its transport when
     * it is closed.
     *
     * @param transportFactory creates the transport of a new session
     */
    public SessionRegistry(Function<ClientOptions, Transport> transportFactory) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory cannot be null");
    }

    /**
     * Returns the session for the given options, creating it on first use.
     *
     * @param options the configuration
     * @return the shared session
     * @throws BeaconException if the registry is closed
     */
    public synchronized SubscriptionSession acquire(ClientOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        if (closed) {
            throw new BeaconException("session registry is closed");
        }
        String key = options.fingerprint();
        Entry entry = entries.get(key);
        if (entry == null) {
            SubscriptionSession session = new SubscriptionSession(options, transportFactory.apply(options), true);
            entry = new Entry(session);
            entries.put(key, entry);
            LOGGER.debug("created session for {}", options.getUserId());
        }
        entry.refs++;
        return entry.session;
    }

    /**
     * Releases a session obtained from {@link #acquire(ClientOptions)}; the last release closes it.
     *
     * @param session the session
     * @return true if the session was closed by this call
     */
    public synchronized boolean release(SubscriptionSession session) {
        Objects.requireNonNull(session, "session cannot be null");
        String key = session.getOptions().fingerprint();
        Entry entry = entries.get(key);
        if (entry == null || entry.session != session) {
            return false;
        }
        entry.refs--;
        if (entry.refs > 0) {
            return false;
        }
        entries.remove(key);
        session.close();
        LOGGER.debug("closed session for {}", session.getOptions().getUserId());
        return true;
    }

    /**
     * Returns the number of open sessions.
     *
     * @return session count
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Returns how many holders share the session for the given options.
     *
     * @param options the configuration
     * @return reference count, 0 if no session exists
     */
    public synchronized int referenceCount(ClientOptions options) {
        Entry entry = entries.get(options.fingerprint());
        return entry == null ? 0 : entry.refs;
    }

    /**
     * Closes every session regardless of outstanding references.
     */
    @Override
    public void close() {
        List<SubscriptionSession> sessions = new ArrayList<>();
        synchronized (this) {
            closed = true;
            entries.values().forEach(e -> sessions.add(e.session));
            entries.clear();
        }
        sessions.forEach(SubscriptionSession::close);
    }

    private static final class Entry {
        private final SubscriptionSession session;
        private int refs;

        private Entry(SubscriptionSession session) {
            this.session = session;
        }
    }
}
