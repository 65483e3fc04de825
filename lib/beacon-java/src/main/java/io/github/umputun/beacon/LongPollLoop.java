package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.CancelledError;
import io.github.umputun.beacon.errors.DecodingError;
import io.github.umputun.beacon.errors.ErrorReason;
import io.github.umputun.beacon.transport.Transport;
import io.github.umputun.beacon.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Connection state machine driving one long-poll request at a time on a dedicated daemon thread.
 * <p>
 * Every control call bumps {@code generation} under {@code lock}; a poll whose generation changed
 * while it was in flight is discarded and reissued with the current cursor and subscription set.
 * Status emission and event dispatch also happen under {@code lock}, so listeners observe
 * transitions in the order they were made.
 */
final class LongPollLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(LongPollLoop.class);

    static final String THREAD_NAME = "beacon-subscribe";
    private static final long JOIN_TIMEOUT_MS = 1000;

    private final SubscriptionSet set;
    private final Endpoints endpoints;
    private final Transport transport;
    private final EnvelopeDecoder decoder;
    private final ListenerHub hub;
    private final ReconnectPolicy policy;
    private final int messageCountThreshold;

    private final Object lock = new Object();
    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile Cursor cursor = Cursor.START;
    private long generation;
    private long resets;
    private int attempt;
    private boolean closed;
    private CompletableFuture<byte[]> inFlight;
    private Thread thread;

    LongPollLoop(SubscriptionSet set, Endpoints endpoints, Transport transport, EnvelopeDecoder decoder,
                 ListenerHub hub, ReconnectPolicy policy, int messageCountThreshold) {
        this.set = set;
        this.endpoints = endpoints;
        this.transport = transport;
        this.decoder = decoder;
        this.hub = hub;
        this.policy = policy;
        this.messageCountThreshold = messageCountThreshold;
    }

    ConnectionState currentState() {
        return state;
    }

    Cursor currentCursor() {
        return cursor;
    }

    /**
     * Starts polling from the retained cursor if idle or disconnected, otherwise reissues the current poll.
     * Does nothing while the subscription set is empty.
     */
    void start() {
        synchronized (lock) {
            if (closed) {
                throw new BeaconException("session is closed");
            }
            // the set may have been emptied between the caller's add and this call
            if (set.isEmpty()) {
                LOGGER.debug("start ignored, nothing subscribed");
                return;
            }
            if (state.isActive()) {
                restartPoll();
                return;
            }
            ensureThread();
            attempt = 0;
            generation++;
            LOGGER.info("subscribing from {}", cursor);
            transition(ConnectionState.CONNECTING);
            lock.notifyAll();
        }
    }

    /**
     * Cancels the in-flight poll and reissues it with the unchanged cursor. No-op when not polling.
     */
    void refresh() {
        synchronized (lock) {
            if (!closed && state.isActive()) {
                restartPoll();
            }
        }
    }

    /**
     * Stops polling and moves to IDLE.
     *
     * @param resetCursor true to forget the cursor, false to keep it for a later catch-up
     */
    void stop(boolean resetCursor) {
        synchronized (lock) {
            generation++;
            resets++;
            attempt = 0;
            cancelInFlight();
            if (resetCursor) {
                cursor = Cursor.START;
                decoder.resetDuplicates();
            }
            if (state != ConnectionState.IDLE) {
                LOGGER.info("subscription stopped at {}", cursor);
                transition(ConnectionState.IDLE);
            }
            lock.notifyAll();
        }
    }

    /**
     * Resumes polling from the retained cursor, typically after DISCONNECTED_UNEXPECTEDLY.
     */
    void reconnect() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (set.isEmpty()) {
                LOGGER.debug("reconnect ignored, nothing subscribed");
                return;
            }
            start();
        }
    }

    /**
     * Emits a status in order with the loop's own transitions.
     */
    void emit(SubscribeStatus status) {
        synchronized (lock) {
            hub.emit(status);
        }
    }

    void close() {
        Thread worker;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            generation++;
            cancelInFlight();
            if (state != ConnectionState.IDLE) {
                transition(ConnectionState.IDLE);
            }
            lock.notifyAll();
            worker = thread;
        }
        if (worker != null && worker != Thread.currentThread()) {
            try {
                worker.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void ensureThread() {
        if (thread == null) {
            thread = new Thread(this::run, THREAD_NAME);
            thread.setDaemon(true);
            thread.start();
        }
    }

    private void restartPoll() {
        generation++;
        cancelInFlight();
        lock.notifyAll();
    }

    private void cancelInFlight() {
        if (inFlight != null) {
            inFlight.cancel(true);
            inFlight = null;
        }
    }

    private void run() {
        LOGGER.debug("subscribe loop started");
        while (true) {
            long gen = -1;
            try {
                TransportRequest request;
                synchronized (lock) {
                    while (!closed && (!state.isActive() || set.isEmpty())) {
                        lock.wait();
                    }
                    if (closed) {
                        break;
                    }
                    gen = generation;
                    request = endpoints.subscribe(set.snapshot(), cursor);
                }

                CompletableFuture<byte[]> future = send(request);
                synchronized (lock) {
                    if (closed || generation != gen) {
                        future.cancel(true);
                        continue;
                    }
                    inFlight = future;
                }

                byte[] body = null;
                BeaconException failure = null;
                try {
                    body = future.get();
                } catch (CancellationException e) {
                    failure = new CancelledError("subscribe request cancelled", e);
                } catch (ExecutionException e) {
                    failure = toBeaconException(e.getCause());
                }

                synchronized (lock) {
                    if (inFlight == future) {
                        inFlight = null;
                    }
                    if (closed) {
                        break;
                    }
                    if (generation != gen) {
                        LOGGER.debug("discarding result of a superseded poll");
                        continue;
                    }
                    if (failure == null) {
                        handleSuccess(body);
                    } else {
                        handleFailure(failure, gen);
                    }
                }
            } catch (InterruptedException e) {
                if (isClosed()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                LOGGER.debug("subscribe loop interrupted, reissuing poll");
            } catch (RuntimeException e) {
                LOGGER.error("subscribe loop failed", e);
                synchronized (lock) {
                    if (!closed && generation == gen && state.isActive()) {
                        giveUp(toBeaconException(e));
                    }
                }
            }
        }
        LOGGER.debug("subscribe loop stopped");
    }

    private CompletableFuture<byte[]> send(TransportRequest request) {
        try {
            return transport.execute(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // called with lock held
    private void handleSuccess(byte[] body) {
        SubscribeResponse response;
        try {
            response = decoder.decode(body);
        } catch (DecodingError e) {
            LOGGER.warn("failed to decode subscribe response: {}", e.getMessage());
            giveUp(e);
            return;
        }
        LOGGER.debug("poll returned {} events, next cursor {}", response.getEvents().size(), response.getCursor());

        attempt = 0;
        if (state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECTING) {
            transition(ConnectionState.CONNECTED);
        }
        if (response.getEnvelopeCount() >= messageCountThreshold) {
            hub.emit(SubscribeStatus.messageCountExceeded(response.getCursor()));
        }

        long resetsBefore = resets;
        hub.dispatch(response.getEvents());
        // a listener may have stopped the subscription from inside a callback
        if (resets == resetsBefore && state.isActive()) {
            cursor = response.getCursor();
        }
    }

    // called with lock held
    private void handleFailure(BeaconException error, long gen) throws InterruptedException {
        if (!policy.shouldRetry(error)) {
            LOGGER.warn("subscribe failed: {}", error.getMessage());
            giveUp(error);
            return;
        }
        if (!policy.canRetry(attempt)) {
            LOGGER.warn("subscribe failed after {} retries: {}", attempt, error.getMessage());
            giveUp(new BeaconException(ErrorReason.REQUEST_RETRY_FAILED,
                    "retry limit reached after " + attempt + " attempts: " + error.getMessage(), error));
            return;
        }

        Duration delay = policy.nextDelay(attempt);
        attempt++;
        LOGGER.info("subscribe failed ({}), retry {} in {} ms", error.getMessage(), attempt, delay.toMillis());
        transition(ConnectionState.RECONNECTING);
        awaitRetry(delay, gen);
    }

    // waits until the delay passes, a control call changes the generation, or the loop closes
    private void awaitRetry(Duration delay, long gen) throws InterruptedException {
        long deadline = System.nanoTime() + delay.toNanos();
        while (!closed && generation == gen) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return;
            }
            lock.wait(remainingMs);
        }
    }

    private void giveUp(BeaconException error) {
        attempt = 0;
        hub.emit(SubscribeStatus.subscribeError(error));
        if (state != ConnectionState.DISCONNECTED_UNEXPECTEDLY) {
            state = ConnectionState.DISCONNECTED_UNEXPECTEDLY;
            LOGGER.info("disconnected unexpectedly at {}: {}", cursor, error.getReason());
            hub.emit(SubscribeStatus.disconnectedUnexpectedly(error));
        }
    }

    private void transition(ConnectionState next) {
        if (state == next) {
            return;
        }
        LOGGER.debug("state {} -> {}", state, next);
        state = next;
        hub.emit(SubscribeStatus.forState(next));
    }

    private static BeaconException toBeaconException(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof BeaconException) {
            return (BeaconException) current;
        }
        if (current instanceof CancellationException) {
            return new CancelledError("subscribe request cancelled", current);
        }
        return new BeaconException("subscribe request failed: " + current, current);
    }
}
