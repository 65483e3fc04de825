package io.github.umputun.beacon;

import io.github.umputun.beacon.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically announces presence on the subscribed channels. Failures are logged only,
 * they never affect the subscribe loop.
 */
final class HeartbeatScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatScheduler.class);

    static final String THREAD_NAME = "beacon-heartbeat";

    private final SubscriptionSet set;
    private final Endpoints endpoints;
    private final Transport transport;
    private final Duration interval;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;
    private boolean shutdown;

    HeartbeatScheduler(SubscriptionSet set, Endpoints endpoints, Transport transport, Duration interval) {
        this.set = set;
        this.endpoints = endpoints;
        this.transport = transport;
        this.interval = interval;
    }

    boolean isEnabled() {
        return !interval.isZero();
    }

    synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Schedules heartbeats if enabled and not already running.
     */
    synchronized void start() {
        if (!isEnabled() || shutdown || task != null) {
            return;
        }
        if (executor == null) {
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, THREAD_NAME);
                t.setDaemon(true);
                return t;
            });
        }
        long periodMs = interval.toMillis();
        task = executor.scheduleAtFixedRate(() -> {
            try {
                beat();
            } catch (RuntimeException e) {
                LOGGER.error("heartbeat task failed", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOGGER.debug("heartbeat started, every {} ms", periodMs);
    }

    synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            LOGGER.debug("heartbeat stopped");
        }
    }

    /**
     * Sends one heartbeat for the current subscription set.
     *
     * @return future completing when the request finished, successfully or not
     */
    CompletableFuture<Void> beat() {
        SubscriptionSet.Snapshot snapshot = set.snapshot();
        if (snapshot.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return transport.execute(endpoints.heartbeat(snapshot))
                .handle((body, error) -> {
                    if (error != null) {
                        LOGGER.warn("heartbeat for {} failed: {}", snapshot.channels(), error.getMessage());
                    } else {
                        LOGGER.debug("heartbeat sent for {} {}", snapshot.channels(), snapshot.groups());
                    }
                    return null;
                });
    }

    void shutdown() {
        ScheduledExecutorService toStop;
        synchronized (this) {
            shutdown = true;
            stop();
            toStop = executor;
            executor = null;
        }
        if (toStop == null) {
            return;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(1, TimeUnit.SECONDS)) {
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
