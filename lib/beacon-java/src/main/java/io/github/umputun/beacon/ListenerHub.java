package io.github.umputun.beacon;

import io.github.umputun.beacon.event.SubscribeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Ordered registry of listeners. Registration and removal may happen from any thread,
 * including from inside a callback.
 */
final class ListenerHub {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListenerHub.class);

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    ListenerRegistration add(SubscriptionListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        Entry entry = new Entry(listener);
        entries.add(entry);
        return entry;
    }

    /**
     * Removes a registration created by this hub.
     *
     * @return true if the registration was active
     */
    boolean remove(ListenerRegistration registration) {
        if (!(registration instanceof Entry)) {
            return false;
        }
        Entry entry = (Entry) registration;
        if (entry.owner() != this || !entry.isActive()) {
            return false;
        }
        entry.cancel();
        return true;
    }

    void removeAll() {
        entries.forEach(Entry::cancel);
    }

    int size() {
        return entries.size();
    }

    void dispatch(List<SubscribeEvent> events) {
        for (SubscribeEvent event : events) {
            deliver(listener -> event.dispatchTo(listener), event);
        }
    }

    void emit(SubscribeStatus status) {
        LOGGER.debug("status {}", status);
        deliver(listener -> listener.onStatus(status), status);
    }

    private void deliver(Consumer<SubscriptionListener> call, Object what) {
        // iterates a snapshot, entries added during delivery see the next item
        for (Entry entry : entries) {
            if (!entry.isActive()) {
                continue;
            }
            try {
                call.accept(entry.listener);
            } catch (RuntimeException e) {
                LOGGER.error("listener {} failed on {}", entry.listener, what, e);
            }
        }
    }

    private final class Entry implements ListenerRegistration {
        private final SubscriptionListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Entry(SubscriptionListener listener) {
            this.listener = listener;
        }

        private ListenerHub owner() {
            return ListenerHub.this;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                entries.remove(this);
            }
        }
    }
}
