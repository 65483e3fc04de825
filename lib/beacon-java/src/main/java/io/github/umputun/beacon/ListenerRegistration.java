package io.github.umputun.beacon;

/**
 * Handle returned when a listener is added. Cancelling stops delivery immediately,
 * including while a dispatch to that listener is in progress on another thread.
 */
public interface ListenerRegistration extends AutoCloseable {

    /**
     * Checks if the listener still receives events.
     *
     * @return false once cancelled
     */
    boolean isActive();

    /**
     * Removes the listener. Safe to call multiple times.
     */
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
