package io.github.umputun.beacon;

/**
 * State of the long-poll loop.
 */
public enum ConnectionState {
    /** nothing subscribed, or polling stopped by the caller */
    IDLE,
    /** first poll for a new subscription is in flight */
    CONNECTING,
    /** at least one poll succeeded since the last failure */
    CONNECTED,
    /** last poll failed with a retryable error, waiting to retry */
    RECONNECTING,
    /** polling gave up after a non-retryable error */
    DISCONNECTED_UNEXPECTEDLY;

    /**
     * Checks if the loop keeps polling in this state.
     *
     * @return true for CONNECTING, CONNECTED and RECONNECTING
     */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED || this == RECONNECTING;
    }
}
