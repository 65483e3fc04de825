package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.ErrorReason;

import java.util.Objects;

/**
 * Status notification broadcast to listeners. Transient, never persisted.
 */
public final class SubscribeStatus {

    /**
     * What the status reports.
     */
    public enum Category {
        CONNECTING,
        CONNECTED,
        RECONNECTING,
        DISCONNECTED,
        DISCONNECTED_UNEXPECTEDLY,
        SUBSCRIPTION_CHANGED,
        SUBSCRIBE_ERROR,
        REQUEST_MESSAGE_COUNT_EXCEEDED
    }

    private final Category category;
    private final SubscriptionChange change;
    private final BeaconException error;
    private final Cursor cursor;

    private SubscribeStatus(Category category, SubscriptionChange change, BeaconException error, Cursor cursor) {
        this.category = category;
        this.change = change;
        this.error = error;
        this.cursor = cursor;
    }

    static SubscribeStatus of(Category category) {
        return new SubscribeStatus(category, null, null, null);
    }

    static SubscribeStatus subscriptionChanged(SubscriptionChange change) {
        return new SubscribeStatus(Category.SUBSCRIPTION_CHANGED, change, null, null);
    }

    static SubscribeStatus subscribeError(BeaconException error) {
        return new SubscribeStatus(Category.SUBSCRIBE_ERROR, null, error, null);
    }

    static SubscribeStatus disconnectedUnexpectedly(BeaconException error) {
        return new SubscribeStatus(Category.DISCONNECTED_UNEXPECTEDLY, null, error, null);
    }

    static SubscribeStatus messageCountExceeded(Cursor cursor) {
        return new SubscribeStatus(Category.REQUEST_MESSAGE_COUNT_EXCEEDED, null, null, cursor);
    }

    static SubscribeStatus forState(ConnectionState state) {
        switch (state) {
            case CONNECTING:
                return of(Category.CONNECTING);
            case CONNECTED:
                return of(Category.CONNECTED);
            case RECONNECTING:
                return of(Category.RECONNECTING);
            case IDLE:
                return of(Category.DISCONNECTED);
            default:
                throw new IllegalArgumentException("no plain status for " + state);
        }
    }

    /**
     * Returns the status category.
     *
     * @return the category
     */
    public Category getCategory() {
        return category;
    }

    /**
     * Returns the subscription change for SUBSCRIPTION_CHANGED statuses.
     *
     * @return the change, or null
     */
    public SubscriptionChange getChange() {
        return change;
    }

    /**
     * Returns the error for SUBSCRIBE_ERROR and DISCONNECTED_UNEXPECTEDLY statuses.
     *
     * @return the error, or null
     */
    public BeaconException getError() {
        return error;
    }

    /**
     * Returns the reason of the attached error.
     *
     * @return the reason, or null when no error is attached
     */
    public ErrorReason getReason() {
        return error != null ? error.getReason() : null;
    }

    /**
     * Returns the cursor of the batch that triggered REQUEST_MESSAGE_COUNT_EXCEEDED.
     *
     * @return the cursor, or null
     */
    public Cursor getCursor() {
        return cursor;
    }

    /**
     * Checks if this status reports an error.
     *
     * @return true if an error is attached
     */
    public boolean isError() {
        return error != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscribeStatus that = (SubscribeStatus) o;
        return category == that.category &&
                Objects.equals(change, that.change) &&
                Objects.equals(error, that.error) &&
                Objects.equals(cursor, that.cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, change, error, cursor);
    }

    @Override
    public String toString() {
        return "SubscribeStatus{" +
                "category=" + category +
                (change != null ? ", change=" + change : "") +
                (error != null ? ", reason=" + error.getReason() + ", error='" + error.getMessage() + '\'' : "") +
                (cursor != null ? ", cursor=" + cursor : "") +
                '}';
    }
}
