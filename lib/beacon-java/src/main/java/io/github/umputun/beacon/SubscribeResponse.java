package io.github.umputun.beacon;

import io.github.umputun.beacon.event.SubscribeEvent;

import java.util.List;

/**
 * Decoded long-poll response: the next cursor and the events of the batch in server order.
 */
final class SubscribeResponse {

    private final Cursor cursor;
    private final List<SubscribeEvent> events;
    private final int envelopeCount;

    SubscribeResponse(Cursor cursor, List<SubscribeEvent> events, int envelopeCount) {
        this.cursor = cursor;
        this.events = List.copyOf(events);
        this.envelopeCount = envelopeCount;
    }

    Cursor getCursor() {
        return cursor;
    }

    List<SubscribeEvent> getEvents() {
        return events;
    }

    /** number of envelopes the server sent, including skipped and duplicate ones */
    int getEnvelopeCount() {
        return envelopeCount;
    }

    @Override
    public String toString() {
        return "SubscribeResponse{" +
                "cursor=" + cursor +
                ", events=" + events.size() +
                ", envelopeCount=" + envelopeCount +
                '}';
    }
}
