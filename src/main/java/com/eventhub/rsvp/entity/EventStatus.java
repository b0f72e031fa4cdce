package com.eventhub.rsvp.entity;

/**
 * Lifecycle phase of an {@link Event}.
 *
 * <p>{@link #UPCOMING}, {@link #ONGOING} and {@link #COMPLETED} are derived from the
 * schedule by {@code LifecycleEvaluator} and only persisted opportunistically.
 * {@link #CANCELLED} is set by the organizer and is terminal: it is never recomputed.
 */
public enum EventStatus {
    UPCOMING,
    ONGOING,
    COMPLETED,
    CANCELLED;

    public boolean isOpenForReservations() {
        return this == UPCOMING || this == ONGOING;
    }
}
