package com.eventhub.rsvp.entity;

/**
 * Lifecycle states for a {@link Reservation}.
 *
 * <p>Mapped as {@code VARCHAR} via {@code @Enumerated(EnumType.STRING)}; the partial
 * unique index {@code uq_reservations_confirmed_pair} matches on the literal
 * {@code 'CONFIRMED'}, so the constant names are part of the schema.
 *
 * <ul>
 *   <li>{@link #CONFIRMED}: the user holds one of the event's slots</li>
 *   <li>{@link #CANCELLED}: the user left; the row is kept as history</li>
 * </ul>
 */
public enum ReservationStatus {
    CONFIRMED,
    CANCELLED
}
