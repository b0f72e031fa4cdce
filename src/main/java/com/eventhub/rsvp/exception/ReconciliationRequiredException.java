package com.eventhub.rsvp.exception;

import lombok.Getter;

/**
 * A leave cancelled its reservation but the attendee counter could not be released.
 * The event is flagged for reconciliation; retrying the same leave is safe.
 */
@Getter
public class ReconciliationRequiredException extends RuntimeException {

    private final Long eventId;

    public ReconciliationRequiredException(Long eventId) {
        super("Reservation cancelled but attendee count for event " + eventId
            + " is pending reconciliation. Retry the request.");
        this.eventId = eventId;
    }
}
