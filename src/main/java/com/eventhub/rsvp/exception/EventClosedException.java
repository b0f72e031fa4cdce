package com.eventhub.rsvp.exception;

import com.eventhub.rsvp.entity.EventStatus;

public class EventClosedException extends RuntimeException {

    public EventClosedException(Long eventId, EventStatus status) {
        super("Event with id " + eventId + " is not accepting reservations (current status is " + status + ")");
    }
}
