package com.eventhub.rsvp.exception;

public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(Long eventId) {
        super("Event with id " + eventId + " is full");
    }
}
