package com.eventhub.rsvp.exception;

public class AlreadyReservedException extends RuntimeException {

    public AlreadyReservedException(Long eventId, Long userId) {
        super("User " + userId + " already has a confirmed reservation for event " + eventId);
    }
}
