package com.eventhub.rsvp.exception;

public class UnauthorizedOrganizerException extends RuntimeException {

    public UnauthorizedOrganizerException(Long eventId, Long userId) {
        super("User " + userId + " is not the organizer of event " + eventId);
    }
}
