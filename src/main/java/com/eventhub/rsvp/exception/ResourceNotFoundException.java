package com.eventhub.rsvp.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(entityName + " not found with id " + id);
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException confirmedReservation(Long eventId, Long userId) {
        return new ResourceNotFoundException(
            "No confirmed reservation for user " + userId + " on event " + eventId);
    }
}
