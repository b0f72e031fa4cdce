package com.eventhub.rsvp.exception;

public class CapacityBelowAttendeesException extends RuntimeException {

    public CapacityBelowAttendeesException(int requestedCapacity, int currentAttendees) {
        super("Cannot reduce capacity to " + requestedCapacity
            + " below current attendees (" + currentAttendees + ")");
    }
}
