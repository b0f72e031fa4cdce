package com.eventhub.rsvp.dto.response;

public record ReconciliationResponse(
    Long eventId,
    int previousAttendees,
    int currentAttendees,
    int availableSpots
) {
    public boolean corrected() {
        return previousAttendees != currentAttendees;
    }
}
