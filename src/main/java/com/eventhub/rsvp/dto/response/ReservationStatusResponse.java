package com.eventhub.rsvp.dto.response;

public record ReservationStatusResponse(
    Long eventId,
    Long userId,
    boolean reserved
) {}
