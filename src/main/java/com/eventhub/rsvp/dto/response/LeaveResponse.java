package com.eventhub.rsvp.dto.response;

public record LeaveResponse(
    Long eventId,
    int availableSpots
) {}
