package com.eventhub.rsvp.dto.response;

import com.eventhub.rsvp.entity.ReservationStatus;

import java.time.Instant;

public record ReservationResponse(
    Long id,
    Long eventId,
    String eventTitle,
    Instant eventScheduledAt,
    Long userId,
    ReservationStatus status,
    String notes,
    Instant reservedAt,
    Instant cancelledAt
) {}
