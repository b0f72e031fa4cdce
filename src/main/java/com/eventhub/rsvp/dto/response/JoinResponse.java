package com.eventhub.rsvp.dto.response;

public record JoinResponse(
    ReservationResponse reservation,
    int availableSpots
) {}
