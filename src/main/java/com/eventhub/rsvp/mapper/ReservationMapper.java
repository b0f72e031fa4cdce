package com.eventhub.rsvp.mapper;

import com.eventhub.rsvp.dto.response.ReservationResponse;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.entity.Reservation;

public final class ReservationMapper {

    private ReservationMapper() {}

    public static ReservationResponse toResponse(Reservation reservation) {
        Event event = reservation.getEvent();
        return new ReservationResponse(
            reservation.getId(),
            event.getId(),
            event.getTitle(),
            event.getScheduledAt(),
            reservation.getUserId(),
            reservation.getStatus(),
            reservation.getNotes(),
            reservation.getReservedAt(),
            reservation.getCancelledAt()
        );
    }
}
