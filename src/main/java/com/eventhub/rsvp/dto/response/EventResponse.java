package com.eventhub.rsvp.dto.response;

import com.eventhub.rsvp.entity.EventCategory;
import com.eventhub.rsvp.entity.EventStatus;

import java.time.Instant;

public record EventResponse(
    Long id,
    Long organizerId,
    String title,
    String description,
    String location,
    EventCategory category,
    String imageUrl,
    Instant scheduledAt,
    int capacity,
    int currentAttendees,
    int availableSpots,
    boolean full,
    boolean past,
    EventStatus status,
    boolean reserved,
    Instant createdAt,
    Instant updatedAt
) {}
