package com.eventhub.rsvp.mapper;

import com.eventhub.rsvp.dto.request.CreateEventRequest;
import com.eventhub.rsvp.dto.request.UpdateEventRequest;
import com.eventhub.rsvp.dto.response.EventResponse;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.entity.EventCategory;
import com.eventhub.rsvp.entity.EventStatus;

import java.time.Instant;

public final class EventMapper {

    private EventMapper() {}

    public static Event toEntity(CreateEventRequest request, Long organizerId) {
        Event event = new Event();
        event.setOrganizerId(organizerId);
        event.setTitle(request.title());
        event.setDescription(request.description());
        event.setLocation(request.location());
        event.setCategory(request.category() != null ? request.category() : EventCategory.OTHER);
        event.setImageUrl(request.imageUrl());
        event.setScheduledAt(request.scheduledAt());
        event.setCapacity(request.capacity());
        return event;
    }

    /**
     * @param status  lifecycle status derived at read time, not the stored column
     * @param reserved whether the viewing user holds a confirmed reservation
     */
    public static EventResponse toResponse(Event event, EventStatus status, boolean reserved, Instant now) {
        return new EventResponse(
            event.getId(),
            event.getOrganizerId(),
            event.getTitle(),
            event.getDescription(),
            event.getLocation(),
            event.getCategory(),
            event.getImageUrl(),
            event.getScheduledAt(),
            event.getCapacity(),
            event.getCurrentAttendees(),
            event.getAvailableSpots(),
            event.isFull(),
            event.isPast(now),
            status,
            reserved,
            event.getCreatedAt(),
            event.getUpdatedAt()
        );
    }

    public static void updateEntity(Event event, UpdateEventRequest request) {
        if (request.title() != null) {
            event.setTitle(request.title());
        }
        if (request.description() != null) {
            event.setDescription(request.description());
        }
        if (request.location() != null) {
            event.setLocation(request.location());
        }
        if (request.category() != null) {
            event.setCategory(request.category());
        }
        if (request.imageUrl() != null) {
            event.setImageUrl(request.imageUrl());
        }
        if (request.scheduledAt() != null) {
            event.setScheduledAt(request.scheduledAt());
        }
        if (request.capacity() != null) {
            event.setCapacity(request.capacity());
        }
    }
}
