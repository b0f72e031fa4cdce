package com.eventhub.rsvp.service;

import com.eventhub.rsvp.dto.request.CreateEventRequest;
import com.eventhub.rsvp.dto.request.UpdateEventRequest;
import com.eventhub.rsvp.dto.response.EventResponse;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.entity.EventStatus;
import com.eventhub.rsvp.entity.ReservationStatus;
import com.eventhub.rsvp.exception.CapacityBelowAttendeesException;
import com.eventhub.rsvp.exception.EventClosedException;
import com.eventhub.rsvp.exception.ResourceNotFoundException;
import com.eventhub.rsvp.exception.UnauthorizedOrganizerException;
import com.eventhub.rsvp.mapper.EventMapper;
import com.eventhub.rsvp.repository.EventRepository;
import com.eventhub.rsvp.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Organizer-side writes the reservation engine depends on: create, schedule and
 * capacity edits, cancellation and deletion.
 *
 * <p>Capacity edits are validated against the attendee count of the loaded snapshot.
 * A join committed after that snapshot bumps the event version, so the save then
 * fails optimistically instead of lowering capacity under the real count.
 */
@Service
@RequiredArgsConstructor
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final ReservationRepository reservationRepository;
    private final LifecycleEvaluator lifecycleEvaluator;
    private final ReservationCleanupService cleanupService;

    @Transactional
    public EventResponse create(Long organizerId, CreateEventRequest request) {
        Event event = EventMapper.toEntity(request, organizerId);
        lifecycleEvaluator.refresh(event);
        Event saved = eventRepository.save(event);
        log.info("Organizer {} created event {} with capacity {}", organizerId, saved.getId(), saved.getCapacity());
        return toResponse(saved, false);
    }

    @Transactional(readOnly = true)
    public EventResponse findById(Long eventId, Long viewerId) {
        Event event = findEvent(eventId);
        boolean reserved = viewerId != null && reservationRepository
            .existsByEventIdAndUserIdAndStatus(eventId, viewerId, ReservationStatus.CONFIRMED);
        return toResponse(event, reserved);
    }

    @Transactional
    public EventResponse update(Long eventId, Long organizerId, UpdateEventRequest request) {
        Event event = findOwnedEvent(eventId, organizerId);

        if (request.capacity() != null && request.capacity() < event.getCurrentAttendees()) {
            throw new CapacityBelowAttendeesException(request.capacity(), event.getCurrentAttendees());
        }

        EventMapper.updateEntity(event, request);
        lifecycleEvaluator.refresh(event);
        Event saved = eventRepository.saveAndFlush(event);
        return toResponse(saved, false);
    }

    @Transactional
    public EventResponse cancel(Long eventId, Long organizerId) {
        Event event = findOwnedEvent(eventId, organizerId);
        EventStatus current = lifecycleEvaluator.currentStatus(event);
        if (current == EventStatus.COMPLETED) {
            throw new EventClosedException(eventId, current);
        }

        event.setStatus(EventStatus.CANCELLED);
        Event saved = eventRepository.saveAndFlush(event);
        log.info("Organizer {} cancelled event {} with {} confirmed attendees",
            organizerId, eventId, saved.getCurrentAttendees());
        return toResponse(saved, false);
    }

    @Transactional
    public void delete(Long eventId, Long organizerId) {
        findOwnedEvent(eventId, organizerId);
        cleanupService.purgeEvent(eventId);
    }

    private Event findEvent(Long eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    private Event findOwnedEvent(Long eventId, Long organizerId) {
        Event event = findEvent(eventId);
        if (!event.isOrganizedBy(organizerId)) {
            throw new UnauthorizedOrganizerException(eventId, organizerId);
        }
        return event;
    }

    private EventResponse toResponse(Event event, boolean reserved) {
        return EventMapper.toResponse(event, lifecycleEvaluator.currentStatus(event), reserved,
            lifecycleEvaluator.now());
    }
}
