package com.eventhub.rsvp.service;

import com.eventhub.rsvp.dto.response.ReconciliationResponse;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.exception.ResourceNotFoundException;
import com.eventhub.rsvp.repository.EventRepository;
import com.eventhub.rsvp.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Restores agreement between an event's attendee counter, its attendee set and its
 * confirmed reservations. The reservation ledger is treated as the source of truth.
 * Reconciling an event that is already consistent changes nothing but the pending flags.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final EventRepository eventRepository;
    private final ReservationRepository reservationRepository;
    private final LifecycleEvaluator lifecycleEvaluator;

    @Transactional
    public ReconciliationResponse reconcile(Long eventId) {
        Event locked = eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        int before = locked.getCurrentAttendees();

        eventRepository.pruneStaleAttendees(eventId);
        eventRepository.restoreMissingAttendees(eventId);
        eventRepository.recountAttendees(eventId, lifecycleEvaluator.now());
        reservationRepository.clearReleasePending(eventId);

        Event event = eventRepository.findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        ReconciliationResponse result = new ReconciliationResponse(
            eventId, before, event.getCurrentAttendees(), event.getAvailableSpots());

        if (result.corrected()) {
            log.warn("Reconciled event {}: attendee count {} -> {}",
                eventId, result.previousAttendees(), result.currentAttendees());
        } else {
            log.debug("Event {} already consistent ({} attendees)", eventId, result.currentAttendees());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<Long> findPendingEventIds() {
        return eventRepository.findIdsPendingReconciliation();
    }
}
