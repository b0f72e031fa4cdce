package com.eventhub.rsvp.service;

import com.eventhub.rsvp.dto.response.UserPurgeResponse;
import com.eventhub.rsvp.entity.Reservation;
import com.eventhub.rsvp.entity.ReservationStatus;
import com.eventhub.rsvp.exception.ResourceNotFoundException;
import com.eventhub.rsvp.repository.EventRepository;
import com.eventhub.rsvp.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cleanup contract invoked when an event or a user account is deleted, so that no
 * reservation, attendee row or attendee count refers to a deleted entity.
 */
@Service
@RequiredArgsConstructor
public class ReservationCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ReservationCleanupService.class);

    private final EventRepository eventRepository;
    private final ReservationRepository reservationRepository;
    private final LifecycleEvaluator lifecycleEvaluator;

    /**
     * Deletes an event together with all its reservations. Attendee rows go with the
     * event through {@code ON DELETE CASCADE}.
     */
    @Transactional
    public int purgeEvent(Long eventId) {
        eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        int deleted = reservationRepository.deleteAllByEventId(eventId);
        eventRepository.deleteById(eventId);
        log.info("Deleted event {} and {} reservation(s)", eventId, deleted);
        return deleted;
    }

    /**
     * Releases every slot the user holds and deletes all of the user's reservations.
     * Event rows are locked in ascending id order, the same order any other multi-event
     * writer would use.
     */
    @Transactional
    public UserPurgeResponse purgeUser(Long userId) {
        Set<Long> heldEventIds = new TreeSet<>();
        for (Reservation reservation : reservationRepository
                .findByUserIdAndStatusNewestFirst(userId, ReservationStatus.CONFIRMED)) {
            heldEventIds.add(reservation.getEvent().getId());
        }
        Set<Long> attendedEventIds = new TreeSet<>(eventRepository.findEventIdsByAttendee(userId));

        Set<Long> affected = new TreeSet<>(heldEventIds);
        affected.addAll(attendedEventIds);
        affected.forEach(eventRepository::findByIdForUpdate);

        List<Long> released = new ArrayList<>();
        for (Long eventId : heldEventIds) {
            eventRepository.removeAttendee(eventId, userId);
            if (eventRepository.releaseSlot(eventId, lifecycleEvaluator.now()) == 1) {
                released.add(eventId);
            } else {
                eventRepository.markReconciliationPending(eventId);
                log.warn("Could not release slot of user {} on event {}; flagged for reconciliation",
                    userId, eventId);
            }
        }
        for (Long eventId : attendedEventIds) {
            if (!heldEventIds.contains(eventId)) {
                eventRepository.removeAttendee(eventId, userId);
                eventRepository.markReconciliationPending(eventId);
            }
        }

        int deleted = reservationRepository.deleteAllByUserId(userId);
        log.info("Purged user {}: {} reservation(s) deleted, {} slot(s) released",
            userId, deleted, released.size());
        return new UserPurgeResponse(userId, deleted, released);
    }
}
