package com.eventhub.rsvp.service;

import com.eventhub.rsvp.dto.request.JoinEventRequest;
import com.eventhub.rsvp.dto.response.JoinResponse;
import com.eventhub.rsvp.dto.response.LeaveResponse;
import com.eventhub.rsvp.dto.response.ReconciliationResponse;
import com.eventhub.rsvp.dto.response.ReservationResponse;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.entity.EventStatus;
import com.eventhub.rsvp.entity.Reservation;
import com.eventhub.rsvp.entity.ReservationStatus;
import com.eventhub.rsvp.exception.AlreadyReservedException;
import com.eventhub.rsvp.exception.CapacityExceededException;
import com.eventhub.rsvp.exception.EventClosedException;
import com.eventhub.rsvp.exception.ReconciliationRequiredException;
import com.eventhub.rsvp.exception.ResourceNotFoundException;
import com.eventhub.rsvp.mapper.ReservationMapper;
import com.eventhub.rsvp.repository.EventRepository;
import com.eventhub.rsvp.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reservation engine: join, leave, status and attendee listing.
 *
 * <p>Join and leave each run in one transaction. The capacity gate
 * ({@link EventRepository#reserveSlot}) is a single conditional UPDATE which also
 * takes the event row lock, so every later step of a join for the same event runs
 * serialised behind it. Joins for different events never share a lock.
 *
 * <p>If anything fails after the gate, the exception rolls the transaction back and
 * with it the counter increment and the attendee-set insert. The reservation ledger
 * and the event ledger are therefore never committed in disagreement by a join.
 */
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final EventRepository eventRepository;
    private final ReservationRepository reservationRepository;
    private final LifecycleEvaluator lifecycleEvaluator;
    private final ReconciliationService reconciliationService;

    @Transactional
    public JoinResponse join(Long eventId, Long userId, JoinEventRequest request) {
        Instant now = lifecycleEvaluator.now();

        // A holder of a confirmed seat is told so even when the event is full.
        if (hasConfirmedReservation(eventId, userId)) {
            throw new AlreadyReservedException(eventId, userId);
        }

        int reserved = eventRepository.reserveSlot(eventId, now, lifecycleEvaluator.completedCutoff(now));
        if (reserved == 0) {
            throw rejectionFor(eventId);
        }

        // Repeated under the event row lock: a concurrent join of the same user may have committed since.
        if (hasConfirmedReservation(eventId, userId)) {
            throw new AlreadyReservedException(eventId, userId);
        }
        if (eventRepository.addAttendee(eventId, userId) == 0) {
            eventRepository.markReconciliationPending(eventId);
            log.warn("User {} was already in the attendee set of event {} without a confirmed reservation; "
                + "flagged for reconciliation", userId, eventId);
        }

        Event event = eventRepository.findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        Reservation reservation = new Reservation();
        reservation.setEvent(event);
        reservation.setUserId(userId);
        reservation.setStatus(ReservationStatus.CONFIRMED);
        reservation.setNotes(request != null ? request.notes() : null);
        reservation.setReservedAt(now);

        Reservation saved;
        try {
            saved = reservationRepository.saveAndFlush(reservation);
        } catch (DataIntegrityViolationException ex) {
            throw new AlreadyReservedException(eventId, userId);
        }

        log.info("User {} joined event {} ({} spots left)", userId, eventId, event.getAvailableSpots());
        return new JoinResponse(ReservationMapper.toResponse(saved), event.getAvailableSpots());
    }

    /**
     * Cancels the caller's confirmed reservation, then releases its slot.
     *
     * <p>The reservation is cancelled first. If the slot cannot be released afterwards
     * the cancellation is still committed, the event is flagged for reconciliation and
     * {@link ReconciliationRequiredException} is thrown. The ledger then under-counts
     * until reconciled, which can never over-book.
     */
    @Transactional(noRollbackFor = ReconciliationRequiredException.class)
    public LeaveResponse leave(Long eventId, Long userId) {
        Optional<Reservation> confirmed = reservationRepository
            .findByEventIdAndUserIdAndStatusForUpdate(eventId, userId, ReservationStatus.CONFIRMED);

        if (confirmed.isEmpty()) {
            return resumePendingLeave(eventId, userId);
        }

        Instant now = lifecycleEvaluator.now();
        Reservation reservation = confirmed.get();
        reservation.cancel(now);
        reservationRepository.saveAndFlush(reservation);

        eventRepository.removeAttendee(eventId, userId);
        if (eventRepository.releaseSlot(eventId, now) == 0) {
            reservationRepository.markReleasePending(reservation.getId());
            eventRepository.markReconciliationPending(eventId);
            log.warn("Reservation {} cancelled but slot on event {} could not be released; "
                + "flagged for reconciliation", reservation.getId(), eventId);
            throw new ReconciliationRequiredException(eventId);
        }

        Event event = eventRepository.findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        log.info("User {} left event {} ({} spots left)", userId, eventId, event.getAvailableSpots());
        return new LeaveResponse(eventId, event.getAvailableSpots());
    }

    @Transactional(readOnly = true)
    public boolean hasConfirmedReservation(Long eventId, Long userId) {
        return reservationRepository.existsByEventIdAndUserIdAndStatus(eventId, userId, ReservationStatus.CONFIRMED);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listAttendees(Long eventId) {
        if (!eventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("Event", eventId);
        }
        return reservationRepository
            .findByEventIdAndStatusInReservationOrder(eventId, ReservationStatus.CONFIRMED)
            .stream()
            .map(ReservationMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listForUser(Long userId, ReservationStatus status) {
        ReservationStatus effective = status != null ? status : ReservationStatus.CONFIRMED;
        return reservationRepository.findByUserIdAndStatusNewestFirst(userId, effective)
            .stream()
            .map(ReservationMapper::toResponse)
            .toList();
    }

    /**
     * A retried leave whose first attempt already cancelled the reservation. Finishes
     * the job by reconciling the event, so the retry answers like a successful leave.
     * Only the reservation whose slot release failed qualifies; older cancellations of
     * the same user still answer NotFound.
     */
    private LeaveResponse resumePendingLeave(Long eventId, Long userId) {
        if (!eventRepository.existsById(eventId)) {
            throw new ResourceNotFoundException("Event", eventId);
        }
        if (!reservationRepository.existsByEventIdAndUserIdAndReleasePendingTrue(eventId, userId)) {
            throw ResourceNotFoundException.confirmedReservation(eventId, userId);
        }

        ReconciliationResponse result = reconciliationService.reconcile(eventId);
        log.info("Retried leave of user {} on event {} completed by reconciliation", userId, eventId);
        return new LeaveResponse(eventId, result.availableSpots());
    }

    private RuntimeException rejectionFor(Long eventId) {
        Optional<Event> event = eventRepository.findById(eventId);
        if (event.isEmpty()) {
            return new ResourceNotFoundException("Event", eventId);
        }
        EventStatus status = lifecycleEvaluator.currentStatus(event.get());
        if (!status.isOpenForReservations()) {
            log.debug("Join rejected: event {} is {}", eventId, status);
            return new EventClosedException(eventId, status);
        }
        log.debug("Join rejected: event {} is full", eventId);
        return new CapacityExceededException(eventId);
    }
}
