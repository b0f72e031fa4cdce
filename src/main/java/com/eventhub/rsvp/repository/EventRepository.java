package com.eventhub.rsvp.repository;

import com.eventhub.rsvp.entity.Event;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Event ledger.
 *
 * <p>The modifying statements are the only writers of {@code current_attendees} and
 * {@code event_attendees}. Each one is a single conditional statement, so the check
 * and the write happen under the same row lock; callers must never read the counter
 * and write it back.
 */
public interface EventRepository extends JpaRepository<Event, Long> {

    /**
     * Capacity gate. Takes one slot if the event is open and not full, refreshing the
     * persisted lifecycle status in the same statement.
     *
     * @param closesBefore events scheduled at or before this instant are completed
     * @return 1 if a slot was taken, 0 if the event is missing, full, cancelled or over
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
        UPDATE events
           SET current_attendees = current_attendees + 1,
               status = CASE WHEN scheduled_at > :now THEN 'UPCOMING' ELSE 'ONGOING' END,
               version = version + 1,
               updated_at = :now
         WHERE id = :eventId
           AND current_attendees < capacity
           AND status <> 'CANCELLED'
           AND scheduled_at > :closesBefore
        """, nativeQuery = true)
    int reserveSlot(@Param("eventId") Long eventId,
                    @Param("now") Instant now,
                    @Param("closesBefore") Instant closesBefore);

    /**
     * Gives one slot back. Never drives the counter below zero.
     *
     * @return 1 if a slot was released, 0 if the event is missing or already at zero
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
        UPDATE events
           SET current_attendees = current_attendees - 1,
               version = version + 1,
               updated_at = :now
         WHERE id = :eventId
           AND current_attendees > 0
        """, nativeQuery = true)
    int releaseSlot(@Param("eventId") Long eventId, @Param("now") Instant now);

    /** @return 1 if the user was added, 0 if already in the attendee set */
    @Modifying
    @Query(value = """
        INSERT INTO event_attendees (event_id, user_id)
        VALUES (:eventId, :userId)
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int addAttendee(@Param("eventId") Long eventId, @Param("userId") Long userId);

    @Modifying
    @Query(value = "DELETE FROM event_attendees WHERE event_id = :eventId AND user_id = :userId",
           nativeQuery = true)
    int removeAttendee(@Param("eventId") Long eventId, @Param("userId") Long userId);

    @Query(value = "SELECT user_id FROM event_attendees WHERE event_id = :eventId ORDER BY user_id",
           nativeQuery = true)
    List<Long> findAttendeeIds(@Param("eventId") Long eventId);

    @Query(value = "SELECT event_id FROM event_attendees WHERE user_id = :userId ORDER BY event_id",
           nativeQuery = true)
    List<Long> findEventIdsByAttendee(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE events SET reconciliation_pending = TRUE WHERE id = :eventId",
           nativeQuery = true)
    int markReconciliationPending(@Param("eventId") Long eventId);

    @Query(value = "SELECT id FROM events WHERE reconciliation_pending ORDER BY id", nativeQuery = true)
    List<Long> findIdsPendingReconciliation();

    /**
     * Rewrites the counter from the confirmed reservations and clears the pending flag.
     * Callers must hold the row lock from {@link #findByIdForUpdate(Long)}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
        UPDATE events
           SET current_attendees = (SELECT COUNT(*) FROM reservations r
                                     WHERE r.event_id = events.id AND r.status = 'CONFIRMED'),
               reconciliation_pending = FALSE,
               version = version + 1,
               updated_at = :now
         WHERE id = :eventId
        """, nativeQuery = true)
    int recountAttendees(@Param("eventId") Long eventId, @Param("now") Instant now);

    @Modifying
    @Query(value = """
        DELETE FROM event_attendees a
         WHERE a.event_id = :eventId
           AND NOT EXISTS (SELECT 1 FROM reservations r
                            WHERE r.event_id = a.event_id AND r.user_id = a.user_id
                              AND r.status = 'CONFIRMED')
        """, nativeQuery = true)
    int pruneStaleAttendees(@Param("eventId") Long eventId);

    @Modifying
    @Query(value = """
        INSERT INTO event_attendees (event_id, user_id)
        SELECT r.event_id, r.user_id FROM reservations r
         WHERE r.event_id = :eventId AND r.status = 'CONFIRMED'
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int restoreMissingAttendees(@Param("eventId") Long eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT e FROM Event e WHERE e.id = :id")
    Optional<Event> findByIdForUpdate(@Param("id") Long id);
}
