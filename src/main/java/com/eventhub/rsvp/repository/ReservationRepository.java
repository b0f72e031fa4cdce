package com.eventhub.rsvp.repository;

import com.eventhub.rsvp.entity.Reservation;
import com.eventhub.rsvp.entity.ReservationStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    boolean existsByEventIdAndUserIdAndStatus(Long eventId, Long userId, ReservationStatus status);

    long countByEventIdAndStatus(Long eventId, ReservationStatus status);

    boolean existsByEventIdAndUserIdAndReleasePendingTrue(Long eventId, Long userId);

    /** Marks a cancelled reservation whose slot could not be released. */
    @Modifying(flushAutomatically = true)
    @Query(value = "UPDATE reservations SET release_pending = TRUE WHERE id = :id", nativeQuery = true)
    int markReleasePending(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE reservations SET release_pending = FALSE WHERE event_id = :eventId AND release_pending",
           nativeQuery = true)
    int clearReleasePending(@Param("eventId") Long eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM Reservation r "
         + "WHERE r.event.id = :eventId AND r.userId = :userId AND r.status = :status")
    Optional<Reservation> findByEventIdAndUserIdAndStatusForUpdate(
        @Param("eventId") Long eventId,
        @Param("userId") Long userId,
        @Param("status") ReservationStatus status
    );

    @Query("SELECT r FROM Reservation r JOIN FETCH r.event "
         + "WHERE r.event.id = :eventId AND r.status = :status "
         + "ORDER BY r.reservedAt ASC, r.id ASC")
    List<Reservation> findByEventIdAndStatusInReservationOrder(
        @Param("eventId") Long eventId,
        @Param("status") ReservationStatus status
    );

    @Query("SELECT r FROM Reservation r JOIN FETCH r.event "
         + "WHERE r.userId = :userId AND r.status = :status "
         + "ORDER BY r.reservedAt DESC, r.id DESC")
    List<Reservation> findByUserIdAndStatusNewestFirst(
        @Param("userId") Long userId,
        @Param("status") ReservationStatus status
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.event.id = :eventId")
    int deleteAllByEventId(@Param("eventId") Long eventId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Reservation r WHERE r.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
