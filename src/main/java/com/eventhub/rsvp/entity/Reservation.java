package com.eventhub.rsvp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity representing one user's reservation of a slot in an {@link Event}.
 *
 * <p>For a given (event, user) pair at most one row may be {@code CONFIRMED}. The
 * reservation engine checks this explicitly while holding the event row lock, and the
 * partial unique index {@code uq_reservations_confirmed_pair} (migration V3) rejects
 * anything that slips past it.
 *
 * <p>Leaving an event transitions the row to {@code CANCELLED} and stamps
 * {@link #cancelledAt}; rows are never deleted except by the event/user cleanup
 * cascade. A cancellation whose slot release failed also carries
 * {@link #releasePending} until the event is reconciled.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards against two
 * concurrent leaves cancelling the same row.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "event_id", nullable = false, updatable = false)
    private Event event;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "notes", length = 500)
    private String notes;

    /** Ordering key for attendee lists. */
    @Column(name = "reserved_at", nullable = false, updatable = false)
    private Instant reservedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    /**
     * Set when the reservation was cancelled but its slot is still counted on the
     * event. Written only by {@code ReservationRepository} update statements.
     */
    @Column(name = "release_pending", nullable = false, updatable = false)
    private boolean releasePending;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isConfirmed() {
        return status == ReservationStatus.CONFIRMED;
    }

    public void cancel(Instant at) {
        status = ReservationStatus.CANCELLED;
        cancelledAt = at;
    }
}
