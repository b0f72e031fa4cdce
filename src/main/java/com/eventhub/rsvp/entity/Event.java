package com.eventhub.rsvp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity representing a capacity-limited event.
 *
 * <p><strong>Attendee counter ownership</strong>: {@link #currentAttendees} and the
 * attendee set ({@code event_attendees} table) belong to the reservation engine.
 * Both are moved exclusively by the conditional native statements in
 * {@code EventRepository}, inside the same transaction. The column is therefore
 * mapped {@code updatable = false}: saving an Event loaded by the organizer flow can
 * never write back a stale count. The same applies to {@link #reconciliationPending}.
 *
 * <p><strong>Optimistic locking</strong>: every native counter update also bumps
 * {@link #version}. An organizer edit based on a snapshot taken before a concurrent
 * join therefore fails with {@code OptimisticLockingFailureException} instead of
 * validating a capacity change against an outdated attendee count.
 *
 * <p>The store enforces {@code 0 <= current_attendees <= capacity} with a CHECK
 * constraint (migration V1).
 *
 * <p><strong>Derived values</strong>: available spots, fullness and pastness are
 * computed from stored fields and never persisted. {@link #status} is persisted only
 * as a cache of the derived lifecycle; readers go through {@code LifecycleEvaluator}.
 */
@Entity
@Table(name = "events")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Event extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Opaque identifier of the organizing user, supplied by the authentication layer. */
    @Column(name = "organizer_id", nullable = false, updatable = false)
    private Long organizerId;

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "location", nullable = false, length = 200)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private EventCategory category = EventCategory.OTHER;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    @Column(name = "current_attendees", nullable = false, updatable = false)
    private Integer currentAttendees = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status = EventStatus.UPCOMING;

    /**
     * Set when a leave cancelled its reservation but could not release the slot.
     * Cleared by {@code ReconciliationService}.
     */
    @Column(name = "reconciliation_pending", nullable = false, updatable = false)
    private boolean reconciliationPending;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public int getAvailableSpots() {
        return capacity - currentAttendees;
    }

    public boolean isFull() {
        return currentAttendees >= capacity;
    }

    public boolean isPast(Instant now) {
        return scheduledAt.isBefore(now);
    }

    public boolean isOrganizedBy(Long userId) {
        return organizerId.equals(userId);
    }
}
