package com.eventhub.rsvp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import java.time.Instant;

/**
 * Shared superclass for all JPA entities.
 *
 * <p>Provides audit timestamps ({@code created_at} and {@code updated_at}) via JPA
 * lifecycle callbacks. {@code created_at} is written once on first persist.
 *
 * <p>The callbacks only fire for entity-level writes. The native statements in
 * {@code EventRepository} that move the attendee counter set {@code updated_at}
 * themselves.
 */
@MappedSuperclass
public abstract class BaseEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BaseEntity() {}

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
