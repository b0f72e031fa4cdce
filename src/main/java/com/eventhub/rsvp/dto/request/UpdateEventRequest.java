package com.eventhub.rsvp.dto.request;

import com.eventhub.rsvp.entity.EventCategory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateEventRequest(

    @Size(min = 1, max = 100, message = "Title must be between 1 and 100 characters")
    String title,

    @Size(min = 1, max = 2000, message = "Description must be between 1 and 2000 characters")
    String description,

    @Size(min = 1, max = 200, message = "Location must be between 1 and 200 characters")
    String location,

    EventCategory category,

    @Size(max = 500, message = "Image URL must not exceed 500 characters")
    String imageUrl,

    Instant scheduledAt,

    @Min(value = 1, message = "Capacity must be at least 1")
    @Max(value = 10000, message = "Capacity cannot exceed 10000")
    Integer capacity
) {}
