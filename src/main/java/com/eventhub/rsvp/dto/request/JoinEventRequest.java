package com.eventhub.rsvp.dto.request;

import jakarta.validation.constraints.Size;

public record JoinEventRequest(

    @Size(max = 500, message = "Notes must not exceed 500 characters")
    String notes
) {}
