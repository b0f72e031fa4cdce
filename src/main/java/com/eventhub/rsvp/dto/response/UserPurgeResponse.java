package com.eventhub.rsvp.dto.response;

import java.util.List;

public record UserPurgeResponse(
    Long userId,
    int reservationsDeleted,
    List<Long> releasedEventIds
) {}
