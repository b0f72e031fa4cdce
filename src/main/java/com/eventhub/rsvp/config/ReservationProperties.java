package com.eventhub.rsvp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Binds the {@code rsvp.*} block of application.yml.
 */
@ConfigurationProperties(prefix = "rsvp")
public record ReservationProperties(
        @DefaultValue Lifecycle lifecycle,
        @DefaultValue Reconciliation reconciliation
) {
    /**
     * @param duration how long an event stays ONGOING after its scheduled start
     */
    public record Lifecycle(
            @DefaultValue("PT4H") Duration duration
    ) {}

    public record Reconciliation(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("60000") long intervalMs
    ) {}
}
