package com.eventhub.rsvp.service;

import com.eventhub.rsvp.config.ReservationProperties;
import com.eventhub.rsvp.entity.Event;
import com.eventhub.rsvp.entity.EventStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives an event's lifecycle phase from its schedule and the current time.
 *
 * <p>An event is {@link EventStatus#UPCOMING} before {@code scheduledAt},
 * {@link EventStatus#ONGOING} for {@code duration} after it, and
 * {@link EventStatus#COMPLETED} from then on. {@link EventStatus#CANCELLED} overrides
 * the schedule and is never recomputed.
 *
 * <p>The derivation itself is the static {@link #deriveStatus}; the bean only supplies
 * the configured duration and the application {@link Clock}.
 */
@Component
public class LifecycleEvaluator {

    private final Duration duration;
    private final Clock clock;

    public LifecycleEvaluator(ReservationProperties properties, Clock clock) {
        this.duration = properties.lifecycle().duration();
        this.clock = clock;
    }

    public static EventStatus deriveStatus(EventStatus stored, Instant scheduledAt,
                                           Duration duration, Instant now) {
        if (stored == EventStatus.CANCELLED) {
            return EventStatus.CANCELLED;
        }
        if (now.isBefore(scheduledAt)) {
            return EventStatus.UPCOMING;
        }
        if (now.isBefore(scheduledAt.plus(duration))) {
            return EventStatus.ONGOING;
        }
        return EventStatus.COMPLETED;
    }

    public Instant now() {
        return clock.instant();
    }

    public EventStatus currentStatus(Event event) {
        return deriveStatus(event.getStatus(), event.getScheduledAt(), duration, now());
    }

    /**
     * Writes the derived status onto a managed entity so it is persisted with the
     * caller's next flush.
     */
    public EventStatus refresh(Event event) {
        EventStatus derived = currentStatus(event);
        event.setStatus(derived);
        return derived;
    }

    /** Events scheduled at or before the returned instant are completed at {@code now}. */
    public Instant completedCutoff(Instant now) {
        return now.minus(duration);
    }
}
