package com.eventhub.rsvp;

import com.eventhub.rsvp.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

class EventRsvpApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Flyway migrations applied and entity mappings validated against them.
    }
}
