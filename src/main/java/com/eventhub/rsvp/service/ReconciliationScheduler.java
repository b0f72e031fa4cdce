package com.eventhub.rsvp.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically reconciles every event flagged by a leave that could not release its
 * slot. Each event is reconciled in its own transaction; a failure on one event is
 * logged and retried on the next pass.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rsvp.reconciliation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final ReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${rsvp.reconciliation.interval-ms:60000}")
    public void reconcilePending() {
        List<Long> pending = reconciliationService.findPendingEventIds();
        if (pending.isEmpty()) {
            return;
        }
        log.info("Reconciliation pass: {} event(s) pending", pending.size());

        int failed = 0;
        for (Long eventId : pending) {
            try {
                reconciliationService.reconcile(eventId);
            } catch (RuntimeException ex) {
                failed++;
                log.error("Reconciliation of event {} failed; will retry on next pass", eventId, ex);
            }
        }
        if (failed > 0) {
            log.warn("Reconciliation pass finished with {} failure(s)", failed);
        }
    }
}
