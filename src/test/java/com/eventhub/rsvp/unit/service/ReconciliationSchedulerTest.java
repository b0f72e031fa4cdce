package com.eventhub.rsvp.unit.service;

import com.eventhub.rsvp.dto.response.ReconciliationResponse;
import com.eventhub.rsvp.service.ReconciliationScheduler;
import com.eventhub.rsvp.service.ReconciliationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private ReconciliationService reconciliationService;

    @InjectMocks
    private ReconciliationScheduler scheduler;

    @Test
    void reconcilePending_nothingFlagged_doesNothing() {
        when(reconciliationService.findPendingEventIds()).thenReturn(List.of());

        scheduler.reconcilePending();

        verify(reconciliationService, never()).reconcile(anyLong());
    }

    @Test
    void reconcilePending_failureOnOneEvent_continuesWithTheRest() {
        when(reconciliationService.findPendingEventIds()).thenReturn(List.of(1L, 2L, 3L));
        when(reconciliationService.reconcile(1L)).thenReturn(new ReconciliationResponse(1L, 0, 2, 8));
        when(reconciliationService.reconcile(2L))
            .thenThrow(new PessimisticLockingFailureException("lock timeout"));
        when(reconciliationService.reconcile(3L)).thenReturn(new ReconciliationResponse(3L, 1, 1, 4));

        scheduler.reconcilePending();

        verify(reconciliationService).reconcile(1L);
        verify(reconciliationService).reconcile(2L);
        verify(reconciliationService).reconcile(3L);
    }
}
