package com.eventhub.rsvp.controller;

import com.eventhub.rsvp.dto.response.ReconciliationResponse;
import com.eventhub.rsvp.dto.response.UserPurgeResponse;
import com.eventhub.rsvp.service.ReconciliationService;
import com.eventhub.rsvp.service.ReservationCleanupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service-to-service endpoints for the account service and operators. Not exposed
 * through the public gateway.
 */
@RestController
@RequestMapping("/internal/v1")
@RequiredArgsConstructor
@Tag(name = "Internal", description = "Reconciliation and deletion cascade")
public class InternalMaintenanceController {

    private final ReconciliationService reconciliationService;
    private final ReservationCleanupService cleanupService;

    @PostMapping("/events/{eventId}/reconcile")
    @Operation(summary = "Reconcile an event's attendee count with its confirmed reservations")
    public ResponseEntity<ReconciliationResponse> reconcile(@PathVariable Long eventId) {
        return ResponseEntity.ok(reconciliationService.reconcile(eventId));
    }

    @DeleteMapping("/events/{eventId}")
    @Operation(summary = "Delete an event and all its reservations on behalf of the authoring service")
    public ResponseEntity<Void> purgeEvent(@PathVariable Long eventId) {
        cleanupService.purgeEvent(eventId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/users/{userId}/reservations")
    @Operation(summary = "Release and delete every reservation of a deleted user account")
    public ResponseEntity<UserPurgeResponse> purgeUser(@PathVariable Long userId) {
        return ResponseEntity.ok(cleanupService.purgeUser(userId));
    }
}
