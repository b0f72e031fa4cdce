package com.eventhub.rsvp.controller;

import com.eventhub.rsvp.dto.request.JoinEventRequest;
import com.eventhub.rsvp.dto.response.JoinResponse;
import com.eventhub.rsvp.dto.response.LeaveResponse;
import com.eventhub.rsvp.dto.response.ReservationResponse;
import com.eventhub.rsvp.dto.response.ReservationStatusResponse;
import com.eventhub.rsvp.entity.ReservationStatus;
import com.eventhub.rsvp.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "Joining and leaving capacity-limited events")
public class ReservationController {

    static final String USER_HEADER = "X-User-Id";

    private final ReservationService reservationService;

    @PostMapping("/events/{eventId}/reservations")
    @Operation(summary = "Join an event", description = "Takes one slot if the event is open and not full. "
        + "At most one confirmed reservation per user and event.")
    @ApiResponse(responseCode = "201", description = "Reservation confirmed")
    @ApiResponse(responseCode = "401", description = "Missing X-User-Id header")
    @ApiResponse(responseCode = "404", description = "Event not found")
    @ApiResponse(responseCode = "409", description = "Event full, closed, or already joined")
    public ResponseEntity<JoinResponse> join(@PathVariable Long eventId,
                                             @RequestHeader(USER_HEADER) Long userId,
                                             @Valid @RequestBody(required = false) JoinEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reservationService.join(eventId, userId, request));
    }

    @DeleteMapping("/events/{eventId}/reservations")
    @Operation(summary = "Leave an event", description = "Cancels the caller's confirmed reservation. "
        + "The reservation record is retained for history.")
    @ApiResponse(responseCode = "200", description = "Reservation cancelled")
    @ApiResponse(responseCode = "404", description = "No confirmed reservation")
    @ApiResponse(responseCode = "503", description = "Cancelled, attendee count pending reconciliation; safe to retry")
    public ResponseEntity<LeaveResponse> leave(@PathVariable Long eventId,
                                               @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(reservationService.leave(eventId, userId));
    }

    @GetMapping("/events/{eventId}/reservations/status")
    @Operation(summary = "Check whether the caller holds a confirmed reservation")
    public ResponseEntity<ReservationStatusResponse> status(@PathVariable Long eventId,
                                                            @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(new ReservationStatusResponse(
            eventId, userId, reservationService.hasConfirmedReservation(eventId, userId)));
    }

    @GetMapping("/events/{eventId}/attendees")
    @Operation(summary = "List attendees", description = "Confirmed reservations in the order they were made.")
    @ApiResponse(responseCode = "200", description = "Attendee list")
    @ApiResponse(responseCode = "404", description = "Event not found")
    public ResponseEntity<List<ReservationResponse>> attendees(@PathVariable Long eventId) {
        return ResponseEntity.ok(reservationService.listAttendees(eventId));
    }

    @GetMapping("/reservations/me")
    @Operation(summary = "List the caller's reservations", description = "Newest first.")
    public ResponseEntity<List<ReservationResponse>> mine(
            @RequestHeader(USER_HEADER) Long userId,
            @Parameter(description = "Filter by status (CONFIRMED, CANCELLED); defaults to CONFIRMED")
            @RequestParam(required = false) ReservationStatus status) {
        return ResponseEntity.ok(reservationService.listForUser(userId, status));
    }
}
