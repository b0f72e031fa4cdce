package com.eventhub.rsvp.controller;

import com.eventhub.rsvp.dto.request.CreateEventRequest;
import com.eventhub.rsvp.dto.request.UpdateEventRequest;
import com.eventhub.rsvp.dto.response.EventResponse;
import com.eventhub.rsvp.service.EventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.eventhub.rsvp.controller.ReservationController.USER_HEADER;

@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Organizer operations on capacity-limited events")
public class EventController {

    private final EventService eventService;

    @PostMapping
    @Operation(summary = "Create an event", description = "The caller becomes the organizer.")
    @ApiResponse(responseCode = "201", description = "Event created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ResponseEntity<EventResponse> create(@RequestHeader(USER_HEADER) Long userId,
                                                @Valid @RequestBody CreateEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.create(userId, request));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get event by ID", description = "Status is derived from the schedule at read time.")
    @ApiResponse(responseCode = "200", description = "Event found")
    @ApiResponse(responseCode = "404", description = "Event not found")
    public ResponseEntity<EventResponse> findById(@PathVariable Long id,
                                                  @RequestHeader(value = USER_HEADER, required = false) Long userId) {
        return ResponseEntity.ok(eventService.findById(id, userId));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update an event", description = "Partial update, organizer only. "
        + "Capacity cannot drop below the current attendee count.")
    @ApiResponse(responseCode = "200", description = "Event updated")
    @ApiResponse(responseCode = "400", description = "Validation error or capacity below attendees")
    @ApiResponse(responseCode = "403", description = "Caller is not the organizer")
    @ApiResponse(responseCode = "409", description = "Event changed concurrently; retry")
    public ResponseEntity<EventResponse> update(@PathVariable Long id,
                                                @RequestHeader(USER_HEADER) Long userId,
                                                @Valid @RequestBody UpdateEventRequest request) {
        return ResponseEntity.ok(eventService.update(id, userId, request));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel an event", description = "Permanent. Reservations are kept as history.")
    @ApiResponse(responseCode = "200", description = "Event cancelled")
    @ApiResponse(responseCode = "403", description = "Caller is not the organizer")
    public ResponseEntity<EventResponse> cancel(@PathVariable Long id,
                                                @RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(eventService.cancel(id, userId));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an event", description = "Deletes all of its reservations as well.")
    @ApiResponse(responseCode = "204", description = "Event deleted")
    @ApiResponse(responseCode = "403", description = "Caller is not the organizer")
    @ApiResponse(responseCode = "404", description = "Event not found")
    public ResponseEntity<Void> delete(@PathVariable Long id,
                                       @RequestHeader(USER_HEADER) Long userId) {
        eventService.delete(id, userId);
        return ResponseEntity.noContent().build();
    }
}
