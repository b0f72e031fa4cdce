package com.eventhub.rsvp.integration;

import com.eventhub.rsvp.dto.request.JoinEventRequest;
import com.eventhub.rsvp.dto.response.ErrorResponse;
import com.eventhub.rsvp.dto.response.JoinResponse;
import com.eventhub.rsvp.dto.response.LeaveResponse;
import com.eventhub.rsvp.dto.response.ReservationResponse;
import com.eventhub.rsvp.dto.response.ReservationStatusResponse;
import com.eventhub.rsvp.entity.ReservationStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class ReservationIntegrationTest extends AbstractIntegrationTest {

    @Test
    void joinLeaveAndJoinAgain_keepsLedgersInStep() {
        Long eventId = createEvent("Spring Meetup", 5);

        // JOIN
        ResponseEntity<JoinResponse> joined = exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST,
            new JoinEventRequest("Vegetarian meal"), JoinResponse.class);

        assertThat(joined.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(joined.getBody().availableSpots()).isEqualTo(4);
        ReservationResponse reservation = joined.getBody().reservation();
        assertThat(reservation.eventId()).isEqualTo(eventId);
        assertThat(reservation.eventTitle()).isEqualTo("Spring Meetup");
        assertThat(reservation.userId()).isEqualTo(42L);
        assertThat(reservation.status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(reservation.notes()).isEqualTo("Vegetarian meal");
        assertThat(reservation.cancelledAt()).isNull();
        assertLedgersAgree(eventId);

        // LEAVE
        ResponseEntity<LeaveResponse> left =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);
        assertThat(left.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(left.getBody().availableSpots()).isEqualTo(5);
        assertThat(storedAttendeeCount(eventId)).isZero();
        assertLedgersAgree(eventId);

        // JOIN again after leaving
        ResponseEntity<JoinResponse> rejoined =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        assertThat(rejoined.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(rejoined.getBody().reservation().id()).isNotEqualTo(reservation.id());
        assertThat(storedAttendeeCount(eventId)).isEqualTo(1);
        assertLedgersAgree(eventId);
    }

    @Test
    void join_twice_returns409AndLeavesCountUnchanged() {
        Long eventId = createEvent("Duplicate Join", 5);
        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);

        ResponseEntity<ErrorResponse> response =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("already has a confirmed reservation");
        assertThat(storedAttendeeCount(eventId)).isEqualTo(1);
        assertLedgersAgree(eventId);
    }

    @Test
    void join_againOnFullEvent_reportsExistingReservationNotCapacity() {
        Long eventId = createEvent("Single Seat", 1);
        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);

        ResponseEntity<ErrorResponse> response =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("already has a confirmed reservation");
        assertThat(storedAttendeeCount(eventId)).isEqualTo(1);
        assertLedgersAgree(eventId);
    }

    @Test
    void join_fullEvent_returns409() {
        Long eventId = createEvent("Tiny Workshop", 1);
        exchangeAs(1L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);

        ResponseEntity<ErrorResponse> response =
            exchangeAs(2L, reservationsUrl(eventId), HttpMethod.POST, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).contains("is full");
        assertThat(storedAttendeeCount(eventId)).isEqualTo(1);
    }

    @Test
    void join_nonExistentEvent_returns404() {
        ResponseEntity<ErrorResponse> response =
            exchangeAs(42L, reservationsUrl(99999L), HttpMethod.POST, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void join_notesTooLong_returns400() {
        Long eventId = createEvent("Validation", 5);

        ResponseEntity<ErrorResponse> response = exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST,
            new JoinEventRequest("x".repeat(501)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors())
            .extracting(ErrorResponse.FieldError::field)
            .containsExactly("notes");
        assertThat(storedAttendeeCount(eventId)).isZero();
    }

    @Test
    void join_withoutUserHeader_returns401() {
        Long eventId = createEvent("Anonymous", 5);

        ResponseEntity<ErrorResponse> response =
            restTemplate.postForEntity(reservationsUrl(eventId), null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(storedAttendeeCount(eventId)).isZero();
    }

    @Test
    void leave_withoutReservation_returns404AndLeavesCountUnchanged() {
        Long eventId = createEvent("Leave Nothing", 5);
        exchangeAs(1L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);

        ResponseEntity<ErrorResponse> response =
            exchangeAs(2L, reservationsUrl(eventId), HttpMethod.DELETE, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).contains("No confirmed reservation");
        assertThat(storedAttendeeCount(eventId)).isEqualTo(1);
    }

    @Test
    void leave_twice_secondReturns404() {
        Long eventId = createEvent("Leave Twice", 5);
        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);

        ResponseEntity<ErrorResponse> response =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(storedAttendeeCount(eventId)).isZero();
    }

    @Test
    void leave_whenCounterCannotBeReleased_returns503ThenRetrySucceeds() {
        Long eventId = createEvent("Drift On Leave", 5);
        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        jdbcTemplate.update("UPDATE events SET current_attendees = 0 WHERE id = ?", eventId);

        ResponseEntity<ErrorResponse> first =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, ErrorResponse.class);

        assertThat(first.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(first.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("5");
        assertThat(confirmedReservationCount(eventId)).isZero();
        assertThat(jdbcTemplate.queryForObject(
            "SELECT reconciliation_pending FROM events WHERE id = ?", Boolean.class, eventId)).isTrue();

        ResponseEntity<LeaveResponse> retry =
            exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);

        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(retry.getBody().availableSpots()).isEqualTo(5);
        assertLedgersAgree(eventId);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT reconciliation_pending FROM events WHERE id = ?", Boolean.class, eventId)).isFalse();
    }

    @Test
    void leave_byEarlierLeaverWhileAnotherLeaveIsPending_returns404() {
        Long eventId = createEvent("Pending Neighbour", 5);
        exchangeAs(7L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(7L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);
        exchangeAs(8L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        jdbcTemplate.update("UPDATE events SET current_attendees = 0 WHERE id = ?", eventId);
        assertThat(exchangeAs(8L, reservationsUrl(eventId), HttpMethod.DELETE, null, ErrorResponse.class)
            .getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);

        ResponseEntity<ErrorResponse> stale =
            exchangeAs(7L, reservationsUrl(eventId), HttpMethod.DELETE, null, ErrorResponse.class);

        assertThat(stale.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT reconciliation_pending FROM events WHERE id = ?", Boolean.class, eventId)).isTrue();

        ResponseEntity<LeaveResponse> retry =
            exchangeAs(8L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);
        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reservations WHERE event_id = ? AND release_pending", Integer.class, eventId))
            .isZero();
        assertLedgersAgree(eventId);
    }

    @Test
    void status_reflectsJoinAndLeave() {
        Long eventId = createEvent("Status Check", 5);
        String statusUrl = reservationsUrl(eventId) + "/status";

        assertThat(exchangeAs(42L, statusUrl, HttpMethod.GET, null, ReservationStatusResponse.class)
            .getBody().reserved()).isFalse();

        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        assertThat(exchangeAs(42L, statusUrl, HttpMethod.GET, null, ReservationStatusResponse.class)
            .getBody().reserved()).isTrue();

        exchangeAs(42L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);
        assertThat(exchangeAs(42L, statusUrl, HttpMethod.GET, null, ReservationStatusResponse.class)
            .getBody().reserved()).isFalse();
    }

    @Test
    void attendees_listedInReservationOrder() {
        Long eventId = createEvent("Ordered", 5);
        exchangeAs(30L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(10L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(20L, reservationsUrl(eventId), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(10L, reservationsUrl(eventId), HttpMethod.DELETE, null, LeaveResponse.class);

        ResponseEntity<ReservationResponse[]> response = restTemplate.getForEntity(
            EVENTS_URL + "/" + eventId + "/attendees", ReservationResponse[].class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
            .extracting(ReservationResponse::userId)
            .containsExactly(30L, 20L);
    }

    @Test
    void myReservations_filtersByStatus() {
        Long first = createEvent("First", 5);
        Long second = createEvent("Second", 5);
        exchangeAs(42L, reservationsUrl(first), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(42L, reservationsUrl(second), HttpMethod.POST, null, JoinResponse.class);
        exchangeAs(42L, reservationsUrl(first), HttpMethod.DELETE, null, LeaveResponse.class);

        ResponseEntity<ReservationResponse[]> confirmed = exchangeAs(42L, "/api/v1/reservations/me",
            HttpMethod.GET, null, ReservationResponse[].class);
        ResponseEntity<ReservationResponse[]> cancelled = exchangeAs(42L, "/api/v1/reservations/me?status=CANCELLED",
            HttpMethod.GET, null, ReservationResponse[].class);

        assertThat(confirmed.getBody()).extracting(ReservationResponse::eventId).containsExactly(second);
        assertThat(cancelled.getBody()).extracting(ReservationResponse::eventId).containsExactly(first);
        assertThat(cancelled.getBody()[0].cancelledAt()).isNotNull();
    }
}
