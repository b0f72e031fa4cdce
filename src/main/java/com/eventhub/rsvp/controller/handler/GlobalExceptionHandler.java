package com.eventhub.rsvp.controller.handler;

import com.eventhub.rsvp.dto.response.ErrorResponse;
import com.eventhub.rsvp.exception.AlreadyReservedException;
import com.eventhub.rsvp.exception.CapacityBelowAttendeesException;
import com.eventhub.rsvp.exception.CapacityExceededException;
import com.eventhub.rsvp.exception.EventClosedException;
import com.eventhub.rsvp.exception.ReconciliationRequiredException;
import com.eventhub.rsvp.exception.ResourceNotFoundException;
import com.eventhub.rsvp.exception.UnauthorizedOrganizerException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex,
                                                        HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(CapacityExceededException ex,
                                                                HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(AlreadyReservedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyReserved(AlreadyReservedException ex,
                                                               HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(EventClosedException.class)
    public ResponseEntity<ErrorResponse> handleEventClosed(EventClosedException ex,
                                                           HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedOrganizerException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorizedOrganizer(UnauthorizedOrganizerException ex,
                                                                     HttpServletRequest request) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(CapacityBelowAttendeesException.class)
    public ResponseEntity<ErrorResponse> handleCapacityBelowAttendees(CapacityBelowAttendeesException ex,
                                                                      HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(ReconciliationRequiredException.class)
    public ResponseEntity<ErrorResponse> handleReconciliationRequired(ReconciliationRequiredException ex,
                                                                      HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex,
                                                             HttpServletRequest request) {
        return error(HttpStatus.UNAUTHORIZED, "Missing required header '" + ex.getHeaderName() + "'", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        return ResponseEntity.badRequest().body(ErrorResponse.invalidRequest(request.getRequestURI(), fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String msg = String.format("Invalid value '%s' for parameter '%s'",
                                   ex.getValue(), ex.getName());
        return error(HttpStatus.BAD_REQUEST, msg, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        String constraintName = extractConstraintName(ex);
        if ("uq_reservations_confirmed_pair".equals(constraintName)) {
            return error(HttpStatus.CONFLICT, "User already has a confirmed reservation for this event", request);
        }
        if ("chk_events_attendees".equals(constraintName)) {
            return error(HttpStatus.CONFLICT, "Event capacity would be exceeded", request);
        }
        log.warn("Data integrity violation on {} (constraint {})", request.getRequestURI(), constraintName);
        return error(HttpStatus.BAD_REQUEST, "Data integrity violation", request);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "Resource was modified by another request. Please retry.", request);
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleLockTimeout(PessimisticLockingFailureException ex,
                                                           HttpServletRequest request) {
        log.warn("Lock not acquired on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.CONFLICT, "Resource is busy. Please retry.", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message, request.getRequestURI()));
    }

    private String extractConstraintName(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve) {
            return cve.getConstraintName();
        }
        return null;
    }
}
