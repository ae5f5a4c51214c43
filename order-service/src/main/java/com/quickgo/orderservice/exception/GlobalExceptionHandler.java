package com.quickgo.orderservice.exception;

import com.quickgo.common.dto.ErrorResponse;
import com.quickgo.common.dto.ValidationErrorResponse;
import com.quickgo.common.exception.AccessDeniedException;
import com.quickgo.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Maps the domain error taxonomy to HTTP.
 *
 * 400 bad input, 403 not your order/offer, 404 unknown id,
 * 409 races the client should retry or ignore (offer expired, slot taken, stale version),
 * 422 the order's state does not allow the request.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND", request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {
        return build(HttpStatus.FORBIDDEN, ex.getMessage(), "ACCESS_DENIED", request);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            ValidationException ex,
            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR", request);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransitionException(
            InvalidTransitionException ex,
            HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "INVALID_TRANSITION", request);
    }

    @ExceptionHandler(NotCancellableException.class)
    public ResponseEntity<ErrorResponse> handleNotCancellableException(
            NotCancellableException ex,
            HttpServletRequest request) {

        ResponseEntity<ErrorResponse> response =
                build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "NOT_CANCELLABLE", request);
        response.getBody().setCurrentStatus(ex.getCurrentStatus().name());
        return response;
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateException(
            InvalidStateException ex,
            HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "INVALID_STATE", request);
    }

    @ExceptionHandler(OrderNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleOrderNotReadyException(
            OrderNotReadyException ex,
            HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "ORDER_NOT_READY", request);
    }

    @ExceptionHandler(OfferExpiredException.class)
    public ResponseEntity<ErrorResponse> handleOfferExpiredException(
            OfferExpiredException ex,
            HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), "OFFER_EXPIRED", request);
    }

    @ExceptionHandler(AssignmentConflictException.class)
    public ResponseEntity<ErrorResponse> handleAssignmentConflictException(
            AssignmentConflictException ex,
            HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), "ASSIGNMENT_CONFLICT", request);
    }

    @ExceptionHandler(NoDriverAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNoDriverAvailableException(
            NoDriverAvailableException ex,
            HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, ex.getMessage(), "NO_DRIVER_AVAILABLE", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleMethodArgumentNotValidException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, List<String>> validationErrors = new TreeMap<>();
        List<String> globalErrors = new ArrayList<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            validationErrors.computeIfAbsent(fieldError.getField(), field -> new ArrayList<>())
                    .add(fieldError.getDefaultMessage());
        }
        for (ObjectError globalError : ex.getBindingResult().getGlobalErrors()) {
            globalErrors.add(globalError.getDefaultMessage());
        }

        String correlationId = generateCorrelationId();
        log.debug("[{}] Request rejected - Path: {} - Fields: {} - Global: {}",
                correlationId, request.getRequestURI(), validationErrors.keySet(), globalErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .message(ex.getBindingResult().getErrorCount() + " constraint violation(s) in request body")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .globalErrors(globalErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request) {
        String message = ex instanceof IllegalArgumentException
                ? ex.getMessage()
                : "Malformed request";
        return build(HttpStatus.BAD_REQUEST, message, "INVALID_ARGUMENT", request);
    }

    /**
     * Version check failed on an order or driver record: someone else wrote it first.
     * The client should reload and retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        log.warn("Optimistic locking conflict - Path: {} - client should retry", request.getRequestURI());
        return build(HttpStatus.CONFLICT,
                "The record was modified concurrently. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        ResponseEntity<ErrorResponse> response = build(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", request);
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                response.getBody().getCorrelationId(),
                request.getRequestURI(),
                ex.getMessage(),
                ex);
        return response;
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String errorCode,
                                                HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(generateCorrelationId())
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }
}
