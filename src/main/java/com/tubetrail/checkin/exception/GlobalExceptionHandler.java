package com.tubetrail.checkin.exception;

import com.tubetrail.checkin.dto.CheckinErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Global exception handler for the application.
 * Catches exceptions and returns the shared error envelope.
 *
 * Messages here are shown to users: no internal terms, no exception text.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String CODE_VALIDATION = "validation_failed";
    public static final String CODE_INVALID_COORDINATES = "invalid_coordinates";
    public static final String CODE_INVALID_OCR_RESULT = "invalid_ocr_result";
    public static final String CODE_STORE_UNAVAILABLE = "store_unavailable";
    public static final String CODE_SERVER_ERROR = "server_error";

    /**
     * Handle validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CheckinErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .sorted()
                .collect(Collectors.joining("; "));
        log.info("Validation error: {}", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(CheckinErrorResponse.of(CODE_VALIDATION, fields));
    }

    /**
     * Unreadable JSON, including coordinates that are not numbers.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CheckinErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(CheckinErrorResponse.of(CODE_VALIDATION, "The request could not be read."));
    }

    @ExceptionHandler(InvalidCoordinatesException.class)
    public ResponseEntity<CheckinErrorResponse> handleInvalidCoordinates(InvalidCoordinatesException ex) {
        log.info("Invalid coordinates: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(CheckinErrorResponse.of(CODE_INVALID_COORDINATES, "The location we received isn't valid."));
    }

    @ExceptionHandler(InvalidPhotoReadException.class)
    public ResponseEntity<CheckinErrorResponse> handleInvalidPhotoRead(InvalidPhotoReadException ex) {
        log.info("Invalid photo read: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(CheckinErrorResponse.of(CODE_INVALID_OCR_RESULT, "The photo check result we received isn't valid."));
    }

    /**
     * Store outages, lock waits and transaction timeouts. Safe to retry.
     */
    @ExceptionHandler({
            VisitStoreUnavailableException.class,
            PessimisticLockingFailureException.class,
            CannotAcquireLockException.class,
            QueryTimeoutException.class,
            DataAccessResourceFailureException.class,
            TransactionException.class
    })
    public ResponseEntity<CheckinErrorResponse> handleStoreUnavailable(RuntimeException ex) {
        log.error("Store unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(CheckinErrorResponse.retryable(CODE_STORE_UNAVAILABLE,
                        "We couldn't save your check-in right now. Please try again."));
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<CheckinErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CheckinErrorResponse.of(CODE_SERVER_ERROR, "Something went wrong. Please try again."));
    }

}
