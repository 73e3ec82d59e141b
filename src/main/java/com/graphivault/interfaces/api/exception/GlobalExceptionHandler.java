package com.graphivault.interfaces.api.exception;

import com.graphivault.domain.exception.AssetNotFoundException;
import com.graphivault.domain.exception.AssetReferenceException;
import com.graphivault.domain.exception.DuplicateAssetException;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.infrastructure.crypto.EncryptionGatewayException;
import com.graphivault.infrastructure.crypto.GatewayResult;
import com.graphivault.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Maps the store's typed failures to status codes:
 * - duplicate content: 409
 * - tag or annotation on a missing asset: 422
 * - missing asset: 404
 * - storage failure: 503
 * - gateway refusal: 422, gateway unreachable or async timeout: 502, with the gateway outcome
 *
 * Content hashes and file paths are not echoed back in error messages.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.FieldViolation> fieldErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError && !isSecret(fieldName)
                    ? ((FieldError) error).getRejectedValue()
                    : null;
                return new ErrorResponse.FieldViolation(fieldName, error.getDefaultMessage(), rejectedValue);
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = errorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request);
        errorResponse.setFieldErrors(fieldErrors);

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                fieldErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(DuplicateAssetException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(
            DuplicateAssetException ex,
            HttpServletRequest request) {

        if (log.isInfoEnabled()) {
            log.info("Duplicate asset rejected on {}", request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse(HttpStatus.CONFLICT,
            "Conflict", "An asset with the same content already exists", request));
    }

    @ExceptionHandler(AssetReferenceException.class)
    public ResponseEntity<ErrorResponse> handleAssetReference(
            AssetReferenceException ex,
            HttpServletRequest request) {

        return ResponseEntity.unprocessableEntity().body(errorResponse(HttpStatus.UNPROCESSABLE_ENTITY,
            "Unknown Asset", "No asset with id " + ex.getAssetId(), request));
    }

    @ExceptionHandler(AssetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            AssetNotFoundException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse(HttpStatus.NOT_FOUND,
            "Not Found", "Asset not found", request));
    }

    /**
     * Store unavailable, locked past the busy timeout, or failing I/O.
     */
    @ExceptionHandler(VaultStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(
            VaultStorageException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Storage failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse(
            HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
            "The vault store could not complete the operation", request));
    }

    @ExceptionHandler(EncryptionGatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(
            EncryptionGatewayException ex,
            HttpServletRequest request) {

        HttpStatus status = ex.getResult().getOutcome() == GatewayResult.Outcome.FAILURE
            ? HttpStatus.UNPROCESSABLE_ENTITY
            : HttpStatus.BAD_GATEWAY;

        if (log.isWarnEnabled()) {
            log.warn("Encryption gateway {} on {}", ex.getResult().getOutcome(), request.getRequestURI());
        }

        ErrorResponse body = errorResponse(status, "Encryption Gateway", ex.getResult().getReason(), request);
        body.setOutcome(ex.getResult().getOutcome().name());
        return ResponseEntity.status(status).body(body);
    }

    /**
     * The container gave up on an asynchronous request. Only reachable when a
     * container-level async timeout is configured; reported like an unreachable gateway.
     */
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleAsyncTimeout(
            AsyncRequestTimeoutException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Request timed out waiting for a result on {}", request.getRequestURI());
        }

        ErrorResponse body = errorResponse(HttpStatus.BAD_GATEWAY, "Encryption Gateway",
            "No result before the request timed out", request);
        body.setOutcome(GatewayResult.Outcome.TRANSPORT_ERROR.name());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    /**
     * Handle illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse(HttpStatus.BAD_REQUEST,
            "Bad Request", "Invalid request: " + ex.getMessage(), request));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        return ResponseEntity.badRequest().body(errorResponse(HttpStatus.BAD_REQUEST,
            "Bad Request", "Invalid value for parameter " + ex.getName(), request));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", request));
    }

    private static ErrorResponse errorResponse(HttpStatus status, String error, String message,
                                               HttpServletRequest request) {
        return ErrorResponse.builder()
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();
    }

    private static boolean isSecret(String fieldName) {
        return fieldName != null && fieldName.toLowerCase().contains("password");
    }
}
