package com.wayfinder.storefront.controller;

import com.wayfinder.storefront.model.api.ApiError;
import com.wayfinder.storefront.vision.InvalidImageException;
import com.wayfinder.storefront.vision.VisionException;
import com.wayfinder.storefront.vision.VisionNotConfiguredException;
import com.wayfinder.storefront.vision.VisionWarmingUpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", "));
        return failure(HttpStatus.BAD_REQUEST, fields.isEmpty() ? "Validation failed" : "Validation failed: " + fields);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleInput(ServerWebInputException ex) {
        String reason = ex.getReason();
        return failure(HttpStatus.BAD_REQUEST, reason == null || reason.isBlank() ? "Invalid request" : reason);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        String message = ex.getReason();
        if (message == null || message.isBlank()) {
            HttpStatus httpStatus = HttpStatus.resolve(statusCode.value());
            message = httpStatus != null ? httpStatus.getReasonPhrase() : "Request failed";
        }
        return ResponseEntity.status(statusCode).body(ApiError.of(statusCode.value(), message));
    }

    @ExceptionHandler(VisionNotConfiguredException.class)
    public ResponseEntity<ApiError> handleVisionNotConfigured(VisionNotConfiguredException ex) {
        return failure(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(VisionWarmingUpException.class)
    public ResponseEntity<ApiError> handleVisionWarmingUp(VisionWarmingUpException ex) {
        return failure(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(InvalidImageException.class)
    public ResponseEntity<ApiError> handleInvalidImage(InvalidImageException ex) {
        return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(VisionException.class)
    public ResponseEntity<ApiError> handleVision(VisionException ex) {
        log.warn("Vision request failed: {}", ex.getMessage());
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Vision analysis failed: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ApiError> failure(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiError.of(status.value(), message));
    }
}
