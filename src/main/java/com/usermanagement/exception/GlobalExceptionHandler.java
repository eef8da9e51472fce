package com.usermanagement.exception;

import com.usermanagement.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle user not found exception
     */
    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException e) {
        log.warn("User not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("User Not Found", e.getMessage()));
    }

    /**
     * Handle duplicate email
     */
    @ExceptionHandler(EmailConflictException.class)
    public ResponseEntity<ErrorResponse> handleEmailConflict(EmailConflictException e) {
        log.warn("Email conflict: {}", e.getEmail());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("User Conflict", e.getMessage()));
    }

    /**
     * Handle missing or invalid bearer token
     */
    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.warn("Unauthorized request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.of("Unauthorized"));
    }

    /**
     * Handle request validation exception
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.computeIfAbsent(error.getField(), field -> new ArrayList<>())
                    .add(error.getDefaultMessage());
        }

        log.warn("Request validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.builder()
                        .error("Validation failed")
                        .detail("One or more validation errors occurred.")
                        .errors(errors)
                        .build());
    }

    /**
     * Handle missing or malformed JSON body
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("Malformed request body."));
    }

    /**
     * A path id that is not a UUID cannot name a user
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Unparseable path value: {}={}", e.getName(), e.getValue());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("User Not Found", "User with id '" + e.getValue() + "' was not found."));
    }

    /**
     * Handle client errors raised by Spring MVC itself (unsupported method or media type,
     * missing parameters) with the status the framework assigns
     */
    @ExceptionHandler({
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeException.class,
            ServletRequestBindingException.class,
            ErrorResponseException.class
    })
    public ResponseEntity<ErrorResponse> handleFrameworkError(Exception e) {
        HttpStatusCode statusCode = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String title = status != null ? status.getReasonPhrase() : "Request failed";

        if (statusCode.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
            return ResponseEntity.status(statusCode)
                    .body(ErrorResponse.of("Internal server error."));
        }

        log.warn("Request rejected with {}: {}", statusCode.value(), e.getMessage());
        return ResponseEntity.status(statusCode)
                .body(ErrorResponse.of(title, e.getMessage()));
    }

    /**
     * Handle static resource not found (e.g., favicon.ico)
     * Do not log as error since this is expected behavior
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("Resource not found"));
    }

    /**
     * Handle all uncaught exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception while processing request: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Internal server error."));
    }
}
