package com.demandplanner.exception;

import com.demandplanner.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String TYPE_MISMATCH     = "TYPE_MISMATCH";
    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    static final String INTERNAL_ERROR    = "INTERNAL_ERROR";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.Violation.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .reason(fe.getDefaultMessage())
                .build())
            .toList();

        return send(respond(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_FAILED,
                       "Run request failed validation", request)
            .violations(violations)
            .build());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<ApiError.Violation> violations = ex.getConstraintViolations()
            .stream()
            .map(cv -> ApiError.Violation.builder()
                .field(lastNode(cv.getPropertyPath().toString()))
                .rejectedValue(cv.getInvalidValue())
                .reason(cv.getMessage())
                .build())
            .toList();

        return send(respond(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_FAILED,
                       "Query parameters failed validation", request)
            .violations(violations)
            .build());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return send(respond(HttpStatus.BAD_REQUEST, TYPE_MISMATCH, msg, request).build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return send(respond(HttpStatus.BAD_REQUEST, MALFORMED_REQUEST,
                       "Run request body could not be parsed", request).build());
    }

    @ExceptionHandler(ForecastRunNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            ForecastRunNotFoundException ex, HttpServletRequest request) {
        return send(respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request)
            .runId(ex.getRunId())
            .build());
    }

    @ExceptionHandler(UpstreamDataException.class)
    public ResponseEntity<ApiError> handleUpstream(
            UpstreamDataException ex, HttpServletRequest request) {
        log.error("Upstream data unavailable | dataset={} | error={}", ex.getDataset(), ex.getMessage(), ex);
        return send(respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request)
            .dataset(ex.getDataset())
            .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return send(respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR,
                       "An unexpected error occurred", request).build());
    }

    private ApiError.ApiErrorBuilder respond(
            HttpStatus status, String code, String message, HttpServletRequest request) {
        return ApiError.builder()
            .status(status.value())
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now());
    }

    private static ResponseEntity<ApiError> send(ApiError body) {
        return ResponseEntity.status(body.getStatus()).body(body);
    }

    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }
}
