package com.adlanda.resumetailor.controller;

import com.adlanda.resumetailor.exception.AiServiceUnavailableException;
import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.InvalidStatusTransitionException;
import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.adlanda.resumetailor.exception.NoBulletsAvailableException;
import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.exception.ResumeTailorException;
import com.adlanda.resumetailor.exception.TailoringCancelledException;
import com.adlanda.resumetailor.exception.ValidationException;
import com.adlanda.resumetailor.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain and pipeline failures onto HTTP responses.
 *
 * Tailoring failures caused by the AI backend always render the same message;
 * backend error text only reaches the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TAILORING_FAILED_MESSAGE = "could not generate tailored resume, please retry";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        Map<String, String> fields = new LinkedHashMap<>();
        ex.getFieldErrors().forEach(e -> fields.putIfAbsent(e.field(), e.message()));
        return validationResponse(ex.getCode().name(), ex.getMessage(), fields, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex,
                                                           HttpServletRequest request) {
        Map<String, String> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(e -> fields.putIfAbsent(
                e.getField(), e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid value"));
        return validationResponse(ErrorCode.VALIDATION_ERROR.name(), "invalid request body", fields, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        String message = ex instanceof MissingRequestHeaderException missing
                ? "missing header " + missing.getHeaderName()
                : "malformed request body";
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR.name(), message, request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getCode().name(), ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleStatus(InvalidStatusTransitionException ex,
                                                      HttpServletRequest request) {
        HttpStatus status = ex.getCode() == ErrorCode.INVALID_RESUME_STATUS
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.CONFLICT;
        return respond(status, ex.getCode().name(), ex.getMessage(), request);
    }

    @ExceptionHandler(NoBulletsAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNoBullets(NoBulletsAvailableException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode().name(), ex.getMessage(), request);
    }

    @ExceptionHandler({
            AiServiceUnavailableException.class,
            MalformedAiResponseException.class,
            TailoringCancelledException.class
    })
    public ResponseEntity<ErrorResponse> handleTailoringFailure(ResumeTailorException ex, HttpServletRequest request) {
        log.error("Tailoring failed [{}]: {}", ex.getCode(), ex.getMessage(), ex);
        HttpStatus status = ex instanceof MalformedAiResponseException
                ? HttpStatus.BAD_GATEWAY
                : HttpStatus.SERVICE_UNAVAILABLE;
        return respond(status, ex.getCode().name(), TAILORING_FAILED_MESSAGE, request);
    }

    private ResponseEntity<ErrorResponse> validationResponse(String code, String message,
                                                             Map<String, String> fields,
                                                             HttpServletRequest request) {
        log.warn("Validation failed: {}", fields);
        ErrorResponse body = new ErrorResponse(
                Instant.now(), HttpStatus.BAD_REQUEST.value(), code, message, request.getRequestURI(), fields);
        return ResponseEntity.badRequest().body(body);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                         HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), code, message, request.getRequestURI()));
    }
}
