package com.flamingo.ai.edigrammar.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SourceUnreadableException.class)
  public ResponseEntity<ApiError> handleSourceUnreadable(
      SourceUnreadableException ex, HttpServletRequest request) {

    incrementErrorCounter("source_unreadable");
    String errorId = generateErrorId();
    log.error("Unreadable source [{}] {}: {}", errorId, ex.getDocumentName(), ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.SOURCE_UNREADABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(NoSegmentsFoundException.class)
  public ResponseEntity<ApiError> handleNoSegmentsFound(
      NoSegmentsFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("no_segments_found");
    String errorId = generateErrorId();
    log.warn("No segments found [{}]: {}", errorId, ex.getDocumentName());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.NO_SEGMENTS_FOUND,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<ApiError> handleMissingPart(
      MissingServletRequestPartException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing request part [{}]: {}", errorId, ex.getRequestPartName());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MISSING_FILE,
        "Request part '" + ex.getRequestPartName() + "' is required",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
