package com.flamingo.ai.juris.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(UnsupportedFormatException.class)
  public ResponseEntity<ApiError> handleUnsupportedFormat(
      UnsupportedFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_format");
    String errorId = generateErrorId();
    log.warn(
        "Unsupported format [{}]: file={}, format={}", errorId, ex.getFileName(), ex.getFormat());

    return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.UNSUPPORTED_FORMAT)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ExtractionTooShortException.class)
  public ResponseEntity<ApiError> handleExtractionTooShort(
      ExtractionTooShortException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_too_short");
    String errorId = generateErrorId();
    log.warn(
        "Extraction too short [{}]: file={}, {} chars",
        errorId,
        ex.getFileName(),
        ex.getExtractedLength());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTRACTION_TOO_SHORT)
                .message(ex.getUserMessage())
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ContentProcessingException.class)
  public ResponseEntity<ApiError> handleContentProcessing(
      ContentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("content_processing");
    String errorId = generateErrorId();
    log.error("Content processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTRACTION_FAILED)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
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
