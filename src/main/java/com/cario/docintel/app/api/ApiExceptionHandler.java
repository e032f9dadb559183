package com.cario.docintel.app.api;

import com.cario.docintel.app.exception.OcrValidationException;
import com.cario.docintel.app.exception.UnifiedRecognitionException;
import com.cario.docintel.app.model.ApiError;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Maps service exceptions onto HTTP responses with an {@link ApiError} body. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  /** File rejected before any provider call: empty, too large, wrong type, too many languages. */
  @ExceptionHandler(OcrValidationException.class)
  public ResponseEntity<ApiError> handleOcrValidation(OcrValidationException ex) {
    log.warn("api.error kind=validation provider={} msg={}", ex.getProvider(), ex.getMessage());
    return body(HttpStatus.BAD_REQUEST, "VALIDATION", ex.getMessage());
  }

  /** Every provider failed. */
  @ExceptionHandler(UnifiedRecognitionException.class)
  public ResponseEntity<ApiError> handleRecognitionFailure(UnifiedRecognitionException ex) {
    log.error("api.error kind=ocr_failed msg={}", ex.getMessage());
    return body(HttpStatus.BAD_GATEWAY, "OCR_FAILED", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
    String errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("api.error kind=bad_body msg={}", errors);
    return body(HttpStatus.BAD_REQUEST, "VALIDATION", errors);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex) {
    log.warn("api.error kind=constraint msg={}", ex.getMessage());
    return body(HttpStatus.BAD_REQUEST, "VALIDATION", ex.getMessage());
  }

  /** Request parameter constraints ({@code languages}, {@code maxPages}). */
  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiError> handleInvalidParameters(HandlerMethodValidationException ex) {
    String errors =
        ex.getAllValidationResults().stream()
            .flatMap(
                result ->
                    result.getResolvableErrors().stream()
                        .map(
                            error ->
                                result.getMethodParameter().getParameterName()
                                    + ": "
                                    + error.getDefaultMessage()))
            .collect(Collectors.joining(", "));
    log.warn("api.error kind=bad_params msg={}", errors);
    return body(HttpStatus.BAD_REQUEST, "VALIDATION", errors);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
    log.warn("api.error kind=too_large max={}", ex.getMaxUploadSize());
    return body(HttpStatus.PAYLOAD_TOO_LARGE, "VALIDATION", ex.getMessage());
  }

  /** Unknown document type and similar bad input. */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("api.error kind=bad_request msg={}", ex.getMessage());
    return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
  }

  private static ResponseEntity<ApiError> body(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .timestamp(Instant.now())
                .build());
  }
}
