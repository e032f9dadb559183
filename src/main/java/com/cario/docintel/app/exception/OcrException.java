package com.cario.docintel.app.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by an OCR provider client or the job runner.
 *
 * <p>The failover service catches these and classifies them by {@link #getKind()}; callers of
 * the service only ever see {@link OcrValidationException} and {@link
 * UnifiedRecognitionException}.
 */
@Getter
public abstract class OcrException extends RuntimeException {

  private final OcrErrorKind kind;

  /** Provider that raised the error, or {@code null} when raised before a provider was chosen. */
  private final String provider;

  protected OcrException(OcrErrorKind kind, String provider, String message) {
    super(message);
    this.kind = kind;
    this.provider = provider;
  }

  protected OcrException(OcrErrorKind kind, String provider, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.provider = provider;
  }
}
