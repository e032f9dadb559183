package com.cario.docintel.app.exception;

/**
 * Local precondition violation (empty file, size ceiling, unsupported MIME type, too many
 * language hints). Raised before any network call and surfaced to the caller unchanged.
 */
public class OcrValidationException extends OcrException {

  public OcrValidationException(String provider, String message) {
    super(OcrErrorKind.VALIDATION, provider, message);
  }
}
