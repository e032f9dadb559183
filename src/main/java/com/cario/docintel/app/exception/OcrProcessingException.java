package com.cario.docintel.app.exception;

/**
 * Provider refused the content, answered with an unexpected non-2xx code, or reported the job as
 * failed.
 */
public class OcrProcessingException extends OcrException {

  public OcrProcessingException(String provider, String message) {
    super(OcrErrorKind.PROCESSING, provider, message);
  }

  public OcrProcessingException(String provider, String message, Throwable cause) {
    super(OcrErrorKind.PROCESSING, provider, message, cause);
  }
}
