package com.cario.docintel.app.exception;

/** Polling ran out of attempts or deadline, or a single HTTP call timed out. */
public class OcrTimeoutException extends OcrException {

  public OcrTimeoutException(String provider, String message) {
    super(OcrErrorKind.TIMEOUT, provider, message);
  }

  public OcrTimeoutException(String provider, String message, Throwable cause) {
    super(OcrErrorKind.TIMEOUT, provider, message, cause);
  }
}
