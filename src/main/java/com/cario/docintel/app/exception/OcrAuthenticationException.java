package com.cario.docintel.app.exception;

/** Credential rejected by the provider (HTTP 401). Never retried against the same credential. */
public class OcrAuthenticationException extends OcrException {

  public OcrAuthenticationException(String provider, String message) {
    super(OcrErrorKind.AUTHENTICATION, provider, message);
  }

  public OcrAuthenticationException(String provider, String message, Throwable cause) {
    super(OcrErrorKind.AUTHENTICATION, provider, message, cause);
  }
}
