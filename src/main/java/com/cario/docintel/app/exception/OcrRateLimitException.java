package com.cario.docintel.app.exception;

/** Provider refused the request with HTTP 429. */
public class OcrRateLimitException extends OcrException {

  public OcrRateLimitException(String provider, String message) {
    super(OcrErrorKind.RATE_LIMIT, provider, message);
  }

  public OcrRateLimitException(String provider, String message, Throwable cause) {
    super(OcrErrorKind.RATE_LIMIT, provider, message, cause);
  }
}
