package com.cario.docintel.app.exception;

/** Network-level failure talking to the provider (connection refused, reset, DNS). */
public class OcrTransportException extends OcrException {

  public OcrTransportException(String provider, String message) {
    super(OcrErrorKind.TRANSPORT, provider, message);
  }

  public OcrTransportException(String provider, String message, Throwable cause) {
    super(OcrErrorKind.TRANSPORT, provider, message, cause);
  }
}
