package com.cario.docintel.app.model;

import com.cario.docintel.app.exception.OcrErrorKind;
import lombok.Value;

/** Audit record of one provider attempt within a recognize call. */
@Value
public class ProviderAttempt {

  String provider;

  boolean succeeded;

  /** Average confidence when the attempt succeeded, else null. */
  Double confidence;

  /** Error kind when the attempt failed, else null. */
  OcrErrorKind errorKind;

  String errorMessage;

  public static ProviderAttempt success(String provider, double confidence) {
    return new ProviderAttempt(provider, true, confidence, null, null);
  }

  public static ProviderAttempt failure(String provider, OcrErrorKind kind, String message) {
    return new ProviderAttempt(provider, false, null, kind, message);
  }
}
