package com.cario.docintel.app.model;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Freight document types with their gated flag and default flag threshold. */
@Getter
@RequiredArgsConstructor
public enum DocumentType {
  CDL(BusinessFlag.VERIFIED, 0.90),
  COI(BusinessFlag.VERIFIED, 0.70),
  POD(BusinessFlag.COMPLETED, 0.80),
  AGREEMENT(BusinessFlag.SIGNED, 0.90),
  RATE_CONFIRMATION(BusinessFlag.VERIFIED, 0.80),
  INVOICE(BusinessFlag.VERIFIED, 0.65),
  LUMPER_RECEIPT(BusinessFlag.VERIFIED, 0.35);

  private final BusinessFlag flag;
  private final double defaultThreshold;

  /** Accepts {@code cdl}, {@code rate-confirmation}, {@code RATE_CONFIRMATION}. */
  public static DocumentType fromPath(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("document type is required");
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return DocumentType.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown document type: " + value, e);
    }
  }
}
