package com.cario.docintel.app.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Structured record produced by parsing one document's text.
 *
 * <p>{@code fields} keeps the document table's field order and maps absent fields to {@code
 * null}. Parsing the same text against the same table always yields an equal result.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionResult {

  DocumentType documentType;

  /** Field name to typed value (String, LocalDate, Long cents, SignalEvidence, List) or null. */
  Map<String, Object> fields;

  Map<String, FieldMatch> extractionDetails;

  /** Confidence in [0, 1]. */
  double confidence;

  BusinessFlag flag;

  /** Whether the gate granted {@link #flag}. */
  boolean flagValue;

  /** Terminal parse state. */
  ParseState state;

  int fieldsFound;

  /** Present only when the text came from the OCR pipeline. */
  OcrSummary ocr;

  public Object field(String name) {
    return fields.get(name);
  }
}
