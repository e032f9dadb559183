package com.cario.docintel.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Error body returned by the REST API. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

  /** HTTP status code. */
  private int status;

  /** Short machine-readable code, e.g. {@code VALIDATION}, {@code OCR_FAILED}. */
  private String error;

  /** Human-readable detail. */
  private String message;

  private Instant timestamp;
}
