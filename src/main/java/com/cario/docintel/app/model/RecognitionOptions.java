package com.cario.docintel.app.model;

import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Per-call knobs for a recognition request. */
@Value
@Builder(toBuilder = true)
public class RecognitionOptions {

  /** Up to four language hints, e.g. {@code en}, {@code es}. */
  @Builder.Default List<String> languages = List.of();

  /** Optional page cap forwarded to the provider. */
  Integer maxPages;

  /** Ask the provider to spend maximal effort (Marker forces OCR on every page). */
  boolean maxEffort;

  /** Skip the primary provider and go straight to the alternate. */
  boolean forceFallback;

  /** Overall deadline for the whole call; falls back to the configured default when null. */
  Duration deadline;

  public static RecognitionOptions defaults() {
    return RecognitionOptions.builder().build();
  }

  public RecognitionOptions withMaxEffort() {
    return toBuilder().maxEffort(true).build();
  }
}
