package com.cario.docintel.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Settings for the OCR providers, the poll loop and the failover chain ({@code ocr.*}). */
@Data
@Validated
@ConfigurationProperties(prefix = "ocr")
public class OcrProperties {

  @Valid private Provider datalab = new Provider();

  @Valid private Marker marker = new Marker();

  @Valid private Polling polling = new Polling();

  @Valid private Failover failover = new Failover();

  @Data
  public static class Provider {
    /** Service root; endpoints are appended ({@code /ocr}, {@code /marker}). */
    @NotBlank private String baseUrl = "https://www.datalab.to/api/v1";

    /** Sent as {@code X-Api-Key}. */
    private String apiKey = "";

    /** Upload ceiling enforced before any network call. */
    @Min(1)
    private long maxFileSizeBytes = 200L * 1024 * 1024;

    /** Timeout for a single submit or poll HTTP call. */
    private Duration requestTimeout = Duration.ofSeconds(60);
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  @ToString(callSuper = true)
  public static class Marker extends Provider {
    @Valid private MarkerConfidence confidence = new MarkerConfidence();
  }

  /**
   * Constants for Marker's completeness-based confidence estimate. Marker reports no native
   * confidence, so these are heuristics awaiting recalibration against labeled documents.
   */
  @Data
  public static class MarkerConfidence {
    /** Estimate when the response has no page structure to measure. */
    private double base = 0.80;

    /** Added to {@link #base} when the response has children but no measurable blocks. */
    private double structureBonus = 0.10;

    /** Estimate at zero completeness. */
    private double rangeFloor = 0.70;

    /** Added at full completeness. */
    private double rangeSpan = 0.25;

    private double min = 0.50;

    private double max = 0.95;
  }

  @Data
  public static class Polling {
    @Min(1)
    private int maxAttempts = 300;

    private Duration initialInterval = Duration.ofSeconds(2);

    @DecimalMin("1.0")
    private double backoffMultiplier = 1.5;

    private Duration maxInterval = Duration.ofSeconds(10);

    /** Default overall deadline for one recognize call when the caller gives none. */
    private Duration overallDeadline = Duration.ofMinutes(10);
  }

  @Data
  public static class Failover {
    private boolean enabled = true;

    /** Results at or above this average confidence are accepted from the primary. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.5;

    /** Put the structure-oriented provider first for multi-page document formats. */
    private boolean preferStructureForDocuments = false;

    /**
     * Skip the alternate after an authentication error when both providers send the same key.
     * Off by default: the alternate is tried on every primary error.
     */
    private boolean failFastOnSharedCredential = false;
  }
}
