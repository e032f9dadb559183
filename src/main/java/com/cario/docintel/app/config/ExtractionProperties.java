package com.cario.docintel.app.config;

import com.cario.docintel.app.model.DocumentType;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings for the verification gates ({@code extraction.*}). */
@Data
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

  /** Expirations must fall strictly after today plus this many days to pass the gate. */
  private int minExpirationDays = 30;

  /** Per-type flag thresholds; types not listed keep their built-in defaults. */
  private Map<DocumentType, Double> thresholds = new EnumMap<>(DocumentType.class);

  public double thresholdFor(DocumentType type) {
    Double configured = thresholds.get(type);
    return configured == null ? type.getDefaultThreshold() : configured;
  }
}
