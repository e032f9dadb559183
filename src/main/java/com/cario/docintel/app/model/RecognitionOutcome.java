package com.cario.docintel.app.model;

import java.util.List;
import lombok.Value;

/**
 * What the failover service hands back: the chosen result plus how it got there. Warnings are
 * set when a result is returned below the confidence threshold.
 */
@Value
public class RecognitionOutcome {

  RecognitionResult result;

  RecognitionRoute route;

  List<String> warnings;

  List<ProviderAttempt> attempts;

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
