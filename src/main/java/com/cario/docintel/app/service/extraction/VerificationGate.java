package com.cario.docintel.app.service.extraction;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/** Grants a document's flag: confidence at or above threshold AND the hard requirement holds. */
public class VerificationGate {

  private final Clock clock;

  public VerificationGate(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  public boolean evaluate(DocumentSpec spec, FieldExtraction fields, double confidence) {
    boolean requirementMet = spec.getRequirement().test(fields, LocalDate.now(clock));
    return confidence >= spec.getThreshold() && requirementMet;
  }
}
