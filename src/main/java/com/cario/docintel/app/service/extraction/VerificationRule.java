package com.cario.docintel.app.service.extraction;

import java.time.LocalDate;

/** The hard requirement a document must meet for its flag, independent of confidence. */
@FunctionalInterface
public interface VerificationRule {

  boolean test(FieldExtraction fields, LocalDate today);
}
