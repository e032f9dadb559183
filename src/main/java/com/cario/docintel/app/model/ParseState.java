package com.cario.docintel.app.model;

/**
 * Parse lifecycle. Every parse ends in exactly one of {@link #VERIFIED} or {@link #REJECTED};
 * the intermediate states are logged as the parse advances.
 */
public enum ParseState {
  RECEIVED,
  TEXT_NORMALIZED,
  FIELDS_EXTRACTED,
  SCORED,
  VERIFIED,
  REJECTED;

  public boolean isTerminal() {
    return this == VERIFIED || this == REJECTED;
  }
}
