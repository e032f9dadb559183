package com.cario.docintel.app.service.extraction;

/** How a field chooses its value among pattern matches. */
public enum SelectionMode {
  /** Patterns in table order, occurrences in text order; the first accepted value wins. */
  FIRST_MATCH,
  /** Every accepted match is scored; the highest score wins, ties go to the earlier match. */
  BEST_CANDIDATE,
  /** Counts distinct patterns that matched; present once the minimum is reached. */
  SIGNAL_COUNT,
  /** Every accepted value, de-duplicated, in encounter order. */
  COLLECT
}
