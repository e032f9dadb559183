package com.cario.docintel.app.model;

import java.util.List;
import lombok.Value;

/** Audit detail for one extracted field: which pattern produced it and from what raw text. */
@Value
public class FieldMatch {

  String fieldName;

  /** Index of the winning pattern in the field's table, or null when absent. */
  Integer patternIndex;

  /** Raw captured text before parsing, or null when absent. */
  String rawText;

  /** Matches the parser accepted across all patterns (candidates, signals or collected values). */
  int acceptedMatches;

  /** Patterns that produced at least one accepted match, ascending. */
  List<Integer> matchedPatterns;

  public static FieldMatch absent(String fieldName) {
    return new FieldMatch(fieldName, null, null, 0, List.of());
  }

  public boolean isPresent() {
    return patternIndex != null;
  }
}
