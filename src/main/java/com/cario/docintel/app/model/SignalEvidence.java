package com.cario.docintel.app.model;

import java.util.List;
import lombok.Value;

/** Corroborating indicators found for a signal-count field (signatures, confirmations). */
@Value
public class SignalEvidence {

  /** Number of distinct indicator patterns that matched. */
  int count;

  /** Indexes of the matching patterns, ascending. */
  List<Integer> patternIndexes;

  /** First matched snippet per indicator, in pattern order. */
  List<String> snippets;
}
