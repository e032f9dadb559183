package com.cario.docintel.app.service.extraction;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Static description of how one field is found in text. Immutable once built. */
@Value
@Builder
public class FieldSpec {

  @NonNull String name;

  /** Ordered; earlier patterns take precedence. */
  @Singular List<FieldPattern> patterns;

  /** Maps raw text to a typed value or rejects it. */
  @NonNull ValueParser<?> parser;

  @Builder.Default SelectionMode mode = SelectionMode.FIRST_MATCH;

  /** Required for {@link SelectionMode#BEST_CANDIDATE}. */
  CandidateScorer scorer;

  /** Candidates must score strictly above this to be eligible. */
  @Builder.Default double minimumScore = Double.NEGATIVE_INFINITY;

  /** Signals needed before a {@link SelectionMode#SIGNAL_COUNT} field is present. */
  @Builder.Default int minimumSignals = 1;

  /** Cap on values kept by {@link SelectionMode#COLLECT}. */
  @Builder.Default int maxCollected = 10;

  /** When set, collected values are joined into one string with this separator. */
  String collectJoiner;
}
