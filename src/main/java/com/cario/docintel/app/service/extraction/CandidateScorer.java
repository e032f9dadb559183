package com.cario.docintel.app.service.extraction;

/** Scores a candidate; higher is better. */
@FunctionalInterface
public interface CandidateScorer {

  double score(Candidate candidate);

  /** Earlier patterns score higher; useful alone or as a tie-breaking term. */
  static CandidateScorer precedence() {
    return c -> c.getPatternCount() - c.getPatternIndex();
  }

  /** Largest numeric value wins. */
  static CandidateScorer largestValue() {
    return c -> ((Number) c.getValue()).doubleValue();
  }
}
