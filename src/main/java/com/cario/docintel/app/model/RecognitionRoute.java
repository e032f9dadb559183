package com.cario.docintel.app.model;

/** How the failover service arrived at the returned result. */
public enum RecognitionRoute {
  /** Primary succeeded at or above the confidence threshold. */
  PRIMARY,
  /** Primary was below threshold and failover was disabled or unavailable. */
  LOW_CONFIDENCE_ACCEPTED,
  /** Primary raised an error; the alternate's result was returned. */
  FAILOVER_AFTER_ERROR,
  /** Primary was below threshold; the alternate's result was returned. */
  FAILOVER_AFTER_LOW_CONFIDENCE,
  /** Both providers were tried, the alternate failed, the low-confidence primary was kept. */
  BEST_EFFORT,
  /** Caller asked to skip the primary. */
  FORCED_FALLBACK
}
