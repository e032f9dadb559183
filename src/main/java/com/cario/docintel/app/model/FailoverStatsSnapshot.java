package com.cario.docintel.app.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Point-in-time, immutable copy of the failover counters. */
@Value
@Builder
public class FailoverStatsSnapshot {

  long totalRequests;

  /**
   * Results returned, keyed by the provider that produced them. A best-effort return (the
   * low-confidence primary kept after the alternate failed) is not counted here; it shows under
   * {@code bothFailed} and {@code acceptedWithWarning}.
   */
  Map<String, Long> providerSuccesses;

  /** Failovers triggered because the primary came back below threshold. */
  long confidenceTriggeredFallback;

  /** Failovers triggered because the primary raised an error. */
  long errorTriggeredFallback;

  /** Calls where the caller asked to skip the primary. */
  long forcedFallback;

  /** Calls where both providers were tried and the alternate also failed. */
  long bothFailed;

  /** Below-threshold primary results returned, with failover disabled or as best effort. */
  long acceptedWithWarning;

  /** Provider errors seen, keyed by error kind name. */
  Map<String, Long> errorsByKind;

  /** Share of requests counted under {@code providerSuccesses}, 0.0 when there were none. */
  double successRate;

  /** Share of requests that went to the alternate provider, 0.0 when there were none. */
  double fallbackRate;
}
