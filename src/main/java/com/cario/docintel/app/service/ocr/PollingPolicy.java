package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.config.OcrProperties;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Poll cadence: geometric backoff with a cap, an attempt ceiling and an overall deadline. */
@Value
@Builder
public class PollingPolicy {

  int maxAttempts;
  Duration initialInterval;
  double backoffMultiplier;
  Duration maxInterval;
  Duration overallDeadline;

  public static PollingPolicy from(OcrProperties.Polling polling) {
    return PollingPolicy.builder()
        .maxAttempts(polling.getMaxAttempts())
        .initialInterval(polling.getInitialInterval())
        .backoffMultiplier(polling.getBackoffMultiplier())
        .maxInterval(polling.getMaxInterval())
        .overallDeadline(polling.getOverallDeadline())
        .build();
  }

  /** Interval after {@code current}: multiplied, then capped at {@link #maxInterval}. */
  public Duration next(Duration current) {
    long millis = Math.round(current.toMillis() * backoffMultiplier);
    Duration grown = Duration.ofMillis(millis);
    return grown.compareTo(maxInterval) > 0 ? maxInterval : grown;
  }
}
