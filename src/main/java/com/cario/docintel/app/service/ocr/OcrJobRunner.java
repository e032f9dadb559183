package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrTimeoutException;
import com.cario.docintel.app.exception.OcrTransportException;
import com.cario.docintel.app.model.JobHandle;
import com.cario.docintel.app.model.OcrRequest;
import com.cario.docintel.app.model.PollOutcome;
import com.cario.docintel.app.model.RecognitionResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Drives one provider job to completion: validate, submit, then poll with backoff until the job
 * completes, the attempt ceiling is hit, or the deadline passes.
 *
 * <p>Every HTTP call is bounded by the smaller of the provider's request timeout and the time
 * left before the deadline.
 */
@Log4j2
public class OcrJobRunner {

  private final PollingPolicy policy;
  private final Sleeper sleeper;
  private final Clock clock;

  public OcrJobRunner(PollingPolicy policy, Sleeper sleeper, Clock clock) {
    this.policy = Objects.requireNonNull(policy);
    this.sleeper = Objects.requireNonNull(sleeper);
    this.clock = Objects.requireNonNull(clock);
  }

  public RecognitionResult run(OcrProviderClient client, OcrRequest request) {
    client.validate(request);

    Duration deadline =
        request.getOptions() != null && request.getOptions().getDeadline() != null
            ? request.getOptions().getDeadline()
            : policy.getOverallDeadline();
    Instant started = clock.instant();
    Instant deadlineAt = started.plus(deadline);

    JobHandle handle = client.submit(request, callTimeout(client, deadlineAt));

    Duration interval = policy.getInitialInterval();
    for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
      pause(client, interval, deadlineAt);

      PollOutcome outcome;
      try {
        outcome = client.poll(handle, callTimeout(client, deadlineAt));
      } catch (OcrTransportException e) {
        log.warn(
            "ocr.poll.transport provider={} requestId={} attempt={} msg={}",
            client.name(),
            handle.getRequestId(),
            attempt,
            e.getMessage());
        outcome = PollOutcome.processing();
      }

      if (outcome.isComplete()) {
        log.debug(
            "ocr.poll.done provider={} requestId={} attempts={}",
            client.name(),
            handle.getRequestId(),
            attempt);
        return outcome.getResult();
      }
      interval = policy.next(interval);
    }

    throw new OcrTimeoutException(
        client.name(),
        "job " + handle.getRequestId() + " not complete after " + policy.getMaxAttempts()
            + " polls");
  }

  private void pause(OcrProviderClient client, Duration interval, Instant deadlineAt) {
    Duration remaining = remaining(client, deadlineAt);
    Duration wait = interval.compareTo(remaining) < 0 ? interval : remaining;
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OcrTimeoutException(client.name(), "interrupted while waiting for job", e);
    }
    remaining(client, deadlineAt);
  }

  private Duration callTimeout(OcrProviderClient client, Instant deadlineAt) {
    Duration remaining = remaining(client, deadlineAt);
    return client.requestTimeout().compareTo(remaining) < 0 ? client.requestTimeout() : remaining;
  }

  private Duration remaining(OcrProviderClient client, Instant deadlineAt) {
    Duration remaining = Duration.between(clock.instant(), deadlineAt);
    if (remaining.isZero() || remaining.isNegative()) {
      throw new OcrTimeoutException(client.name(), "deadline exceeded");
    }
    return remaining;
  }
}
