package com.cario.docintel.app.model;

import lombok.Value;

/** Result of one poll: still processing, or complete with a normalized result. */
@Value
public class PollOutcome {

  public enum Status {
    PROCESSING,
    COMPLETE
  }

  Status status;

  /** Present only when {@link Status#COMPLETE}. */
  RecognitionResult result;

  public static PollOutcome processing() {
    return new PollOutcome(Status.PROCESSING, null);
  }

  public static PollOutcome complete(RecognitionResult result) {
    return new PollOutcome(Status.COMPLETE, result);
  }

  public boolean isComplete() {
    return status == Status.COMPLETE;
  }
}
