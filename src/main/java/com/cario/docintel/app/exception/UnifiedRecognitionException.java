package com.cario.docintel.app.exception;

import lombok.Getter;

/**
 * Terminal failure of the failover chain: the primary failed and the alternate either failed
 * too or was not attempted. Names both underlying failures.
 */
@Getter
public class UnifiedRecognitionException extends RuntimeException {

  private final OcrException primaryFailure;

  /** {@code null} when no alternate provider was attempted. */
  private final OcrException secondaryFailure;

  public UnifiedRecognitionException(OcrException primaryFailure, OcrException secondaryFailure) {
    super(describe(primaryFailure, secondaryFailure), primaryFailure);
    this.primaryFailure = primaryFailure;
    this.secondaryFailure = secondaryFailure;
    if (secondaryFailure != null) {
      addSuppressed(secondaryFailure);
    }
  }

  private static String describe(OcrException primary, OcrException secondary) {
    String first =
        "primary " + primary.getProvider() + " failed (" + primary.getKind() + "): "
            + primary.getMessage();
    if (secondary == null) {
      return first + "; no alternate provider attempted";
    }
    return first
        + "; alternate "
        + secondary.getProvider()
        + " failed ("
        + secondary.getKind()
        + "): "
        + secondary.getMessage();
  }
}
