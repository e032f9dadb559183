package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrErrorKind;
import com.cario.docintel.app.exception.OcrException;
import com.cario.docintel.app.exception.OcrValidationException;
import com.cario.docintel.app.exception.UnifiedRecognitionException;
import com.cario.docintel.app.model.FailoverStatsSnapshot;
import com.cario.docintel.app.model.OcrRequest;
import com.cario.docintel.app.model.ProviderAttempt;
import com.cario.docintel.app.model.RecognitionOptions;
import com.cario.docintel.app.model.RecognitionOutcome;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.model.RecognitionRoute;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * Routes a recognition request across an ordered pair of providers.
 *
 * <ol>
 *   <li>Order the providers (structure-oriented first for document formats when configured) and
 *       drop those whose local validation rejects the file.
 *   <li>Run the primary. At or above the confidence threshold its result is returned.
 *   <li>Below threshold, or on error, run the alternate with maximal effort and return its
 *       result whatever its confidence.
 *   <li>If the alternate fails too, return the low-confidence primary when there is one,
 *       otherwise throw {@link UnifiedRecognitionException}.
 * </ol>
 *
 * Attempts within one call are strictly sequential; concurrent calls share only the stats.
 */
@Log4j2
public class FailoverOcrService {

  static final Set<String> DOCUMENT_MIME_TYPES =
      Set.of(
          "application/pdf",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/vnd.ms-powerpoint",
          "application/vnd.openxmlformats-officedocument.presentationml.presentation");

  private final List<OcrProviderClient> providers;
  private final OcrJobRunner jobRunner;
  private final double confidenceThreshold;
  private final boolean failoverEnabled;
  private final boolean preferStructureForDocuments;
  private final boolean failFastOnSharedCredential;
  private final FailoverStats stats = new FailoverStats();

  public FailoverOcrService(
      List<OcrProviderClient> providers,
      OcrJobRunner jobRunner,
      double confidenceThreshold,
      boolean failoverEnabled,
      boolean preferStructureForDocuments) {
    this(
        providers,
        jobRunner,
        confidenceThreshold,
        failoverEnabled,
        preferStructureForDocuments,
        false);
  }

  /**
   * @param failFastOnSharedCredential when true, an authentication error is not failed over to
   *     an alternate that sends the same credential
   */
  public FailoverOcrService(
      List<OcrProviderClient> providers,
      OcrJobRunner jobRunner,
      double confidenceThreshold,
      boolean failoverEnabled,
      boolean preferStructureForDocuments,
      boolean failFastOnSharedCredential) {
    if (providers == null || providers.isEmpty()) {
      throw new IllegalArgumentException("at least one OCR provider is required");
    }
    this.providers = List.copyOf(providers);
    this.jobRunner = Objects.requireNonNull(jobRunner);
    this.confidenceThreshold = Math.max(0.0, Math.min(1.0, confidenceThreshold));
    this.failoverEnabled = failoverEnabled;
    this.preferStructureForDocuments = preferStructureForDocuments;
    this.failFastOnSharedCredential = failFastOnSharedCredential;
  }

  public double getConfidenceThreshold() {
    return confidenceThreshold;
  }

  public RecognitionOutcome recognize(
      byte[] content, String filename, String mimeType, RecognitionOptions options) {
    RecognitionOptions opts = options == null ? RecognitionOptions.defaults() : options;
    String mime = OcrProviderClient.resolveMimeType(mimeType, filename);
    OcrRequest request = new OcrRequest(content, filename, mime, opts);
    String reqId = UUID.randomUUID().toString();

    List<OcrProviderClient> order = providerOrder(request);
    stats.recordRequest();
    log.info(
        "failover.start id={} file={} mime={} order={} threshold={}",
        reqId,
        filename,
        request.getMimeType(),
        order.stream().map(OcrProviderClient::name).toList(),
        confidenceThreshold);

    List<ProviderAttempt> attempts = new ArrayList<>();
    OcrProviderClient primary = order.get(0);
    OcrProviderClient alternate = order.size() > 1 ? order.get(1) : null;

    if (opts.isForceFallback() && alternate != null) {
      stats.recordForcedFallback();
      return runAlternate(
          reqId, alternate, request, attempts, null, null, RecognitionRoute.FORCED_FALLBACK);
    }

    RecognitionResult primaryResult = null;
    OcrException primaryError = null;
    try {
      primaryResult = jobRunner.run(primary, request);
      attempts.add(ProviderAttempt.success(primary.name(), primaryResult.getAverageConfidence()));
    } catch (OcrException e) {
      primaryError = e;
      stats.recordError(e.getKind());
      attempts.add(ProviderAttempt.failure(primary.name(), e.getKind(), e.getMessage()));
      log.warn(
          "failover.primary.error id={} provider={} kind={} msg={}",
          reqId,
          primary.name(),
          e.getKind(),
          e.getMessage());
    }

    if (primaryResult != null) {
      double confidence = primaryResult.getAverageConfidence();
      if (confidence >= confidenceThreshold) {
        stats.recordSuccess(primary.name());
        log.info(
            "failover.done id={} provider={} route={} confidence={}",
            reqId,
            primary.name(),
            RecognitionRoute.PRIMARY,
            confidence);
        return new RecognitionOutcome(primaryResult, RecognitionRoute.PRIMARY, List.of(), attempts);
      }
      if (!failoverEnabled || alternate == null) {
        stats.recordSuccess(primary.name());
        stats.recordAcceptedWithWarning();
        String warning = lowConfidenceWarning(primary.name(), confidence);
        log.warn("failover.accepted.lowconfidence id={} {}", reqId, warning);
        return new RecognitionOutcome(
            primaryResult, RecognitionRoute.LOW_CONFIDENCE_ACCEPTED, List.of(warning), attempts);
      }
      stats.recordConfidenceTriggeredFallback();
      log.info(
          "failover.fallback id={} reason=low_confidence confidence={} threshold={} to={}",
          reqId,
          confidence,
          confidenceThreshold,
          alternate.name());
      return runAlternate(
          reqId,
          alternate,
          request,
          attempts,
          primaryResult,
          null,
          RecognitionRoute.FAILOVER_AFTER_LOW_CONFIDENCE);
    }

    if (!failoverEnabled || alternate == null) {
      log.error(
          "failover.failed id={} provider={} failover=unavailable", reqId, primary.name());
      throw new UnifiedRecognitionException(primaryError, null);
    }
    if (failFastOnSharedCredential
        && primaryError.getKind() == OcrErrorKind.AUTHENTICATION
        && primary.credentialId().equals(alternate.credentialId())) {
      log.error(
          "failover.failed id={} provider={} reason=shared_credential_rejected",
          reqId,
          primary.name());
      throw new UnifiedRecognitionException(primaryError, null);
    }
    stats.recordErrorTriggeredFallback();
    log.info(
        "failover.fallback id={} reason=error kind={} to={}",
        reqId,
        primaryError.getKind(),
        alternate.name());
    return runAlternate(
        reqId,
        alternate,
        request,
        attempts,
        null,
        primaryError,
        RecognitionRoute.FAILOVER_AFTER_ERROR);
  }

  private RecognitionOutcome runAlternate(
      String reqId,
      OcrProviderClient alternate,
      OcrRequest request,
      List<ProviderAttempt> attempts,
      RecognitionResult primaryResult,
      OcrException primaryError,
      RecognitionRoute route) {
    try {
      RecognitionResult result =
          jobRunner.run(alternate, request.withOptions(request.getOptions().withMaxEffort()));
      stats.recordSuccess(alternate.name());
      attempts.add(ProviderAttempt.success(alternate.name(), result.getAverageConfidence()));
      List<String> warnings =
          result.getAverageConfidence() < confidenceThreshold
              ? List.of(lowConfidenceWarning(alternate.name(), result.getAverageConfidence()))
              : List.of();
      log.info(
          "failover.done id={} provider={} route={} confidence={}",
          reqId,
          alternate.name(),
          route,
          result.getAverageConfidence());
      return new RecognitionOutcome(result, route, warnings, attempts);
    } catch (OcrException e) {
      stats.recordError(e.getKind());
      stats.recordBothFailed();
      attempts.add(ProviderAttempt.failure(alternate.name(), e.getKind(), e.getMessage()));
      log.warn(
          "failover.alternate.error id={} provider={} kind={} msg={}",
          reqId,
          alternate.name(),
          e.getKind(),
          e.getMessage());

      if (primaryResult != null) {
        stats.recordAcceptedWithWarning();
        String warning =
            lowConfidenceWarning(
                primaryResult.getProviderName(), primaryResult.getAverageConfidence());
        log.warn("failover.besteffort id={} {}", reqId, warning);
        return new RecognitionOutcome(
            primaryResult,
            RecognitionRoute.BEST_EFFORT,
            List.of(warning, "alternate " + alternate.name() + " failed: " + e.getMessage()),
            attempts);
      }
      if (primaryError == null) {
        // forced fallback: no primary attempt to report
        throw new UnifiedRecognitionException(e, null);
      }
      throw new UnifiedRecognitionException(primaryError, e);
    }
  }

  /**
   * Providers in attempt order, minus those that reject the file locally. Raises the first
   * validation failure when no provider accepts it.
   */
  List<OcrProviderClient> providerOrder(OcrRequest request) {
    List<OcrProviderClient> ordered = new ArrayList<>(providers);
    if (preferStructureForDocuments && DOCUMENT_MIME_TYPES.contains(request.getMimeType())) {
      List<OcrProviderClient> structured = new ArrayList<>();
      List<OcrProviderClient> others = new ArrayList<>();
      for (OcrProviderClient p : providers) {
        (p.structureOriented() ? structured : others).add(p);
      }
      ordered = new ArrayList<>(structured);
      ordered.addAll(others);
    }

    List<OcrProviderClient> accepted = new ArrayList<>();
    OcrValidationException firstRejection = null;
    for (OcrProviderClient p : ordered) {
      try {
        p.validate(request);
        accepted.add(p);
      } catch (OcrValidationException e) {
        log.debug("failover.skip provider={} reason={}", p.name(), e.getMessage());
        if (firstRejection == null) {
          firstRejection = e;
        }
      }
    }
    if (accepted.isEmpty()) {
      throw firstRejection;
    }
    return accepted;
  }

  public FailoverStatsSnapshot getStats() {
    return stats.snapshot();
  }

  public void resetStats() {
    stats.reset();
    log.info("failover.stats.reset");
  }

  private String lowConfidenceWarning(String provider, double confidence) {
    return String.format(
        Locale.ROOT,
        "low confidence from %s: %.3f < %.3f", provider, confidence, confidenceThreshold);
  }
}
