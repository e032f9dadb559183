package com.cario.docintel.app.service;

import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.model.OcrSummary;
import com.cario.docintel.app.model.RecognitionOptions;
import com.cario.docintel.app.model.RecognitionOutcome;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.service.ocr.FailoverOcrService;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * DocumentProcessingService
 *
 * <ol>
 *   <li>Recognize the uploaded file through {@link FailoverOcrService} (primary provider, with
 *       confidence- or error-triggered failover).
 *   <li>Parse the recognized full text with {@link DocumentParsingService} for the requested
 *       document type.
 *   <li>Return the extraction with the OCR provider, confidence and route attached.
 * </ol>
 */
@Log4j2
public class DocumentProcessingService {

  private final FailoverOcrService ocrService;
  private final DocumentParsingService parsingService;

  public DocumentProcessingService(
      FailoverOcrService ocrService, DocumentParsingService parsingService) {
    this.ocrService = Objects.requireNonNull(ocrService);
    this.parsingService = Objects.requireNonNull(parsingService);
  }

  public ExtractionResult process(
      DocumentType type,
      byte[] content,
      String filename,
      String mimeType,
      RecognitionOptions options) {
    String reqId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();
    log.info(
        "pipeline.start id={} type={} file={} bytes={}",
        reqId,
        type,
        filename,
        content == null ? 0 : content.length);

    try {
      RecognitionOutcome outcome = ocrService.recognize(content, filename, mimeType, options);
      RecognitionResult recognition = outcome.getResult();
      ExtractionResult parsed = parsingService.parse(type, recognition);

      ExtractionResult result =
          parsed.toBuilder()
              .ocr(
                  new OcrSummary(
                      recognition.getProviderName(),
                      recognition.getAverageConfidence(),
                      recognition.getPageCount(),
                      outcome.getRoute(),
                      outcome.getWarnings()))
              .build();

      long ms = (System.nanoTime() - t0) / 1_000_000;
      log.info(
          "pipeline.done id={} type={} provider={} route={} confidence={} {}={} durationMs={}",
          reqId,
          type,
          recognition.getProviderName(),
          outcome.getRoute(),
          result.getConfidence(),
          result.getFlag(),
          result.isFlagValue(),
          ms);
      return result;

    } catch (RuntimeException e) {
      long ms = (System.nanoTime() - t0) / 1_000_000;
      log.error(
          "pipeline.error id={} type={} durationMs={} msg={}", reqId, type, ms, e.getMessage(), e);
      throw e;
    }
  }
}
