package com.cario.docintel.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.docintel.app.config.ExtractionProperties;
import com.cario.docintel.app.exception.OcrTimeoutException;
import com.cario.docintel.app.exception.OcrValidationException;
import com.cario.docintel.app.exception.UnifiedRecognitionException;
import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.model.OcrSummary;
import com.cario.docintel.app.model.Page;
import com.cario.docintel.app.model.ProviderAttempt;
import com.cario.docintel.app.model.RecognitionOptions;
import com.cario.docintel.app.model.RecognitionOutcome;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.model.RecognitionRoute;
import com.cario.docintel.app.model.TextLine;
import com.cario.docintel.app.service.extraction.DocumentSpecRegistry;
import com.cario.docintel.app.service.extraction.PatternFieldExtractor;
import com.cario.docintel.app.service.extraction.VerificationGate;
import com.cario.docintel.app.service.extraction.spec.CdlDocumentSpec;
import com.cario.docintel.app.service.ocr.FailoverOcrService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingServiceTest {

  private static final byte[] PDF = "%PDF-1.7".getBytes();

  @Mock private FailoverOcrService ocrService;

  private DocumentProcessingService service;

  @BeforeEach
  void setUp() {
    DocumentParsingService parser =
        new DocumentParsingService(
            DocumentSpecRegistry.create(new ExtractionProperties()),
            new PatternFieldExtractor(),
            new VerificationGate(
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC)));
    service = new DocumentProcessingService(ocrService, parser);
  }

  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
  // Pipeline
  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

  @Test
  @DisplayName("Recognized text is parsed and the OCR summary attached")
  void process_attachesOcrSummary() {
    RecognitionOptions options = RecognitionOptions.builder().languages(List.of("en")).build();
    RecognitionOutcome outcome =
        new RecognitionOutcome(
            recognition("datalab-marker", "NAME: JOHN SMITH", "EXP: 12/25/2030"),
            RecognitionRoute.FAILOVER_AFTER_LOW_CONFIDENCE,
            List.of(),
            List.of(
                ProviderAttempt.success("datalab-ocr", 0.4),
                ProviderAttempt.success("datalab-marker", 0.9)));
    when(ocrService.recognize(eq(PDF), eq("cdl.pdf"), eq("application/pdf"), any()))
        .thenReturn(outcome);

    ExtractionResult result =
        service.process(DocumentType.CDL, PDF, "cdl.pdf", "application/pdf", options);

    assertEquals("John Smith", result.field(CdlDocumentSpec.NAME));
    assertTrue(result.isFlagValue());
    OcrSummary ocr = result.getOcr();
    assertNotNull(ocr);
    assertEquals("datalab-marker", ocr.getProvider());
    assertEquals(0.9, ocr.getAverageConfidence(), 1e-9);
    assertEquals(2, ocr.getPageCount());
    assertEquals(RecognitionRoute.FAILOVER_AFTER_LOW_CONFIDENCE, ocr.getRoute());
    assertTrue(ocr.getWarnings().isEmpty());
    verify(ocrService).recognize(PDF, "cdl.pdf", "application/pdf", options);
  }

  @Test
  @DisplayName("Low-confidence warnings are carried onto the summary")
  void process_carriesWarnings() {
    RecognitionOutcome outcome =
        new RecognitionOutcome(
            recognition("datalab-ocr", "Hello world"),
            RecognitionRoute.LOW_CONFIDENCE_ACCEPTED,
            List.of("confidence 0.900 < 0.950"),
            List.of(ProviderAttempt.success("datalab-ocr", 0.9)));
    when(ocrService.recognize(any(), any(), any(), any())).thenReturn(outcome);

    ExtractionResult result = service.process(DocumentType.AGREEMENT, PDF, "a.pdf", null, null);

    assertEquals(List.of("confidence 0.900 < 0.950"), result.getOcr().getWarnings());
    assertEquals(0.0, result.getConfidence());
  }

  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
  // Failures
  // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

  @Test
  @DisplayName("Recognition failures propagate unchanged")
  void process_rethrowsRecognitionFailure() {
    UnifiedRecognitionException failure =
        new UnifiedRecognitionException(
            new OcrTimeoutException("datalab-ocr", "deadline exceeded"),
            new OcrTimeoutException("datalab-marker", "deadline exceeded"));
    when(ocrService.recognize(any(), any(), any(), any())).thenThrow(failure);

    UnifiedRecognitionException thrown =
        assertThrows(
            UnifiedRecognitionException.class,
            () -> service.process(DocumentType.POD, PDF, "pod.pdf", "application/pdf", null));
    assertSame(failure, thrown);
  }

  @Test
  @DisplayName("Validation failures propagate unchanged")
  void process_rethrowsValidationFailure() {
    when(ocrService.recognize(any(), any(), any(), any()))
        .thenThrow(new OcrValidationException(null, "file is empty"));

    assertThrows(
        OcrValidationException.class,
        () -> service.process(DocumentType.COI, new byte[0], "coi.pdf", "application/pdf", null));
  }

  private static RecognitionResult recognition(String provider, String... pageTexts) {
    List<Page> pages =
        IntStream.range(0, pageTexts.length)
            .mapToObj(
                i ->
                    Page.of(
                        i + 1,
                        List.of(
                            TextLine.builder()
                                .text(pageTexts[i])
                                .confidence(0.9)
                                .bbox(List.of())
                                .polygon(List.of())
                                .build()),
                        List.of("en")))
            .collect(Collectors.toList());
    return RecognitionResult.of(provider, pages, Duration.ofSeconds(3));
  }
}
