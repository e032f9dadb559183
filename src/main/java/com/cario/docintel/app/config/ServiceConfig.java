package com.cario.docintel.app.config;

import com.cario.docintel.app.service.DocumentParsingService;
import com.cario.docintel.app.service.DocumentProcessingService;
import com.cario.docintel.app.service.extraction.DocumentSpecRegistry;
import com.cario.docintel.app.service.extraction.PatternFieldExtractor;
import com.cario.docintel.app.service.extraction.VerificationGate;
import com.cario.docintel.app.service.ocr.DatalabOcrClient;
import com.cario.docintel.app.service.ocr.DatalabTransport;
import com.cario.docintel.app.service.ocr.FailoverOcrService;
import com.cario.docintel.app.service.ocr.MarkerOcrClient;
import com.cario.docintel.app.service.ocr.OcrJobRunner;
import com.cario.docintel.app.service.ocr.PollingPolicy;
import com.cario.docintel.app.service.ocr.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final OcrProperties ocrProperties;
  private final ExtractionProperties extractionProperties;
  private final ObjectMapper objectMapper;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // -------------------
  // OCR providers
  // -------------------

  @Bean
  public DatalabOcrClient datalabOcrClient(WebClient.Builder builder, Clock clock) {
    OcrProperties.Provider cfg = ocrProperties.getDatalab();
    DatalabTransport transport =
        new DatalabTransport(
            DatalabOcrClient.NAME,
            builder,
            cfg.getBaseUrl(),
            cfg.getApiKey(),
            objectMapper,
            clock);
    return new DatalabOcrClient(
        transport, cfg.getMaxFileSizeBytes(), cfg.getRequestTimeout(), clock);
  }

  @Bean
  public MarkerOcrClient markerOcrClient(WebClient.Builder builder, Clock clock) {
    OcrProperties.Marker cfg = ocrProperties.getMarker();
    DatalabTransport transport =
        new DatalabTransport(
            MarkerOcrClient.NAME, builder, cfg.getBaseUrl(), cfg.getApiKey(), objectMapper, clock);
    return new MarkerOcrClient(
        transport, cfg.getMaxFileSizeBytes(), cfg.getRequestTimeout(), cfg.getConfidence(), clock);
  }

  @Bean
  public OcrJobRunner ocrJobRunner(Clock clock) {
    return new OcrJobRunner(
        PollingPolicy.from(ocrProperties.getPolling()), Sleeper.threadSleep(), clock);
  }

  @Bean
  public FailoverOcrService failoverOcrService(
      DatalabOcrClient datalabOcrClient, MarkerOcrClient markerOcrClient, OcrJobRunner runner) {
    OcrProperties.Failover failover = ocrProperties.getFailover();
    return new FailoverOcrService(
        List.of(datalabOcrClient, markerOcrClient),
        runner,
        failover.getConfidenceThreshold(),
        failover.isEnabled(),
        failover.isPreferStructureForDocuments(),
        failover.isFailFastOnSharedCredential());
  }

  // -------------------
  // Extraction
  // -------------------

  @Bean
  public DocumentSpecRegistry documentSpecRegistry() {
    return DocumentSpecRegistry.create(extractionProperties);
  }

  @Bean
  public DocumentParsingService documentParsingService(
      DocumentSpecRegistry documentSpecRegistry, Clock clock) {
    return new DocumentParsingService(
        documentSpecRegistry, new PatternFieldExtractor(), new VerificationGate(clock));
  }

  @Bean
  public DocumentProcessingService documentProcessingService(
      FailoverOcrService failoverOcrService, DocumentParsingService documentParsingService) {
    return new DocumentProcessingService(failoverOcrService, documentParsingService);
  }
}
