package com.cario.docintel.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.cario.docintel.app.config.ExtractionProperties;
import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.service.DocumentParsingService;
import com.cario.docintel.app.service.ocr.FailoverOcrService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {"ocr.failover.confidence-threshold=0.75", "extraction.thresholds.POD=0.85"})
class DocIntelServiceApplicationTest {

  @Autowired private FailoverOcrService failoverOcrService;

  @Autowired private DocumentParsingService parsingService;

  @Autowired private ExtractionProperties extractionProperties;

  @Test
  void contextWiresConfiguredThresholds() {
    assertEquals(0.75, failoverOcrService.getConfidenceThreshold(), 1e-9);
    assertEquals(0.85, extractionProperties.thresholdFor(DocumentType.POD), 1e-9);
    assertEquals(0.90, extractionProperties.thresholdFor(DocumentType.CDL), 1e-9);
    assertEquals(0L, failoverOcrService.getStats().getTotalRequests());
  }

  @Test
  void parsingServiceIsReady() {
    ExtractionResult result = parsingService.parse(DocumentType.POD, "");
    assertNotNull(result);
    assertFalse(result.isFlagValue());
  }
}
