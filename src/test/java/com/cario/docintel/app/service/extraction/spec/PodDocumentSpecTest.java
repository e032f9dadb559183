package com.cario.docintel.app.service.extraction.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.docintel.app.model.BusinessFlag;
import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.model.SignalEvidence;
import com.cario.docintel.app.service.DocumentParsingService;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PodDocumentSpecTest {

  private final DocumentParsingService parser = ParserFixtures.parser();

  private ExtractionResult parse(String text) {
    return parser.parse(DocumentType.POD, text);
  }

  @Test
  @DisplayName("A signed, dated delivery receipt is completed")
  void fullReceipt_completed() {
    ExtractionResult result =
        parse(
            "PROOF OF DEL1VERY\n"
                + "Delivered on: 03/15/2025\n"
                + "Received by: Maria Lopez\n"
                + "Shipment received in good condition\n"
                + "Notes: 2 pallets shrink wrap torn");

    SignalEvidence confirmation =
        (SignalEvidence) result.field(PodDocumentSpec.DELIVERY_CONFIRMED);
    assertEquals(4, confirmation.getCount());
    assertEquals(1, ((SignalEvidence) result.field(PodDocumentSpec.SIGNATURE)).getCount());
    assertEquals(LocalDate.of(2025, 3, 15), result.field(PodDocumentSpec.DELIVERY_DATE));
    assertEquals("Maria Lopez", result.field(PodDocumentSpec.RECEIVER_NAME));
    assertEquals("2 pallets shrink wrap torn", result.field(PodDocumentSpec.DELIVERY_NOTES));
    assertEquals(1.0, result.getConfidence(), 1e-9);
    assertEquals(BusinessFlag.COMPLETED, result.getFlag());
    assertTrue(result.isFlagValue());
  }

  @Test
  @DisplayName("A bare delivered mention is not enough to complete")
  void confirmationAlone_notCompleted() {
    ExtractionResult result = parse("Status: delivered");

    assertEquals(0.40, result.getConfidence(), 1e-9);
    assertFalse(result.isFlagValue());
  }

  @Test
  @DisplayName("Without a delivery confirmation the receipt is never completed")
  void noConfirmation_notCompleted() {
    ExtractionResult result = parse("Signature: ____\nDate: 03/15/2025");

    assertNull(result.field(PodDocumentSpec.DELIVERY_CONFIRMED));
    assertEquals(LocalDate.of(2025, 3, 15), result.field(PodDocumentSpec.DELIVERY_DATE));
    assertEquals(0.45, result.getConfidence(), 1e-9);
    assertFalse(result.isFlagValue());
  }

  @Test
  @DisplayName("Form vocabulary is never taken as the receiver name")
  void receiverName_skipsFormWords() {
    ExtractionResult result =
        parse("Delivered\nReceived by: Signature on file\nPrinted name: John Doe");

    assertEquals("John Doe", result.field(PodDocumentSpec.RECEIVER_NAME));
  }

  @Test
  @DisplayName("OCR digit substitutions are repaired before matching")
  void ocrArtifacts_repaired() {
    ExtractionResult result = parse("Del1very c0mplete");

    SignalEvidence confirmation =
        (SignalEvidence) result.field(PodDocumentSpec.DELIVERY_CONFIRMED);
    assertEquals(1, confirmation.getCount());
    assertEquals("Delivery complete", confirmation.getSnippets().get(0));
  }
}
