package com.cario.docintel.app.service.extraction;

import com.cario.docintel.app.config.ExtractionProperties;
import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.service.extraction.spec.AgreementDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.CdlDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.CoiDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.InvoiceDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.LumperReceiptDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.PodDocumentSpec;
import com.cario.docintel.app.service.extraction.spec.RateConfirmationDocumentSpec;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Document tables built once at startup; read-only afterwards. */
public class DocumentSpecRegistry {

  private final Map<DocumentType, DocumentSpec> specs;

  public DocumentSpecRegistry(Map<DocumentType, DocumentSpec> specs) {
    EnumMap<DocumentType, DocumentSpec> copy = new EnumMap<>(DocumentType.class);
    copy.putAll(specs);
    this.specs = Collections.unmodifiableMap(copy);
  }

  public static DocumentSpecRegistry create(ExtractionProperties props) {
    int days = props.getMinExpirationDays();
    Map<DocumentType, DocumentSpec> specs = new EnumMap<>(DocumentType.class);
    specs.put(
        DocumentType.CDL, CdlDocumentSpec.create(props.thresholdFor(DocumentType.CDL), days));
    specs.put(
        DocumentType.COI, CoiDocumentSpec.create(props.thresholdFor(DocumentType.COI), days));
    specs.put(DocumentType.POD, PodDocumentSpec.create(props.thresholdFor(DocumentType.POD)));
    specs.put(
        DocumentType.AGREEMENT,
        AgreementDocumentSpec.create(props.thresholdFor(DocumentType.AGREEMENT)));
    specs.put(
        DocumentType.RATE_CONFIRMATION,
        RateConfirmationDocumentSpec.create(props.thresholdFor(DocumentType.RATE_CONFIRMATION)));
    specs.put(
        DocumentType.INVOICE, InvoiceDocumentSpec.create(props.thresholdFor(DocumentType.INVOICE)));
    specs.put(
        DocumentType.LUMPER_RECEIPT,
        LumperReceiptDocumentSpec.create(props.thresholdFor(DocumentType.LUMPER_RECEIPT)));
    return new DocumentSpecRegistry(specs);
  }

  public DocumentSpec get(DocumentType type) {
    DocumentSpec spec = specs.get(type);
    if (spec == null) {
      throw new IllegalArgumentException("no field table registered for " + type);
    }
    return spec;
  }
}
