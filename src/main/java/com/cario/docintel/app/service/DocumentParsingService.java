package com.cario.docintel.app.service;

import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.model.FieldMatch;
import com.cario.docintel.app.model.ParseState;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.service.extraction.DocumentSpec;
import com.cario.docintel.app.service.extraction.DocumentSpecRegistry;
import com.cario.docintel.app.service.extraction.FieldExtraction;
import com.cario.docintel.app.service.extraction.PatternFieldExtractor;
import com.cario.docintel.app.service.extraction.VerificationGate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Parses recognized text into a scored, gated {@link ExtractionResult}.
 *
 * <p>Lifecycle: RECEIVED, TEXT_NORMALIZED, FIELDS_EXTRACTED, SCORED, then VERIFIED or REJECTED.
 * Blank text goes straight to REJECTED with confidence 0.0. Never throws for any text input.
 */
@Log4j2
public class DocumentParsingService {

  private final DocumentSpecRegistry registry;
  private final PatternFieldExtractor extractor;
  private final VerificationGate gate;

  public DocumentParsingService(
      DocumentSpecRegistry registry, PatternFieldExtractor extractor, VerificationGate gate) {
    this.registry = Objects.requireNonNull(registry);
    this.extractor = Objects.requireNonNull(extractor);
    this.gate = Objects.requireNonNull(gate);
  }

  /** Parses the result's full text verbatim. */
  public ExtractionResult parse(DocumentType type, RecognitionResult recognition) {
    return parse(type, recognition == null ? null : recognition.getFullText());
  }

  public ExtractionResult parse(DocumentType type, String text) {
    DocumentSpec spec = registry.get(type);
    log.debug("parse.state type={} state={} chars={}", type, ParseState.RECEIVED, length(text));

    if (text == null || text.isBlank()) {
      log.info("parse.done type={} state={} reason=empty_text", type, ParseState.REJECTED);
      return emptyResult(spec);
    }

    String normalized = spec.getNormalizer().normalize(text);
    log.debug("parse.state type={} state={}", type, ParseState.TEXT_NORMALIZED);

    FieldExtraction fields = extractor.extract(normalized, spec.getFields());
    log.debug(
        "parse.state type={} state={} found={}",
        type,
        ParseState.FIELDS_EXTRACTED,
        fields.presentCount());

    double confidence = spec.getConfidenceRule().score(fields);
    log.debug("parse.state type={} state={} confidence={}", type, ParseState.SCORED, confidence);

    boolean flag = gate.evaluate(spec, fields, confidence);
    ParseState terminal = flag ? ParseState.VERIFIED : ParseState.REJECTED;
    log.info(
        "parse.done type={} state={} confidence={} fields={} {}={}",
        type,
        terminal,
        confidence,
        fields.presentCount(),
        type.getFlag(),
        flag);

    return ExtractionResult.builder()
        .documentType(type)
        .fields(fields.getValues())
        .extractionDetails(fields.getDetails())
        .confidence(confidence)
        .flag(type.getFlag())
        .flagValue(flag)
        .state(terminal)
        .fieldsFound(fields.presentCount())
        .build();
  }

  private static ExtractionResult emptyResult(DocumentSpec spec) {
    Map<String, Object> values = new LinkedHashMap<>();
    Map<String, FieldMatch> details = new LinkedHashMap<>();
    spec.getFields()
        .forEach(
            f -> {
              values.put(f.getName(), null);
              details.put(f.getName(), FieldMatch.absent(f.getName()));
            });
    return ExtractionResult.builder()
        .documentType(spec.getType())
        .fields(Collections.unmodifiableMap(values))
        .extractionDetails(Collections.unmodifiableMap(details))
        .confidence(0.0)
        .flag(spec.getType().getFlag())
        .flagValue(false)
        .state(ParseState.REJECTED)
        .fieldsFound(0)
        .build();
  }

  private static int length(String text) {
    return text == null ? 0 : text.length();
  }
}
