package com.cario.docintel.app.api;

import com.cario.docintel.app.model.DocumentType;
import com.cario.docintel.app.model.ExtractionResult;
import com.cario.docintel.app.model.FailoverStatsSnapshot;
import com.cario.docintel.app.model.RecognitionOptions;
import com.cario.docintel.app.service.DocumentParsingService;
import com.cario.docintel.app.service.DocumentProcessingService;
import com.cario.docintel.app.service.ocr.FailoverOcrService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Log4j2
@Validated
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentParsingService parsingService;
  private final DocumentProcessingService processingService;
  private final FailoverOcrService ocrService;

  // ------------------------------------------------------------
  // /documents/{type}/parse
  // ------------------------------------------------------------
  @PostMapping(
      path = "/{type}/parse",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ExtractionResult> parse(
      @PathVariable("type") String type, @RequestBody @Validated ParseTextRequest req) {
    DocumentType docType = DocumentType.fromPath(type);
    log.info("documents.parse type={} chars={}", docType, req.getText().length());
    return ResponseEntity.ok(parsingService.parse(docType, req.getText()));
  }

  // ------------------------------------------------------------
  // /documents/{type}/process
  // ------------------------------------------------------------
  @PostMapping(
      path = "/{type}/process",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ExtractionResult> process(
      @PathVariable("type") String type,
      @RequestPart("file") @NotNull MultipartFile file,
      @RequestParam(name = "languages", required = false) @Size(max = 4) List<String> languages,
      @RequestParam(name = "maxPages", required = false) @Min(1) @Max(1000) Integer maxPages,
      @RequestParam(name = "forceFallback", defaultValue = "false") boolean forceFallback) {

    DocumentType docType = DocumentType.fromPath(type);
    log.info(
        "documents.process type={} filename={} size={} contentType={}",
        docType,
        file.getOriginalFilename(),
        file.getSize(),
        file.getContentType());

    RecognitionOptions options =
        RecognitionOptions.builder()
            .languages(languages == null ? List.of() : List.copyOf(languages))
            .maxPages(maxPages)
            .forceFallback(forceFallback)
            .build();

    return ResponseEntity.ok(
        processingService.process(
            docType, bytes(file), file.getOriginalFilename(), file.getContentType(), options));
  }

  // ------------------------------------------------------------
  // /documents/ocr/stats
  // ------------------------------------------------------------
  @GetMapping(path = "/ocr/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<FailoverStatsSnapshot> stats() {
    return ResponseEntity.ok(ocrService.getStats());
  }

  @PostMapping(path = "/ocr/stats/reset", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<FailoverStatsSnapshot> resetStats() {
    ocrService.resetStats();
    return ResponseEntity.ok(ocrService.getStats());
  }

  private static byte[] bytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("could not read upload " + file.getOriginalFilename(), e);
    }
  }

  // ------------------------------------------------------------
  // DTOs
  // ------------------------------------------------------------
  @Data
  public static class ParseTextRequest {
    /** Recognized text; may be blank, which yields an empty, rejected result. */
    @NotNull private String text;
  }
}
