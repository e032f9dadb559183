package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrProcessingException;
import com.cario.docintel.app.model.JobHandle;
import com.cario.docintel.app.model.OcrRequest;
import com.cario.docintel.app.model.Page;
import com.cario.docintel.app.model.PollOutcome;
import com.cario.docintel.app.model.Point;
import com.cario.docintel.app.model.RecognitionResult;
import com.cario.docintel.app.model.TextLine;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * Datalab OCR endpoint ({@code /ocr}). Reports native per-line confidence, so its results are
 * the ones the failover threshold is calibrated against.
 *
 * <p>Completed status payload:
 *
 * <pre>
 * { "status": "complete", "success": true, "page_count": 1,
 *   "pages": [ { "page": 1, "languages": ["en"],
 *                "text_lines": [ { "text": "...", "confidence": 0.97,
 *                                  "bbox": [x1, y1, x2, y2],
 *                                  "polygon": [[x, y], [x, y], [x, y], [x, y]] } ] } ] }
 * </pre>
 */
@Log4j2
public class DatalabOcrClient implements OcrProviderClient {

  public static final String NAME = "datalab-ocr";
  static final String PATH = "/ocr";

  static final Set<String> MIME_TYPES =
      Set.of(
          "application/pdf",
          "image/png",
          "image/jpeg",
          "image/jpg",
          "image/webp",
          "image/gif",
          "image/tiff");

  private final DatalabTransport transport;
  private final long maxFileSizeBytes;
  private final Duration requestTimeout;
  private final Clock clock;

  public DatalabOcrClient(
      DatalabTransport transport, long maxFileSizeBytes, Duration requestTimeout, Clock clock) {
    this.transport = Objects.requireNonNull(transport);
    this.maxFileSizeBytes = maxFileSizeBytes;
    this.requestTimeout = Objects.requireNonNull(requestTimeout);
    this.clock = Objects.requireNonNull(clock);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String credentialId() {
    return transport.credentialId();
  }

  @Override
  public boolean structureOriented() {
    return false;
  }

  @Override
  public Set<String> supportedMimeTypes() {
    return MIME_TYPES;
  }

  @Override
  public long maxFileSizeBytes() {
    return maxFileSizeBytes;
  }

  @Override
  public Duration requestTimeout() {
    return requestTimeout;
  }

  @Override
  public JobHandle submit(OcrRequest request, Duration timeout) {
    validate(request);
    log.info(
        "ocr.submit provider={} file={} bytes={} mime={}",
        NAME,
        request.getFilename(),
        request.size(),
        request.getMimeType());
    return transport.submit(PATH, transport.baseForm(request), timeout);
  }

  @Override
  public PollOutcome poll(JobHandle handle, Duration timeout) {
    JsonNode status = transport.fetchStatus(handle, timeout);
    String state = status.path("status").asText("");
    if ("processing".equals(state)) {
      return PollOutcome.processing();
    }
    if (!"complete".equals(state)) {
      throw new OcrProcessingException(NAME, "unexpected job status: " + state);
    }
    if (!status.path("success").asBoolean(false)) {
      throw new OcrProcessingException(
          NAME, "job failed: " + DatalabTransport.errorText(status));
    }
    RecognitionResult result =
        RecognitionResult.of(
            NAME,
            normalizePages(status.path("pages")),
            Duration.between(handle.getSubmittedAt(), clock.instant()));
    log.info(
        "ocr.complete provider={} requestId={} pages={} lines={} avgConfidence={}",
        NAME,
        handle.getRequestId(),
        result.getPageCount(),
        result.getLineCount(),
        result.getAverageConfidence());
    return PollOutcome.complete(result);
  }

  List<Page> normalizePages(JsonNode pagesNode) {
    List<Page> pages = new ArrayList<>();
    if (!pagesNode.isArray()) {
      return pages;
    }
    int index = 0;
    for (JsonNode pageNode : pagesNode) {
      index++;
      List<TextLine> lines = new ArrayList<>();
      for (JsonNode lineNode : pageNode.path("text_lines")) {
        String text = lineNode.path("text").asText("").trim();
        if (text.isEmpty()) {
          continue;
        }
        List<Double> bbox = readNumbers(lineNode.path("bbox"));
        List<Point> polygon = readPolygon(lineNode.path("polygon"));
        lines.add(
            TextLine.builder()
                .text(text)
                .confidence(clamp(lineNode.path("confidence").asDouble(0.0)))
                .bbox(bbox)
                .polygon(polygon.isEmpty() ? TextLine.polygonFromBbox(bbox) : polygon)
                .build());
      }
      List<String> languages = new ArrayList<>();
      pageNode.path("languages").forEach(l -> languages.add(l.asText()));
      pages.add(Page.of(pageNode.path("page").asInt(index), lines, languages));
    }
    return pages;
  }

  static List<Double> readNumbers(JsonNode node) {
    List<Double> values = new ArrayList<>();
    if (node.isArray()) {
      node.forEach(n -> values.add(n.asDouble()));
    }
    return List.copyOf(values);
  }

  static List<Point> readPolygon(JsonNode node) {
    List<Point> points = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode corner : node) {
        if (corner.isArray() && corner.size() >= 2) {
          points.add(new Point(corner.get(0).asDouble(), corner.get(1).asDouble()));
        }
      }
    }
    return List.copyOf(points);
  }

  private static double clamp(double confidence) {
    return Math.max(0.0, Math.min(1.0, confidence));
  }
}
