package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.config.OcrProperties;
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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.jsoup.Jsoup;
import org.springframework.http.client.MultipartBodyBuilder;

/**
 * Datalab Marker endpoint ({@code /marker}): layout-aware conversion that accepts office and
 * web formats in addition to PDFs and images.
 *
 * <p>Marker reports no confidence. The document-level estimate comes from how complete the
 * returned block structure is, and every line carries that estimate so the result's mean line
 * confidence equals it.
 */
@Log4j2
public class MarkerOcrClient implements OcrProviderClient {

  public static final String NAME = "datalab-marker";
  static final String PATH = "/marker";

  private static final int MIN_BLOCK_TEXT = 2;

  static final Set<String> MIME_TYPES = buildMimeTypes();

  private final DatalabTransport transport;
  private final long maxFileSizeBytes;
  private final Duration requestTimeout;
  private final OcrProperties.MarkerConfidence confidence;
  private final Clock clock;

  public MarkerOcrClient(
      DatalabTransport transport,
      long maxFileSizeBytes,
      Duration requestTimeout,
      OcrProperties.MarkerConfidence confidence,
      Clock clock) {
    this.transport = Objects.requireNonNull(transport);
    this.maxFileSizeBytes = maxFileSizeBytes;
    this.requestTimeout = Objects.requireNonNull(requestTimeout);
    this.confidence = Objects.requireNonNull(confidence);
    this.clock = Objects.requireNonNull(clock);
  }

  private static Set<String> buildMimeTypes() {
    Set<String> types = new HashSet<>(DatalabOcrClient.MIME_TYPES);
    types.add("application/msword");
    types.add("application/vnd.openxmlformats-officedocument.wordprocessingml.document");
    types.add("application/vnd.ms-powerpoint");
    types.add("application/vnd.openxmlformats-officedocument.presentationml.presentation");
    types.add("application/vnd.ms-excel");
    types.add("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    types.add("text/html");
    types.add("application/epub+zip");
    return Set.copyOf(types);
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
    return true;
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
    boolean maxEffort = request.getOptions() != null && request.getOptions().isMaxEffort();
    log.info(
        "ocr.submit provider={} file={} bytes={} mime={} forceOcr={}",
        NAME,
        request.getFilename(),
        request.size(),
        request.getMimeType(),
        maxEffort);
    MultipartBodyBuilder form = transport.baseForm(request);
    form.part("output_format", "json");
    if (maxEffort) {
      form.part("force_ocr", "true");
    }
    return transport.submit(PATH, form, timeout);
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
            NAME, normalize(status), Duration.between(handle.getSubmittedAt(), clock.instant()));
    log.info(
        "ocr.complete provider={} requestId={} pages={} lines={} estimatedConfidence={}",
        NAME,
        handle.getRequestId(),
        result.getPageCount(),
        result.getLineCount(),
        result.getAverageConfidence());
    return PollOutcome.complete(result);
  }

  List<Page> normalize(JsonNode status) {
    JsonNode json = status.path("json");
    if (json.isObject() && json.path("children").isArray()) {
      return normalizeBlocks(json.path("children"));
    }
    String markdown = status.path("markdown").asText("");
    if (!markdown.isBlank()) {
      return List.of(pageFromPlainText(markdown, confidence.getBase()));
    }
    return List.of();
  }

  private List<Page> normalizeBlocks(JsonNode pageNodes) {
    int totalBlocks = 0;
    int validBlocks = 0;
    List<List<JsonNode>> pageBlocks = new ArrayList<>();
    for (JsonNode pageNode : pageNodes) {
      List<JsonNode> blocks = new ArrayList<>();
      for (JsonNode block : pageNode.path("children")) {
        totalBlocks++;
        if (stripHtml(block.path("html").asText("")).length() > MIN_BLOCK_TEXT
            && block.path("bbox").isArray()
            && block.path("bbox").size() >= 4) {
          validBlocks++;
        }
        blocks.add(block);
      }
      pageBlocks.add(blocks);
    }

    double estimate = estimateConfidence(validBlocks, totalBlocks, pageNodes.size() > 0);
    List<Page> pages = new ArrayList<>();
    int pageNumber = 0;
    for (List<JsonNode> blocks : pageBlocks) {
      pageNumber++;
      List<TextLine> lines = new ArrayList<>();
      for (JsonNode block : blocks) {
        String text = stripHtml(block.path("html").asText(""));
        if (text.isEmpty()) {
          continue;
        }
        List<Double> bbox = DatalabOcrClient.readNumbers(block.path("bbox"));
        List<Point> polygon = DatalabOcrClient.readPolygon(block.path("polygon"));
        lines.add(
            TextLine.builder()
                .text(text)
                .confidence(estimate)
                .bbox(bbox)
                .polygon(polygon.isEmpty() ? TextLine.polygonFromBbox(bbox) : polygon)
                .build());
      }
      pages.add(Page.of(pageNumber, lines, List.of()));
    }
    return pages;
  }

  private Page pageFromPlainText(String text, double lineConfidence) {
    List<TextLine> lines = new ArrayList<>();
    for (String raw : text.split("\\R")) {
      String line = raw.trim();
      if (!line.isEmpty()) {
        lines.add(
            TextLine.builder()
                .text(line)
                .confidence(clampEstimate(lineConfidence))
                .bbox(List.of())
                .polygon(List.of())
                .build());
      }
    }
    return Page.of(1, lines, List.of());
  }

  /**
   * Completeness heuristic: share of blocks with usable text and geometry, mapped onto
   * [rangeFloor, rangeFloor + rangeSpan]; without any blocks to measure, the base estimate
   * (plus a bonus when page structure exists). Always clamped to [min, max].
   */
  double estimateConfidence(int validBlocks, int totalBlocks, boolean hasChildren) {
    double estimate;
    if (totalBlocks > 0) {
      double ratio = (double) validBlocks / totalBlocks;
      estimate = confidence.getRangeFloor() + ratio * confidence.getRangeSpan();
    } else if (hasChildren) {
      estimate = confidence.getBase() + confidence.getStructureBonus();
    } else {
      estimate = confidence.getBase();
    }
    return clampEstimate(estimate);
  }

  private double clampEstimate(double estimate) {
    return Math.max(confidence.getMin(), Math.min(confidence.getMax(), estimate));
  }

  /** Visible text of a block's HTML; entities decoded, script and style bodies dropped. */
  static String stripHtml(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return Jsoup.parse(html).text().trim();
  }
}
