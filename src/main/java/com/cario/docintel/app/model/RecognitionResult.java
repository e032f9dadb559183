package com.cario.docintel.app.model;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Normalized output of any OCR provider.
 *
 * <p>Immutable once built. {@code averageConfidence} is the mean over every line of every page
 * (not the mean of page means) and is 0.0 when there are no lines. {@code fullText} is the page
 * texts joined by a blank line, in page order.
 */
@Value
public class RecognitionResult {

  List<Page> pages;

  String fullText;

  double averageConfidence;

  String providerName;

  int pageCount;

  /** Wall-clock time from submit to completion, when known. */
  Duration processingTime;

  public static RecognitionResult of(
      String providerName, List<Page> pages, Duration processingTime) {
    List<Page> safePages = pages == null ? List.of() : List.copyOf(pages);
    String fullText = safePages.stream().map(Page::getText).collect(Collectors.joining("\n\n"));
    double avg =
        safePages.stream()
            .flatMap(p -> p.getLines().stream())
            .mapToDouble(TextLine::getConfidence)
            .average()
            .orElse(0.0);
    return new RecognitionResult(
        safePages, fullText, avg, providerName, safePages.size(), processingTime);
  }

  public int getLineCount() {
    return pages.stream().mapToInt(p -> p.getLines().size()).sum();
  }

  /** Copy with the processing time filled in once the job runner knows it. */
  public RecognitionResult withProcessingTime(Duration elapsed) {
    return new RecognitionResult(
        pages, fullText, averageConfidence, providerName, pageCount, elapsed);
  }
}
