package com.cario.docintel.app.model;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/** One recognized page. Text is the page's lines joined by newlines. */
@Value
public class Page {

  /** 1-based page number as reported by the provider. */
  int pageNumber;

  String text;

  List<TextLine> lines;

  /** Mean line confidence on this page, 0.0 when the page has no lines. */
  double averageConfidence;

  /** Language hints the provider reports for this page; may be empty. */
  List<String> languages;

  public static Page of(int pageNumber, List<TextLine> lines, List<String> languages) {
    List<TextLine> safeLines = lines == null ? List.of() : List.copyOf(lines);
    String text = safeLines.stream().map(TextLine::getText).collect(Collectors.joining("\n"));
    double avg =
        safeLines.stream().mapToDouble(TextLine::getConfidence).average().orElse(0.0);
    return new Page(
        pageNumber, text, safeLines, avg, languages == null ? List.of() : List.copyOf(languages));
  }
}
