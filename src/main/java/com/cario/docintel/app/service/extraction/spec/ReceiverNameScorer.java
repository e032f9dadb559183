package com.cario.docintel.app.service.extraction.spec;

import com.cario.docintel.app.service.extraction.Candidate;
import com.cario.docintel.app.service.extraction.CandidateScorer;
import com.cario.docintel.app.util.TextUtils;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ranks receiver-name candidates on a proof of delivery. Short, name-shaped values win; form
 * vocabulary ("signature", "date", "good condition") sinks a candidate below zero.
 */
final class ReceiverNameScorer implements CandidateScorer {

  static final double DENYLIST_PENALTY = -10.0;

  private static final List<Pattern> DENYLIST =
      Stream.of(
              "date", "time", "signature", "line", "print", "page", "delivery", "package",
              "condition", "satisfied", "front door", "good", "excellent", "poor", "damaged",
              "notes", "comments", "remarks")
          .map(word -> Pattern.compile("\\b" + Pattern.quote(word) + "\\b"))
          .collect(Collectors.toUnmodifiableList());
  private static final Pattern FIRST_LAST = Pattern.compile("^[A-Z][a-z]+ [A-Z][a-z]+$");
  private static final Pattern SINGLE_WORD = Pattern.compile("^[A-Z][a-z]+$");

  @Override
  public double score(Candidate candidate) {
    String value = candidate.getValue().toString();
    String lower = TextUtils.lower(value);
    for (Pattern word : DENYLIST) {
      if (word.matcher(lower).find()) {
        return DENYLIST_PENALTY;
      }
    }
    double score = 0.0;
    if (value.length() <= 20) {
      score += 3;
    } else if (value.length() <= 30) {
      score += 1;
    }
    if (FIRST_LAST.matcher(value).matches()) {
      score += 5;
    } else if (SINGLE_WORD.matcher(value).matches()) {
      score += 2;
    }
    long periods = value.chars().filter(c -> c == '.').count();
    long commas = value.chars().filter(c -> c == ',').count();
    if (periods <= 1 && commas <= 1) {
      score += 1;
    }
    // earlier patterns are more specific labels
    score += 0.1 * (candidate.getPatternCount() - candidate.getPatternIndex());
    return score;
  }
}
