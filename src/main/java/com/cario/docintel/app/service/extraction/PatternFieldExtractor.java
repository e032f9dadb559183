package com.cario.docintel.app.service.extraction;

import com.cario.docintel.app.model.FieldMatch;
import com.cario.docintel.app.model.SignalEvidence;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import lombok.extern.log4j.Log4j2;

/**
 * Applies a document's field table to text.
 *
 * <p>Total over all inputs: a field whose parser or scorer fails is logged and left absent, and
 * the remaining fields are still extracted. Results depend only on the text and the table.
 */
@Log4j2
public class PatternFieldExtractor {

  public FieldExtraction extract(String text, List<FieldSpec> specs) {
    String safeText = text == null ? "" : text;
    Map<String, Object> values = new LinkedHashMap<>();
    Map<String, FieldMatch> details = new LinkedHashMap<>();

    for (FieldSpec spec : specs) {
      FieldOutcome outcome;
      try {
        outcome = extractField(safeText, spec);
      } catch (RuntimeException e) {
        log.error("extract.field.error field={} msg={}", spec.getName(), e.getMessage(), e);
        outcome = FieldOutcome.absent(spec.getName());
      }
      values.put(spec.getName(), outcome.value);
      details.put(spec.getName(), outcome.match);
    }
    return new FieldExtraction(
        Collections.unmodifiableMap(values), Collections.unmodifiableMap(details));
  }

  private FieldOutcome extractField(String text, FieldSpec spec) {
    switch (spec.getMode()) {
      case BEST_CANDIDATE:
        return bestCandidate(text, spec);
      case SIGNAL_COUNT:
        return signalCount(text, spec);
      case COLLECT:
        return collect(text, spec);
      case FIRST_MATCH:
      default:
        return firstMatch(text, spec);
    }
  }

  private FieldOutcome firstMatch(String text, FieldSpec spec) {
    List<FieldPattern> patterns = spec.getPatterns();
    for (int i = 0; i < patterns.size(); i++) {
      Matcher m = patterns.get(i).getRegex().matcher(text);
      while (m.find()) {
        String raw = patterns.get(i).capture(m);
        Optional<?> value = parse(spec, raw);
        if (value.isPresent()) {
          return new FieldOutcome(
              value.get(), new FieldMatch(spec.getName(), i, raw, 1, List.of(i)));
        }
      }
    }
    return FieldOutcome.absent(spec.getName());
  }

  private FieldOutcome bestCandidate(String text, FieldSpec spec) {
    if (spec.getScorer() == null) {
      throw new IllegalStateException("field " + spec.getName() + " has no candidate scorer");
    }
    List<FieldPattern> patterns = spec.getPatterns();
    Candidate best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    int accepted = 0;
    Set<Integer> matchedPatterns = new TreeSet<>();

    for (int i = 0; i < patterns.size(); i++) {
      Matcher m = patterns.get(i).getRegex().matcher(text);
      while (m.find()) {
        String raw = patterns.get(i).capture(m);
        Optional<?> value = parse(spec, raw);
        if (value.isEmpty()) {
          continue;
        }
        Candidate candidate = new Candidate(value.get(), raw, i, patterns.size(), m.start());
        double score = spec.getScorer().score(candidate);
        if (score <= spec.getMinimumScore()) {
          continue;
        }
        accepted++;
        matchedPatterns.add(i);
        // strictly greater: earlier pattern, then earlier position, keeps ties
        if (best == null || score > bestScore) {
          best = candidate;
          bestScore = score;
        }
      }
    }
    if (best == null) {
      return FieldOutcome.absent(spec.getName());
    }
    return new FieldOutcome(
        best.getValue(),
        new FieldMatch(
            spec.getName(),
            best.getPatternIndex(),
            best.getRaw(),
            accepted,
            List.copyOf(matchedPatterns)));
  }

  private FieldOutcome signalCount(String text, FieldSpec spec) {
    List<FieldPattern> patterns = spec.getPatterns();
    List<Integer> indexes = new ArrayList<>();
    List<String> snippets = new ArrayList<>();
    for (int i = 0; i < patterns.size(); i++) {
      Matcher m = patterns.get(i).getRegex().matcher(text);
      while (m.find()) {
        String raw = m.group().trim();
        if (parse(spec, raw).isPresent()) {
          indexes.add(i);
          snippets.add(raw);
          break;
        }
      }
    }
    if (indexes.size() < spec.getMinimumSignals() || indexes.isEmpty()) {
      return new FieldOutcome(
          null, new FieldMatch(spec.getName(), null, null, indexes.size(), List.copyOf(indexes)));
    }
    SignalEvidence evidence =
        new SignalEvidence(indexes.size(), List.copyOf(indexes), List.copyOf(snippets));
    return new FieldOutcome(
        evidence,
        new FieldMatch(
            spec.getName(),
            indexes.get(0),
            snippets.get(0),
            indexes.size(),
            evidence.getPatternIndexes()));
  }

  private FieldOutcome collect(String text, FieldSpec spec) {
    List<FieldPattern> patterns = spec.getPatterns();
    Set<Object> collected = new LinkedHashSet<>();
    Set<Integer> matchedPatterns = new TreeSet<>();
    Integer firstIndex = null;
    String firstRaw = null;

    for (int i = 0; i < patterns.size() && collected.size() < spec.getMaxCollected(); i++) {
      Matcher m = patterns.get(i).getRegex().matcher(text);
      while (m.find() && collected.size() < spec.getMaxCollected()) {
        String raw = patterns.get(i).capture(m);
        Optional<?> value = parse(spec, raw);
        if (value.isPresent() && collected.add(value.get())) {
          matchedPatterns.add(i);
          if (firstIndex == null) {
            firstIndex = i;
            firstRaw = raw;
          }
        }
      }
    }
    if (collected.isEmpty()) {
      return FieldOutcome.absent(spec.getName());
    }
    Object value;
    if (spec.getCollectJoiner() != null) {
      List<String> parts = new ArrayList<>();
      collected.forEach(v -> parts.add(v.toString()));
      value = String.join(spec.getCollectJoiner(), parts);
    } else {
      value = List.copyOf(collected);
    }
    return new FieldOutcome(
        value,
        new FieldMatch(
            spec.getName(), firstIndex, firstRaw, collected.size(), List.copyOf(matchedPatterns)));
  }

  private static Optional<?> parse(FieldSpec spec, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    Optional<?> parsed = spec.getParser().parse(raw);
    return parsed == null ? Optional.empty() : parsed;
  }

  private static final class FieldOutcome {
    private final Object value;
    private final FieldMatch match;

    private FieldOutcome(Object value, FieldMatch match) {
      this.value = value;
      this.match = match;
    }

    static FieldOutcome absent(String field) {
      return new FieldOutcome(null, FieldMatch.absent(field));
    }
  }
}
