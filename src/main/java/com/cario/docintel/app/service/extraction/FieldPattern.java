package com.cario.docintel.app.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * One structural pattern in a field table, plus which capture groups make up the raw value.
 *
 * <p>By default the raw value is group 1 (or the whole match when the regex has no groups).
 * Patterns that split a value over several groups (first/last name, city/state) name the groups
 * and the joiner.
 */
public final class FieldPattern {

  private final Pattern regex;
  private final int[] groups;
  private final String joiner;

  private FieldPattern(Pattern regex, int[] groups, String joiner) {
    this.regex = Objects.requireNonNull(regex);
    this.groups = groups.clone();
    this.joiner = joiner;
  }

  public static FieldPattern of(String regex) {
    return new FieldPattern(Pattern.compile(regex), new int[0], " ");
  }

  /** Case-insensitive pattern. */
  public static FieldPattern ci(String regex) {
    return new FieldPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), new int[0], " ");
  }

  /** Pattern whose raw value is the listed groups joined by {@code joiner}, skipping nulls. */
  public static FieldPattern joined(String regex, int flags, String joiner, int... groups) {
    return new FieldPattern(Pattern.compile(regex, flags), groups, joiner);
  }

  public Pattern getRegex() {
    return regex;
  }

  /** Raw value of one match; never null, possibly blank. */
  public String capture(MatchResult match) {
    if (groups.length == 0) {
      String value = match.groupCount() >= 1 ? match.group(1) : match.group();
      return value == null ? "" : value.trim();
    }
    List<String> parts = new ArrayList<>(groups.length);
    for (int group : groups) {
      String value = group <= match.groupCount() ? match.group(group) : null;
      if (value != null && !value.isBlank()) {
        parts.add(value.trim());
      }
    }
    return String.join(joiner, parts);
  }

  @Override
  public String toString() {
    return regex.pattern();
  }
}
