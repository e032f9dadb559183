package com.cario.docintel.app.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Small string helpers shared by the field parsers. */
public final class TextUtils {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** USPS two-letter codes for the states, DC and the territories. */
  public static final Set<String> US_STATE_CODES =
      Set.of(
          "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA", "HI", "ID", "IL", "IN",
          "IA", "KS", "KY", "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV",
          "NH", "NJ", "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN",
          "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY", "DC", "PR", "GU", "VI", "AS", "MP");

  private TextUtils() {}

  public static String collapseWhitespace(String value) {
    if (value == null) {
      return "";
    }
    return WHITESPACE.matcher(value).replaceAll(" ").trim();
  }

  /** {@code O'BRIEN-SMITH} becomes {@code O'Brien-Smith}. */
  public static String titleCase(String value) {
    StringBuilder out = new StringBuilder(value.length());
    boolean startOfWord = true;
    for (char c : value.toCharArray()) {
      if (Character.isLetter(c)) {
        out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
        startOfWord = false;
      } else {
        out.append(c);
        startOfWord = c == ' ' || c == '-' || c == '\'';
      }
    }
    return out.toString();
  }

  /** Drops trailing punctuation and separators left behind by greedy captures. */
  public static String trimPunctuation(String value) {
    String trimmed = value.trim();
    int end = trimmed.length();
    while (end > 0 && ",;:-_|/".indexOf(trimmed.charAt(end - 1)) >= 0) {
      end--;
    }
    return trimmed.substring(0, end).trim();
  }

  public static boolean containsDigit(String value) {
    return value.chars().anyMatch(Character::isDigit);
  }

  public static String upper(String value) {
    return value.toUpperCase(Locale.ROOT);
  }

  public static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
