package com.cario.docintel.app.service.extraction;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs digit-for-letter OCR substitutions in delivery vocabulary ({@code del1very}, {@code
 * rece1ved}, {@code pr00f}). Only whole known words are rewritten, so numbers are untouched.
 */
public class OcrArtifactCleaner implements TextNormalizer {

  private static final Map<String, String> FIXES = new LinkedHashMap<>();

  static {
    FIXES.put("del1very", "delivery");
    FIXES.put("de1ivery", "delivery");
    FIXES.put("d3livery", "delivery");
    FIXES.put("del!very", "delivery");
    FIXES.put("del1vered", "delivered");
    FIXES.put("de1ivered", "delivered");
    FIXES.put("d3livered", "delivered");
    FIXES.put("del!vered", "delivered");
    FIXES.put("s1gnature", "signature");
    FIXES.put("s1gned", "signed");
    FIXES.put("rec31ved", "received");
    FIXES.put("rece1ved", "received");
    FIXES.put("acc3pted", "accepted");
    FIXES.put("accept3d", "accepted");
    FIXES.put("pr00f", "proof");
    FIXES.put("pr0of", "proof");
    FIXES.put("p0d", "pod");
    FIXES.put("dat3", "date");
    FIXES.put("t1me", "time");
    FIXES.put("tim3", "time");
    FIXES.put("c0nfirmat10n", "confirmation");
    FIXES.put("c0nfirmati0n", "confirmation");
    FIXES.put("c0mplete", "complete");
    FIXES.put("compl3te", "complete");
  }

  private static final Pattern KNOWN =
      Pattern.compile(
          "(?<![A-Za-z0-9])("
              + String.join(
                  "|", FIXES.keySet().stream().map(Pattern::quote).toArray(String[]::new))
              + ")(?![A-Za-z0-9])",
          Pattern.CASE_INSENSITIVE);

  @Override
  public String normalize(String text) {
    Matcher m = KNOWN.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (m.find()) {
      String found = m.group(1);
      String fix = FIXES.get(found.toLowerCase(Locale.ROOT));
      m.appendReplacement(out, Matcher.quoteReplacement(matchCase(found, fix)));
    }
    m.appendTail(out);
    return out.toString();
  }

  private static String matchCase(String original, String replacement) {
    boolean allUpper =
        original.chars().filter(Character::isLetter).allMatch(Character::isUpperCase);
    if (allUpper) {
      return replacement.toUpperCase(Locale.ROOT);
    }
    if (Character.isUpperCase(original.charAt(0))) {
      return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
    }
    return replacement;
  }
}
