package com.cario.docintel.app.service.extraction;

import java.util.regex.Pattern;

/** Deterministic text cleanup applied before field extraction. */
@FunctionalInterface
public interface TextNormalizer {

  Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+(?=\\n)");

  String normalize(String text);

  default TextNormalizer andThen(TextNormalizer next) {
    return text -> next.normalize(normalize(text));
  }

  /** Unifies line endings, turns non-breaking spaces into spaces, trims line ends. */
  static TextNormalizer standard() {
    return text -> {
      String unified =
          text.replace("\r\n", "\n")
              .replace('\r', '\n')
              .replace('\u00A0', ' ')
              .replace('\t', ' ');
      return TRAILING_SPACE.matcher(unified).replaceAll("").strip();
    };
  }
}
