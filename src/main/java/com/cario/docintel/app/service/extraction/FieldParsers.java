package com.cario.docintel.app.service.extraction;

import com.cario.docintel.app.model.ChargeLine;
import com.cario.docintel.app.util.TextUtils;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reusable {@link ValueParser}s for the document tables. */
public final class FieldParsers {

  static final int MIN_YEAR = 1950;
  static final int MAX_YEAR = 2100;

  private static final Pattern NUMERIC_DATE =
      Pattern.compile("(\\d{1,4})[/-](\\d{1,2})[/-](\\d{1,4})");
  private static final List<DateTimeFormatter> TEXT_DATES =
      List.of(
          textDate("MMMM d, uuuu"),
          textDate("MMMM d uuuu"),
          textDate("MMM d, uuuu"),
          textDate("MMM d uuuu"),
          textDate("MMM. d, uuuu"),
          textDate("d MMMM uuuu"),
          textDate("d MMM uuuu"));
  private static final Pattern AMOUNT =
      Pattern.compile(
          "([0-9][0-9,]*(?:\\.[0-9]+)?)\\s*(M|MM|MIL|MILLION|K|THOUSAND)?",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern NAME_TOKEN = Pattern.compile("[A-Za-z][A-Za-z'.-]*");

  private static final Set<String> NAME_NOISE =
      Set.of(
          "LICENSE", "LIC", "CDL", "DL", "EXP", "EXPIRES", "EXPIRATION", "CLASS", "NAME",
          "FIRST", "LAST", "DOB", "ISS", "DRIVER", "DRIVERS", "SEX", "HGT", "WGT", "EYES",
          "HAIR", "ADDRESS", "STATE", "DATE", "RESTRICTIONS", "ENDORSEMENTS", "NONE");
  private static final Set<String> IDENTIFIER_NOISE =
      Set.of("LICENSE", "NUMBER", "CLASS", "EXPIRES", "EXPIRATION", "RESTRICTIONS", "NONE");
  private static final Set<String> GENERIC_INSURANCE_WORDS =
      Set.of(
          "certificate", "of", "liability", "insurance", "general", "auto", "automobile",
          "commercial", "workers", "compensation", "umbrella", "excess", "the", "and",
          "coverage", "coverages", "policy", "producer", "insured", "holder", "company",
          "insurer", "insurers", "affording", "a", "b", "c", "d", "e", "f");

  private FieldParsers() {}

  /** Whitespace-collapsed text within a length window. */
  public static ValueParser<String> text(int minLength, int maxLength) {
    return raw -> {
      String value = TextUtils.trimPunctuation(TextUtils.collapseWhitespace(raw));
      return value.length() >= minLength && value.length() <= maxLength
          ? Optional.of(value)
          : Optional.empty();
    };
  }

  /** Accepts any match; the value is the constant. Used by signal-count fields. */
  public static <T> ValueParser<T> constant(T value) {
    return raw -> Optional.of(value);
  }

  /**
   * Person name: drops license numbers, dates and form labels, turns {@code LAST, FIRST} into
   * {@code First Last}, title-cases, and needs at least two name tokens.
   */
  public static ValueParser<String> personName() {
    return raw -> {
      String value = TextUtils.collapseWhitespace(raw);
      int comma = value.indexOf(',');
      if (comma > 0) {
        value = value.substring(comma + 1).trim() + " " + value.substring(0, comma).trim();
      }
      List<String> tokens = new ArrayList<>();
      for (String token : value.split(" ")) {
        if (token.isEmpty()
            || TextUtils.containsDigit(token)
            || NAME_NOISE.contains(TextUtils.upper(token.replace(":", "")))
            || !NAME_TOKEN.matcher(token).matches()) {
          continue;
        }
        tokens.add(token);
      }
      if (tokens.size() < 2 || tokens.size() > 5) {
        return Optional.empty();
      }
      String name = TextUtils.titleCase(String.join(" ", tokens));
      return name.length() > 3 ? Optional.of(name) : Optional.empty();
    };
  }

  /**
   * Calendar date. Numeric forms are month-first unless the first part has four digits
   * (year-first); two-digit years map into 1950-2049. Month-name forms are English. Years
   * outside 1950-2100 are rejected. Past dates are accepted: whether a date is current is the
   * verification gate's decision.
   */
  public static ValueParser<LocalDate> date() {
    return raw -> {
      String value = TextUtils.collapseWhitespace(raw);
      Matcher m = NUMERIC_DATE.matcher(value);
      if (m.matches()) {
        return numericDate(m.group(1), m.group(2), m.group(3));
      }
      for (DateTimeFormatter formatter : TEXT_DATES) {
        Optional<LocalDate> parsed = parseWith(value, formatter);
        if (parsed.isPresent()) {
          return plausible(parsed.get());
        }
      }
      return Optional.empty();
    };
  }

  private static Optional<LocalDate> parseWith(String value, DateTimeFormatter formatter) {
    try {
      return Optional.of(LocalDate.parse(value, formatter));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDate> numericDate(String first, String second, String third) {
    int year;
    int month;
    int day;
    if (first.length() == 4) {
      year = Integer.parseInt(first);
      month = Integer.parseInt(second);
      day = Integer.parseInt(third);
    } else if (first.length() <= 2 && (third.length() == 2 || third.length() == 4)) {
      month = Integer.parseInt(first);
      day = Integer.parseInt(second);
      year = Integer.parseInt(third);
      if (third.length() == 2) {
        year += year < 50 ? 2000 : 1900;
      }
    } else {
      return Optional.empty();
    }
    try {
      return plausible(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private static Optional<LocalDate> plausible(LocalDate date) {
    return date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR
        ? Optional.of(date)
        : Optional.empty();
  }

  /** Driver license number: 7-15 alphanumerics with at least one digit. */
  public static ValueParser<String> licenseNumber() {
    return identifier(7, 15);
  }

  /** Insurance policy number: 5-25 characters, at least one digit, not shaped like a date. */
  public static ValueParser<String> policyNumber() {
    ValueParser<String> base = identifier(5, 25);
    return raw -> {
      if (NUMERIC_DATE.matcher(raw.trim()).matches()) {
        return Optional.empty();
      }
      return base.parse(raw);
    };
  }

  /** Invoice, receipt or bill of lading number: 3-20 characters with at least one digit. */
  public static ValueParser<String> documentNumber() {
    return identifier(3, 20);
  }

  private static ValueParser<String> identifier(int minLength, int maxLength) {
    return raw -> {
      String value = TextUtils.upper(raw.trim()).replaceAll("[^A-Z0-9-]", "");
      String compact = value.replace("-", "");
      if (compact.length() < minLength
          || compact.length() > maxLength
          || !TextUtils.containsDigit(compact)
          || IDENTIFIER_NOISE.contains(compact)) {
        return Optional.empty();
      }
      return Optional.of(value);
    };
  }

  /** One of the given single-letter codes, upper-cased. */
  public static ValueParser<String> letterCode(Set<String> allowed) {
    return raw -> {
      String value = TextUtils.upper(raw.trim());
      return allowed.contains(value) ? Optional.of(value) : Optional.empty();
    };
  }

  public static ValueParser<String> usState() {
    return letterCode(TextUtils.US_STATE_CODES);
  }

  /**
   * Dollar amount in cents. Accepts thousands separators and an {@code M}/{@code K} suffix
   * ({@code 1.5M}, {@code 500 K}); rejects values outside the window.
   */
  public static ValueParser<Long> moneyCents(long minCents, long maxCents) {
    return raw -> {
      Matcher m = AMOUNT.matcher(raw.trim());
      if (!m.find()) {
        return Optional.empty();
      }
      BigDecimal dollars;
      try {
        dollars = new BigDecimal(m.group(1).replace(",", ""));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
      String suffix = m.group(2) == null ? "" : TextUtils.upper(m.group(2));
      if (suffix.startsWith("M")) {
        dollars = dollars.multiply(BigDecimal.valueOf(1_000_000));
      } else if (suffix.startsWith("K") || suffix.startsWith("T")) {
        dollars = dollars.multiply(BigDecimal.valueOf(1_000));
      }
      BigDecimal cents = dollars.movePointRight(2).setScale(0, RoundingMode.HALF_UP);
      if (cents.compareTo(BigDecimal.valueOf(minCents)) < 0
          || cents.compareTo(BigDecimal.valueOf(maxCents)) > 0) {
        return Optional.empty();
      }
      return Optional.of(cents.longValueExact());
    };
  }

  /** Whole number (e.g. pounds) within a window; separators ignored. */
  public static ValueParser<Long> wholeNumber(long min, long max) {
    return raw -> {
      String digits = raw.replace(",", "").trim();
      if (!digits.matches("\\d{1,9}")) {
        return Optional.empty();
      }
      long value = Long.parseLong(digits);
      return value >= min && value <= max ? Optional.of(value) : Optional.empty();
    };
  }

  /** Decimal quantity (e.g. labor hours) above zero and at most {@code max}. */
  public static ValueParser<BigDecimal> positiveDecimal(BigDecimal max) {
    return raw -> {
      String digits = raw.replace(",", "").trim();
      if (!digits.matches("\\d{1,6}(?:\\.\\d{1,4})?")) {
        return Optional.empty();
      }
      BigDecimal value = new BigDecimal(digits);
      return value.signum() > 0 && value.compareTo(max) <= 0
          ? Optional.of(value)
          : Optional.empty();
    };
  }

  /**
   * Charge line from a raw {@code description=amount} pair, as produced by a pattern joining
   * its two groups with {@code =}. The amount must be positive and at most {@code maxCents}.
   */
  public static ValueParser<ChargeLine> chargeLine(long maxCents) {
    ValueParser<String> description = text(3, 60);
    ValueParser<Long> amount = moneyCents(1, maxCents);
    return raw -> {
      int split = raw.lastIndexOf('=');
      if (split <= 0) {
        return Optional.empty();
      }
      Optional<String> desc = description.parse(raw.substring(0, split));
      Optional<Long> cents = amount.parse(raw.substring(split + 1));
      if (desc.isEmpty() || cents.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new ChargeLine(TextUtils.titleCase(desc.get()), cents.get()));
    };
  }

  /** {@code houston, tx} becomes {@code Houston, TX}; the state must be a US code. */
  public static ValueParser<String> cityState() {
    return raw -> {
      String value = TextUtils.collapseWhitespace(raw);
      int comma = value.lastIndexOf(',');
      if (comma <= 0) {
        return Optional.empty();
      }
      String city = TextUtils.trimPunctuation(value.substring(0, comma));
      String state = TextUtils.upper(value.substring(comma + 1).trim());
      if (city.length() < 2 || !TextUtils.US_STATE_CODES.contains(state)) {
        return Optional.empty();
      }
      return Optional.of(TextUtils.titleCase(city) + ", " + state);
    };
  }

  /** Insurer name; rejects captures made only of generic certificate vocabulary. */
  public static ValueParser<String> companyName() {
    ValueParser<String> base = text(3, 80);
    return raw -> {
      Optional<String> value = base.parse(raw);
      if (value.isEmpty()) {
        return value;
      }
      boolean generic = true;
      for (String token : TextUtils.lower(value.get()).split("[^a-z0-9&]+")) {
        if (!token.isEmpty() && !GENERIC_INSURANCE_WORDS.contains(token)) {
          generic = false;
          break;
        }
      }
      return generic ? Optional.empty() : value;
    };
  }

  /** Vendor or customer name; all-caps captures are title-cased, mixed case is kept. */
  public static ValueParser<String> businessName(int minLength, int maxLength) {
    ValueParser<String> base = text(minLength, maxLength);
    return raw ->
        base.parse(raw)
            .map(name -> name.equals(TextUtils.upper(name)) ? TextUtils.titleCase(name) : name);
  }

  /** Canonical title-cased label for a matched phrase, e.g. agreement types. */
  public static ValueParser<String> label() {
    return raw -> {
      String value = TextUtils.collapseWhitespace(raw);
      return value.isEmpty() ? Optional.empty() : Optional.of(TextUtils.titleCase(value));
    };
  }

  private static DateTimeFormatter textDate(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.US)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
