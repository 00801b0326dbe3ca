package io.remindly.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * An ordinal-weekday-of-month target such as {@code 第3火曜日} or {@code 第1,3金曜日の前日}.
 *
 * @param ordinals the ordinals (1-5), sorted and distinct
 * @param weekday the weekday
 * @param dayBefore whether the reminder fires on the day before each match
 */
public record OrdinalWeekday(List<Integer> ordinals, Weekday weekday, boolean dayBefore) {
  /** Highest ordinal a weekday can have within one month. */
  public static final int MAX_ORDINAL = 5;

  private static final Pattern TOKEN =
      Pattern.compile("第(\\d{1,2}(?:[,、]\\d{1,2})*)([月火水木金土日])(?:曜日?)?(の前日)?");

  /** Validates ordinals and stores them sorted and distinct. */
  public OrdinalWeekday {
    if (ordinals == null || ordinals.isEmpty()) {
      throw new IllegalArgumentException("at least one ordinal is required");
    }
    if (weekday == null) {
      throw new IllegalArgumentException("weekday is required");
    }
    for (int n : ordinals) {
      if (n < 1 || n > MAX_ORDINAL) {
        throw new IllegalArgumentException("ordinal out of range: " + n);
      }
    }
    ordinals = ordinals.stream().distinct().sorted().collect(Collectors.toUnmodifiableList());
  }

  /**
   * Parses a rule token. The token must match in full.
   *
   * @param s the token
   * @return the ordinal weekday, or empty if the token is not in the vocabulary
   */
  public static Optional<OrdinalWeekday> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    Matcher m = TOKEN.matcher(s.trim());
    if (!m.matches()) {
      return Optional.empty();
    }
    Optional<List<Integer>> ordinals = parseOrdinals(m.group(1));
    if (ordinals.isEmpty()) {
      return Optional.empty();
    }
    Weekday weekday = Weekday.fromKanji(m.group(2).charAt(0)).orElseThrow();
    return Optional.of(new OrdinalWeekday(ordinals.get(), weekday, m.group(3) != null));
  }

  /**
   * Parses a comma separated ordinal list such as {@code 1,3} or {@code 2、4}.
   *
   * @param list the list text
   * @return the ordinals, or empty if any entry is outside 1-5
   */
  public static Optional<List<Integer>> parseOrdinals(String list) {
    List<Integer> result = new ArrayList<>();
    for (String part : list.split("[,、]")) {
      if (part.isBlank()) {
        continue;
      }
      int n = Integer.parseInt(part.trim());
      if (n < 1 || n > MAX_ORDINAL) {
        return Optional.empty();
      }
      result.add(n);
    }
    return result.isEmpty() ? Optional.empty() : Optional.of(result);
  }

  /**
   * Returns the canonical rule token.
   *
   * @return the token, e.g. {@code 第1,3金曜日の前日}
   */
  public String token() {
    String list = ordinals.stream().map(String::valueOf).collect(Collectors.joining(","));
    return "第" + list + weekday.token() + (dayBefore ? "の前日" : "");
  }

  @Override
  public String toString() {
    return token();
  }
}
