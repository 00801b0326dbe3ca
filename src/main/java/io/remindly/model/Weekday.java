package io.remindly.model;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week by its Japanese kanji. */
public enum Weekday {
  MONDAY(1, '月'),
  TUESDAY(2, '火'),
  WEDNESDAY(3, '水'),
  THURSDAY(4, '木'),
  FRIDAY(5, '金'),
  SATURDAY(6, '土'),
  SUNDAY(7, '日');

  private final int isoNumber;
  private final char kanji;

  Weekday(int isoNumber, char kanji) {
    this.isoNumber = isoNumber;
    this.kanji = kanji;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the single kanji used in phrases such as {@code 金曜}.
   *
   * @return the weekday kanji
   */
  public char kanji() {
    return kanji;
  }

  /**
   * Returns the canonical rule token, e.g. {@code 金曜日}.
   *
   * @return the weekday token
   */
  public String token() {
    return kanji + "曜日";
  }

  @Override
  public String toString() {
    return token();
  }

  private static final Map<Character, Weekday> BY_KANJI =
      Map.of(
          '月', MONDAY,
          '火', TUESDAY,
          '水', WEDNESDAY,
          '木', THURSDAY,
          '金', FRIDAY,
          '土', SATURDAY,
          '日', SUNDAY);

  /**
   * Parses a weekday written as {@code 金}, {@code 金曜} or {@code 金曜日}.
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    if (s == null || s.isEmpty()) {
      return Optional.empty();
    }
    String rest = s.substring(1);
    if (!rest.isEmpty() && !rest.equals("曜") && !rest.equals("曜日")) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_KANJI.get(s.charAt(0)));
  }

  /**
   * Returns the weekday for a single kanji.
   *
   * @param kanji the kanji character
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromKanji(char kanji) {
    return Optional.ofNullable(BY_KANJI.get(kanji));
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(isoNumber);
  }
}
