package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.parser.Resolution;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An explicit month and day: {@code 7月12日} or {@code 7/12}. A date already behind today moves to
 * next year; a date that does not exist resolves to nothing.
 */
public final class MonthDayRule extends PatternRule {
  private static final Pattern KANJI_DATE = Pattern.compile("(?<!\\d)(\\d{1,2})月(\\d{1,2})日");
  private static final Pattern SLASH_DATE =
      Pattern.compile("(?<![\\d/])(\\d{1,2})/(\\d{1,2})(?![\\d/])");

  private final LocalTime defaultTime;

  public MonthDayRule(LocalTime defaultTime) {
    super("month-day", KANJI_DATE, SLASH_DATE);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    int month = Integer.parseInt(m.group(1));
    int day = Integer.parseInt(m.group(2));
    if (month < 1 || month > 12) {
      return Optional.empty();
    }

    LocalDate today = now.toLocalDate();
    Optional<LocalDate> date =
        CalendarMath.exactDay(YearMonth.of(today.getYear(), month), day)
            .filter(d -> !d.isBefore(today));
    if (date.isEmpty()) {
      date = CalendarMath.exactDay(YearMonth.of(today.getYear() + 1, month), day);
    }

    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    return date.map(d -> Resolution.once(RuleSupport.at(d, time, now)));
  }
}
