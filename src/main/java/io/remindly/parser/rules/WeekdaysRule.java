package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.model.RecurrenceRule;
import io.remindly.parser.Resolution;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Monday to Friday: {@code 平日}, {@code 平日の朝}, {@code 平日毎朝7時}. */
public final class WeekdaysRule extends PatternRule {
  private static final Pattern WEEKDAYS = Pattern.compile("平日");

  private final LocalTime defaultTime;

  public WeekdaysRule(LocalTime defaultTime) {
    super("weekdays", WEEKDAYS);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    LocalDate start = now.toLocalDate();
    if (!RuleSupport.at(start, time, now).isAfter(now)) {
      start = start.plusDays(1);
    }
    LocalDate first = CalendarMath.weekdayOnOrAfter(start);
    return Optional.of(
        Resolution.recurring(RuleSupport.at(first, time, now), RecurrenceRule.weekdays()));
  }
}
