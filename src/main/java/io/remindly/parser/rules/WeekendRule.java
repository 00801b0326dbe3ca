package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.parser.Resolution;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weekend references: {@code 今週末} / {@code 週末} resolve to today on a Saturday or Sunday and to
 * the coming Saturday otherwise; {@code 来週末} resolves to the Saturday a week after that.
 */
public final class WeekendRule extends PatternRule {
  private static final Pattern WEEKEND = Pattern.compile("(来週末|今週末|この週末|週末)");

  private final LocalTime defaultTime;

  public WeekendRule(LocalTime defaultTime) {
    super("weekend", WEEKEND);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    LocalDate today = now.toLocalDate();
    // Saturday of the current Monday-based week.
    LocalDate saturday =
        today.getDayOfWeek() == DayOfWeek.SUNDAY
            ? today.minusDays(1)
            : today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY));

    LocalDate date;
    if (m.group(1).equals("来週末")) {
      date = saturday.plusWeeks(1);
    } else {
      date = CalendarMath.isWeekend(today) ? today : saturday;
    }
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    return Optional.of(Resolution.once(RuleSupport.at(date, time, now)));
  }
}
