package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.model.RecurrenceRule;
import io.remindly.parser.Resolution;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fixed day every month: {@code 毎月25日}. The first occurrence is this month's day (clamped to
 * the month's last day) unless it is not ahead of now, in which case it is next month's.
 */
public final class MonthlyDayRule extends PatternRule {
  private static final Pattern MONTHLY_DAY = Pattern.compile("毎月\\s*の?\\s*(\\d{1,2})日(?!間)");

  private final LocalTime defaultTime;

  public MonthlyDayRule(LocalTime defaultTime) {
    super("monthly-day", MONTHLY_DAY);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    int day = Integer.parseInt(m.group(1));
    if (day < 1 || day > 31) {
      return Optional.empty();
    }
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    YearMonth month = YearMonth.from(now.toLocalDate());

    ZonedDateTime first = RuleSupport.at(CalendarMath.clampedDay(month, day), time, now);
    if (!first.isAfter(now)) {
      first = RuleSupport.at(CalendarMath.clampedDay(month.plusMonths(1), day), time, now);
    }
    return Optional.of(Resolution.recurring(first, RecurrenceRule.monthlyOnDay(day)));
  }
}
