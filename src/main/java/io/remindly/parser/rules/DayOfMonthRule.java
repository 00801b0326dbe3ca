package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.parser.Resolution;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An explicit day within a qualified month: {@code 来月15日}, {@code 再来月の3日}. A day the month
 * does not have resolves to nothing rather than to a neighbouring date.
 */
public final class DayOfMonthRule extends PatternRule {
  private static final Pattern DAY_OF_MONTH =
      Pattern.compile(RuleSupport.MONTH_QUALIFIER + "の?(\\d{1,2})日(?!間|後)");

  private final LocalTime defaultTime;

  public DayOfMonthRule(LocalTime defaultTime) {
    super("day-of-month", DAY_OF_MONTH);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    YearMonth month = RuleSupport.month(m.group(1), now);
    int day = Integer.parseInt(m.group(2));
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    return CalendarMath.exactDay(month, day)
        .map(date -> Resolution.once(RuleSupport.at(date, time, now)));
  }
}
