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
 * First or last day of this month, next month or the month after next: {@code 今月末}, {@code
 * 来月の末日}, {@code 再来月の最終日}, {@code 月末}, {@code 来月初め}, {@code 来月頭}.
 */
public final class MonthBoundaryRule extends PatternRule {
  private static final Pattern MONTH_END =
      Pattern.compile(RuleSupport.MONTH_QUALIFIER + "の?(?:末日|最終日|末)|月末");
  private static final Pattern MONTH_START =
      Pattern.compile(RuleSupport.MONTH_QUALIFIER + "の?(?:初日|初め|はじめ|頭)|月初め?");

  private final LocalTime defaultTime;

  public MonthBoundaryRule(LocalTime defaultTime) {
    super("month-boundary", MONTH_END, MONTH_START);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    YearMonth month = RuleSupport.month(m.group(1), now);
    LocalDate date =
        m.pattern() == MONTH_END ? CalendarMath.lastDayOfMonth(month) : month.atDay(1);
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    return Optional.of(Resolution.once(RuleSupport.at(date, time, now)));
  }
}
