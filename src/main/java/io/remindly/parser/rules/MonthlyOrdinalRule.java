package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.model.OrdinalWeekday;
import io.remindly.model.RecurrenceRule;
import io.remindly.parser.Resolution;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Monthly ordinal weekdays: {@code 毎月第3火曜日}, {@code 毎月第1,3金曜}, and the day-before form
 * {@code 毎月第2水曜日の前日}.
 *
 * <p>Two instances sit in the detector: the day-before form first, then the plain form.
 */
public final class MonthlyOrdinalRule extends PatternRule {
  private static final String ORDINAL_WEEKDAY =
      "毎月\\s*の?\\s*第(\\d{1,2}(?:\\s*[,、]\\s*\\d{1,2})*)\\s*" + RuleSupport.WEEKDAY + "曜日?";
  private static final Pattern WITH_DAY_BEFORE =
      Pattern.compile(ORDINAL_WEEKDAY + "\\s*の?前日");
  private static final Pattern PLAIN = Pattern.compile(ORDINAL_WEEKDAY + "(?!\\s*の?前日)");

  private final boolean dayBefore;
  private final LocalTime defaultTime;

  public MonthlyOrdinalRule(boolean dayBefore, LocalTime defaultTime) {
    super(
        dayBefore ? "monthly-ordinal-day-before" : "monthly-ordinal",
        dayBefore ? WITH_DAY_BEFORE : PLAIN);
    this.dayBefore = dayBefore;
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    Optional<List<Integer>> ordinals =
        OrdinalWeekday.parseOrdinals(m.group(1).replaceAll("\\s", ""));
    if (ordinals.isEmpty()) {
      return Optional.empty();
    }
    OrdinalWeekday target =
        new OrdinalWeekday(ordinals.get(), RuleSupport.weekday(m.group(2)), dayBefore);
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    RecurrenceRule rule = RecurrenceRule.monthlyOn(target);
    return CalendarMath.nextOrdinalWeekday(target, time, now)
        .map(first -> Resolution.recurring(first, rule));
  }
}
