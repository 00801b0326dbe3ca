package io.remindly.parser.rules;

import io.remindly.model.Weekday;
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
 * Weekday references.
 *
 * <ul>
 *   <li>{@code 今週の金曜}, {@code 来週の月曜日}, {@code 再来週水曜}: that weekday of the Monday-based
 *       week
 *   <li>{@code 次の金曜}: the first such weekday strictly after today
 *   <li>{@code 金曜日}: today when it is that weekday and the time is still ahead, else the next one
 * </ul>
 */
public final class WeekdayReferenceRule extends PatternRule {
  private static final Pattern QUALIFIED =
      Pattern.compile(RuleSupport.WEEK_QUALIFIER + "の?" + RuleSupport.WEEKDAY + "曜");
  private static final Pattern NEXT = Pattern.compile("次の?" + RuleSupport.WEEKDAY + "曜");
  private static final Pattern BARE = Pattern.compile(RuleSupport.WEEKDAY + "曜");

  private final LocalTime defaultTime;

  public WeekdayReferenceRule(LocalTime defaultTime) {
    super("weekday-reference", QUALIFIED, NEXT, BARE);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    LocalDate today = now.toLocalDate();
    LocalTime time = RuleSupport.timeOr(text, defaultTime);

    if (m.pattern() == QUALIFIED) {
      Weekday weekday = RuleSupport.weekday(m.group(2));
      LocalDate monday =
          today
              .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
              .plusWeeks(RuleSupport.weekOffset(m.group(1)));
      LocalDate date = monday.plusDays(weekday.number() - 1L);
      return Optional.of(Resolution.once(RuleSupport.at(date, time, now)));
    }

    Weekday weekday = RuleSupport.weekday(m.group(1));
    if (m.pattern() == NEXT) {
      LocalDate date = today.with(TemporalAdjusters.next(weekday.toDayOfWeek()));
      return Optional.of(Resolution.once(RuleSupport.at(date, time, now)));
    }
    return Optional.of(Resolution.once(RuleSupport.nextWeekdayAt(weekday, time, now)));
  }
}
