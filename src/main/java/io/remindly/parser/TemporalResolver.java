package io.remindly.parser;

import io.remindly.parser.rules.DayOfMonthRule;
import io.remindly.parser.rules.MonthBoundaryRule;
import io.remindly.parser.rules.MonthDayRule;
import io.remindly.parser.rules.NamedDayRule;
import io.remindly.parser.rules.RelativeOffsetRule;
import io.remindly.parser.rules.TimeOfDayRule;
import io.remindly.parser.rules.WeekdayReferenceRule;
import io.remindly.parser.rules.WeekendRule;
import java.time.LocalTime;
import java.util.List;

/** Resolves single-shot phrases such as {@code 明日18時} or {@code 30分後} to one occurrence. */
public final class TemporalResolver extends RuleChain {
  /**
   * Creates the resolver.
   *
   * @param defaultTime the time used when a phrase names a day but no time
   */
  public TemporalResolver(LocalTime defaultTime) {
    super(
        List.of(
            new RelativeOffsetRule(),
            new NamedDayRule(defaultTime),
            new WeekendRule(defaultTime),
            new MonthBoundaryRule(defaultTime),
            new DayOfMonthRule(defaultTime),
            new WeekdayReferenceRule(defaultTime),
            new MonthDayRule(defaultTime),
            new TimeOfDayRule()));
  }
}
