package io.remindly.parser;

import io.remindly.parser.rules.DailyRule;
import io.remindly.parser.rules.EveryWeekRule;
import io.remindly.parser.rules.MonthlyDayRule;
import io.remindly.parser.rules.MonthlyOrdinalRule;
import io.remindly.parser.rules.WeekdayCadenceRule;
import io.remindly.parser.rules.WeekdaysRule;
import java.time.LocalTime;
import java.util.List;

/**
 * Detects repeating phrases such as {@code 毎月第3火曜日} or {@code 毎朝7時} and computes their first
 * occurrence. Consulted before {@link TemporalResolver}.
 */
public final class RecurrenceDetector extends RuleChain {
  /**
   * Creates the detector.
   *
   * @param defaultTime the time used when a phrase states none
   */
  public RecurrenceDetector(LocalTime defaultTime) {
    super(
        List.of(
            new MonthlyOrdinalRule(true, defaultTime),
            new MonthlyOrdinalRule(false, defaultTime),
            new MonthlyDayRule(defaultTime),
            WeekdayCadenceRule.biweekly(defaultTime),
            WeekdayCadenceRule.weekly(defaultTime),
            new EveryWeekRule(defaultTime),
            new DailyRule(defaultTime),
            new WeekdaysRule(defaultTime)));
  }
}
