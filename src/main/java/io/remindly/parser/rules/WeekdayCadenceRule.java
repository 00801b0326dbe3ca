package io.remindly.parser.rules;

import io.remindly.model.RecurrenceKind;
import io.remindly.model.RecurrenceRule;
import io.remindly.model.Weekday;
import io.remindly.parser.Resolution;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named weekday every week ({@code 毎週金曜}, {@code 毎金曜}, {@code 毎日曜日}) or every other week
 * ({@code 隔週月曜}). The first occurrence is the next such weekday at the stated time.
 */
public final class WeekdayCadenceRule extends PatternRule {
  private static final Pattern WEEKLY =
      Pattern.compile("毎週?\\s*の?\\s*" + RuleSupport.WEEKDAY + "曜");
  private static final Pattern BIWEEKLY =
      Pattern.compile("隔週\\s*の?\\s*" + RuleSupport.WEEKDAY + "曜");

  private final RecurrenceKind kind;
  private final LocalTime defaultTime;

  private WeekdayCadenceRule(String name, Pattern pattern, RecurrenceKind kind, LocalTime time) {
    super(name, pattern);
    this.kind = kind;
    this.defaultTime = time;
  }

  /**
   * Creates the every-week rule.
   *
   * @param defaultTime the time used when the phrase states none
   * @return the rule
   */
  public static WeekdayCadenceRule weekly(LocalTime defaultTime) {
    return new WeekdayCadenceRule("weekly-weekday", WEEKLY, RecurrenceKind.WEEKLY, defaultTime);
  }

  /**
   * Creates the every-other-week rule.
   *
   * @param defaultTime the time used when the phrase states none
   * @return the rule
   */
  public static WeekdayCadenceRule biweekly(LocalTime defaultTime) {
    return new WeekdayCadenceRule(
        "biweekly-weekday", BIWEEKLY, RecurrenceKind.BIWEEKLY, defaultTime);
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    Weekday weekday = RuleSupport.weekday(m.group(1));
    LocalTime time = RuleSupport.timeOr(text, defaultTime);
    ZonedDateTime first = RuleSupport.nextWeekdayAt(weekday, time, now);
    return Optional.of(Resolution.recurring(first, new RecurrenceRule(kind, weekday.token())));
  }
}
