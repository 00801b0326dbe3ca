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
 * {@code 毎週} or {@code 隔週} with no weekday: the cadence repeats on today's weekday. Placed after
 * the weekday cadence rules, so a phrase reaching it names no weekday.
 */
public final class EveryWeekRule extends PatternRule {
  private static final Pattern EVERY_WEEK = Pattern.compile("(毎週|隔週)");

  private final LocalTime defaultTime;

  public EveryWeekRule(LocalTime defaultTime) {
    super("every-week", EVERY_WEEK);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    RecurrenceKind kind =
        m.group(1).equals("隔週") ? RecurrenceKind.BIWEEKLY : RecurrenceKind.WEEKLY;
    Weekday today = Weekday.fromDayOfWeek(now.getDayOfWeek());
    LocalTime time = RuleSupport.timeOr(text, defaultTime);

    ZonedDateTime first = RuleSupport.at(now.toLocalDate(), time, now);
    if (!first.isAfter(now)) {
      first = RuleSupport.at(now.toLocalDate().plusDays(7), time, now);
    }
    return Optional.of(Resolution.recurring(first, new RecurrenceRule(kind, today.token())));
  }
}
