package io.remindly.parser.rules;

import io.remindly.model.RecurrenceRule;
import io.remindly.parser.Resolution;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every day: {@code 毎朝} 08:00, {@code 毎晩}/{@code 毎夜} 20:00, {@code 毎夕} 17:00 and {@code
 * 毎日} at the default hour. A stated time wins over the word's own hour.
 *
 * <p>Phrases mentioning {@code 平日} are left to {@link WeekdaysRule}.
 */
public final class DailyRule extends PatternRule {
  private static final Pattern DAILY = Pattern.compile("(毎朝|毎晩|毎夜|毎夕|毎日)(?!曜)");

  private final LocalTime defaultTime;

  public DailyRule(LocalTime defaultTime) {
    super("daily", DAILY);
    this.defaultTime = defaultTime;
  }

  @Override
  public boolean claims(String text) {
    return !text.contains("平日") && super.claims(text);
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    LocalTime time = RuleSupport.timeOr(text, wordTime(m.group(1)));
    ZonedDateTime first = RuleSupport.at(now.toLocalDate(), time, now);
    if (!first.isAfter(now)) {
      first = RuleSupport.at(now.toLocalDate().plusDays(1), time, now);
    }
    return Optional.of(Resolution.recurring(first, RecurrenceRule.daily()));
  }

  private LocalTime wordTime(String word) {
    return switch (word) {
      case "毎朝" -> LocalTime.of(8, 0);
      case "毎晩", "毎夜" -> LocalTime.of(20, 0);
      case "毎夕" -> LocalTime.of(17, 0);
      default -> defaultTime;
    };
  }
}
