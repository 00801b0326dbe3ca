package io.remindly.parser.rules;

import io.remindly.model.TimeOfDay;
import io.remindly.parser.Resolution;
import io.remindly.parser.TimeOfDayExtractor;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative offsets from now: {@code 30分後}, {@code 2時間後}, {@code 1時間半後}, {@code 1時間30分後},
 * {@code 3日後}, {@code 2週間後}.
 *
 * <p>Every unit in the phrase adds its delta. When only day or week units appear and the phrase
 * also states a time ({@code 3日後の18時}), that time is used on the resulting date.
 */
public final class RelativeOffsetRule extends PatternRule {
  private static final String UNIT_WORDS = "(週間|日|時間半|時間|分)";
  private static final Pattern OFFSET =
      Pattern.compile("((?:\\d{1,4}\\s*" + UNIT_WORDS + "\\s*)+)後");
  private static final Pattern UNIT = Pattern.compile("(\\d{1,4})\\s*" + UNIT_WORDS);

  public RelativeOffsetRule() {
    super("relative-offset", OFFSET);
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    ZonedDateTime result = now;
    boolean clockUnits = false;

    Matcher unit = UNIT.matcher(m.group(1));
    while (unit.find()) {
      long n = Long.parseLong(unit.group(1));
      switch (unit.group(2)) {
        case "週間" -> result = result.plusWeeks(n);
        case "日" -> result = result.plusDays(n);
        case "時間半" -> {
          result = result.plusHours(n).plusMinutes(30);
          clockUnits = true;
        }
        case "時間" -> {
          result = result.plusHours(n);
          clockUnits = true;
        }
        default -> {
          result = result.plusMinutes(n);
          clockUnits = true;
        }
      }
    }

    if (!clockUnits) {
      String rest = text.substring(0, m.start()) + " " + text.substring(m.end());
      Optional<TimeOfDay> time = TimeOfDayExtractor.extract(rest);
      if (time.isPresent()) {
        result = RuleSupport.at(result.toLocalDate(), time.get().toLocalTime(), now);
      }
    }
    return Optional.of(Resolution.once(result));
  }
}
