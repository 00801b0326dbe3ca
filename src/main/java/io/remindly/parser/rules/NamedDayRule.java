package io.remindly.parser.rules;

import io.remindly.model.TimeOfDay;
import io.remindly.parser.Resolution;
import io.remindly.parser.TimeOfDayExtractor;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named days relative to today: {@code 今日}, {@code 明日}, {@code 明後日}, {@code 明々後日}.
 *
 * <p>Without a stated time the default hour is used, except for today, which defaults to the next
 * full hour.
 */
public final class NamedDayRule extends PatternRule {
  // Longest first: しあさって contains あさって.
  private static final Pattern NAMED_DAY =
      Pattern.compile("(明々後日|明明後日|しあさって|明後日|あさって|明日|あした|あす|今日|本日)");

  private final LocalTime defaultTime;

  public NamedDayRule(LocalTime defaultTime) {
    super("named-day", NAMED_DAY);
    this.defaultTime = defaultTime;
  }

  @Override
  protected Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now) {
    String word = m.group(1);
    int offset = daysAhead(word);
    LocalDate date = now.toLocalDate().plusDays(offset);
    Optional<TimeOfDay> time = TimeOfDayExtractor.extract(text);

    if (time.isPresent()) {
      return Optional.of(Resolution.once(RuleSupport.at(date, time.get().toLocalTime(), now)));
    }
    if (offset == 0) {
      return Optional.of(Resolution.once(now.truncatedTo(ChronoUnit.HOURS).plusHours(1)));
    }
    return Optional.of(Resolution.once(RuleSupport.at(date, defaultTime, now)));
  }

  private static int daysAhead(String word) {
    return switch (word) {
      case "明々後日", "明明後日", "しあさって" -> 3;
      case "明後日", "あさって" -> 2;
      case "明日", "あした", "あす" -> 1;
      default -> 0;
    };
  }
}
