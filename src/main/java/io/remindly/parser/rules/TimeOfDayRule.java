package io.remindly.parser.rules;

import io.remindly.model.TimeOfDay;
import io.remindly.parser.Resolution;
import io.remindly.parser.TemporalRule;
import io.remindly.parser.TimeOfDayExtractor;
import java.time.ZonedDateTime;
import java.util.Optional;

/** A time of day with no date: today at that time, or tomorrow once it has passed. */
public final class TimeOfDayRule implements TemporalRule {
  @Override
  public String name() {
    return "time-of-day";
  }

  @Override
  public boolean claims(String text) {
    return TimeOfDayExtractor.extract(text).isPresent();
  }

  @Override
  public Optional<Resolution> resolve(String text, ZonedDateTime now) {
    Optional<TimeOfDay> time = TimeOfDayExtractor.extract(text);
    if (time.isEmpty()) {
      return Optional.empty();
    }
    ZonedDateTime result = RuleSupport.at(now.toLocalDate(), time.get().toLocalTime(), now);
    if (result.isBefore(now)) {
      result = RuleSupport.at(now.toLocalDate().plusDays(1), time.get().toLocalTime(), now);
    }
    return Optional.of(Resolution.once(result));
  }

  @Override
  public String toString() {
    return name();
  }
}
