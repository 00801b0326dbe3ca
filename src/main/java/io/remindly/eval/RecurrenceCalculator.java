package io.remindly.eval;

import io.remindly.model.OrdinalWeekday;
import io.remindly.model.RecurrenceRule;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the occurrence that follows a fired one.
 *
 * <table>
 *   <caption>Advancing by kind</caption>
 *   <tr><th>Kind</th><th>Next occurrence</th></tr>
 *   <tr><td>daily</td><td>+1 day</td></tr>
 *   <tr><td>weekly</td><td>+7 days</td></tr>
 *   <tr><td>biweekly</td><td>+14 days</td></tr>
 *   <tr><td>weekdays</td><td>+1 day, then past Saturday and Sunday</td></tr>
 *   <tr><td>monthly, day D</td><td>day D of next month, clamped to its last day</td></tr>
 *   <tr><td>monthly, no value</td><td>the fired day of next month, clamped</td></tr>
 *   <tr><td>monthly, ordinal weekday</td><td>earliest candidate over the next three months</td></tr>
 * </table>
 *
 * <p>The wall-clock time of the fired occurrence is kept.
 */
public final class RecurrenceCalculator {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

  private final ZoneId zone;

  /**
   * Creates a calculator for a zone.
   *
   * @param zone the configured zone, used for all wall-clock arithmetic
   */
  public RecurrenceCalculator(ZoneId zone) {
    this.zone = zone;
  }

  /**
   * Computes the next occurrence.
   *
   * @param occurrence the occurrence that just fired
   * @param rule the rule, null for a one-shot reminder
   * @return the next occurrence, or empty when the rule is exhausted
   */
  public Optional<ZonedDateTime> advance(ZonedDateTime occurrence, RecurrenceRule rule) {
    if (rule == null || !rule.isRecurring()) {
      return Optional.empty();
    }
    ZonedDateTime fired = occurrence.withZoneSameInstant(zone);
    LocalDate date = fired.toLocalDate();
    LocalTime time = fired.toLocalTime();

    Optional<ZonedDateTime> next =
        switch (rule.kind()) {
          case DAILY -> Optional.of(at(date.plusDays(1), time));
          case WEEKLY -> Optional.of(at(date.plusWeeks(1), time));
          case BIWEEKLY -> Optional.of(at(date.plusWeeks(2), time));
          case WEEKDAYS -> Optional.of(at(CalendarMath.weekdayOnOrAfter(date.plusDays(1)), time));
          case MONTHLY -> nextMonthly(fired, rule);
          case NONE -> Optional.empty();
        };

    if (next.isEmpty()) {
      log.warn("rule {} has no occurrence after {}", rule, fired);
    } else {
      log.debug("rule {} advanced {} -> {}", rule, fired, next.get());
    }
    return next;
  }

  /**
   * Returns the zone used for arithmetic.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  private Optional<ZonedDateTime> nextMonthly(ZonedDateTime fired, RecurrenceRule rule) {
    Optional<OrdinalWeekday> target = rule.ordinalWeekday();
    if (target.isPresent()) {
      return CalendarMath.nextOrdinalWeekday(target.get(), fired.toLocalTime(), fired);
    }

    int day = rule.dayOfMonth().orElse(fired.getDayOfMonth());
    YearMonth nextMonth = YearMonth.from(fired.toLocalDate()).plusMonths(1);
    return Optional.of(at(CalendarMath.clampedDay(nextMonth, day), fired.toLocalTime()));
  }

  private ZonedDateTime at(LocalDate date, LocalTime time) {
    return CalendarMath.atTimeOnDate(date, time, zone);
  }
}
