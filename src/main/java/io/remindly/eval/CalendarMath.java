package io.remindly.eval;

import io.remindly.model.OrdinalWeekday;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Calendar arithmetic shared by the phrase rules and the recurrence calculator.
 *
 * <h2>Month ends</h2>
 *
 * <p>The last day of a month is always computed as the first day of the following month minus one
 * day, never by assuming a month length.
 *
 * <h2>Ordinal weekdays</h2>
 *
 * <p>The Nth weekday W of a month is the first W on or after the 1st plus (N-1) weeks. A result
 * that spills into the following month does not exist ("5th Monday" in most months).
 *
 * <h2>DST</h2>
 *
 * <p>A wall-clock time inside a gap is pushed forward by the length of the gap. An ambiguous time
 * in an overlap resolves to the earlier offset. Both are {@link ZonedDateTime#of} defaults.
 */
public final class CalendarMath {
  /** Number of months searched for an ordinal-weekday occurrence: this one and the next two. */
  public static final int ORDINAL_SEARCH_MONTHS = 3;

  private CalendarMath() {}

  /**
   * Returns the last day of a month.
   *
   * @param month the month
   * @return the last date in the month
   */
  public static LocalDate lastDayOfMonth(YearMonth month) {
    return month.atDay(1).plusMonths(1).minusDays(1);
  }

  /**
   * Returns the given day of a month, clamped to the month's last day.
   *
   * @param month the month
   * @param day the day of month (1-31)
   * @return the date
   */
  public static LocalDate clampedDay(YearMonth month, int day) {
    LocalDate last = lastDayOfMonth(month);
    return day >= last.getDayOfMonth() ? last : month.atDay(day);
  }

  /**
   * Returns the given day of a month if it exists.
   *
   * @param month the month
   * @param day the day of month
   * @return the date, or empty if the month has no such day
   */
  public static Optional<LocalDate> exactDay(YearMonth month, int day) {
    if (day < 1 || day > lastDayOfMonth(month).getDayOfMonth()) {
      return Optional.empty();
    }
    return Optional.of(month.atDay(day));
  }

  /**
   * Returns the Nth occurrence of a weekday within a month.
   *
   * @param month the month
   * @param weekday the weekday
   * @param n the ordinal (1-5)
   * @return the date, or empty if the month has fewer than N such weekdays
   */
  public static Optional<LocalDate> nthWeekdayOfMonth(YearMonth month, DayOfWeek weekday, int n) {
    LocalDate d = month.atDay(1);
    while (d.getDayOfWeek() != weekday) {
      d = d.plusDays(1);
    }

    d = d.plusWeeks(n - 1);

    if (!YearMonth.from(d).equals(month)) {
      return Optional.empty();
    }
    return Optional.of(d);
  }

  /**
   * Returns whether a date falls on Saturday or Sunday.
   *
   * @param date the date
   * @return true for weekend days
   */
  public static boolean isWeekend(LocalDate date) {
    DayOfWeek dow = date.getDayOfWeek();
    return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
  }

  /**
   * Returns the first Monday-to-Friday date on or after the given date.
   *
   * @param date the starting date
   * @return the date itself, or the following Monday for weekend dates
   */
  public static LocalDate weekdayOnOrAfter(LocalDate date) {
    LocalDate d = date;
    while (isWeekend(d)) {
      d = d.plusDays(1);
    }
    return d;
  }

  /**
   * Creates a ZonedDateTime at the given date and wall-clock time.
   *
   * @param date the date
   * @param time the wall-clock time
   * @param zone the time zone
   * @return the zoned date-time
   */
  public static ZonedDateTime atTimeOnDate(LocalDate date, LocalTime time, ZoneId zone) {
    return ZonedDateTime.of(LocalDateTime.of(date, time), zone);
  }

  /**
   * Finds the earliest ordinal-weekday occurrence strictly after a given instant.
   *
   * <p>Searches the month of {@code after} and the following two months. Every ordinal of the
   * target is tried in each month, the day-before offset is applied, and the minimum candidate
   * wins.
   *
   * @param target the ordinal weekday target
   * @param time the wall-clock time of the occurrence
   * @param after the exclusive lower bound, its zone is used for the result
   * @return the occurrence, or empty if none exists in the window
   */
  public static Optional<ZonedDateTime> nextOrdinalWeekday(
      OrdinalWeekday target, LocalTime time, ZonedDateTime after) {
    YearMonth month = YearMonth.from(after.toLocalDate());
    DayOfWeek dow = target.weekday().toDayOfWeek();
    ZonedDateTime best = null;

    for (int i = 0; i < ORDINAL_SEARCH_MONTHS; i++) {
      for (int n : target.ordinals()) {
        Optional<LocalDate> day = nthWeekdayOfMonth(month, dow, n);
        if (day.isEmpty()) {
          continue;
        }
        LocalDate date = target.dayBefore() ? day.get().minusDays(1) : day.get();
        ZonedDateTime candidate = atTimeOnDate(date, time, after.getZone());
        if (candidate.isAfter(after) && (best == null || candidate.isBefore(best))) {
          best = candidate;
        }
      }
      month = month.plusMonths(1);
    }

    return Optional.ofNullable(best);
  }
}
