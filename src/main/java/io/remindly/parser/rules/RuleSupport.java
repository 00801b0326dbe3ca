package io.remindly.parser.rules;

import io.remindly.eval.CalendarMath;
import io.remindly.model.TimeOfDay;
import io.remindly.model.Weekday;
import io.remindly.parser.TimeOfDayExtractor;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;

/** Regex fragments and small helpers shared by the rules. */
final class RuleSupport {
  /** One weekday kanji. */
  static final String WEEKDAY = "([月火水木金土日])";

  /** A month qualifier: this month, next month or the month after next. */
  static final String MONTH_QUALIFIER = "(再来月|今月|来月)";

  /** A week qualifier: this week, next week or the week after next. */
  static final String WEEK_QUALIFIER = "(再来週|今週|来週)";

  private RuleSupport() {}

  /** Returns the stated time, or the fallback when the phrase states none. */
  static LocalTime timeOr(String text, LocalTime fallback) {
    return TimeOfDayExtractor.extract(text).map(TimeOfDay::toLocalTime).orElse(fallback);
  }

  /** Returns the date at the given wall-clock time in the zone of {@code now}. */
  static ZonedDateTime at(LocalDate date, LocalTime time, ZonedDateTime now) {
    return CalendarMath.atTimeOnDate(date, time, now.getZone());
  }

  /** Returns the month named by a qualifier; null means the current month. */
  static YearMonth month(String qualifier, ZonedDateTime now) {
    YearMonth current = YearMonth.from(now.toLocalDate());
    if (qualifier == null) {
      return current;
    }
    return switch (qualifier) {
      case "来月" -> current.plusMonths(1);
      case "再来月" -> current.plusMonths(2);
      default -> current;
    };
  }

  /** Returns how many weeks ahead a qualifier points. */
  static int weekOffset(String qualifier) {
    return switch (qualifier) {
      case "来週" -> 1;
      case "再来週" -> 2;
      default -> 0;
    };
  }

  /** Returns the weekday for a kanji captured by {@link #WEEKDAY}. */
  static Weekday weekday(String kanji) {
    return Weekday.fromKanji(kanji.charAt(0)).orElseThrow();
  }

  /**
   * Returns the next occurrence of a weekday at a time: today when the time is still ahead,
   * otherwise the following one.
   */
  static ZonedDateTime nextWeekdayAt(Weekday weekday, LocalTime time, ZonedDateTime now) {
    LocalDate today = now.toLocalDate();
    int ahead = (weekday.number() - today.getDayOfWeek().getValue() + 7) % 7;
    ZonedDateTime candidate = at(today.plusDays(ahead), time, now);
    if (!candidate.isAfter(now)) {
      candidate = at(today.plusDays(ahead + 7L), time, now);
    }
    return candidate;
  }
}
