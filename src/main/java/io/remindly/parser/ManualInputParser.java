package io.remindly.parser;

import io.remindly.text.TextNormalizer;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Parses the separate date and time fields of a manual edit form.
 *
 * <p>Dates are {@code Y/M/D} or {@code M/D} (current year); times are {@code H} or {@code H:MM}.
 * Full-width digits are accepted.
 */
public final class ManualInputParser {
  private ManualInputParser() {}

  /**
   * Parses a date and a time in the zone of {@code now}.
   *
   * @param dateText the date field
   * @param timeText the time field
   * @param now the reference time, supplying the zone and the default year
   * @return the timestamp, or empty if either field is malformed or names an impossible date
   */
  public static Optional<ZonedDateTime> parse(String dateText, String timeText, ZonedDateTime now) {
    if (dateText == null || timeText == null) {
      return Optional.empty();
    }
    String[] date = TextNormalizer.normalize(dateText.trim()).split("/", -1);
    String[] time = TextNormalizer.normalize(timeText.trim()).replace('：', ':').split(":", -1);
    if (date.length < 2 || date.length > 3 || time.length > 2) {
      return Optional.empty();
    }

    try {
      int year = date.length == 3 ? Integer.parseInt(date[0]) : now.getYear();
      int month = Integer.parseInt(date[date.length - 2]);
      int day = Integer.parseInt(date[date.length - 1]);
      int hour = Integer.parseInt(time[0]);
      int minute = time.length == 2 ? Integer.parseInt(time[1]) : 0;
      return Optional.of(
          ZonedDateTime.of(
              LocalDate.of(year, month, day), LocalTime.of(hour, minute), now.getZone()));
    } catch (NumberFormatException | DateTimeException e) {
      return Optional.empty();
    }
  }
}
