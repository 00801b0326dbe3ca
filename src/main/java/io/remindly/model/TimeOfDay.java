package io.remindly.model;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Represents a wall-clock time of day (hour and minute).
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 */
public record TimeOfDay(int hour, int minute) {
  /** Validates the hour and minute ranges. */
  public TimeOfDay {
    if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
      throw new IllegalArgumentException("invalid time of day " + hour + ":" + minute);
    }
  }

  /**
   * Creates a time of day if the values are in range.
   *
   * @param hour the hour
   * @param minute the minute
   * @return the time of day, or empty if out of range
   */
  public static Optional<TimeOfDay> of(int hour, int minute) {
    if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
      return Optional.empty();
    }
    return Optional.of(new TimeOfDay(hour, minute));
  }

  /**
   * Returns this time as a LocalTime with zero seconds.
   *
   * @return the local time
   */
  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute);
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
