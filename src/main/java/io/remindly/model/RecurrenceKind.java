package io.remindly.model;

import java.util.Locale;
import java.util.Optional;

/** The cadence of a reminder. */
public enum RecurrenceKind {
  NONE("none"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly"),
  BIWEEKLY("biweekly"),
  WEEKDAYS("weekdays");

  private final String wireName;

  RecurrenceKind(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used by the storage layer.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }

  /**
   * Parses a wire name (case insensitive).
   *
   * @param s the string to parse
   * @return the kind if known
   */
  public static Optional<RecurrenceKind> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    String lower = s.trim().toLowerCase(Locale.ROOT);
    for (RecurrenceKind kind : values()) {
      if (kind.wireName.equals(lower)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
