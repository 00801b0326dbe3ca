package io.remindly.model;

import io.remindly.RemindException;
import java.util.Optional;

/**
 * A recurrence rule: a cadence plus a value from a small closed vocabulary.
 *
 * <ul>
 *   <li>{@link RecurrenceKind#MONTHLY}: a day-of-month digit string ({@code "1"}..{@code "31"}),
 *       an {@link OrdinalWeekday} token, or null for "same day as the fired occurrence"
 *   <li>{@link RecurrenceKind#WEEKLY}, {@link RecurrenceKind#BIWEEKLY}: a weekday token such as
 *       {@code 金曜日}
 *   <li>{@link RecurrenceKind#DAILY}, {@link RecurrenceKind#WEEKDAYS}, {@link
 *       RecurrenceKind#NONE}: null
 * </ul>
 *
 * @param kind the cadence
 * @param value the cadence detail, canonicalized
 */
public record RecurrenceRule(RecurrenceKind kind, String value) {
  /** Validates the value against the kind and canonicalizes it. */
  public RecurrenceRule {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    switch (kind) {
      case NONE, DAILY, WEEKDAYS -> {
        if (value != null) {
          throw new IllegalArgumentException(kind + " takes no value: " + value);
        }
      }
      case WEEKLY, BIWEEKLY -> {
        String raw = value;
        value =
            Weekday.parse(raw)
                .map(Weekday::token)
                .orElseThrow(() -> new IllegalArgumentException("unknown weekday: " + raw));
      }
      case MONTHLY -> value = canonicalMonthlyValue(value);
    }
  }

  /**
   * Returns the rule for a one-shot reminder.
   *
   * @return the NONE rule
   */
  public static RecurrenceRule none() {
    return new RecurrenceRule(RecurrenceKind.NONE, null);
  }

  /**
   * Returns a daily rule.
   *
   * @return the DAILY rule
   */
  public static RecurrenceRule daily() {
    return new RecurrenceRule(RecurrenceKind.DAILY, null);
  }

  /**
   * Returns a Monday-to-Friday rule.
   *
   * @return the WEEKDAYS rule
   */
  public static RecurrenceRule weekdays() {
    return new RecurrenceRule(RecurrenceKind.WEEKDAYS, null);
  }

  /**
   * Returns a weekly rule.
   *
   * @param weekday the weekday
   * @return the WEEKLY rule
   */
  public static RecurrenceRule weekly(Weekday weekday) {
    return new RecurrenceRule(RecurrenceKind.WEEKLY, weekday.token());
  }

  /**
   * Returns an every-other-week rule.
   *
   * @param weekday the weekday
   * @return the BIWEEKLY rule
   */
  public static RecurrenceRule biweekly(Weekday weekday) {
    return new RecurrenceRule(RecurrenceKind.BIWEEKLY, weekday.token());
  }

  /**
   * Returns a monthly rule on a fixed day of the month.
   *
   * @param day the day of month (1-31)
   * @return the MONTHLY rule
   */
  public static RecurrenceRule monthlyOnDay(int day) {
    return new RecurrenceRule(RecurrenceKind.MONTHLY, String.valueOf(day));
  }

  /**
   * Returns a monthly rule on ordinal weekdays.
   *
   * @param target the ordinal weekday target
   * @return the MONTHLY rule
   */
  public static RecurrenceRule monthlyOn(OrdinalWeekday target) {
    return new RecurrenceRule(RecurrenceKind.MONTHLY, target.token());
  }

  /**
   * Reads a rule back from its stored form.
   *
   * <p>Values are discarded for kinds that do not use them, since older rows may carry a time
   * string there.
   *
   * @param kind the stored kind name, null or blank for a one-shot reminder
   * @param value the stored value
   * @return the rule
   * @throws RemindException if the kind or value is outside the vocabulary
   */
  public static RecurrenceRule parse(String kind, String value) throws RemindException {
    if (kind == null || kind.isBlank()) {
      return none();
    }
    RecurrenceKind parsed =
        RecurrenceKind.parse(kind)
            .orElseThrow(() -> RemindException.rule("unknown recurrence kind", kind));
    String v = value == null || value.isBlank() ? null : value.trim();
    return switch (parsed) {
      case NONE, DAILY, WEEKDAYS -> new RecurrenceRule(parsed, null);
      case WEEKLY, BIWEEKLY -> {
        if (v == null || Weekday.parse(v).isEmpty()) {
          throw RemindException.rule("unknown weekday", value);
        }
        yield new RecurrenceRule(parsed, v);
      }
      case MONTHLY -> {
        if (v != null && parseDay(v).isEmpty() && OrdinalWeekday.parse(v).isEmpty()) {
          throw RemindException.rule("unknown monthly value", value);
        }
        yield new RecurrenceRule(parsed, v);
      }
    };
  }

  /**
   * Returns whether this rule produces more than one occurrence.
   *
   * @return false only for NONE
   */
  public boolean isRecurring() {
    return kind != RecurrenceKind.NONE;
  }

  /**
   * Returns the weekday of a weekly or biweekly rule.
   *
   * @return the weekday, or empty for other kinds
   */
  public Optional<Weekday> weekday() {
    if (kind != RecurrenceKind.WEEKLY && kind != RecurrenceKind.BIWEEKLY) {
      return Optional.empty();
    }
    return Weekday.parse(value);
  }

  /**
   * Returns the day of month of a monthly digit rule.
   *
   * @return the day, or empty for other values
   */
  public Optional<Integer> dayOfMonth() {
    if (kind != RecurrenceKind.MONTHLY || value == null) {
      return Optional.empty();
    }
    return parseDay(value);
  }

  /**
   * Returns the ordinal-weekday target of a monthly rule.
   *
   * @return the target, or empty for other values
   */
  public Optional<OrdinalWeekday> ordinalWeekday() {
    if (kind != RecurrenceKind.MONTHLY || value == null) {
      return Optional.empty();
    }
    return OrdinalWeekday.parse(value);
  }

  @Override
  public String toString() {
    return value == null ? kind.wireName() : kind.wireName() + "(" + value + ")";
  }

  private static String canonicalMonthlyValue(String value) {
    if (value == null) {
      return null;
    }
    Optional<Integer> day = parseDay(value);
    if (day.isPresent()) {
      return String.valueOf(day.get());
    }
    return OrdinalWeekday.parse(value)
        .map(OrdinalWeekday::token)
        .orElseThrow(() -> new IllegalArgumentException("unknown monthly value: " + value));
  }

  private static Optional<Integer> parseDay(String value) {
    String v = value.trim();
    if (v.isEmpty() || v.length() > 2 || !v.chars().allMatch(c -> c >= '0' && c <= '9')) {
      return Optional.empty();
    }
    int day = Integer.parseInt(v);
    return day >= 1 && day <= 31 ? Optional.of(day) : Optional.empty();
  }
}
