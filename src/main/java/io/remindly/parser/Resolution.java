package io.remindly.parser;

import io.remindly.model.RecurrenceRule;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * The time computed by a rule, before content extraction.
 *
 * @param occurrence the first occurrence
 * @param rule the recurrence rule, or null for a one-shot reminder
 */
public record Resolution(ZonedDateTime occurrence, RecurrenceRule rule) {
  /**
   * Creates a one-shot resolution.
   *
   * @param occurrence the occurrence
   * @return a resolution without a rule
   */
  public static Resolution once(ZonedDateTime occurrence) {
    return new Resolution(occurrence, null);
  }

  /**
   * Creates a recurring resolution.
   *
   * @param occurrence the first occurrence
   * @param rule the recurrence rule
   * @return a resolution with a rule
   */
  public static Resolution recurring(ZonedDateTime occurrence, RecurrenceRule rule) {
    return new Resolution(occurrence, rule);
  }

  /**
   * Returns the recurrence rule, if any.
   *
   * @return the rule
   */
  public Optional<RecurrenceRule> recurrence() {
    return Optional.ofNullable(rule);
  }
}
