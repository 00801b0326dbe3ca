package io.remindly.model;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * The outcome of resolving a reminder phrase.
 *
 * @param content the reminder text with the temporal phrase removed, never blank
 * @param occurrence the first time the reminder fires, in the configured zone
 * @param rule the recurrence rule, or null for a one-shot reminder
 */
public record ParseResult(String content, ZonedDateTime occurrence, RecurrenceRule rule) {
  /** Validates the content and normalizes a NONE rule to null. */
  public ParseResult {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("content must not be blank");
    }
    if (occurrence == null) {
      throw new IllegalArgumentException("occurrence is required");
    }
    if (rule != null && !rule.isRecurring()) {
      rule = null;
    }
  }

  /**
   * Returns the recurrence rule, if any.
   *
   * @return the rule, or empty for a one-shot reminder
   */
  public Optional<RecurrenceRule> recurrence() {
    return Optional.ofNullable(rule);
  }

  /**
   * Returns whether this reminder repeats.
   *
   * @return true if a recurrence rule is present
   */
  public boolean isRecurring() {
    return rule != null;
  }
}
