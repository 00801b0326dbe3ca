package io.remindly.eval;

import io.remindly.model.RecurrenceRule;
import java.time.ZonedDateTime;
import java.util.Optional;

/** What happens to a reminder once it has fired: it is rescheduled or it is deactivated. */
public sealed interface FireOutcome permits FireOutcome.Reschedule, FireOutcome.Deactivate {

  /**
   * The reminder stays active with a new occurrence.
   *
   * @param next the next occurrence
   */
  record Reschedule(ZonedDateTime next) implements FireOutcome {}

  /**
   * The reminder is done.
   *
   * @param reason why it stops, for logs
   */
  record Deactivate(String reason) implements FireOutcome {}

  /**
   * Decides the outcome for a fired reminder.
   *
   * @param rule the reminder's rule, null for a one-shot reminder
   * @param fired the occurrence that fired
   * @param calculator the calculator for the configured zone
   * @return the outcome
   */
  static FireOutcome after(
      RecurrenceRule rule, ZonedDateTime fired, RecurrenceCalculator calculator) {
    if (rule == null || !rule.isRecurring()) {
      return new Deactivate("one-shot");
    }
    Optional<ZonedDateTime> next = calculator.advance(fired, rule);
    if (next.isEmpty()) {
      return new Deactivate("no occurrence after " + fired + " for " + rule);
    }
    return new Reschedule(next.get());
  }

  /**
   * Returns the next occurrence when rescheduled.
   *
   * @return the next occurrence, or empty when deactivated
   */
  default Optional<ZonedDateTime> nextOccurrence() {
    if (this instanceof Reschedule r) {
      return Optional.of(r.next());
    }
    return Optional.empty();
  }
}
