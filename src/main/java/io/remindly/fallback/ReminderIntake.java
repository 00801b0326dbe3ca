package io.remindly.fallback;

import io.remindly.Reminders;
import io.remindly.config.RemindlyConfig;
import io.remindly.model.ParseResult;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a phrase with the rules and, when none applies, with the fallback delegate.
 *
 * <p>A delegate result is merged with the rule-extracted content and carries no recurrence rule.
 * Phrases handed to the delegate are logged on the {@code remindly.fallback} logger so the rules
 * can be extended to cover them.
 */
public final class ReminderIntake {
  private static final Logger log = LoggerFactory.getLogger(ReminderIntake.class);
  private static final Logger fallbackLog = LoggerFactory.getLogger("remindly.fallback");

  private final Reminders reminders;
  private final FallbackDelegate delegate;
  private final boolean fallbackEnabled;

  /**
   * Creates an intake.
   *
   * @param reminders the rule-based resolver
   * @param delegate the delegate for phrases no rule recognizes
   * @param fallbackEnabled whether the delegate is consulted at all
   */
  public ReminderIntake(Reminders reminders, FallbackDelegate delegate, boolean fallbackEnabled) {
    this.reminders = reminders;
    this.delegate = delegate;
    this.fallbackEnabled = fallbackEnabled;
  }

  /**
   * Creates an intake from loaded settings.
   *
   * @param config the settings
   * @param delegate the delegate for phrases no rule recognizes
   * @return the intake
   */
  public static ReminderIntake create(RemindlyConfig config, FallbackDelegate delegate) {
    return new ReminderIntake(Reminders.create(config), delegate, config.fallbackEnabled());
  }

  /**
   * Resolves a phrase.
   *
   * @param phrase the phrase as typed
   * @param now the reference time
   * @return the result, or empty if neither the rules nor the delegate can schedule it
   */
  public Optional<ParseResult> intake(String phrase, ZonedDateTime now) {
    if (phrase == null || phrase.isBlank()) {
      return Optional.empty();
    }
    Optional<ParseResult> resolved = reminders.resolve(phrase, now);
    if (resolved.isPresent() || !fallbackEnabled) {
      return resolved;
    }

    ZonedDateTime nowInZone = now.withZoneSameInstant(reminders.zone());
    Optional<ZonedDateTime> external;
    try {
      external = delegate.tryExternalResolve(phrase, nowInZone);
    } catch (RuntimeException e) {
      log.warn("fallback delegate failed for \"{}\"", phrase, e);
      return Optional.empty();
    }

    if (external.isEmpty()) {
      fallbackLog.info("unresolved: \"{}\"", phrase);
      return Optional.empty();
    }
    ZonedDateTime occurrence = external.get().withZoneSameInstant(reminders.zone());
    fallbackLog.info("resolved by fallback: \"{}\" -> {}", phrase, occurrence);
    return Optional.of(new ParseResult(Reminders.extractContent(phrase), occurrence, null));
  }
}
