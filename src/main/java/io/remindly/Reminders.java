package io.remindly;

import io.remindly.config.RemindlyConfig;
import io.remindly.eval.FireOutcome;
import io.remindly.eval.RecurrenceCalculator;
import io.remindly.model.ParseResult;
import io.remindly.model.RecurrenceRule;
import io.remindly.parser.RecurrenceDetector;
import io.remindly.parser.Resolution;
import io.remindly.parser.RuleChain;
import io.remindly.parser.TemporalResolver;
import io.remindly.text.ContentExtractor;
import io.remindly.text.ProtectedWords;
import io.remindly.text.TextNormalizer;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * The main entry point for turning reminder phrases into occurrences.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Reminders reminders = Reminders.create(RemindlyConfig.load());
 * Optional<ParseResult> result = reminders.resolve("毎週金曜18時 ゴミ出し", ZonedDateTime.now());
 * result.ifPresent(r -> System.out.println(r.content() + " at " + r.occurrence()));
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Reminders {
  private final ZoneId zone;
  private final RecurrenceDetector detector;
  private final TemporalResolver resolver;
  private final RecurrenceCalculator calculator;

  private Reminders(ZoneId zone, LocalTime defaultTime) {
    this.zone = zone;
    this.detector = new RecurrenceDetector(defaultTime);
    this.resolver = new TemporalResolver(defaultTime);
    this.calculator = new RecurrenceCalculator(zone);
  }

  /**
   * Creates an instance from loaded settings.
   *
   * @param config the settings
   * @return the instance
   */
  public static Reminders create(RemindlyConfig config) {
    return new Reminders(config.timezone(), config.defaultTime());
  }

  /**
   * Creates an instance for a zone with the default settings otherwise.
   *
   * @param zone the zone
   * @return the instance
   */
  public static Reminders inZone(ZoneId zone) {
    return new Reminders(zone, RemindlyConfig.defaults().defaultTime());
  }

  /**
   * Resolves a phrase into its content, first occurrence and recurrence rule.
   *
   * <p>Repeating phrases are recognized before single-shot ones.
   *
   * @param phrase the phrase as typed
   * @param now the reference time, converted to the configured zone
   * @return the result, or empty if nothing in the phrase can be scheduled
   */
  public Optional<ParseResult> resolve(String phrase, ZonedDateTime now) {
    if (phrase == null || phrase.isBlank()) {
      return Optional.empty();
    }
    String text = ProtectedWords.mask(TextNormalizer.normalize(phrase));
    ZonedDateTime nowInZone = now.withZoneSameInstant(zone);

    Optional<Resolution> resolution =
        detector
            .claim(text)
            .or(() -> resolver.claim(text))
            .flatMap(rule -> RuleChain.apply(rule, text, nowInZone));
    return resolution.map(
        r -> new ParseResult(extractContent(phrase), r.occurrence(), r.rule()));
  }

  /**
   * Computes the occurrence after a fired one.
   *
   * @param occurrence the occurrence that fired
   * @param rule the rule, null for a one-shot reminder
   * @return the next occurrence, or empty when there is none
   */
  public Optional<ZonedDateTime> advance(ZonedDateTime occurrence, RecurrenceRule rule) {
    return calculator.advance(occurrence, rule);
  }

  /**
   * Decides whether a fired reminder is rescheduled or deactivated.
   *
   * @param rule the rule, null for a one-shot reminder
   * @param fired the occurrence that fired
   * @return the outcome
   */
  public FireOutcome afterFire(RecurrenceRule rule, ZonedDateTime fired) {
    return FireOutcome.after(rule, fired, calculator);
  }

  /**
   * Returns what a phrase is about, with its temporal wording removed.
   *
   * @param phrase the phrase as typed
   * @return the content, never empty for a non-empty phrase
   */
  public static String extractContent(String phrase) {
    return ContentExtractor.extract(phrase);
  }

  /**
   * Returns the configured zone.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }
}
