package io.remindly.parser;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered list of rules. The first rule that claims a phrase decides it; later rules are never
 * consulted, even when the claiming rule cannot compute an occurrence.
 */
public abstract class RuleChain {
  private static final Logger log = LoggerFactory.getLogger(RuleChain.class);

  private final List<TemporalRule> rules;

  protected RuleChain(List<TemporalRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Returns the rules in priority order.
   *
   * @return the rules
   */
  public List<TemporalRule> rules() {
    return rules;
  }

  /**
   * Returns the first rule that claims the phrase.
   *
   * @param text the normalized, masked phrase
   * @return the claiming rule, or empty if none does
   */
  public Optional<TemporalRule> claim(String text) {
    for (TemporalRule rule : rules) {
      if (rule.claims(text)) {
        log.debug("rule {} claimed \"{}\"", rule.name(), text);
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a phrase with the first claiming rule.
   *
   * @param text the normalized, masked phrase
   * @param now the reference instant in the configured zone
   * @return the resolution, or empty if no rule claims the phrase or the claimed date is impossible
   */
  public Optional<Resolution> resolve(String text, ZonedDateTime now) {
    return claim(text).flatMap(rule -> apply(rule, text, now));
  }

  /**
   * Applies one rule, logging when it cannot compute an occurrence.
   *
   * @param rule the claiming rule
   * @param text the phrase
   * @param now the reference instant
   * @return the resolution
   */
  public static Optional<Resolution> apply(TemporalRule rule, String text, ZonedDateTime now) {
    Optional<Resolution> result = rule.resolve(text, now);
    if (result.isEmpty()) {
      log.debug("rule {} found no valid date in \"{}\"", rule.name(), text);
    }
    return result;
  }
}
