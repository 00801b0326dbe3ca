package io.remindly.parser;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * One phrase family: decides whether it owns a phrase, then computes the occurrence.
 *
 * <p>Rules are stateless. Both methods receive normalized, masked text.
 */
public interface TemporalRule {
  /**
   * Returns a short name for logs and tests.
   *
   * @return the rule name
   */
  String name();

  /**
   * Returns whether this rule owns the phrase.
   *
   * @param text the phrase
   * @return true if the phrase belongs to this family
   */
  boolean claims(String text);

  /**
   * Computes the occurrence for a phrase this rule claims.
   *
   * @param text the phrase
   * @param now the reference instant, already in the configured zone
   * @return the resolution, or empty if the phrase names an impossible date
   */
  Optional<Resolution> resolve(String text, ZonedDateTime now);
}
