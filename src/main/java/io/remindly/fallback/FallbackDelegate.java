package io.remindly.fallback;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * An external resolver consulted when no rule recognizes a phrase, such as a language-model
 * service. Implementations live outside this library and are passed to {@link ReminderIntake}.
 */
@FunctionalInterface
public interface FallbackDelegate {
  /**
   * Tries to resolve a phrase.
   *
   * @param phrase the phrase as typed
   * @param now the reference time in the configured zone
   * @return the timestamp, or empty if the delegate cannot resolve it either
   */
  Optional<ZonedDateTime> tryExternalResolve(String phrase, ZonedDateTime now);

  /**
   * Returns a delegate that never resolves anything.
   *
   * @return the delegate
   */
  static FallbackDelegate none() {
    return (phrase, now) -> Optional.empty();
  }
}
