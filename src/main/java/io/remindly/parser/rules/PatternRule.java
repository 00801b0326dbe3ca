package io.remindly.parser.rules;

import io.remindly.parser.Resolution;
import io.remindly.parser.TemporalRule;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rule that claims a phrase when any of its patterns is found. Patterns are tried in order and
 * the first one found is handed to {@link #compute}.
 */
public abstract class PatternRule implements TemporalRule {
  private final String name;
  private final List<Pattern> patterns;

  protected PatternRule(String name, Pattern... patterns) {
    this.name = name;
    this.patterns = List.of(patterns);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean claims(String text) {
    for (Pattern p : patterns) {
      if (p.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Optional<Resolution> resolve(String text, ZonedDateTime now) {
    for (Pattern p : patterns) {
      Matcher m = p.matcher(text);
      if (m.find()) {
        return compute(m, text, now);
      }
    }
    return Optional.empty();
  }

  /**
   * Computes the occurrence from the first pattern found.
   *
   * @param m the matcher positioned on the match, {@code m.pattern()} tells which pattern it was
   * @param text the whole phrase
   * @param now the reference instant
   * @return the resolution, or empty for an impossible date
   */
  protected abstract Optional<Resolution> compute(Matcher m, String text, ZonedDateTime now);

  @Override
  public String toString() {
    return name;
  }
}
