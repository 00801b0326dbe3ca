package io.remindly.parser;

import io.remindly.model.TimeOfDay;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the time of day stated in a normalized, masked phrase.
 *
 * <p>Candidates are tried from the most specific to the vaguest. The order matters: {@code 正午}
 * must be seen before {@code 昼}, and {@code 深夜} before {@code 夜}.
 *
 * <ol>
 *   <li>{@code 18:30} (half- or full-width colon)
 *   <li>{@code 午後3時}, {@code 午後3時15分}, {@code 午後3時半}
 *   <li>{@code 午前3時} ...
 *   <li>{@code 7時半}
 *   <li>{@code 7時}, {@code 7時15分}
 *   <li>{@code 正午} 12:00, {@code 深夜} 23:00, {@code 夕方} 17:00, {@code 昼} 12:00, {@code 朝}
 *       08:00, {@code 夜}/{@code 晩} 20:00
 * </ol>
 *
 * <p>Bare hours 1-11 from candidates 1, 4 and 5 move to the afternoon when the phrase mentions an
 * afternoon or night word and no morning word.
 */
public final class TimeOfDayExtractor {
  private static final Pattern COLON = Pattern.compile("(?<!\\d)(\\d{1,2})[:：](\\d{2})(?!\\d)");
  private static final Pattern PM =
      Pattern.compile("午後(\\d{1,2})時(?!間)(?:(\\d{1,2})分|(半))?");
  private static final Pattern AM =
      Pattern.compile("午前(\\d{1,2})時(?!間)(?:(\\d{1,2})分|(半))?");
  private static final Pattern HOUR_HALF = Pattern.compile("(?<!\\d)(\\d{1,2})時半");
  private static final Pattern HOUR_MINUTE =
      Pattern.compile("(?<!\\d)(\\d{1,2})時(?!間)(?:(\\d{1,2})分)?");

  private static final List<VagueWord> VAGUE_WORDS =
      List.of(
          new VagueWord("正午", 12),
          new VagueWord("深夜", 23),
          new VagueWord("夕方", 17),
          new VagueWord("昼", 12),
          new VagueWord("朝", 8),
          new VagueWord("夜", 20),
          new VagueWord("晩", 20));

  private static final List<String> AFTERNOON_WORDS = List.of("午後", "夕方", "夜", "晩");
  private static final List<String> MORNING_WORDS = List.of("午前", "朝", "深夜", "未明");

  private TimeOfDayExtractor() {}

  /**
   * Extracts the time of day.
   *
   * @param text the normalized and masked phrase
   * @return the time, or empty if the phrase states none
   */
  public static Optional<TimeOfDay> extract(String text) {
    Matcher m = COLON.matcher(text);
    if (m.find()) {
      return TimeOfDay.of(
          afternoonAdjusted(text, Integer.parseInt(m.group(1))), Integer.parseInt(m.group(2)));
    }

    m = PM.matcher(text);
    if (m.find()) {
      int hour = Integer.parseInt(m.group(1));
      return TimeOfDay.of(hour < 12 ? hour + 12 : hour, minuteOf(m));
    }

    m = AM.matcher(text);
    if (m.find()) {
      int hour = Integer.parseInt(m.group(1));
      return TimeOfDay.of(hour == 12 ? 0 : hour, minuteOf(m));
    }

    m = HOUR_HALF.matcher(text);
    if (m.find()) {
      return TimeOfDay.of(afternoonAdjusted(text, Integer.parseInt(m.group(1))), 30);
    }

    m = HOUR_MINUTE.matcher(text);
    if (m.find()) {
      int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
      return TimeOfDay.of(afternoonAdjusted(text, Integer.parseInt(m.group(1))), minute);
    }

    return vagueTime(text);
  }

  /**
   * Returns the default hour for the first vague period word in the phrase.
   *
   * @param text the normalized and masked phrase
   * @return the time, or empty if no period word appears
   */
  public static Optional<TimeOfDay> vagueTime(String text) {
    for (VagueWord word : VAGUE_WORDS) {
      if (text.contains(word.word())) {
        return Optional.of(new TimeOfDay(word.hour(), 0));
      }
    }
    return Optional.empty();
  }

  private static int afternoonAdjusted(String text, int hour) {
    if (hour < 1 || hour > 11) {
      return hour;
    }
    for (String word : MORNING_WORDS) {
      if (text.contains(word)) {
        return hour;
      }
    }
    for (String word : AFTERNOON_WORDS) {
      if (text.contains(word)) {
        return hour + 12;
      }
    }
    return hour;
  }

  private static int minuteOf(Matcher m) {
    if (m.group(3) != null) {
      return 30;
    }
    return m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
  }

  private record VagueWord(String word, int hour) {}
}
