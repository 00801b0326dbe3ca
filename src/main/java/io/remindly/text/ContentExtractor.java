package io.remindly.text;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips the temporal and recurrence wording from a phrase, leaving what the reminder is about.
 *
 * <p>Works on the original text, so digit classes accept both ASCII and full-width digits. Each
 * temporal pattern also swallows one particle and any separators right after it: in {@code
 * 明日の18:00、歯医者} the {@code の} and the {@code 、} go with the tokens they follow.
 *
 * <p>The result is never empty. When nothing would be left, the input is returned unchanged.
 */
public final class ContentExtractor {
  private static final String D = "[0-9０-９]";
  private static final String W = "[月火水木金土日]";
  private static final String SEP = "\\s\u3000、,，";
  private static final String FOLLOWING = "(?:までに|からの|までの|から|まで|に|の|は|で)?[" + SEP + "]*";

  private static final List<Pattern> TEMPORAL =
      List.of(
          // recurrence
          temporal("毎月\\s*の?\\s*第" + D + "{1,2}(?:\\s*[,、]\\s*" + D + "{1,2})*\\s*" + W
              + "曜日?(?:\\s*の?前日)?"),
          temporal("毎月\\s*の?\\s*" + D + "{1,2}日"),
          temporal("(?:毎週?|隔週)\\s*の?\\s*" + W + "曜日?"),
          temporal("平日(?:の)?(?:毎朝|毎晩|毎夜|毎夕|毎日)?"),
          temporal("毎週|隔週|毎朝|毎晩|毎夜|毎夕|毎日"),
          // relative offsets
          temporal("(?:" + D + "{1,4}\\s*(?:週間|日|時間半|時間|分)\\s*)+後"),
          // named days
          temporal("明々後日|明明後日|しあさって|明後日|あさって|明日|あした|あす|今日|本日"),
          // weekend and month boundaries
          temporal("来週末|今週末|この週末|週末"),
          temporal("(?:再来月|今月|来月)の?(?:末日|最終日|末|初日|初め|はじめ|頭)|月末|月初め?"),
          // day of month
          temporal("(?:再来月|今月|来月)の?" + D + "{1,2}日"),
          // weekday references
          temporal("(?:(?:再来週|今週|来週)の?|次の?)?" + W + "曜日?"),
          // explicit dates
          temporal(D + "{1,2}月" + D + "{1,2}日|(?<![0-9０-９/])" + D + "{1,2}/" + D + "{1,2}"),
          // explicit times
          temporal("(?:午前|午後)?" + D + "{1,2}[:：]" + D + "{2}(?:頃|ごろ)?"),
          temporal("(?:午前|午後)?" + D + "{1,2}時(?!間)(?:半|" + D + "{1,2}分)?(?:頃|ごろ)?"),
          // vague period words
          temporal("今?(?:正午|深夜|夕方|昼|朝|夜|晩)(?:頃|ごろ)?"));

  private static final Pattern REQUEST =
      Pattern.compile(
          "(?:って|と)?(?:リマインドして|教えて|知らせて|通知して)(?:ください|下さい)?"
              + "[。.!！]*[\\s\u3000]*$");
  private static final Pattern LEADING = Pattern.compile("^[" + SEP + "。]+");
  private static final Pattern TRAILING_PARTICLE =
      Pattern.compile("[" + SEP + "]*(?:から|まで|に|の|は|で|を)?[" + SEP + "。]*$");
  private static final Pattern SPACES = Pattern.compile("[\\s\u3000]+");

  private ContentExtractor() {}

  /**
   * Extracts the reminder content.
   *
   * @param phrase the original phrase
   * @return the content, or the phrase itself when nothing is left
   */
  public static String extract(String phrase) {
    if (phrase == null || phrase.isBlank()) {
      return phrase;
    }
    String masked = ProtectedWords.mask(phrase);
    String text = masked;
    for (Pattern p : TEMPORAL) {
      text = p.matcher(text).replaceAll("");
    }
    boolean stripped = !text.equals(masked);
    text = REQUEST.matcher(text).replaceAll("");
    text = LEADING.matcher(text).replaceFirst("");
    // a particle left dangling at the end belonged to a removed token ("歯医者に明日")
    if (stripped) {
      text = TRAILING_PARTICLE.matcher(text).replaceFirst("");
    }
    text = SPACES.matcher(text).replaceAll(" ").strip();
    text = ProtectedWords.unmask(text);
    return text.isEmpty() ? phrase : text;
  }

  private static Pattern temporal(String regex) {
    return Pattern.compile("(?:" + regex + ")" + FOLLOWING);
  }
}
