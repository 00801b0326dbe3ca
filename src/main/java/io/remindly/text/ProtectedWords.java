package io.remindly.text;

import java.util.Comparator;
import java.util.List;

/**
 * Compound words that contain temporal characters without being temporal, such as {@code 朝食}
 * (breakfast) or {@code 日曜大工} (DIY).
 *
 * <p>Masking swaps each word for a single private-use character so that no time pattern can match
 * inside it. Private-use characters already present in the input are escaped first, so unmasking
 * restores exactly the original text.
 */
public final class ProtectedWords {
  private static final char PLACEHOLDER_BASE = '\uE000';
  private static final char ESCAPE = '\uE0FF';

  /** Protected words, longest first so that a longer word wins over its prefix. */
  public static final List<String> WORDS =
      List.of(
              "朝食", "朝ご飯", "朝ごはん", "朝御飯", "朝礼", "朝刊", "朝顔",
              "昼食", "昼ご飯", "昼ごはん", "昼御飯", "昼休み", "昼寝",
              "夕食", "夕飯", "夕ご飯", "夕刊",
              "晩ご飯", "晩ごはん", "晩御飯", "晩酌",
              "夜食", "夜勤", "夜景",
              "毎日新聞", "日曜大工", "明日香")
          .stream()
          .sorted(Comparator.comparingInt(String::length).reversed())
          .toList();

  private ProtectedWords() {}

  /**
   * Replaces every protected word with its placeholder.
   *
   * @param text the text
   * @return the masked text
   */
  public static String mask(String text) {
    StringBuilder escaped = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == ESCAPE || isPlaceholder(c)) {
        escaped.append(ESCAPE);
      }
      escaped.append(c);
    }
    String result = escaped.toString();
    for (int i = 0; i < WORDS.size(); i++) {
      result = result.replace(WORDS.get(i), String.valueOf((char) (PLACEHOLDER_BASE + i)));
    }
    return result;
  }

  /**
   * Restores the protected words in masked text.
   *
   * @param masked the masked text
   * @return the original words put back
   */
  public static String unmask(String masked) {
    StringBuilder sb = new StringBuilder(masked.length());
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == ESCAPE && i + 1 < masked.length()) {
        sb.append(masked.charAt(++i));
      } else if (isPlaceholder(c)) {
        sb.append(WORDS.get(c - PLACEHOLDER_BASE));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static boolean isPlaceholder(char c) {
    int index = c - PLACEHOLDER_BASE;
    return index >= 0 && index < WORDS.size();
  }
}
