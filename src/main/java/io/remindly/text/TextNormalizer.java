package io.remindly.text;

/** Canonicalizes digit glyphs before any pattern matching. */
public final class TextNormalizer {
  private TextNormalizer() {}

  /**
   * Maps full-width digits ({@code ０}-{@code ９}) to ASCII digits. Every other character is kept.
   *
   * @param text the text, may be null
   * @return the normalized text, or null for null input
   */
  public static String normalize(String text) {
    if (text == null) {
      return null;
    }
    StringBuilder sb = null;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c >= '０' && c <= '９') {
        if (sb == null) {
          sb = new StringBuilder(text);
        }
        sb.setCharAt(i, (char) ('0' + (c - '０')));
      }
    }
    return sb == null ? text : sb.toString();
  }
}
