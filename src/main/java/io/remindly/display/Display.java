package io.remindly.display;

import io.remindly.model.RecurrenceRule;
import java.time.Duration;
import java.time.ZonedDateTime;

/** Renders rules and due times as short Japanese labels for reminder lists. */
public final class Display {
  private Display() {}

  /**
   * Renders a recurrence rule: {@code 毎日}, {@code 毎週金曜日}, {@code 隔週月曜日}, {@code 平日},
   * {@code 毎月15日}, {@code 毎月第3火曜日}.
   *
   * @param rule the rule, null for a one-shot reminder
   * @return the label, empty for a one-shot reminder
   */
  public static String repeatLabel(RecurrenceRule rule) {
    if (rule == null) {
      return "";
    }
    String value = rule.value() == null ? "" : rule.value();
    return switch (rule.kind()) {
      case NONE -> "";
      case DAILY -> "毎日";
      case WEEKDAYS -> "平日";
      case WEEKLY -> "毎週" + value;
      case BIWEEKLY -> "隔週" + value;
      case MONTHLY -> rule.dayOfMonth().map(d -> "毎月" + d + "日").orElse("毎月" + value);
    };
  }

  /**
   * Renders the time left until a due time, to the coarsest two units: {@code あと2日3時間},
   * {@code あと5時間}, {@code あと12分}. Under a minute is {@code まもなく}; a past time is {@code
   * 期限切れ}.
   *
   * @param target the due time
   * @param now the reference time
   * @return the label
   */
  public static String remaining(ZonedDateTime target, ZonedDateTime now) {
    // truncated toward zero: half a second overdue still reads as まもなく
    long seconds = Duration.between(now, target).toMillis() / 1000;
    if (seconds < 0) {
      return "期限切れ";
    }

    long days = seconds / 86400;
    long hours = (seconds % 86400) / 3600;
    long minutes = (seconds % 3600) / 60;

    if (days > 0) {
      return hours > 0 ? "あと" + days + "日" + hours + "時間" : "あと" + days + "日";
    }
    if (hours > 0) {
      return minutes > 0 ? "あと" + hours + "時間" + minutes + "分" : "あと" + hours + "時間";
    }
    if (minutes > 0) {
      return "あと" + minutes + "分";
    }
    return "まもなく";
  }
}
