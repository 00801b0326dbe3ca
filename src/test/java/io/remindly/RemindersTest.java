package io.remindly;

import static org.junit.jupiter.api.Assertions.*;

import io.remindly.eval.FireOutcome;
import io.remindly.model.ParseResult;
import io.remindly.model.RecurrenceKind;
import io.remindly.model.RecurrenceRule;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** End-to-end tests for phrase resolution through {@link Reminders}. */
public class RemindersTest {
  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
  private static final Reminders REMINDERS = Reminders.inZone(TOKYO);

  // Monday
  private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 7, 1, 9, 0, 0, 0, TOKYO);

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, TOKYO);
  }

  @Test
  void testTomorrowEvening() {
    ParseResult r = REMINDERS.resolve("明日の18:00、歯医者", NOW).orElseThrow();
    assertEquals("歯医者", r.content());
    assertEquals(at(2024, 7, 2, 18, 0), r.occurrence());
    assertNull(r.rule());
    assertFalse(r.isRecurring());
  }

  @Test
  void testEveryFriday() {
    ParseResult r = REMINDERS.resolve("毎週金曜18:00、ゴミ出し", NOW).orElseThrow();
    assertEquals("ゴミ出し", r.content());
    assertEquals(at(2024, 7, 5, 18, 0), r.occurrence());
    assertEquals(new RecurrenceRule(RecurrenceKind.WEEKLY, "金曜日"), r.rule());
  }

  @Test
  void testMonthlyDayClampsInFebruary() {
    ZonedDateTime now = at(2024, 2, 15, 9, 0);
    ParseResult r = REMINDERS.resolve("毎月31日、家賃", now).orElseThrow();
    assertEquals("家賃", r.content());
    assertEquals(RecurrenceRule.monthlyOnDay(31), r.rule());
    assertEquals(at(2024, 2, 29, 9, 0), r.occurrence());

    assertEquals(Optional.of(at(2024, 3, 31, 9, 0)), REMINDERS.advance(r.occurrence(), r.rule()));
  }

  @Test
  void testNothingSchedulable() {
    assertTrue(REMINDERS.resolve("牛乳を買う", NOW).isEmpty());
  }

  @Test
  void testBlankPhrase() {
    assertTrue(REMINDERS.resolve("", NOW).isEmpty());
    assertTrue(REMINDERS.resolve("   ", NOW).isEmpty());
    assertTrue(REMINDERS.resolve(null, NOW).isEmpty());
  }

  @Test
  void testRelativeOffsetKeepsSeconds() {
    ZonedDateTime now = ZonedDateTime.of(2024, 7, 1, 9, 0, 17, 0, TOKYO);
    ParseResult r = REMINDERS.resolve("30分後に洗濯物", now).orElseThrow();
    assertEquals("洗濯物", r.content());
    assertEquals(now.plusMinutes(30), r.occurrence());
  }

  @Test
  void testFullWidthDigits() {
    ParseResult r = REMINDERS.resolve("明日１８時に歯医者", NOW).orElseThrow();
    assertEquals("歯医者", r.content());
    assertEquals(at(2024, 7, 2, 18, 0), r.occurrence());
  }

  @Test
  void testNowIsConvertedToConfiguredZone() {
    ZonedDateTime utcNow = ZonedDateTime.of(2024, 7, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    ParseResult r = REMINDERS.resolve("明日18時", utcNow).orElseThrow();
    assertEquals(at(2024, 7, 2, 18, 0), r.occurrence());
    assertEquals(TOKYO, r.occurrence().getZone());
  }

  @Test
  void testContentFallsBackToPhrase() {
    ParseResult r = REMINDERS.resolve("明日18時", NOW).orElseThrow();
    assertEquals("明日18時", r.content());
  }

  @Test
  void testRecurrenceBeforeSingleShot() {
    ParseResult r = REMINDERS.resolve("毎朝7時に薬", NOW).orElseThrow();
    assertEquals("薬", r.content());
    assertEquals(RecurrenceRule.daily(), r.rule());
    assertEquals(at(2024, 7, 2, 7, 0), r.occurrence());
  }

  @Test
  void testResolveIsRepeatable() {
    String phrase = "毎月第3火曜日の10時に定例会議";
    assertEquals(REMINDERS.resolve(phrase, NOW), REMINDERS.resolve(phrase, NOW));
  }

  @Test
  void testAfterFire() {
    FireOutcome once = REMINDERS.afterFire(null, at(2024, 7, 2, 18, 0));
    assertInstanceOf(FireOutcome.Deactivate.class, once);
    assertTrue(once.nextOccurrence().isEmpty());

    FireOutcome daily = REMINDERS.afterFire(RecurrenceRule.daily(), at(2024, 7, 2, 7, 0));
    assertEquals(new FireOutcome.Reschedule(at(2024, 7, 3, 7, 0)), daily);
  }

  @Test
  void testFullWidthSpaceSeparator() {
    ParseResult r = REMINDERS.resolve("明日18時\u3000歯医者", NOW).orElseThrow();
    assertEquals("歯医者", r.content());
    assertEquals(at(2024, 7, 2, 18, 0), r.occurrence());
  }

  @Test
  void testDurationStaysInContent() {
    ParseResult r = REMINDERS.resolve("明日18時に2時間勉強", NOW).orElseThrow();
    assertEquals("2時間勉強", r.content());
    assertEquals(at(2024, 7, 2, 18, 0), r.occurrence());
  }

  @Test
  void testExtractContent() {
    assertEquals("ゴミ出し", Reminders.extractContent("毎週金曜の朝にゴミ出し"));
  }
}
