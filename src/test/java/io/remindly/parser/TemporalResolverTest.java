package io.remindly.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class TemporalResolverTest {
  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
  private static final TemporalResolver RESOLVER = new TemporalResolver(LocalTime.of(9, 0));

  // Monday
  private static final ZonedDateTime NOW = at(2024, 7, 1, 9, 0);

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, TOKYO);
  }

  private static Optional<ZonedDateTime> resolve(String text, ZonedDateTime now) {
    Optional<Resolution> r = RESOLVER.resolve(text, now);
    r.ifPresent(res -> assertNull(res.rule(), "single-shot phrases carry no rule"));
    return r.map(Resolution::occurrence);
  }

  private static Optional<ZonedDateTime> resolve(String text) {
    return resolve(text, NOW);
  }

  @Test
  void testRelativeOffsets() {
    assertEquals(Optional.of(at(2024, 7, 4, 9, 0)), resolve("3日後"));
    assertEquals(Optional.of(at(2024, 7, 1, 11, 30)), resolve("2時間半後"));
    assertEquals(Optional.of(at(2024, 7, 1, 10, 30)), resolve("1時間30分後"));
    assertEquals(Optional.of(at(2024, 7, 8, 10, 0)), resolve("1週間後の10時"));
  }

  @Test
  void testNamedDays() {
    assertEquals(Optional.of(at(2024, 7, 2, 9, 0)), resolve("明日"));
    assertEquals(Optional.of(at(2024, 7, 3, 9, 0)), resolve("明後日"));
    assertEquals(Optional.of(at(2024, 7, 4, 9, 0)), resolve("しあさって"));
    assertEquals(Optional.of(at(2024, 7, 2, 18, 0)), resolve("あした18時"));
  }

  @Test
  void testTodayWithoutTimeIsNextFullHour() {
    ZonedDateTime now = ZonedDateTime.of(2024, 7, 1, 9, 42, 10, 0, TOKYO);
    assertEquals(Optional.of(at(2024, 7, 1, 10, 0)), resolve("今日", now));
    assertEquals(Optional.of(at(2024, 7, 1, 15, 0)), resolve("今日の15時", now));
  }

  @Test
  void testWeekend() {
    assertEquals(Optional.of(at(2024, 7, 6, 9, 0)), resolve("週末"));
    assertEquals(Optional.of(at(2024, 7, 13, 9, 0)), resolve("来週末"));
    ZonedDateTime sunday = at(2024, 7, 7, 8, 0);
    assertEquals(Optional.of(at(2024, 7, 7, 9, 0)), resolve("今週末", sunday));
  }

  @Test
  void testMonthBoundaries() {
    assertEquals(Optional.of(at(2024, 7, 31, 9, 0)), resolve("今月末"));
    assertEquals(Optional.of(at(2024, 8, 31, 9, 0)), resolve("来月の末日"));
    assertEquals(Optional.of(at(2024, 8, 1, 9, 0)), resolve("来月初め"));
    ZonedDateTime january = at(2024, 1, 10, 9, 0);
    assertEquals(Optional.of(at(2024, 2, 29, 9, 0)), resolve("来月末", january));
  }

  @Test
  void testDayOfMonth() {
    assertEquals(Optional.of(at(2024, 8, 15, 9, 0)), resolve("来月15日"));
    assertEquals(Optional.of(at(2024, 9, 3, 9, 0)), resolve("再来月の3日"));
    assertTrue(resolve("来月31日", at(2024, 8, 15, 9, 0)).isEmpty());
  }

  @Test
  void testClaimingRuleDecides() {
    // day-of-month claims the phrase; its impossible date is not replaced by the stated time
    assertTrue(resolve("来月31日18時", at(2024, 8, 15, 9, 0)).isEmpty());
    assertEquals("day-of-month", RESOLVER.claim("来月31日18時").orElseThrow().name());
  }

  @Test
  void testWeekdayReferences() {
    assertEquals(Optional.of(at(2024, 7, 10, 9, 0)), resolve("来週の水曜"));
    assertEquals(Optional.of(at(2024, 7, 17, 9, 0)), resolve("再来週水曜日"));
    assertEquals(Optional.of(at(2024, 7, 8, 9, 0)), resolve("次の月曜"));
    assertEquals(Optional.of(at(2024, 7, 5, 9, 0)), resolve("金曜日"));
    assertEquals(Optional.of(at(2024, 7, 1, 10, 0)), resolve("月曜の10時"));
    assertEquals(Optional.of(at(2024, 7, 8, 8, 0)), resolve("月曜8時"));
  }

  @Test
  void testExplicitDates() {
    assertEquals(Optional.of(at(2024, 7, 15, 9, 0)), resolve("7月15日"));
    assertEquals(Optional.of(at(2024, 7, 1, 20, 0)), resolve("7/1 20:00"));
    assertEquals(Optional.of(at(2025, 6, 30, 9, 0)), resolve("6/30"));
    assertTrue(resolve("2月30日").isEmpty());
    assertTrue(resolve("13/1").isEmpty());
    // 2024-02-29 has passed and 2025 has no Feb 29
    assertTrue(resolve("2/29").isEmpty());
  }

  @Test
  void testTimeOnly() {
    assertEquals(Optional.of(at(2024, 7, 1, 15, 0)), resolve("15時"));
    assertEquals(Optional.of(at(2024, 7, 2, 8, 0)), resolve("8時"));
    assertEquals(Optional.of(at(2024, 7, 1, 12, 0)), resolve("正午"));
  }

  @Test
  void testNoMatch() {
    assertTrue(resolve("牛乳を買う").isEmpty());
    assertTrue(RESOLVER.claim("牛乳を買う").isEmpty());
  }
}
