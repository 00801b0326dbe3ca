package io.remindly.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.remindly.model.OrdinalWeekday;
import io.remindly.model.RecurrenceKind;
import io.remindly.model.RecurrenceRule;
import io.remindly.model.Weekday;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class RecurrenceCalculatorTest {
  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
  private static final RecurrenceCalculator CALC = new RecurrenceCalculator(TOKYO);

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, TOKYO);
  }

  private static RecurrenceRule monthly(String value) {
    return new RecurrenceRule(RecurrenceKind.MONTHLY, value);
  }

  @Test
  void testFixedCadences() {
    ZonedDateTime fired = at(2024, 7, 5, 18, 0);
    assertEquals(Optional.of(at(2024, 7, 6, 18, 0)), CALC.advance(fired, RecurrenceRule.daily()));
    assertEquals(
        Optional.of(at(2024, 7, 12, 18, 0)),
        CALC.advance(fired, RecurrenceRule.weekly(Weekday.FRIDAY)));
    assertEquals(
        Optional.of(at(2024, 7, 19, 18, 0)),
        CALC.advance(fired, RecurrenceRule.biweekly(Weekday.FRIDAY)));
  }

  @Test
  void testWeekdaysSkipWeekend() {
    // Friday -> Monday
    assertEquals(
        Optional.of(at(2024, 7, 8, 8, 0)),
        CALC.advance(at(2024, 7, 5, 8, 0), RecurrenceRule.weekdays()));
    // Tuesday -> Wednesday
    assertEquals(
        Optional.of(at(2024, 7, 3, 8, 0)),
        CALC.advance(at(2024, 7, 2, 8, 0), RecurrenceRule.weekdays()));
  }

  @Test
  void testWeekdaysNeverLandOnWeekend() {
    ZonedDateTime t = at(2024, 7, 1, 8, 0);
    for (int i = 0; i < 30; i++) {
      t = CALC.advance(t, RecurrenceRule.weekdays()).orElseThrow();
      DayOfWeek dow = t.getDayOfWeek();
      assertNotEquals(DayOfWeek.SATURDAY, dow);
      assertNotEquals(DayOfWeek.SUNDAY, dow);
    }
  }

  @Test
  void testMonthlyDayClamps() {
    RecurrenceRule rule = monthly("31");
    assertEquals(Optional.of(at(2024, 2, 29, 9, 0)), CALC.advance(at(2024, 1, 31, 9, 0), rule));
    assertEquals(Optional.of(at(2023, 2, 28, 9, 0)), CALC.advance(at(2023, 1, 31, 9, 0), rule));
    assertEquals(Optional.of(at(2024, 3, 31, 9, 0)), CALC.advance(at(2024, 2, 29, 9, 0), rule));
    assertEquals(
        Optional.of(at(2025, 1, 15, 9, 0)), CALC.advance(at(2024, 12, 15, 9, 0), monthly("15")));
  }

  @Test
  void testMonthlyWithoutValueKeepsDay() {
    assertEquals(
        Optional.of(at(2024, 8, 20, 7, 30)),
        CALC.advance(at(2024, 7, 20, 7, 30), new RecurrenceRule(RecurrenceKind.MONTHLY, null)));
  }

  @Test
  void testMonthlyOrdinal() {
    assertEquals(
        Optional.of(at(2024, 8, 20, 10, 0)),
        CALC.advance(at(2024, 7, 16, 10, 0), monthly("第3火曜日")));
    // 1st and 3rd Friday: the 3rd comes before next month's 1st
    assertEquals(
        Optional.of(at(2024, 7, 19, 18, 0)),
        CALC.advance(at(2024, 7, 5, 18, 0), monthly("第1,3金曜日")));
  }

  @Test
  void testMonthlyOrdinalDayBefore() {
    // day before the 2nd Wednesday of August (Aug 14)
    assertEquals(
        Optional.of(at(2024, 8, 13, 20, 0)),
        CALC.advance(at(2024, 7, 9, 20, 0), monthly("第2水曜日の前日")));
  }

  @Test
  void testFifthWeekdaySkipsShortMonths() {
    // 5th Monday: July 29, none in August, September 30
    assertEquals(
        Optional.of(at(2024, 9, 30, 9, 0)),
        CALC.advance(at(2024, 7, 29, 9, 0), monthly("第5月曜日")));
  }

  @Test
  void testExhausted() {
    // no 5th Monday in February or March 2024
    assertTrue(CALC.advance(at(2024, 1, 29, 9, 0), monthly("第5月曜日")).isEmpty());
  }

  @Test
  void testOneShot() {
    assertTrue(CALC.advance(at(2024, 7, 1, 9, 0), RecurrenceRule.none()).isEmpty());
    assertTrue(CALC.advance(at(2024, 7, 1, 9, 0), null).isEmpty());
  }

  @Test
  void testOccurrenceConvertedToZone() {
    ZonedDateTime utc = ZonedDateTime.of(2024, 7, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    assertEquals(Optional.of(at(2024, 7, 2, 9, 0)), CALC.advance(utc, RecurrenceRule.daily()));
  }

  @Test
  void testDstGapPushedForward() {
    ZoneId newYork = ZoneId.of("America/New_York");
    RecurrenceCalculator calc = new RecurrenceCalculator(newYork);
    ZonedDateTime fired = ZonedDateTime.of(2024, 3, 9, 2, 30, 0, 0, newYork);
    ZonedDateTime next = calc.advance(fired, RecurrenceRule.daily()).orElseThrow();
    assertEquals(ZonedDateTime.of(2024, 3, 10, 3, 30, 0, 0, newYork), next);
  }

  @Test
  void testOrdinalSearch() {
    OrdinalWeekday target = new OrdinalWeekday(List.of(3), Weekday.TUESDAY, false);
    assertEquals(
        Optional.of(at(2024, 7, 16, 9, 0)),
        CalendarMath.nextOrdinalWeekday(target, LocalTime.of(9, 0), at(2024, 7, 1, 9, 0)));
  }
}
