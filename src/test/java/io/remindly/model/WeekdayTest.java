package io.remindly.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class WeekdayTest {

  @Test
  void testParseForms() {
    assertEquals(Optional.of(Weekday.FRIDAY), Weekday.parse("金"));
    assertEquals(Optional.of(Weekday.FRIDAY), Weekday.parse("金曜"));
    assertEquals(Optional.of(Weekday.FRIDAY), Weekday.parse("金曜日"));
    assertTrue(Weekday.parse("金よう").isEmpty());
    assertTrue(Weekday.parse("friday").isEmpty());
  }

  @Test
  void testDayOfWeekBridge() {
    for (Weekday w : Weekday.values()) {
      assertEquals(w, Weekday.fromDayOfWeek(w.toDayOfWeek()));
    }
    assertEquals(DayOfWeek.SUNDAY, Weekday.SUNDAY.toDayOfWeek());
    assertEquals("日曜日", Weekday.SUNDAY.token());
  }
}
