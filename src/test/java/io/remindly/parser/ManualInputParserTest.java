package io.remindly.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class ManualInputParserTest {
  private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
  private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 7, 1, 9, 0, 0, 0, TOKYO);

  @Test
  void testFullDate() {
    assertEquals(
        Optional.of(ZonedDateTime.of(2025, 1, 5, 18, 30, 0, 0, TOKYO)),
        ManualInputParser.parse("2025/1/5", "18:30", NOW));
  }

  @Test
  void testMonthDayUsesCurrentYear() {
    assertEquals(
        Optional.of(ZonedDateTime.of(2024, 12, 24, 7, 0, 0, 0, TOKYO)),
        ManualInputParser.parse("12/24", "7", NOW));
  }

  @Test
  void testFullWidth() {
    assertEquals(
        Optional.of(ZonedDateTime.of(2024, 8, 1, 9, 15, 0, 0, TOKYO)),
        ManualInputParser.parse("８/１", "９：１５", NOW));
  }

  @Test
  void testMalformed() {
    assertTrue(ManualInputParser.parse("2024-08-01", "9:00", NOW).isEmpty());
    assertTrue(ManualInputParser.parse("8/1", "nine", NOW).isEmpty());
    assertTrue(ManualInputParser.parse("1/2/3/4", "9:00", NOW).isEmpty());
    assertTrue(ManualInputParser.parse("8/1", "9:00:00", NOW).isEmpty());
    assertTrue(ManualInputParser.parse(null, "9:00", NOW).isEmpty());
  }

  @Test
  void testImpossible() {
    assertTrue(ManualInputParser.parse("2/30", "9:00", NOW).isEmpty());
    assertTrue(ManualInputParser.parse("8/1", "24:00", NOW).isEmpty());
    assertTrue(ManualInputParser.parse("8/1", "9:60", NOW).isEmpty());
  }
}
