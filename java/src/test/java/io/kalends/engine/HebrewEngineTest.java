package io.kalends.engine;

import static org.junit.jupiter.api.Assertions.*;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.ErrorKind;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Unit tests for the Hebrew engine. */
public class HebrewEngineTest {
  private final HebrewEngine engine = HebrewEngine.INSTANCE;

  @Test
  void testMetonicCycle() {
    Set<Integer> leapPositions = Set.of(3, 6, 8, 11, 14, 17, 0);
    for (int year = 5701; year <= 5701 + 38; year++) {
      assertEquals(leapPositions.contains(year % 19), engine.isLeapYear(year), "year " + year);
      assertEquals(engine.isLeapYear(year) ? 13 : 12, engine.monthsPerYear(year));
    }
  }

  @Test
  void testYearLengths() throws CalendarException {
    assertEquals(384, engine.daysInYear(5782));
    assertEquals(355, engine.daysInYear(5783));
    assertEquals(383, engine.daysInYear(5784));
    assertEquals(355, engine.daysInYear(5785));
    assertEquals(354, engine.daysInYear(5786));
    assertEquals(385, engine.daysInYear(5787));

    Set<Integer> legal = Set.of(353, 354, 355, 383, 384, 385);
    for (int year = 1; year <= 3000; year++) {
      assertTrue(legal.contains(engine.daysInYear(year)), "year " + year);
    }
  }

  @Test
  void testVariableMonthsFollowYearLength() throws CalendarException {
    for (int year = 5700; year <= 5800; year++) {
      int length = engine.daysInYear(year);
      int heshvan = engine.daysInMonth(year, HebrewEngine.HESHVAN);
      int kislev = engine.daysInMonth(year, HebrewEngine.KISLEV);
      switch (length % 10) {
        case 3 -> assertEquals(58, heshvan + kislev, "deficient " + year);
        case 4 -> assertEquals(59, heshvan + kislev, "regular " + year);
        case 5 -> assertEquals(60, heshvan + kislev, "complete " + year);
        default -> fail("illegal year length " + length);
      }
      int sum = 0;
      for (int m = 1; m <= engine.monthsPerYear(year); m++) {
        sum += engine.daysInMonth(year, m);
      }
      assertEquals(length, sum, "months of " + year);
    }
  }

  @Test
  void testLeapYearMonths() throws CalendarException {
    // 5784: Adar I 30, Adar II 29, Nisan 30, Elul 29
    assertEquals(30, engine.daysInMonth(5784, 6));
    assertEquals(29, engine.daysInMonth(5784, 7));
    assertEquals(30, engine.daysInMonth(5784, 8));
    assertEquals(29, engine.daysInMonth(5784, 13));
    // 5785: Adar 29, Nisan 30
    assertEquals(29, engine.daysInMonth(5785, 6));
    assertEquals(30, engine.daysInMonth(5785, 7));

    CalendarException e =
        assertThrows(CalendarException.class, () -> engine.daysInMonth(5785, 13));
    assertEquals(ErrorKind.INVALID_DATE, e.kind());
    assertEquals("month", e.field().orElseThrow());
  }

  @Test
  void testNewYearNeverOnSundayWednesdayOrFriday() throws CalendarException {
    for (int year = 5600; year <= 6000; year++) {
      int weekday = engine.toAbsoluteDay(year, HebrewEngine.TISHRI, 1).dayOfWeek().getValue();
      assertNotEquals(7, weekday, "Sunday " + year);
      assertNotEquals(3, weekday, "Wednesday " + year);
      assertNotEquals(5, weekday, "Friday " + year);
    }
  }

  @Test
  void testEpoch() throws CalendarException {
    AbsoluteDay epoch = engine.toAbsoluteDay(1, 1, 1);
    assertEquals(engine.minDay(), epoch);
    assertEquals(347_998, epoch.toJulianDayNumber());
    assertEquals(new YearMonthDay(-3760, 10, 7), JulianEngine.INSTANCE.fromAbsoluteDay(epoch));
  }

  @Test
  void testRoundTripAcrossCenturies() throws CalendarException {
    long start = engine.toAbsoluteDay(5500, 1, 1).value();
    long end = engine.toAbsoluteDay(5900, 1, 1).value();
    for (long d = start; d < end; d++) {
      YearMonthDay ymd = engine.fromAbsoluteDay(new AbsoluteDay(d));
      assertEquals(d, engine.toAbsoluteDay(ymd.year(), ymd.month(), ymd.day()).value());
    }
  }

  @Test
  void testResultsIndependentOfCache() throws CalendarException {
    HebrewEngine uncached = new HebrewEngine(HebrewYearCache.withCapacity(0));
    HebrewEngine tiny =
        new HebrewEngine(HebrewYearCache.withCapacity(HebrewYearCache.MIN_CAPACITY));
    for (int year = 1; year < 6000; year += 37) {
      assertEquals(engine.newYear(year), uncached.newYear(year), "year " + year);
      assertEquals(engine.newYear(year), tiny.newYear(year), "year " + year);
    }
    AbsoluteDay day = new AbsoluteDay(739_161);
    assertEquals(new YearMonthDay(5785, 1, 1), uncached.fromAbsoluteDay(day));
    assertEquals(new YearMonthDay(5785, 1, 1), tiny.fromAbsoluteDay(day));
  }

  @Test
  void testSpan() throws CalendarException {
    assertThrows(CalendarException.class, () -> engine.toAbsoluteDay(0, 1, 1));
    assertThrows(
        CalendarException.class, () -> engine.fromAbsoluteDay(engine.minDay().plusDays(-1)));
    YearMonthDay last = engine.fromAbsoluteDay(engine.maxDay());
    assertEquals(HebrewEngine.MAX_YEAR, last.year());
    assertEquals(engine.monthsPerYear(last.year()), last.month());
    assertEquals(29, last.day());
  }
}
