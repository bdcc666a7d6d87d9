package io.kalends;

import static org.junit.jupiter.api.Assertions.*;

import io.kalends.engine.CalendarEngine;
import io.kalends.engine.YearMonthDay;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Randomized checks of the properties every calendar must satisfy. */
public class CalendarPropertiesTest {
  private static final int SAMPLES = 20_000;
  private static final long SEED = 0x5EED_CA1EL;

  @Test
  void testRoundTripWithinCalendar() throws CalendarException {
    Random random = new Random(SEED);
    for (CalendarKind kind : CalendarKind.values()) {
      CalendarEngine engine = kind.engine();
      for (int i = 0; i < SAMPLES; i++) {
        int year = randomYear(random, engine);
        int month = 1 + random.nextInt(engine.monthsPerYear(year));
        int day = 1 + random.nextInt(engine.daysInMonth(year, month));

        AbsoluteDay absolute = engine.toAbsoluteDay(year, month, day);
        assertEquals(
            new YearMonthDay(year, month, day),
            engine.fromAbsoluteDay(absolute),
            kind + " " + year + "-" + month + "-" + day);
      }
    }
  }

  @Test
  void testRoundTripAcrossCalendars() throws CalendarException {
    Random random = new Random(SEED + 1);
    for (CalendarKind from : CalendarKind.values()) {
      for (CalendarKind to : CalendarKind.values()) {
        for (int i = 0; i < SAMPLES / 4; i++) {
          AbsoluteDay day = randomDayInOverlap(random, from.engine(), to.engine());
          CivilDate date = CivilDate.of(day, from);
          CivilDate converted = date.convertTo(to);
          assertEquals(date, converted.convertTo(from), date + " via " + to);
          assertEquals(day, converted.absoluteDay());
        }
      }
    }
  }

  @Test
  void testAddDaysPreservesOrder() throws CalendarException {
    Random random = new Random(SEED + 2);
    for (CalendarKind kind : CalendarKind.values()) {
      CalendarEngine engine = kind.engine();
      for (int i = 0; i < SAMPLES / 4; i++) {
        CivilDate a = CivilDate.of(randomDayInOverlap(random, engine, engine), kind);
        long n = random.nextInt(20_000) - 10_000;
        if (!engine.supports(a.absoluteDay().plusDays(n))) {
          continue;
        }
        CivilDate b = a.addDays(n);

        assertEquals(n, a.daysUntil(b));
        assertEquals(DateOrder.fromComparison(Long.signum(n)), b.compare(a));
        if (n > 0) {
          assertNotEquals(DateOrder.AFTER, a.addDays(1).compare(b), a + " + 1 passed " + b);
        }
        assertEquals(a, b.addDays(-n));
      }
    }
  }

  @Test
  void testConsecutiveDaysAreContiguous() throws CalendarException {
    for (CalendarKind kind : CalendarKind.values()) {
      CivilDate date = CivilDate.of(1800, 1, 1, CalendarKind.GREGORIAN).convertTo(kind);
      for (int i = 0; i < 3 * 366; i++) {
        CivilDate next = date.addDays(1);
        assertEquals(DateOrder.BEFORE, date.compare(next));
        if (next.day() != 1) {
          assertEquals(date.day() + 1, next.day(), date + " -> " + next);
        } else if (next.month() != 1) {
          assertEquals(date.daysInMonth(), date.day(), "month ended early: " + date);
          assertEquals(date.month() + 1, next.month());
        } else {
          assertEquals(date.monthsPerYear(), date.month(), "year ended early: " + date);
          assertEquals(date.year() + 1, next.year());
        }
        date = next;
      }
    }
  }

  @Test
  void testLeapYearAgreement() throws CalendarException {
    for (CalendarKind kind : CalendarKind.values()) {
      CalendarEngine engine = kind.engine();
      int commonYear = firstCommonYear(engine);
      int base = engine.daysInMonth(commonYear, engine.leapMonth());
      for (int year = Math.max(engine.minYear(), -2000); year <= 6000; year++) {
        int delta = engine.daysInMonth(year, engine.leapMonth()) - base;
        assertEquals(engine.isLeapYear(year) ? engine.leapDelta() : 0, delta, kind + " " + year);
      }
    }
  }

  private static int firstCommonYear(CalendarEngine engine) {
    int year = Math.max(engine.minYear(), 1);
    while (engine.isLeapYear(year)) {
      year++;
    }
    return year;
  }

  private static int randomYear(Random random, CalendarEngine engine) {
    long span = (long) engine.maxYear() - engine.minYear() + 1;
    return (int) (engine.minYear() + Math.floorMod(random.nextLong(), span));
  }

  private static AbsoluteDay randomDayInOverlap(
      Random random, CalendarEngine a, CalendarEngine b) {
    long min = Math.max(a.minDay().value(), b.minDay().value());
    long max = Math.min(a.maxDay().value(), b.maxDay().value());
    return new AbsoluteDay(min + Math.floorMod(random.nextLong(), max - min + 1));
  }
}
