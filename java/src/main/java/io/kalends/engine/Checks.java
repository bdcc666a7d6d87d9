package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;

/** Range checks shared by the engines. Each check names the offending field. */
final class Checks {
  private Checks() {}

  static void year(CalendarEngine engine, int year) throws CalendarException {
    if (year < engine.minYear() || year > engine.maxYear()) {
      throw CalendarException.outOfRange(
          engine.kind(),
          "year",
          year,
          String.format(
              "year %d is outside the %s span (%d..%d)",
              year, engine.kind(), engine.minYear(), engine.maxYear()));
    }
  }

  static void month(CalendarEngine engine, int year, int month) throws CalendarException {
    year(engine, year);
    int months = engine.monthsPerYear(year);
    if (month < 1 || month > months) {
      throw CalendarException.invalidDate(
          engine.kind(),
          "month",
          month,
          String.format(
              "month %d does not exist in %s year %d (1..%d)",
              month, engine.kind(), year, months));
    }
  }

  static void day(CalendarEngine engine, int year, int month, int day) throws CalendarException {
    int length = engine.daysInMonth(year, month);
    if (day < 1 || day > length) {
      throw CalendarException.invalidDate(
          engine.kind(),
          "day",
          day,
          String.format(
              "day %d is out of range for %s %04d-%02d (1..%d)",
              day, engine.kind(), year, month, length));
    }
  }

  static void absoluteDay(CalendarEngine engine, AbsoluteDay day) throws CalendarException {
    if (!engine.supports(day)) {
      throw CalendarException.outOfRange(
          engine.kind(),
          "absoluteDay",
          day.value(),
          String.format(
              "absolute day %d is outside the %s span (%d..%d)",
              day.value(), engine.kind(), engine.minDay().value(), engine.maxDay().value()));
    }
  }
}
