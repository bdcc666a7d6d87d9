package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;

/**
 * Sealed interface for the per-calendar converters.
 *
 * <p>There are 4 engines, one per {@link CalendarKind}:
 *
 * <ul>
 *   <li>{@link GregorianEngine} - proleptic Gregorian, closed-form day count
 *   <li>{@link JulianEngine} - proleptic Julian, closed-form day count
 *   <li>{@link FrenchRepublicanEngine} - twelve 30-day months plus the complementary days
 *   <li>{@link HebrewEngine} - lunisolar, year start derived from the molad
 * </ul>
 *
 * <p>Engines are stateless apart from memoization that never changes a result, and are safe to
 * call from any thread.
 */
public sealed interface CalendarEngine
    permits GregorianEngine, JulianEngine, FrenchRepublicanEngine, HebrewEngine {

  /**
   * Returns the calendar implemented by this engine.
   *
   * @return the calendar
   */
  CalendarKind kind();

  /**
   * Converts a date to its absolute day.
   *
   * @param year the year
   * @param month the month (1-based)
   * @param day the day of the month (1-based)
   * @return the absolute day
   * @throws CalendarException if the date does not exist or the year is outside the span
   */
  AbsoluteDay toAbsoluteDay(int year, int month, int day) throws CalendarException;

  /**
   * Converts an absolute day to a date in this calendar.
   *
   * @param day the absolute day
   * @return the date
   * @throws CalendarException if the day lies outside {@link #minDay()}..{@link #maxDay()}
   */
  YearMonthDay fromAbsoluteDay(AbsoluteDay day) throws CalendarException;

  /**
   * Returns whether a year is a leap year. Defined for every year, supported or not.
   *
   * @param year the year
   * @return true for a leap year
   */
  boolean isLeapYear(int year);

  /**
   * Returns the number of months in a year. Defined for every year, supported or not.
   *
   * @param year the year
   * @return the month count
   */
  int monthsPerYear(int year);

  /**
   * Returns the length of a month.
   *
   * @param year the year
   * @param month the month (1-based)
   * @return the number of days
   * @throws CalendarException if the year is unsupported or the month does not exist
   */
  int daysInMonth(int year, int month) throws CalendarException;

  /**
   * Returns the length of a year.
   *
   * @param year the year
   * @return the number of days
   * @throws CalendarException if the year is unsupported
   */
  int daysInYear(int year) throws CalendarException;

  /**
   * Returns the month whose length differs between common and leap years.
   *
   * @return the month number
   */
  int leapMonth();

  /**
   * Returns how many days {@link #leapMonth()} gains in a leap year.
   *
   * @return the day delta
   */
  int leapDelta();

  /**
   * Returns the first supported year.
   *
   * @return the minimum year
   */
  int minYear();

  /**
   * Returns the last supported year.
   *
   * @return the maximum year
   */
  int maxYear();

  /**
   * Returns the first day expressible in this calendar.
   *
   * @return the minimum absolute day
   */
  AbsoluteDay minDay();

  /**
   * Returns the last day expressible in this calendar.
   *
   * @return the maximum absolute day
   */
  AbsoluteDay maxDay();

  /**
   * Returns whether an absolute day is expressible in this calendar.
   *
   * @param day the absolute day
   * @return true if the day lies within the supported span
   */
  default boolean supports(AbsoluteDay day) {
    return day.compareTo(minDay()) >= 0 && day.compareTo(maxDay()) <= 0;
  }
}
