package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;

/**
 * French Republican calendar.
 *
 * <p>Year 1 begins on 22 September 1792 (Gregorian). Months 1 to 12 (Vendémiaire to Fructidor)
 * have 30 days; month 13 holds the complementary days, 5 in a common year and 6 in a sextile
 * year.
 *
 * <h2>Leap rule</h2>
 *
 * <p>The calendar was abandoned before an arithmetic rule was enacted, and its equinox-based
 * placement cannot be reproduced by any fixed rule past year 14. This engine uses a fixed rule
 * instead: year {@code y} is sextile iff {@code y + 1} is a Gregorian leap year. That yields
 * years 3, 7 and 11, matching the historical sextile years, then every fourth year with the
 * Gregorian century exceptions (99, 199 and 299 are common, 399 is sextile).
 */
public final class FrenchRepublicanEngine implements CalendarEngine {
  /** The shared instance. */
  public static final FrenchRepublicanEngine INSTANCE = new FrenchRepublicanEngine();

  /** First supported year. */
  public static final int MIN_YEAR = 1;

  /** Last supported year. */
  public static final int MAX_YEAR = 999_999;

  /** Month holding the complementary days. */
  public static final int COMPLEMENTARY_MONTH = 13;

  /** Absolute day of 1 Vendémiaire year 1. */
  static final long EPOCH = GregorianEngine.fixed(1792, 9, 22);

  private static final int DAYS_PER_MONTH = 30;
  private static final long DAYS_PER_400_YEARS = 146_097;

  private static final AbsoluteDay MIN_DAY = new AbsoluteDay(EPOCH);
  private static final AbsoluteDay MAX_DAY =
      new AbsoluteDay(fixed(MAX_YEAR + 1, 1, 1) - 1);

  private FrenchRepublicanEngine() {}

  @Override
  public CalendarKind kind() {
    return CalendarKind.FRENCH_REPUBLICAN;
  }

  @Override
  public AbsoluteDay toAbsoluteDay(int year, int month, int day) throws CalendarException {
    Checks.day(this, year, month, day);
    return new AbsoluteDay(fixed(year, month, day));
  }

  @Override
  public YearMonthDay fromAbsoluteDay(AbsoluteDay day) throws CalendarException {
    Checks.absoluteDay(this, day);
    long d = day.value();
    long year = Math.floorDiv((d - EPOCH) * 400, DAYS_PER_400_YEARS) + 1;
    while (fixed(year, 1, 1) > d) {
      year--;
    }
    while (fixed(year + 1, 1, 1) <= d) {
      year++;
    }
    int dayOfYear = (int) (d - fixed(year, 1, 1));
    return new YearMonthDay(
        Math.toIntExact(year),
        dayOfYear / DAYS_PER_MONTH + 1,
        dayOfYear % DAYS_PER_MONTH + 1);
  }

  @Override
  public boolean isLeapYear(int year) {
    return leap(year);
  }

  @Override
  public int monthsPerYear(int year) {
    return COMPLEMENTARY_MONTH;
  }

  @Override
  public int daysInMonth(int year, int month) throws CalendarException {
    Checks.month(this, year, month);
    if (month == COMPLEMENTARY_MONTH) {
      return leap(year) ? 6 : 5;
    }
    return DAYS_PER_MONTH;
  }

  @Override
  public int daysInYear(int year) throws CalendarException {
    Checks.year(this, year);
    return leap(year) ? 366 : 365;
  }

  @Override
  public int leapMonth() {
    return COMPLEMENTARY_MONTH;
  }

  @Override
  public int leapDelta() {
    return 1;
  }

  @Override
  public int minYear() {
    return MIN_YEAR;
  }

  @Override
  public int maxYear() {
    return MAX_YEAR;
  }

  @Override
  public AbsoluteDay minDay() {
    return MIN_DAY;
  }

  @Override
  public AbsoluteDay maxDay() {
    return MAX_DAY;
  }

  private static boolean leap(long year) {
    return GregorianEngine.leap(year + 1);
  }

  /** Sextile years among 1..y-1 are the Gregorian leap years among 2..y. */
  private static long fixed(long year, int month, int day) {
    return EPOCH
        + 365 * (year - 1)
        + Math.floorDiv(year, 4)
        - Math.floorDiv(year, 100)
        + Math.floorDiv(year, 400)
        + (long) DAYS_PER_MONTH * (month - 1)
        + day
        - 1;
  }
}
