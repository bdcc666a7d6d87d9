package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;

/**
 * Proleptic Julian calendar with astronomical year numbering.
 *
 * <p>Every fourth year is a leap year. The month layout matches the Gregorian one, so both
 * engines share the month arithmetic; only the year term and the epoch differ. The gap between the
 * two calendars (10 days in 1582, 13 days since 1900) falls out of the two formulas.
 */
public final class JulianEngine implements CalendarEngine {
  /** The shared instance. */
  public static final JulianEngine INSTANCE = new JulianEngine();

  /** First supported year. */
  public static final int MIN_YEAR = -999_999;

  /** Last supported year. */
  public static final int MAX_YEAR = 999_999;

  /** Absolute day of Julian 1 January 1, which is Gregorian 30 December 0. */
  static final long EPOCH = GregorianEngine.fixed(0, 12, 30);

  private static final AbsoluteDay MIN_DAY = new AbsoluteDay(fixed(MIN_YEAR, 1, 1));
  private static final AbsoluteDay MAX_DAY = new AbsoluteDay(fixed(MAX_YEAR, 12, 31));

  private JulianEngine() {}

  @Override
  public CalendarKind kind() {
    return CalendarKind.JULIAN;
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
    long year = Math.floorDiv(4 * (d - EPOCH) + 1464, 1461);
    long priorDays = d - fixed(year, 1, 1);
    int month = GregorianEngine.monthOf(priorDays, leap(year));
    return new YearMonthDay(
        Math.toIntExact(year), month, (int) (d - fixed(year, month, 1)) + 1);
  }

  @Override
  public boolean isLeapYear(int year) {
    return leap(year);
  }

  @Override
  public int monthsPerYear(int year) {
    return 12;
  }

  @Override
  public int daysInMonth(int year, int month) throws CalendarException {
    Checks.month(this, year, month);
    return GregorianEngine.monthLength(month, leap(year));
  }

  @Override
  public int daysInYear(int year) throws CalendarException {
    Checks.year(this, year);
    return leap(year) ? 366 : 365;
  }

  @Override
  public int leapMonth() {
    return 2;
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
    return Math.floorMod(year, 4) == 0;
  }

  private static long fixed(long year, int month, int day) {
    long y = year - 1;
    return EPOCH
        - 1
        + 365 * y
        + Math.floorDiv(y, 4)
        + GregorianEngine.daysBeforeMonth(month, leap(year))
        + day;
  }
}
