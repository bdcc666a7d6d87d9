package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;

/**
 * Proleptic Gregorian calendar.
 *
 * <p>Years use astronomical numbering: year 0 is 1 BCE, year -1 is 2 BCE. There is no Julian
 * cutover; every year follows the Gregorian leap rule.
 *
 * <h2>Day count</h2>
 *
 * <p>Both directions are closed-form. A date maps to
 *
 * <pre>
 * 365(y-1) + floor((y-1)/4) - floor((y-1)/100) + floor((y-1)/400)
 *   + floor((367m - 362)/12) + correction(m, leap) + d - 1
 * </pre>
 *
 * <p>and the inverse splits the day count into 400-, 100-, 4- and 1-year cycles. Floor division
 * keeps both formulas exact for negative years.
 */
public final class GregorianEngine implements CalendarEngine {
  /** The shared instance. */
  public static final GregorianEngine INSTANCE = new GregorianEngine();

  /** First supported year. */
  public static final int MIN_YEAR = -999_999;

  /** Last supported year. */
  public static final int MAX_YEAR = 999_999;

  private static final long DAYS_PER_400_YEARS = 146_097;
  private static final long DAYS_PER_100_YEARS = 36_524;
  private static final long DAYS_PER_4_YEARS = 1_461;

  private static final int[] MONTH_LENGTHS = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

  private static final AbsoluteDay MIN_DAY = new AbsoluteDay(fixed(MIN_YEAR, 1, 1));
  private static final AbsoluteDay MAX_DAY = new AbsoluteDay(fixed(MAX_YEAR, 12, 31));

  private GregorianEngine() {}

  @Override
  public CalendarKind kind() {
    return CalendarKind.GREGORIAN;
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
    long year = yearOf(d);
    long priorDays = d - fixed(year, 1, 1);
    int month = monthOf(priorDays, leap(year));
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
    return monthLength(month, leap(year));
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

  /** Gregorian leap rule, also used by the French Republican engine. */
  static boolean leap(long year) {
    return Math.floorMod(year, 4) == 0
        && (Math.floorMod(year, 100) != 0 || Math.floorMod(year, 400) == 0);
  }

  /** Absolute day of a Gregorian date, without validation. */
  static long fixed(long year, int month, int day) {
    long y = year - 1;
    return 365 * y
        + Math.floorDiv(y, 4)
        - Math.floorDiv(y, 100)
        + Math.floorDiv(y, 400)
        + daysBeforeMonth(month, leap(year))
        + day
        - 1;
  }

  private static long yearOf(long d) {
    long n400 = Math.floorDiv(d, DAYS_PER_400_YEARS);
    long d1 = Math.floorMod(d, DAYS_PER_400_YEARS);
    long n100 = Math.floorDiv(d1, DAYS_PER_100_YEARS);
    long d2 = Math.floorMod(d1, DAYS_PER_100_YEARS);
    long n4 = Math.floorDiv(d2, DAYS_PER_4_YEARS);
    long d3 = Math.floorMod(d2, DAYS_PER_4_YEARS);
    long n1 = Math.floorDiv(d3, 365);
    long year = 400 * n400 + 100 * n100 + 4 * n4 + n1;
    // The last day of a 4- or 400-year cycle belongs to the year just counted
    return (n100 == 4 || n1 == 4) ? year : year + 1;
  }

  /** Days in the months before {@code month}, for the 12-month Julian and Gregorian layout. */
  static int daysBeforeMonth(int month, boolean leap) {
    int correction;
    if (month <= 2) {
      correction = 0;
    } else {
      correction = leap ? -1 : -2;
    }
    return Math.floorDiv(367 * month - 362, 12) + correction;
  }

  /** Month containing the day that follows {@code priorDays} days of the year. */
  static int monthOf(long priorDays, boolean leap) {
    long marchFirst = leap ? 60 : 59;
    long correction;
    if (priorDays < marchFirst) {
      correction = 0;
    } else {
      correction = leap ? 1 : 2;
    }
    return (int) Math.floorDiv(12 * (priorDays + correction) + 373, 367);
  }

  static int monthLength(int month, boolean leap) {
    if (month == 2 && leap) {
      return 29;
    }
    return MONTH_LENGTHS[month - 1];
  }
}
