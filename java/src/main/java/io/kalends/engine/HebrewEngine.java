package io.kalends.engine;

import io.kalends.AbsoluteDay;
import io.kalends.CalendarException;
import io.kalends.CalendarKind;

/**
 * Hebrew lunisolar calendar.
 *
 * <h2>Month numbering</h2>
 *
 * <p>Months are numbered in civil order from the start of the year, so month numbers stay
 * contiguous in both common and leap years:
 *
 * <ul>
 *   <li>Common year (12 months): Tishri, Heshvan, Kislev, Tevet, Shevat, Adar, Nisan, Iyyar, Sivan,
 *       Tammuz, Av, Elul
 *   <li>Leap year (13 months): Tishri, Heshvan, Kislev, Tevet, Shevat, Adar I, Adar II, Nisan,
 *       Iyyar, Sivan, Tammuz, Av, Elul
 * </ul>
 *
 * <h2>Year length</h2>
 *
 * <p>Leap years are years 3, 6, 8, 11, 14, 17 and 19 of the 19-year cycle, i.e. {@code (7y + 1) mod
 * 19 < 7}. The new year is the day of the molad of Tishri, postponed by the four dehiyyot (the
 * three-part parity test on the weekday plus the 356- and 382-day year corrections). A year has
 * 353, 354 or 355 days (383, 384 or 385 in a leap year); a deficient year shortens Kislev to 29
 * days and a complete year lengthens Heshvan to 30.
 *
 * <p>New-year days are memoized in a {@link HebrewYearCache}; results are identical with the cache
 * disabled.
 */
public final class HebrewEngine implements CalendarEngine {
  /** The shared instance. */
  public static final HebrewEngine INSTANCE =
      new HebrewEngine(HebrewYearCache.fromSystemProperties());

  /** First supported year (AM 1). */
  public static final int MIN_YEAR = 1;

  /** Last supported year. */
  public static final int MAX_YEAR = 999_999;

  /** Month number of Tishri. */
  public static final int TISHRI = 1;

  /** Month number of Heshvan, 30 days in a complete year. */
  public static final int HESHVAN = 2;

  /** Month number of Kislev, 29 days in a deficient year. */
  public static final int KISLEV = 3;

  /** Month number of Adar in a common year, Adar I in a leap year. */
  public static final int ADAR = 6;

  /** Absolute day of the calendar epoch, 7 October 3761 BCE (Julian). */
  static final long EPOCH = -1_373_428L;

  private static final long PARTS_PER_DAY = 25_920;
  private static final long MONTH_PARTS = 13_753;
  private static final long MOLAD_OF_YEAR_ONE = 12_084;

  private static final AbsoluteDay MIN_DAY = new AbsoluteDay(computeNewYear(MIN_YEAR));
  private static final AbsoluteDay MAX_DAY = new AbsoluteDay(computeNewYear(MAX_YEAR + 1) - 1);

  private final HebrewYearCache cache;

  HebrewEngine(HebrewYearCache cache) {
    this.cache = cache;
  }

  @Override
  public CalendarKind kind() {
    return CalendarKind.HEBREW;
  }

  @Override
  public AbsoluteDay toAbsoluteDay(int year, int month, int day) throws CalendarException {
    Checks.day(this, year, month, day);
    long d = newYear(year);
    for (int m = 1; m < month; m++) {
      d += monthLength(year, m);
    }
    return new AbsoluteDay(d + day - 1);
  }

  @Override
  public YearMonthDay fromAbsoluteDay(AbsoluteDay day) throws CalendarException {
    Checks.absoluteDay(this, day);
    long d = day.value();
    // Mean year length is 35975351/98496 days
    int year = (int) (Math.floorDiv((d - EPOCH) * 98_496, 35_975_351L) + 1);
    while (year > MIN_YEAR && newYear(year) > d) {
      year--;
    }
    while (year < MAX_YEAR && newYear(year + 1) <= d) {
      year++;
    }
    long remaining = d - newYear(year);
    int month = 1;
    int length = monthLength(year, month);
    while (remaining >= length) {
      remaining -= length;
      month++;
      length = monthLength(year, month);
    }
    return new YearMonthDay(year, month, (int) remaining + 1);
  }

  @Override
  public boolean isLeapYear(int year) {
    return leap(year);
  }

  @Override
  public int monthsPerYear(int year) {
    return leap(year) ? 13 : 12;
  }

  @Override
  public int daysInMonth(int year, int month) throws CalendarException {
    Checks.month(this, year, month);
    return monthLength(year, month);
  }

  @Override
  public int daysInYear(int year) throws CalendarException {
    Checks.year(this, year);
    return yearLength(year);
  }

  @Override
  public int leapMonth() {
    return ADAR;
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

  /** Absolute day of 1 Tishri of {@code year}. */
  long newYear(int year) {
    return cache.get(year, HebrewEngine::computeNewYear);
  }

  private int yearLength(int year) {
    return (int) (newYear(year + 1) - newYear(year));
  }

  private int monthLength(int year, int month) {
    boolean leap = leap(year);
    int nisan = leap ? 8 : 7;
    if (month >= nisan) {
      // Nisan 30, Iyyar 29, Sivan 30, Tammuz 29, Av 30, Elul 29
      return (month - nisan) % 2 == 0 ? 30 : 29;
    }
    return switch (month) {
      case TISHRI -> 30;
      case HESHVAN -> yearLength(year) % 10 == 5 ? 30 : 29;
      case KISLEV -> yearLength(year) % 10 == 3 ? 29 : 30;
      case 4 -> 29;
      case 5 -> 30;
      case ADAR -> leap ? 30 : 29;
      default -> 29; // Adar II
    };
  }

  private static boolean leap(long year) {
    return Math.floorMod(7 * year + 1, 19) < 7;
  }

  private static long computeNewYear(int year) {
    return EPOCH + elapsedDays(year) + newYearDelay(year);
  }

  /** Days from the epoch to the molad of Tishri, after the weekday postponement. */
  private static long elapsedDays(long year) {
    long monthsElapsed = Math.floorDiv(235 * year - 234, 19);
    long partsElapsed = MOLAD_OF_YEAR_ONE + MONTH_PARTS * monthsElapsed;
    long days = 29 * monthsElapsed + Math.floorDiv(partsElapsed, PARTS_PER_DAY);
    // Tishri 1 never falls on Sunday, Wednesday or Friday
    if (Math.floorMod(3 * (days + 1), 7) < 3) {
      return days + 1;
    }
    return days;
  }

  /** Extra postponement keeping every year within the legal lengths. */
  private static long newYearDelay(long year) {
    long previous = elapsedDays(year - 1);
    long current = elapsedDays(year);
    long next = elapsedDays(year + 1);
    if (next - current == 356) {
      return 2;
    }
    if (current - previous == 382) {
      return 1;
    }
    return 0;
  }
}
