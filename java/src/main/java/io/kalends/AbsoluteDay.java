package io.kalends;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * A calendar-independent count of days.
 *
 * <p>Day 0 is 1 January of year 1 in the proleptic Gregorian calendar, a Monday. Every engine
 * converts through this count.
 *
 * @param value the number of days since the epoch, negative before it
 */
public record AbsoluteDay(long value) implements Comparable<AbsoluteDay> {
  /** Julian Day Number of the epoch (serial day numbers used by older genealogy databases). */
  public static final long JULIAN_DAY_NUMBER_OFFSET = 1_721_426L;

  /** Absolute day of 1970-01-01, the {@link LocalDate#toEpochDay()} origin. */
  private static final long UNIX_EPOCH = 719_162L;

  /**
   * Returns the day count shifted by {@code days}.
   *
   * @param days the number of days to add, may be negative
   * @return the shifted day
   * @throws ArithmeticException if the result overflows a long
   */
  public AbsoluteDay plusDays(long days) {
    return new AbsoluteDay(Math.addExact(value, days));
  }

  /**
   * Returns the signed number of days from this day to {@code other}.
   *
   * @param other the other day
   * @return positive if {@code other} is later
   */
  public long daysUntil(AbsoluteDay other) {
    return other.value - value;
  }

  /**
   * Returns the Julian Day Number (serial day number) of this day.
   *
   * @return the Julian Day Number
   */
  public long toJulianDayNumber() {
    return value + JULIAN_DAY_NUMBER_OFFSET;
  }

  /**
   * Creates an absolute day from a Julian Day Number.
   *
   * @param jdn the Julian Day Number
   * @return the absolute day
   */
  public static AbsoluteDay fromJulianDayNumber(long jdn) {
    return new AbsoluteDay(jdn - JULIAN_DAY_NUMBER_OFFSET);
  }

  /**
   * Returns the day of the week.
   *
   * @return the day of the week
   */
  public DayOfWeek dayOfWeek() {
    return DayOfWeek.of((int) Math.floorMod(value, 7L) + 1);
  }

  /**
   * Converts this day to a {@link LocalDate} (ISO, proleptic Gregorian).
   *
   * @return the local date
   */
  public LocalDate toLocalDate() {
    return LocalDate.ofEpochDay(value - UNIX_EPOCH);
  }

  /**
   * Creates an absolute day from a {@link LocalDate}.
   *
   * @param date the local date
   * @return the absolute day
   */
  public static AbsoluteDay fromLocalDate(LocalDate date) {
    return new AbsoluteDay(date.toEpochDay() + UNIX_EPOCH);
  }

  @Override
  public int compareTo(AbsoluteDay other) {
    return Long.compare(value, other.value);
  }
}
