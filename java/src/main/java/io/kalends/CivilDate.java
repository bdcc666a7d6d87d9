package io.kalends;

import io.kalends.engine.CalendarEngine;
import io.kalends.engine.YearMonthDay;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * An immutable date in one of the supported calendars.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CivilDate date = CivilDate.of(1995, 8, 15, CalendarKind.JULIAN);
 * CivilDate gregorian = date.convertTo(CalendarKind.GREGORIAN); // 1995-08-28 (gregorian)
 * DateOrder order = date.compare(gregorian);                     // SAME
 * }</pre>
 *
 * <p>A date is validated by its calendar's engine when it is created, and its {@link AbsoluteDay}
 * is computed once and kept. Comparison, arithmetic and conversion all go through that day count,
 * so dates in different calendars compare chronologically.
 *
 * <p>{@link #equals(Object)} compares the fields and the calendar: the same day expressed in two
 * calendars gives two unequal values for which {@link #compare(CivilDate)} returns {@link
 * DateOrder#SAME}. The natural order ({@link #compareTo(CivilDate)}) sorts by day and then by
 * calendar, so it stays consistent with {@code equals}.
 */
public final class CivilDate implements Comparable<CivilDate> {
  private final int year;
  private final int month;
  private final int day;
  private final CalendarKind calendar;
  private final AbsoluteDay absoluteDay;

  private CivilDate(int year, int month, int day, CalendarKind calendar, AbsoluteDay absoluteDay) {
    this.year = year;
    this.month = month;
    this.day = day;
    this.calendar = calendar;
    this.absoluteDay = absoluteDay;
  }

  /**
   * Creates a date, validating it against its calendar.
   *
   * @param year the year (astronomical numbering for Gregorian and Julian)
   * @param month the month (1-based)
   * @param day the day of the month (1-based)
   * @param calendar the calendar
   * @return the date
   * @throws CalendarException if the date does not exist ({@link ErrorKind#INVALID_DATE}), the year
   *     is outside the calendar's span ({@link ErrorKind#OUT_OF_RANGE}), or no calendar is given
   *     ({@link ErrorKind#UNSUPPORTED_CALENDAR})
   */
  public static CivilDate of(int year, int month, int day, CalendarKind calendar)
      throws CalendarException {
    AbsoluteDay absolute = Calendars.engine(calendar).toAbsoluteDay(year, month, day);
    return new CivilDate(year, month, day, calendar, absolute);
  }

  /**
   * Expresses an absolute day in a calendar.
   *
   * @param day the absolute day
   * @param calendar the calendar
   * @return the date
   * @throws CalendarException if the day is outside the calendar's span
   */
  public static CivilDate of(AbsoluteDay day, CalendarKind calendar) throws CalendarException {
    YearMonthDay ymd = Calendars.engine(calendar).fromAbsoluteDay(day);
    return new CivilDate(ymd.year(), ymd.month(), ymd.day(), calendar, day);
  }

  /**
   * Creates a Gregorian date from a {@link LocalDate}.
   *
   * @param date the local date
   * @return the Gregorian date
   * @throws CalendarException if the year is outside the Gregorian span
   */
  public static CivilDate fromLocalDate(LocalDate date) throws CalendarException {
    return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), CalendarKind.GREGORIAN);
  }

  /**
   * Returns the year.
   *
   * @return the year
   */
  public int year() {
    return year;
  }

  /**
   * Returns the month (1-based).
   *
   * @return the month
   */
  public int month() {
    return month;
  }

  /**
   * Returns the day of the month (1-based).
   *
   * @return the day
   */
  public int day() {
    return day;
  }

  /**
   * Returns the calendar.
   *
   * @return the calendar
   */
  public CalendarKind calendar() {
    return calendar;
  }

  /**
   * Returns the absolute day computed when this date was created.
   *
   * @return the absolute day
   */
  public AbsoluteDay absoluteDay() {
    return absoluteDay;
  }

  /**
   * Converts this date to another calendar.
   *
   * @param target the target calendar
   * @return the same day in the target calendar
   * @throws CalendarException if the day is outside the target calendar's span
   */
  public CivilDate convertTo(CalendarKind target) throws CalendarException {
    if (target == calendar) {
      return this;
    }
    return of(absoluteDay, target);
  }

  /**
   * Compares the days denoted by two dates, regardless of their calendars.
   *
   * @param other the other date
   * @return {@link DateOrder#BEFORE} if this date is earlier
   */
  public DateOrder compare(CivilDate other) {
    return DateOrder.fromComparison(absoluteDay.compareTo(other.absoluteDay));
  }

  /**
   * Returns true if this date falls on an earlier day than {@code other}.
   *
   * @param other the other date
   * @return true if earlier
   */
  public boolean isBefore(CivilDate other) {
    return compare(other) == DateOrder.BEFORE;
  }

  /**
   * Returns true if this date falls on a later day than {@code other}.
   *
   * @param other the other date
   * @return true if later
   */
  public boolean isAfter(CivilDate other) {
    return compare(other) == DateOrder.AFTER;
  }

  /**
   * Returns true if both dates denote the same day, in any calendars.
   *
   * @param other the other date
   * @return true for the same day
   */
  public boolean isSameDay(CivilDate other) {
    return compare(other) == DateOrder.SAME;
  }

  /**
   * Shifts this date by a number of days, staying in the same calendar.
   *
   * @param days the number of days, may be negative
   * @return the shifted date
   * @throws CalendarException if the result is outside the calendar's span
   */
  public CivilDate addDays(long days) throws CalendarException {
    if (days == 0) {
      return this;
    }
    long target;
    try {
      target = Math.addExact(absoluteDay.value(), days);
    } catch (ArithmeticException e) {
      throw CalendarException.outOfRange(
          calendar, "days", days, "shifting " + this + " by " + days + " days overflows");
    }
    return of(new AbsoluteDay(target), calendar);
  }

  /**
   * Returns the signed number of days from this date to {@code other}.
   *
   * @param other the other date
   * @return positive if {@code other} is later
   */
  public long daysUntil(CivilDate other) {
    return absoluteDay.daysUntil(other.absoluteDay);
  }

  /**
   * Returns whether this date's year is a leap year in its calendar.
   *
   * @return true for a leap year
   */
  public boolean isLeapYear() {
    return engine().isLeapYear(year);
  }

  /**
   * Returns the length of this date's month.
   *
   * @return the number of days in the month
   */
  public int daysInMonth() {
    try {
      return engine().daysInMonth(year, month);
    } catch (CalendarException e) {
      throw new IllegalStateException(calendar + " rejected its own validated date " + this, e);
    }
  }

  /**
   * Returns the number of months in this date's year.
   *
   * @return the month count
   */
  public int monthsPerYear() {
    return engine().monthsPerYear(year);
  }

  /**
   * Returns the day of the week.
   *
   * @return the day of the week
   */
  public DayOfWeek dayOfWeek() {
    return absoluteDay.dayOfWeek();
  }

  /**
   * Converts this date to a {@link LocalDate}, which is always proleptic Gregorian.
   *
   * @return the local date
   */
  public LocalDate toLocalDate() {
    return absoluteDay.toLocalDate();
  }

  private CalendarEngine engine() {
    return calendar.engine();
  }

  @Override
  public int compareTo(CivilDate other) {
    int byDay = absoluteDay.compareTo(other.absoluteDay);
    if (byDay != 0) {
      return byDay;
    }
    return calendar.compareTo(other.calendar);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CivilDate other)) {
      return false;
    }
    return year == other.year
        && month == other.month
        && day == other.day
        && calendar == other.calendar;
  }

  @Override
  public int hashCode() {
    return Objects.hash(year, month, day, calendar);
  }

  /**
   * Returns the date as {@code YYYY-MM-DD (calendar)}, e.g. {@code 1995-08-15 (julian)}.
   *
   * @return the string form
   */
  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d (%s)", year, month, day, calendar.tag());
  }
}
