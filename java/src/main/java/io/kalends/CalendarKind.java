package io.kalends;

import io.kalends.engine.CalendarEngine;
import java.util.Map;
import java.util.Optional;

/**
 * The supported calendar systems.
 *
 * <p>The set is closed. Each constant is bound to exactly one {@link CalendarEngine} through the
 * dispatch table in {@link Calendars}; adding a calendar means adding a constant here and an entry
 * there.
 */
public enum CalendarKind {
  /** Proleptic Gregorian calendar. */
  GREGORIAN("gregorian"),
  /** Proleptic Julian calendar. */
  JULIAN("julian"),
  /** French Republican calendar, counted from 22 September 1792. */
  FRENCH_REPUBLICAN("french"),
  /** Hebrew lunisolar calendar, counted from the creation epoch (AM 1). */
  HEBREW("hebrew");

  private final String tag;

  CalendarKind(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the fixed string tag used when serializing a date.
   *
   * @return the tag
   */
  public String tag() {
    return tag;
  }

  @Override
  public String toString() {
    return tag;
  }

  private static final Map<String, CalendarKind> PARSE_MAP =
      Map.ofEntries(
          Map.entry("gregorian", GREGORIAN),
          Map.entry("julian", JULIAN),
          Map.entry("french", FRENCH_REPUBLICAN),
          Map.entry("french_republican", FRENCH_REPUBLICAN),
          Map.entry("hebrew", HEBREW));

  /**
   * Parses a calendar tag or constant name (case insensitive).
   *
   * @param s the string to parse
   * @return the calendar if recognized
   */
  public static Optional<CalendarKind> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase()));
  }

  /**
   * Resolves a calendar tag, failing for anything outside the supported set.
   *
   * @param tag the tag to resolve
   * @return the calendar
   * @throws CalendarException with {@link ErrorKind#UNSUPPORTED_CALENDAR} if the tag is unknown
   */
  public static CalendarKind fromTag(String tag) throws CalendarException {
    Optional<CalendarKind> kind = parse(tag);
    if (kind.isEmpty()) {
      throw CalendarException.unsupportedCalendar(tag, "unsupported calendar: " + tag);
    }
    return kind.get();
  }

  /**
   * Returns the engine that implements this calendar.
   *
   * @return the engine
   */
  public CalendarEngine engine() {
    return Calendars.engineFor(this);
  }

  /**
   * Returns whether the given year is a leap year in this calendar.
   *
   * @param year the year
   * @return true for a leap year
   */
  public boolean isLeapYear(int year) {
    return engine().isLeapYear(year);
  }

  /**
   * Returns the number of months in the given year, counting the complementary days of the French
   * Republican calendar as a month.
   *
   * @param year the year
   * @return the month count
   */
  public int monthsPerYear(int year) {
    return engine().monthsPerYear(year);
  }

  /**
   * Returns the length of a month.
   *
   * @param year the year
   * @param month the month (1-based)
   * @return the number of days in the month
   * @throws CalendarException if the year is unsupported or the month does not exist
   */
  public int daysInMonth(int year, int month) throws CalendarException {
    return engine().daysInMonth(year, month);
  }
}
