package io.kalends;

import io.kalends.engine.CalendarEngine;
import io.kalends.engine.FrenchRepublicanEngine;
import io.kalends.engine.GregorianEngine;
import io.kalends.engine.HebrewEngine;
import io.kalends.engine.JulianEngine;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static entry points for engine lookup, conversion, validation and calendar detection.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CivilDate julian = CivilDate.of(1995, 8, 15, CalendarKind.JULIAN);
 * CivilDate gregorian = Calendars.convert(julian, CalendarKind.GREGORIAN); // 1995-08-28
 * boolean ok = Calendars.validate(1900, 2, 29, CalendarKind.GREGORIAN);   // false
 * }</pre>
 */
public final class Calendars {
  private static final Logger LOG = LoggerFactory.getLogger(Calendars.class);

  /** First year of the French Republican calendar, in Gregorian years. */
  private static final int FRENCH_REPUBLIC_FIRST_YEAR = 1792;

  /** Last Gregorian year in which the French Republican calendar was in force. */
  private static final int FRENCH_REPUBLIC_LAST_YEAR = 1805;

  /** First year of the Gregorian reform. */
  private static final int GREGORIAN_REFORM_YEAR = 1582;

  /** Years beyond this are taken to be Hebrew anno mundi years. */
  private static final int HEBREW_YEAR_THRESHOLD = 5000;

  private static final Map<CalendarKind, CalendarEngine> ENGINES = createDispatchTable();

  private Calendars() {}

  private static Map<CalendarKind, CalendarEngine> createDispatchTable() {
    Map<CalendarKind, CalendarEngine> table = new EnumMap<>(CalendarKind.class);
    table.put(CalendarKind.GREGORIAN, GregorianEngine.INSTANCE);
    table.put(CalendarKind.JULIAN, JulianEngine.INSTANCE);
    table.put(CalendarKind.FRENCH_REPUBLICAN, FrenchRepublicanEngine.INSTANCE);
    table.put(CalendarKind.HEBREW, HebrewEngine.INSTANCE);
    for (CalendarKind kind : CalendarKind.values()) {
      CalendarEngine engine = table.get(kind);
      if (engine == null || engine.kind() != kind) {
        throw new IllegalStateException("no engine registered for calendar " + kind);
      }
    }
    return Collections.unmodifiableMap(table);
  }

  /**
   * Returns the engine for a calendar.
   *
   * @param kind the calendar
   * @return the engine
   * @throws CalendarException with {@link ErrorKind#UNSUPPORTED_CALENDAR} if {@code kind} is null
   */
  public static CalendarEngine engine(CalendarKind kind) throws CalendarException {
    if (kind == null) {
      throw CalendarException.unsupportedCalendar(null, "no calendar given");
    }
    return engineFor(kind);
  }

  /** Table lookup for a non-null calendar. */
  static CalendarEngine engineFor(CalendarKind kind) {
    return ENGINES.get(kind);
  }

  /**
   * Converts a date to another calendar.
   *
   * @param date the date
   * @param target the target calendar
   * @return the same day in the target calendar
   * @throws CalendarException if the day is outside the target calendar's span
   */
  public static CivilDate convert(CivilDate date, CalendarKind target) throws CalendarException {
    return date.convertTo(target);
  }

  /**
   * Validates a date without throwing.
   *
   * @param year the year
   * @param month the month
   * @param day the day
   * @param kind the calendar
   * @return true if the date exists in the calendar's supported span
   */
  public static boolean validate(int year, int month, int day, CalendarKind kind) {
    try {
      engine(kind).toAbsoluteDay(year, month, day);
      return true;
    } catch (CalendarException e) {
      LOG.debug("Rejected {}-{}-{} ({}): {}", year, month, day, kind, e.getMessage());
      return false;
    }
  }

  /**
   * Guesses the calendar of a year recorded without one.
   *
   * <p>Years above 5000 are taken as Hebrew, 1792 to 1805 as French Republican, years before 1582
   * as Julian, and anything else as Gregorian. This is a heuristic for imported records; it never
   * replaces an explicit calendar.
   *
   * @param year the recorded year
   * @return the most likely calendar
   */
  public static CalendarKind detect(int year) {
    CalendarKind kind;
    if (year > HEBREW_YEAR_THRESHOLD) {
      kind = CalendarKind.HEBREW;
    } else if (year >= FRENCH_REPUBLIC_FIRST_YEAR && year <= FRENCH_REPUBLIC_LAST_YEAR) {
      kind = CalendarKind.FRENCH_REPUBLICAN;
    } else if (year < GREGORIAN_REFORM_YEAR) {
      kind = CalendarKind.JULIAN;
    } else {
      kind = CalendarKind.GREGORIAN;
    }
    LOG.debug("Detected {} calendar for year {}", kind, year);
    return kind;
  }

  /**
   * Guesses the calendar of a date. Dates tagged with a non-Gregorian calendar keep it; Gregorian
   * dates, the default tag for imported records, go through {@link #detect(int)}.
   *
   * @param date the date
   * @return the most likely calendar
   */
  public static CalendarKind detect(CivilDate date) {
    if (date.calendar() != CalendarKind.GREGORIAN) {
      return date.calendar();
    }
    return detect(date.year());
  }
}
