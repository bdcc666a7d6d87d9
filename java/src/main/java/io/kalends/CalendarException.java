package io.kalends;

import java.util.Optional;

/** Exception thrown when a date cannot be constructed, validated, or converted. */
public final class CalendarException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The calendar the failing operation was working in. */
  private final CalendarKind calendar;

  /** The name of the offending field (year, month, day, absoluteDay, calendar). */
  private final String field;

  /** The offending value, as text. */
  private final String value;

  private CalendarException(
      ErrorKind kind, String message, CalendarKind calendar, String field, String value) {
    super(message);
    this.kind = kind;
    this.calendar = calendar;
    this.field = field;
    this.value = value;
  }

  /**
   * Creates a new invalid-date error.
   *
   * @param calendar the calendar the date was expressed in
   * @param field the offending field
   * @param value the offending value
   * @param message the error message
   * @return a new CalendarException for an invalid date
   */
  public static CalendarException invalidDate(
      CalendarKind calendar, String field, long value, String message) {
    return new CalendarException(
        ErrorKind.INVALID_DATE, message, calendar, field, String.valueOf(value));
  }

  /**
   * Creates a new out-of-range error.
   *
   * @param calendar the calendar whose span was exceeded
   * @param field the offending field
   * @param value the offending value
   * @param message the error message
   * @return a new CalendarException for an out-of-range year or day count
   */
  public static CalendarException outOfRange(
      CalendarKind calendar, String field, long value, String message) {
    return new CalendarException(
        ErrorKind.OUT_OF_RANGE, message, calendar, field, String.valueOf(value));
  }

  /**
   * Creates a new unsupported-calendar error.
   *
   * @param value the calendar tag or name that was not recognized, may be null
   * @param message the error message
   * @return a new CalendarException for an unsupported calendar
   */
  public static CalendarException unsupportedCalendar(String value, String message) {
    return new CalendarException(ErrorKind.UNSUPPORTED_CALENDAR, message, null, "calendar", value);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the calendar involved, if known.
   *
   * @return the calendar, or empty for unsupported-calendar errors
   */
  public Optional<CalendarKind> calendar() {
    return Optional.ofNullable(calendar);
  }

  /**
   * Returns the name of the offending field, if available.
   *
   * @return the field name
   */
  public Optional<String> field() {
    return Optional.ofNullable(field);
  }

  /**
   * Returns the offending value, if available.
   *
   * @return the value as text
   */
  public Optional<String> value() {
    return Optional.ofNullable(value);
  }

  /**
   * Formats the error with its kind and offending field, for example:
   *
   * <pre>
   * error[invalid_date]: day 29 is out of range for gregorian 1900-02 (1..28)
   *   field: day = 29
   * </pre>
   *
   * @return a formatted error message
   */
  public String display() {
    StringBuilder sb = new StringBuilder();
    sb.append("error[").append(kind).append("]: ").append(getMessage());
    if (field != null) {
      sb.append("\n  field: ").append(field);
      if (value != null) {
        sb.append(" = ").append(value);
      }
    }
    return sb.toString();
  }
}
