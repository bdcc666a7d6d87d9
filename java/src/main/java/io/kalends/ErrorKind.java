package io.kalends;

/** The type of error that occurred while validating or converting a date. */
public enum ErrorKind {
  /** The fields are inconsistent for the stated calendar and year (bad month or day). */
  INVALID_DATE("invalid_date"),
  /** The year or day count falls outside the calendar's supported span. */
  OUT_OF_RANGE("out_of_range"),
  /** The calendar is not one of the supported systems. */
  UNSUPPORTED_CALENDAR("unsupported_calendar");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
