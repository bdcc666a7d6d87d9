package io.kalends.engine;

/**
 * A raw (year, month, day) triple as produced by an engine.
 *
 * @param year the year
 * @param month the month (1-based)
 * @param day the day of the month (1-based)
 */
public record YearMonthDay(int year, int month, int day) {
  @Override
  public String toString() {
    return String.format("%04d-%02d-%02d", year, month, day);
  }
}
