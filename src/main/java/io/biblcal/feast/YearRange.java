package io.biblcal.feast;

import io.biblcal.CalendarException;
import java.util.stream.IntStream;

/**
 * An inclusive span of historical years.
 *
 * @param start the first year
 * @param end the last year, not before {@code start}
 */
public record YearRange(int start, int end) {
  /** Earliest year the flood table scans. */
  public static final int FLOOD_EARLIEST = -4004;

  /** Latest year accepted anywhere. */
  public static final int LATEST = 9999;

  /** Earliest year accepted anywhere. */
  public static final int EARLIEST = -9999;

  /**
   * Creates a validated range.
   *
   * @param start the first year
   * @param end the last year
   * @return the range
   * @throws CalendarException if a bound is outside [-9999, 9999] or the range is reversed
   */
  public static YearRange of(int start, int end) throws CalendarException {
    checkYear(start);
    checkYear(end);
    if (end < start) {
      throw CalendarException.input("range ends before it starts", start + ".." + end);
    }
    return new YearRange(start, end);
  }

  /**
   * Creates a single-year range.
   *
   * @param year the year
   * @return the range
   * @throws CalendarException if the year is outside [-9999, 9999]
   */
  public static YearRange single(int year) throws CalendarException {
    return of(year, year);
  }

  /**
   * Normalizes the bounds of a flood-table run: the end is raised to 4004 BCE and lowered to 9999
   * CE, an end of 0 becomes 1 BCE, and reversed bounds are swapped.
   *
   * @param start the first year
   * @param end the last year
   * @return the range
   * @throws CalendarException if the start is outside [-9999, 9999]
   */
  public static YearRange forFlood(int start, int end) throws CalendarException {
    checkYear(start);
    int e = end;
    if (e < FLOOD_EARLIEST) {
      e = FLOOD_EARLIEST;
    }
    if (e == 0) {
      e = -1;
    }
    if (e > LATEST) {
      e = LATEST;
    }
    return e < start ? new YearRange(e, start) : new YearRange(start, e);
  }

  /**
   * Validates a single year.
   *
   * @param year the year
   * @throws CalendarException if the year is outside [-9999, 9999]
   */
  public static void checkYear(int year) throws CalendarException {
    if (year < EARLIEST || year > LATEST) {
      throw CalendarException.input("year must be within [-9999, 9999]", year);
    }
  }

  /**
   * Returns true if the range covers more than one year.
   *
   * @return true for a multi-year run
   */
  public boolean isMultiYear() {
    return end > start;
  }

  /**
   * Returns the years in increasing order. Year 0 is read as year 1 and never repeated.
   *
   * @return the years
   */
  public IntStream years() {
    return IntStream.rangeClosed(start, end).map(y -> y == 0 ? 1 : y).distinct();
  }
}
