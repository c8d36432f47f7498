package io.biblcal.time;

import java.util.Optional;

/** Represents a month of the Gregorian year. */
public enum GregorianMonth {
  JANUARY(1, "Jan"),
  FEBRUARY(2, "Feb"),
  MARCH(3, "Mar"),
  APRIL(4, "Apr"),
  MAY(5, "May"),
  JUNE(6, "Jun"),
  JULY(7, "Jul"),
  AUGUST(8, "Aug"),
  SEPTEMBER(9, "Sep"),
  OCTOBER(10, "Oct"),
  NOVEMBER(11, "Nov"),
  DECEMBER(12, "Dec");

  private final int monthNumber;
  private final String abbreviation;

  GregorianMonth(int monthNumber, String abbreviation) {
    this.monthNumber = monthNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  /**
   * Returns the three-letter abbreviation used in report columns.
   *
   * @return the abbreviation
   */
  public String abbreviation() {
    return abbreviation;
  }

  /**
   * Returns a GregorianMonth from its number.
   *
   * @param n the month number (1-12)
   * @return the month if valid
   */
  public static Optional<GregorianMonth> fromNumber(int n) {
    if (n < 1 || n > 12) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }
}
