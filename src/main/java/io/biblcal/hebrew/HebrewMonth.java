package io.biblcal.hebrew;

import java.util.Optional;

/**
 * Hebrew months in religious-year order, with their lengths in a common deficient year. Heshvan
 * and Kislev vary with the year type; that variation is carried by the year length.
 */
public enum HebrewMonth {
  NISAN(1, "Nisan", 30),
  IYAR(2, "Iyar", 29),
  SIVAN(3, "Sivan", 30),
  TAMMUZ(4, "Tammuz", 29),
  AV(5, "Av", 30),
  ELUL(6, "Elul", 29),
  TISHRI(7, "Tishri", 30),
  HESHVAN(8, "Heshvan", 29),
  KISLEV(9, "Kislev", 29),
  TEVET(10, "Tevet", 29),
  SHEVAT(11, "Shevat", 30),
  ADAR(12, "Adar", 29),
  /** The intercalary month of a leap year. */
  VEDAR(13, "Vedar", 29);

  private final int number;
  private final String displayName;
  private final int length;

  HebrewMonth(int number, String displayName, int length) {
    this.number = number;
    this.displayName = displayName;
    this.length = length;
  }

  /**
   * Returns the month number, Nisan=1.
   *
   * @return the month number (1-13)
   */
  public int number() {
    return number;
  }

  /**
   * Returns the length of the month in a common deficient year.
   *
   * @return the number of days
   */
  public int length() {
    return length;
  }

  /**
   * Returns true for the month that only exists in leap years.
   *
   * @return true for Vedar
   */
  public boolean isIntercalary() {
    return this == VEDAR;
  }

  /**
   * Returns the number of months in a year.
   *
   * @param leap whether the year is a leap year
   * @return 13 for a leap year, else 12
   */
  public static int monthsInYear(boolean leap) {
    return leap ? 13 : 12;
  }

  /**
   * Returns a HebrewMonth from its number.
   *
   * @param n the month number (1-13)
   * @return the month if valid
   */
  public static Optional<HebrewMonth> fromNumber(int n) {
    if (n < 1 || n > 13) {
      return Optional.empty();
    }
    return Optional.of(values()[n - 1]);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
