package io.biblcal.hebrew;

/**
 * Summary of the Hebrew year that begins on 1 Tishri of a Gregorian year.
 *
 * @param gregorianYear the Gregorian year containing 1 Tishri
 * @param hebrewYear the Hebrew year number
 * @param metonicPosition position in the 19-year cycle (1-19)
 * @param leap whether the year has the intercalary month
 * @param tishriJulianDay the Julian Day of 1 Tishri (at 0h)
 * @param yearLengthDays the year length, one of 353, 354, 355, 383, 384, 385
 * @param yearType the year type matching the length
 */
public record HebrewYearInfo(
    int gregorianYear,
    int hebrewYear,
    int metonicPosition,
    boolean leap,
    double tishriJulianDay,
    int yearLengthDays,
    HebrewYearType yearType) {

  /**
   * Computes the year summary.
   *
   * @param gregorianYear the Gregorian year (year 0 is treated as 1)
   * @return the year summary
   */
  public static HebrewYearInfo of(int gregorianYear) {
    int year = gregorianYear == 0 ? 1 : gregorianYear;
    int hebrewYear = HebrewCalendar.hebrewYearStartingIn(year);
    int length = HebrewCalendar.yearLength(year);
    HebrewYearType type =
        HebrewYearType.fromLength(length)
            .orElseThrow(() -> new IllegalStateException("non-canonical year length " + length));
    return new HebrewYearInfo(
        year,
        hebrewYear,
        HebrewCalendar.metonicPosition(hebrewYear),
        HebrewCalendar.isLeapYear(hebrewYear),
        HebrewCalendar.tishriJulianDay(year),
        length,
        type);
  }
}
