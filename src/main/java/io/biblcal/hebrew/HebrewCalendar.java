package io.biblcal.hebrew;

import io.biblcal.time.JulianDay;

/**
 * Arithmetic (rabbinic) Hebrew calendar rules, after Meeus, Astronomical Algorithms ch. 9.
 *
 * <p>Gregorian years are historical (no year 0; year 0 is treated as year 1). The Hebrew year that
 * begins on 1 Tishri of Gregorian year {@code y} is {@code y + 3761} for CE years; the year whose
 * spring falls in {@code y} is one less.
 */
public final class HebrewCalendar {
  /** Offset from a CE Gregorian year to the Hebrew year beginning in its autumn. */
  public static final int TISHRI_YEAR_OFFSET = 3761;

  /** Days from the March date returned by the Pesach rule to 1 Tishri. */
  private static final int PESACH_TO_TISHRI = 163;

  private HebrewCalendar() {}

  /**
   * Returns the Julian Day (at 0h, so ending in .5) of 1 Tishri in the given Gregorian year.
   *
   * <p>The naive Pesach date is {@code floor(Q) + 22} March. Postponements, checked on the weekday
   * {@code j} of the naive epoch:
   *
   * <ol>
   *   <li>{@code j} is 2, 4 or 6: one day later
   *   <li>{@code j == 1}, {@code lca > 6} and {@code frac(Q) >= 0.63287037}: two days later
   *   <li>{@code j == 0}, {@code lca > 11} and {@code frac(Q) >= 0.897723765}: one day later
   * </ol>
   *
   * @param gregorianYear the Gregorian year
   * @return the Julian Day of 1 Tishri
   */
  public static double tishriJulianDay(int gregorianYear) {
    double x = JulianDay.astronomicalYear(gregorianYear);
    double c = Math.floor(x / 100d);
    double s = Math.floor((3 * c - 5) / 4d);
    int lca = Math.floorMod((long) Math.floor(12 * x + 12), 19);
    int lcb = Math.floorMod((long) x, 4);
    double q =
        -1.904412361576d
            + 1.554241796621d * lca
            + 0.25d * lcb
            - 0.003177794022d * x
            + s;
    double fq = Math.floor(q);
    int j = Math.floorMod((long) Math.floor(fq + 3 * x + 5 * lcb + 2 - s), 7);
    double r = q - fq;

    double day = fq + 22;
    if (j == 2 || j == 4 || j == 6) {
      day = fq + 23;
    }
    if (j == 1 && lca > 6 && r >= 0.63287037d) {
      day = fq + 24;
    }
    if (j == 0 && lca > 11 && r >= 0.897723765d) {
      day = fq + 23;
    }

    int month = 3;
    if (day > 31) {
      day -= 31;
      month++;
      if (day > 30) {
        day -= 30;
        month++;
      }
    }
    return JulianDay.julianDayAtMidnight(month, day, gregorianYear) + PESACH_TO_TISHRI;
  }

  /**
   * Returns the length of the Hebrew year that begins in the given Gregorian year.
   *
   * @param gregorianYear the Gregorian year
   * @return the year length in days, one of 353, 354, 355, 383, 384, 385
   */
  public static int yearLength(int gregorianYear) {
    int year = gregorianYear == 0 ? 1 : gregorianYear;
    int next = year == -1 ? 1 : year + 1;
    return (int) (tishriJulianDay(next) - tishriJulianDay(year));
  }

  /**
   * Returns true if the Hebrew year has an intercalary month.
   *
   * @param hebrewYear the Hebrew year number
   * @return true for a leap (embolismic) year
   */
  public static boolean isLeapYear(long hebrewYear) {
    return Math.floorMod(7 * hebrewYear + 1, 19) < 7;
  }

  /**
   * Returns the position of a Hebrew year in its 19-year cycle.
   *
   * @param hebrewYear the Hebrew year number
   * @return the cycle position (1-19)
   */
  public static int metonicPosition(long hebrewYear) {
    return (int) Math.floorMod(hebrewYear - 1, 19L) + 1;
  }

  /**
   * Returns the Hebrew year that begins on 1 Tishri of the given Gregorian year.
   *
   * @param gregorianYear the Gregorian year
   * @return the Hebrew year number
   */
  public static int hebrewYearStartingIn(int gregorianYear) {
    return JulianDay.astronomicalYear(gregorianYear) + TISHRI_YEAR_OFFSET;
  }
}
