package io.biblcal.time;

/**
 * Conversions between civil (proleptic Gregorian) dates and Julian Day numbers.
 *
 * <h2>Year numbering</h2>
 *
 * <p>Callers use historical years: there is no year 0 and 1 BCE is year -1. Inside the formulas
 * years are astronomical (1 BCE is year 0), so a historical year {@code y <= 0} is shifted by one
 * before conversion. Year 0 itself is therefore treated as year 1.
 *
 * <h2>Day boundary</h2>
 *
 * <p>{@link #toJulianDay} returns the integral day number of the civil date (the Julian Day at
 * noon). {@link #julianDayAtMidnight} returns the astronomical value at 0h, which ends in .5.
 *
 * <h2>Weekdays</h2>
 *
 * <p>{@code weekdayOf(jd) = floor(jd) mod 7} with 0 = Monday. Julian Day number 0 was a Monday.
 */
public final class JulianDay {
  /**
   * Julian Day before which the ephemeris series switch to their early-epoch constants. Falls in
   * the year 1350.
   */
  public static final double EARLY_EPOCH_BOUNDARY = 1483746;

  /** Julian Day of the Gregorian reform (1582-10-15). */
  private static final double GREGORIAN_REFORM = 1867216.25;

  private JulianDay() {}

  /**
   * Converts a civil date to its integral Julian Day number.
   *
   * @param month the month (1-12)
   * @param day the day of month, possibly fractional
   * @param year the historical year (negative for BCE)
   * @return the Julian Day number
   */
  public static double toJulianDay(int month, double day, int year) {
    return Math.floor(julianDayAtMidnight(month, day, year)) + 1;
  }

  /**
   * Converts a civil date to the astronomical Julian Day at 0h of that date.
   *
   * @param month the month (1-12)
   * @param day the day of month, possibly fractional
   * @param year the historical year (negative for BCE)
   * @return the Julian Day, ending in .5 for a whole day
   */
  public static double julianDayAtMidnight(int month, double day, int year) {
    double y = astronomicalYear(year);
    double m = month;
    if (m < 3) {
      y--;
      m += 12;
    }
    double a = Math.floor(y / 100d);
    double b = Math.floor(2 - a + Math.floor(a / 4d));
    return Math.floor(365.25d * (y + 4716)) + Math.floor(30.6001d * (m + 1)) + day + b - 1524.5d;
  }

  /**
   * Converts a Julian Day to a civil date. The day carries the fractional part of the input,
   * rounded to two decimals.
   *
   * @param jd the Julian Day
   * @return the civil date
   */
  public static CivilDate toCivilDate(double jd) {
    double z = Math.floor(jd);
    double f = jd - z;
    double alpha = Math.floor((z - GREGORIAN_REFORM) / 36524.25d);
    double a = z + 1 + alpha - Math.floor(alpha / 4d);
    double b = a + 1524;
    double c = Math.floor((b - 122.1d) / 365.25d);
    double d = Math.floor(365.25d * c);
    double e = Math.floor((b - d) / 30.6001d);
    double day = Math.rint((b - d - Math.floor(30.6001d * e) + f) * 100) / 100;

    int month = (int) (e < 14 ? e - 1 : e - 13);
    int year = (int) (month > 2 ? c - 4716 : c - 4715);
    if (year < 1) {
      year--;
    }
    return new CivilDate(month, day, year);
  }

  /**
   * Returns the weekday number of a Julian Day, 0 = Monday through 6 = Sunday.
   *
   * @param jd the Julian Day
   * @return the weekday number (0-6)
   */
  public static int weekdayOf(double jd) {
    return (int) Math.floorMod((long) Math.floor(jd), 7L);
  }

  /**
   * Returns the typed weekday of a Julian Day.
   *
   * @param jd the Julian Day
   * @return the weekday
   */
  public static Weekday weekday(double jd) {
    return Weekday.fromJulianDay(jd);
  }

  /**
   * Maps a historical year to the astronomical numbering used inside the formulas.
   *
   * @param year the historical year
   * @return the astronomical year
   */
  public static int astronomicalYear(int year) {
    return year <= 0 ? year + 1 : year;
  }
}
