package io.biblcal.time;

/**
 * A proleptic Gregorian calendar date. The day may carry a fraction from a Julian Day
 * conversion. Years are historical: there is no year 0.
 *
 * @param month the month (1-12)
 * @param day the day of month (1 to below 32)
 * @param year the year, negative for BCE
 */
public record CivilDate(int month, double day, int year) {
  /**
   * Returns the whole day of month.
   *
   * @return the day without its fraction
   */
  public int dayOfMonth() {
    return (int) Math.floor(day);
  }

  /**
   * Returns the month as an enum.
   *
   * @return the month
   */
  public GregorianMonth monthName() {
    return GregorianMonth.fromNumber(month).orElseThrow();
  }

  /**
   * Returns true if the year is before the common era.
   *
   * @return true for BCE years
   */
  public boolean isBce() {
    return year < 0;
  }

  /**
   * Returns the integral Julian Day number of this date.
   *
   * @return the Julian Day number
   */
  public double toJulianDay() {
    return JulianDay.toJulianDay(month, dayOfMonth(), year);
  }

  /**
   * Formats as day/month/year.
   *
   * @return the date in day-first form
   */
  public String toDayFirstString() {
    return dayOfMonth() + "/" + month + "/" + year;
  }

  @Override
  public String toString() {
    return month + "/" + dayOfMonth() + "/" + year;
  }
}
