package io.biblcal.astro;

import io.biblcal.time.JulianDay;

/** Time arguments for the series: Julian centuries, Delta T and sidereal time. */
public final class AstroTime {
  /** Julian Day of 1900 January 0.5, the series epoch. */
  public static final double EPOCH_1900 = 2415020;

  private static final double DAYS_PER_CENTURY = 36525;

  private AstroTime() {}

  /**
   * Returns Delta T in days for a time {@code ct} Julian centuries after 1900.
   *
   * @param ct Julian centuries from 1900
   * @return Delta T, days
   */
  public static double deltaTDays(double ct) {
    return (0.41 + 1.2053 * ct + 0.4992 * ct * ct) / 1440;
  }

  /**
   * Returns the series time for the evening of day {@code jd}, near local sunset.
   *
   * @param jd the integral Julian Day
   * @param observer the observer
   * @param deltaT Delta T, days
   * @return Julian centuries from 1900
   */
  public static double eveningCenturies(double jd, Observer observer, double deltaT) {
    double eveningOffset = jd < JulianDay.EARLY_EPOCH_BOUNDARY ? 0.2222 : 0.25;
    return (jd + observer.westLongitudeFraction() + eveningOffset + deltaT - EPOCH_1900)
        / DAYS_PER_CENTURY;
  }

  /**
   * Returns the series time at a number of hours after local noon on day {@code jd}.
   *
   * @param jd the integral Julian Day
   * @param hoursAfterNoon hours after local noon
   * @param observer the observer
   * @param deltaT Delta T, days
   * @return Julian centuries from 1900
   */
  public static double centuriesAt(
      double jd, double hoursAfterNoon, Observer observer, double deltaT) {
    double epoch = jd < JulianDay.EARLY_EPOCH_BOUNDARY ? 2415020.0278 : EPOCH_1900;
    return (jd + hoursAfterNoon / 24d + deltaT + observer.westLongitudeFraction() - epoch)
        / DAYS_PER_CENTURY;
  }

  /**
   * Returns Greenwich mean sidereal time at 0h UT of the day, in hours.
   *
   * @param jd the integral Julian Day
   * @return sidereal time in [0, 24)
   */
  public static double siderealHoursAtMidnight(double jd) {
    double kt = (jd - 2415019.5) / DAYS_PER_CENTURY;
    double s = 6.6460656 + 2400.051262 * kt + 0.00002581 * kt * kt;
    return Angles.modulo(s, 24);
  }
}
