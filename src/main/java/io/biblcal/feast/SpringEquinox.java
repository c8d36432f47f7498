package io.biblcal.feast;

import io.biblcal.time.JulianDay;

/**
 * Mean March equinox, Meeus, Astronomical Algorithms tables 27.A (years -1000 to 1000) and 27.B
 * (1000 to 3000). Years outside those spans extrapolate the nearer polynomial.
 */
public final class SpringEquinox {
  private SpringEquinox() {}

  /**
   * Returns the instant of the March equinox as a Julian Ephemeris Day.
   *
   * @param year the historical year
   * @return the Julian Ephemeris Day
   */
  public static double julianEphemerisDay(int year) {
    int astronomical = JulianDay.astronomicalYear(year);
    if (astronomical < 1000) {
      double y = astronomical / 1000d;
      return 1721139.29189
          + 365242.13740 * y
          + 0.06134 * y * y
          + 0.00111 * y * y * y
          - 0.00071 * y * y * y * y;
    }
    double y = (astronomical - 2000) / 1000d;
    return 2451623.80984
        + 365242.37404 * y
        + 0.05169 * y * y
        - 0.00411 * y * y * y
        - 0.00057 * y * y * y * y;
  }

  /**
   * Returns the integral Julian Day of the civil day containing the equinox.
   *
   * @param year the historical year
   * @return the Julian Day number
   */
  public static double day(int year) {
    return Math.floor(julianEphemerisDay(year) + 0.5);
  }
}
