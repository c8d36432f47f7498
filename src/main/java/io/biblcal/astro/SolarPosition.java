package io.biblcal.astro;

import static io.biblcal.astro.Angles.DR;
import static io.biblcal.astro.Angles.RADIANS_TO_HOURS;
import static io.biblcal.astro.Angles.normalizeDegrees;

/**
 * Low-order solar series (Meeus, Astronomical Formulae for Calculators) evaluated at a time in
 * Julian centuries from 1900 January 0.5.
 *
 * @param obliquity obliquity of the ecliptic with nutation, radians
 * @param meanLongitude mean longitude, radians
 * @param meanAnomaly mean anomaly, radians
 * @param equationOfTime equation of time, hours
 * @param apparentLongitude apparent longitude, radians
 * @param declination declination, radians
 * @param rightAscension right ascension, hours
 */
public record SolarPosition(
    double obliquity,
    double meanLongitude,
    double meanAnomaly,
    double equationOfTime,
    double apparentLongitude,
    double declination,
    double rightAscension) {

  /**
   * Evaluates the series.
   *
   * @param t Julian centuries from 1900 January 0.5
   * @return the solar position
   */
  public static SolarPosition at(double t) {
    double t2 = t * t;
    double t3 = t2 * t;
    double node = (259.18 - 1934.142 * t) * DR;
    double eo =
        (23.452294 - 0.0130125 * t - 0.00000164 * t2 + 0.000000503 * t3 + 0.00256 * Math.cos(node))
            * DR;

    // planetary perturbation arguments
    double a = normalizeDegrees(153.23 + 22518.7541 * t) * DR;
    double b = normalizeDegrees(216.57 + 45037.5082 * t) * DR;
    double c = normalizeDegrees(312.69 + 32964.3577 * t) * DR;
    double d = normalizeDegrees(350.74 + 445267.1142 * t - 0.00144 * t2) * DR;
    double e = normalizeDegrees(231.19 + 20.2 * t) * DR;

    double ls = normalizeDegrees(279.69668 + 36000.76892 * t + 0.0003025 * t2) * DR;
    double ms =
        normalizeDegrees(358.47583 + 35999.04975 * t - 0.00015 * t2 - 0.0000033 * t3) * DR;
    double ecc = 0.01675104 - 0.0000418 * t - 0.000000126 * t2;

    double y = Math.pow(Math.tan(eo / 2), 2);
    double et =
        y * Math.sin(2 * ls)
            - 2 * ecc * Math.sin(ms)
            + 4 * ecc * y * Math.sin(ms) * Math.cos(2 * ls);
    et = (et - 0.5 * y * y * Math.sin(4 * ls) - 1.25 * ecc * ecc * Math.sin(2 * ms)) * 3.819718634;

    double center = (1.91946 - 0.004789 * t - 0.000014 * t2) * Math.sin(ms);
    center = (center + (0.020094 - 0.0001 * t) * Math.sin(2 * ms) + 0.000293 * Math.sin(3 * ms)) * DR;

    double lo =
        ls
            + center
            + (0.00134 * Math.cos(a)
                    + 0.00154 * Math.cos(b)
                    + 0.002 * Math.cos(c)
                    + 0.00179 * Math.sin(d)
                    + 0.00178 * Math.sin(e)
                    - 0.00569
                    - 0.00479 * Math.sin(node))
                * DR;

    double ds = Angles.asin(Math.sin(eo) * Math.sin(lo));
    double ra = Angles.quadrantAtan(Math.cos(eo) * Math.sin(lo), Math.cos(lo)) * RADIANS_TO_HOURS;
    return new SolarPosition(eo, ls, ms, et, lo, ds, ra);
  }
}
