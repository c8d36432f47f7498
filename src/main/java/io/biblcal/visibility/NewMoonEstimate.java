package io.biblcal.visibility;

import static io.biblcal.astro.Angles.DR;
import static io.biblcal.astro.Angles.normalizeDegrees;
import static java.lang.Math.sin;

import io.biblcal.astro.AstroTime;
import io.biblcal.time.JulianDay;

/**
 * Mean new moon of a lunation with the periodic corrections of Meeus, Astronomical Formulae for
 * Calculators ch. 32. Lunation 0 is the new moon of 1900 January.
 *
 * @param lunation the lunation number
 * @param julianDay the estimated instant of conjunction
 * @param deltaT Delta T at the estimate, days
 * @param firstEvening the integral Julian Day of the first evening worth observing
 */
public record NewMoonEstimate(int lunation, double julianDay, double deltaT, double firstEvening) {
  /** Mean lunations per year. */
  private static final double LUNATIONS_PER_YEAR = 12.368277;

  /** Correction applied to estimates before the early-epoch boundary. */
  private static final double EARLY_EPOCH_CORRECTION = 0.02778;

  /**
   * Returns the first lunation searched for a year: the last new moon before early April.
   *
   * @param year the historical year
   * @return the lunation number
   */
  public static int firstLunationOf(int year) {
    double y = year + 0.256;
    double base = y >= 0 ? 1900 : 1899;
    return (int) Math.floor((y - base) * LUNATIONS_PER_YEAR);
  }

  /**
   * Estimates the new moon of a lunation.
   *
   * @param lunation the lunation number
   * @return the estimate
   */
  public static NewMoonEstimate of(int lunation) {
    double ln = lunation;
    double ct = ln / 1236.85;
    double ct2 = ct * ct;
    double ct3 = ct2 * ct;

    double s = normalizeDegrees(166.56 + 132.87 * ct - 0.009173 * ct2);
    double jd = 2415020.75933 + 29.53058868 * ln + 0.0001178 * ct2;
    jd = jd - 0.000000155 * ct3 + 0.00033 * sin(s * DR);

    double sa = normalizeDegrees(359.2242 + 29.10535608 * ln - 0.0000333 * ct2 - 0.00000347 * ct3) * DR;
    double ma = normalizeDegrees(306.0253 + 385.816918 * ln + 0.0107306 * ct2 + 0.00001236 * ct3) * DR;
    double ml = normalizeDegrees(21.2964 + 390.6705065 * ln - 0.0016528 * ct2 - 0.00000239 * ct3) * DR;

    double add = (0.1734 - 0.000393 * ct) * sin(sa) + 0.0021 * sin(2 * sa) - 0.4068 * sin(ma);
    add = add + 0.0161 * sin(2 * ma) - 0.0004 * sin(3 * ma) + 0.0104 * sin(2 * ml);
    add = add - 0.0051 * sin(sa + ma) - 0.0074 * sin(sa - ma) + 0.0004 * sin(2 * ml + sa);
    add = add - 0.0004 * sin(2 * ml - sa) - 0.0006 * sin(2 * ml + ma);
    add = add + 0.001 * sin(2 * ml - ma) + 0.0005 * sin(sa + 2 * ma);
    jd += add;

    if (jd < JulianDay.EARLY_EPOCH_BOUNDARY) {
      jd -= EARLY_EPOCH_CORRECTION;
    }
    double deltaT = AstroTime.deltaTDays(ct);

    // conjunctions late in the day are first observable on the following evening
    double local = jd - deltaT;
    double evening = Math.floor(local);
    if (local - evening > 0.7) {
      evening++;
    }
    return new NewMoonEstimate(lunation, jd, deltaT, evening);
  }
}
