package io.biblcal.astro;

import static io.biblcal.astro.Angles.DR;
import static io.biblcal.astro.Angles.RADIANS_TO_HOURS;
import static io.biblcal.astro.Angles.normalizeDegrees;
import static java.lang.Math.cos;
import static java.lang.Math.sin;

/**
 * Lunar series (Meeus, Astronomical Formulae for Calculators ch. 30) evaluated at a time in Julian
 * centuries from 1900 January 0.5.
 *
 * @param longitude geocentric ecliptic longitude, radians
 * @param latitude geocentric ecliptic latitude, radians
 * @param parallax horizontal parallax, degrees
 * @param declination declination, radians
 * @param rightAscension right ascension, hours
 * @param meanAnomaly mean anomaly, radians
 * @param sunMeanAnomaly the sun's mean anomaly as used by the lunar terms, radians
 */
public record LunarPosition(
    double longitude,
    double latitude,
    double parallax,
    double declination,
    double rightAscension,
    double meanAnomaly,
    double sunMeanAnomaly) {

  /**
   * Evaluates the series.
   *
   * @param t Julian centuries from 1900 January 0.5
   * @param obliquity obliquity of the ecliptic at {@code t}, radians
   * @return the lunar position
   */
  public static LunarPosition at(double t, double obliquity) {
    double t2 = t * t;
    double t3 = t2 * t;
    double a4 = normalizeDegrees(51.2 + 20.2 * t) * DR;
    double a5 = normalizeDegrees(346.56 + 132.87 * t - 0.0091731 * t2) * DR;
    double a6 = 0.003964 * sin(a5);
    double omega = 259.183275 - 1934.142 * t + 0.002078 * t2 + 0.0000022 * t3;
    double node = normalizeDegrees(omega) * DR;
    double a7 = normalizeDegrees(omega + 275.05 - 2.3 * t) * DR;

    double mm = 296.104608 + 477198.8491 * t + 0.009192 * t2;
    mm = mm + 0.0000144 * t3 + 0.000817 * sin(a4);
    mm = mm + a6 + 0.002541 * sin(node);
    mm = normalizeDegrees(mm) * DR;

    double lm = 270.434164 + 481267.8831 * t - 0.001133 * t2 + 0.0000019 * t3;
    lm = lm + 0.000233 * sin(a4) + a6 + 0.001964 * sin(node);
    lm = normalizeDegrees(lm);

    double s1 = 358.475833 + 35999.0498 * t - 0.00015 * t2 - 0.0000033 * t3;
    s1 -= 0.001778 * sin(a4);
    s1 = normalizeDegrees(s1) * DR;

    double dm = 350.737486 + 445267.1142 * t - 0.001436 * t2 + 0.0000019 * t3;
    dm = dm + 0.002011 * sin(a4) + a6 + 0.001964 * sin(node);
    dm = normalizeDegrees(dm) * DR;

    double fm = 11.250889 + 483202.0251 * t - 0.003211 * t2 - 0.0000003 * t3;
    fm = fm + a6 - 0.024691 * sin(node) - 0.004328 * sin(a7);
    fm = normalizeDegrees(fm) * DR;

    double e1 = 1 - 0.002495 * t - 0.00000752 * t2;
    double e2 = e1 * e1;

    double l = longitude(lm, mm, dm, fm, s1, e1, e2);
    double lb = latitude(mm, dm, fm, s1, e1, e2);
    double hp = parallax(mm, dm, fm, s1, e1, e2);

    double w1 = 0.0004664 * cos(node);
    double w2 = 0.0000754 * cos(node + (275.05 - 2.3 * t) * DR);
    lb *= 1 - w1 - w2;
    l *= DR;
    lb *= DR;

    double dec = Angles.asin(sin(lb) * cos(obliquity) + cos(lb) * sin(obliquity) * sin(l));
    double ra =
        Angles.quadrantAtan(sin(l) * cos(obliquity) - Math.tan(lb) * sin(obliquity), cos(l))
            * RADIANS_TO_HOURS;
    return new LunarPosition(l, lb, hp, dec, ra, mm, s1);
  }

  private static double longitude(
      double lm, double mm, double dm, double fm, double s1, double e1, double e2) {
    double l = lm + 6.28875 * sin(mm) + 1.274018 * sin(2 * dm - mm) + 0.658309 * sin(2 * dm);
    l = l + 0.213616 * sin(2 * mm) - (0.185596 * sin(s1)) * e1 - 0.114336 * sin(2 * fm);
    l = l + 0.058793 * sin(2 * dm - 2 * mm) + (0.057212 * sin(2 * dm - s1 - mm)) * e1;
    l = l + 0.05332 * sin(2 * dm + mm) + (0.045874 * sin(2 * dm - s1)) * e1;
    l = l + (0.041024 * sin(mm - s1)) * e1 - 0.034718 * sin(dm);
    l = l - e1 * 0.030465 * sin(s1 + mm) + 0.015326 * sin(2 * dm - 2 * fm);
    l = l - 0.012528 * sin(2 * fm + mm) - 0.01098 * sin(2 * fm - mm) + 0.010674 * sin(4 * dm - mm);
    l = l + 0.010034 * sin(3 * mm) + 0.008548 * sin(4 * dm - 2 * mm);
    l = l - 0.00791 * sin(s1 - mm + 2 * dm) * e1 - e1 * 0.006783 * sin(2 * dm + s1);
    l = l + 0.005162 * sin(mm - dm) + e1 * 0.005 * sin(s1 + dm);
    l = l + e1 * 0.004049 * sin(mm - s1 + 2 * dm) + 0.003996 * sin(2 * mm + 2 * dm);
    l = l + 0.003862 * sin(4 * dm) + 0.003665 * sin(2 * dm - 3 * mm);
    l = l + e1 * 0.002695 * sin(2 * mm - s1) + 0.002602 * sin(mm - 2 * fm - 2 * dm);
    l = l + e1 * 0.002396 * sin(2 * dm - s1 - 2 * mm) - 0.002349 * sin(mm + dm);
    l = l + e2 * 0.002249 * sin(2 * dm - 2 * s1) - e1 * 0.002125 * sin(2 * mm + s1);
    l = l - e2 * 0.002079 * sin(2 * s1) + e2 * 0.002059 * sin(2 * dm - mm - 2 * s1);
    l = l - 0.001773 * sin(mm + 2 * dm - 2 * fm) - 0.001595 * sin(2 * fm + 2 * dm);
    l = l + e1 * 0.00122 * sin(4 * dm - s1 - mm) - 0.00111 * sin(2 * mm + 2 * fm);
    l = l + 0.000892 * sin(mm - 3 * dm) - e1 * 0.000811 * sin(s1 + mm + 2 * dm);
    l = l + e1 * 0.000761 * sin(4 * dm - s1 - 2 * mm) + e2 * 0.000717 * sin(mm - 2 * s1);
    l = l + e2 * 0.000704 * sin(mm - 2 * s1 - 2 * dm) + e1 * 0.000693 * sin(s1 - 2 * mm + 2 * dm);
    l += e1 * 0.000598 * sin(2 * dm - s1 - 2 * fm);
    l = l + 0.00055 * sin(mm + 4 * dm) + 0.000538 * sin(4 * mm);
    l = l + e1 * 0.000521 * sin(4 * dm - s1) + 0.000486 * sin(2 * mm - dm);
    return l;
  }

  private static double latitude(
      double mm, double dm, double fm, double s1, double e1, double e2) {
    double b = 5.128189 * sin(fm) + 0.280606 * sin(mm + fm) + 0.277693 * sin(mm - fm);
    b = b + 0.173238 * sin(2 * dm - fm) + 0.055413 * sin(2 * dm + fm - mm);
    b = b + 0.046272 * sin(2 * dm - fm - mm) + 0.032573 * sin(2 * dm + fm);
    b = b + 0.017198 * sin(2 * mm + fm) + 0.009267 * sin(2 * dm + mm - fm);
    b = b + 0.008823 * sin(2 * mm - fm) + e1 * 0.008247 * sin(2 * dm - s1 - fm);
    b = b + 0.004323 * sin(2 * dm - fm - 2 * mm) + 0.0042 * sin(2 * dm + fm + mm);
    b = b + e1 * 0.003372 * sin(fm - s1 - 2 * dm) + e1 * 0.002472 * sin(2 * dm + fm - s1 - mm);
    b = b + e1 * 0.002222 * sin(2 * dm + fm - s1) + e1 * 0.002072 * sin(2 * dm - fm - s1 - mm);
    b = b + e1 * 0.001877 * sin(fm - s1 + mm) + 0.001828 * sin(4 * dm - fm - mm);
    b = b - e1 * 0.001803 * sin(fm + s1) - 0.00175 * sin(3 * fm) + e1 * 0.00157 * sin(mm - s1 - fm);
    b = b - 0.001487 * sin(fm + dm) - e1 * 0.001481 * sin(fm + s1 + mm);
    b = b + e1 * 0.001417 * sin(fm - s1 - mm) + e1 * 0.00135 * sin(fm - s1) + 0.00133 * sin(fm - dm);
    b = b + 0.001106 * sin(fm + 3 * mm) + 0.00102 * sin(4 * dm - fm);
    b = b + 0.000833 * sin(fm + 4 * dm - mm) + 0.000781 * sin(mm - 3 * fm);
    b = b + 0.00067 * sin(fm + 4 * dm - 2 * mm) + 0.000606 * sin(2 * dm - 3 * fm);
    b = b + 0.000597 * sin(2 * dm + 2 * mm - fm) + e1 * 0.000492 * sin(2 * dm + mm - s1 - fm);
    b = b + 0.00045 * sin(2 * mm - fm - 2 * dm) + 0.000439 * sin(3 * mm - fm);
    b = b + 0.000423 * sin(fm + 2 * dm + 2 * mm) + 0.000422 * sin(2 * dm - fm - 3 * mm);
    b = b - e1 * 0.000367 * sin(s1 + fm + 2 * dm - mm) - e1 * 0.000353 * sin(s1 + fm + 2 * dm);
    b = b + 0.000331 * sin(fm + 4 * dm) + e1 * 0.000317 * sin(2 * dm + fm - s1 + mm);
    b = b + e2 * 0.000306 * sin(2 * dm - 2 * s1 - fm) - 0.000283 * sin(mm + 3 * fm);
    return b;
  }

  private static double parallax(
      double mm, double dm, double fm, double s1, double e1, double e2) {
    double p = 0.950724 + 0.051818 * cos(mm) + 0.009531 * cos(2 * dm - mm);
    p = p + 0.007843 * cos(2 * dm) + 0.002824 * cos(2 * mm);
    p = p + 0.000857 * cos(2 * dm + mm) + e1 * (0.000533 * cos(2 * dm - s1));
    p = p + e1 * (0.000401 * cos(2 * dm - s1 - mm)) + e1 * (0.00032 * cos(mm - s1));
    p = p - 0.000271 * cos(dm) - e1 * (0.000264 * cos(s1 + mm));
    p = p - 0.000198 * cos(2 * fm - mm) + 0.000173 * cos(3 * mm);
    p = p + 0.000167 * cos(4 * dm - mm) - e1 * (0.000111 * cos(s1));
    p = p + 0.000103 * cos(4 * dm - 2 * mm) - 0.000084 * cos(2 * mm - 2 * dm);
    p = p - e1 * (0.000083 * cos(2 * dm + s1)) + 0.000079 * cos(2 * dm + 2 * mm);
    p = p + 0.000072 * cos(4 * dm) + e1 * (0.000064 * cos(2 * dm - s1 + mm));
    p = p - e1 * (0.000063 * cos(2 * dm + s1 - mm)) + e1 * (0.000041 * cos(s1 + dm));
    p = p + e1 * (0.000035 * cos(2 * mm - s1)) - 0.000033 * cos(3 * mm - 2 * dm);
    p = p - 0.00003 * cos(mm + dm) - 0.000029 * cos(2 * fm - 2 * dm);
    p = p - e1 * (0.000029 * cos(2 * mm + s1)) + e2 * (0.000026 * cos(2 * dm - 2 * s1));
    p = p - 0.000023 * cos(2 * fm - 2 * dm + mm) + e1 * (0.000019 * cos(4 * dm - s1 - mm));
    return p;
  }
}
