package io.biblcal.astro;

import static io.biblcal.astro.Angles.RADIANS_TO_HOURS;

import io.biblcal.time.JulianDay;
import java.util.ArrayList;
import java.util.List;

/** Solves local sunset from the solar series. */
public final class SunsetCalculator {
  /** sin(-50'), the altitude of the sun's upper limb at sunset with refraction. */
  private static final double SUNSET_ALTITUDE_SINE = -0.01454;

  /** Half a minute, in hours, so that truncation to minutes rounds. */
  private static final double HALF_MINUTE = 0.00833333333;

  private SunsetCalculator() {}

  /**
   * Computes sunset on day {@code jd}.
   *
   * @param jd the integral Julian Day
   * @param observer the observer
   * @param deltaT Delta T, days
   * @return the sunset
   */
  public static Sunset sunset(double jd, Observer observer, double deltaT) {
    SolarPosition sun = SolarPosition.at(AstroTime.eveningCenturies(jd, observer, deltaT));
    double sinDec = Math.sin(sun.declination());
    double cosDec = Math.cos(sun.declination());
    double cosH =
        (SUNSET_ALTITUDE_SINE - observer.sinLatitude() * sinDec) / (observer.cosLatitude() * cosDec);
    double hourAngle = Angles.acos(cosH) * RADIANS_TO_HOURS - sun.equationOfTime();
    double local = hourAngle + observer.zoneCorrectionHours() + HALF_MINUTE;
    double azimuth = Angles.acos(-(sinDec / observer.cosLatitude())) / Angles.DR;
    return new Sunset(jd, hourAngle, local, azimuth, sun);
  }

  /**
   * Computes sunsets for consecutive days starting on 1 January.
   *
   * @param year the historical year
   * @param observer the observer
   * @param days the number of days
   * @return one sunset per day
   */
  public static List<Sunset> table(int year, Observer observer, int days) {
    double start = JulianDay.toJulianDay(1, 1, year);
    double deltaT = AstroTime.deltaTDays((start - AstroTime.EPOCH_1900) / 36525d);
    List<Sunset> out = new ArrayList<>(days);
    for (int i = 0; i < days; i++) {
      out.add(sunset(start + i, observer, deltaT));
    }
    return out;
  }
}
