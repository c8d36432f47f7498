package io.biblcal.visibility;

import static io.biblcal.astro.Angles.DR;
import static io.biblcal.astro.Angles.PI;
import static io.biblcal.astro.Angles.RADIANS_TO_HOURS;

import io.biblcal.astro.Angles;
import io.biblcal.astro.AstroTime;
import io.biblcal.astro.LunarPosition;
import io.biblcal.astro.Observer;
import io.biblcal.astro.SolarPosition;
import io.biblcal.astro.Sunset;
import io.biblcal.astro.SunsetCalculator;
import io.biblcal.config.CalendarConfig;
import io.biblcal.location.Location;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the first evening the young crescent can be seen after each new moon of a year.
 *
 * <h2>Per lunation</h2>
 *
 * <ol>
 *   <li><b>EstimateEpoch:</b> mean new moon with periodic terms, see {@link NewMoonEstimate}.
 *   <li><b>LocateSunset:</b> sunset on the evening under the day cursor.
 *   <li><b>SearchMoonset:</b> the moon's setting hour angle is evaluated at a trial time, which
 *       then moves to the estimate just found.
 *   <li><b>Classify:</b> visibility index from time lag, illumination, moon altitude at sunset and
 *       sun altitude at moonset, then {@link VisibilityTier#classify}.
 * </ol>
 *
 * <p>A {@link VisibilityTier#NOT_VISIBLE} evening moves the day cursor to the next day; any other
 * tier fixes the month start.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <p>moonsetMaxIterations (default 10): the moonset search stops when two successive estimates
 * agree within moonsetToleranceMinutes (default 1), measured around the clock. When the moon does
 * not set at a trial time the trial moves one hour on. Reaching the cap without agreement leaves
 * the lunation undetermined.
 *
 * <p>maxEveningsPerLunation (default 6): evenings tried before a lunation is undetermined.
 *
 * <p>In practice the moonset search agrees within two or three iterations.
 */
public final class VisibilityEngine {
  private static final Logger log = LoggerFactory.getLogger(VisibilityEngine.class);

  /** Sidereal hours per solar hour. */
  private static final double SIDEREAL_RATE = 1.002737908;

  /** Refraction allowance added to the sun's altitude at moonset, degrees. */
  private static final double SUN_ALTITUDE_ALLOWANCE = 1.75;

  /** Moonset refraction and semi-diameter allowance, hours. */
  private static final double MOONSET_ALLOWANCE = 0.0241666666;

  private final CalendarConfig config;

  /**
   * Creates an engine.
   *
   * @param config the search limits
   */
  public VisibilityEngine(CalendarConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Searches the lunations of a year.
   *
   * @param year the historical year (year 0 is treated as 1)
   * @param location the observing site
   * @return one result per lunation, in order
   */
  public List<LunationResult> lunationsForYear(int year, Location location) {
    Observer observer = Observer.of(location);
    int first = NewMoonEstimate.firstLunationOf(year == 0 ? 1 : year);
    List<LunationResult> results = new ArrayList<>(config.lunationsPerYear());
    for (int i = 0; i < config.lunationsPerYear(); i++) {
      results.add(searchLunation(first + i, observer));
    }
    log.info(
        "searched {} lunations from {} at {}",
        results.size(),
        first,
        location.describe());
    return results;
  }

  /**
   * Searches one lunation.
   *
   * @param lunation the lunation number
   * @param observer the observer
   * @return the result
   */
  public LunationResult searchLunation(int lunation, Observer observer) {
    LunarMonthObservation obs = new LunarMonthObservation(lunation);
    estimateEpoch(obs);
    for (int evening = 0; evening < config.maxEveningsPerLunation(); evening++) {
      locateSunset(obs, observer);
      if (!searchMoonset(obs, observer)) {
        String reason = "moonset search did not converge on JD " + (long) obs.dayCursor();
        log.warn("lunation {}: {}", lunation, reason);
        return LunationResult.undetermined(
            lunation, obs.estimatedNewMoonJulianDay(), obs.evenings(), reason);
      }
      classify(obs, observer);
      obs.recordEvening();
      log.debug(
          "lunation {} JD {} index {} {}",
          lunation,
          (long) obs.dayCursor(),
          obs.visibilityIndex(),
          obs.tier());
      if (obs.tier().startsMonth()) {
        double start = obs.dayCursor() + obs.tier().monthStartOffset();
        return LunationResult.determined(
            lunation, obs.estimatedNewMoonJulianDay(), obs.evenings(), start, obs.tier());
      }
      obs.nextEvening();
    }
    String reason = "crescent not visible within " + config.maxEveningsPerLunation() + " evenings";
    log.warn("lunation {}: {}", lunation, reason);
    return LunationResult.undetermined(
        lunation, obs.estimatedNewMoonJulianDay(), obs.evenings(), reason);
  }

  /**
   * Observes a single evening.
   *
   * @param jd the integral Julian Day of the evening
   * @param observer the observer
   * @param deltaT Delta T, days
   * @return the observation, or empty if the moonset search did not converge
   */
  Optional<EveningObservation> observeEvening(double jd, Observer observer, double deltaT) {
    LunarMonthObservation obs = new LunarMonthObservation(-1);
    obs.epoch(Double.NaN, deltaT, jd);
    locateSunset(obs, observer);
    if (!searchMoonset(obs, observer)) {
      return Optional.empty();
    }
    classify(obs, observer);
    return Optional.of(obs.snapshot());
  }

  /**
   * Computes the visibility index.
   *
   * @param timeLagMinutes moonset minus sunset, minutes
   * @param illumination illuminated fraction, percent
   * @param moonAltitude moon altitude at sunset, degrees
   * @param sunAltitudeAtMoonset sun altitude at moonset, degrees
   * @return the index
   */
  public static double visibilityIndex(
      double timeLagMinutes, double illumination, double moonAltitude, double sunAltitudeAtMoonset) {
    return (timeLagMinutes + illumination * 27 + moonAltitude * 5.5 - sunAltitudeAtMoonset * 5) / 1.7;
  }

  void estimateEpoch(LunarMonthObservation obs) {
    NewMoonEstimate estimate = NewMoonEstimate.of(obs.lunation());
    obs.epoch(estimate.julianDay(), estimate.deltaT(), estimate.firstEvening());
  }

  void locateSunset(LunarMonthObservation obs, Observer observer) {
    obs.sunset(SunsetCalculator.sunset(obs.dayCursor(), observer, obs.deltaT()));
  }

  /**
   * Iterates moonset estimates from the sunset hour angle, each estimate seeding the next trial
   * time. The recorded moonset is the converged estimate, the first one within the tolerance of
   * its predecessor, not the second estimate of the series.
   *
   * @param obs the lunation state, with the evening's sunset located
   * @param observer the observer
   * @return false if the iteration cap was reached first
   */
  boolean searchMoonset(LunarMonthObservation obs, Observer observer) {
    double jd = obs.dayCursor();
    double sidereal = AstroTime.siderealHoursAtMidnight(jd);
    double obliquity = obs.sunset().sun().obliquity();
    double tolerance = config.moonsetToleranceHours();

    double trial = obs.sunset().hourAngleHours();
    double previous = Double.NaN;
    LunarPosition atSunset = null;
    for (int i = 1; i <= config.moonsetMaxIterations(); i++) {
      double t = AstroTime.centuriesAt(jd, trial, observer, obs.deltaT());
      LunarPosition moon = LunarPosition.at(t, obliquity);
      if (atSunset == null) {
        atSunset = moon;
      }
      OptionalDouble setting = moonsetHours(moon, observer, obs.deltaT(), sidereal);
      if (setting.isEmpty()) {
        trial += 1;
        previous = Double.NaN;
        continue;
      }
      double estimate = setting.getAsDouble();
      if (!Double.isNaN(previous) && clockDistance(estimate, previous) <= tolerance) {
        obs.moonset(atSunset, t, estimate, i);
        return true;
      }
      previous = estimate;
      trial = estimate;
    }
    return false;
  }

  void classify(LunarMonthObservation obs, Observer observer) {
    Sunset sunset = obs.sunset();
    SolarPosition sun = sunset.sun();
    LunarPosition moon = obs.moonAtSunset();
    double zone = observer.zoneCorrectionHours();
    double sinLat = observer.sinLatitude();
    double cosLat = observer.cosLatitude();
    double sidereal = AstroTime.siderealHoursAtMidnight(obs.dayCursor());

    double moonset = obs.moonsetHours() + zone;
    if (moonset > 24) {
      moonset -= 24;
    }
    int moonsetHour = (int) Math.floor(moonset);
    int moonsetMinutes = moonsetHour * 60 + (int) Math.floor((moonset - moonsetHour) * 60);
    int timeLag = moonsetMinutes - sunset.minutesAfterNoon();

    double illumination = illumination(moon, sun);

    double hourAngle =
        (sidereal + (sunset.localHours() + 12) * SIDEREAL_RATE - zone - moon.rightAscension())
            / RADIANS_TO_HOURS;
    double azNum = Math.sin(hourAngle);
    double azDen = Math.cos(hourAngle) * sinLat - Math.tan(moon.declination()) * cosLat;
    double moonAzimuth = Angles.quadrantAtan(azNum, azDen) / DR;
    double moonAltitude =
        Angles.floor4(
            Angles.asin(
                    sinLat * Math.sin(moon.declination())
                        + cosLat * Math.cos(moon.declination()) * Math.cos(hourAngle))
                / DR);

    SolarPosition sunAtMoonset = SolarPosition.at(obs.moonsetSearchCenturies());
    double sunHourAngle =
        (sidereal + (moonset + 12) * SIDEREAL_RATE - zone - sunAtMoonset.rightAscension())
            / RADIANS_TO_HOURS;
    double sunAltitude =
        Angles.floor4(
            Angles.asin(
                        sinLat * Math.sin(sunAtMoonset.declination())
                            + cosLat
                                * Math.cos(sunAtMoonset.declination())
                                * Math.cos(sunHourAngle))
                    / DR
                + SUN_ALTITUDE_ALLOWANCE);

    double index = visibilityIndex(timeLag, illumination, moonAltitude, sunAltitude);
    obs.classification(moonset, timeLag, illumination, moonAzimuth, moonAltitude, sunAltitude, index);
  }

  /**
   * Returns the moon's setting time in local apparent hours after noon, or empty when the moon
   * stays above or below the horizon all day.
   */
  static OptionalDouble moonsetHours(
      LunarPosition moon, Observer observer, double deltaT, double sidereal) {
    double dec = moon.declination();
    double cosH =
        ((0.7275 * moon.parallax() - 0.5666667) * DR - observer.sinLatitude() * Math.sin(dec))
            / (observer.cosLatitude() * Math.cos(dec));
    if (cosH > 1 || cosH < -1) {
      return OptionalDouble.empty();
    }
    double hours = Angles.acos(cosH) * RADIANS_TO_HOURS;
    double transit = 12 + sidereal - moon.rightAscension() - 0.065712 * deltaT;
    transit = transit > 0 ? 24 - transit : -transit;
    hours += transit + MOONSET_ALLOWANCE;
    if (hours > 24) {
      hours -= 24;
    }
    return OptionalDouble.of(hours);
  }

  /** Illuminated fraction of the disk in percent, rounded to two decimals in single precision. */
  static double illumination(LunarPosition moon, SolarPosition sun) {
    double elongation =
        Angles.acos(Math.cos(moon.longitude() - sun.apparentLongitude()) * Math.cos(moon.latitude()));
    double phaseAngle =
        PI
            - elongation
            - (0.1468
                    * ((1 - 0.0549 * Math.sin(moon.meanAnomaly()))
                        / (1 - 0.0167 * Math.sin(moon.sunMeanAnomaly())))
                    * DR)
                * Math.sin(elongation);
    float fraction = (float) ((1 + Math.cos(phaseAngle)) / 2);
    return (float) (Math.rint(fraction * 10000d) / 100d);
  }

  private static double clockDistance(double a, double b) {
    double d = Math.abs(a - b);
    return Math.min(d, 24 - d);
  }
}
