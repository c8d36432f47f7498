package io.biblcal.visibility;

import io.biblcal.astro.LunarPosition;
import io.biblcal.astro.Sunset;
import io.biblcal.time.TimeOfDay;
import java.util.ArrayList;
import java.util.List;

/**
 * Working state of the crescent search for one lunation. Each step of {@link VisibilityEngine}
 * fills in its own fields; the state of a finished evening is copied out with {@link #snapshot()}
 * before the day cursor moves on.
 */
public final class LunarMonthObservation {
  private final int lunation;
  private final List<EveningObservation> evenings = new ArrayList<>();

  // EstimateEpoch
  private double estimatedNewMoonJulianDay;
  private double deltaT;
  private double dayCursor;

  // LocateSunset
  private Sunset sunset;

  // SearchMoonset
  private LunarPosition moonAtSunset;
  private double moonsetSearchCenturies;
  private double moonsetHours = Double.NaN;
  private int iterations;

  // Classify
  private double moonsetZoneHours = Double.NaN;
  private double illumination;
  private double moonAzimuth;
  private double moonAltitudeAtSunset;
  private double sunAltitudeAtMoonset;
  private int timeLagMinutes;
  private double visibilityIndex;
  private VisibilityTier tier;

  LunarMonthObservation(int lunation) {
    this.lunation = lunation;
  }

  /**
   * Freezes the current evening.
   *
   * @return the evening observation
   */
  EveningObservation snapshot() {
    return new EveningObservation(
        dayCursor,
        sunset.time(),
        TimeOfDay.fromHoursAfterNoon(moonsetZoneHours),
        timeLagMinutes,
        illumination,
        sunset.sunAzimuth(),
        moonAzimuth,
        moonAltitudeAtSunset,
        sunAltitudeAtMoonset,
        visibilityIndex,
        tier,
        iterations);
  }

  void recordEvening() {
    evenings.add(snapshot());
  }

  void epoch(double newMoon, double deltaT, double firstEvening) {
    this.estimatedNewMoonJulianDay = newMoon;
    this.deltaT = deltaT;
    this.dayCursor = firstEvening;
  }

  void nextEvening() {
    dayCursor++;
    sunset = null;
    moonAtSunset = null;
    moonsetHours = Double.NaN;
    moonsetZoneHours = Double.NaN;
    iterations = 0;
    tier = null;
  }

  void sunset(Sunset sunset) {
    this.sunset = sunset;
  }

  void moonset(LunarPosition atSunset, double centuries, double hours, int iterations) {
    this.moonAtSunset = atSunset;
    this.moonsetSearchCenturies = centuries;
    this.moonsetHours = hours;
    this.iterations = iterations;
  }

  void classification(
      double moonsetZone,
      int timeLag,
      double illumination,
      double moonAzimuth,
      double moonAltitude,
      double sunAltitude,
      double index) {
    this.moonsetZoneHours = moonsetZone;
    this.timeLagMinutes = timeLag;
    this.illumination = illumination;
    this.moonAzimuth = moonAzimuth;
    this.moonAltitudeAtSunset = moonAltitude;
    this.sunAltitudeAtMoonset = sunAltitude;
    this.visibilityIndex = index;
    this.tier = VisibilityTier.classify(index);
  }

  public int lunation() {
    return lunation;
  }

  public double estimatedNewMoonJulianDay() {
    return estimatedNewMoonJulianDay;
  }

  public double deltaT() {
    return deltaT;
  }

  public double dayCursor() {
    return dayCursor;
  }

  public Sunset sunset() {
    return sunset;
  }

  public LunarPosition moonAtSunset() {
    return moonAtSunset;
  }

  public double moonsetSearchCenturies() {
    return moonsetSearchCenturies;
  }

  /**
   * Returns the converged moonset estimate in local apparent hours after noon, NaN until the
   * search converges.
   *
   * @return the moonset hours
   */
  public double moonsetHours() {
    return moonsetHours;
  }

  public int iterations() {
    return iterations;
  }

  public double visibilityIndex() {
    return visibilityIndex;
  }

  public VisibilityTier tier() {
    return tier;
  }

  public List<EveningObservation> evenings() {
    return List.copyOf(evenings);
  }
}
