package io.biblcal.astro;

import io.biblcal.time.TimeOfDay;

/**
 * Local sunset on one day.
 *
 * @param julianDay the integral Julian Day of the date
 * @param hourAngleHours the sunset hour angle corrected by the equation of time, hours after noon
 * @param localHours sunset in zone time, hours after noon
 * @param sunAzimuth azimuth of the setting sun, degrees
 * @param sun the solar position used
 */
public record Sunset(
    double julianDay, double hourAngleHours, double localHours, double sunAzimuth, SolarPosition sun) {

  /**
   * Returns the sunset as a clock time.
   *
   * @return the zone time of sunset
   */
  public TimeOfDay time() {
    return TimeOfDay.fromHoursAfterNoon(localHours);
  }

  /**
   * Returns the sunset in whole minutes after noon, the unit used for time lags.
   *
   * @return minutes after noon
   */
  public int minutesAfterNoon() {
    int h = (int) Math.floor(localHours);
    int m = (int) Math.floor((localHours - h) * 60);
    return h * 60 + m;
  }
}
