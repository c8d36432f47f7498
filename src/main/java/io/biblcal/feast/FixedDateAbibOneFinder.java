package io.biblcal.feast;

import io.biblcal.location.Location;
import io.biblcal.time.JulianDay;

/** Takes 1 March as Abib 1 and 30-day months, independent of the moon and the site. */
public final class FixedDateAbibOneFinder implements AbibOneFinder {
  @Override
  public double abibOne(int year, Location location) {
    return JulianDay.toJulianDay(3, 1, year);
  }
}
