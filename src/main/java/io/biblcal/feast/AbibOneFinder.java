package io.biblcal.feast;

import io.biblcal.CalendarException;
import io.biblcal.location.Location;

/** Locates the first day of the Biblical year and the months that follow it. */
public interface AbibOneFinder {
  /**
   * Returns the Julian Day of Abib 1.
   *
   * @param year the historical year
   * @param location the observing site
   * @return the integral Julian Day
   * @throws CalendarException if no month start can be determined
   */
  double abibOne(int year, Location location) throws CalendarException;

  /**
   * Returns the Julian Day of the first day of a month of the Biblical year. The default counts
   * 30-day months from Abib 1.
   *
   * @param year the historical year
   * @param location the observing site
   * @param month the month number, Abib = 1
   * @return the integral Julian Day
   * @throws CalendarException if no month start can be determined
   */
  default double monthStart(int year, Location location, int month) throws CalendarException {
    return abibOne(year, location) + 30L * (month - 1);
  }
}
