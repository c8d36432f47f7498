package io.biblcal.astro;

import io.biblcal.location.Location;
import java.util.Objects;

/**
 * A {@link Location} reduced to the quantities the series need.
 *
 * @param location the observing site
 * @param westLongitudeFraction west longitude as a fraction of a day
 * @param latitudeRadians latitude, radians
 * @param zoneCorrectionHours hours added to local apparent time to reach zone time
 */
public record Observer(
    Location location,
    double westLongitudeFraction,
    double latitudeRadians,
    double zoneCorrectionHours) {

  /**
   * Derives the observer frame of a location.
   *
   * @param location the observing site
   * @return the observer
   */
  public static Observer of(Location location) {
    Objects.requireNonNull(location, "location");
    double westLongitude = -location.longitude();
    double hourLocation = 12 + location.utcOffsetHours();
    double zone = (westLongitude - (12 - hourLocation) * 15) * 0.066667;
    return new Observer(location, westLongitude / 360d, location.latitude() * Angles.DR, zone);
  }

  /**
   * Returns the sine of the latitude.
   *
   * @return sin(latitude)
   */
  public double sinLatitude() {
    return Math.sin(latitudeRadians);
  }

  /**
   * Returns the cosine of the latitude.
   *
   * @return cos(latitude)
   */
  public double cosLatitude() {
    return Math.cos(latitudeRadians);
  }
}
