package io.biblcal.location;

import io.biblcal.CalendarException;
import java.util.Objects;

/**
 * An observing site. Latitude is positive north, longitude positive east, and the UTC offset is
 * the signed standard-time offset in hours.
 *
 * <p>Instances are only created through {@link #of}, so every location in circulation has
 * finite coordinates within range.
 */
public final class Location {
  /** Jerusalem, the default observing site. */
  public static final Location JERUSALEM = new Location("Jerusalem", 31.78, 35.244, 2);

  /** The traditional site of Eden, used for Creation dates. */
  public static final Location EDEN = new Location("Eden", 38.5, 42, 3);

  /** Mount Ararat, used for the Flood table. */
  public static final Location MOUNT_ARARAT = new Location("Mount Ararat", 39.69, 44.32, 3);

  private final String name;
  private final double latitude;
  private final double longitude;
  private final double utcOffsetHours;

  private Location(String name, double latitude, double longitude, double utcOffsetHours) {
    this.name = name;
    this.latitude = latitude;
    this.longitude = longitude;
    this.utcOffsetHours = utcOffsetHours;
  }

  /**
   * Creates a validated, unnamed location.
   *
   * @param latitude degrees north
   * @param longitude degrees east
   * @param utcOffsetHours hours from UTC
   * @return the location
   * @throws CalendarException if a coordinate is out of range or not finite
   */
  public static Location of(double latitude, double longitude, double utcOffsetHours)
      throws CalendarException {
    return of("", latitude, longitude, utcOffsetHours);
  }

  /**
   * Creates a validated location.
   *
   * @param name the display name
   * @param latitude degrees north
   * @param longitude degrees east
   * @param utcOffsetHours hours from UTC
   * @return the location
   * @throws CalendarException if a coordinate is out of range or not finite
   */
  public static Location of(String name, double latitude, double longitude, double utcOffsetHours)
      throws CalendarException {
    if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
      throw CalendarException.location("latitude must be within [-90, 90]", latitude);
    }
    if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
      throw CalendarException.location("longitude must be within [-180, 180]", longitude);
    }
    if (!Double.isFinite(utcOffsetHours) || utcOffsetHours < -12 || utcOffsetHours > 14) {
      throw CalendarException.location("UTC offset must be within [-12, 14]", utcOffsetHours);
    }
    return new Location(name == null ? "" : name.trim(), latitude, longitude, utcOffsetHours);
  }

  /**
   * Returns the display name.
   *
   * @return the name, possibly empty
   */
  public String name() {
    return name;
  }

  /**
   * Returns the latitude.
   *
   * @return degrees, -90 to 90, positive north
   */
  public double latitude() {
    return latitude;
  }

  /**
   * Returns the longitude.
   *
   * @return degrees, -180 to 180, positive east
   */
  public double longitude() {
    return longitude;
  }

  /**
   * Returns the standard-time offset.
   *
   * @return hours from UTC, -12 to 14
   */
  public double utcOffsetHours() {
    return utcOffsetHours;
  }

  /**
   * Formats the coordinates with hemisphere letters, e.g. {@code 31.78N 35.244E UTC+2}.
   *
   * @return the formatted coordinates
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    if (!name.isEmpty()) {
      sb.append(name).append(' ');
    }
    sb.append(trim(Math.abs(latitude))).append(latitude < 0 ? 'S' : 'N').append(' ');
    sb.append(trim(Math.abs(longitude))).append(longitude < 0 ? 'W' : 'E').append(' ');
    sb.append("UTC").append(utcOffsetHours < 0 ? '-' : '+').append(trim(Math.abs(utcOffsetHours)));
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Location)) {
      return false;
    }
    Location other = (Location) o;
    return name.equals(other.name)
        && Double.compare(latitude, other.latitude) == 0
        && Double.compare(longitude, other.longitude) == 0
        && Double.compare(utcOffsetHours, other.utcOffsetHours) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, latitude, longitude, utcOffsetHours);
  }

  @Override
  public String toString() {
    return "Location[" + describe() + "]";
  }

  private static String trim(double v) {
    if (v == Math.rint(v)) {
      return Long.toString((long) v);
    }
    return Double.toString(v);
  }
}
