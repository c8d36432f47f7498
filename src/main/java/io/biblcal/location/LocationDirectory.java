package io.biblcal.location;

import io.biblcal.CalendarException;
import java.util.List;
import java.util.Optional;

/** Named observing sites, with one of them selected as the current location. */
public interface LocationDirectory {
  /**
   * Finds a location by name (case insensitive).
   *
   * @param name the location name
   * @return the location if present
   */
  Optional<Location> find(String name);

  /**
   * Returns all locations in insertion order.
   *
   * @return the locations
   */
  List<Location> list();

  /**
   * Adds or replaces a location.
   *
   * @param location the location, which must be named
   * @throws CalendarException if the location has no name
   */
  void put(Location location) throws CalendarException;

  /**
   * Removes a location.
   *
   * @param name the location name
   * @return true if a location was removed
   */
  boolean remove(String name);

  /**
   * Returns the current location, or Jerusalem if none is selected.
   *
   * @return the current location
   */
  Location current();

  /**
   * Selects the current location.
   *
   * @param name the location name
   * @throws CalendarException if no location has that name
   */
  void select(String name) throws CalendarException;
}
