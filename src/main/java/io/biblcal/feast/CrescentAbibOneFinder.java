package io.biblcal.feast;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.biblcal.CalendarException;
import io.biblcal.location.Location;
import io.biblcal.visibility.LunationResult;
import io.biblcal.visibility.VisibilityEngine;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Takes the month starts from the crescent search. Abib 1 is the first month start whose 14th day
 * (the Passover) falls on or after the day of the March equinox; later months follow lunation by
 * lunation.
 */
public final class CrescentAbibOneFinder implements AbibOneFinder {
  private static final Logger log = LoggerFactory.getLogger(CrescentAbibOneFinder.class);

  private record Key(int year, Location location) {}

  private final LoadingCache<Key, List<LunationResult>> lunations;

  /**
   * Creates a finder backed by an engine.
   *
   * @param engine the crescent search
   */
  public CrescentAbibOneFinder(VisibilityEngine engine) {
    Objects.requireNonNull(engine, "engine");
    this.lunations =
        Caffeine.newBuilder()
            .maximumSize(512)
            .build(k -> engine.lunationsForYear(k.year(), k.location()));
  }

  @Override
  public double abibOne(int year, Location location) throws CalendarException {
    return monthStart(year, location, 1);
  }

  @Override
  public double monthStart(int year, Location location, int month) throws CalendarException {
    List<LunationResult> results = lunations.get(new Key(year, location));
    int abib = abibIndex(results, SpringEquinox.day(year));
    if (abib < 0) {
      throw CalendarException.computation(
          "no month start reaches the equinox in " + year + " at " + location.describe());
    }
    int index = abib + month - 1;
    if (index >= results.size()) {
      throw CalendarException.computation(
          "month " + month + " of " + year + " lies beyond the lunations searched");
    }
    LunationResult lunation = results.get(index);
    if (!lunation.isDetermined()) {
      log.warn("month {} of {} undetermined: {}", month, year, lunation.undeterminedReason());
      throw CalendarException.computation(
          "month " + month + " of " + year + " undetermined: " + lunation.undeterminedReason());
    }
    return lunation.monthStartJulianDay();
  }

  private static int abibIndex(List<LunationResult> results, double equinoxDay) {
    for (int i = 0; i < results.size(); i++) {
      LunationResult r = results.get(i);
      // an undetermined month is placed a day after its conjunction
      double start = r.isDetermined() ? r.monthStartJulianDay() : Math.floor(r.newMoonJulianDay()) + 1;
      if (start + 13 >= equinoxDay) {
        return i;
      }
    }
    return -1;
  }
}
