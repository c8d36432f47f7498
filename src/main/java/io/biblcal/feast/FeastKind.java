package io.biblcal.feast;

import io.biblcal.location.Location;
import io.biblcal.time.Weekday;

/** The feast-date searches and the weekday each one requires. */
public enum FeastKind {
  /** Passover sacrifice on a Wednesday. */
  CRUCIFIXION(Anchor.PASSOVER, Weekday.WEDNESDAY, Location.JERUSALEM),
  /** Passover sacrifice on the Sabbath. */
  JORDAN_CROSSING(Anchor.PASSOVER, Weekday.SATURDAY, Location.JERUSALEM),
  /** Abib 1 on a Sunday. */
  CREATION(Anchor.ABIB_ONE, Weekday.SUNDAY, Location.EDEN);

  /** The day the weekday test applies to. */
  public enum Anchor {
    ABIB_ONE,
    PASSOVER
  }

  private final Anchor anchor;
  private final Weekday weekday;
  private final Location location;

  FeastKind(Anchor anchor, Weekday weekday, Location location) {
    this.anchor = anchor;
    this.weekday = weekday;
    this.location = location;
  }

  /**
   * Returns the day the weekday test applies to.
   *
   * @return the anchor
   */
  public Anchor anchor() {
    return anchor;
  }

  /**
   * Returns the required weekday.
   *
   * @return the weekday
   */
  public Weekday weekday() {
    return weekday;
  }

  /**
   * Returns the site the month start is computed for.
   *
   * @return the location
   */
  public Location location() {
    return location;
  }
}
