package io.biblcal.time;

/** Represents a day of the week. */
public enum Weekday {
  MONDAY(1, "monday"),
  TUESDAY(2, "tuesday"),
  WEDNESDAY(3, "wednesday"),
  THURSDAY(4, "thursday"),
  FRIDAY(5, "friday"),
  SATURDAY(6, "saturday"),
  SUNDAY(7, "sunday");

  private final int isoNumber;
  private final String displayName;

  Weekday(int isoNumber, String displayName) {
    this.isoNumber = isoNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the value {@link JulianDay#weekdayOf} yields for this day (Monday=0, Sunday=6).
   *
   * @return the Julian Day weekday number
   */
  public int julianDayNumber() {
    return isoNumber - 1;
  }

  /**
   * Returns true on the seventh-day Sabbath.
   *
   * @return true for Saturday
   */
  boolean isSabbath() {
    return this == SATURDAY;
  }

  /**
   * Returns the name with an initial capital, as printed in reports.
   *
   * @return e.g. "Wednesday"
   */
  public String capitalized() {
    return Character.toUpperCase(displayName.charAt(0)) + displayName.substring(1);
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Returns the weekday of a Julian Day.
   *
   * @param jd the Julian Day
   * @return the weekday
   */
  public static Weekday fromJulianDay(double jd) {
    return values()[JulianDay.weekdayOf(jd)];
  }
}
