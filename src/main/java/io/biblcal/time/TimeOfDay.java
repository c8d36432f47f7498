package io.biblcal.time;

/**
 * A local clock time (hour and minute).
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 */
public record TimeOfDay(int hour, int minute) {
  /**
   * Builds a clock time from fractional hours after local noon, the form the sunset and moonset
   * solvers produce.
   *
   * @param hoursAfterNoon the time in hours after noon
   * @return the clock time
   */
  public static TimeOfDay fromHoursAfterNoon(double hoursAfterNoon) {
    int h = (int) Math.floor(hoursAfterNoon);
    int m = (int) Math.floor((hoursAfterNoon - h) * 60);
    return new TimeOfDay(Math.floorMod(h + 12, 24), m);
  }

  /**
   * Returns the time as total minutes from midnight.
   *
   * @return total minutes from midnight
   */
  public int totalMinutes() {
    return hour * 60 + minute;
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
