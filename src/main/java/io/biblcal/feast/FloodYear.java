package io.biblcal.feast;

import java.util.List;

/**
 * Days from the 17th of the 2nd month (the flood begins) to the 17th of the 7th (the ark rests).
 *
 * @param year the historical year
 * @param secondMonth17 Julian Day of the 17th of the 2nd month
 * @param seventhMonth17 Julian Day of the 17th of the 7th month
 * @param daysBetween the difference
 * @param bucket the classification of the difference
 */
public record FloodYear(
    int year, double secondMonth17, double seventhMonth17, int daysBetween, FloodBucket bucket) {

  static FloodYear of(int year, double secondMonthStart, double seventhMonthStart) {
    double second = secondMonthStart + FeastDerivation.SEVENTEENTH;
    double seventh = seventhMonthStart + FeastDerivation.SEVENTEENTH;
    int days = (int) (seventh - second);
    return new FloodYear(year, second, seventh, days, FloodBucket.of(days));
  }

  /**
   * Returns the day counts reachable if either month start moved by a day.
   *
   * @return daysBetween - 1 through daysBetween + 2
   */
  public List<Integer> alternatives() {
    return List.of(daysBetween - 1, daysBetween, daysBetween + 1, daysBetween + 2);
  }
}
