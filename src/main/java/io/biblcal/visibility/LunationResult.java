package io.biblcal.visibility;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Outcome of the crescent search for one lunation.
 *
 * @param lunation the lunation number
 * @param newMoonJulianDay the estimated conjunction
 * @param evenings the evenings observed, in order
 * @param monthStartJulianDay first day of the month, or NaN when undetermined
 * @param tier tier of the deciding evening, or null when undetermined
 * @param undeterminedReason why no month start was fixed, or null
 */
public record LunationResult(
    int lunation,
    double newMoonJulianDay,
    List<EveningObservation> evenings,
    double monthStartJulianDay,
    VisibilityTier tier,
    String undeterminedReason) {

  public LunationResult {
    evenings = List.copyOf(evenings);
  }

  static LunationResult determined(
      int lunation, double newMoon, List<EveningObservation> evenings, double start, VisibilityTier tier) {
    return new LunationResult(lunation, newMoon, evenings, start, tier, null);
  }

  static LunationResult undetermined(
      int lunation, double newMoon, List<EveningObservation> evenings, String reason) {
    return new LunationResult(lunation, newMoon, evenings, Double.NaN, null, reason);
  }

  /**
   * Returns true if a month start was fixed.
   *
   * @return true when determined
   */
  public boolean isDetermined() {
    return undeterminedReason == null;
  }

  /**
   * Returns the first day of the month, if determined.
   *
   * @return the Julian Day, or empty
   */
  public OptionalDouble monthStart() {
    return isDetermined() ? OptionalDouble.of(monthStartJulianDay) : OptionalDouble.empty();
  }
}
