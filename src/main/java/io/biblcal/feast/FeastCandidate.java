package io.biblcal.feast;

/**
 * A year whose Abib 1 or Passover falls on the weekday a search requires.
 *
 * @param kind the search
 * @param year the historical year
 * @param abibOneJulianDay Abib 1
 * @param passoverJulianDay Abib 14, the Passover sacrifice
 * @param unleavenedBreadStart first day of Unleavened Bread (Passover + 1)
 * @param unleavenedBreadEnd last day of Unleavened Bread (Passover + 7)
 * @param waveOfferingJulianDay the first Sunday after the Passover
 * @param pentecostJulianDay Wave Offering + 49
 */
public record FeastCandidate(
    FeastKind kind,
    int year,
    double abibOneJulianDay,
    double passoverJulianDay,
    double unleavenedBreadStart,
    double unleavenedBreadEnd,
    double waveOfferingJulianDay,
    double pentecostJulianDay) {

  /**
   * Returns the day the weekday test applied to.
   *
   * @return Abib 1 or the Passover
   */
  public double anchorJulianDay() {
    return kind.anchor() == FeastKind.Anchor.ABIB_ONE ? abibOneJulianDay : passoverJulianDay;
  }
}
