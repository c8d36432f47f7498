package io.biblcal.visibility;

/**
 * Confidence that the young crescent is seen, from the visibility index.
 *
 * <table>
 *   <caption>Index thresholds</caption>
 *   <tr><th>index</th><th>tier</th><th>month starts</th></tr>
 *   <tr><td>&le; 88</td><td>{@link #NOT_VISIBLE}</td><td>not yet; try the next evening</td></tr>
 *   <tr><td>&le; 100</td><td>{@link #PROBABLY_NOT_VISIBLE}</td><td>evening day + 2</td></tr>
 *   <tr><td>&le; 112</td><td>{@link #PROBABLY_VISIBLE}</td><td>evening day + 1</td></tr>
 *   <tr><td>&gt; 112</td><td>{@link #VISIBLE}</td><td>evening day + 1</td></tr>
 * </table>
 */
public enum VisibilityTier {
  NOT_VISIBLE("Not Visible", 0),
  PROBABLY_NOT_VISIBLE("Prob Not Visible", 2),
  PROBABLY_VISIBLE("Prob Visible", 1),
  VISIBLE("Visible", 1);

  /** Highest index that is still not visible. */
  public static final double NOT_VISIBLE_MAX = 88;

  /** Highest index that is probably not visible. */
  public static final double PROBABLY_NOT_VISIBLE_MAX = 100;

  /** Highest index that is probably visible. */
  public static final double PROBABLY_VISIBLE_MAX = 112;

  private final String label;
  private final int monthStartOffset;

  VisibilityTier(String label, int monthStartOffset) {
    this.label = label;
    this.monthStartOffset = monthStartOffset;
  }

  /**
   * Classifies a visibility index.
   *
   * @param index the visibility index
   * @return the tier
   */
  public static VisibilityTier classify(double index) {
    if (index <= NOT_VISIBLE_MAX) {
      return NOT_VISIBLE;
    }
    if (index <= PROBABLY_NOT_VISIBLE_MAX) {
      return PROBABLY_NOT_VISIBLE;
    }
    if (index <= PROBABLY_VISIBLE_MAX) {
      return PROBABLY_VISIBLE;
    }
    return VISIBLE;
  }

  /**
   * Returns true if this tier fixes the start of the month.
   *
   * @return false only for {@link #NOT_VISIBLE}
   */
  public boolean startsMonth() {
    return this != NOT_VISIBLE;
  }

  /**
   * Returns the days from the observing evening's Julian Day to the first day of the month.
   *
   * @return the offset, 0 for {@link #NOT_VISIBLE}
   */
  public int monthStartOffset() {
    return monthStartOffset;
  }

  /**
   * Returns the report label.
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
