package io.biblcal.feast;

/** Classification of the days between the 17th of the 2nd month and the 17th of the 7th. */
public enum FloodBucket {
  EXACT(150, "150 days"),
  PLUS_ONE(149, "149(+1)"),
  PLUS_TWO(148, "148(+2)"),
  NONE(-1, "none");

  private final int days;
  private final String label;

  FloodBucket(int days, String label) {
    this.days = days;
    this.label = label;
  }

  /**
   * Returns the bucket for a day count.
   *
   * @param days days between the two dates
   * @return the bucket
   */
  public static FloodBucket of(int days) {
    for (FloodBucket b : values()) {
      if (b.days == days) {
        return b;
      }
    }
    return NONE;
  }

  /**
   * Returns the column label of the flood table.
   *
   * @return the label
   */
  public String label() {
    return label;
  }
}
