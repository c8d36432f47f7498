package io.biblcal.hebrew;

import java.util.Optional;

/** The six Hebrew year types, keyed by year length. */
public enum HebrewYearType {
  COMMON_DEFICIENT(353, "Common Deficient (353 days)"),
  COMMON_REGULAR(354, "Common Regular (354 days)"),
  COMMON_COMPLETE(355, "Common Complete (355 days)"),
  EMBOLISMIC_DEFICIENT(383, "Embolismic Deficient (383 days)"),
  EMBOLISMIC_REGULAR(384, "Embolismic Regular (384 days)"),
  EMBOLISMIC_COMPLETE(385, "Embolismic Complete (385 days)");

  private final int length;
  private final String label;

  HebrewYearType(int length, String label) {
    this.length = length;
    this.label = label;
  }

  /**
   * Returns the year length in days.
   *
   * @return the length
   */
  public int length() {
    return length;
  }

  /**
   * Returns true for the 13-month types.
   *
   * @return true if embolismic
   */
  public boolean isEmbolismic() {
    return length > 380;
  }

  /**
   * Returns the year type for a year length.
   *
   * @param length the year length in days
   * @return the year type, or empty if the length is not canonical
   */
  public static Optional<HebrewYearType> fromLength(int length) {
    for (HebrewYearType t : values()) {
      if (t.length == length) {
        return Optional.of(t);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return label;
  }
}
