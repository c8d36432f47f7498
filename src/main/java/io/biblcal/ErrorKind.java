package io.biblcal;

/** The type of error raised by a calendar calculation. */
public enum ErrorKind {
  /** Input error - year, month or day out of range or not finite. */
  INPUT("input"),
  /** Location error - coordinates or UTC offset invalid, or unknown location name. */
  LOCATION("location"),
  /** Configuration error - configuration resource missing or malformed. */
  CONFIG("config"),
  /** Computation error - no usable result could be derived. */
  COMPUTATION("computation");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
