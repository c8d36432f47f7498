package io.biblcal.report;

/** Year captions used by the reports. */
public final class YearLabels {
  /** Years from Creation to 1 BCE, counting 1 BCE. */
  private static final int CREATION_OFFSET_BCE = 4005;

  /** Years from Creation to 1 CE. */
  private static final int CREATION_OFFSET_CE = 4004;

  private YearLabels() {}

  /**
   * Formats a historical year as "30 CE" or "4 BCE".
   *
   * @param year the historical year
   * @return the label
   */
  public static String label(int year) {
    return labelWithoutSuffix(year) + (year < 0 ? " BCE" : " CE");
  }

  /**
   * Formats the magnitude of a year with no era suffix.
   *
   * @param year the historical year
   * @return the digits
   */
  public static String labelWithoutSuffix(int year) {
    return Integer.toString(Math.abs(year));
  }

  /**
   * Converts a Gregorian year to a year counted from Creation in 4004 BCE.
   *
   * @param year the historical year
   * @return the year after Creation
   */
  public static int yearAfterCreation(int year) {
    return year < 0 ? year + CREATION_OFFSET_BCE : year + CREATION_OFFSET_CE;
  }
}
