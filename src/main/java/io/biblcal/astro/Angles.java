package io.biblcal.astro;

/** Angle constants and the guarded inverse trigonometry used by the position series. */
public final class Angles {
  /** Degrees to radians. */
  public static final double DR = 0.01745329251993d;

  /** Pi to the precision of the series coefficients. */
  public static final double PI = 3.14159265358979d;

  /** Radians to hours (12 / pi). */
  public static final double RADIANS_TO_HOURS = 3.8197186342055d;

  private Angles() {}

  /**
   * Floor modulo for doubles; the result has the sign of the divisor.
   *
   * @param dividend the dividend
   * @param divisor the divisor
   * @return the remainder in [0, divisor) for a positive divisor
   */
  public static double modulo(double dividend, double divisor) {
    return dividend - divisor * Math.floor(dividend / divisor);
  }

  /**
   * Reduces degrees to [0, 360).
   *
   * @param degrees the angle
   * @return the reduced angle
   */
  public static double normalizeDegrees(double degrees) {
    return modulo(degrees, 360d);
  }

  /**
   * Arc sine with its argument clamped to [-1, 1].
   *
   * @param x the sine
   * @return the angle in radians
   */
  public static double asin(double x) {
    return Math.asin(clamp(x));
  }

  /**
   * Arc cosine with its argument clamped to [-1, 1].
   *
   * @param x the cosine
   * @return the angle in radians
   */
  public static double acos(double x) {
    return Math.acos(clamp(x));
  }

  /**
   * Arc tangent of {@code numerator / denominator} placed in [0, 2pi) by the signs of both parts.
   *
   * <ul>
   *   <li>numerator &gt; 0, denominator &lt; 0: add pi
   *   <li>numerator &lt; 0, denominator &lt; 0: add pi
   *   <li>numerator &lt; 0, denominator &gt; 0: add 2pi
   * </ul>
   *
   * @param numerator the sine-like part
   * @param denominator the cosine-like part
   * @return the angle in radians
   */
  public static double quadrantAtan(double numerator, double denominator) {
    double angle = Math.atan(numerator / denominator);
    if (numerator > 0 && denominator < 0) {
      angle += PI;
    }
    if (numerator < 0 && denominator < 0) {
      angle += PI;
    }
    if (numerator < 0 && denominator > 0) {
      angle += 2 * PI;
    }
    return angle;
  }

  /**
   * Keeps only four decimals, rounding towards negative infinity.
   *
   * @param value the value
   * @return the truncated value
   */
  public static double floor4(double value) {
    return Math.floor(value * 10000) / 10000d;
  }

  private static double clamp(double x) {
    if (x > 1) {
      return 1;
    }
    if (x < -1) {
      return -1;
    }
    return x;
  }
}
