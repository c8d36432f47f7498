package io.biblcal.location;

import io.biblcal.CalendarException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses coordinate and UTC offset strings typed by users or stored in the directory. */
public final class LocationParser {
  private static final Pattern DECIMAL_DEGREES =
      Pattern.compile("(?<latitude>[-+]?\\d+(?:\\.\\d+)?)\\s*[,\\s]\\s*(?<longitude>[-+]?\\d+(?:\\.\\d+)?)");

  private static final Pattern SEXAGESIMAL_DEGREES =
      Pattern.compile(
          "(?<latDeg>\\d+)°(?: *(?<latMin>\\d+)')?(?: *(?<latSec>\\d+(?:\\.\\d+)?)\")? *(?<latDir>[NSns]),?\\s+"
              + "(?<lonDeg>\\d+)°(?: *(?<lonMin>\\d+)')?(?: *(?<lonSec>\\d+(?:\\.\\d+)?)\")? *(?<lonDir>[EWew])");

  private static final Pattern UTC_OFFSET =
      Pattern.compile("(?:(?:UTC|GMT)\\s*)?(?<offset>[-+]?\\d+(?:\\.\\d+)?)?", Pattern.CASE_INSENSITIVE);

  private LocationParser() {}

  /**
   * Parses coordinates given as {@code "31.78, 35.24"} or {@code 31°47' N 35°14' E}.
   *
   * @param text the coordinate text
   * @param utcOffsetHours the UTC offset to attach
   * @return the location
   * @throws CalendarException if the text matches neither form or a value is out of range
   */
  public static Location parseCoordinates(String text, double utcOffsetHours)
      throws CalendarException {
    String input = text == null ? "" : text.trim();

    Matcher decimal = DECIMAL_DEGREES.matcher(input);
    if (decimal.matches()) {
      return Location.of(
          Double.parseDouble(decimal.group("latitude")),
          Double.parseDouble(decimal.group("longitude")),
          utcOffsetHours);
    }

    Matcher sexagesimal = SEXAGESIMAL_DEGREES.matcher(input);
    if (sexagesimal.matches()) {
      double latitude =
          degrees(sexagesimal.group("latDeg"), sexagesimal.group("latMin"), sexagesimal.group("latSec"));
      if (sexagesimal.group("latDir").equalsIgnoreCase("S")) {
        latitude = -latitude;
      }
      double longitude =
          degrees(sexagesimal.group("lonDeg"), sexagesimal.group("lonMin"), sexagesimal.group("lonSec"));
      if (sexagesimal.group("lonDir").equalsIgnoreCase("W")) {
        longitude = -longitude;
      }
      return Location.of(latitude, longitude, utcOffsetHours);
    }

    throw CalendarException.location("unrecognized coordinates", input);
  }

  /**
   * Parses a UTC offset such as {@code "2"}, {@code "+2"}, {@code "-5"}, {@code "5.5"} or {@code
   * "UTC+2"}. A bare {@code "UTC"} is zero.
   *
   * @param text the offset text
   * @return the offset in hours
   * @throws CalendarException if the text is not an offset or is out of range
   */
  public static double parseUtcOffset(String text) throws CalendarException {
    String input = text == null ? "" : text.trim();
    Matcher m = UTC_OFFSET.matcher(input);
    if (input.isEmpty() || !m.matches()) {
      throw CalendarException.location("unrecognized UTC offset", input);
    }
    double offset = m.group("offset") == null ? 0 : Double.parseDouble(m.group("offset"));
    if (offset < -12 || offset > 14) {
      throw CalendarException.location("UTC offset must be within [-12, 14]", input);
    }
    return offset;
  }

  private static double degrees(String deg, String min, String sec) {
    double value = Double.parseDouble(deg);
    if (min != null) {
      value += Double.parseDouble(min) / 60;
    }
    if (sec != null) {
      value += Double.parseDouble(sec) / 3600;
    }
    return value;
  }
}
