package io.biblcal.report;

import io.biblcal.location.Location;
import io.biblcal.time.CivilDate;
import io.biblcal.time.JulianDay;
import io.biblcal.visibility.EveningObservation;
import io.biblcal.visibility.LunationResult;
import java.util.List;

/** Renders the crescent search of a year, one line per evening observed. */
public final class MoonReport {
  static final String HEADER =
      " Date     Sunset Moonset   Illum. Sun's  [Moon's at Sunset]  Sun's    Visib   Visible?";
  static final String SUBHEADER =
      "(Evening)                    %    Azimuth Azimuth Altitude   Alt(M)   Number";

  private MoonReport() {}

  /**
   * Writes the report.
   *
   * @param sink the output
   * @param year the historical year searched
   * @param location the observing site
   * @param lunations the search results, in order
   */
  public static void write(
      OutputSink sink, int year, Location location, List<LunationResult> lunations) {
    sink.writeLine(YearLabels.label(year) + " CALCULATED NEW MOONS");
    sink.writeLine("");
    sink.writeLine(locationLine(location));
    sink.writeLine("");
    for (LunationResult lunation : lunations) {
      sink.writeLine(HEADER);
      sink.writeLine(SUBHEADER);
      for (EveningObservation evening : lunation.evenings()) {
        sink.writeLine(renderEvening(evening));
      }
      sink.writeLine(renderMonthStart(lunation));
      sink.writeLine("");
    }
  }

  /**
   * Renders one evening as a report row.
   *
   * @param e the observation
   * @return the row
   */
  public static String renderEvening(EveningObservation e) {
    CivilDate date = JulianDay.toCivilDate(e.julianDay());
    StringBuilder sb = new StringBuilder();
    sb.append(FieldFormat.pad(Integer.toString(date.dayOfMonth()), 2));
    sb.append(' ').append(date.monthName().abbreviation());
    sb.append("   ").append(e.sunset());
    sb.append("  ").append(e.moonset());
    sb.append("    ").append(FieldFormat.format(e.illumination(), 4));
    sb.append("  ").append(FieldFormat.format(e.sunAzimuth(), 5));
    sb.append("  ").append(FieldFormat.format(e.moonAzimuth(), 5));
    sb.append("   ").append(FieldFormat.format(e.moonAltitude(), 4));
    sb.append("      ").append(FieldFormat.format(e.sunAltitudeAtMoonset(), 4));
    sb.append("    ").append(FieldFormat.format(e.visibilityIndex(), 5));
    sb.append("  ").append(e.tier().label());
    return sb.toString();
  }

  /**
   * Renders the line that closes a lunation.
   *
   * @param lunation the result
   * @return the month start, or the reason none was fixed
   */
  public static String renderMonthStart(LunationResult lunation) {
    if (!lunation.isDetermined()) {
      return "Month start undetermined: " + lunation.undeterminedReason();
    }
    double start = lunation.monthStartJulianDay();
    return "Month begins "
        + JulianDay.toCivilDate(start).toDayFirstString()
        + " ("
        + JulianDay.weekday(start).capitalized()
        + ")";
  }

  static String locationLine(Location location) {
    return "("
        + location.name()
        + ", "
        + sexagesimal(location.latitude(), 'N', 'S')
        + " "
        + sexagesimal(location.longitude(), 'E', 'W')
        + " GMT "
        + offset(location.utcOffsetHours())
        + ")";
  }

  private static String sexagesimal(double degrees, char positive, char negative) {
    double abs = Math.abs(degrees);
    int whole = (int) Math.floor(abs);
    long minutes = Math.round((abs - whole) * 60);
    if (minutes == 60) {
      whole++;
      minutes = 0;
    }
    return whole + "°" + minutes + "'" + (degrees < 0 ? negative : positive);
  }

  private static String offset(double hours) {
    String sign = hours < 0 ? "-" : "+";
    double abs = Math.abs(hours);
    return sign + (abs == Math.rint(abs) ? Long.toString((long) abs) : Double.toString(abs));
  }
}
