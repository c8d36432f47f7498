package io.biblcal.report;

import io.biblcal.astro.Sunset;
import io.biblcal.location.Location;
import io.biblcal.time.CivilDate;
import io.biblcal.time.JulianDay;
import io.biblcal.time.TimeOfDay;
import java.util.List;

/** Renders a table of daily sunsets, four days to a line. */
public final class SunsetReport {
  static final int PER_LINE = 4;

  private SunsetReport() {}

  /**
   * Writes the report.
   *
   * @param sink the output
   * @param year the historical year
   * @param location the observing site
   * @param sunsets consecutive sunsets from 1 January
   */
  public static void write(OutputSink sink, int year, Location location, List<Sunset> sunsets) {
    sink.writeLine(YearLabels.label(year) + " CALCULATED SUNSETS");
    sink.writeLine("Location: " + location.describe());
    sink.writeLine("Times do not reflect changes in 'Daylight Saving Time'");
    sink.writeLine("_".repeat(88));
    for (int i = 0; i < sunsets.size(); i++) {
      if (i > 0 && i % PER_LINE == 0) {
        sink.writeLine("");
      }
      sink.write(renderEntry(sunsets.get(i)) + "    ");
    }
    sink.writeLine("");
  }

  /**
   * Renders one day, e.g. {@code 1/1  4:46 PM}.
   *
   * @param sunset the sunset
   * @return the entry
   */
  public static String renderEntry(Sunset sunset) {
    CivilDate date = JulianDay.toCivilDate(sunset.julianDay());
    TimeOfDay t = sunset.time();
    int hour = t.hour() % 12 == 0 ? 12 : t.hour() % 12;
    return String.format(
        "%d/%d %2d:%02d %s", date.dayOfMonth(), date.month(), hour, t.minute(), t.hour() < 12 ? "AM" : "PM");
  }
}
