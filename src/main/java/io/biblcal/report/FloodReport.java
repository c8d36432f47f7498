package io.biblcal.report;

import io.biblcal.feast.FloodBucket;
import io.biblcal.feast.FloodTable;
import io.biblcal.feast.FloodYear;
import io.biblcal.time.JulianDay;
import java.util.List;
import java.util.stream.Collectors;

/** Renders the flood duration of one year, or the bucket table of a range. */
public final class FloodReport {
  static final int COLUMN = 20;

  private FloodReport() {}

  /**
   * Writes the duration between the 17th of the second and seventh months of one year.
   *
   * @param sink the output
   * @param year the flood-year entry
   */
  public static void writeYear(OutputSink sink, FloodYear year) {
    sink.writeLine("Flood dates in " + YearLabels.label(year.year()));
    sink.writeLine("Second month, 17th day is " + date(year.secondMonth17()));
    sink.writeLine("Seventh month, 17th day is " + date(year.seventhMonth17()));
    if (year.bucket() == FloodBucket.EXACT) {
      sink.writeLine("*******");
    } else if (year.bucket() != FloodBucket.NONE) {
      sink.writeLine("**********");
    }
    sink.writeLine("There are " + year.daysBetween() + " days between these dates.");
    sink.writeLine(
        "Possibly "
            + year.alternatives().stream().map(String::valueOf).collect(Collectors.joining(" or "))
            + " days.");
    sink.writeLine("");
  }

  /**
   * Writes the three-column table of years by bucket.
   *
   * @param sink the output
   * @param table the scanned years
   */
  public static void writeTable(OutputSink sink, FloodTable table) {
    sink.writeLine(
        "First year of run is "
            + YearLabels.label(table.range().start())
            + "          Last year of run is "
            + YearLabels.label(table.range().end()));
    sink.writeLine(" 150 days           149(+1)             148(+2)");
    sink.writeLine(" " + "=".repeat(67));

    List<Integer> exact = table.yearsIn(FloodBucket.EXACT);
    List<Integer> plusOne = table.yearsIn(FloodBucket.PLUS_ONE);
    List<Integer> plusTwo = table.yearsIn(FloodBucket.PLUS_TWO);
    int rows = Math.max(exact.size(), Math.max(plusOne.size(), plusTwo.size()));
    for (int i = 0; i < rows; i++) {
      String line =
          column(exact, i, COLUMN) + column(plusOne, i, COLUMN) + column(plusTwo, i, 0);
      sink.writeLine(line.stripTrailing());
    }
  }

  private static String column(List<Integer> years, int row, int width) {
    String text = row < years.size() ? YearLabels.label(years.get(row)) : "";
    return width == 0 ? text : FieldFormat.pad(text, Math.max(width, text.length()));
  }

  private static String date(double jd) {
    return JulianDay.toCivilDate(jd).toDayFirstString();
  }
}
