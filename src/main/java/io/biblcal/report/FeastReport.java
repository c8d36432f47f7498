package io.biblcal.report;

import io.biblcal.feast.FeastCandidate;
import io.biblcal.feast.FeastKind;
import io.biblcal.feast.YearRange;
import io.biblcal.time.JulianDay;
import java.util.List;

/** Renders feast-date searches, as a list of years or the dates of a single year. */
public final class FeastReport {
  static final String RULE = "=".repeat(30);

  private FeastReport() {}

  /**
   * Writes the report. A multi-year range lists the qualifying years; a single year lists the
   * feast dates when the year qualifies.
   *
   * @param sink the output
   * @param kind the search
   * @param range the years scanned
   * @param candidates the qualifying years, in order
   */
  public static void write(
      OutputSink sink, FeastKind kind, YearRange range, List<FeastCandidate> candidates) {
    if (range.isMultiYear()) {
      sink.writeLine(rangeTitle(kind));
      sink.writeLine("First year of run is " + YearLabels.label(range.start()));
      sink.writeLine("Last year of run is " + YearLabels.label(range.end()));
      sink.writeLine(RULE);
      for (FeastCandidate c : candidates) {
        sink.write(YearLabels.label(c.year()) + "  ");
      }
      sink.writeLine("");
      return;
    }
    sink.writeLine(singleTitle(kind) + YearLabels.label(range.start()));
    for (FeastCandidate c : candidates) {
      writeDetail(sink, c);
    }
  }

  static void writeDetail(OutputSink sink, FeastCandidate c) {
    sink.writeLine("Abib 1 is " + date(c.abibOneJulianDay()));
    sink.writeLine("Passover sacrifice is " + date(c.passoverJulianDay()));
    sink.writeLine("********** " + marker(c.kind()) + " **********");
    sink.writeLine(
        "Feast of Unleavened Bread runs from "
            + date(c.unleavenedBreadStart())
            + " to "
            + date(c.unleavenedBreadEnd()));
    sink.writeLine("The Wave Offering (the First-Fruit) is " + date(c.waveOfferingJulianDay()));
    sink.writeLine("First-Fruits (Pentecost) is " + date(c.pentecostJulianDay()));
  }

  static String rangeTitle(FeastKind kind) {
    return switch (kind) {
      case CRUCIFIXION -> "The following years may have the Passover sacrifice on Wednesday.";
      case JORDAN_CROSSING -> "The following years may have the Passover sacrifice on the Sabbath.";
      case CREATION -> "The following years may have Abib 1 on Sunday.";
    };
  }

  static String singleTitle(FeastKind kind) {
    return switch (kind) {
      case CRUCIFIXION -> "Possible Dates for Jesus' Crucifixion, Resurrection and Pentecost in ";
      case JORDAN_CROSSING -> "Possible Dates for the Jordan Crossing in ";
      case CREATION -> "Possible Dates for Creation in ";
    };
  }

  private static String marker(FeastKind kind) {
    return switch (kind) {
      case CRUCIFIXION -> "This year has the proper day of the week for Christ's death.";
      case JORDAN_CROSSING -> "This year has the Passover sacrifice on the Sabbath.";
      case CREATION -> "This year has Abib 1 on the first day of the week.";
    };
  }

  private static String date(double jd) {
    return JulianDay.toCivilDate(jd).toDayFirstString();
  }
}
