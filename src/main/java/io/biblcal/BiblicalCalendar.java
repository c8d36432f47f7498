package io.biblcal;

import io.biblcal.astro.Observer;
import io.biblcal.astro.Sunset;
import io.biblcal.astro.SunsetCalculator;
import io.biblcal.config.CalendarConfig;
import io.biblcal.feast.AbibOneFinder;
import io.biblcal.feast.CrescentAbibOneFinder;
import io.biblcal.feast.FeastCandidate;
import io.biblcal.feast.FeastDerivation;
import io.biblcal.feast.FeastKind;
import io.biblcal.feast.FixedDateAbibOneFinder;
import io.biblcal.feast.FloodTable;
import io.biblcal.feast.FloodYear;
import io.biblcal.feast.YearRange;
import io.biblcal.hebrew.HebrewYearCache;
import io.biblcal.hebrew.HebrewYearInfo;
import io.biblcal.location.JsonLocationDirectory;
import io.biblcal.location.Location;
import io.biblcal.location.LocationDirectory;
import io.biblcal.location.LocationParser;
import io.biblcal.report.FeastReport;
import io.biblcal.report.FloodReport;
import io.biblcal.report.MoonReport;
import io.biblcal.report.OutputSink;
import io.biblcal.report.SunsetReport;
import io.biblcal.report.YearLabels;
import io.biblcal.time.CivilDate;
import io.biblcal.time.JulianDay;
import io.biblcal.time.Weekday;
import io.biblcal.visibility.LunationResult;
import io.biblcal.visibility.VisibilityEngine;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for calendar conversions, crescent searches and feast-date scans.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * BiblicalCalendar calendar = BiblicalCalendar.create();
 * List<LunationResult> months = calendar.lunations(2024);
 * List<FeastCandidate> years =
 *     calendar.feastCandidates(FeastKind.CRUCIFIXION, YearRange.of(25, 40));
 * }</pre>
 *
 * <p>Years are historical: -1 is 1 BCE and is followed by 1 CE. Year 0 is read as year 1.
 */
public final class BiblicalCalendar {
  private static final Logger log = LoggerFactory.getLogger(BiblicalCalendar.class);

  private static final Pattern YEAR =
      Pattern.compile(
          "(?<sign>[-+])?\\s*(?<digits>\\d{1,4})\\s*(?<era>BCE|BC|CE|AD)?",
          Pattern.CASE_INSENSITIVE);

  /** How Abib 1 is located for the feast scans. */
  public enum AbibOneMethod {
    /** 1 March of the year, months of 30 days. */
    FIXED_DATE,
    /** The first visible crescent near the March equinox. */
    CRESCENT
  }

  private final CalendarConfig config;
  private final LocationDirectory locations;
  private final HebrewYearCache hebrewYears;
  private final VisibilityEngine engine;
  private final FeastDerivation feasts;

  private BiblicalCalendar(
      CalendarConfig config, LocationDirectory locations, AbibOneMethod method) {
    this.config = config;
    this.locations = locations;
    this.hebrewYears = new HebrewYearCache(config.hebrewCacheSize());
    this.engine = new VisibilityEngine(config);
    AbibOneFinder finder =
        method == AbibOneMethod.CRESCENT
            ? new CrescentAbibOneFinder(engine)
            : new FixedDateAbibOneFinder();
    this.feasts = new FeastDerivation(finder);
  }

  /**
   * Creates a calendar from the bundled configuration and locations, with fixed-date Abib 1.
   *
   * @return the calendar
   * @throws CalendarException if a bundled resource is malformed
   */
  public static BiblicalCalendar create() throws CalendarException {
    return create(CalendarConfig.load(), JsonLocationDirectory.bundled(), AbibOneMethod.FIXED_DATE);
  }

  /**
   * Creates a calendar.
   *
   * @param config the search limits and defaults
   * @param locations the named locations
   * @param method how Abib 1 is located
   * @return the calendar
   */
  public static BiblicalCalendar create(
      CalendarConfig config, LocationDirectory locations, AbibOneMethod method) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(locations, "locations");
    Objects.requireNonNull(method, "method");
    String preferred = config.defaultLocation();
    if (preferred != null && !preferred.isBlank()) {
      try {
        locations.select(preferred);
      } catch (CalendarException e) {
        log.warn(
            "default location '{}' not in directory, using {}",
            preferred,
            locations.current().name());
      }
    }
    log.info("calendar ready at {} with {} Abib 1", locations.current().describe(), method);
    return new BiblicalCalendar(config, locations, method);
  }

  /**
   * Parses a year such as "2024", "-30", "30 BCE" or "33 AD".
   *
   * @param text the year
   * @return the historical year, negative for BCE
   * @throws CalendarException if the text is not a year within [-9999, 9999]
   */
  public static int parseYear(String text) throws CalendarException {
    if (text == null) {
      throw CalendarException.input("year is required", "");
    }
    Matcher m = YEAR.matcher(text.trim());
    if (!m.matches()) {
      throw CalendarException.input("not a year", text);
    }
    int year = Integer.parseInt(m.group("digits"));
    String era = m.group("era");
    boolean bce = era != null && era.toUpperCase(Locale.ROOT).startsWith("B");
    if ("-".equals(m.group("sign"))) {
      if (era != null) {
        throw CalendarException.input("sign and era both given", text);
      }
      bce = true;
    }
    year = bce ? -year : year;
    YearRange.checkYear(year);
    return year;
  }

  // --- date conversion ---

  /**
   * Converts a civil date to its Julian Day.
   *
   * @param month 1..12
   * @param day 1..31
   * @param year the historical year
   * @return the Julian Day
   * @throws CalendarException if a field is out of range
   */
  public double toJulianDay(int month, double day, int year) throws CalendarException {
    if (month < 1 || month > 12) {
      throw CalendarException.input("month must be within 1..12", month);
    }
    if (!Double.isFinite(day) || day < 1 || day >= 32) {
      throw CalendarException.input("day must be within 1..31", day);
    }
    YearRange.checkYear(year);
    return JulianDay.toJulianDay(month, day, year);
  }

  /**
   * Converts a Julian Day to a civil date.
   *
   * @param jd the Julian Day
   * @return the date
   * @throws CalendarException if the Julian Day is not finite
   */
  public CivilDate toCivilDate(double jd) throws CalendarException {
    return JulianDay.toCivilDate(finite(jd));
  }

  /**
   * Returns the weekday of a Julian Day.
   *
   * @param jd the Julian Day
   * @return the weekday
   * @throws CalendarException if the Julian Day is not finite
   */
  public Weekday weekdayOf(double jd) throws CalendarException {
    return Weekday.fromJulianDay(finite(jd));
  }

  /**
   * Returns the year counted from Creation.
   *
   * @param year the historical year
   * @return the year after Creation
   */
  public int yearAfterCreation(int year) {
    return YearLabels.yearAfterCreation(year);
  }

  // --- Hebrew calendar ---

  /**
   * Returns the Hebrew year that begins in the autumn of a Gregorian year.
   *
   * @param year the historical year
   * @return the year's data
   * @throws CalendarException if the year is out of range
   */
  public HebrewYearInfo hebrewYearInfo(int year) throws CalendarException {
    YearRange.checkYear(year);
    return hebrewYears.get(year);
  }

  // --- crescent visibility ---

  /**
   * Searches the lunations of a year at the current location.
   *
   * @param year the historical year
   * @return one result per lunation
   * @throws CalendarException if the year is out of range
   */
  public List<LunationResult> lunations(int year) throws CalendarException {
    return lunations(year, locations.current());
  }

  /**
   * Searches the lunations of a year.
   *
   * @param year the historical year
   * @param location the observing site
   * @return one result per lunation
   * @throws CalendarException if the year is out of range
   */
  public List<LunationResult> lunations(int year, Location location) throws CalendarException {
    YearRange.checkYear(year);
    return engine.lunationsForYear(year, Objects.requireNonNull(location, "location"));
  }

  /**
   * Computes sunsets from 1 January for the configured number of days.
   *
   * @param year the historical year
   * @param location the observing site
   * @return one sunset per day
   * @throws CalendarException if the year is out of range
   */
  public List<Sunset> sunsets(int year, Location location) throws CalendarException {
    YearRange.checkYear(year);
    return SunsetCalculator.table(year, Observer.of(location), config.sunsetTableDays());
  }

  // --- feasts ---

  /**
   * Evaluates one year for a feast search.
   *
   * @param kind the search
   * @param year the historical year
   * @return the candidate if the year qualifies
   * @throws CalendarException if the year is out of range or Abib 1 cannot be found
   */
  public Optional<FeastCandidate> feastCandidate(FeastKind kind, int year)
      throws CalendarException {
    YearRange.checkYear(year);
    return feasts.evaluate(kind, year);
  }

  /**
   * Scans a range of years for a feast search.
   *
   * @param kind the search
   * @param range the years
   * @return qualifying years, in increasing-year order
   * @throws CalendarException if Abib 1 cannot be found for some year
   */
  public List<FeastCandidate> feastCandidates(FeastKind kind, YearRange range)
      throws CalendarException {
    return feasts.scan(kind, range);
  }

  /**
   * Computes the flood duration for one year.
   *
   * @param year the historical year
   * @return the flood-year entry
   * @throws CalendarException if the year is out of range or a month start cannot be found
   */
  public FloodYear floodYear(int year) throws CalendarException {
    YearRange.checkYear(year);
    return feasts.floodYear(year);
  }

  /**
   * Computes the flood table; the bounds are normalized to the flood era.
   *
   * @param start first year
   * @param end last year
   * @return the table
   * @throws CalendarException if a bound is out of range or a month start cannot be found
   */
  public FloodTable floodTable(int start, int end) throws CalendarException {
    return feasts.floodTable(YearRange.forFlood(start, end));
  }

  // --- reports ---

  /**
   * Writes the crescent search of a year at the current location.
   *
   * @param sink the output
   * @param year the historical year
   * @throws CalendarException if the year is out of range
   */
  public void writeMoonReport(OutputSink sink, int year) throws CalendarException {
    Location location = locations.current();
    MoonReport.write(sink, year, location, lunations(year, location));
  }

  /**
   * Writes the sunset table of a year at the current location.
   *
   * @param sink the output
   * @param year the historical year
   * @throws CalendarException if the year is out of range
   */
  public void writeSunsetReport(OutputSink sink, int year) throws CalendarException {
    Location location = locations.current();
    SunsetReport.write(sink, year, location, sunsets(year, location));
  }

  /**
   * Writes a feast search over a range.
   *
   * @param sink the output
   * @param kind the search
   * @param range the years
   * @throws CalendarException if Abib 1 cannot be found for some year
   */
  public void writeFeastReport(OutputSink sink, FeastKind kind, YearRange range)
      throws CalendarException {
    FeastReport.write(sink, kind, range, feastCandidates(kind, range));
  }

  /**
   * Writes the flood report. A single year replaces the sink's content with that year's
   * durations; a range writes the bucket table.
   *
   * @param sink the output
   * @param start first year
   * @param end last year
   * @throws CalendarException if a bound is out of range or a month start cannot be found
   */
  public void writeFloodReport(OutputSink sink, int start, int end) throws CalendarException {
    YearRange range = YearRange.forFlood(start, end);
    if (!range.isMultiYear()) {
      sink.clear();
      FloodReport.writeYear(sink, floodYear(range.start()));
      return;
    }
    FloodReport.writeTable(sink, feasts.floodTable(range));
  }

  // --- locations ---

  /**
   * Returns the location directory.
   *
   * @return the directory
   */
  public LocationDirectory locations() {
    return locations;
  }

  /**
   * Parses coordinates and a UTC offset into a location.
   *
   * @param coordinates e.g. "31.78, 35.24" or "31°47' N 35°14' E"
   * @param utcOffset e.g. "+2" or "UTC-5"
   * @return the location
   * @throws CalendarException if either part is malformed or out of range
   */
  public Location parseLocation(String coordinates, String utcOffset) throws CalendarException {
    return LocationParser.parseCoordinates(coordinates, LocationParser.parseUtcOffset(utcOffset));
  }

  /**
   * Returns the configuration in use.
   *
   * @return the configuration
   */
  public CalendarConfig config() {
    return config;
  }

  private static double finite(double jd) throws CalendarException {
    if (!Double.isFinite(jd)) {
      throw CalendarException.input("Julian Day must be finite", jd);
    }
    return jd;
  }
}
