package io.biblcal.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.biblcal.CalendarException;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables for the calculations, read from the classpath resource {@code biblcal.json}. Values
 * outside their range are logged and replaced by the default, whichever way the record is built.
 *
 * @param defaultLocation name of the location selected at start-up
 * @param lunationsPerYear lunations searched per year
 * @param maxEveningsPerLunation evenings tried before a lunation is undetermined
 * @param moonsetMaxIterations iteration cap of the moonset search
 * @param moonsetToleranceMinutes agreement between successive moonset estimates that ends the
 *     search
 * @param sunsetTableDays rows in the sunset table
 * @param hebrewCacheSize Hebrew years kept in memory
 */
public record CalendarConfig(
    String defaultLocation,
    int lunationsPerYear,
    int maxEveningsPerLunation,
    int moonsetMaxIterations,
    double moonsetToleranceMinutes,
    int sunsetTableDays,
    int hebrewCacheSize) {

  private static final Logger log = LoggerFactory.getLogger(CalendarConfig.class);
  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "/biblcal.json";

  static final String DEFAULT_LOCATION = "Jerusalem, Israel";
  static final int LUNATIONS_DEFAULT = 14;
  static final int LUNATIONS_MIN = 1;
  static final int LUNATIONS_MAX = 28;
  static final int EVENINGS_DEFAULT = 6;
  static final int EVENINGS_MIN = 1;
  static final int EVENINGS_MAX = 10;
  static final int ITERATIONS_DEFAULT = 10;
  static final int ITERATIONS_MIN = 2;
  static final int ITERATIONS_MAX = 100;
  static final double TOLERANCE_DEFAULT = 1.0;
  static final double TOLERANCE_MIN = 0.01;
  static final double TOLERANCE_MAX = 30;
  static final int SUNSET_DAYS_DEFAULT = 107;
  static final int SUNSET_DAYS_MIN = 1;
  static final int SUNSET_DAYS_MAX = 366;
  static final int CACHE_DEFAULT = 20_000;
  static final int CACHE_MIN = 16;
  static final int CACHE_MAX = 1_000_000;

  public CalendarConfig {
    if (defaultLocation == null || defaultLocation.isBlank()) {
      defaultLocation = DEFAULT_LOCATION;
    }
    lunationsPerYear =
        checked("lunationsPerYear", lunationsPerYear, LUNATIONS_MIN, LUNATIONS_MAX, LUNATIONS_DEFAULT);
    maxEveningsPerLunation =
        checked(
            "maxEveningsPerLunation",
            maxEveningsPerLunation,
            EVENINGS_MIN,
            EVENINGS_MAX,
            EVENINGS_DEFAULT);
    moonsetMaxIterations =
        checked(
            "moonsetMaxIterations",
            moonsetMaxIterations,
            ITERATIONS_MIN,
            ITERATIONS_MAX,
            ITERATIONS_DEFAULT);
    moonsetToleranceMinutes =
        checked(
            "moonsetToleranceMinutes",
            moonsetToleranceMinutes,
            TOLERANCE_MIN,
            TOLERANCE_MAX,
            TOLERANCE_DEFAULT);
    sunsetTableDays =
        checked("sunsetTableDays", sunsetTableDays, SUNSET_DAYS_MIN, SUNSET_DAYS_MAX, SUNSET_DAYS_DEFAULT);
    hebrewCacheSize =
        checked("hebrewCacheSize", hebrewCacheSize, CACHE_MIN, CACHE_MAX, CACHE_DEFAULT);
  }

  /**
   * Returns the built-in configuration.
   *
   * @return the defaults
   */
  public static CalendarConfig defaults() {
    return new CalendarConfig(
        DEFAULT_LOCATION,
        LUNATIONS_DEFAULT,
        EVENINGS_DEFAULT,
        ITERATIONS_DEFAULT,
        TOLERANCE_DEFAULT,
        SUNSET_DAYS_DEFAULT,
        CACHE_DEFAULT);
  }

  /**
   * Loads {@code biblcal.json} from the classpath, or the defaults if it is absent.
   *
   * @return the configuration
   * @throws CalendarException if the resource exists but cannot be parsed
   */
  public static CalendarConfig load() throws CalendarException {
    try (InputStream in = CalendarConfig.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.info("no {} on the classpath, using defaults", RESOURCE);
        return defaults();
      }
      return MAPPER.readValue(in, Raw.class).validate();
    } catch (IOException e) {
      throw CalendarException.config("cannot read " + RESOURCE, e);
    }
  }

  /**
   * Parses a configuration document. Missing fields take their default.
   *
   * @param json the JSON document
   * @return the configuration
   * @throws CalendarException if the document is malformed
   */
  public static CalendarConfig fromJson(String json) throws CalendarException {
    try {
      return MAPPER.readValue(json, Raw.class).validate();
    } catch (IOException e) {
      throw CalendarException.config("malformed configuration", e);
    }
  }

  /**
   * Returns the moonset tolerance in hours.
   *
   * @return the tolerance, hours
   */
  public double moonsetToleranceHours() {
    return moonsetToleranceMinutes / 60d;
  }

  private static int checked(String name, int value, int min, int max, int fallback) {
    if (value < min || value > max) {
      log.warn("{}={} outside [{}, {}], using {}", name, value, min, max, fallback);
      return fallback;
    }
    return value;
  }

  private static double checked(String name, double value, double min, double max, double fallback) {
    if (!Double.isFinite(value) || value < min || value > max) {
      log.warn("{}={} outside [{}, {}], using {}", name, value, min, max, fallback);
      return fallback;
    }
    return value;
  }

  /** The document as written, before range checks. */
  static final class Raw {
    @JsonProperty("defaultLocation")
    String defaultLocation;

    @JsonProperty("lunationsPerYear")
    Integer lunationsPerYear;

    @JsonProperty("maxEveningsPerLunation")
    Integer maxEveningsPerLunation;

    @JsonProperty("moonsetMaxIterations")
    Integer moonsetMaxIterations;

    @JsonProperty("moonsetToleranceMinutes")
    Double moonsetToleranceMinutes;

    @JsonProperty("sunsetTableDays")
    Integer sunsetTableDays;

    @JsonProperty("hebrewCacheSize")
    Integer hebrewCacheSize;

    CalendarConfig validate() {
      return new CalendarConfig(
          defaultLocation,
          lunationsPerYear == null ? LUNATIONS_DEFAULT : lunationsPerYear,
          maxEveningsPerLunation == null ? EVENINGS_DEFAULT : maxEveningsPerLunation,
          moonsetMaxIterations == null ? ITERATIONS_DEFAULT : moonsetMaxIterations,
          moonsetToleranceMinutes == null ? TOLERANCE_DEFAULT : moonsetToleranceMinutes,
          sunsetTableDays == null ? SUNSET_DAYS_DEFAULT : sunsetTableDays,
          hebrewCacheSize == null ? CACHE_DEFAULT : hebrewCacheSize);
    }
  }
}
