package io.biblcal.feast;

import io.biblcal.CalendarException;
import io.biblcal.location.Location;
import io.biblcal.time.JulianDay;
import io.biblcal.time.Weekday;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans years for feast-date candidates and flood durations. Each year is independent, so ranges
 * are evaluated in parallel; results keep increasing-year order.
 */
public final class FeastDerivation {
  private static final Logger log = LoggerFactory.getLogger(FeastDerivation.class);

  /** Days from Abib 1 to the Passover sacrifice. */
  public static final int PASSOVER_OFFSET = 13;

  /** Days from the Wave Offering to Pentecost. */
  public static final int PENTECOST_OFFSET = 49;

  /** Days from a month start to its 17th. */
  static final int SEVENTEENTH = 16;

  private final AbibOneFinder finder;

  /**
   * Creates a derivation over a month-start finder.
   *
   * @param finder locates Abib 1 and the later months
   */
  public FeastDerivation(AbibOneFinder finder) {
    this.finder = Objects.requireNonNull(finder, "finder");
  }

  /**
   * Evaluates one year.
   *
   * @param kind the search
   * @param year the historical year (year 0 is read as 1)
   * @return the candidate if the year qualifies
   * @throws CalendarException if Abib 1 cannot be determined
   */
  public Optional<FeastCandidate> evaluate(FeastKind kind, int year) throws CalendarException {
    int y = year == 0 ? 1 : year;
    FeastCandidate candidate = candidate(kind, y, finder.abibOne(y, kind.location()));
    if (JulianDay.weekday(candidate.anchorJulianDay()) != kind.weekday()) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  /**
   * Scans a range of years.
   *
   * @param kind the search
   * @param range the years
   * @return the qualifying years' candidates, in increasing-year order
   * @throws CalendarException if Abib 1 cannot be determined for some year
   */
  public List<FeastCandidate> scan(FeastKind kind, YearRange range) throws CalendarException {
    List<FeastCandidate> found =
        parallel(
                range,
                y -> {
                  try {
                    return evaluate(kind, y);
                  } catch (CalendarException e) {
                    throw new ScanFailure(e);
                  }
                })
            .stream()
            .flatMap(Optional::stream)
            .toList();
    log.info("{} {}..{}: {} candidates", kind, range.start(), range.end(), found.size());
    return found;
  }

  /**
   * Computes the flood duration for one year at Mount Ararat.
   *
   * @param year the historical year (year 0 is read as 1)
   * @return the flood-year entry
   * @throws CalendarException if a month start cannot be determined
   */
  public FloodYear floodYear(int year) throws CalendarException {
    int y = year == 0 ? 1 : year;
    Location ararat = Location.MOUNT_ARARAT;
    return FloodYear.of(y, finder.monthStart(y, ararat, 2), finder.monthStart(y, ararat, 7));
  }

  /**
   * Computes the flood table.
   *
   * @param range the years
   * @return one entry per year, in increasing-year order
   * @throws CalendarException if a month start cannot be determined
   */
  public FloodTable floodTable(YearRange range) throws CalendarException {
    List<FloodYear> years =
        parallel(
            range,
            y -> {
              try {
                return floodYear(y);
              } catch (CalendarException e) {
                throw new ScanFailure(e);
              }
            });
    log.info("flood table {}..{}: {} years", range.start(), range.end(), years.size());
    return new FloodTable(range, years);
  }

  /**
   * Builds the candidate record around Abib 1.
   *
   * @param kind the search
   * @param year the historical year
   * @param abibOne the Julian Day of Abib 1
   * @return the candidate
   */
  static FeastCandidate candidate(FeastKind kind, int year, double abibOne) {
    double passover = abibOne + PASSOVER_OFFSET;
    double wave = waveOffering(passover);
    return new FeastCandidate(
        kind, year, abibOne, passover, passover + 1, passover + 7, wave, wave + PENTECOST_OFFSET);
  }

  /**
   * Returns the first Sunday after the Passover.
   *
   * @param passover the Julian Day of the Passover
   * @return the Julian Day of the Wave Offering
   */
  static double waveOffering(double passover) {
    int toSunday = Weekday.SUNDAY.julianDayNumber() - JulianDay.weekdayOf(passover);
    return passover + (toSunday <= 0 ? toSunday + 7 : toSunday);
  }

  private static <T> List<T> parallel(YearRange range, IntFunction<T> perYear)
      throws CalendarException {
    try {
      return range.years().parallel().mapToObj(perYear).toList();
    } catch (ScanFailure e) {
      throw e.getCause();
    }
  }

  /** Carries a checked failure out of a stream. */
  private static final class ScanFailure extends RuntimeException {
    ScanFailure(CalendarException cause) {
      super(cause);
    }

    @Override
    public synchronized CalendarException getCause() {
      return (CalendarException) super.getCause();
    }
  }
}
