package io.biblcal.feast;

import static org.junit.jupiter.api.Assertions.*;

import io.biblcal.CalendarException;
import io.biblcal.ErrorKind;
import io.biblcal.config.CalendarConfig;
import io.biblcal.location.Location;
import io.biblcal.time.JulianDay;
import io.biblcal.time.Weekday;
import io.biblcal.visibility.VisibilityEngine;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Feast-date scans over the fixed-date and crescent Abib 1 finders. */
public class FeastDerivationTest {
  private final FeastDerivation fixed = new FeastDerivation(new FixedDateAbibOneFinder());

  @Test
  void testFixedDateAbibOne() {
    FixedDateAbibOneFinder finder = new FixedDateAbibOneFinder();
    assertEquals(2458179, finder.abibOne(2018, Location.JERUSALEM));
    assertEquals(JulianDay.toJulianDay(3, 1, -30), finder.abibOne(-30, Location.EDEN));
  }

  @Test
  void testFixedMonthsAreThirtyDays() throws CalendarException {
    FixedDateAbibOneFinder finder = new FixedDateAbibOneFinder();
    double abib = finder.abibOne(2024, Location.MOUNT_ARARAT);
    assertEquals(abib + 30, finder.monthStart(2024, Location.MOUNT_ARARAT, 2));
    assertEquals(abib + 180, finder.monthStart(2024, Location.MOUNT_ARARAT, 7));
  }

  @Test
  void testCrucifixion2018() throws CalendarException {
    FeastCandidate c = fixed.evaluate(FeastKind.CRUCIFIXION, 2018).orElseThrow();
    assertEquals(2018, c.year());
    assertEquals(2458179, c.abibOneJulianDay());
    assertEquals(2458192, c.passoverJulianDay());
    assertEquals(Weekday.WEDNESDAY, JulianDay.weekday(c.passoverJulianDay()));
    assertEquals(2458193, c.unleavenedBreadStart());
    assertEquals(2458199, c.unleavenedBreadEnd());
    assertEquals(2458196, c.waveOfferingJulianDay());
    assertEquals(Weekday.SUNDAY, JulianDay.weekday(c.waveOfferingJulianDay()));
    assertEquals(2458245, c.pentecostJulianDay());
    assertEquals(c.passoverJulianDay(), c.anchorJulianDay());
  }

  @Test
  void testJordanCrossingAndCreation2020() throws CalendarException {
    FeastCandidate jordan = fixed.evaluate(FeastKind.JORDAN_CROSSING, 2020).orElseThrow();
    assertEquals(Weekday.SATURDAY, JulianDay.weekday(jordan.passoverJulianDay()));
    assertEquals(jordan.passoverJulianDay() + 1, jordan.waveOfferingJulianDay());

    FeastCandidate creation = fixed.evaluate(FeastKind.CREATION, 2020).orElseThrow();
    assertEquals(2458910, creation.abibOneJulianDay());
    assertEquals(Weekday.SUNDAY, JulianDay.weekday(creation.abibOneJulianDay()));
    assertEquals(creation.abibOneJulianDay(), creation.anchorJulianDay());

    assertTrue(fixed.evaluate(FeastKind.CRUCIFIXION, 2020).isEmpty());
  }

  @Test
  void testNonQualifyingYear() throws CalendarException {
    for (FeastKind kind : FeastKind.values()) {
      assertTrue(fixed.evaluate(kind, 2024).isEmpty(), kind + " in 2024");
    }
  }

  @Test
  void testWaveOfferingIsFirstSundayAfterPassover() {
    double wednesday = 2458192;
    assertEquals(wednesday + 4, FeastDerivation.waveOffering(wednesday));
    double saturday = 2458923;
    assertEquals(saturday + 1, FeastDerivation.waveOffering(saturday));
    double sunday = saturday + 1;
    assertEquals(sunday + 7, FeastDerivation.waveOffering(sunday));
    for (int d = 0; d < 7; d++) {
      double wave = FeastDerivation.waveOffering(wednesday + d);
      assertEquals(Weekday.SUNDAY, JulianDay.weekday(wave));
      assertTrue(wave - (wednesday + d) >= 1 && wave - (wednesday + d) <= 7);
    }
  }

  @Test
  void testScanMatchesPerYearEvaluation() throws CalendarException {
    YearRange range = YearRange.of(-60, 60);
    for (FeastKind kind : FeastKind.values()) {
      List<FeastCandidate> scanned = fixed.scan(kind, range);
      List<FeastCandidate> oneByOne =
          range.years()
              .mapToObj(
                  y -> {
                    try {
                      return fixed.evaluate(kind, y);
                    } catch (CalendarException e) {
                      throw new AssertionError(e);
                    }
                  })
              .flatMap(Optional::stream)
              .toList();
      assertEquals(oneByOne, scanned, kind.toString());
      assertFalse(scanned.isEmpty());
    }
  }

  @Test
  void testScanInIncreasingYearOrder() throws CalendarException {
    List<FeastCandidate> found = fixed.scan(FeastKind.CRUCIFIXION, YearRange.of(-2000, 2000));
    for (int i = 1; i < found.size(); i++) {
      assertTrue(found.get(i - 1).year() < found.get(i).year());
    }
    for (FeastCandidate c : found) {
      assertEquals(Weekday.WEDNESDAY, JulianDay.weekday(c.passoverJulianDay()));
      assertNotEquals(0, c.year());
    }
  }

  @Test
  void testScanIdempotent() throws CalendarException {
    YearRange range = YearRange.of(1, 500);
    assertEquals(
        fixed.scan(FeastKind.JORDAN_CROSSING, range), fixed.scan(FeastKind.JORDAN_CROSSING, range));
  }

  @Test
  void testYearZeroScannedAsYearOne() throws CalendarException {
    List<FeastCandidate> found = fixed.scan(FeastKind.CRUCIFIXION, YearRange.of(0, 1));
    // 1 CE: Abib 1 is a Thursday, Passover a Wednesday
    assertEquals(1, found.size());
    assertEquals(1, found.get(0).year());
  }

  @Test
  void testCrescentAbibOne() throws CalendarException {
    CrescentAbibOneFinder finder =
        new CrescentAbibOneFinder(new VisibilityEngine(CalendarConfig.defaults()));
    assertEquals(2460382, finder.abibOne(2024, Location.JERUSALEM));
    assertEquals(2460411, finder.monthStart(2024, Location.JERUSALEM, 2));
    assertTrue(finder.abibOne(2024, Location.JERUSALEM) + 13 >= SpringEquinox.day(2024));
  }

  @Test
  void testCrescentCrucifixion2023() throws CalendarException {
    FeastDerivation crescent =
        new FeastDerivation(
            new CrescentAbibOneFinder(new VisibilityEngine(CalendarConfig.defaults())));
    FeastCandidate c = crescent.evaluate(FeastKind.CRUCIFIXION, 2023).orElseThrow();
    // Passover on Wednesday 5 April 2023
    assertEquals(2460027, c.abibOneJulianDay());
    assertEquals(2460040, c.passoverJulianDay());
    assertEquals(2460044, c.waveOfferingJulianDay());
    assertTrue(crescent.evaluate(FeastKind.CRUCIFIXION, 2024).isEmpty());
  }

  @Test
  void testCrescentUndeterminedMonthIsComputationError() throws CalendarException {
    CalendarConfig oneEvening = CalendarConfig.fromJson("{\"maxEveningsPerLunation\": 1}");
    CrescentAbibOneFinder finder = new CrescentAbibOneFinder(new VisibilityEngine(oneEvening));
    // the first evening after the March 2024 new moon is too early for a sighting
    CalendarException e =
        assertThrows(CalendarException.class, () -> finder.abibOne(2024, Location.JERUSALEM));
    assertEquals(ErrorKind.COMPUTATION, e.kind());
  }

  @Test
  void testSpringEquinox() {
    // 20 March 2024, 03:06 UT
    assertEquals(2460390, SpringEquinox.day(2024));
    assertEquals(2460389.627, SpringEquinox.julianEphemerisDay(2024), 0.01);
    assertEquals(SpringEquinox.day(1), SpringEquinox.day(0));
  }
}
