package io.biblcal.visibility;

import static org.junit.jupiter.api.Assertions.*;

import io.biblcal.CalendarException;
import io.biblcal.astro.AstroTime;
import io.biblcal.astro.Observer;
import io.biblcal.config.CalendarConfig;
import io.biblcal.location.Location;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** Crescent searches for Jerusalem in 2024. */
public class VisibilityEngineTest {
  private static List<LunationResult> jerusalem2024;

  @BeforeAll
  static void search() {
    jerusalem2024 =
        new VisibilityEngine(CalendarConfig.defaults()).lunationsForYear(2024, Location.JERUSALEM);
  }

  @Test
  void testSearchesFourteenLunations() {
    assertEquals(14, jerusalem2024.size());
    assertEquals(NewMoonEstimate.firstLunationOf(2024), jerusalem2024.get(0).lunation());
    assertEquals(1536, jerusalem2024.get(0).lunation());
    for (int i = 1; i < jerusalem2024.size(); i++) {
      assertEquals(jerusalem2024.get(i - 1).lunation() + 1, jerusalem2024.get(i).lunation());
    }
  }

  @Test
  void testEveryLunationDetermined() {
    for (LunationResult r : jerusalem2024) {
      assertTrue(r.isDetermined(), "lunation " + r.lunation() + ": " + r.undeterminedReason());
      assertTrue(r.monthStart().isPresent());
    }
  }

  @Test
  void testMonthStarts() {
    // 12 March and 10 April 2024
    assertEquals(2460382, jerusalem2024.get(0).monthStartJulianDay());
    assertEquals(VisibilityTier.VISIBLE, jerusalem2024.get(0).tier());
    assertEquals(2460411, jerusalem2024.get(1).monthStartJulianDay());
    assertEquals(2460441, jerusalem2024.get(2).monthStartJulianDay());
    assertEquals(2460470, jerusalem2024.get(3).monthStartJulianDay());
  }

  @Test
  void testProbablyNotVisibleStartsTwoDaysLater() {
    LunationResult july = jerusalem2024.get(4);
    assertEquals(VisibilityTier.PROBABLY_NOT_VISIBLE, july.tier());
    EveningObservation deciding = july.evenings().get(july.evenings().size() - 1);
    assertEquals(deciding.julianDay() + 2, july.monthStartJulianDay());
    assertEquals(2460500, july.monthStartJulianDay());
  }

  @Test
  void testProbablyVisibleStartsNextDay() {
    LunationResult december = jerusalem2024.get(9);
    assertEquals(VisibilityTier.PROBABLY_VISIBLE, december.tier());
    EveningObservation deciding = december.evenings().get(december.evenings().size() - 1);
    assertEquals(deciding.julianDay() + 1, december.monthStartJulianDay());
    assertEquals(2460648, december.monthStartJulianDay());
  }

  @Test
  void testNotVisibleEveningsRetryNextDay() {
    for (LunationResult r : jerusalem2024) {
      List<EveningObservation> evenings = r.evenings();
      for (int i = 0; i < evenings.size() - 1; i++) {
        assertEquals(VisibilityTier.NOT_VISIBLE, evenings.get(i).tier());
        assertEquals(evenings.get(i).julianDay() + 1, evenings.get(i + 1).julianDay());
      }
      assertTrue(evenings.get(evenings.size() - 1).tier().startsMonth());
    }
  }

  @Test
  void testMonthStartFollowsNewMoon() {
    for (LunationResult r : jerusalem2024) {
      double lag = r.monthStartJulianDay() - r.newMoonJulianDay();
      assertTrue(lag > 0 && lag < 5, "lunation " + r.lunation() + " starts " + lag + " days after");
    }
  }

  @Test
  void testMoonsetSearchConvergesQuickly() {
    for (LunationResult r : jerusalem2024) {
      for (EveningObservation e : r.evenings()) {
        assertTrue(e.iterations() >= 2 && e.iterations() <= 4, "iterations " + e.iterations());
      }
    }
  }

  @Test
  void testEveningObservationValues() {
    // evening of 11 March 2024, the first sighting after the new moon of 10 March
    EveningObservation e = jerusalem2024.get(0).evenings().get(1);
    assertEquals(2460381, e.julianDay());
    assertEquals(17, e.sunset().hour());
    assertEquals(19, e.moonset().hour());
    assertTrue(e.timeLagMinutes() > 80 && e.timeLagMinutes() < 90);
    assertEquals(e.moonset().totalMinutes() - e.sunset().totalMinutes(), e.timeLagMinutes());
    assertTrue(e.illumination() > 2 && e.illumination() < 3);
    assertTrue(e.moonAltitude() > 15 && e.moonAltitude() < 17);
    assertTrue(e.sunAltitudeAtMoonset() < -15);
    assertTrue(e.moonAzimuth() >= 0 && e.moonAzimuth() < 360);
    assertTrue(e.visibilityIndex() > 150);
    assertEquals(VisibilityTier.VISIBLE, e.tier());
  }

  @Test
  void testObserveSingleEvening() {
    VisibilityEngine engine = new VisibilityEngine(CalendarConfig.defaults());
    double deltaT = NewMoonEstimate.of(1536).deltaT();
    Optional<EveningObservation> e =
        engine.observeEvening(2460381, Observer.of(Location.JERUSALEM), deltaT);
    assertTrue(e.isPresent());
    assertEquals(jerusalem2024.get(0).evenings().get(1), e.get());
  }

  @Test
  void testMoonsetIsConvergedEstimate() throws CalendarException {
    CalendarConfig fine =
        CalendarConfig.fromJson("{\"moonsetMaxIterations\": 100, \"moonsetToleranceMinutes\": 0.01}");
    double deltaT = NewMoonEstimate.of(1536).deltaT();
    EveningObservation tight =
        new VisibilityEngine(fine)
            .observeEvening(2460381, Observer.of(Location.JERUSALEM), deltaT)
            .orElseThrow();
    EveningObservation usual = jerusalem2024.get(0).evenings().get(1);
    assertTrue(tight.iterations() >= usual.iterations());
    assertTrue(
        Math.abs(tight.moonset().totalMinutes() - usual.moonset().totalMinutes()) <= 1,
        tight.moonset() + " vs " + usual.moonset());
  }

  @Test
  void testIterationCapLeavesLunationUndetermined() throws CalendarException {
    CalendarConfig strict =
        CalendarConfig.fromJson("{\"moonsetMaxIterations\": 2, \"moonsetToleranceMinutes\": 0.01}");
    LunationResult r =
        new VisibilityEngine(strict).searchLunation(1536, Observer.of(Location.JERUSALEM));
    assertFalse(r.isDetermined());
    assertTrue(Double.isNaN(r.monthStartJulianDay()));
    assertTrue(r.monthStart().isEmpty());
    assertNull(r.tier());
    assertTrue(r.undeterminedReason().contains("did not converge"));
  }

  @Test
  void testEveningCapLeavesLunationUndetermined() throws CalendarException {
    CalendarConfig oneEvening = CalendarConfig.fromJson("{\"maxEveningsPerLunation\": 1}");
    LunationResult r =
        new VisibilityEngine(oneEvening).searchLunation(1536, Observer.of(Location.JERUSALEM));
    assertFalse(r.isDetermined());
    assertEquals(1, r.evenings().size());
    assertEquals(VisibilityTier.NOT_VISIBLE, r.evenings().get(0).tier());
    assertTrue(r.undeterminedReason().contains("1 evenings"));
  }

  @Test
  void testRepeatedSearchIdentical() {
    List<LunationResult> again =
        new VisibilityEngine(CalendarConfig.defaults()).lunationsForYear(2024, Location.JERUSALEM);
    assertEquals(jerusalem2024, again);
  }

  @Test
  void testDeltaTPositiveInModernEra() {
    assertTrue(AstroTime.deltaTDays(1.24) > 0);
  }
}
