package io.biblcal.feast;

import static org.junit.jupiter.api.Assertions.*;

import io.biblcal.CalendarException;
import io.biblcal.config.CalendarConfig;
import io.biblcal.visibility.VisibilityEngine;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Flood durations between the 17th of the second and seventh months. */
public class FloodTableTest {

  @Test
  void testBuckets() {
    assertEquals(FloodBucket.EXACT, FloodBucket.of(150));
    assertEquals(FloodBucket.PLUS_ONE, FloodBucket.of(149));
    assertEquals(FloodBucket.PLUS_TWO, FloodBucket.of(148));
    assertEquals(FloodBucket.NONE, FloodBucket.of(147));
    assertEquals(FloodBucket.NONE, FloodBucket.of(151));
    assertEquals("149(+1)", FloodBucket.PLUS_ONE.label());
  }

  @Test
  void testFloodYearOffsets() {
    FloodYear y = FloodYear.of(2024, 2460411, 2460559);
    assertEquals(2460427, y.secondMonth17());
    assertEquals(2460575, y.seventhMonth17());
    assertEquals(148, y.daysBetween());
    assertEquals(FloodBucket.PLUS_TWO, y.bucket());
    assertEquals(List.of(147, 148, 149, 150), y.alternatives());
  }

  @Test
  void testFixedDateYearsAreAllExact() throws CalendarException {
    FeastDerivation fixed = new FeastDerivation(new FixedDateAbibOneFinder());
    FloodTable table = fixed.floodTable(YearRange.forFlood(-50, 50));
    assertEquals(100, table.years().size());
    for (FloodYear y : table.years()) {
      assertEquals(150, y.daysBetween());
      assertEquals(FloodBucket.EXACT, y.bucket());
    }
    assertEquals(100, table.yearsIn(FloodBucket.EXACT).size());
    assertTrue(table.yearsIn(FloodBucket.PLUS_ONE).isEmpty());
  }

  @Test
  void testCrescentYears() throws CalendarException {
    FeastDerivation crescent =
        new FeastDerivation(
            new CrescentAbibOneFinder(new VisibilityEngine(CalendarConfig.defaults())));
    assertEquals(FloodBucket.PLUS_ONE, crescent.floodYear(33).bucket());
    assertEquals(149, crescent.floodYear(33).daysBetween());
    assertEquals(FloodBucket.PLUS_TWO, crescent.floodYear(30).bucket());
  }

  @Test
  void testCrescentTableBucketsExclusive() throws CalendarException {
    FeastDerivation crescent =
        new FeastDerivation(
            new CrescentAbibOneFinder(new VisibilityEngine(CalendarConfig.defaults())));
    FloodTable table = crescent.floodTable(YearRange.forFlood(25, 40));
    assertEquals(16, table.years().size());
    Set<Integer> seen = new HashSet<>();
    int total = 0;
    for (FloodBucket bucket : FloodBucket.values()) {
      List<Integer> years = table.yearsIn(bucket);
      total += years.size();
      for (int year : years) {
        assertTrue(seen.add(year), year + " in two buckets");
      }
    }
    assertEquals(table.years().size(), total);
    assertTrue(table.yearsIn(FloodBucket.PLUS_ONE).contains(33));
    assertTrue(table.yearsIn(FloodBucket.PLUS_TWO).contains(30));
  }
}
