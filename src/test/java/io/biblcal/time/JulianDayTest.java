package io.biblcal.time;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/** Unit tests for Julian Day conversion and weekday arithmetic. */
public class JulianDayTest {

  @Test
  void testJ2000ReferenceDay() {
    assertEquals(2451545, JulianDay.toJulianDay(1, 1, 2000));
    CivilDate date = JulianDay.toCivilDate(2451545);
    assertEquals(1, date.month());
    assertEquals(1, date.dayOfMonth());
    assertEquals(2000, date.year());
  }

  @Test
  void testGregorianReformDay() {
    assertEquals(2299161, JulianDay.toJulianDay(10, 15, 1582));
    assertEquals("10/15/1582", JulianDay.toCivilDate(2299161).toString());
  }

  @Test
  void testNoYearZero() {
    assertEquals(1721425, JulianDay.toJulianDay(12, 31, -1));
    assertEquals(1721426, JulianDay.toJulianDay(1, 1, 1));
    CivilDate lastBce = JulianDay.toCivilDate(1721425);
    assertEquals(-1, lastBce.year());
    assertTrue(lastBce.isBce());
    assertEquals(1, JulianDay.toCivilDate(1721426).year());
  }

  @Test
  void testYearZeroReadAsYearOne() {
    assertEquals(JulianDay.toJulianDay(3, 1, 1), JulianDay.toJulianDay(3, 1, 0));
  }

  @Test
  void testRoundTripOverWideRange() {
    for (int jd = 0; jd <= 5_400_000; jd += 997) {
      CivilDate date = JulianDay.toCivilDate(jd);
      assertEquals(jd, date.toJulianDay(), "round trip of JD " + jd + " via " + date);
    }
  }

  @Test
  void testRoundTripAroundYearBoundaries() {
    for (int year : new int[] {-4004, -1000, -2, -1, 1, 2, 1582, 1600, 1900, 2000, 2100}) {
      for (int month = 1; month <= 12; month++) {
        double jd = JulianDay.toJulianDay(month, 1, year);
        CivilDate date = JulianDay.toCivilDate(jd);
        assertEquals(month, date.month());
        assertEquals(1, date.dayOfMonth());
        assertEquals(year, date.year());
      }
    }
  }

  @Test
  void testWeekdayOf() {
    // 1 January 2000 was a Saturday.
    assertEquals(5, JulianDay.weekdayOf(2451545));
    assertEquals(Weekday.SATURDAY, JulianDay.weekday(2451545));
    assertEquals(Weekday.SUNDAY, JulianDay.weekday(2451546));
    assertEquals(Weekday.MONDAY, JulianDay.weekday(0));
    // 4 July 1776 was a Thursday.
    assertEquals(Weekday.THURSDAY, JulianDay.weekday(JulianDay.toJulianDay(7, 4, 1776)));
  }

  @Test
  void testWeekdayIgnoresFraction() {
    assertEquals(JulianDay.weekdayOf(2451545), JulianDay.weekdayOf(2451545.9));
    assertEquals(JulianDay.weekdayOf(2460586), JulianDay.weekdayOf(2460586.5));
  }

  @Test
  void testWeekdayOfNegativeJulianDay() {
    assertEquals(Weekday.SUNDAY, JulianDay.weekday(-1));
    assertEquals(Weekday.MONDAY, JulianDay.weekday(-7));
  }

  @Test
  void testWeekdayNames() {
    assertTrue(Weekday.SATURDAY.isSabbath());
    assertFalse(Weekday.SUNDAY.isSabbath());
    assertEquals("Wednesday", Weekday.WEDNESDAY.capitalized());
    assertEquals(Weekday.WEDNESDAY, Weekday.fromJulianDay(2458192));
  }

  @Test
  void testCivilDateFormats() {
    CivilDate date = JulianDay.toCivilDate(2460395);
    assertEquals("25/3/2024", date.toDayFirstString());
    assertEquals("3/25/2024", date.toString());
    assertEquals(GregorianMonth.MARCH, date.monthName());
  }

  @Test
  void testTimeOfDayFromHoursAfterNoon() {
    assertEquals(new TimeOfDay(17, 45), TimeOfDay.fromHoursAfterNoon(5.75));
    assertEquals("17:45", TimeOfDay.fromHoursAfterNoon(5.75).toString());
    assertEquals(new TimeOfDay(0, 30), TimeOfDay.fromHoursAfterNoon(12.5));
    assertEquals(17 * 60 + 45, TimeOfDay.fromHoursAfterNoon(5.75).totalMinutes());
  }
}
