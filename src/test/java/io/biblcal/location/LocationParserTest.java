package io.biblcal.location;

import static org.junit.jupiter.api.Assertions.*;

import io.biblcal.CalendarException;
import io.biblcal.ErrorKind;
import org.junit.jupiter.api.Test;

/** Unit tests for coordinate and UTC offset parsing. */
public class LocationParserTest {

  @Test
  void testDecimalCoordinates() throws CalendarException {
    Location loc = LocationParser.parseCoordinates("31.78, 35.24", 2);
    assertEquals(31.78, loc.latitude());
    assertEquals(35.24, loc.longitude());
    assertEquals(2, loc.utcOffsetHours());
  }

  @Test
  void testDecimalCoordinatesWithoutSpace() throws CalendarException {
    Location loc = LocationParser.parseCoordinates("-33.87,151.21", 10);
    assertEquals(-33.87, loc.latitude());
    assertEquals(151.21, loc.longitude());
  }

  @Test
  void testSexagesimalCoordinates() throws CalendarException {
    Location loc = LocationParser.parseCoordinates("31°47' N 35°14' E", 2);
    assertEquals(31 + 47 / 60.0, loc.latitude(), 1e-9);
    assertEquals(35 + 14 / 60.0, loc.longitude(), 1e-9);
  }

  @Test
  void testSexagesimalHemispheresSetSign() throws CalendarException {
    Location loc = LocationParser.parseCoordinates("22°54'30\" S, 43°12' W", -3);
    assertEquals(-(22 + 54 / 60.0 + 30 / 3600.0), loc.latitude(), 1e-9);
    assertEquals(-(43 + 12 / 60.0), loc.longitude(), 1e-9);
  }

  @Test
  void testRejectsGarbage() {
    CalendarException e =
        assertThrows(CalendarException.class, () -> LocationParser.parseCoordinates("north", 0));
    assertEquals(ErrorKind.LOCATION, e.kind());
    assertEquals("north", e.input().orElseThrow());
  }

  @Test
  void testRejectsOutOfRange() {
    assertThrows(CalendarException.class, () -> LocationParser.parseCoordinates("91, 10", 0));
    assertThrows(CalendarException.class, () -> LocationParser.parseCoordinates("10, 181", 0));
    assertThrows(CalendarException.class, () -> Location.of(10, 10, Double.NaN));
  }

  @Test
  void testUtcOffsets() throws CalendarException {
    assertEquals(2, LocationParser.parseUtcOffset("+2"));
    assertEquals(2, LocationParser.parseUtcOffset("2"));
    assertEquals(-5, LocationParser.parseUtcOffset("-5"));
    assertEquals(5.5, LocationParser.parseUtcOffset("5.5"));
    assertEquals(2, LocationParser.parseUtcOffset("UTC+2"));
    assertEquals(-3, LocationParser.parseUtcOffset("gmt -3"));
    assertEquals(0, LocationParser.parseUtcOffset("UTC"));
  }

  @Test
  void testRejectsBadUtcOffsets() {
    assertThrows(CalendarException.class, () -> LocationParser.parseUtcOffset(""));
    assertThrows(CalendarException.class, () -> LocationParser.parseUtcOffset("EST"));
    assertThrows(CalendarException.class, () -> LocationParser.parseUtcOffset("+15"));
    assertThrows(CalendarException.class, () -> LocationParser.parseUtcOffset(null));
  }

  @Test
  void testDescribe() throws CalendarException {
    assertEquals("Jerusalem 31.78N 35.244E UTC+2", Location.JERUSALEM.describe());
    assertEquals(
        "Lima 12.05S 77.05W UTC-5", Location.of("Lima", -12.05, -77.05, -5).describe());
  }

  @Test
  void testLocationRejectsEachFieldOutOfRange() {
    CalendarException e =
        assertThrows(CalendarException.class, () -> Location.of("bad", 200, 500, 40));
    assertEquals(ErrorKind.LOCATION, e.kind());
    assertEquals("200.0", e.input().orElseThrow());

    assertEquals(
        "500.0",
        assertThrows(CalendarException.class, () -> Location.of("bad", 10, 500, 2))
            .input()
            .orElseThrow());
    assertEquals(
        "40.0",
        assertThrows(CalendarException.class, () -> Location.of("bad", 10, 20, 40))
            .input()
            .orElseThrow());
    assertThrows(CalendarException.class, () -> Location.of(Double.NaN, 20, 2));
    assertThrows(CalendarException.class, () -> Location.of(10, Double.POSITIVE_INFINITY, 2));
  }

  @Test
  void testLocationBoundsAccepted() throws CalendarException {
    Location edge = Location.of("  Edge  ", -90, 180, 14);
    assertEquals("Edge", edge.name());
    assertEquals(-90, edge.latitude());
    assertEquals(180, edge.longitude());
    assertEquals(14, edge.utcOffsetHours());
    assertEquals(-12, Location.of(90, -180, -12).utcOffsetHours());
  }

  @Test
  void testLocationEquality() throws CalendarException {
    Location a = Location.of("Jerusalem", 31.78, 35.244, 2);
    assertEquals(Location.JERUSALEM, a);
    assertEquals(Location.JERUSALEM.hashCode(), a.hashCode());
    assertNotEquals(Location.EDEN, a);
  }
}
