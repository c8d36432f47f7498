package io.biblcal.location;

import static org.junit.jupiter.api.Assertions.*;

import io.biblcal.CalendarException;
import io.biblcal.ErrorKind;
import org.junit.jupiter.api.Test;

/** Unit tests for the JSON-seeded location directory. */
public class JsonLocationDirectoryTest {

  @Test
  void testBundledLocations() throws CalendarException {
    LocationDirectory dir = JsonLocationDirectory.bundled();
    assertEquals(32, dir.list().size());
    assertEquals("Jerusalem, Israel", dir.current().name());

    Location newYork = dir.find("new york, new york, usa").orElseThrow();
    assertTrue(newYork.latitude() > 0);
    assertTrue(newYork.longitude() < 0);
    assertEquals(-5, newYork.utcOffsetHours());

    Location brisbane = dir.find("Brisbane, Australia").orElseThrow();
    assertTrue(brisbane.latitude() < 0);
    assertTrue(brisbane.longitude() > 0);
  }

  @Test
  void testBundledEntriesInRange() throws CalendarException {
    for (Location loc : JsonLocationDirectory.bundled().list()) {
      assertTrue(Math.abs(loc.latitude()) <= 90, loc.name());
      assertTrue(Math.abs(loc.longitude()) <= 180, loc.name());
      assertTrue(loc.utcOffsetHours() >= -12 && loc.utcOffsetHours() <= 14, loc.name());
    }
  }

  @Test
  void testPutRemoveAndSelect() throws CalendarException {
    JsonLocationDirectory dir = JsonLocationDirectory.empty();
    assertEquals(Location.JERUSALEM, dir.current());

    Location nineveh = Location.of("Nineveh", 36.36, 43.15, 3);
    dir.put(nineveh);
    assertEquals(nineveh, dir.find("NINEVEH").orElseThrow());

    dir.select("Nineveh");
    assertEquals(nineveh, dir.current());

    assertTrue(dir.remove("nineveh"));
    assertFalse(dir.remove("nineveh"));
    assertEquals(Location.JERUSALEM, dir.current());
  }

  @Test
  void testPutReplacesSameName() throws CalendarException {
    JsonLocationDirectory dir = JsonLocationDirectory.empty();
    dir.put(Location.of("Home", 10, 10, 1));
    dir.put(Location.of("home", 20, 20, 2));
    assertEquals(1, dir.list().size());
    assertEquals(20, dir.find("Home").orElseThrow().latitude());
  }

  @Test
  void testRejectsUnnamedEntry() {
    JsonLocationDirectory dir = JsonLocationDirectory.empty();
    assertThrows(CalendarException.class, () -> dir.put(Location.of(10, 10, 0)));
  }

  @Test
  void testSelectUnknown() {
    CalendarException e =
        assertThrows(
            CalendarException.class, () -> JsonLocationDirectory.empty().select("Atlantis"));
    assertEquals(ErrorKind.LOCATION, e.kind());
  }

  @Test
  void testFromJson() throws CalendarException {
    JsonLocationDirectory dir =
        JsonLocationDirectory.fromJson(
            "{\"current\": \"Ur\", \"locations\": ["
                + "{\"name\": \"Ur\", \"latitude\": 30.96, \"longitude\": 46.1, \"utcOffset\": \"UTC+3\"}]}");
    assertEquals("Ur", dir.current().name());
    assertEquals(3, dir.current().utcOffsetHours());
  }

  @Test
  void testMalformedJson() {
    CalendarException e =
        assertThrows(CalendarException.class, () -> JsonLocationDirectory.fromJson("{locations"));
    assertEquals(ErrorKind.CONFIG, e.kind());
  }

  @Test
  void testMissingResource() {
    CalendarException e =
        assertThrows(
            CalendarException.class, () -> JsonLocationDirectory.fromClasspath("/nowhere.json"));
    assertEquals(ErrorKind.CONFIG, e.kind());
  }
}
