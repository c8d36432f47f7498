package io.biblcal.location;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.biblcal.CalendarException;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link LocationDirectory} seeded from a JSON document:
 *
 * <pre>{@code
 * {
 *   "current": "Jerusalem, Israel",
 *   "locations": [
 *     {"name": "Jerusalem, Israel", "latitude": 31.7833, "longitude": 35.2167, "utcOffset": "+2"}
 *   ]
 * }
 * }</pre>
 */
public final class JsonLocationDirectory implements LocationDirectory {
  private static final Logger log = LoggerFactory.getLogger(JsonLocationDirectory.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Classpath resource with the bundled locations. */
  public static final String DEFAULT_RESOURCE = "/locations.json";

  private final Map<String, Location> locations = new LinkedHashMap<>();
  private String currentKey;

  private JsonLocationDirectory() {}

  /**
   * Creates an empty directory.
   *
   * @return the directory
   */
  public static JsonLocationDirectory empty() {
    return new JsonLocationDirectory();
  }

  /**
   * Loads the bundled locations.
   *
   * @return the directory
   * @throws CalendarException if the resource is missing or malformed
   */
  public static JsonLocationDirectory bundled() throws CalendarException {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  /**
   * Loads locations from a classpath resource.
   *
   * @param resource the resource path
   * @return the directory
   * @throws CalendarException if the resource is missing or malformed
   */
  public static JsonLocationDirectory fromClasspath(String resource) throws CalendarException {
    try (InputStream in = JsonLocationDirectory.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw CalendarException.config("location resource not found: " + resource, null);
      }
      return fromDocument(MAPPER.readValue(in, Document.class));
    } catch (IOException e) {
      throw CalendarException.config("cannot read location resource " + resource, e);
    }
  }

  /**
   * Loads locations from JSON text.
   *
   * @param json the JSON document
   * @return the directory
   * @throws CalendarException if the document is malformed or holds an invalid location
   */
  public static JsonLocationDirectory fromJson(String json) throws CalendarException {
    try {
      return fromDocument(MAPPER.readValue(json, Document.class));
    } catch (IOException e) {
      throw CalendarException.config("malformed location document", e);
    }
  }

  private static JsonLocationDirectory fromDocument(Document doc) throws CalendarException {
    JsonLocationDirectory dir = new JsonLocationDirectory();
    if (doc.locations != null) {
      for (Entry e : doc.locations) {
        double offset = LocationParser.parseUtcOffset(e.utcOffset);
        dir.put(Location.of(e.name, e.latitude, e.longitude, offset));
      }
    }
    if (doc.current != null && !doc.current.isBlank()) {
      dir.select(doc.current);
    }
    log.debug("loaded {} locations, current {}", dir.locations.size(), dir.current().name());
    return dir;
  }

  @Override
  public Optional<Location> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(locations.get(key(name)));
  }

  @Override
  public List<Location> list() {
    return List.copyOf(locations.values());
  }

  @Override
  public void put(Location location) throws CalendarException {
    if (location.name().isBlank()) {
      throw CalendarException.location("a directory entry needs a name", location.describe());
    }
    locations.put(key(location.name()), location);
  }

  @Override
  public boolean remove(String name) {
    String k = key(name);
    boolean removed = locations.remove(k) != null;
    if (removed && k.equals(currentKey)) {
      currentKey = null;
    }
    return removed;
  }

  @Override
  public Location current() {
    if (currentKey != null) {
      Location loc = locations.get(currentKey);
      if (loc != null) {
        return loc;
      }
    }
    return Location.JERUSALEM;
  }

  @Override
  public void select(String name) throws CalendarException {
    String k = key(name);
    if (!locations.containsKey(k)) {
      throw CalendarException.location("unknown location", name);
    }
    currentKey = k;
  }

  private static String key(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }

  static final class Document {
    @JsonProperty("current")
    String current;

    @JsonProperty("locations")
    List<Entry> locations;
  }

  static final class Entry {
    @JsonProperty("name")
    String name;

    @JsonProperty("latitude")
    double latitude;

    @JsonProperty("longitude")
    double longitude;

    @JsonProperty("utcOffset")
    String utcOffset;
  }
}
