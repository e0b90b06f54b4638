package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.NonNull;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Test-only ReferenceDatasetLoader that serves an in-memory JSON string instead of
 * a classpath resource, plus factory methods for repositories built on top of it.
 */
public class StringReferenceDatasetLoader extends ReferenceDatasetLoader {

  /**
   * Small dataset shared by the normalizer and service tests.
   */
  public static final String SAMPLE_JSON = """
      {
        "airports": [
          { "code": "SGN", "name": "Tan Son Nhat", "city": "Ho Chi Minh City", "timezone": "Asia/Ho_Chi_Minh" },
          { "code": "HAN", "name": "Noi Bai", "city": "Hanoi", "timezone": "Asia/Ho_Chi_Minh" },
          { "code": "SFO", "name": "San Francisco International", "city": "San Francisco", "timezone": "America/Los_Angeles" },
          { "code": "JFK", "name": "John F. Kennedy International", "city": "New York", "timezone": "America/New_York" },
          { "code": "LHR", "name": "Heathrow", "city": "London", "timezone": "Europe/London" }
        ],
        "airlines": [
          { "code": "VJ", "name": "VietJet Air" },
          { "code": "AA", "name": "American Airlines" },
          { "code": "BA", "name": "British Airways" }
        ]
      }
      """;

  private final String json;

  public StringReferenceDatasetLoader(String json) {
    super("ignored-location", new DummyResourceLoader(), new ObjectMapper());
    this.json = json;
  }

  @Override
  public InputStream openDatasetStream() {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }

  public static AirportRepositoryInMemory airports(String json) {
    return new AirportRepositoryInMemory(new StringReferenceDatasetLoader(json), new AirportJsonMapper());
  }

  public static AirlineRepositoryInMemory airlines(String json) {
    return new AirlineRepositoryInMemory(new StringReferenceDatasetLoader(json), new AirlineJsonMapper());
  }

  /**
   * Minimal ResourceLoader that always reports an existing (empty) resource, so the
   * ReferenceDatasetLoader constructor completes without a real file.
   */
  static class DummyResourceLoader implements ResourceLoader {

    private final Resource resource = new ByteArrayResource(new byte[0]);

    @Override
    @NonNull
    public Resource getResource(@NonNull String location) {
      return resource;
    }

    @Override
    public ClassLoader getClassLoader() {
      return getClass().getClassLoader();
    }
  }
}
