package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ReferenceDatasetLoader}.
 * Small in-memory ResourceLoader implementations stand in for the classpath, except
 * for one test that opens the dataset bundled with the application.
 */
class ReferenceDatasetLoaderTest {

  /**
   * Happy-path test:
   * The bundled classpath dataset exists and can be read.
   */
  @Test
  void constructor_shouldOpenBundledClasspathDataset() throws IOException {
    // given
    String location = "classpath:static/reference-data.json";

    // when
    ReferenceDatasetLoader loader = new ReferenceDatasetLoader(location, new DefaultResourceLoader(), new ObjectMapper());

    // then
    try (InputStream is = loader.openDatasetStream()) {
      String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      assertTrue(content.contains("\"airports\""), "Bundled dataset should contain an airports array");
      assertTrue(content.contains("\"airlines\""), "Bundled dataset should contain an airlines array");
    }
  }

  /**
   * Failure case:
   * A missing resource fails fast with an IllegalStateException naming the location.
   */
  @Test
  void constructor_shouldFailWhenResourceDoesNotExist() {
    // given
    String location = "classpath:nonexistent/reference-data.json";
    ResourceLoader resourceLoader = new FixedResourceLoader(new ByteArrayResource(new byte[0]) {
      @Override
      public boolean exists() {
        return false;
      }
    });

    // when / then
    IllegalStateException ex = assertThrows(
        IllegalStateException.class,
        () -> new ReferenceDatasetLoader(location, resourceLoader, new ObjectMapper()),
        "Expected IllegalStateException when resource does not exist"
    );
    assertTrue(ex.getMessage().contains(location), "Exception message should mention the missing location");
  }

  /**
   * Edge case:
   * A read failure of the underlying resource is propagated, not swallowed.
   */
  @Test
  void openDatasetStream_shouldPropagateIOExceptionFromResource() {
    // given
    ResourceLoader resourceLoader = new FixedResourceLoader(new ByteArrayResource(new byte[0]) {
      @Override
      @NonNull
      public InputStream getInputStream() throws IOException {
        throw new IOException("Simulated read failure");
      }
    });
    ReferenceDatasetLoader loader = new ReferenceDatasetLoader("classpath:any.json", resourceLoader, new ObjectMapper());

    // when / then
    assertThrows(IOException.class, loader::openDatasetStream,
        "Expected IOException to be propagated from underlying Resource");
  }

  /**
   * Both repositories are built on one loader; the dataset is opened and parsed once.
   */
  @Test
  void arraySection_shouldParseDatasetOnlyOnce() {
    // given
    CountingLoader loader = new CountingLoader(StringReferenceDatasetLoader.SAMPLE_JSON);

    // when
    AirportRepositoryInMemory airports = new AirportRepositoryInMemory(loader, new AirportJsonMapper());
    AirlineRepositoryInMemory airlines = new AirlineRepositoryInMemory(loader, new AirlineJsonMapper());

    // then
    assertEquals(1, loader.opened.get());
    assertTrue(airports.findByCode("SGN").isPresent());
    assertTrue(airlines.findByCode("VJ").isPresent());
  }

  @Test
  void arraySection_shouldBeEmptyForMissingOrNonArraySection() {
    ReferenceDatasetLoader loader = new StringReferenceDatasetLoader("""
        { "airports": [], "airlines": { "VJ": "VietJet Air" } }
        """);

    assertTrue(loader.arraySection("airports").isPresent());
    assertTrue(loader.arraySection("airlines").isEmpty());
    assertTrue(loader.arraySection("countries").isEmpty());
  }

  /**
   * Failure case:
   * A dataset that is not a JSON object fails fast when first read.
   */
  @Test
  void arraySection_shouldFailOnMalformedDataset() {
    ReferenceDatasetLoader notJson = new StringReferenceDatasetLoader("airports: SGN, HAN");
    ReferenceDatasetLoader notAnObject = new StringReferenceDatasetLoader("[1, 2, 3]");

    assertThrows(IllegalStateException.class, () -> notJson.arraySection("airports"));
    assertThrows(IllegalStateException.class, () -> notAnObject.arraySection("airports"));
  }

  private static class CountingLoader extends StringReferenceDatasetLoader {

    private final AtomicInteger opened = new AtomicInteger();

    CountingLoader(String json) {
      super(json);
    }

    @Override
    public InputStream openDatasetStream() {
      opened.incrementAndGet();
      return super.openDatasetStream();
    }
  }

  private static class FixedResourceLoader implements ResourceLoader {

    private final Resource resource;

    FixedResourceLoader(Resource resource) {
      this.resource = resource;
    }

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
