package com.flightmail.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Locates the bundled reference dataset and parses it into a JSON tree once.
 *
 * The dataset is a single document with one array per kind of reference data
 * ({@code airports}, {@code airlines}); each repository asks for its own section,
 * so the file is read at most once however many repositories are built on it.
 */
@Component
public class ReferenceDatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(ReferenceDatasetLoader.class);

  private final String location;
  private final Resource datasetResource;
  private final ObjectMapper objectMapper;

  private JsonNode root;

  public ReferenceDatasetLoader(
      @Value("${flightmail.reference-data.location:classpath:static/reference-data.json}") String location,
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper
  ) {
    this.location = location;
    this.datasetResource = resourceLoader.getResource(location);
    this.objectMapper = objectMapper;

    if (!this.datasetResource.exists()) {
      log.error("Reference dataset does not exist at location: {}", location);
      throw new IllegalStateException("Reference dataset not found at: " + location);
    }

    log.info("Using reference dataset at {}", location);
  }

  public InputStream openDatasetStream() throws IOException {
    return datasetResource.getInputStream();
  }

  /**
   * The named top-level array, or empty when the dataset has no such key or the
   * value is not an array.
   *
   * @throws IllegalStateException if the dataset cannot be read or is not valid JSON
   */
  public Optional<JsonNode> arraySection(String name) {
    JsonNode section = dataset().get(name);
    if (section == null || !section.isArray()) {
      return Optional.empty();
    }
    return Optional.of(section);
  }

  private synchronized JsonNode dataset() {
    if (root == null) {
      try (InputStream is = openDatasetStream()) {
        JsonNode parsed = objectMapper.readTree(is);
        if (parsed == null || !parsed.isObject()) {
          throw new IllegalStateException("Reference dataset at " + location + " is not a JSON object");
        }
        root = parsed;
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read reference dataset at " + location, e);
      }
      log.debug("Parsed reference dataset at {}", location);
    }
    return root;
  }
}
