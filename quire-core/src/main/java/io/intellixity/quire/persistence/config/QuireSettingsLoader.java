package io.intellixity.quire.persistence.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Reads {@link QuireSettings} from JSON. */
public final class QuireSettingsLoader {
  public static final String DEFAULT_RESOURCE = "quire.json";

  private static final ObjectMapper JSON = JsonMapper.builder()
      .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private QuireSettingsLoader() {}

  public static QuireSettings read(Path path) {
    Objects.requireNonNull(path, "path");
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.toString());
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read quire settings from " + path, e);
    }
  }

  public static QuireSettings fromClasspath() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  public static QuireSettings fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = QuireSettingsLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Classpath resource not found: " + resource);
      return read(in, resource);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read quire settings from " + resource, e);
    }
  }

  public static QuireSettings parse(String json) {
    try {
      return JSON.readValue(json, QuireSettings.class);
    } catch (ValueInstantiationException e) {
      throw new IllegalArgumentException("Invalid quire settings: " + e.getCause().getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid quire settings: " + e.getOriginalMessage(), e);
    }
  }

  private static QuireSettings read(InputStream in, String source) throws IOException {
    try {
      return JSON.readValue(in, QuireSettings.class);
    } catch (ValueInstantiationException e) {
      throw new IllegalArgumentException("Invalid quire settings in " + source + ": " + e.getCause().getMessage(), e);
    }
  }
}
