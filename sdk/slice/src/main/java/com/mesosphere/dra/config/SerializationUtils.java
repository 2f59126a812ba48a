package com.mesosphere.dra.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;

/**
 * Contains static object serialization utilities for JSON and YAML.
 */
public final class SerializationUtils {

  /**
   * An Object mapper that can be used for mapping Objects to and from YAML.
   */
  private static final ObjectMapper DEFAULT_YAML_MAPPER = registerDefaultModules(new ObjectMapper(new YAMLFactory()));

  /**
   * An Object mapper that can be used for mapping Objects to and from JSON.
   */
  private static final ObjectMapper DEFAULT_JSON_MAPPER = registerDefaultModules(new ObjectMapper());

  private SerializationUtils() {
    // do not instantiate
  }

  /**
   * Returns the provided {@link ObjectMapper} with default modules and settings applied.
   *
   * @param mapper the instance to register default modules with
   */
  public static ObjectMapper registerDefaultModules(ObjectMapper mapper) {
    // If the user provides duplicate fields (e.g. 'driver' twice), throw an error instead of silently dropping data:
    mapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    return mapper.registerModules(
        new GuavaModule(),  // Guava types
        new Jdk8Module());  // Optional<>s
  }

  /**
   * Returns a YAML representation of the provided value.
   *
   * @param value The value that will be converted to YAML
   * @param <T> The type of the {@code value}
   * @throws IOException if conversion fails
   */
  public static <T> String toYamlString(T value) throws IOException {
    return DEFAULT_YAML_MAPPER.writeValueAsString(value);
  }

  /**
   * Returns the object represented by the provided YAML string.
   */
  public static <T> T fromYamlString(String str, Class<T> clazz) throws IOException {
    return DEFAULT_YAML_MAPPER.readValue(str, clazz);
  }

  /**
   * Returns a JSON representation of the provided value.
   *
   * @param value The value that will be converted to JSON
   * @param <T> The type of the {@code value}
   * @throws IOException if conversion fails
   */
  public static <T> String toJsonString(T value) throws IOException {
    return DEFAULT_JSON_MAPPER.writeValueAsString(value);
  }

  /**
   * Returns a JSON representation of the provided value, or an empty string if conversion fails.
   * This is a convenience function for cases like {@link Object#toString()}.
   */
  public static <T> String toJsonStringOrEmpty(T value) {
    try {
      return toJsonString(value);
    } catch (IOException e) {
      return "";
    }
  }

  /**
   * Returns the object represented by the provided JSON string.
   */
  public static <T> T fromJsonString(String str, Class<T> clazz) throws IOException {
    return DEFAULT_JSON_MAPPER.readValue(str, clazz);
  }
}
