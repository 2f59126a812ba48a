package com.mesosphere.dra.framework;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for grabbing values from a mapping of flag values (typically the process env).
 */
public class EnvStore {
  /**
   * Exception which is thrown when failing to retrieve or parse a given flag value.
   */
  public static class ConfigException extends RuntimeException {

    /**
     * A machine-accessible error type.
     */
    public enum Type {
      NOT_FOUND,
      INVALID_VALUE
    }

    private final Type type;

    private ConfigException(Type type, String message) {
      super(message);
      this.type = type;
    }

    private static ConfigException notFound(String message) {
      return new ConfigException(Type.NOT_FOUND, message);
    }

    private static ConfigException invalidValue(String message) {
      return new ConfigException(Type.INVALID_VALUE, message);
    }

    public Type getType() {
      return type;
    }

    @Override
    public String getMessage() {
      return String.format("%s (errtype: %s)", super.getMessage(), type);
    }
  }

  private final Map<String, String> envMap;

  EnvStore(Map<String, String> envMap) {
    this.envMap = new HashMap<>(envMap);
  }

  public static EnvStore fromEnv() {
    return new EnvStore(System.getenv());
  }

  public static EnvStore fromMap(Map<String, String> envMap) {
    return new EnvStore(envMap);
  }

  public int getOptionalInt(String envKey, int defaultValue) {
    return toInt(envKey, getOptional(envKey, String.valueOf(defaultValue)));
  }

  public boolean getOptionalBoolean(String envKey, boolean defaultValue) {
    return toBoolean(envKey, getOptional(envKey, String.valueOf(defaultValue)));
  }

  /**
   * List of comma-separated strings. Any whitespace is cleaned up automatically.
   */
  public List<String> getOptionalStringList(String envKey, List<String> defaultValue) {
    return Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .splitToList(getOptional(envKey, Joiner.on(',').join(defaultValue)));
  }

  /**
   * Returns the requested value if set, or {@code defaultValue} if it's missing from the map entirely.
   */
  public String getOptional(String envKey, String defaultValue) {
    String value = envMap.get(envKey);
    return (value == null) ? defaultValue : value;
  }

  /**
   * Returns the requested value if set, or throws an exception if it's missing from the map entirely.
   */
  public String getRequired(String envKey) {
    String value = envMap.get(envKey);
    if (value == null) {
      throw ConfigException.notFound(String.format("Missing required environment variable: %s", envKey));
    }
    return value;
  }

  public boolean isPresent(String envKey) {
    return envMap.containsKey(envKey);
  }

  private static int toInt(String envKey, String envVal) {
    try {
      return Integer.parseInt(envVal);
    } catch (NumberFormatException e) {
      throw ConfigException.invalidValue(String.format(
          "Failed to parse configured environment variable '%s' as an integer: %s", envKey, envVal));
    }
  }

  private static boolean toBoolean(String envKey, String envVal) {
    if (StringUtils.isBlank(envVal)) {
      // Treat empty or whitespace-only envvar as false
      return false;
    }
    switch (envVal.trim().charAt(0)) {
      case 't':
      case 'T':
      case 'y':
      case 'Y':
        // true: "[tT]rue" and "[yY]es"
        return true;
      case 'f':
      case 'F':
      case 'n':
      case 'N':
        // false: "[fF]alse" and "[nN]o"
        return false;
      default:
        throw ConfigException.invalidValue(String.format(
            "Failed to parse configured environment variable '%s' as a boolean: %s", envKey, envVal));
    }
  }
}
