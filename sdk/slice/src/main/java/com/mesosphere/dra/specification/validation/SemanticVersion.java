package com.mesosphere.dra.specification.validation;

import java.util.regex.Pattern;

/**
 * Checks strings against the semver.org 2.0.0 grammar.
 */
public final class SemanticVersion {

  private static final Pattern SEMVER_PATTERN = Pattern.compile(
      "(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
          + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
          + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?");

  private SemanticVersion() {
    // do not instantiate
  }

  public static boolean isValid(String version) {
    return version != null && SEMVER_PATTERN.matcher(version).matches();
  }
}
