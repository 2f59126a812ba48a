package com.mesosphere.dra.common;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods around construction of loggers.
 */
public final class LoggingUtils {

  private LoggingUtils() {
  }

  /**
   * Creates a logger which is tagged with the provided class.
   *
   * @param clazz the class using this logger
   */
  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz.getSimpleName());
  }

  /**
   * Creates a logger which is tagged with the provided class and the name of the slice being handled.
   *
   * @param clazz     the class using this logger
   * @param sliceName the name of the resource slice, omitted from the tag when blank
   */
  public static Logger getLogger(Class<?> clazz, String sliceName) {
    if (StringUtils.isBlank(sliceName)) {
      return getLogger(clazz);
    }
    return LoggerFactory.getLogger(String.format("(%s) %s", sliceName, clazz.getSimpleName()));
  }
}
