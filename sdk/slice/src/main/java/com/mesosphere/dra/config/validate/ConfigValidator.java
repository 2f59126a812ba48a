package com.mesosphere.dra.config.validate;

import java.util.Collection;
import java.util.Optional;

/**
 * The {@code ConfigValidator} interface should be implemented by any class which intends to
 * validate a new configuration document, either on its own, or w.r.t. a prior version of it.
 *
 * @param <C> the type of configuration to be validated
 */
public interface ConfigValidator<C> {
  /**
   * Returns the {@link ConfigValidationError}s found in the newly supplied configuration.
   *
   * A validator can validate a newConfig in the following ways:
   * 1. Validate newConfig against oldConfig. Ex: the driver of a slice cannot change.
   * 2. Validate just newConfig. Ex: the pool's resourceSliceCount is greater than zero.
   *
   * @param oldConfig Currently stored configuration, or empty if the document is being created
   * @param newConfig Proposed new configuration
   * @return List of errors, or an empty list if validation passed
   */
  Collection<ConfigValidationError> validate(Optional<C> oldConfig, C newConfig);
}
