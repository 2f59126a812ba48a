package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.common.LoggingUtils;
import com.mesosphere.dra.specification.ResourceSlice;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry points for validating resource slices. Every validator in {@link DefaultSliceValidators} runs, and their
 * errors are returned together in the order in which they were found.
 */
public final class ResourceSliceValidation {

  private ResourceSliceValidation() {
    // do not instantiate
  }

  /**
   * Validates a slice which is being created.
   *
   * @return List of errors, or an empty list if validation passed
   */
  public static List<ConfigValidationError> validateCreate(ResourceSlice slice) {
    return validate(Optional.empty(), slice, DefaultSliceValidators.getValidators());
  }

  /**
   * Validates an updated slice, on its own and against the version it replaces.
   *
   * @return List of errors, or an empty list if validation passed
   */
  public static List<ConfigValidationError> validateUpdate(ResourceSlice newSlice, ResourceSlice oldSlice) {
    return validate(Optional.of(oldSlice), newSlice, DefaultSliceValidators.getValidators());
  }

  static List<ConfigValidationError> validate(
      Optional<ResourceSlice> oldSlice,
      ResourceSlice newSlice,
      Collection<ConfigValidator<ResourceSlice>> validators)
  {
    Logger logger = LoggingUtils.getLogger(ResourceSliceValidation.class, newSlice.getMetadata().getName());
    List<ConfigValidationError> errors = new ArrayList<>();
    for (ConfigValidator<ResourceSlice> validator : validators) {
      errors.addAll(validator.validate(oldSlice, newSlice));
    }

    String action = oldSlice.isPresent() ? "update" : "create";
    if (errors.isEmpty()) {
      logger.info("Resource slice {} passed validation", action);
    } else {
      logger.warn("Resource slice {} failed validation with {} error{}:", action, errors.size(),
          errors.size() == 1 ? "" : "s");
      for (ConfigValidationError error : errors) {
        logger.warn("  {}", error);
      }
    }
    return errors;
  }
}
