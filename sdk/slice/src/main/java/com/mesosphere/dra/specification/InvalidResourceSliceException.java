package com.mesosphere.dra.specification;

import com.mesosphere.dra.config.validate.ConfigValidationError;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * This class is an Exception to be used when a resource slice document was parsed successfully but failed
 * validation. It carries every error which was found.
 */
public class InvalidResourceSliceException extends Exception {

  private final List<ConfigValidationError> errors;

  public InvalidResourceSliceException(String sliceName, Collection<ConfigValidationError> errors) {
    super(String.format("Resource slice '%s' failed validation with %d error%s:%n%s",
        sliceName,
        errors.size(),
        errors.size() == 1 ? "" : "s",
        errors.stream().map(ConfigValidationError::toString).collect(Collectors.joining("\n"))));
    this.errors = Collections.unmodifiableList(errors.stream().collect(Collectors.toList()));
  }

  public List<ConfigValidationError> getErrors() {
    return errors;
  }
}
