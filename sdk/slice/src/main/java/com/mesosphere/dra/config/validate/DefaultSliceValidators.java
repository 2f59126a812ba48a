package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.ResourceSlice;

import java.util.Arrays;
import java.util.Collection;

/**
 * Catalog of {@link ConfigValidator}s which are run against every resource slice, in order.
 */
public final class DefaultSliceValidators {

  private DefaultSliceValidators() {
  }

  public static Collection<ConfigValidator<ResourceSlice>> getValidators() {
    return Arrays.asList(
        new ObjectMetaValidator(),
        new ResourceSliceSpecValidator(),
        new ConsumesCapacityFromCannotFormCycles(),
        new SliceFieldsCannotChange());
  }
}
