package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.ResourcePool;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration validator which validates that the driver, the node selection and the pool name of a slice cannot
 * change once the slice exists.
 * <p>
 * A driver which needs different values has to delete the slice and create a new one.
 */
public class SliceFieldsCannotChange implements ConfigValidator<ResourceSlice> {

  static final String IMMUTABLE_FIELD_MESSAGE = "field is immutable";

  private static final FieldPath SPEC = FieldPath.of("spec");

  @Override
  public Collection<ConfigValidationError> validate(Optional<ResourceSlice> oldConfig, ResourceSlice newConfig) {
    if (!oldConfig.isPresent()) {
      return Collections.emptyList();
    }

    ResourceSliceSpec oldSpec = oldConfig.get().getSpec();
    ResourceSliceSpec newSpec = newConfig.getSpec();
    List<ConfigValidationError> errors = new ArrayList<>();
    checkUnchanged(errors, SPEC.child("driver"), oldSpec.getDriver(), newSpec.getDriver());
    checkUnchanged(errors, SPEC.child("nodeName"), oldSpec.getNodeName(), newSpec.getNodeName());
    checkUnchanged(errors, SPEC.child("nodeSelector"), oldSpec.getNodeSelector(), newSpec.getNodeSelector());
    checkUnchanged(errors, SPEC.child("allNodes"), oldSpec.isAllNodes(), newSpec.isAllNodes());
    checkUnchanged(errors, SPEC.child("pool", "name"), poolName(oldSpec.getPool()), poolName(newSpec.getPool()));
    return errors;
  }

  private static void checkUnchanged(
      List<ConfigValidationError> errors, FieldPath path, Object oldValue, Object newValue)
  {
    if (!Objects.equals(oldValue, newValue)) {
      errors.add(ConfigValidationError.transitionError(path, oldValue, newValue, IMMUTABLE_FIELD_MESSAGE));
    }
  }

  private static String poolName(ResourcePool pool) {
    return pool == null ? null : pool.getName();
  }
}
