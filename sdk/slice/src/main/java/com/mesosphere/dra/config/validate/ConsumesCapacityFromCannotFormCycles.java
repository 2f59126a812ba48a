package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.graph.CycleDetector;
import com.mesosphere.dra.specification.graph.DeviceReferenceGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Configuration validator which validates that no device of a slice ends up consuming capacity from itself, directly
 * or through other devices. One error is produced per cycle.
 */
public class ConsumesCapacityFromCannotFormCycles implements ConfigValidator<ResourceSlice> {

  private static final FieldPath DEVICES = FieldPath.of("spec", "devices");

  @Override
  public Collection<ConfigValidationError> validate(Optional<ResourceSlice> oldConfig, ResourceSlice newConfig) {
    DeviceReferenceGraph graph = DeviceReferenceGraph.build(newConfig.getSpec().getDevices());
    List<ConfigValidationError> errors = new ArrayList<>();
    for (List<String> cycle : CycleDetector.findCycles(graph)) {
      errors.add(ConfigValidationError.invalid(DEVICES, "", String.format(
          "`consumesCapacityFrom` references can not form cycle. Found cycle: %s", String.join(" -> ", cycle))));
    }
    return errors;
  }
}
