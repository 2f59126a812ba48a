package com.mesosphere.dra.registry;

import com.mesosphere.dra.common.LoggingUtils;
import com.mesosphere.dra.config.validate.ConfigValidationError;
import com.mesosphere.dra.config.validate.ResourceSliceValidation;
import com.mesosphere.dra.framework.SliceFeatures;
import com.mesosphere.dra.specification.BasicDevice;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.ObjectMeta;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceSpec;
import com.mesosphere.dra.specification.SpecCollections;
import org.apache.commons.collections.CollectionUtils;
import org.slf4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lifecycle hooks for storing resource slices: preparing a slice before it gets created or updated, and validating
 * it afterwards.
 * <p>
 * When partitionable devices are disabled, the fields which belong to that feature are dropped from new slices. An
 * update keeps them if the stored slice already uses them, so that turning the feature off doesn't break existing
 * slices.
 */
public class ResourceSliceStrategy {

  private static final Logger LOGGER = LoggingUtils.getLogger(ResourceSliceStrategy.class);

  private final SliceFeatures features;

  public ResourceSliceStrategy(SliceFeatures features) {
    this.features = features;
  }

  /**
   * Returns the slice as it should be created: with generation 1 and without disabled fields.
   */
  public ResourceSlice prepareForCreate(ResourceSlice slice) {
    ResourceSlice prepared = slice.withMetadata(ObjectMeta.newBuilder(slice.getMetadata()).generation(1).build());
    if (features.isPartitionableDevicesEnabled()) {
      return prepared;
    }
    return dropPartitionableDevicesFields(prepared);
  }

  /**
   * Returns the slice as it should be stored in place of {@code oldSlice}. The generation is bumped when the spec
   * changes.
   */
  public ResourceSlice prepareForUpdate(ResourceSlice newSlice, ResourceSlice oldSlice) {
    ResourceSlice prepared = newSlice;
    if (!features.isPartitionableDevicesEnabled() && !partitionableDevicesInUse(oldSlice)) {
      prepared = dropPartitionableDevicesFields(prepared);
    }
    long oldGeneration = oldSlice.getMetadata().getGeneration();
    long generation = Objects.equals(prepared.getSpec(), oldSlice.getSpec()) ? oldGeneration : oldGeneration + 1;
    return prepared.withMetadata(ObjectMeta.newBuilder(prepared.getMetadata()).generation(generation).build());
  }

  public List<ConfigValidationError> validate(ResourceSlice slice) {
    return ResourceSliceValidation.validateCreate(slice);
  }

  public List<ConfigValidationError> validateUpdate(ResourceSlice newSlice, ResourceSlice oldSlice) {
    return ResourceSliceValidation.validateUpdate(newSlice, oldSlice);
  }

  /**
   * Returns whether the slice uses any field which belongs to partitionable devices.
   */
  public static boolean partitionableDevicesInUse(ResourceSlice slice) {
    ResourceSliceSpec spec = slice.getSpec();
    if (spec.getMixins() != null || CollectionUtils.isNotEmpty(spec.getSharedCounters())) {
      return true;
    }
    for (Device device : SpecCollections.orEmpty(spec.getDevices())) {
      if (device == null) {
        continue;
      }
      if (device.getComposite() != null) {
        return true;
      }
      BasicDevice basic = device.getBasic();
      if (basic != null &&
          (CollectionUtils.isNotEmpty(basic.getIncludes()) ||
              CollectionUtils.isNotEmpty(basic.getConsumesCounters())))
      {
        return true;
      }
    }
    return false;
  }

  private static ResourceSlice dropPartitionableDevicesFields(ResourceSlice slice) {
    if (!partitionableDevicesInUse(slice)) {
      return slice;
    }
    LOGGER.info("Partitionable devices are disabled, dropping mixins, shared counters, composite devices "
        + "and counter consumption from slice '{}'", slice.getMetadata().getName());
    ResourceSliceSpec spec = slice.getSpec();
    List<Device> devices = spec.getDevices() == null ? null : spec.getDevices().stream()
        .map(ResourceSliceStrategy::dropPartitionableDevicesFields)
        .collect(Collectors.toList());
    return slice.withSpec(ResourceSliceSpec.newBuilder(spec)
        .mixins(null)
        .sharedCounters(null)
        .devices(devices)
        .build());
  }

  private static Device dropPartitionableDevicesFields(Device device) {
    if (device == null) {
      return null;
    }
    BasicDevice basic = device.getBasic();
    if (basic != null) {
      basic = BasicDevice.newBuilder(basic).includes(null).consumesCounters(null).build();
    }
    return Device.of(device.getName(), basic, null);
  }
}
