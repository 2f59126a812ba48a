package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.CounterSet;
import com.mesosphere.dra.specification.CounterSetMixin;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.DeviceContent;
import com.mesosphere.dra.specification.DeviceContentKind;
import com.mesosphere.dra.specification.DeviceCounterConsumption;
import com.mesosphere.dra.specification.DeviceCounterConsumptionMixin;
import com.mesosphere.dra.specification.DeviceMixin;
import com.mesosphere.dra.specification.NodeSelectionMode;
import com.mesosphere.dra.specification.ResourcePool;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceMixins;
import com.mesosphere.dra.specification.ResourceSliceSpec;
import com.mesosphere.dra.specification.SpecCollections;
import com.mesosphere.dra.specification.mixin.MixinTable;
import com.mesosphere.dra.specification.validation.IdentifierValidation;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration validator which checks the content of a slice's spec on its own: the pool, the node selection, the
 * driver, the size limits, and the devices, counter sets and mixins along with every name they reference.
 * <p>
 * Includes are checked against the declared mixins but not merged; merging happens when the slice gets resolved.
 */
public class ResourceSliceSpecValidator implements ConfigValidator<ResourceSlice> {

  static final int MAX_DEVICES_AND_MIXINS = 128;
  static final int MAX_SHARED_COUNTERS = 8;
  static final int MAX_CONSUMES_CAPACITY_FROM = 1;
  static final int MAX_CONSUMES_COUNTERS = 2;

  static final String NODE_SELECTION_MESSAGE =
      "exactly one of `nodeName`, `nodeSelector`, or `allNodes` is required";
  static final String DEVICE_CONTENT_MESSAGE = "exactly one of `basic`, or `composite` is required";
  static final String UNKNOWN_DEVICE_MESSAGE = "must be the name of a device in the resource slice";
  static final String UNKNOWN_COUNTER_SET_MESSAGE = "must be the name of a counter set in the resource slice";

  private static final FieldPath SPEC = FieldPath.of("spec");

  @Override
  public Collection<ConfigValidationError> validate(Optional<ResourceSlice> oldConfig, ResourceSlice newConfig) {
    ResourceSliceSpec spec = newConfig.getSpec();
    MixinTable mixins = MixinTable.of(spec.getMixins());
    Set<String> deviceNames = names(spec.getDevices(), Device::getName);
    Set<String> counterSetNames = names(spec.getSharedCounters(), CounterSet::getName);

    List<ConfigValidationError> errors = new ArrayList<>();
    errors.addAll(validatePool(SPEC.child("pool"), spec.getPool()));
    errors.addAll(validateNodeSelection(spec));
    errors.addAll(validateDriver(SPEC.child("driver"), spec.getDriver()));

    int devicesAndMixins = SpecCollections.size(spec.getDevices())
        + (spec.getMixins() == null ? 0 : spec.getMixins().getTotalCount());
    if (devicesAndMixins > MAX_DEVICES_AND_MIXINS) {
      errors.add(ConfigValidationError.invalid(SPEC, devicesAndMixins, String.format(
          "the total number of devices and mixins must not exceed %d", MAX_DEVICES_AND_MIXINS)));
    }

    errors.addAll(validateDevices(SPEC.child("devices"), spec.getDevices(), mixins, deviceNames, counterSetNames));
    errors.addAll(validateSharedCounters(SPEC.child("sharedCounters"), spec.getSharedCounters(), mixins));
    errors.addAll(validateMixins(SPEC.child("mixins"), spec.getMixins()));
    return errors;
  }

  private static List<ConfigValidationError> validatePool(FieldPath path, ResourcePool pool) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (pool == null) {
      errors.add(ConfigValidationError.required(path, ""));
      return errors;
    }
    errors.addAll(IdentifierValidation.validatePoolName(path.child("name"), pool.getName()));
    if (pool.getResourceSliceCount() <= 0) {
      errors.add(ConfigValidationError.invalid(
          path.child("resourceSliceCount"), pool.getResourceSliceCount(), "must be greater than zero"));
    }
    if (pool.getGeneration() < 0) {
      errors.add(ConfigValidationError.invalid(
          path.child("generation"), pool.getGeneration(), "must be greater than or equal to zero"));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateNodeSelection(ResourceSliceSpec spec) {
    List<ConfigValidationError> errors = new ArrayList<>();
    Set<NodeSelectionMode> modes = spec.getNodeSelectionModes();
    if (modes.contains(NodeSelectionMode.NODE_NAME)) {
      errors.addAll(IdentifierValidation.validateSubdomain(SPEC.child("nodeName"), spec.getNodeName()));
    }
    if (modes.contains(NodeSelectionMode.NODE_SELECTOR)) {
      errors.addAll(NodeSelectorValidator.validate(SPEC.child("nodeSelector"), spec.getNodeSelector()));
    }
    if (modes.isEmpty()) {
      errors.add(ConfigValidationError.required(SPEC, NODE_SELECTION_MESSAGE));
    } else if (modes.size() > 1) {
      errors.add(ConfigValidationError.invalid(SPEC, null, NODE_SELECTION_MESSAGE));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateDriver(FieldPath path, String driver) {
    if (StringUtils.isEmpty(driver)) {
      List<ConfigValidationError> errors = new ArrayList<>();
      errors.add(ConfigValidationError.required(path, ""));
      return errors;
    }
    return IdentifierValidation.validateSubdomain(path, driver);
  }

  private static List<ConfigValidationError> validateDevices(
      FieldPath path,
      List<Device> devices,
      MixinTable mixins,
      Set<String> deviceNames,
      Set<String> counterSetNames)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    List<Device> all = SpecCollections.orEmpty(devices);
    for (int i = 0; i < all.size(); ++i) {
      Device device = all.get(i);
      FieldPath devicePath = path.index(i);
      if (device == null) {
        errors.add(ConfigValidationError.required(devicePath, ""));
        continue;
      }
      FieldPath namePath = devicePath.child("name");
      errors.addAll(IdentifierValidation.validateLabel(namePath, device.getName()));
      if (!seen.add(device.getName())) {
        errors.add(ConfigValidationError.duplicate(namePath, device.getName()));
      }

      Set<DeviceContentKind> kinds = device.getContentKinds();
      if (kinds.isEmpty()) {
        errors.add(ConfigValidationError.required(devicePath, DEVICE_CONTENT_MESSAGE));
      } else if (kinds.size() > 1) {
        errors.add(ConfigValidationError.invalid(devicePath, null, DEVICE_CONTENT_MESSAGE));
      }
      // Each kind present is checked, even when both are set.
      if (device.getBasic() != null) {
        errors.addAll(validateDeviceContent(
            devicePath.child(DeviceContentKind.BASIC.getFieldName()),
            device.getBasic(), mixins, deviceNames, counterSetNames));
      }
      if (device.getComposite() != null) {
        errors.addAll(validateDeviceContent(
            devicePath.child(DeviceContentKind.COMPOSITE.getFieldName()),
            device.getComposite(), mixins, deviceNames, counterSetNames));
      }
    }
    return errors;
  }

  private static List<ConfigValidationError> validateDeviceContent(
      FieldPath path,
      DeviceContent content,
      MixinTable mixins,
      Set<String> deviceNames,
      Set<String> counterSetNames)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    errors.addAll(SliceFieldValidation.validateAttributes(path.child("attributes"), content.getAttributes()));
    errors.addAll(SliceFieldValidation.validateCapacity(path.child("capacity"), content.getCapacity()));
    errors.addAll(SliceFieldValidation.validateAttributeAndCapacityCount(
        path, content.getAttributes(), content.getCapacity()));
    errors.addAll(SliceFieldValidation.validateIncludes(
        path.child("includes"), content.getIncludes(), mixins.getDeviceMixinNames()));
    if (content.getConsumesCapacityFrom() != null) {
      errors.addAll(SliceFieldValidation.validateReferences(
          path.child("consumesCapacityFrom"),
          content.getConsumesCapacityFrom(),
          MAX_CONSUMES_CAPACITY_FROM,
          deviceNames,
          UNKNOWN_DEVICE_MESSAGE));
    }
    errors.addAll(validateConsumesCounters(
        path.child("consumesCounters"), content.getConsumesCounters(), mixins, counterSetNames));
    return errors;
  }

  private static List<ConfigValidationError> validateConsumesCounters(
      FieldPath path,
      List<DeviceCounterConsumption> consumesCounters,
      MixinTable mixins,
      Set<String> counterSetNames)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (SpecCollections.size(consumesCounters) > MAX_CONSUMES_COUNTERS) {
      errors.add(ConfigValidationError.tooMany(path, consumesCounters.size(), MAX_CONSUMES_COUNTERS));
    }
    List<DeviceCounterConsumption> all = SpecCollections.orEmpty(consumesCounters);
    for (int i = 0; i < all.size(); ++i) {
      DeviceCounterConsumption consumption = all.get(i);
      FieldPath entryPath = path.index(i);
      if (consumption == null) {
        errors.add(ConfigValidationError.required(entryPath, ""));
        continue;
      }
      FieldPath counterSetPath = entryPath.child("counterSet");
      if (StringUtils.isEmpty(consumption.getCounterSet())) {
        errors.add(ConfigValidationError.required(counterSetPath, ""));
      } else {
        errors.addAll(IdentifierValidation.validateLabel(counterSetPath, consumption.getCounterSet()));
        if (!counterSetNames.contains(consumption.getCounterSet())) {
          errors.add(ConfigValidationError.invalid(
              counterSetPath, consumption.getCounterSet(), UNKNOWN_COUNTER_SET_MESSAGE));
        }
      }
      errors.addAll(SliceFieldValidation.validateCounters(entryPath.child("counters"), consumption.getCounters()));
      errors.addAll(SliceFieldValidation.validateIncludes(
          entryPath.child("includes"), consumption.getIncludes(), mixins.getCounterConsumptionMixinNames()));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateSharedCounters(
      FieldPath path, List<CounterSet> counterSets, MixinTable mixins)
  {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (SpecCollections.size(counterSets) > MAX_SHARED_COUNTERS) {
      errors.add(ConfigValidationError.tooMany(path, counterSets.size(), MAX_SHARED_COUNTERS));
    }
    Set<String> seen = new HashSet<>();
    List<CounterSet> all = SpecCollections.orEmpty(counterSets);
    for (int i = 0; i < all.size(); ++i) {
      CounterSet counterSet = all.get(i);
      FieldPath setPath = path.index(i);
      if (counterSet == null) {
        errors.add(ConfigValidationError.required(setPath, ""));
        continue;
      }
      FieldPath namePath = setPath.child("name");
      errors.addAll(IdentifierValidation.validateLabel(namePath, counterSet.getName()));
      if (!seen.add(counterSet.getName())) {
        errors.add(ConfigValidationError.duplicate(namePath, counterSet.getName()));
      }
      errors.addAll(SliceFieldValidation.validateCounters(setPath.child("counters"), counterSet.getCounters()));
      errors.addAll(SliceFieldValidation.validateIncludes(
          setPath.child("includes"), counterSet.getIncludes(), mixins.getCounterSetMixinNames()));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateMixins(FieldPath path, ResourceSliceMixins mixins) {
    List<ConfigValidationError> errors = new ArrayList<>();
    if (mixins == null) {
      return errors;
    }
    // Mixin names are unique across all kinds of mixins.
    Set<String> seen = new HashSet<>();

    List<DeviceMixin> deviceMixins = SpecCollections.orEmpty(mixins.getDevice());
    for (int i = 0; i < deviceMixins.size(); ++i) {
      DeviceMixin mixin = deviceMixins.get(i);
      FieldPath mixinPath = path.child("device").index(i);
      if (mixin == null) {
        errors.add(ConfigValidationError.required(mixinPath, ""));
        continue;
      }
      errors.addAll(validateMixinName(mixinPath.child("name"), mixin.getName(), seen));
      errors.addAll(SliceFieldValidation.validateAttributes(mixinPath.child("attributes"), mixin.getAttributes()));
      errors.addAll(SliceFieldValidation.validateCapacity(mixinPath.child("capacity"), mixin.getCapacity()));
      errors.addAll(SliceFieldValidation.validateAttributeAndCapacityCount(
          mixinPath, mixin.getAttributes(), mixin.getCapacity()));
    }

    List<CounterSetMixin> counterSetMixins = SpecCollections.orEmpty(mixins.getCounterSet());
    for (int i = 0; i < counterSetMixins.size(); ++i) {
      CounterSetMixin mixin = counterSetMixins.get(i);
      FieldPath mixinPath = path.child("counterSet").index(i);
      if (mixin == null) {
        errors.add(ConfigValidationError.required(mixinPath, ""));
        continue;
      }
      errors.addAll(validateMixinName(mixinPath.child("name"), mixin.getName(), seen));
      errors.addAll(SliceFieldValidation.validateCounters(mixinPath.child("counters"), mixin.getCounters()));
    }

    List<DeviceCounterConsumptionMixin> consumptionMixins =
        SpecCollections.orEmpty(mixins.getDeviceCounterConsumption());
    for (int i = 0; i < consumptionMixins.size(); ++i) {
      DeviceCounterConsumptionMixin mixin = consumptionMixins.get(i);
      FieldPath mixinPath = path.child("deviceCounterConsumption").index(i);
      if (mixin == null) {
        errors.add(ConfigValidationError.required(mixinPath, ""));
        continue;
      }
      errors.addAll(validateMixinName(mixinPath.child("name"), mixin.getName(), seen));
      errors.addAll(SliceFieldValidation.validateCounters(mixinPath.child("counters"), mixin.getCounters()));
    }
    return errors;
  }

  private static List<ConfigValidationError> validateMixinName(FieldPath path, String name, Set<String> seen) {
    List<ConfigValidationError> errors = new ArrayList<>(IdentifierValidation.validateLabel(path, name));
    if (!seen.add(name)) {
      errors.add(ConfigValidationError.duplicate(path, name));
    }
    return errors;
  }

  /**
   * Returns the names of the non-{@code null} items. {@code null} items are reported by the per-item checks.
   */
  private static <T> Set<String> names(List<T> items, Function<T, String> getName) {
    Set<String> names = new LinkedHashSet<>();
    for (T item : SpecCollections.orEmpty(items)) {
      if (item != null) {
        names.add(getName.apply(item));
      }
    }
    return names;
  }
}
