package com.mesosphere.dra.specification.mixin;

import com.mesosphere.dra.specification.Counter;
import com.mesosphere.dra.specification.CounterSet;
import com.mesosphere.dra.specification.CounterSetMixin;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.DeviceAttribute;
import com.mesosphere.dra.specification.DeviceCapacity;
import com.mesosphere.dra.specification.DeviceContent;
import com.mesosphere.dra.specification.DeviceCounterConsumption;
import com.mesosphere.dra.specification.DeviceCounterConsumptionMixin;
import com.mesosphere.dra.specification.DeviceMixin;
import com.mesosphere.dra.specification.SpecCollections;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Flattens the mixins included by devices, counter sets and counter consumptions into the entities themselves.
 * <p>
 * For an entity with includes {@code [m1, ..., mk]} and own fields {@code F}, each resolved map is built by layering
 * {@code m1} through {@code mk} in document order and then {@code F} on top, so a later mixin overrides an earlier
 * one and the entity's own keys override every mixin. Includes which name no mixin are skipped here; they are
 * reported by validation. Maps which end up empty are returned as {@code null}. Inputs are never modified.
 */
public final class MixinMerger {

  private MixinMerger() {
    // do not instantiate
  }

  /**
   * Returns the device with its content's attributes, capacity and counter consumptions resolved. Devices without
   * exactly one kind of content are returned as-is.
   */
  public static Device resolveDevice(Device device, MixinTable table) {
    Optional<DeviceContent> content = device.getContent();
    if (!content.isPresent()) {
      return device;
    }
    DeviceContent in = content.get();
    List<String> includes = in.getIncludes();
    Map<String, DeviceAttribute> attributes =
        merge(includes, name -> table.getDeviceMixin(name).map(DeviceMixin::getAttributes), in.getAttributes());
    Map<String, DeviceCapacity> capacity =
        merge(includes, name -> table.getDeviceMixin(name).map(DeviceMixin::getCapacity), in.getCapacity());

    List<DeviceCounterConsumption> consumesCounters = null;
    if (in.getConsumesCounters() != null) {
      consumesCounters = new ArrayList<>();
      for (DeviceCounterConsumption consumption : in.getConsumesCounters()) {
        consumesCounters.add(consumption == null ? null : resolveCounterConsumption(consumption, table));
      }
    }
    return device.withContent(in.withResolvedFields(attributes, capacity, consumesCounters));
  }

  public static CounterSet resolveCounterSet(CounterSet counterSet, MixinTable table) {
    return counterSet.withResolvedCounters(merge(
        counterSet.getIncludes(),
        name -> table.getCounterSetMixin(name).map(CounterSetMixin::getCounters),
        counterSet.getCounters()));
  }

  public static DeviceCounterConsumption resolveCounterConsumption(
      DeviceCounterConsumption consumption, MixinTable table)
  {
    return consumption.withResolvedCounters(merge(
        consumption.getIncludes(),
        name -> table.getCounterConsumptionMixin(name).map(DeviceCounterConsumptionMixin::getCounters),
        consumption.getCounters()));
  }

  /**
   * Layers the maps of the included mixins in order, then the entity's own map. Returns {@code null} if the result
   * is empty.
   *
   * @param includes names of the included mixins, may be {@code null}
   * @param lookup returns the map which the named mixin contributes, or empty if there's no such mixin
   * @param own the entity's own map, may be {@code null}
   */
  public static <V> Map<String, V> merge(
      List<String> includes,
      Function<String, Optional<Map<String, V>>> lookup,
      Map<String, V> own)
  {
    Map<String, V> merged = new LinkedHashMap<>();
    for (String include : SpecCollections.orEmpty(includes)) {
      lookup.apply(include).ifPresent(layer -> merged.putAll(SpecCollections.orEmpty(layer)));
    }
    merged.putAll(SpecCollections.orEmpty(own));
    return merged.isEmpty() ? null : merged;
  }
}
