package com.mesosphere.dra.specification.mixin;

import com.mesosphere.dra.specification.CounterSetMixin;
import com.mesosphere.dra.specification.DeviceCounterConsumptionMixin;
import com.mesosphere.dra.specification.DeviceMixin;
import com.mesosphere.dra.specification.ResourceSliceMixins;
import com.mesosphere.dra.specification.SpecCollections;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Name lookup over the mixins declared by one slice. When several mixins of a kind share a name, the first one
 * declared is the one which is found.
 */
public final class MixinTable {

  private static final MixinTable EMPTY = new MixinTable(null);

  private final Map<String, DeviceMixin> deviceMixins;
  private final Map<String, CounterSetMixin> counterSetMixins;
  private final Map<String, DeviceCounterConsumptionMixin> counterConsumptionMixins;

  private MixinTable(ResourceSliceMixins mixins) {
    if (mixins == null) {
      this.deviceMixins = Collections.emptyMap();
      this.counterSetMixins = Collections.emptyMap();
      this.counterConsumptionMixins = Collections.emptyMap();
    } else {
      this.deviceMixins = index(mixins.getDevice(), DeviceMixin::getName);
      this.counterSetMixins = index(mixins.getCounterSet(), CounterSetMixin::getName);
      this.counterConsumptionMixins =
          index(mixins.getDeviceCounterConsumption(), DeviceCounterConsumptionMixin::getName);
    }
  }

  public static MixinTable of(ResourceSliceMixins mixins) {
    return mixins == null ? EMPTY : new MixinTable(mixins);
  }

  public static MixinTable empty() {
    return EMPTY;
  }

  public Optional<DeviceMixin> getDeviceMixin(String name) {
    return Optional.ofNullable(deviceMixins.get(name));
  }

  public Optional<CounterSetMixin> getCounterSetMixin(String name) {
    return Optional.ofNullable(counterSetMixins.get(name));
  }

  public Optional<DeviceCounterConsumptionMixin> getCounterConsumptionMixin(String name) {
    return Optional.ofNullable(counterConsumptionMixins.get(name));
  }

  public Set<String> getDeviceMixinNames() {
    return deviceMixins.keySet();
  }

  public Set<String> getCounterSetMixinNames() {
    return counterSetMixins.keySet();
  }

  public Set<String> getCounterConsumptionMixinNames() {
    return counterConsumptionMixins.keySet();
  }

  private static <M> Map<String, M> index(List<M> mixins, Function<M, String> getName) {
    Map<String, M> byName = new LinkedHashMap<>();
    for (M mixin : SpecCollections.orEmpty(mixins)) {
      if (mixin != null) {
        byName.putIfAbsent(getName.apply(mixin), mixin);
      }
    }
    return Collections.unmodifiableMap(byName);
  }
}
