package com.mesosphere.dra.specification.mixin;

import com.mesosphere.dra.common.LoggingUtils;
import com.mesosphere.dra.specification.CounterSet;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceSpec;
import org.slf4j.Logger;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Produces the resolved form of a slice, in which every device, counter set and counter consumption carries the
 * fields of the mixins it includes and the mixins container itself is gone.
 */
public final class ResourceSliceResolver {

  private static final Logger LOGGER = LoggingUtils.getLogger(ResourceSliceResolver.class);

  private ResourceSliceResolver() {
    // do not instantiate
  }

  /**
   * Returns the resolved slice. A slice which declares no mixins is returned unchanged.
   */
  public static ResourceSlice resolve(ResourceSlice slice) {
    ResourceSliceSpec spec = slice.getSpec();
    if (spec.getMixins() == null) {
      return slice;
    }
    MixinTable table = MixinTable.of(spec.getMixins());
    ResourceSliceSpec resolvedSpec = ResourceSliceSpec.newBuilder(spec)
        .devices(map(spec.getDevices(), device -> MixinMerger.resolveDevice(device, table)))
        .sharedCounters(map(spec.getSharedCounters(), set -> MixinMerger.resolveCounterSet(set, table)))
        .mixins(null)
        .build();
    LOGGER.debug("Resolved mixins of slice '{}': {} device mixins, {} counter set mixins, "
            + "{} counter consumption mixins",
        slice.getMetadata().getName(),
        table.getDeviceMixinNames().size(),
        table.getCounterSetMixinNames().size(),
        table.getCounterConsumptionMixinNames().size());
    return slice.withSpec(resolvedSpec);
  }

  private static <T> List<T> map(List<T> items, Function<T, T> resolve) {
    return items == null ? null : items.stream()
        .map(item -> item == null ? null : resolve.apply(item))
        .collect(Collectors.toList());
  }
}
