package com.mesosphere.dra.framework;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Feature toggles which affect which resource slice fields are accepted. Presented as an immutable object which is
 * handed to the components that need it, rather than being consulted as global state.
 */
public final class SliceFeatures {

  /**
   * Envvar which enables partitionable devices: composite devices, shared counters, counter consumption and mixins.
   */
  public static final String PARTITIONABLE_DEVICES_ENV = "DRA_PARTITIONABLE_DEVICES";

  private static final boolean DEFAULT_PARTITIONABLE_DEVICES = false;

  private final boolean partitionableDevices;

  private SliceFeatures(boolean partitionableDevices) {
    this.partitionableDevices = partitionableDevices;
  }

  public static SliceFeatures fromEnv() {
    return fromEnvStore(EnvStore.fromEnv());
  }

  public static SliceFeatures fromEnvStore(EnvStore envStore) {
    return new SliceFeatures(
        envStore.getOptionalBoolean(PARTITIONABLE_DEVICES_ENV, DEFAULT_PARTITIONABLE_DEVICES));
  }

  public static SliceFeatures withPartitionableDevices(boolean enabled) {
    return new SliceFeatures(enabled);
  }

  public boolean isPartitionableDevicesEnabled() {
    return partitionableDevices;
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(this);
  }

  @Override
  public String toString() {
    return ToStringBuilder.reflectionToString(this);
  }
}
