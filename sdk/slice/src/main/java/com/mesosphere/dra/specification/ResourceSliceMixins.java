package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;

/**
 * The mixins declared by a resource slice, grouped by the kind of entity which may include them.
 */
public final class ResourceSliceMixins {

  private final List<DeviceMixin> device;

  private final List<CounterSetMixin> counterSet;

  private final List<DeviceCounterConsumptionMixin> deviceCounterConsumption;

  @JsonCreator
  private ResourceSliceMixins(
      @JsonProperty("device") List<DeviceMixin> device,
      @JsonProperty("counterSet") List<CounterSetMixin> counterSet,
      @JsonProperty("deviceCounterConsumption") List<DeviceCounterConsumptionMixin> deviceCounterConsumption)
  {
    this.device = SpecCollections.copyOf(device);
    this.counterSet = SpecCollections.copyOf(counterSet);
    this.deviceCounterConsumption = SpecCollections.copyOf(deviceCounterConsumption);
  }

  public static ResourceSliceMixins of(
      List<DeviceMixin> device,
      List<CounterSetMixin> counterSet,
      List<DeviceCounterConsumptionMixin> deviceCounterConsumption)
  {
    return new ResourceSliceMixins(device, counterSet, deviceCounterConsumption);
  }

  @JsonProperty("device")
  public List<DeviceMixin> getDevice() {
    return device;
  }

  @JsonProperty("counterSet")
  public List<CounterSetMixin> getCounterSet() {
    return counterSet;
  }

  @JsonProperty("deviceCounterConsumption")
  public List<DeviceCounterConsumptionMixin> getDeviceCounterConsumption() {
    return deviceCounterConsumption;
  }

  /**
   * Returns the number of mixins of all kinds.
   */
  @JsonIgnore
  public int getTotalCount() {
    return SpecCollections.size(device)
        + SpecCollections.size(counterSet)
        + SpecCollections.size(deviceCounterConsumption);
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
