package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Fields shared by every kind of device content. Maps and lists are {@code null} when absent from the document.
 */
public abstract class DeviceContent {

  private final Map<String, DeviceAttribute> attributes;

  private final Map<String, DeviceCapacity> capacity;

  private final List<DeviceCounterConsumption> consumesCounters;

  private final List<String> includes;

  protected DeviceContent(
      Map<String, DeviceAttribute> attributes,
      Map<String, DeviceCapacity> capacity,
      List<DeviceCounterConsumption> consumesCounters,
      List<String> includes)
  {
    this.attributes = SpecCollections.copyOf(attributes);
    this.capacity = SpecCollections.copyOf(capacity);
    this.consumesCounters = SpecCollections.copyOf(consumesCounters);
    this.includes = SpecCollections.copyOf(includes);
  }

  @JsonIgnore
  public abstract DeviceContentKind getKind();

  /**
   * Returns the names of the devices whose capacity this device draws from, or {@code null} if none are listed.
   */
  public abstract List<String> getConsumesCapacityFrom();

  /**
   * Returns a copy of this content of the same kind, carrying the provided resolved fields and no mixin includes.
   */
  public abstract DeviceContent withResolvedFields(
      Map<String, DeviceAttribute> resolvedAttributes,
      Map<String, DeviceCapacity> resolvedCapacity,
      List<DeviceCounterConsumption> resolvedConsumesCounters);

  @JsonProperty("attributes")
  public Map<String, DeviceAttribute> getAttributes() {
    return attributes;
  }

  @JsonProperty("capacity")
  public Map<String, DeviceCapacity> getCapacity() {
    return capacity;
  }

  @JsonProperty("consumesCounters")
  public List<DeviceCounterConsumption> getConsumesCounters() {
    return consumesCounters;
  }

  /**
   * Returns the names of the device mixins this content includes, in document order.
   */
  @JsonProperty("includes")
  public List<String> getIncludes() {
    return includes;
  }
}
