package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;
import java.util.Map;

/**
 * A device which may additionally draw its capacity from another device in the same slice, e.g. a partition of a
 * larger accelerator.
 */
public final class CompositeDevice extends DeviceContent {

  private final List<String> consumesCapacityFrom;

  @JsonCreator
  private CompositeDevice(
      @JsonProperty("attributes") Map<String, DeviceAttribute> attributes,
      @JsonProperty("capacity") Map<String, DeviceCapacity> capacity,
      @JsonProperty("consumesCounters") List<DeviceCounterConsumption> consumesCounters,
      @JsonProperty("includes") List<String> includes,
      @JsonProperty("consumesCapacityFrom") List<String> consumesCapacityFrom)
  {
    super(attributes, capacity, consumesCounters, includes);
    this.consumesCapacityFrom = SpecCollections.copyOf(consumesCapacityFrom);
  }

  private CompositeDevice(Builder builder) {
    this(builder.attributes,
        builder.capacity,
        builder.consumesCounters,
        builder.includes,
        builder.consumesCapacityFrom);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(CompositeDevice copy) {
    Builder builder = new Builder();
    builder.attributes = copy.getAttributes();
    builder.capacity = copy.getCapacity();
    builder.consumesCounters = copy.getConsumesCounters();
    builder.includes = copy.getIncludes();
    builder.consumesCapacityFrom = copy.getConsumesCapacityFrom();
    return builder;
  }

  @Override
  public DeviceContentKind getKind() {
    return DeviceContentKind.COMPOSITE;
  }

  @JsonProperty("consumesCapacityFrom")
  @Override
  public List<String> getConsumesCapacityFrom() {
    return consumesCapacityFrom;
  }

  @Override
  public CompositeDevice withResolvedFields(
      Map<String, DeviceAttribute> resolvedAttributes,
      Map<String, DeviceCapacity> resolvedCapacity,
      List<DeviceCounterConsumption> resolvedConsumesCounters)
  {
    return newBuilder(this)
        .attributes(resolvedAttributes)
        .capacity(resolvedCapacity)
        .consumesCounters(resolvedConsumesCounters)
        .includes(null)
        .build();
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o, false, DeviceContent.class);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(17, 37, this, false, DeviceContent.class);
  }

  @Override
  public String toString() {
    return ToStringBuilder.reflectionToString(this);
  }

  /**
   * {@link CompositeDevice} builder static inner class.
   */
  public static final class Builder {
    private Map<String, DeviceAttribute> attributes;
    private Map<String, DeviceCapacity> capacity;
    private List<DeviceCounterConsumption> consumesCounters;
    private List<String> includes;
    private List<String> consumesCapacityFrom;

    private Builder() {
    }

    public Builder attributes(Map<String, DeviceAttribute> attributes) {
      this.attributes = attributes;
      return this;
    }

    public Builder capacity(Map<String, DeviceCapacity> capacity) {
      this.capacity = capacity;
      return this;
    }

    public Builder consumesCounters(List<DeviceCounterConsumption> consumesCounters) {
      this.consumesCounters = consumesCounters;
      return this;
    }

    public Builder includes(List<String> includes) {
      this.includes = includes;
      return this;
    }

    public Builder consumesCapacityFrom(List<String> consumesCapacityFrom) {
      this.consumesCapacityFrom = consumesCapacityFrom;
      return this;
    }

    public CompositeDevice build() {
      return new CompositeDevice(this);
    }
  }
}
