package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.Map;

/**
 * A named set of attributes and capacity which devices include by name.
 */
public final class DeviceMixin {

  private final String name;

  private final Map<String, DeviceAttribute> attributes;

  private final Map<String, DeviceCapacity> capacity;

  @JsonCreator
  private DeviceMixin(
      @JsonProperty("name") String name,
      @JsonProperty("attributes") Map<String, DeviceAttribute> attributes,
      @JsonProperty("capacity") Map<String, DeviceCapacity> capacity)
  {
    this.name = name;
    this.attributes = SpecCollections.copyOf(attributes);
    this.capacity = SpecCollections.copyOf(capacity);
  }

  public static DeviceMixin of(
      String name, Map<String, DeviceAttribute> attributes, Map<String, DeviceCapacity> capacity)
  {
    return new DeviceMixin(name, attributes, capacity);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("attributes")
  public Map<String, DeviceAttribute> getAttributes() {
    return attributes;
  }

  @JsonProperty("capacity")
  public Map<String, DeviceCapacity> getCapacity() {
    return capacity;
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
