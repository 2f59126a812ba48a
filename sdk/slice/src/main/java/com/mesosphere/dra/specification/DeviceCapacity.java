package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * The amount of a capacity which a device provides, e.g. memory.
 */
public final class DeviceCapacity {

  private final Quantity value;

  @JsonCreator
  private DeviceCapacity(@JsonProperty("value") Quantity value) {
    this.value = value;
  }

  public static DeviceCapacity of(Quantity value) {
    return new DeviceCapacity(value);
  }

  public static DeviceCapacity of(String value) {
    return new DeviceCapacity(Quantity.parse(value));
  }

  @JsonProperty("value")
  public Quantity getValue() {
    return value;
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
    return String.valueOf(value);
  }
}
