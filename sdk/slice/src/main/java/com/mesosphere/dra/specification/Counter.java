package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * A single named amount within a counter set or a counter consumption.
 */
public final class Counter {

  private final Quantity value;

  @JsonCreator
  private Counter(@JsonProperty("value") Quantity value) {
    this.value = value;
  }

  public static Counter of(Quantity value) {
    return new Counter(value);
  }

  public static Counter of(String value) {
    return new Counter(Quantity.parse(value));
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
