package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.Map;

/**
 * A named set of counters which counter sets include by name.
 */
public final class CounterSetMixin {

  private final String name;

  private final Map<String, Counter> counters;

  @JsonCreator
  private CounterSetMixin(
      @JsonProperty("name") String name,
      @JsonProperty("counters") Map<String, Counter> counters)
  {
    this.name = name;
    this.counters = SpecCollections.copyOf(counters);
  }

  public static CounterSetMixin of(String name, Map<String, Counter> counters) {
    return new CounterSetMixin(name, counters);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("counters")
  public Map<String, Counter> getCounters() {
    return counters;
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
