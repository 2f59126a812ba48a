package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;
import java.util.Map;

/**
 * A named pool of counters which devices in the same slice draw from.
 */
public final class CounterSet {

  private final String name;

  private final Map<String, Counter> counters;

  private final List<String> includes;

  @JsonCreator
  private CounterSet(
      @JsonProperty("name") String name,
      @JsonProperty("counters") Map<String, Counter> counters,
      @JsonProperty("includes") List<String> includes)
  {
    this.name = name;
    this.counters = SpecCollections.copyOf(counters);
    this.includes = SpecCollections.copyOf(includes);
  }

  public static CounterSet of(String name, Map<String, Counter> counters) {
    return new CounterSet(name, counters, null);
  }

  public static CounterSet of(String name, Map<String, Counter> counters, List<String> includes) {
    return new CounterSet(name, counters, includes);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("counters")
  public Map<String, Counter> getCounters() {
    return counters;
  }

  /**
   * Returns the names of the counter set mixins this counter set includes, in document order.
   */
  @JsonProperty("includes")
  public List<String> getIncludes() {
    return includes;
  }

  /**
   * Returns a copy of this counter set with the provided counters and no mixin includes.
   */
  public CounterSet withResolvedCounters(Map<String, Counter> resolvedCounters) {
    return new CounterSet(name, resolvedCounters, null);
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
