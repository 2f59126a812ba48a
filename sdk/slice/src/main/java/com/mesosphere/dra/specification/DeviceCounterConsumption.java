package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;
import java.util.Map;

/**
 * The counters which a device draws from one {@link CounterSet} when it gets allocated.
 */
public final class DeviceCounterConsumption {

  private final String counterSet;

  private final Map<String, Counter> counters;

  private final List<String> includes;

  @JsonCreator
  private DeviceCounterConsumption(
      @JsonProperty("counterSet") String counterSet,
      @JsonProperty("counters") Map<String, Counter> counters,
      @JsonProperty("includes") List<String> includes)
  {
    this.counterSet = counterSet;
    this.counters = SpecCollections.copyOf(counters);
    this.includes = SpecCollections.copyOf(includes);
  }

  public static DeviceCounterConsumption of(String counterSet, Map<String, Counter> counters) {
    return new DeviceCounterConsumption(counterSet, counters, null);
  }

  public static DeviceCounterConsumption of(String counterSet, Map<String, Counter> counters, List<String> includes) {
    return new DeviceCounterConsumption(counterSet, counters, includes);
  }

  @JsonProperty("counterSet")
  public String getCounterSet() {
    return counterSet;
  }

  @JsonProperty("counters")
  public Map<String, Counter> getCounters() {
    return counters;
  }

  /**
   * Returns the names of the counter consumption mixins this entry includes, in document order.
   */
  @JsonProperty("includes")
  public List<String> getIncludes() {
    return includes;
  }

  /**
   * Returns a copy of this entry with the provided counters and no mixin includes.
   */
  public DeviceCounterConsumption withResolvedCounters(Map<String, Counter> resolvedCounters) {
    return new DeviceCounterConsumption(counterSet, resolvedCounters, null);
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
