package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Describes the pool which a slice belongs to. All slices of a pool share the pool's name and generation.
 */
public final class ResourcePool {

  private final String name;

  private final long generation;

  private final long resourceSliceCount;

  @JsonCreator
  private ResourcePool(
      @JsonProperty("name") String name,
      @JsonProperty("generation") long generation,
      @JsonProperty("resourceSliceCount") long resourceSliceCount)
  {
    this.name = name;
    this.generation = generation;
    this.resourceSliceCount = resourceSliceCount;
  }

  public static ResourcePool of(String name, long generation, long resourceSliceCount) {
    return new ResourcePool(name, generation, resourceSliceCount);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("generation")
  public long getGeneration() {
    return generation;
  }

  @JsonProperty("resourceSliceCount")
  public long getResourceSliceCount() {
    return resourceSliceCount;
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
