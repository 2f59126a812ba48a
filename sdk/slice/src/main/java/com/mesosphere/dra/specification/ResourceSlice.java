package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mesosphere.dra.config.SerializationUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * A resource slice document: object metadata plus the devices advertised by one driver for one pool.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResourceSlice {

  private final ObjectMeta metadata;

  private final ResourceSliceSpec spec;

  @JsonCreator
  private ResourceSlice(
      @JsonProperty("metadata") ObjectMeta metadata,
      @JsonProperty("spec") ResourceSliceSpec spec)
  {
    this.metadata = metadata == null ? ObjectMeta.newBuilder().build() : metadata;
    this.spec = spec == null ? ResourceSliceSpec.newBuilder().build() : spec;
  }

  public static ResourceSlice of(ObjectMeta metadata, ResourceSliceSpec spec) {
    return new ResourceSlice(metadata, spec);
  }

  @JsonProperty("metadata")
  public ObjectMeta getMetadata() {
    return metadata;
  }

  @JsonProperty("spec")
  public ResourceSliceSpec getSpec() {
    return spec;
  }

  public ResourceSlice withMetadata(ObjectMeta newMetadata) {
    return new ResourceSlice(newMetadata, spec);
  }

  public ResourceSlice withSpec(ResourceSliceSpec newSpec) {
    return new ResourceSlice(metadata, newSpec);
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
    return SerializationUtils.toJsonStringOrEmpty(this);
  }
}
