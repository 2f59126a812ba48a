package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.Map;

/**
 * The subset of object metadata which slices carry and which gets validated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ObjectMeta {

  private final String name;

  private final String generateName;

  private final Map<String, String> labels;

  private final Map<String, String> annotations;

  private final String resourceVersion;

  private final long generation;

  @JsonCreator
  private ObjectMeta(
      @JsonProperty("name") String name,
      @JsonProperty("generateName") String generateName,
      @JsonProperty("labels") Map<String, String> labels,
      @JsonProperty("annotations") Map<String, String> annotations,
      @JsonProperty("resourceVersion") String resourceVersion,
      @JsonProperty("generation") long generation)
  {
    this.name = name;
    this.generateName = generateName;
    this.labels = SpecCollections.copyOf(labels);
    this.annotations = SpecCollections.copyOf(annotations);
    this.resourceVersion = resourceVersion;
    this.generation = generation;
  }

  private ObjectMeta(Builder builder) {
    this(builder.name,
        builder.generateName,
        builder.labels,
        builder.annotations,
        builder.resourceVersion,
        builder.generation);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(ObjectMeta copy) {
    Builder builder = new Builder();
    builder.name = copy.name;
    builder.generateName = copy.generateName;
    builder.labels = copy.labels;
    builder.annotations = copy.annotations;
    builder.resourceVersion = copy.resourceVersion;
    builder.generation = copy.generation;
    return builder;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("generateName")
  public String getGenerateName() {
    return generateName;
  }

  @JsonProperty("labels")
  public Map<String, String> getLabels() {
    return labels;
  }

  @JsonProperty("annotations")
  public Map<String, String> getAnnotations() {
    return annotations;
  }

  @JsonProperty("resourceVersion")
  public String getResourceVersion() {
    return resourceVersion;
  }

  @JsonProperty("generation")
  @JsonInclude(JsonInclude.Include.NON_DEFAULT)
  public long getGeneration() {
    return generation;
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

  /**
   * {@link ObjectMeta} builder static inner class.
   */
  public static final class Builder {
    private String name;
    private String generateName;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private String resourceVersion;
    private long generation;

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder generateName(String generateName) {
      this.generateName = generateName;
      return this;
    }

    public Builder labels(Map<String, String> labels) {
      this.labels = labels;
      return this;
    }

    public Builder annotations(Map<String, String> annotations) {
      this.annotations = annotations;
      return this;
    }

    public Builder resourceVersion(String resourceVersion) {
      this.resourceVersion = resourceVersion;
      return this;
    }

    public Builder generation(long generation) {
      this.generation = generation;
      return this;
    }

    public ObjectMeta build() {
      return new ObjectMeta(this);
    }
  }
}
