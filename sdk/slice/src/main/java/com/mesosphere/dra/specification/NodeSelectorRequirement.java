package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;

/**
 * A single {@code key operator values} match against node labels or fields. The operator is kept as written so that
 * unsupported operators can be reported rather than rejected while parsing.
 */
public final class NodeSelectorRequirement {

  public static final String OP_IN = "In";
  public static final String OP_NOT_IN = "NotIn";
  public static final String OP_EXISTS = "Exists";
  public static final String OP_DOES_NOT_EXIST = "DoesNotExist";
  public static final String OP_GT = "Gt";
  public static final String OP_LT = "Lt";

  private final String key;

  private final String operator;

  private final List<String> values;

  @JsonCreator
  private NodeSelectorRequirement(
      @JsonProperty("key") String key,
      @JsonProperty("operator") String operator,
      @JsonProperty("values") List<String> values)
  {
    this.key = key;
    this.operator = operator;
    this.values = SpecCollections.copyOf(values);
  }

  public static NodeSelectorRequirement of(String key, String operator, List<String> values) {
    return new NodeSelectorRequirement(key, operator, values);
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("operator")
  public String getOperator() {
    return operator;
  }

  @JsonProperty("values")
  public List<String> getValues() {
    return values;
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
