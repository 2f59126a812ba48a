package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;

/**
 * A set of requirements which must all hold for a node to match.
 */
public final class NodeSelectorTerm {

  private final List<NodeSelectorRequirement> matchExpressions;

  private final List<NodeSelectorRequirement> matchFields;

  @JsonCreator
  private NodeSelectorTerm(
      @JsonProperty("matchExpressions") List<NodeSelectorRequirement> matchExpressions,
      @JsonProperty("matchFields") List<NodeSelectorRequirement> matchFields)
  {
    this.matchExpressions = SpecCollections.copyOf(matchExpressions);
    this.matchFields = SpecCollections.copyOf(matchFields);
  }

  public static NodeSelectorTerm of(
      List<NodeSelectorRequirement> matchExpressions, List<NodeSelectorRequirement> matchFields)
  {
    return new NodeSelectorTerm(matchExpressions, matchFields);
  }

  @JsonProperty("matchExpressions")
  public List<NodeSelectorRequirement> getMatchExpressions() {
    return matchExpressions;
  }

  @JsonProperty("matchFields")
  public List<NodeSelectorRequirement> getMatchFields() {
    return matchFields;
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
