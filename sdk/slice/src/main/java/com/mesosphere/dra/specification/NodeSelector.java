package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import java.util.List;

/**
 * Selects the nodes which can reach the devices of a slice. The terms are ORed together.
 */
public final class NodeSelector {

  private final List<NodeSelectorTerm> nodeSelectorTerms;

  @JsonCreator
  private NodeSelector(@JsonProperty("nodeSelectorTerms") List<NodeSelectorTerm> nodeSelectorTerms) {
    this.nodeSelectorTerms = SpecCollections.copyOf(nodeSelectorTerms);
  }

  public static NodeSelector of(List<NodeSelectorTerm> nodeSelectorTerms) {
    return new NodeSelector(nodeSelectorTerms);
  }

  @JsonProperty("nodeSelectorTerms")
  public List<NodeSelectorTerm> getNodeSelectorTerms() {
    return nodeSelectorTerms;
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
