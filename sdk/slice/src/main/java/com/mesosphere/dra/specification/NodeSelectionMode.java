package com.mesosphere.dra.specification;

/**
 * The ways in which a slice may say which nodes can reach its devices. A slice uses exactly one.
 */
public enum NodeSelectionMode {
  NODE_NAME("nodeName"),
  NODE_SELECTOR("nodeSelector"),
  ALL_NODES("allNodes");

  private final String fieldName;

  NodeSelectionMode(String fieldName) {
    this.fieldName = fieldName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
