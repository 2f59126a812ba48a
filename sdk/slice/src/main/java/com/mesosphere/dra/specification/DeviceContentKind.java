package com.mesosphere.dra.specification;

/**
 * The mutually exclusive forms in which a {@link Device} may describe itself.
 */
public enum DeviceContentKind {
  BASIC("basic"),
  COMPOSITE("composite");

  private final String fieldName;

  DeviceContentKind(String fieldName) {
    this.fieldName = fieldName;
  }

  /**
   * Returns the document field which carries this kind of content.
   */
  public String getFieldName() {
    return fieldName;
  }
}
