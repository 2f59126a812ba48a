package com.mesosphere.dra.config.validate;

import java.util.Objects;

/**
 * Immutable path to a field within a resource slice document, rendered as e.g.
 * {@code spec.devices[0].composite.attributes[driver.example.com/model]}.
 */
public final class FieldPath {

  private final FieldPath parent;

  private final String element;

  private FieldPath(FieldPath parent, String element) {
    this.parent = parent;
    this.element = element;
  }

  /**
   * Returns a new root path made of the provided field names.
   */
  public static FieldPath of(String name, String... moreNames) {
    FieldPath path = new FieldPath(null, name);
    for (String moreName : moreNames) {
      path = path.child(moreName);
    }
    return path;
  }

  public FieldPath child(String name, String... moreNames) {
    FieldPath path = new FieldPath(this, "." + name);
    for (String moreName : moreNames) {
      path = new FieldPath(path, "." + moreName);
    }
    return path;
  }

  public FieldPath index(int index) {
    return new FieldPath(this, "[" + index + "]");
  }

  public FieldPath key(String key) {
    return new FieldPath(this, "[" + key + "]");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldPath && toString().equals(o.toString());
  }

  @Override
  public int hashCode() {
    return Objects.hash(toString());
  }

  @Override
  public String toString() {
    return parent == null ? element : parent.toString() + element;
  }
}
