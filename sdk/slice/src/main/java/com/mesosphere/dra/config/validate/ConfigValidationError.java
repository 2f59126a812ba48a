package com.mesosphere.dra.config.validate;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Signals that a certain field of a resource slice, or a transition of that field between two versions of the slice,
 * did not pass validation.
 */
public final class ConfigValidationError {

  /**
   * The kind of problem which was found in a field.
   */
  public enum Type {
    REQUIRED("Required value"),
    INVALID("Invalid value"),
    DUPLICATE("Duplicate value"),
    TOO_MANY("Too many"),
    TOO_LONG("Too long"),
    TYPE_INVALID("Invalid value"),
    NOT_SUPPORTED("Unsupported value"),
    FORBIDDEN("Forbidden");

    private final String description;

    Type(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final String field;

  private final Type type;

  @Nullable
  private final Object oldValue;

  @Nullable
  private final Object value;

  private final String message;

  private ConfigValidationError(
      String field,
      Type type,
      Object oldValue,
      Object value,
      String message)
  {
    this.field = field;
    this.type = type;
    this.oldValue = oldValue;
    this.value = value;
    this.message = message;
  }

  /**
   * Returns a new validation error which indicates that a configuration field has an invalid
   * value. This is equivalent to a transition error, except with no prior value.
   */
  public static ConfigValidationError valueError(FieldPath field, Type type, Object value, String message) {
    return new ConfigValidationError(field.toString(), type, null, value, message);
  }

  /**
   * Returns a new validation error which indicates that a configuration field has an invalid
   * transition from its previous value to the current value.
   */
  public static ConfigValidationError transitionError(
      FieldPath field, Object oldValue, Object newValue, String message)
  {
    return new ConfigValidationError(field.toString(), Type.INVALID, oldValue, newValue, message);
  }

  public static ConfigValidationError required(FieldPath field, String message) {
    return valueError(field, Type.REQUIRED, "", message);
  }

  public static ConfigValidationError invalid(FieldPath field, Object value, String message) {
    return valueError(field, Type.INVALID, value, message);
  }

  public static ConfigValidationError duplicate(FieldPath field, Object value) {
    return valueError(field, Type.DUPLICATE, value, "");
  }

  public static ConfigValidationError tooMany(FieldPath field, int actual, int max) {
    return valueError(field, Type.TOO_MANY, actual, String.format("must have at most %d items", max));
  }

  public static ConfigValidationError tooLong(FieldPath field, Object value, int maxLength) {
    return valueError(field, Type.TOO_LONG, value, String.format("may not be more than %d bytes", maxLength));
  }

  public static ConfigValidationError typeInvalid(FieldPath field, Object value, String message) {
    return valueError(field, Type.TYPE_INVALID, value, message);
  }

  public static ConfigValidationError notSupported(FieldPath field, Object value, Collection<String> supported) {
    return valueError(field, Type.NOT_SUPPORTED, value, "supported values: "
        + supported.stream().map(s -> "\"" + s + "\"").collect(Collectors.joining(", ")));
  }

  public static ConfigValidationError forbidden(FieldPath field, String message) {
    return valueError(field, Type.FORBIDDEN, "", message);
  }

  /**
   * Returns the path of the field which had the error.
   */
  public String getField() {
    return field;
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns the current value which triggered the error.
   */
  public Object getValue() {
    return value;
  }

  /**
   * Returns the previous value which failed to transition to the current value, or {@code null}
   * if this is not a transition error.
   */
  public Object getOldValue() {
    return oldValue;
  }

  /**
   * Returns the provided error message for this error.
   */
  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(this);
  }

  /**
   * Returns a complete user-facing string representation providing the error and its source.
   */
  @Override
  public String toString() {
    if (oldValue != null) {
      return String.format("Field: '%s'; %s; Transition: '%s' => '%s'; Message: '%s'",
          field, type.getDescription(), oldValue, value, message);
    } else {
      return String.format("Field: '%s'; %s; Value: '%s'; Message: '%s'",
          field, type.getDescription(), value, message);
    }
  }
}
