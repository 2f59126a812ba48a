package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import javax.annotation.Nullable;

/**
 * A single typed attribute of a device. Exactly one of the four values is expected to be set, which is enforced by
 * validation rather than at construction time so that malformed documents can be reported in full.
 */
public final class DeviceAttribute {

  @Nullable
  private final Long intValue;

  @Nullable
  private final Boolean boolValue;

  @Nullable
  private final String stringValue;

  @Nullable
  private final String versionValue;

  @JsonCreator
  public DeviceAttribute(
      @JsonProperty("int") Long intValue,
      @JsonProperty("bool") Boolean boolValue,
      @JsonProperty("string") String stringValue,
      @JsonProperty("version") String versionValue)
  {
    this.intValue = intValue;
    this.boolValue = boolValue;
    this.stringValue = stringValue;
    this.versionValue = versionValue;
  }

  public static DeviceAttribute ofInt(long value) {
    return new DeviceAttribute(value, null, null, null);
  }

  public static DeviceAttribute ofBool(boolean value) {
    return new DeviceAttribute(null, value, null, null);
  }

  public static DeviceAttribute ofString(String value) {
    return new DeviceAttribute(null, null, value, null);
  }

  public static DeviceAttribute ofVersion(String value) {
    return new DeviceAttribute(null, null, null, value);
  }

  @Nullable
  @JsonProperty("int")
  public Long getIntValue() {
    return intValue;
  }

  @Nullable
  @JsonProperty("bool")
  public Boolean getBoolValue() {
    return boolValue;
  }

  @Nullable
  @JsonProperty("string")
  public String getStringValue() {
    return stringValue;
  }

  @Nullable
  @JsonProperty("version")
  public String getVersionValue() {
    return versionValue;
  }

  /**
   * Returns how many of the typed values are set.
   */
  @JsonIgnore
  public int getValueCount() {
    int count = 0;
    if (intValue != null) {
      count++;
    }
    if (boolValue != null) {
      count++;
    }
    if (stringValue != null) {
      count++;
    }
    if (versionValue != null) {
      count++;
    }
    return count;
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
