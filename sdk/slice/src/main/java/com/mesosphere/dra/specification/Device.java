package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A single allocatable device. Its content is carried by exactly one of the {@code basic} or {@code composite}
 * fields. A device written by a newer producer may carry neither, in which case its content is unknown.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Device {

  private final String name;

  @Nullable
  private final BasicDevice basic;

  @Nullable
  private final CompositeDevice composite;

  @JsonCreator
  private Device(
      @JsonProperty("name") String name,
      @JsonProperty("basic") BasicDevice basic,
      @JsonProperty("composite") CompositeDevice composite)
  {
    this.name = name;
    this.basic = basic;
    this.composite = composite;
  }

  public static Device of(String name, BasicDevice basic, CompositeDevice composite) {
    return new Device(name, basic, composite);
  }

  public static Device basic(String name, BasicDevice basic) {
    return new Device(name, basic, null);
  }

  public static Device composite(String name, CompositeDevice composite) {
    return new Device(name, null, composite);
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @Nullable
  @JsonProperty("basic")
  public BasicDevice getBasic() {
    return basic;
  }

  @Nullable
  @JsonProperty("composite")
  public CompositeDevice getComposite() {
    return composite;
  }

  /**
   * Returns the kinds of content which are set on this device. A well-formed device has exactly one.
   */
  @JsonIgnore
  public Set<DeviceContentKind> getContentKinds() {
    Set<DeviceContentKind> kinds = EnumSet.noneOf(DeviceContentKind.class);
    if (basic != null) {
      kinds.add(DeviceContentKind.BASIC);
    }
    if (composite != null) {
      kinds.add(DeviceContentKind.COMPOSITE);
    }
    return kinds;
  }

  /**
   * Returns the content of this device, or an empty {@link Optional} if the device doesn't carry exactly one kind of
   * content.
   */
  @JsonIgnore
  public Optional<DeviceContent> getContent() {
    if (basic != null && composite == null) {
      return Optional.of(basic);
    }
    if (composite != null && basic == null) {
      return Optional.of(composite);
    }
    return Optional.empty();
  }

  /**
   * Returns a copy of this device which carries the provided content in place of its current content.
   */
  public Device withContent(DeviceContent content) {
    switch (content.getKind()) {
      case BASIC:
        return new Device(name, (BasicDevice) content, null);
      case COMPOSITE:
        return new Device(name, null, (CompositeDevice) content);
      default:
        throw new IllegalArgumentException("Unsupported device content kind: " + content.getKind());
    }
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
