package com.mesosphere.dra.specification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The devices advertised by one slice, along with the pool and nodes they belong to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ResourceSliceSpec {

  private final String driver;

  @Nullable
  private final ResourcePool pool;

  private final String nodeName;

  @Nullable
  private final NodeSelector nodeSelector;

  private final boolean allNodes;

  private final List<Device> devices;

  private final List<CounterSet> sharedCounters;

  @Nullable
  private final ResourceSliceMixins mixins;

  @JsonCreator
  private ResourceSliceSpec(
      @JsonProperty("driver") String driver,
      @JsonProperty("pool") ResourcePool pool,
      @JsonProperty("nodeName") String nodeName,
      @JsonProperty("nodeSelector") NodeSelector nodeSelector,
      @JsonProperty("allNodes") boolean allNodes,
      @JsonProperty("devices") List<Device> devices,
      @JsonProperty("sharedCounters") List<CounterSet> sharedCounters,
      @JsonProperty("mixins") ResourceSliceMixins mixins)
  {
    this.driver = driver;
    this.pool = pool;
    this.nodeName = nodeName;
    this.nodeSelector = nodeSelector;
    this.allNodes = allNodes;
    this.devices = SpecCollections.copyOf(devices);
    this.sharedCounters = SpecCollections.copyOf(sharedCounters);
    this.mixins = mixins;
  }

  private ResourceSliceSpec(Builder builder) {
    this(builder.driver,
        builder.pool,
        builder.nodeName,
        builder.nodeSelector,
        builder.allNodes,
        builder.devices,
        builder.sharedCounters,
        builder.mixins);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(ResourceSliceSpec copy) {
    Builder builder = new Builder();
    builder.driver = copy.driver;
    builder.pool = copy.pool;
    builder.nodeName = copy.nodeName;
    builder.nodeSelector = copy.nodeSelector;
    builder.allNodes = copy.allNodes;
    builder.devices = copy.devices;
    builder.sharedCounters = copy.sharedCounters;
    builder.mixins = copy.mixins;
    return builder;
  }

  @JsonProperty("driver")
  public String getDriver() {
    return driver;
  }

  @JsonProperty("pool")
  public ResourcePool getPool() {
    return pool;
  }

  @JsonProperty("nodeName")
  public String getNodeName() {
    return nodeName;
  }

  @JsonProperty("nodeSelector")
  public NodeSelector getNodeSelector() {
    return nodeSelector;
  }

  @JsonProperty("allNodes")
  @JsonInclude(JsonInclude.Include.NON_DEFAULT)
  public boolean isAllNodes() {
    return allNodes;
  }

  @JsonProperty("devices")
  public List<Device> getDevices() {
    return devices;
  }

  @JsonProperty("sharedCounters")
  public List<CounterSet> getSharedCounters() {
    return sharedCounters;
  }

  @JsonProperty("mixins")
  public ResourceSliceMixins getMixins() {
    return mixins;
  }

  /**
   * Returns which of the node selection fields are set. A valid spec has exactly one.
   */
  @JsonIgnore
  public Set<NodeSelectionMode> getNodeSelectionModes() {
    Set<NodeSelectionMode> modes = EnumSet.noneOf(NodeSelectionMode.class);
    if (!StringUtils.isEmpty(nodeName)) {
      modes.add(NodeSelectionMode.NODE_NAME);
    }
    if (nodeSelector != null) {
      modes.add(NodeSelectionMode.NODE_SELECTOR);
    }
    if (allNodes) {
      modes.add(NodeSelectionMode.ALL_NODES);
    }
    return modes;
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
   * {@link ResourceSliceSpec} builder static inner class.
   */
  public static final class Builder {
    private String driver;
    private ResourcePool pool;
    private String nodeName;
    private NodeSelector nodeSelector;
    private boolean allNodes;
    private List<Device> devices;
    private List<CounterSet> sharedCounters;
    private ResourceSliceMixins mixins;

    private Builder() {
    }

    public Builder driver(String driver) {
      this.driver = driver;
      return this;
    }

    public Builder pool(ResourcePool pool) {
      this.pool = pool;
      return this;
    }

    public Builder nodeName(String nodeName) {
      this.nodeName = nodeName;
      return this;
    }

    public Builder nodeSelector(NodeSelector nodeSelector) {
      this.nodeSelector = nodeSelector;
      return this;
    }

    public Builder allNodes(boolean allNodes) {
      this.allNodes = allNodes;
      return this;
    }

    public Builder devices(List<Device> devices) {
      this.devices = devices;
      return this;
    }

    public Builder sharedCounters(List<CounterSet> sharedCounters) {
      this.sharedCounters = sharedCounters;
      return this;
    }

    public Builder mixins(ResourceSliceMixins mixins) {
      this.mixins = mixins;
      return this;
    }

    public ResourceSliceSpec build() {
      return new ResourceSliceSpec(this);
    }
  }
}
