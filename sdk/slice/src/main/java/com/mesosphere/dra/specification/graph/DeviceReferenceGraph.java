package com.mesosphere.dra.specification.graph;

import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.DeviceContent;
import com.mesosphere.dra.specification.SpecCollections;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The {@link DeviceReferenceGraph} captures which devices of a slice draw capacity from which other devices.
 * Counter set references are not part of the graph, since counter sets never point back at devices.
 */
public final class DeviceReferenceGraph {
  /**
   * Mapping of device names to the names of the devices they consume capacity from, in declared order.
   */
  private final Map<String, List<String>> edges;

  private DeviceReferenceGraph() {
    this.edges = new LinkedHashMap<>();
  }

  /**
   * Builds the graph for the provided devices. {@code null} devices and references to names which aren't declared
   * are left out; reporting them is up to the caller.
   */
  public static DeviceReferenceGraph build(List<Device> devices) {
    DeviceReferenceGraph graph = new DeviceReferenceGraph();
    for (Device device : SpecCollections.orEmpty(devices)) {
      if (device != null) {
        graph.addElement(device.getName());
      }
    }
    for (Device device : SpecCollections.orEmpty(devices)) {
      Optional<DeviceContent> content = device == null ? Optional.empty() : device.getContent();
      if (!content.isPresent()) {
        continue;
      }
      for (String target : SpecCollections.orEmpty(content.get().getConsumesCapacityFrom())) {
        if (graph.edges.containsKey(target)) {
          graph.addEdge(device.getName(), target);
        }
      }
    }
    return graph;
  }

  private void addElement(String device) {
    edges.computeIfAbsent(device, k -> new ArrayList<>());
  }

  /**
   * Marks that {@code from} consumes capacity from {@code to}.
   */
  private void addEdge(String from, String to) {
    edges.get(from).add(to);
  }

  /**
   * Returns every device name in declared order.
   */
  public Collection<String> getDevices() {
    return Collections.unmodifiableSet(edges.keySet());
  }

  /**
   * Returns the devices which {@code device} consumes capacity from, or an empty list if it's unknown.
   */
  public List<String> getReferences(String device) {
    List<String> references = edges.get(device);
    return references == null ? Collections.emptyList() : Collections.unmodifiableList(references);
  }
}
