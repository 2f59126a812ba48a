package com.mesosphere.dra.specification.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the cycles in a {@link DeviceReferenceGraph} using a depth-first traversal which marks each device as
 * unvisited, in progress or done. Each traversal starts from the next unvisited device in declared order, and devices
 * which are done are never entered again, so a cycle is reported once per call.
 */
public final class CycleDetector {

  private enum Mark {
    IN_PROGRESS,
    DONE
  }

  private CycleDetector() {
    // do not instantiate
  }

  /**
   * Returns the cycles found in the graph. Each cycle lists device names in traversal order and repeats its first
   * name at the end, so a device which consumes its own capacity yields {@code [a, a]}.
   */
  public static List<List<String>> findCycles(DeviceReferenceGraph graph) {
    Map<String, Mark> marks = new HashMap<>();
    List<List<String>> cycles = new ArrayList<>();
    for (String device : graph.getDevices()) {
      if (!marks.containsKey(device)) {
        visit(graph, device, marks, cycles);
      }
    }
    return cycles;
  }

  /**
   * Walks every device reachable from {@code root} with an explicit stack of frames, so that long reference chains
   * don't exhaust the thread stack.
   */
  private static void visit(
      DeviceReferenceGraph graph,
      String root,
      Map<String, Mark> marks,
      List<List<String>> cycles)
  {
    Deque<Frame> stack = new ArrayDeque<>();
    List<String> path = new ArrayList<>();
    enter(root, marks, path, stack);
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      List<String> references = graph.getReferences(frame.device);
      if (frame.nextEdge >= references.size()) {
        stack.pop();
        path.remove(path.size() - 1);
        marks.put(frame.device, Mark.DONE);
        continue;
      }
      String next = references.get(frame.nextEdge++);
      Mark mark = marks.get(next);
      if (mark == null) {
        enter(next, marks, path, stack);
      } else if (mark == Mark.IN_PROGRESS) {
        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
        cycle.add(next);
        cycles.add(cycle);
      }
    }
  }

  private static void enter(String device, Map<String, Mark> marks, List<String> path, Deque<Frame> stack) {
    marks.put(device, Mark.IN_PROGRESS);
    path.add(device);
    stack.push(new Frame(device));
  }

  /**
   * A device on the traversal stack, with the index of the next reference to follow.
   */
  private static final class Frame {
    private final String device;
    private int nextEdge;

    private Frame(String device) {
      this.device = device;
      this.nextEdge = 0;
    }
  }
}
