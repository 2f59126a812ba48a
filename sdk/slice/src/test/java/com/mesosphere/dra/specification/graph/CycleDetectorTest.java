package com.mesosphere.dra.specification.graph;

import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.testutils.TestSlices;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CycleDetectorTest {

    @Test
    public void testNoCycles() {
        DeviceReferenceGraph graph = DeviceReferenceGraph.build(Arrays.asList(
                TestSlices.compositeDevice("a", "b"),
                TestSlices.compositeDevice("b", "c"),
                TestSlices.compositeDevice("c"),
                TestSlices.compositeDevice("d", "c")));
        Assert.assertTrue(CycleDetector.findCycles(graph).isEmpty());
    }

    @Test
    public void testSelfReference() {
        DeviceReferenceGraph graph = DeviceReferenceGraph.build(Collections.singletonList(
                TestSlices.compositeDevice("a", "a")));
        Assert.assertEquals(
                Collections.singletonList(Arrays.asList("a", "a")),
                CycleDetector.findCycles(graph));
    }

    @Test
    public void testCycleReportedOnce() {
        DeviceReferenceGraph graph = DeviceReferenceGraph.build(Arrays.asList(
                TestSlices.compositeDevice("a", "b"),
                TestSlices.compositeDevice("b", "c"),
                TestSlices.compositeDevice("c", "a"),
                TestSlices.compositeDevice("d", "a")));
        Assert.assertEquals(
                Collections.singletonList(Arrays.asList("a", "b", "c", "a")),
                CycleDetector.findCycles(graph));
    }

    @Test
    public void testCycleStartsWhereTraversalEntersIt() {
        DeviceReferenceGraph graph = DeviceReferenceGraph.build(Arrays.asList(
                TestSlices.compositeDevice("x", "b"),
                TestSlices.compositeDevice("a", "b"),
                TestSlices.compositeDevice("b", "a")));
        Assert.assertEquals(
                Collections.singletonList(Arrays.asList("b", "a", "b")),
                CycleDetector.findCycles(graph));
    }

    @Test
    public void testSeparateCycles() {
        DeviceReferenceGraph graph = DeviceReferenceGraph.build(Arrays.asList(
                TestSlices.compositeDevice("a", "b"),
                TestSlices.compositeDevice("b", "a"),
                TestSlices.compositeDevice("c", "d"),
                TestSlices.compositeDevice("d", "c")));
        List<List<String>> cycles = CycleDetector.findCycles(graph);
        Assert.assertEquals(
                Arrays.asList(Arrays.asList("a", "b", "a"), Arrays.asList("c", "d", "c")),
                cycles);
    }

    @Test
    public void testLongChainWithoutCycle() {
        List<Device> devices = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            devices.add(TestSlices.compositeDevice("d" + i, "d" + (i + 1)));
        }
        devices.add(TestSlices.compositeDevice("d20000"));
        Assert.assertTrue(CycleDetector.findCycles(DeviceReferenceGraph.build(devices)).isEmpty());
    }

    @Test
    public void testLongChainClosedIntoCycle() {
        List<Device> devices = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            devices.add(TestSlices.compositeDevice("d" + i, "d" + ((i + 1) % 5000)));
        }
        List<List<String>> cycles = CycleDetector.findCycles(DeviceReferenceGraph.build(devices));
        Assert.assertEquals(1, cycles.size());
        List<String> cycle = cycles.get(0);
        Assert.assertEquals(5001, cycle.size());
        Assert.assertEquals("d0", cycle.get(0));
        Assert.assertEquals("d4999", cycle.get(4999));
        Assert.assertEquals("d0", cycle.get(5000));
    }
}
