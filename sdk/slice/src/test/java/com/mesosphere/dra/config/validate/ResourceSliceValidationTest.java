package com.mesosphere.dra.config.validate;

import com.mesosphere.dra.specification.BasicDevice;
import com.mesosphere.dra.specification.CompositeDevice;
import com.mesosphere.dra.specification.CounterSet;
import com.mesosphere.dra.specification.CounterSetMixin;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.DeviceMixin;
import com.mesosphere.dra.specification.NodeSelector;
import com.mesosphere.dra.specification.NodeSelectorRequirement;
import com.mesosphere.dra.specification.NodeSelectorTerm;
import com.mesosphere.dra.specification.ResourcePool;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceMixins;
import com.mesosphere.dra.specification.yaml.YAMLResourceSliceFactory;
import com.mesosphere.dra.testutils.TestSlices;
import org.apache.commons.lang3.StringUtils;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.mesosphere.dra.specification.validation.IdentifierValidation.LABEL_ERROR_MESSAGE;
import static com.mesosphere.dra.specification.validation.IdentifierValidation.LABEL_VALUE_ERROR_MESSAGE;
import static com.mesosphere.dra.specification.validation.IdentifierValidation.SUBDOMAIN_ERROR_MESSAGE;
import static com.mesosphere.dra.testutils.TestSlices.BAD_NAME;
import static com.mesosphere.dra.testutils.TestSlices.DRIVER;
import static com.mesosphere.dra.testutils.TestSlices.GOOD_NAME;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ResourceSliceValidationTest {
    private static final FieldPath SPEC = FieldPath.of("spec");
    private static final FieldPath DEVICES = FieldPath.of("spec", "devices");

    @Mock private ConfigValidator<ResourceSlice> mockValidatorA;
    @Mock private ConfigValidator<ResourceSlice> mockValidatorB;

    @Before
    public void beforeEach() {
        MockitoAnnotations.initMocks(this);
    }

    @Test
    public void testErrorsFromAllValidatorsInOrder() {
        ResourceSlice slice = TestSlices.validSlice();
        ConfigValidationError errorA = ConfigValidationError.required(FieldPath.of("a"), "a");
        ConfigValidationError errorB = ConfigValidationError.required(FieldPath.of("b"), "b");
        when(mockValidatorA.validate(Optional.empty(), slice)).thenReturn(Collections.singletonList(errorA));
        when(mockValidatorB.validate(Optional.empty(), slice)).thenReturn(Collections.singletonList(errorB));

        List<ConfigValidationError> errors = ResourceSliceValidation.validate(
                Optional.empty(), slice, Arrays.asList(mockValidatorA, mockValidatorB));
        Assert.assertEquals(Arrays.asList(errorA, errorB), errors);

        InOrder order = inOrder(mockValidatorA, mockValidatorB);
        order.verify(mockValidatorA).validate(Optional.empty(), slice);
        order.verify(mockValidatorB).validate(Optional.empty(), slice);
    }

    @Test
    public void testUpdatePassesOldSlice() {
        ResourceSlice oldSlice = TestSlices.validSlice();
        ResourceSlice newSlice = TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 2);
        when(mockValidatorA.validate(Optional.of(oldSlice), newSlice)).thenReturn(Collections.emptyList());

        Assert.assertTrue(ResourceSliceValidation.validate(
                Optional.of(oldSlice), newSlice, Collections.singletonList(mockValidatorA)).isEmpty());
        verify(mockValidatorA).validate(Optional.of(oldSlice), newSlice);
    }

    @Test
    public void testUpdateWithChangedImmutableFields() {
        ResourceSlice oldSlice = TestSlices.validSlice();
        ResourceSlice newSlice = TestSlices.withSpec(oldSlice, spec -> spec.driver("other.example.com"));
        Assert.assertTrue(ResourceSliceValidation.validateCreate(newSlice).isEmpty());
        Assert.assertEquals(
                Collections.singletonList(ConfigValidationError.transitionError(
                        SPEC.child("driver"), DRIVER, "other.example.com", "field is immutable")),
                ResourceSliceValidation.validateUpdate(newSlice, oldSlice));
    }

    @Test
    public void testValidSlice() {
        assertNoErrors(TestSlices.validSlice());
        assertNoErrors(TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 3));
        assertNoErrors(TestSlices.compositeSliceWithMixin(GOOD_NAME, GOOD_NAME, DRIVER, 2));
    }

    @Test
    public void testMaxDevices() {
        assertNoErrors(TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 128));
        assertErrors(TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 129),
                ConfigValidationError.invalid(SPEC, 129, "the total number of devices and mixins must not exceed 128"));
    }

    @Test
    public void testMaxDevicesCountsMixins() {
        assertNoErrors(TestSlices.compositeSliceWithMixin(GOOD_NAME, GOOD_NAME, DRIVER, 127));
        assertErrors(TestSlices.compositeSliceWithMixin(GOOD_NAME, GOOD_NAME, DRIVER, 128),
                ConfigValidationError.invalid(SPEC, 129, "the total number of devices and mixins must not exceed 128"));
    }

    @Test
    public void testMissingName() {
        ResourceSlice slice = TestSlices.withMetadata(TestSlices.validSlice(), meta -> meta.name(""));
        assertErrors(slice,
                ConfigValidationError.required(FieldPath.of("metadata", "name"), "name or generateName is required"));
    }

    @Test
    public void testBadName() {
        ResourceSlice slice = TestSlices.slice(BAD_NAME, GOOD_NAME, DRIVER, 1);
        assertErrors(slice,
                ConfigValidationError.invalid(FieldPath.of("metadata", "name"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE));
    }

    @Test
    public void testBadPoolAndNodeName() {
        assertErrors(TestSlices.slice(GOOD_NAME, BAD_NAME, DRIVER, 1),
                ConfigValidationError.invalid(SPEC.child("pool", "name"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE),
                ConfigValidationError.invalid(SPEC.child("nodeName"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE));
    }

    @Test
    public void testBadMultipartPoolName() {
        String badPath = BAD_NAME + "/" + BAD_NAME;
        assertErrors(TestSlices.slice(GOOD_NAME, badPath, DRIVER, 1),
                ConfigValidationError.invalid(SPEC.child("pool", "name"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE),
                ConfigValidationError.invalid(SPEC.child("pool", "name"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE),
                ConfigValidationError.invalid(SPEC.child("nodeName"), badPath, SUBDOMAIN_ERROR_MESSAGE));
    }

    @Test
    public void testGoodMultipartPoolName() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.pool(ResourcePool.of("example.com/gpus/rack-1", 3, 2)));
        assertNoErrors(slice);
    }

    @Test
    public void testBadPool() {
        String longName = StringUtils.repeat("x/", 126) + "xy";
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.pool(ResourcePool.of(longName, -1, 0)));
        assertErrors(slice,
                ConfigValidationError.tooLong(SPEC.child("pool", "name"), longName, 253),
                ConfigValidationError.invalid(SPEC.child("pool", "resourceSliceCount"), 0L,
                        "must be greater than zero"),
                ConfigValidationError.invalid(SPEC.child("pool", "generation"), -1L,
                        "must be greater than or equal to zero"));
    }

    @Test
    public void testMissingPoolName() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.pool(ResourcePool.of("", 0, 1)));
        assertErrors(slice, ConfigValidationError.required(SPEC.child("pool", "name"), ""));
    }

    @Test
    public void testMissingPool() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.pool(null));
        assertErrors(slice, ConfigValidationError.required(SPEC.child("pool"), ""));
    }

    @Test
    public void testNodeSelectorWithoutTerms() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.nodeName(null).nodeSelector(NodeSelector.of(null)));
        FieldPath termsPath = SPEC.child("nodeSelector", "nodeSelectorTerms");
        assertErrors(slice,
                ConfigValidationError.required(termsPath, "must have at least one node selector term"),
                ConfigValidationError.invalid(termsPath, null, "must have exactly one node selector term"));
    }

    @Test
    public void testNodeSelectorLabelValue() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.nodeName(null).nodeSelector(selector("foo", "-1")));
        assertErrors(slice, ConfigValidationError.invalid(
                SPEC.child("nodeSelector", "nodeSelectorTerms").index(0).child("matchExpressions").index(0)
                        .child("values").index(0),
                "-1",
                LABEL_VALUE_ERROR_MESSAGE));
    }

    @Test
    public void testValidNodeSelector() {
        assertNoErrors(TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.nodeName(null).nodeSelector(selector("example.com/rack", "rack-1"))));
    }

    @Test
    public void testAllNodes() {
        assertNoErrors(TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.nodeName(null).allNodes(true)));
    }

    @Test
    public void testMultipleNodeSelectionModes() {
        ConfigValidationError expected = ConfigValidationError.invalid(
                SPEC, null, "exactly one of `nodeName`, `nodeSelector`, or `allNodes` is required");
        assertErrors(TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.allNodes(true)), expected);
        assertErrors(TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.nodeSelector(selector("foo", "bar"))), expected);
        assertErrors(TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.nodeSelector(selector("foo", "bar")).allNodes(true)), expected);
    }

    @Test
    public void testNoNodeSelectionMode() {
        assertErrors(TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.nodeName(null)),
                ConfigValidationError.required(
                        SPEC, "exactly one of `nodeName`, `nodeSelector`, or `allNodes` is required"));
        // An empty node name counts as unset.
        assertErrors(TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.nodeName("")),
                ConfigValidationError.required(
                        SPEC, "exactly one of `nodeName`, `nodeSelector`, or `allNodes` is required"));
    }

    @Test
    public void testBadDriver() {
        assertErrors(TestSlices.slice(GOOD_NAME, GOOD_NAME, BAD_NAME, 1),
                ConfigValidationError.invalid(SPEC.child("driver"), BAD_NAME, SUBDOMAIN_ERROR_MESSAGE));
    }

    @Test
    public void testBadDevices() {
        ResourceSlice slice = TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 3);
        List<Device> devices = new ArrayList<>(slice.getSpec().getDevices());
        devices.set(1, Device.basic(BAD_NAME, devices.get(1).getBasic()));
        devices.set(2, Device.of("device-2", null, null));
        assertErrors(TestSlices.withSpec(slice, spec -> spec.devices(devices)),
                ConfigValidationError.invalid(DEVICES.index(1).child("name"), BAD_NAME, LABEL_ERROR_MESSAGE),
                ConfigValidationError.required(DEVICES.index(2), "exactly one of `basic`, or `composite` is required"));
    }

    @Test
    public void testDeviceWithBothContents() {
        Device device = Device.of("device-0", BasicDevice.newBuilder().build(), CompositeDevice.newBuilder().build());
        ResourceSlice slice = withDevices(device);
        assertErrors(slice, ConfigValidationError.invalid(
                DEVICES.index(0), null, "exactly one of `basic`, or `composite` is required"));
    }

    @Test
    public void testDuplicateDeviceNames() {
        ResourceSlice slice = TestSlices.slice(GOOD_NAME, GOOD_NAME, DRIVER, 2);
        List<Device> devices = new ArrayList<>(slice.getSpec().getDevices());
        devices.set(1, Device.basic("device-0", devices.get(1).getBasic()));
        assertErrors(TestSlices.withSpec(slice, spec -> spec.devices(devices)),
                ConfigValidationError.duplicate(DEVICES.index(1).child("name"), "device-0"));
    }

    @Test
    public void testTooManyIncludes() {
        assertErrors(withCompositeIncludes(Collections.nCopies(9, TestSlices.MIXIN_NAME)),
                ConfigValidationError.tooMany(DEVICES.index(0).child("composite", "includes"), 9, 8));
    }

    @Test
    public void testBadInclude() {
        FieldPath includePath = DEVICES.index(0).child("composite", "includes").index(0);
        assertErrors(withCompositeIncludes(Collections.singletonList(BAD_NAME)),
                ConfigValidationError.invalid(includePath, BAD_NAME, LABEL_ERROR_MESSAGE),
                ConfigValidationError.invalid(includePath, BAD_NAME,
                        "must be the name of a mixin in the resource slice"));
    }

    @Test
    public void testUnknownInclude() {
        assertErrors(withCompositeIncludes(Collections.singletonList("unknown-mixin")),
                ConfigValidationError.invalid(DEVICES.index(0).child("composite", "includes").index(0),
                        "unknown-mixin", "must be the name of a mixin in the resource slice"));
    }

    @Test
    public void testIncludeOfOtherMixinKind() {
        // Counter set mixins can't be included by devices.
        ResourceSlice slice = TestSlices.withSpec(withCompositeIncludes(Collections.singletonList("counters")),
                spec -> spec.mixins(ResourceSliceMixins.of(
                        null, Collections.singletonList(CounterSetMixin.of("counters", null)), null)));
        assertErrors(slice, ConfigValidationError.invalid(DEVICES.index(0).child("composite", "includes").index(0),
                "counters", "must be the name of a mixin in the resource slice"));
    }

    @Test
    public void testTooManyConsumesCapacityFrom() {
        assertErrors(withDevices(
                        TestSlices.compositeDevice("device-0", "device-1", "device-2"),
                        TestSlices.compositeDevice("device-1"),
                        TestSlices.compositeDevice("device-2")),
                ConfigValidationError.tooMany(DEVICES.index(0).child("composite", "consumesCapacityFrom"), 2, 1));
    }

    @Test
    public void testBadConsumesCapacityFrom() {
        FieldPath refPath = DEVICES.index(0).child("composite", "consumesCapacityFrom").index(0);
        assertErrors(withDevices(TestSlices.compositeDevice("device-0", BAD_NAME)),
                ConfigValidationError.invalid(refPath, BAD_NAME, LABEL_ERROR_MESSAGE),
                ConfigValidationError.invalid(refPath, BAD_NAME, "must be the name of a device in the resource slice"));
    }

    @Test
    public void testUnknownConsumesCapacityFrom() {
        assertErrors(withDevices(TestSlices.compositeDevice("device-0", "not-a-device")),
                ConfigValidationError.invalid(DEVICES.index(0).child("composite", "consumesCapacityFrom").index(0),
                        "not-a-device", "must be the name of a device in the resource slice"));
    }

    @Test
    public void testConsumesCapacityFromChain() {
        assertNoErrors(withDevices(
                TestSlices.compositeDevice("device-0", "device-1"),
                TestSlices.compositeDevice("device-1", "device-2"),
                TestSlices.compositeDevice("device-2")));
    }

    @Test
    public void testConsumesCapacityFromCycle() {
        assertErrors(withDevices(
                        TestSlices.compositeDevice("device-0-0", "device-0-1"),
                        TestSlices.compositeDevice("device-0-1", "device-0-2"),
                        TestSlices.compositeDevice("device-0-2", "device-0-0")),
                cycleError("device-0-0 -> device-0-1 -> device-0-2 -> device-0-0"));
    }

    @Test
    public void testMultipleConsumesCapacityFromCycles() {
        assertErrors(withDevices(
                        TestSlices.compositeDevice("device-0-0", "device-0-1"),
                        TestSlices.compositeDevice("device-0-1", "device-0-2"),
                        TestSlices.compositeDevice("device-0-2", "device-0-0"),
                        TestSlices.compositeDevice("device-1-0", "device-1-1"),
                        TestSlices.compositeDevice("device-1-1", "device-1-2"),
                        TestSlices.compositeDevice("device-1-2", "device-1-0")),
                cycleError("device-0-0 -> device-0-1 -> device-0-2 -> device-0-0"),
                cycleError("device-1-0 -> device-1-1 -> device-1-2 -> device-1-0"));
    }

    @Test
    public void testConsumesCapacityFromSelf() {
        assertErrors(withDevices(TestSlices.compositeDevice("device-0", "device-0")),
                cycleError("device-0 -> device-0"));
    }

    @Test
    public void testBadMixinName() {
        ResourceSlice slice = withDeviceMixins(GOOD_NAME, BAD_NAME);
        assertErrors(slice, ConfigValidationError.invalid(
                SPEC.child("mixins", "device").index(1).child("name"), BAD_NAME, LABEL_ERROR_MESSAGE));
    }

    @Test
    public void testDuplicateMixinNames() {
        assertErrors(withDeviceMixins(GOOD_NAME, GOOD_NAME),
                ConfigValidationError.duplicate(SPEC.child("mixins", "device").index(1).child("name"), GOOD_NAME));
    }

    @Test
    public void testDuplicateMixinNamesAcrossKinds() {
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.mixins(ResourceSliceMixins.of(
                Collections.singletonList(DeviceMixin.of(GOOD_NAME, null, null)),
                Collections.singletonList(CounterSetMixin.of(GOOD_NAME, null)),
                null)));
        assertErrors(slice,
                ConfigValidationError.duplicate(SPEC.child("mixins", "counterSet").index(0).child("name"), GOOD_NAME));
    }

    @Test
    public void testCounterSetNames() {
        List<CounterSet> counterSets = Arrays.asList(
                CounterSet.of("counters", null),
                CounterSet.of(BAD_NAME, null),
                CounterSet.of("counters", null));
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.sharedCounters(counterSets));
        FieldPath sharedCounters = SPEC.child("sharedCounters");
        assertErrors(slice,
                ConfigValidationError.invalid(sharedCounters.index(1).child("name"), BAD_NAME, LABEL_ERROR_MESSAGE),
                ConfigValidationError.duplicate(sharedCounters.index(2).child("name"), "counters"));
    }

    @Test
    public void testLongConsumesCapacityFromChain() {
        List<Device> devices = new ArrayList<>();
        for (int i = 0; i < 50000; i++) {
            devices.add(TestSlices.compositeDevice("d" + i, "d" + (i + 1)));
        }
        devices.add(TestSlices.compositeDevice("d50000"));
        ResourceSlice slice = TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.devices(devices));

        List<ConfigValidationError> errors = ResourceSliceValidation.validateCreate(slice);
        Assert.assertEquals(1, errors.size());
        Assert.assertEquals("spec", errors.get(0).getField());
        Assert.assertEquals(50001, errors.get(0).getValue());
    }

    @Test
    public void testYamlWithNullDevice() throws Exception {
        assertYamlErrors(
                spec("nodeName: node-1", "devices:", "  -"),
                ConfigValidationError.required(DEVICES.index(0), ""));
    }

    @Test
    public void testYamlWithNullDeviceAmongOthers() throws Exception {
        assertYamlErrors(
                spec("nodeName: node-1",
                        "devices:",
                        "  - name: gpu-0",
                        "    composite:",
                        "      consumesCapacityFrom: [gpu-1]",
                        "  -",
                        "  - name: gpu-1",
                        "    composite: {}"),
                ConfigValidationError.required(DEVICES.index(1), ""));
    }

    @Test
    public void testYamlWithNullSharedCounter() throws Exception {
        assertYamlErrors(
                spec("nodeName: node-1", "devices: []", "sharedCounters:", "  -"),
                ConfigValidationError.required(SPEC.child("sharedCounters").index(0), ""));
    }

    @Test
    public void testYamlWithNullCounterConsumption() throws Exception {
        assertYamlErrors(
                spec("nodeName: node-1",
                        "devices:",
                        "  - name: gpu-0",
                        "    basic:",
                        "      consumesCounters:",
                        "        -"),
                ConfigValidationError.required(DEVICES.index(0).child("basic", "consumesCounters").index(0), ""));
    }

    @Test
    public void testYamlWithNullMixins() throws Exception {
        FieldPath mixins = SPEC.child("mixins");
        assertYamlErrors(
                spec("nodeName: node-1",
                        "devices:",
                        "  - name: gpu-0",
                        "    composite:",
                        "      includes: [a100]",
                        "mixins:",
                        "  device:",
                        "    -",
                        "    - name: a100",
                        "  counterSet:",
                        "    -",
                        "  deviceCounterConsumption:",
                        "    -"),
                ConfigValidationError.required(mixins.child("device").index(0), ""),
                ConfigValidationError.required(mixins.child("counterSet").index(0), ""),
                ConfigValidationError.required(mixins.child("deviceCounterConsumption").index(0), ""));
    }

    @Test
    public void testYamlWithNullNodeSelectorTerm() throws Exception {
        assertYamlErrors(
                spec("nodeSelector:", "  nodeSelectorTerms:", "    -", "devices: []"),
                ConfigValidationError.required(SPEC.child("nodeSelector", "nodeSelectorTerms").index(0), ""));
    }

    @Test
    public void testYamlWithNullNodeSelectorRequirements() throws Exception {
        FieldPath term = SPEC.child("nodeSelector", "nodeSelectorTerms").index(0);
        assertYamlErrors(
                spec("nodeSelector:",
                        "  nodeSelectorTerms:",
                        "    - matchExpressions:",
                        "        -",
                        "      matchFields:",
                        "        -",
                        "devices: []"),
                ConfigValidationError.required(term.child("matchExpressions").index(0), ""),
                ConfigValidationError.required(term.child("matchFields").index(0), ""));
    }

    @Test
    public void testYamlWithoutSpec() throws Exception {
        assertYamlErrors(
                "metadata:\n  name: slice-1\n",
                ConfigValidationError.required(SPEC.child("pool"), ""),
                ConfigValidationError.required(SPEC, ResourceSliceSpecValidator.NODE_SELECTION_MESSAGE),
                ConfigValidationError.required(SPEC.child("driver"), ""));
    }

    @Test
    public void testYamlWithoutMetadata() throws Exception {
        String yaml = spec("nodeName: node-1", "devices: []");
        assertYamlErrors(
                yaml.substring(yaml.indexOf("spec:")),
                ConfigValidationError.required(FieldPath.of("metadata", "name"), "name or generateName is required"));
    }

    private static ResourceSlice withCompositeIncludes(List<String> includes) {
        ResourceSlice slice = TestSlices.compositeSliceWithMixin(GOOD_NAME, GOOD_NAME, DRIVER, 1);
        return TestSlices.withSpec(slice, spec -> spec.devices(Collections.singletonList(Device.composite(
                "device-0", CompositeDevice.newBuilder().includes(includes).build()))));
    }

    private static ResourceSlice withDevices(Device... devices) {
        return TestSlices.withSpec(TestSlices.validSlice(), spec -> spec.devices(Arrays.asList(devices)));
    }

    private static ResourceSlice withDeviceMixins(String... names) {
        List<DeviceMixin> mixins = new ArrayList<>();
        for (String name : names) {
            mixins.add(DeviceMixin.of(name, null, null));
        }
        return TestSlices.withSpec(TestSlices.validSlice(),
                spec -> spec.mixins(ResourceSliceMixins.of(mixins, null, null)));
    }

    private static NodeSelector selector(String key, String value) {
        return NodeSelector.of(Collections.singletonList(NodeSelectorTerm.of(
                Collections.singletonList(NodeSelectorRequirement.of(
                        key, NodeSelectorRequirement.OP_IN, Collections.singletonList(value))),
                null)));
    }

    private static ConfigValidationError cycleError(String cycle) {
        return ConfigValidationError.invalid(DEVICES, "",
                "`consumesCapacityFrom` references can not form cycle. Found cycle: " + cycle);
    }

    private static void assertNoErrors(ResourceSlice slice) {
        Assert.assertEquals(Collections.emptyList(), ResourceSliceValidation.validateCreate(slice));
    }

    private static void assertErrors(ResourceSlice slice, ConfigValidationError... expected) {
        Assert.assertEquals(Arrays.asList(expected), ResourceSliceValidation.validateCreate(slice));
    }

    /**
     * Returns a slice document with a valid name, driver and pool, followed by the provided spec lines.
     */
    private static String spec(String... lines) {
        StringBuilder yaml = new StringBuilder()
                .append("metadata:\n")
                .append("  name: slice-1\n")
                .append("spec:\n")
                .append("  driver: gpu.example.com\n")
                .append("  pool:\n")
                .append("    name: node-1\n")
                .append("    resourceSliceCount: 1\n");
        for (String line : lines) {
            yaml.append("  ").append(line).append("\n");
        }
        return yaml.toString();
    }

    private static void assertYamlErrors(String yaml, ConfigValidationError... expected) throws Exception {
        ResourceSlice slice = YAMLResourceSliceFactory.generateSliceFromYAML(yaml);
        Assert.assertEquals(Arrays.asList(expected), ResourceSliceValidation.validateCreate(slice));
    }
}
