package com.mesosphere.dra.testutils;

import com.mesosphere.dra.specification.BasicDevice;
import com.mesosphere.dra.specification.CompositeDevice;
import com.mesosphere.dra.specification.Device;
import com.mesosphere.dra.specification.DeviceAttribute;
import com.mesosphere.dra.specification.DeviceCapacity;
import com.mesosphere.dra.specification.DeviceMixin;
import com.mesosphere.dra.specification.ObjectMeta;
import com.mesosphere.dra.specification.ResourcePool;
import com.mesosphere.dra.specification.ResourceSlice;
import com.mesosphere.dra.specification.ResourceSliceMixins;
import com.mesosphere.dra.specification.ResourceSliceSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Builders for the resource slices used across tests.
 */
public class TestSlices {
    public static final String GOOD_NAME = "foo";
    public static final String BAD_NAME = "!@#$%^";
    public static final String DRIVER = "driver.example.com";
    public static final String MIXIN_NAME = "mixin";

    private TestSlices() {
        // do not instantiate
    }

    /**
     * Returns a valid slice with {@code numDevices} basic devices named {@code device-<i>}. The pool is named after
     * the node.
     */
    public static ResourceSlice slice(String name, String nodeName, String driver, int numDevices) {
        return ResourceSlice.of(
                ObjectMeta.newBuilder().name(name).build(),
                ResourceSliceSpec.newBuilder()
                        .driver(driver)
                        .nodeName(nodeName)
                        .pool(ResourcePool.of(nodeName, 0, 1))
                        .devices(basicDevices(numDevices))
                        .build());
    }

    public static ResourceSlice validSlice() {
        return slice(GOOD_NAME, GOOD_NAME, DRIVER, 1);
    }

    /**
     * Returns a valid slice with one device mixin and {@code numDevices} composite devices which include it.
     */
    public static ResourceSlice compositeSliceWithMixin(
            String name, String nodeName, String driver, int numDevices) {
        List<Device> devices = new ArrayList<>();
        for (int i = 0; i < numDevices; i++) {
            devices.add(Device.composite(String.format("device-%d", i), CompositeDevice.newBuilder()
                    .includes(Collections.singletonList(MIXIN_NAME))
                    .build()));
        }
        ResourceSliceMixins mixins = ResourceSliceMixins.of(
                Collections.singletonList(DeviceMixin.of(
                        MIXIN_NAME,
                        Collections.singletonMap("model", DeviceAttribute.ofString("x")),
                        null)),
                null,
                null);
        return withSpec(slice(name, nodeName, driver, 0), spec -> spec.devices(devices).mixins(mixins));
    }

    public static List<Device> basicDevices(int numDevices) {
        List<Device> devices = new ArrayList<>();
        for (int i = 0; i < numDevices; i++) {
            devices.add(Device.basic(String.format("device-%d", i), BasicDevice.newBuilder()
                    .attributes(testAttributes())
                    .capacity(testCapacity())
                    .build()));
        }
        return devices;
    }

    public static Map<String, DeviceAttribute> testAttributes() {
        Map<String, DeviceAttribute> attributes = new LinkedHashMap<>();
        attributes.put("int", DeviceAttribute.ofInt(42));
        attributes.put("string", DeviceAttribute.ofString("hello world"));
        attributes.put("version", DeviceAttribute.ofVersion("1.2.3"));
        attributes.put("bool", DeviceAttribute.ofBool(true));
        return attributes;
    }

    public static Map<String, DeviceCapacity> testCapacity() {
        return Collections.singletonMap("memory", DeviceCapacity.of("1Gi"));
    }

    /**
     * Returns a copy of the slice with its spec modified by {@code change}.
     */
    public static ResourceSlice withSpec(ResourceSlice slice, UnaryOperator<ResourceSliceSpec.Builder> change) {
        return slice.withSpec(change.apply(ResourceSliceSpec.newBuilder(slice.getSpec())).build());
    }

    /**
     * Returns a copy of the slice with its metadata modified by {@code change}.
     */
    public static ResourceSlice withMetadata(ResourceSlice slice, UnaryOperator<ObjectMeta.Builder> change) {
        return slice.withMetadata(change.apply(ObjectMeta.newBuilder(slice.getMetadata())).build());
    }

    /**
     * Returns a composite device which consumes capacity from the listed devices.
     */
    public static Device compositeDevice(String name, String... consumesCapacityFrom) {
        CompositeDevice.Builder builder = CompositeDevice.newBuilder();
        if (consumesCapacityFrom.length > 0) {
            List<String> refs = new ArrayList<>();
            Collections.addAll(refs, consumesCapacityFrom);
            builder.consumesCapacityFrom(refs);
        }
        return Device.composite(name, builder.build());
    }
}
