package com.sandy.fleet.view.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceKeyTest {

    @Test
    void rendersIdAndVersion() {
        assertEquals("dev1:1.0", DeviceKey.of("dev1", "1.0").toString());
        assertNotEquals(DeviceKey.of("dev1", "1.0"), DeviceKey.of("dev1", "2.0"));
    }

    @Test
    void missingPartsRenderUndefined() {
        TopoEntity entity = TopoEntity.builder().id("dev1").type(EntityType.ENTITY).attributes(Map.of()).build();
        assertEquals("dev1:undefined", entity.deviceKey().toString());
        assertEquals("undefined:2.0", ConfigSnapshot.builder().deviceVersion("2.0").build().deviceKey().toString());
    }

    @Test
    void versionMayContainSeparator() {
        assertEquals("dev1:1.0:rc1", DeviceKey.of("dev1", "1.0:rc1").toString());
        assertEquals(DeviceKey.of("a:b", "c").toString(), DeviceKey.of("a", "b:c").toString());
    }
}
