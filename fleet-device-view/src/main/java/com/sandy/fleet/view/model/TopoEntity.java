package com.sandy.fleet.view.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Object reported by the topology stream. Relationship and kind objects share the shape but carry no device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopoEntity {
    public static final String VERSION_ATTRIBUTE = "version";

    private String id;
    @Builder.Default
    private EntityType type = EntityType.UNSPECIFIED;
    private String kindId;
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();
    @Builder.Default
    private List<ProtocolState> protocolStates = new ArrayList<>();

    public boolean isEntity() {
        return type == EntityType.ENTITY;
    }

    public String version() {
        return attributes == null ? null : attributes.get(VERSION_ATTRIBUTE);
    }

    public DeviceKey deviceKey() {
        return DeviceKey.of(id, version());
    }
}
