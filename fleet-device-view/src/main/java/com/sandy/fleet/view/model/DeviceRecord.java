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
 * Merged view of one device. Owned by the registry; callers only ever see copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRecord {
    private String deviceId;
    private String version;
    private String kind;
    @Builder.Default
    private EntityType entityType = EntityType.ENTITY;
    private RecordSource source;
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();
    @Builder.Default
    private List<ProtocolState> protocolStates = new ArrayList<>();

    public DeviceKey key() {
        return DeviceKey.of(deviceId, version);
    }

    public int statusCode() {
        return ProtocolStates.deriveStatusCode(protocolStates);
    }

    public DeviceRecord copy() {
        return toBuilder()
                .attributes(new HashMap<>(attributes == null ? Map.of() : attributes))
                .protocolStates(new ArrayList<>(protocolStates == null ? List.of() : protocolStates))
                .build();
    }
}
