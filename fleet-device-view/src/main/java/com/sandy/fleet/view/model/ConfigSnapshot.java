package com.sandy.fleet.view.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time configuration of one device as pushed by the snapshot stream.
 * {@code id} keys the configuration table; {@code deviceId:deviceVersion} keys the device registry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConfigSnapshot {
    private String id;
    private String deviceId;
    private String deviceType;
    private String deviceVersion;
    private String snapshotId;
    @Builder.Default
    private List<PathValue> values = new ArrayList<>();

    public DeviceKey deviceKey() {
        return DeviceKey.of(deviceId, deviceVersion);
    }
}
