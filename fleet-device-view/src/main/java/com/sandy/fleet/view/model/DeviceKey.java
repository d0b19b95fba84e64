package com.sandy.fleet.view.model;

import java.util.Objects;

/**
 * 设备标识 {@code deviceId:version}。注册表以渲染后的字符串为键，所以两个渲染结果相同的 key 指向同一台设备。
 */
public record DeviceKey(String deviceId, String version) {

    // 缺失部分的渲染值，与现有客户端生成的 key 保持一致
    public static final String MISSING = "undefined";

    public static final char SEPARATOR = ':';

    public DeviceKey {
        deviceId = Objects.requireNonNullElse(deviceId, MISSING);
        version = Objects.requireNonNullElse(version, MISSING);
    }

    public static DeviceKey of(String deviceId, String version) {
        return new DeviceKey(deviceId, version);
    }

    @Override
    public String toString() {
        return deviceId + SEPARATOR + version;
    }
}
