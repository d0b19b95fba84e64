package com.sandy.fleet.view.registry;

import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.DeviceKey;
import com.sandy.fleet.view.model.DeviceRecord;
import com.sandy.fleet.view.model.DeviceSortCriterion;
import com.sandy.fleet.view.model.EntityType;
import com.sandy.fleet.view.model.PathValue;
import com.sandy.fleet.view.model.ProtocolState;
import com.sandy.fleet.view.model.ProtocolStates;
import com.sandy.fleet.view.model.RecordSource;
import com.sandy.fleet.view.model.TopoEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 拓扑流与配置快照流中出现过的所有设备。
 * <p>
 * 两张表：设备表以渲染后的 {@code deviceId:version} 字符串为键，配置表以快照自身的 id 为键。设备不会被删除；
 * 拓扑字段覆盖由快照合成的占位记录，快照之间后写覆盖先写。写操作在本实例上串行，查询返回副本。
 */
@Slf4j
public class DeviceRegistry {

    private final Map<String, DeviceRecord> devices = new HashMap<>();
    private final Map<String, ConfigSnapshot> configurations = new HashMap<>();

    /**
     * Merges one topology object.
     *
     * @return true if the registry changed
     */
    public synchronized boolean upsertFromTopology(TopoEntity entity) {
        if (entity == null) {
            log.debug("Ignoring null topo entity");
            return false;
        }
        if (!entity.isEntity()) {
            log.trace("Ignoring topo object {} of type {}", entity.getId(), entity.getType());
            return false;
        }
        DeviceKey key = entity.deviceKey();
        DeviceRecord existing = devices.get(key.toString());
        if (existing == null) {
            devices.put(key.toString(), fromTopology(key, entity));
            log.info("Adding topo entity {} {}", key, entity.getType());
            return true;
        }
        if (existing.getSource() == RecordSource.CONFIGURATION) {
            devices.put(key.toString(), fromTopology(key, entity));
            log.info("Topo entity {} replaces configuration placeholder", key);
            return true;
        }
        List<ProtocolState> latest = protocolStatesOf(entity);
        if (!latest.equals(existing.getProtocolStates())) {
            existing.setProtocolStates(latest);
            log.debug("Protocol states of {} updated to {}", key, ProtocolStates.deriveStatusLabels(latest));
            return true;
        }
        return false;
    }

    /**
     * Stores the snapshot, last write wins, and creates a placeholder device the first time its
     * {@code deviceId:deviceVersion} is seen.
     *
     * @return true if a device was created
     */
    public synchronized boolean upsertFromConfigSnapshot(ConfigSnapshot snapshot) {
        if (snapshot == null) {
            log.debug("Ignoring null configuration snapshot");
            return false;
        }
        DeviceKey key = snapshot.deviceKey();
        boolean created = false;
        if (!devices.containsKey(key.toString())) {
            devices.put(key.toString(), fromSnapshot(key, snapshot));
            log.info("Adding config entity {}", key);
            created = true;
        }
        String id = snapshot.getId() != null ? snapshot.getId() : key.toString();
        configurations.put(id, copyOf(snapshot));
        return created;
    }

    public synchronized Optional<DeviceRecord> find(String key) {
        DeviceRecord r = key == null ? null : devices.get(key);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    public synchronized Optional<ConfigSnapshot> snapshot(String id) {
        ConfigSnapshot s = id == null ? null : configurations.get(id);
        return s == null ? Optional.empty() : Optional.of(copyOf(s));
    }

    public synchronized int size() {
        return devices.size();
    }

    public synchronized int configurationCount() {
        return configurations.size();
    }

    public synchronized SortedSet<String> keys() {
        return new TreeSet<>(devices.keySet());
    }

    /**
     * 设备的状态样式；key 未知或设备没有协议状态时返回空列表。
     */
    public synchronized List<String> statusStylesFor(String key) {
        DeviceRecord r = key == null ? null : devices.get(key);
        if (r == null) {
            log.debug("Could not find key {}", key);
            return Collections.emptyList();
        }
        return ProtocolStates.deriveStatusLabels(r.getProtocolStates());
    }

    public synchronized int statusCodeFor(String key) {
        DeviceRecord r = key == null ? null : devices.get(key);
        return r == null ? 0 : r.statusCode();
    }

    public synchronized List<Map.Entry<String, DeviceRecord>> entries() {
        List<Map.Entry<String, DeviceRecord>> list = new ArrayList<>(devices.size());
        devices.forEach((k, v) -> list.add(new AbstractMap.SimpleImmutableEntry<>(k, v.copy())));
        return list;
    }

    public List<DeviceRecord> devices(DeviceSortCriterion criterion, boolean descending) {
        List<Map.Entry<String, DeviceRecord>> list = entries();
        list.sort(DeviceComparators.forCriterion(criterion, descending));
        List<DeviceRecord> result = new ArrayList<>(list.size());
        for (Map.Entry<String, DeviceRecord> e : list) {
            result.add(e.getValue());
        }
        return result;
    }

    private static DeviceRecord fromTopology(DeviceKey key, TopoEntity entity) {
        return DeviceRecord.builder()
                .deviceId(key.deviceId())
                .version(key.version())
                .kind(entity.getKindId())
                .entityType(EntityType.ENTITY)
                .source(RecordSource.TOPOLOGY)
                .attributes(entity.getAttributes() == null ? new HashMap<>() : new HashMap<>(entity.getAttributes()))
                .protocolStates(protocolStatesOf(entity))
                .build();
    }

    private static DeviceRecord fromSnapshot(DeviceKey key, ConfigSnapshot snapshot) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put(TopoEntity.VERSION_ATTRIBUTE, key.version());
        return DeviceRecord.builder()
                .deviceId(key.deviceId())
                .version(key.version())
                .kind(snapshot.getDeviceType())
                .entityType(EntityType.ENTITY)
                .source(RecordSource.CONFIGURATION)
                .attributes(attributes)
                .protocolStates(new ArrayList<>())
                .build();
    }

    private static List<ProtocolState> protocolStatesOf(TopoEntity entity) {
        List<ProtocolState> states = new ArrayList<>();
        if (entity.getProtocolStates() != null) {
            entity.getProtocolStates().stream().filter(Objects::nonNull).forEach(states::add);
        }
        return states;
    }

    private static ConfigSnapshot copyOf(ConfigSnapshot snapshot) {
        List<PathValue> values = new ArrayList<>();
        if (snapshot.getValues() != null) {
            for (PathValue v : snapshot.getValues()) {
                if (v != null) values.add(PathValue.builder().path(v.getPath()).value(v.getValue()).build());
            }
        }
        return snapshot.toBuilder().values(values).build();
    }
}
