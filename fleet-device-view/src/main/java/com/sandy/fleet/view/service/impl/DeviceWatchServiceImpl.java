package com.sandy.fleet.view.service.impl;

import com.sandy.fleet.view.bridge.StreamBridge;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.DeviceRecord;
import com.sandy.fleet.view.model.DeviceSortCriterion;
import com.sandy.fleet.view.model.TopoEntity;
import com.sandy.fleet.view.registry.DeviceRegistry;
import com.sandy.fleet.view.service.ConfigAdminService;
import com.sandy.fleet.view.service.DeviceWatchService;
import com.sandy.fleet.view.service.ErrorCallback;
import com.sandy.fleet.view.service.SubscriptionState;
import com.sandy.fleet.view.transport.CallCredentials;
import com.sandy.fleet.view.transport.TopoClient;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the device registry and the two subscriptions that feed it. Every write to the registry goes
 * through the stream handlers here.
 */
@Service
@Slf4j
public class DeviceWatchServiceImpl implements DeviceWatchService {

    private final ConfigAdminService adminService;
    private final TopoClient topoClient;
    private final StreamBridge streamBridge;
    private final CallCredentials credentials;
    private final DeviceRegistry registry = new DeviceRegistry();
    private final ManagedSubscription configurations = new ManagedSubscription("configurations");
    private final ManagedSubscription topology = new ManagedSubscription("topology");

    @Value("${fleet.watch.snapshot-filter:}")
    private String snapshotFilter = "";
    @Value("${fleet.watch.auto-start:false}")
    private boolean autoStart;

    public DeviceWatchServiceImpl(ConfigAdminService adminService, TopoClient topoClient,
                                  StreamBridge streamBridge, CallCredentials credentials) {
        this.adminService = adminService;
        this.topoClient = topoClient;
        this.streamBridge = streamBridge;
        this.credentials = credentials;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (!autoStart) return;
        ErrorCallback logOnly = e -> log.error("Watch failed, restart required: {}", e.getMessage());
        watchTopology(logOnly);
        watchConfigurations(logOnly);
    }

    @Override
    public DeviceRegistry getRegistry() {
        return registry;
    }

    @Override
    public void watchConfigurations(ErrorCallback errorCallback) {
        watchConfigurations(snapshotFilter, errorCallback);
    }

    @Override
    public void watchConfigurations(String wildcard, ErrorCallback errorCallback) {
        configurations.start(adminService.requestSnapshots(wildcard), this::onSnapshot, errorCallback);
    }

    @Override
    public void stopWatchingConfigurations() {
        configurations.stop();
    }

    @Override
    public SubscriptionState configurationState() {
        return configurations.state();
    }

    @Override
    public void watchTopology(ErrorCallback errorCallback) {
        topology.start(
                streamBridge.bridgeStream("WatchEntities", () -> topoClient.watchEntities(credentials.toMetadata())),
                this::onTopoEntity,
                errorCallback);
    }

    @Override
    public void stopWatchingTopology() {
        topology.stop();
    }

    @Override
    public SubscriptionState topologyState() {
        return topology.state();
    }

    @Override
    public List<String> deviceStatusStyles(String deviceKey) {
        return registry.statusStylesFor(deviceKey);
    }

    @Override
    public List<DeviceRecord> devices(DeviceSortCriterion criterion, boolean descending) {
        return registry.devices(criterion, descending);
    }

    @Override
    @PreDestroy
    public void shutdown() {
        configurations.stop();
        topology.stop();
        log.info("Device watch shut down with {} devices and {} configurations",
                registry.size(), registry.configurationCount());
    }

    private void onSnapshot(ConfigSnapshot s) {
        log.debug("List Snapshots response for {} {} {}", s.getId(), s.getSnapshotId(),
                s.getValues() == null ? 0 : s.getValues().size());
        registry.upsertFromConfigSnapshot(s);
    }

    private void onTopoEntity(TopoEntity entity) {
        registry.upsertFromTopology(entity);
    }
}
