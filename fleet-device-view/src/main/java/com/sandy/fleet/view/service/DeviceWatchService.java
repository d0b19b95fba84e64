package com.sandy.fleet.view.service;

import com.sandy.fleet.view.model.DeviceRecord;
import com.sandy.fleet.view.model.DeviceSortCriterion;
import com.sandy.fleet.view.registry.DeviceRegistry;

import java.util.List;

/**
 * Keeps the device registry fed from the topology and configuration snapshot streams.
 */
public interface DeviceWatchService {

    DeviceRegistry getRegistry();

    void watchConfigurations(ErrorCallback errorCallback);

    void watchConfigurations(String wildcard, ErrorCallback errorCallback);

    void stopWatchingConfigurations();

    SubscriptionState configurationState();

    void watchTopology(ErrorCallback errorCallback);

    void stopWatchingTopology();

    SubscriptionState topologyState();

    List<String> deviceStatusStyles(String deviceKey);

    List<DeviceRecord> devices(DeviceSortCriterion criterion, boolean descending);

    void shutdown();
}
