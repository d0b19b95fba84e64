package com.sandy.fleet.view.controller;

import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.DeviceSortCriterion;
import com.sandy.fleet.view.service.DeviceWatchService;
import com.sandy.fleet.view.service.ErrorCallback;
import com.sandy.fleet.view.vo.DeviceVO;
import com.sandy.fleet.view.vo.WatchStateVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 设备列表查询，以及两个订阅的启停
 */
@Controller
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceWatchService deviceWatchService;
    private final AtomicReference<String> lastError = new AtomicReference<>();

    @GetMapping(value = "/devices", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public List<DeviceVO> listDevices(@RequestParam(value = "sort", defaultValue = "ALPHABETICAL") DeviceSortCriterion sort,
                                      @RequestParam(value = "order", defaultValue = "asc") String order) {
        boolean descending = "desc".equalsIgnoreCase(order);
        return deviceWatchService.devices(sort, descending).stream().map(DeviceVO::of).toList();
    }

    @GetMapping(value = "/devices/{key}/styles", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public List<String> deviceStyles(@PathVariable String key) {
        return deviceWatchService.deviceStatusStyles(key);
    }

    @GetMapping(value = "/configurations/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ConfigSnapshot> configuration(@PathVariable String id) {
        return deviceWatchService.getRegistry().snapshot(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/watch", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public WatchStateVO watchState() {
        return WatchStateVO.builder()
                .configurations(deviceWatchService.configurationState())
                .topology(deviceWatchService.topologyState())
                .devices(deviceWatchService.getRegistry().size())
                .configurationSnapshots(deviceWatchService.getRegistry().configurationCount())
                .lastError(lastError.get())
                .build();
    }

    @PostMapping(value = "/watch/configurations", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public WatchStateVO watchConfigurations(@RequestParam(value = "wildcard", required = false) String wildcard) {
        lastError.set(null);
        if (wildcard == null) {
            deviceWatchService.watchConfigurations(recordError("configurations"));
        } else {
            deviceWatchService.watchConfigurations(wildcard, recordError("configurations"));
        }
        return watchState();
    }

    @DeleteMapping(value = "/watch/configurations", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public WatchStateVO stopWatchingConfigurations() {
        deviceWatchService.stopWatchingConfigurations();
        return watchState();
    }

    @PostMapping(value = "/watch/topology", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public WatchStateVO watchTopology() {
        lastError.set(null);
        deviceWatchService.watchTopology(recordError("topology"));
        return watchState();
    }

    @DeleteMapping(value = "/watch/topology", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public WatchStateVO stopWatchingTopology() {
        deviceWatchService.stopWatchingTopology();
        return watchState();
    }

    private ErrorCallback recordError(String stream) {
        return e -> {
            log.error("Watch on {} failed: {}", stream, e.getMessage());
            lastError.set(stream + ": " + e.getMessage());
        };
    }
}
