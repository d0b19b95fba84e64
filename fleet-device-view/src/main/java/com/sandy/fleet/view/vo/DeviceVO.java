package com.sandy.fleet.view.vo;

import com.sandy.fleet.view.model.DeviceRecord;
import com.sandy.fleet.view.model.ProtocolStates;
import com.sandy.fleet.view.model.RecordSource;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DeviceVO {
    private String key;
    private String deviceId;
    private String version;
    private String kind;
    private RecordSource source;
    private int statusCode;
    private List<String> styles;

    public static DeviceVO of(DeviceRecord r) {
        return DeviceVO.builder()
                .key(r.key().toString())
                .deviceId(r.getDeviceId())
                .version(r.getVersion())
                .kind(r.getKind())
                .source(r.getSource())
                .statusCode(r.statusCode())
                .styles(ProtocolStates.deriveStatusLabels(r.getProtocolStates()))
                .build();
    }
}
