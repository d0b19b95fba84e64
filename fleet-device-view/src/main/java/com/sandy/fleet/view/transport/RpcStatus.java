package com.sandy.fleet.view.transport;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 调用结束时的 status，仅记录日志
 */
@Value
@Builder
public class RpcStatus {
    StatusCode code;
    String details;
    @Builder.Default
    Map<String, String> metadata = Map.of();
}
