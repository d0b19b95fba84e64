package com.sandy.fleet.view.transport;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CompactChangesRequest {
    Duration retentionPeriod;
}
