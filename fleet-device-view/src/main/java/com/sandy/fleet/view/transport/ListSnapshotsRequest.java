package com.sandy.fleet.view.transport;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot listing; {@code id} is a wildcard filter, empty for every device.
 */
@Value
@Builder
public class ListSnapshotsRequest {
    boolean subscribe;
    String id;
}
