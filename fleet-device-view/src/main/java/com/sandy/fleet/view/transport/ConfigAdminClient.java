package com.sandy.fleet.view.transport;

import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;

import java.util.Map;

/**
 * Administrative surface of the configuration service. Implementations own the wire protocol;
 * {@code metadata} is sent as call headers.
 */
public interface ConfigAdminClient {

    UnaryCall rollbackNetworkChange(RollbackRequest request, Map<String, String> metadata,
                                    ResponseCallback<RollbackResponse> callback);

    StreamingCall<ModelInfo> listRegisteredModels(ListModelsRequest request, Map<String, String> metadata);

    StreamingCall<ConfigSnapshot> listSnapshots(ListSnapshotsRequest request, Map<String, String> metadata);

    UnaryCall compactChanges(CompactChangesRequest request, Map<String, String> metadata,
                             ResponseCallback<CompactChangesResponse> callback);
}
