package com.sandy.fleet.view;

import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.model.TopoEntity;
import com.sandy.fleet.view.transport.CompactChangesRequest;
import com.sandy.fleet.view.transport.ConfigAdminClient;
import com.sandy.fleet.view.transport.ListModelsRequest;
import com.sandy.fleet.view.transport.ListSnapshotsRequest;
import com.sandy.fleet.view.transport.ResponseCallback;
import com.sandy.fleet.view.transport.RollbackRequest;
import com.sandy.fleet.view.transport.RpcError;
import com.sandy.fleet.view.transport.StreamingCall;
import com.sandy.fleet.view.transport.TopoClient;
import com.sandy.fleet.view.transport.UnaryCall;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stands in for the configuration and topology services in tests. Streaming calls stay open until the
 * test pushes or terminates them; unary calls answer immediately unless a failure is armed.
 */
@Component
@Profile("test")
public class InMemoryTransport implements ConfigAdminClient, TopoClient {

    public final List<FakeStreamingCall<ConfigSnapshot>> snapshotCalls = new CopyOnWriteArrayList<>();
    public final List<FakeStreamingCall<TopoEntity>> topoCalls = new CopyOnWriteArrayList<>();
    public final List<ListSnapshotsRequest> snapshotRequests = new CopyOnWriteArrayList<>();
    public final List<ListModelsRequest> modelRequests = new CopyOnWriteArrayList<>();
    public final List<RollbackRequest> rollbackRequests = new CopyOnWriteArrayList<>();
    public final List<CompactChangesRequest> compactRequests = new CopyOnWriteArrayList<>();
    public final List<Map<String, String>> metadataSeen = new CopyOnWriteArrayList<>();

    private volatile List<ModelInfo> models = new ArrayList<>();
    private volatile RpcError nextUnaryError;

    public void reset() {
        snapshotCalls.clear();
        topoCalls.clear();
        snapshotRequests.clear();
        modelRequests.clear();
        rollbackRequests.clear();
        compactRequests.clear();
        metadataSeen.clear();
        models = new ArrayList<>();
        nextUnaryError = null;
    }

    public void setModels(List<ModelInfo> models) {
        this.models = new ArrayList<>(models);
    }

    public void failNextUnary(RpcError error) {
        this.nextUnaryError = error;
    }

    public FakeStreamingCall<ConfigSnapshot> lastSnapshotCall() {
        return snapshotCalls.get(snapshotCalls.size() - 1);
    }

    public FakeStreamingCall<TopoEntity> lastTopoCall() {
        return topoCalls.get(topoCalls.size() - 1);
    }

    @Override
    public UnaryCall rollbackNetworkChange(RollbackRequest request, Map<String, String> metadata,
                                           ResponseCallback<RollbackResponse> callback) {
        rollbackRequests.add(request);
        metadataSeen.add(metadata);
        return answer(callback, RollbackResponse.builder().message("rolled back " + request.getName()).build());
    }

    @Override
    public StreamingCall<ModelInfo> listRegisteredModels(ListModelsRequest request, Map<String, String> metadata) {
        modelRequests.add(request);
        metadataSeen.add(metadata);
        return new FakeStreamingCall<>(models, true);
    }

    @Override
    public StreamingCall<ConfigSnapshot> listSnapshots(ListSnapshotsRequest request, Map<String, String> metadata) {
        snapshotRequests.add(request);
        metadataSeen.add(metadata);
        FakeStreamingCall<ConfigSnapshot> call = new FakeStreamingCall<>();
        snapshotCalls.add(call);
        return call;
    }

    @Override
    public UnaryCall compactChanges(CompactChangesRequest request, Map<String, String> metadata,
                                    ResponseCallback<CompactChangesResponse> callback) {
        compactRequests.add(request);
        metadataSeen.add(metadata);
        return answer(callback, CompactChangesResponse.builder().compactedChanges(3).build());
    }

    @Override
    public StreamingCall<TopoEntity> watchEntities(Map<String, String> metadata) {
        metadataSeen.add(metadata);
        FakeStreamingCall<TopoEntity> call = new FakeStreamingCall<>();
        topoCalls.add(call);
        return call;
    }

    private <T> UnaryCall answer(ResponseCallback<T> callback, T response) {
        FakeUnaryCall<T> call = new FakeUnaryCall<>(callback);
        RpcError error = nextUnaryError;
        nextUnaryError = null;
        if (error != null) {
            call.fail(error);
        } else {
            call.respond(response);
        }
        return call;
    }
}
