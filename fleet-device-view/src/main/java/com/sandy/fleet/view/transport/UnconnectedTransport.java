package com.sandy.fleet.view.transport;

import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.model.TopoEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Consumer;

/**
 * 未部署传输层时的默认实现，所有调用直接以 UNAVAILABLE 失败。
 * 自带客户端的部署设置 {@code fleet.transport.placeholder=false}。
 */
@Component
@ConditionalOnProperty(name = "fleet.transport.placeholder", havingValue = "true", matchIfMissing = true)
@Slf4j
public class UnconnectedTransport implements ConfigAdminClient, TopoClient {

    @Value("${fleet.config.url:http://localhost:5150}")
    private String configUrl;

    @Override
    public UnaryCall rollbackNetworkChange(RollbackRequest request, Map<String, String> metadata,
                                           ResponseCallback<RollbackResponse> callback) {
        return failUnary("RollbackNetworkChange", callback);
    }

    @Override
    public StreamingCall<ModelInfo> listRegisteredModels(ListModelsRequest request, Map<String, String> metadata) {
        return failStream("ListRegisteredModels");
    }

    @Override
    public StreamingCall<ConfigSnapshot> listSnapshots(ListSnapshotsRequest request, Map<String, String> metadata) {
        return failStream("ListSnapshots");
    }

    @Override
    public UnaryCall compactChanges(CompactChangesRequest request, Map<String, String> metadata,
                                    ResponseCallback<CompactChangesResponse> callback) {
        return failUnary("CompactChanges", callback);
    }

    @Override
    public StreamingCall<TopoEntity> watchEntities(Map<String, String> metadata) {
        return failStream("WatchEntities");
    }

    private RpcError unavailable(String method) {
        log.warn("{} not sent, no transport connected to {}", method, configUrl);
        return new RpcError(StatusCode.UNAVAILABLE, "No transport connected to " + configUrl);
    }

    private <T> StreamingCall<T> failStream(String method) {
        RpcError error = unavailable(method);
        return new StreamingCall<>() {
            @Override
            public void start(CallListener<T> listener) {
                listener.onError(error);
            }

            @Override
            public void cancel() {
            }
        };
    }

    private <T> UnaryCall failUnary(String method, ResponseCallback<T> callback) {
        callback.onResponse(unavailable(method), null);
        return new UnaryCall() {
            @Override
            public void onStatus(Consumer<RpcStatus> statusListener) {
            }

            @Override
            public void cancel() {
            }
        };
    }
}
