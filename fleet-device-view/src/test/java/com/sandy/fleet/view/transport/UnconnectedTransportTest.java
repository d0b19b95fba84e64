package com.sandy.fleet.view.transport;

import com.sandy.fleet.view.bridge.StreamBridge;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.model.TopoEntity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UnconnectedTransportTest {

    private final UnconnectedTransport transport = new UnconnectedTransport();
    private final StreamBridge bridge = new StreamBridge();

    @Test
    void streamingCallsFailUnavailable() {
        List<Throwable> errors = new ArrayList<>();
        List<TopoEntity> data = new ArrayList<>();
        bridge.<TopoEntity>bridgeStream("WatchEntities", () -> transport.watchEntities(Map.of()))
                .subscribe().with(data::add, errors::add);

        assertTrue(data.isEmpty());
        assertEquals(1, errors.size());
        assertEquals(StatusCode.UNAVAILABLE, ((RpcError) errors.get(0)).getCode());
    }

    @Test
    void unaryCallsFailUnavailable() {
        RollbackRequest request = RollbackRequest.builder().name("change-1").comment("c").build();
        ExecutionException ex = assertThrows(ExecutionException.class, () ->
                bridge.<RollbackResponse>bridgeUnaryCall("Rollback",
                                callback -> transport.rollbackNetworkChange(request, Map.of(), callback))
                        .subscribeAsCompletionStage().get(1, TimeUnit.SECONDS));
        assertInstanceOf(RpcError.class, ex.getCause());
        assertEquals(StatusCode.UNAVAILABLE, ((RpcError) ex.getCause()).getCode());
    }
}
