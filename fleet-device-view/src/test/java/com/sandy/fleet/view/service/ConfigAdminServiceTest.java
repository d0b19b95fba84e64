package com.sandy.fleet.view.service;

import com.sandy.fleet.view.InMemoryTransport;
import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.transport.RpcError;
import com.sandy.fleet.view.transport.StatusCode;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ConfigAdminServiceTest {

    @Autowired ConfigAdminService configAdminService;
    @Autowired InMemoryTransport transport;

    @BeforeEach
    void setup() {
        transport.reset();
    }

    @Test
    void rollbackUsesDefaultComment() throws Exception {
        Uni<RollbackResponse> rollback = configAdminService.requestRollback("change-1");
        assertTrue(transport.rollbackRequests.isEmpty(), "call is issued on subscription");

        RollbackResponse resp = rollback.subscribeAsCompletionStage().get(1, TimeUnit.SECONDS);
        assertEquals("rolled back change-1", resp.getMessage());
        assertEquals("change-1", transport.rollbackRequests.get(0).getName());
        assertEquals("Rolled back from GUI", transport.rollbackRequests.get(0).getComment());
    }

    @Test
    void rollbackKeepsGivenComment() throws Exception {
        configAdminService.requestRollback("change-2", "bad vlan").subscribeAsCompletionStage().get(1, TimeUnit.SECONDS);
        assertEquals("bad vlan", transport.rollbackRequests.get(0).getComment());
    }

    @Test
    void rollbackFailureSurfacesTransportError() {
        RpcError error = new RpcError(StatusCode.NOT_FOUND, "change-3 not found");
        transport.failNextUnary(error);
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> configAdminService.requestRollback("change-3").subscribeAsCompletionStage().get(1, TimeUnit.SECONDS));
        assertSame(error, ex.getCause());
    }

    @Test
    void compactBuildsRetentionDuration() throws Exception {
        CompactChangesResponse resp = configAdminService.requestCompactChanges(3600).subscribeAsCompletionStage().get(1, TimeUnit.SECONDS);
        assertEquals(3, resp.getCompactedChanges());
        assertEquals(Duration.ofHours(1), transport.compactRequests.get(0).getRetentionPeriod());
    }

    @Test
    void modelListingIsVerboseAndRaw() throws Exception {
        ModelInfo stratum = ModelInfo.builder().name("stratum").version("1.0.0").module("stratum.so.1.0.0").build();
        ModelInfo devicesim = ModelInfo.builder().name("devicesim").version("1.0.0").module("devicesim.so.1.0.0").build();
        transport.setModels(List.of(stratum, devicesim));

        List<ModelInfo> models = configAdminService.requestListRegisteredModels().collect().asList().subscribeAsCompletionStage().get(1, TimeUnit.SECONDS);
        assertEquals(List.of(stratum, devicesim), models);
        assertTrue(transport.modelRequests.get(0).isVerbose());
    }
}
