package com.sandy.fleet.view.service.impl;

import com.sandy.fleet.view.bridge.StreamBridge;
import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.service.ConfigAdminService;
import com.sandy.fleet.view.transport.CallCredentials;
import com.sandy.fleet.view.transport.CompactChangesRequest;
import com.sandy.fleet.view.transport.ConfigAdminClient;
import com.sandy.fleet.view.transport.ListModelsRequest;
import com.sandy.fleet.view.transport.ListSnapshotsRequest;
import com.sandy.fleet.view.transport.RollbackRequest;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@Slf4j
@RequiredArgsConstructor
public class ConfigAdminServiceImpl implements ConfigAdminService {

    private final ConfigAdminClient adminClient;
    private final StreamBridge streamBridge;
    private final CallCredentials credentials;

    @Value("${fleet.config.url:http://localhost:5150}")
    private String configUrl;
    @Value("${fleet.admin.default-rollback-comment:Rolled back from GUI}")
    private String defaultRollbackComment = "Rolled back from GUI";

    @PostConstruct
    public void init() {
        log.info("Config Admin Url {}", configUrl);
    }

    @Override
    public Uni<RollbackResponse> requestRollback(String changeName, String comment) {
        RollbackRequest request = RollbackRequest.builder()
                .name(changeName)
                .comment(comment == null || comment.isBlank() ? defaultRollbackComment : comment)
                .build();
        log.info("Requesting rollback of network change {}", changeName);
        return streamBridge.bridgeUnaryCall("Rollback",
                callback -> adminClient.rollbackNetworkChange(request, credentials.toMetadata(), callback));
    }

    @Override
    public Multi<ModelInfo> requestListRegisteredModels() {
        ListModelsRequest request = ListModelsRequest.builder().verbose(true).build();
        return streamBridge.bridgeStream("ListRegisteredModels", () -> {
            log.info("ListRegisteredModels sent to {}", configUrl);
            return adminClient.listRegisteredModels(request, credentials.toMetadata());
        });
    }

    @Override
    public Multi<ConfigSnapshot> requestSnapshots(String wildcard) {
        ListSnapshotsRequest request = ListSnapshotsRequest.builder()
                .subscribe(true)
                .id(wildcard == null ? "" : wildcard)
                .build();
        return streamBridge.bridgeStream("ListSnapshots", () -> {
            log.info("ListSnapshots sent to {} filter='{}'", configUrl, request.getId());
            return adminClient.listSnapshots(request, credentials.toMetadata());
        });
    }

    @Override
    public Uni<CompactChangesResponse> requestCompactChanges(long retentionSeconds) {
        CompactChangesRequest request = CompactChangesRequest.builder()
                .retentionPeriod(Duration.ofSeconds(retentionSeconds))
                .build();
        log.info("Compacting changes older than {} second(s)", retentionSeconds);
        return streamBridge.bridgeUnaryCall("Compact changes",
                callback -> adminClient.compactChanges(request, credentials.toMetadata(), callback));
    }
}
