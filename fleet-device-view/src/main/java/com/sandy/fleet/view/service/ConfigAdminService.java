package com.sandy.fleet.view.service;

import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ConfigSnapshot;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Calls of the configuration admin service. Nothing is sent until the returned Uni/Multi is subscribed.
 */
public interface ConfigAdminService {

    Uni<RollbackResponse> requestRollback(String changeName, String comment);

    default Uni<RollbackResponse> requestRollback(String changeName) {
        return requestRollback(changeName, null);
    }

    Multi<ModelInfo> requestListRegisteredModels();

    Multi<ConfigSnapshot> requestSnapshots(String wildcard);

    Uni<CompactChangesResponse> requestCompactChanges(long retentionSeconds);
}
