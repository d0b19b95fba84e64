package com.sandy.fleet.view.transport;

import com.sandy.fleet.view.model.TopoEntity;

import java.util.Map;

/**
 * Topology service: streams every known object, then each change as it happens.
 */
public interface TopoClient {

    StreamingCall<TopoEntity> watchEntities(Map<String, String> metadata);
}
