package com.sandy.fleet.view.transport;

import java.util.Map;

/**
 * 每次调用时重新读取 token，刷新后新发起的调用即可生效
 */
@FunctionalInterface
public interface CallCredentials {

    String AUTHORIZATION = "Authorization";

    String token();

    default Map<String, String> toMetadata() {
        String token = token();
        if (token == null || token.isBlank()) {
            return Map.of();
        }
        return Map.of(AUTHORIZATION, "Bearer " + token);
    }
}
