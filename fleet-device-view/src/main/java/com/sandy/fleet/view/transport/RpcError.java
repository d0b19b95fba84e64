package com.sandy.fleet.view.transport;

import java.util.Map;

/**
 * Terminal failure of a call as reported by the transport. Passed to subscribers as is so that the
 * status code, details and trailing metadata stay inspectable.
 */
public class RpcError extends RuntimeException {

    private final StatusCode code;
    private final Map<String, String> metadata;

    public RpcError(StatusCode code, String message) {
        this(code, message, Map.of());
    }

    public RpcError(StatusCode code, String message, Map<String, String> metadata) {
        super(message);
        this.code = code == null ? StatusCode.UNKNOWN : code;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public StatusCode getCode() {
        return code;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "RpcError{code=" + code + ", message=" + getMessage() + "}";
    }
}
