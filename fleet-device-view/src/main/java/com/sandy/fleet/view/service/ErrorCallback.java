package com.sandy.fleet.view.service;

/**
 * Receives the terminal failure of a watched stream, typically a
 * {@link com.sandy.fleet.view.transport.RpcError} as reported by the transport.
 */
@FunctionalInterface
public interface ErrorCallback {
    void onError(Throwable error);
}
