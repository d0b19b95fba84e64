package com.sandy.fleet.view.transport;

/**
 * Receives the events of one server-streaming call. The transport invokes {@link #onData} zero or more
 * times and then at most one of {@link #onError} or {@link #onEnd}.
 */
public interface CallListener<T> {

    void onData(T message);

    void onError(RpcError error);

    void onEnd();

    default void onStatus(RpcStatus status) {
    }
}
