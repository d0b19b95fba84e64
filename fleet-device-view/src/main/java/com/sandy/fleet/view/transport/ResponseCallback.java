package com.sandy.fleet.view.transport;

/**
 * Completion callback of a unary call; exactly one of the arguments is non-null.
 */
@FunctionalInterface
public interface ResponseCallback<T> {
    void onResponse(RpcError error, T response);
}
