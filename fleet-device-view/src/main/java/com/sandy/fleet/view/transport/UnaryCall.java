package com.sandy.fleet.view.transport;

import java.util.function.Consumer;

/**
 * Handle of an in-flight request/response call; the result goes to the {@link ResponseCallback}.
 */
public interface UnaryCall {

    void onStatus(Consumer<RpcStatus> statusListener);

    void cancel();
}
