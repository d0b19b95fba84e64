package com.sandy.fleet.view.bridge;

import com.sandy.fleet.view.transport.CallListener;
import com.sandy.fleet.view.transport.ResponseCallback;
import com.sandy.fleet.view.transport.RpcError;
import com.sandy.fleet.view.transport.RpcStatus;
import com.sandy.fleet.view.transport.StatusCode;
import com.sandy.fleet.view.transport.StreamingCall;
import com.sandy.fleet.view.transport.UnaryCall;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Adapts the two call shapes of the transport to Mutiny. The call is issued once per subscription;
 * transport errors are forwarded untouched. Cancelling a subscription before the call terminated
 * releases the call exactly once.
 */
@Component
@Slf4j
public class StreamBridge {

    public <T> Multi<T> bridgeStream(String name, Supplier<StreamingCall<T>> issueCall) {
        return Multi.createFrom().emitter(emitter -> {
            StreamingCall<T> call;
            try {
                call = issueCall.get();
            } catch (RuntimeException e) {
                log.warn("Failed to issue call {}: {}", name, e.getMessage());
                emitter.fail(e);
                return;
            }
            AtomicBoolean finished = new AtomicBoolean();
            emitter.onTermination(() -> {
                if (finished.compareAndSet(false, true)) {
                    log.debug("Call {} cancelled by subscriber", name);
                    call.cancel();
                }
            });
            call.start(new CallListener<>() {
                @Override
                public void onData(T message) {
                    if (message == null) {
                        onError(new RpcError(StatusCode.INTERNAL, "Call " + name + " emitted a null item"));
                        return;
                    }
                    emitter.emit(message);
                }

                @Override
                public void onError(RpcError error) {
                    if (!finished.compareAndSet(false, true)) return;
                    log.debug("Stream {} failed: {}", name, error.toString());
                    emitter.fail(error);
                }

                @Override
                public void onEnd() {
                    if (!finished.compareAndSet(false, true)) return;
                    log.debug("Stream {} ended", name);
                    emitter.complete();
                }

                @Override
                public void onStatus(RpcStatus status) {
                    log.debug("{} status {} {} {}", name, status.getCode(), status.getDetails(), status.getMetadata());
                }
            });
        });
    }

    /**
     * 成功响应为一个 item，失败为一个 failure；trailing status 只记日志。
     */
    public <T> Uni<T> bridgeUnaryCall(String name, Function<ResponseCallback<T>, UnaryCall> issueCall) {
        return Uni.createFrom().emitter(emitter -> {
            AtomicBoolean finished = new AtomicBoolean();
            UnaryCall call;
            try {
                call = issueCall.apply((error, response) -> {
                    if (!finished.compareAndSet(false, true)) return;
                    if (error != null) {
                        emitter.fail(error);
                    } else if (response == null) {
                        emitter.fail(new RpcError(StatusCode.INTERNAL, "Call " + name + " completed without a response"));
                    } else {
                        emitter.complete(response);
                    }
                });
            } catch (RuntimeException e) {
                log.warn("Failed to issue call {}: {}", name, e.getMessage());
                emitter.fail(e);
                return;
            }
            call.onStatus(status -> log.info("{} status {} {} {}", name, status.getCode(), status.getDetails(), status.getMetadata()));
            emitter.onTermination(() -> {
                if (finished.compareAndSet(false, true)) {
                    log.debug("Call {} cancelled by subscriber", name);
                    call.cancel();
                }
            });
        });
    }
}
