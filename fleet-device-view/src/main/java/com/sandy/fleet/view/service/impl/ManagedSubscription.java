package com.sandy.fleet.view.service.impl;

import com.sandy.fleet.view.service.ErrorCallback;
import com.sandy.fleet.view.service.SubscriptionState;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.Cancellable;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * 一个逻辑流最多持有一个订阅，并跟踪其生命周期。已被替换的订阅发来的信号直接忽略。
 */
@Slf4j
final class ManagedSubscription {

    private final String name;
    private SubscriptionState state = SubscriptionState.IDLE;
    private Cancellable cancellable;
    private long generation;

    ManagedSubscription(String name) {
        this.name = name;
    }

    synchronized SubscriptionState state() {
        return state;
    }

    synchronized boolean holdsCall() {
        return cancellable != null;
    }

    synchronized <T> void start(Multi<T> stream, Consumer<T> onData, ErrorCallback errorCallback) {
        if (state == SubscriptionState.ACTIVE) {
            log.info("Restarting {} subscription", name);
            stop();
        }
        long gen = ++generation;
        state = SubscriptionState.ACTIVE;
        Cancellable c = stream.subscribe().with(
                onData,
                error -> failed(gen, error, errorCallback),
                () -> completed(gen));
        // 调用可能在 subscribe 内同步结束（例如传输层直接失败）
        if (state != SubscriptionState.ACTIVE) {
            log.info("{} subscription ended while starting: {}", name, state);
            return;
        }
        cancellable = c;
        log.info("Watching {}", name);
    }

    synchronized void stop() {
        if (state != SubscriptionState.ACTIVE) {
            log.debug("{} subscription not active ({}), nothing to stop", name, state);
            return;
        }
        state = SubscriptionState.CANCELLED;
        Cancellable c = cancellable;
        cancellable = null;
        if (c != null) {
            c.cancel();
        }
        log.info("Stopped watching {}", name);
    }

    private void failed(long gen, Throwable error, ErrorCallback errorCallback) {
        synchronized (this) {
            if (gen != generation || state != SubscriptionState.ACTIVE) return;
            state = SubscriptionState.ERRORED;
            cancellable = null;
        }
        log.warn("Error on {} subscription: {}", name, String.valueOf(error));
        if (errorCallback != null) {
            errorCallback.onError(error);
        }
    }

    private synchronized void completed(long gen) {
        if (gen != generation || state != SubscriptionState.ACTIVE) return;
        state = SubscriptionState.COMPLETED;
        cancellable = null;
        log.info("{} stream completed", name);
    }
}
