package com.sandy.fleet.view.transport;

/**
 * 服务端流式调用
 */
public interface StreamingCall<T> {

    void start(CallListener<T> listener);

    // 连接可能异步释放
    void cancel();
}
