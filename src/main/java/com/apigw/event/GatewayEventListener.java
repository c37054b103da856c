package com.apigw.event;

/**
 * 网关生命周期与请求事件监听器
 * 监听器只读，不能修改请求上下文，也不应阻塞调用线程
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public interface GatewayEventListener {

    default void onStarted(int port) {
    }

    default void onRequestCompleted(RequestCompletedEvent event) {
    }

    default void onError(String requestId, Throwable error) {
    }

    default void onStopped() {
    }
}
