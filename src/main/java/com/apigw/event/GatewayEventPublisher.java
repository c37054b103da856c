package com.apigw.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 事件分发
 * 单个监听器异常不影响其他监听器与请求处理
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class GatewayEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(GatewayEventPublisher.class);

    private final List<GatewayEventListener> listeners = new CopyOnWriteArrayList<>();

    public GatewayEventPublisher() {
    }

    public GatewayEventPublisher(List<GatewayEventListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public void addListener(GatewayEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GatewayEventListener listener) {
        listeners.remove(listener);
    }

    public void publishStarted(int port) {
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onStarted(port);
            } catch (Exception e) {
                log.error("监听器处理启动事件失败: {}", listener.getClass().getSimpleName(), e);
            }
        }
    }

    public void publishRequestCompleted(RequestCompletedEvent event) {
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onRequestCompleted(event);
            } catch (Exception e) {
                log.error("[{}] 监听器处理请求完成事件失败: {}", event.getRequestId(),
                        listener.getClass().getSimpleName(), e);
            }
        }
    }

    public void publishError(String requestId, Throwable error) {
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onError(requestId, error);
            } catch (Exception e) {
                log.error("[{}] 监听器处理错误事件失败: {}", requestId, listener.getClass().getSimpleName(), e);
            }
        }
    }

    public void publishStopped() {
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onStopped();
            } catch (Exception e) {
                log.error("监听器处理停止事件失败: {}", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
