package com.apigw.discovery;

/**
 * 服务注册表订阅者
 * 通知在状态修改完成之后发出
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public interface ServiceRegistryListener {

    default void onRegistered(ServiceDefinition service) {
    }

    default void onDeregistered(String serviceName) {
    }

    default void onHealthChanged(HealthChangeEvent event) {
    }
}
