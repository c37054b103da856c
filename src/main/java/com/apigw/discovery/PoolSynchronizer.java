package com.apigw.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将注册表的成员关系与健康状态同步到负载均衡池
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class PoolSynchronizer implements ServiceRegistryListener {

    private static final Logger log = LoggerFactory.getLogger(PoolSynchronizer.class);

    private final LoadBalancer loadBalancer;

    public PoolSynchronizer(LoadBalancer loadBalancer) {
        this.loadBalancer = loadBalancer;
    }

    @Override
    public void onRegistered(ServiceDefinition service) {
        loadBalancer.register(service.getName(), service.getInstances());
        log.debug("同步服务 {} 到负载均衡池", service.getName());
    }

    @Override
    public void onDeregistered(String serviceName) {
        loadBalancer.unregister(serviceName);
    }

    @Override
    public void onHealthChanged(HealthChangeEvent event) {
        loadBalancer.setHealth(event.getServiceName(), event.getInstanceUrl(), event.isHealthy());
    }
}
