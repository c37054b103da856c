package com.apigw.discovery;

import com.apigw.util.TraceIdGenerator;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 服务注册表
 * 维护服务及其实例的成员关系与健康状态，并按配置周期性探测实例健康
 *
 * 重新注册同名服务时采用替换语义：停止旧的探测任务并整体替换实例列表。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class ServiceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Settings settings;
    private final HealthProbe healthProbe;

    private final Map<String, ServiceDefinition> services = new ConcurrentHashMap<>();

    /**
     * 每个服务的健康检查任务
     */
    private final Map<String, Disposable> healthChecks = new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<ServiceRegistryListener> listeners = new CopyOnWriteArrayList<>();

    public ServiceRegistry(Settings settings, HealthProbe healthProbe) {
        this.settings = settings;
        this.healthProbe = healthProbe;
    }

    /**
     * 注册服务
     *
     * @param service 服务定义
     * @return 注册后的服务定义（实例已分配 ID 并标记为健康）
     */
    public ServiceDefinition register(ServiceDefinition service) {
        if (service == null || service.getName() == null || service.getName().isEmpty()
                || service.getInstances() == null || service.getInstances().isEmpty()) {
            throw new IllegalArgumentException("Service name and instances are required");
        }

        String name = service.getName();
        List<ServiceInstance> instances = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        for (ServiceInstance instance : service.getInstances()) {
            if (!seenUrls.add(instance.getUrl())) {
                log.warn("服务 {} 中实例地址 {} 重复，忽略", name, instance.getUrl());
                continue;
            }
            String id = instance.getId() != null && !instance.getId().isEmpty()
                    ? instance.getId() : TraceIdGenerator.generateShort();
            instances.add(instance.withId(id));
        }

        ServiceDefinition registered = service.toBuilder()
                .clearInstances()
                .instances(instances)
                .registeredAt(Instant.now())
                .build();

        stopHealthChecks(name);
        ServiceDefinition previous = services.put(name, registered);
        if (previous != null) {
            log.info("服务 {} 已存在，替换为新的实例列表", name);
        }
        log.info("注册服务: {}，实例数 {}", name, instances.size());

        for (ServiceRegistryListener listener : listeners) {
            try {
                listener.onRegistered(registered);
            } catch (Exception e) {
                log.error("通知服务注册监听器失败: service={}", name, e);
            }
        }

        if (settings.isHealthCheck()) {
            startHealthChecks(name);
        }
        return registered;
    }

    /**
     * 注销服务，取消其健康检查并移除所有实例状态
     *
     * @param name 服务名
     * @return 服务是否存在
     */
    public boolean deregister(String name) {
        stopHealthChecks(name);
        if (services.remove(name) == null) {
            return false;
        }
        log.info("注销服务: {}", name);
        for (ServiceRegistryListener listener : listeners) {
            try {
                listener.onDeregistered(name);
            } catch (Exception e) {
                log.error("通知服务注销监听器失败: service={}", name, e);
            }
        }
        return true;
    }

    public ServiceDefinition getService(String name) {
        return services.get(name);
    }

    public List<ServiceDefinition> getAllServices() {
        return new ArrayList<>(services.values());
    }

    /**
     * 获取服务的健康实例
     */
    public List<ServiceInstance> getHealthyInstances(String name) {
        ServiceDefinition service = services.get(name);
        if (service == null) {
            return Collections.emptyList();
        }
        List<ServiceInstance> healthy = new ArrayList<>();
        for (ServiceInstance instance : service.getInstances()) {
            if (instance.isHealthy()) {
                healthy.add(instance);
            }
        }
        return healthy;
    }

    /**
     * 更新实例健康状态，仅在状态翻转时发出通知
     *
     * @param serviceName 服务名
     * @param instanceId  实例 ID
     * @param healthy     健康状态
     * @return 实例是否存在
     */
    public boolean updateHealth(String serviceName, String instanceId, boolean healthy) {
        ServiceDefinition service = services.get(serviceName);
        if (service == null) {
            return false;
        }
        ServiceInstance instance = findInstance(service, instanceId);
        if (instance == null) {
            return false;
        }

        if (instance.updateHealth(healthy)) {
            log.info("服务 {} 的实例 {} 状态变更为 {}", serviceName, instance, healthy ? "健康" : "不健康");
            HealthChangeEvent event = new HealthChangeEvent(serviceName, instance.getId(), instance.getUrl(),
                    healthy, instance.getLastCheck());
            for (ServiceRegistryListener listener : listeners) {
                try {
                    listener.onHealthChanged(event);
                } catch (Exception e) {
                    log.error("通知健康状态监听器失败: service={}, instance={}", serviceName, instanceId, e);
                }
            }
        }
        return true;
    }

    /**
     * 对服务的所有实例执行一轮健康检查
     * 每个实例独立探测，互不阻塞；探测超时视为不健康
     *
     * @param name 服务名
     * @return 本轮检查完成信号
     */
    public Mono<Void> performHealthChecks(String name) {
        ServiceDefinition service = services.get(name);
        if (service == null) {
            return Mono.empty();
        }
        return Flux.fromIterable(service.getInstances())
                .flatMap(instance -> checkInstance(name, instance))
                .then();
    }

    private Mono<Boolean> checkInstance(String serviceName, ServiceInstance instance) {
        String healthPath = instance.getHealthPath(settings.getDefaultHealthPath());
        return Mono.defer(() -> healthProbe.probe(instance, healthPath))
                .timeout(settings.getHealthCheckTimeout())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.debug("服务 {} 的实例 {} 健康检查失败: {}", serviceName, instance, e.toString());
                    return Mono.just(false);
                })
                .doOnNext(healthy -> updateHealth(serviceName, instance.getId(), healthy));
    }

    private void startHealthChecks(String name) {
        Disposable task = Flux.interval(Duration.ZERO, settings.getHealthCheckInterval())
                .onBackpressureDrop()
                .concatMap(tick -> performHealthChecks(name))
                .subscribe(
                        unused -> { },
                        e -> log.error("服务 {} 的健康检查任务异常终止", name, e));
        Disposable previous = healthChecks.put(name, task);
        if (previous != null) {
            previous.dispose();
        }
        log.debug("启动服务 {} 的健康检查，间隔 {}", name, settings.getHealthCheckInterval());
    }

    private void stopHealthChecks(String name) {
        Disposable task = healthChecks.remove(name);
        if (task != null) {
            task.dispose();
            log.debug("停止服务 {} 的健康检查", name);
        }
    }

    private static ServiceInstance findInstance(ServiceDefinition service, String instanceId) {
        for (ServiceInstance instance : service.getInstances()) {
            if (instance.getId().equals(instanceId)) {
                return instance;
            }
        }
        return null;
    }

    public void addListener(ServiceRegistryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ServiceRegistryListener listener) {
        listeners.remove(listener);
    }

    /**
     * 注册表统计
     */
    public RegistryStats getStats() {
        List<RegistryStats.ServiceStats> stats = new ArrayList<>();
        for (ServiceDefinition service : services.values()) {
            stats.add(new RegistryStats.ServiceStats(service.getName(), service.getInstances().size(),
                    service.healthyCount(), service.getRegisteredAt()));
        }
        return new RegistryStats(services.size(), stats);
    }

    /**
     * 停止所有健康检查并清空注册表
     */
    @Override
    public void close() {
        for (String name : new ArrayList<>(healthChecks.keySet())) {
            stopHealthChecks(name);
        }
        services.clear();
        log.info("服务注册表已关闭");
    }

    /**
     * 注册表配置
     */
    @Value
    @Builder
    public static class Settings {

        @Builder.Default
        boolean healthCheck = false;

        @Builder.Default
        Duration healthCheckInterval = Duration.ofMillis(30000);

        @Builder.Default
        Duration healthCheckTimeout = Duration.ofMillis(5000);

        @Builder.Default
        String defaultHealthPath = "/health";
    }
}
