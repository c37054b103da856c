package com.apigw.discovery;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 服务定义：唯一名称 + 有序实例列表
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
@Builder(toBuilder = true)
public class ServiceDefinition {

    private final String name;

    @Singular
    private final List<ServiceInstance> instances;

    @Singular("metadataEntry")
    private final Map<String, String> metadata;

    @Builder.Default
    private final Instant registeredAt = Instant.now();

    public int healthyCount() {
        return (int) instances.stream().filter(ServiceInstance::isHealthy).count();
    }
}
