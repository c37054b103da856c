package com.apigw.discovery;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 注册表统计快照
 */
@Value
public class RegistryStats {

    int totalServices;

    List<ServiceStats> services;

    @Value
    public static class ServiceStats {

        String name;

        int instances;

        int healthyInstances;

        Instant registeredAt;
    }
}
