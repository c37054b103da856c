package com.apigw.discovery;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 负载均衡池统计快照
 */
@Value
public class LoadBalancerStats {

    String serviceName;

    LoadBalancingAlgorithm algorithm;

    int totalInstances;

    int healthyInstances;

    int activeConnections;

    List<InstanceStats> instances;

    @Value
    public static class InstanceStats {

        String url;

        boolean healthy;

        int connections;

        int weight;

        Instant lastUsed;
    }
}
