package com.apigw.discovery;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 负载均衡池中的实例记录
 * 健康标记、连接计数与最近使用时间在并发选择下原子更新
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
public class PoolInstance {

    private final String url;

    private final int weight;

    private final Map<String, String> metadata;

    private volatile boolean healthy = true;

    private final AtomicInteger connections = new AtomicInteger();

    private volatile Instant lastUsed;

    public PoolInstance(String url, int weight, Map<String, String> metadata) {
        this.url = url;
        this.weight = weight > 0 ? weight : 1;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static PoolInstance from(ServiceInstance instance) {
        return new PoolInstance(instance.getUrl(), instance.getWeight(), instance.getMetadata());
    }

    public int getConnections() {
        return connections.get();
    }

    void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    /**
     * 被选中：连接数加一并记录使用时间
     */
    void acquire() {
        connections.incrementAndGet();
        lastUsed = Instant.now();
    }

    /**
     * 释放连接，计数不小于零
     */
    void release() {
        connections.getAndUpdate(c -> c > 0 ? c - 1 : 0);
    }

    @Override
    public String toString() {
        return url;
    }
}
