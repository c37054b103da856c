package com.apigw.discovery;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务实例
 * 注册后身份（id、url、元数据）不变，健康状态持续变化
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
public class ServiceInstance {

    public static final String META_HEALTH_PATH = "healthPath";
    public static final String META_WEIGHT = "weight";

    private final String id;

    private final String url;

    private final Map<String, String> metadata;

    private final Instant registeredAt;

    private final AtomicBoolean healthy = new AtomicBoolean(true);

    private volatile Instant lastCheck;

    @Builder
    public ServiceInstance(String id, String url, Map<String, String> metadata) {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Instance url must not be empty");
        }
        this.id = id;
        this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        this.registeredAt = Instant.now();
    }

    /**
     * 以指定 ID 复制实例（注册时分配 ID 使用）
     */
    ServiceInstance withId(String newId) {
        return new ServiceInstance(newId, url, metadata);
    }

    public boolean isHealthy() {
        return healthy.get();
    }

    /**
     * 更新健康状态
     *
     * @return 状态是否发生翻转
     */
    boolean updateHealth(boolean value) {
        lastCheck = Instant.now();
        return healthy.getAndSet(value) != value;
    }

    /**
     * 健康检查路径，未配置时返回默认值
     */
    public String getHealthPath(String defaultPath) {
        String path = metadata.get(META_HEALTH_PATH);
        return path != null && !path.isEmpty() ? path : defaultPath;
    }

    /**
     * 负载均衡权重，未配置或非法时为 1
     */
    public int getWeight() {
        String weight = metadata.get(META_WEIGHT);
        if (weight == null) {
            return 1;
        }
        try {
            int value = Integer.parseInt(weight.trim());
            return value > 0 ? value : 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    @Override
    public String toString() {
        return id + "(" + url + ")";
    }
}
