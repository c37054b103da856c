package com.apigw.discovery;

/**
 * 负载均衡算法
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public enum LoadBalancingAlgorithm {

    ROUND_ROBIN("round-robin"),

    LEAST_CONNECTIONS("least-connections"),

    RANDOM("random"),

    IP_HASH("ip-hash"),

    WEIGHTED("weighted");

    private final String value;

    LoadBalancingAlgorithm(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 按配置名解析，兼容 "round-robin" 与 "ROUND_ROBIN" 两种写法
     *
     * @param value 配置值
     * @return 算法
     */
    public static LoadBalancingAlgorithm fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return ROUND_ROBIN;
        }
        for (LoadBalancingAlgorithm algorithm : values()) {
            if (algorithm.value.equalsIgnoreCase(value) || algorithm.name().equalsIgnoreCase(value)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown load balancing algorithm: " + value);
    }
}
