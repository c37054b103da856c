package com.apigw.model;

import lombok.Value;

import java.time.Duration;

/**
 * 重试策略
 * 第 n 次重试前等待 delay × 2^n（n 从 0 开始）
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
public class RetryPolicy {

    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ofMillis(1000));

    /**
     * 首次失败后的最大重试次数
     */
    int attempts;

    /**
     * 基础退避时间
     */
    Duration delay;

    public static RetryPolicy of(int attempts, Duration delay) {
        if (attempts < 0) {
            throw new IllegalArgumentException("Retry attempts must not be negative: " + attempts);
        }
        return new RetryPolicy(attempts, delay != null ? delay : NONE.getDelay());
    }

    /**
     * 计算第 n 次重试前的等待时间
     */
    public Duration backoff(int retryIndex) {
        return delay.multipliedBy(1L << retryIndex);
    }

    public boolean isEnabled() {
        return attempts > 0;
    }
}
