package com.apigw.resilience;

import lombok.Value;

import java.time.Duration;

/**
 * 一次限流准入检查的结果
 */
@Value
public class RateLimitResult {

    boolean allowed;

    int limit;

    int remaining;

    /**
     * 当前窗口结束时间（epoch 毫秒）
     */
    long resetAt;

    /**
     * 被拒绝时建议的重试等待时间，放行时为零
     */
    Duration retryAfter;
}
