package com.apigw.resilience;

import lombok.Value;

/**
 * 单个限流键的计数快照
 */
@Value
public class RateLimitStats {

    String key;

    int count;

    int limit;

    int remaining;

    long resetAt;
}
