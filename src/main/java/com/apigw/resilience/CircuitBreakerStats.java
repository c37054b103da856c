package com.apigw.resilience;

import lombok.Value;

import java.time.Instant;

/**
 * 熔断器状态快照
 */
@Value
public class CircuitBreakerStats {

    String name;

    CircuitState state;

    int failures;

    int halfOpenSuccesses;

    Instant lastFailureTime;

    Instant nextAttemptTime;
}
