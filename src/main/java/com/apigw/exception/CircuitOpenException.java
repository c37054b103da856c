package com.apigw.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 熔断器打开时的拒绝信号
 * 与被保护操作自身的失败相区分，不计入熔断失败次数
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
public class CircuitOpenException extends GatewayException {

    private final String circuitName;

    /**
     * 距离下一次允许尝试的剩余时间
     */
    private final Duration retryAfter;

    public CircuitOpenException(String circuitName, Duration retryAfter) {
        super(ErrorCode.CIRCUIT_BREAKER_OPEN, "Circuit breaker '" + circuitName + "' is OPEN");
        this.circuitName = circuitName;
        this.retryAfter = retryAfter;
    }
}
