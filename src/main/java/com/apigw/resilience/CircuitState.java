package com.apigw.resilience;

/**
 * 熔断器状态
 */
public enum CircuitState {

    /**
     * 正常放行
     */
    CLOSED,

    /**
     * 直接拒绝
     */
    OPEN,

    /**
     * 试探放行
     */
    HALF_OPEN
}
