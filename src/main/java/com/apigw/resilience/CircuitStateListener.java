package com.apigw.resilience;

/**
 * 熔断器状态变更监听器，在状态修改完成后回调
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String circuitName, CircuitState from, CircuitState to);
}
