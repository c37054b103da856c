package com.apigw.discovery;

import reactor.core.publisher.Mono;

/**
 * 实例健康探测
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * 探测单个实例
     *
     * @param instance   实例
     * @param healthPath 健康检查路径
     * @return true 表示健康；出错由调用方按不健康处理
     */
    Mono<Boolean> probe(ServiceInstance instance, String healthPath);
}
