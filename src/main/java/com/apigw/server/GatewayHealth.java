package com.apigw.server;

import lombok.Builder;
import lombok.Value;

/**
 * 健康检查端点返回内容
 */
@Value
@Builder
public class GatewayHealth {

    String status;

    long uptimeMs;

    int routes;

    int middlewares;

    long heapUsed;

    long heapMax;

    int processors;

    int threads;

    String timestamp;
}
