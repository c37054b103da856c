package com.apigw.discovery;

import lombok.Value;

import java.time.Instant;

/**
 * 实例健康状态翻转通知
 */
@Value
public class HealthChangeEvent {

    String serviceName;

    String instanceId;

    String instanceUrl;

    boolean healthy;

    Instant timestamp;
}
