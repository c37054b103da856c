package com.apigw.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 熔断器配置
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
@Builder
public class CircuitBreakerConfig {

    /**
     * 监控窗口内触发熔断的失败次数
     */
    @Builder.Default
    int threshold = 5;

    /**
     * 熔断打开后进入半开前的等待时间
     */
    @Builder.Default
    Duration timeout = Duration.ofMillis(60000);

    /**
     * 失败统计窗口
     */
    @Builder.Default
    Duration monitoringPeriod = Duration.ofMillis(60000);

    /**
     * 半开状态下关闭熔断所需的成功次数：ceil(threshold / 2)
     */
    public int getHalfOpenSuccessThreshold() {
        return (threshold + 1) / 2;
    }
}
