package com.apigw.filter.impl;

import com.apigw.config.GatewayProperties;
import com.apigw.exception.CircuitOpenException;
import com.apigw.exception.GatewayException;
import com.apigw.filter.FilterChain;
import com.apigw.filter.GatewayFilter;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.model.RouteMatch;
import com.apigw.resilience.CircuitBreaker;
import com.apigw.resilience.CircuitBreakerConfig;
import com.apigw.resilience.CircuitBreakerStats;
import com.apigw.router.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 熔断过滤器
 * GLOBAL 粒度下所有请求共用一个熔断器，ROUTE 粒度下每个路由一个熔断器
 *
 * 计为失败：后端异常、5xx 网关异常、状态码 >= 500 的响应。
 * 熔断器自身的拒绝不计入失败。
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Component
public class CircuitBreakerFilter implements GatewayFilter {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerFilter.class);

    static final String GLOBAL_CIRCUIT = "global";

    private final GatewayProperties.CircuitBreakerProperties properties;
    private final Router router;
    private final Clock clock;
    private final CircuitBreakerConfig breakerConfig;
    private final ConcurrentHashMap<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();

    @Autowired
    public CircuitBreakerFilter(GatewayProperties properties, Router router) {
        this(properties, router, Clock.systemUTC());
    }

    public CircuitBreakerFilter(GatewayProperties properties, Router router, Clock clock) {
        this.properties = properties.getCircuitBreaker();
        this.router = router;
        this.clock = clock;
        this.breakerConfig = CircuitBreakerConfig.builder()
                .threshold(this.properties.getThreshold())
                .timeout(Duration.ofMillis(this.properties.getTimeoutMs()))
                .monitoringPeriod(Duration.ofMillis(this.properties.getMonitoringPeriodMs()))
                .build();

        log.info("初始化熔断过滤器: scope={}, threshold={}, timeout={}ms, monitoringPeriod={}ms",
                this.properties.getScope(), breakerConfig.getThreshold(),
                this.properties.getTimeoutMs(), this.properties.getMonitoringPeriodMs());
    }

    @Override
    public String getName() {
        return "CircuitBreakerFilter";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public Mono<GatewayResponse> filter(RequestContext context, FilterChain chain) {
        String circuitName = resolveCircuitName(context);
        if (circuitName == null) {
            // 未匹配路由，交给后续 404 处理
            return chain.filter(context);
        }

        CircuitBreaker circuitBreaker = getOrCreate(circuitName);
        if (!circuitBreaker.tryAcquire()) {
            Duration retryAfter = circuitBreaker.getRetryAfter();
            log.warn("[{}] 熔断器打开，拒绝请求: circuit={}, retryAfter={}ms",
                    context.getRequestId(), circuitName, retryAfter.toMillis());
            return Mono.error(new CircuitOpenException(circuitName, retryAfter));
        }

        return chain.filter(context)
                .doOnSuccess(response -> {
                    int status = response != null ? response.getStatusCode() : context.getResponseStatus();
                    if (status >= 500) {
                        circuitBreaker.recordFailure();
                    } else {
                        circuitBreaker.recordSuccess();
                    }
                })
                .doOnError(e -> {
                    if (isFailure(e)) {
                        log.debug("[{}] 熔断器记录失败: circuit={}, error={}",
                                context.getRequestId(), circuitName, e.toString());
                        circuitBreaker.recordFailure();
                    }
                });
    }

    private String resolveCircuitName(RequestContext context) {
        if (properties.getScope() == GatewayProperties.CircuitBreakerScope.GLOBAL) {
            return GLOBAL_CIRCUIT;
        }
        RouteMatch match = router.match(context);
        return match != null ? match.getRoute().getPath() : null;
    }

    /**
     * 熔断拒绝与 4xx 类网关异常不计入失败
     */
    static boolean isFailure(Throwable e) {
        if (e instanceof CircuitOpenException) {
            return false;
        }
        if (e instanceof GatewayException) {
            return ((GatewayException) e).getErrorCode().isServerError();
        }
        return true;
    }

    CircuitBreaker getOrCreate(String name) {
        return circuitBreakers.computeIfAbsent(name, id -> {
            log.info("创建熔断器: {}", id);
            return new CircuitBreaker(id, breakerConfig, clock);
        });
    }

    /**
     * 获取熔断器状态（用于监控）
     *
     * @param name 熔断器名称，GLOBAL 粒度为 "global"，ROUTE 粒度为路由路径
     * @return 状态快照，熔断器不存在时返回 null
     */
    public CircuitBreakerStats getStats(String name) {
        CircuitBreaker cb = circuitBreakers.get(name);
        return cb != null ? cb.getStats() : null;
    }

    public List<CircuitBreakerStats> getAllStats() {
        List<CircuitBreakerStats> stats = new ArrayList<>();
        circuitBreakers.values().forEach(cb -> stats.add(cb.getStats()));
        return stats;
    }

    /**
     * 重置熔断器（用于运维操作）
     */
    public void reset(String name) {
        CircuitBreaker cb = circuitBreakers.get(name);
        if (cb != null) {
            cb.reset();
            log.info("已重置熔断器 {}", name);
        }
    }
}
