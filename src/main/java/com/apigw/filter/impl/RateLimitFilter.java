package com.apigw.filter.impl;

import com.apigw.config.GatewayProperties;
import com.apigw.filter.FilterChain;
import com.apigw.filter.GatewayFilter;
import com.apigw.model.GatewayResponse;
import com.apigw.model.RequestContext;
import com.apigw.resilience.FixedWindowRateLimiter;
import com.apigw.resilience.RateLimitResult;
import io.netty.handler.codec.http.HttpHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 限流过滤器
 * 基于固定窗口计数，默认按客户端 IP 限流，可配置为按请求头（如 X-API-Key）限流
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Component
public class RateLimitFilter implements GatewayFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";

    private final GatewayProperties.RateLimitProperties config;
    private final FixedWindowRateLimiter rateLimiter;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitFilter(GatewayProperties properties, FixedWindowRateLimiter rateLimiter) {
        this.config = properties.getRateLimit();
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String getName() {
        return "RateLimitFilter";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Mono<GatewayResponse> filter(RequestContext context, FilterChain chain) {
        if (shouldSkip(context.getPath())) {
            return chain.filter(context);
        }

        String key = resolveKey(context);
        RateLimitResult result = rateLimiter.tryAcquire(key);

        if (!result.isAllowed()) {
            log.warn("[{}] 限流触发，拒绝请求: key={}, limit={}", context.getRequestId(), key, result.getLimit());
            GatewayResponse response = GatewayResponse.tooManyRequests(
                    "Rate limit exceeded, try again later", context.getRequestId(),
                    result.getRetryAfter().toMillis());
            response.addHeader(HEADER_LIMIT, String.valueOf(result.getLimit()));
            response.addHeader(HEADER_REMAINING, "0");
            response.addHeader(HEADER_RESET, String.valueOf(result.getResetAt()));
            return Mono.just(response);
        }

        HttpHeaders headers = context.getResponseHeaders();
        headers.set(HEADER_LIMIT, result.getLimit());
        headers.set(HEADER_REMAINING, result.getRemaining());
        headers.set(HEADER_RESET, result.getResetAt());

        log.debug("[{}] 限流检查通过: key={}, remaining={}", context.getRequestId(), key, result.getRemaining());
        return chain.filter(context);
    }

    /**
     * 限流键：配置的请求头优先，其次客户端 IP
     */
    String resolveKey(RequestContext context) {
        String header = config.getKeyHeader();
        if (header != null && !header.isEmpty()) {
            String value = context.getHeader(header);
            if (value != null && !value.isEmpty()) {
                return header.toLowerCase() + ":" + value;
            }
        }
        return context.getClientIp();
    }

    private boolean shouldSkip(String path) {
        List<String> skipPaths = config.getSkipPaths();
        if (skipPaths == null || skipPaths.isEmpty()) {
            return false;
        }
        for (String skipPath : skipPaths) {
            if (pathMatcher.match(skipPath, path)) {
                return true;
            }
        }
        return false;
    }
}
