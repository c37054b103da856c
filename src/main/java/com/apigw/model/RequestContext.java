package com.apigw.model;

import com.apigw.auth.AuthenticatedPrincipal;
import com.apigw.discovery.PoolInstance;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * 请求上下文
 * 每个入站请求创建一份，贯穿过滤器链与转发器，完成事件发出后丢弃，不跨请求共享
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
@Setter
@Builder
public class RequestContext {

    private final String requestId;

    private final Instant startTime;

    /**
     * HTTP 方法（大写）
     */
    private final String method;

    /**
     * 完整 URI（包含查询参数）
     */
    private final String uri;

    /**
     * 原始路径（不含查询参数）
     */
    private final String path;

    private final String queryString;

    /**
     * 入站协议：http 或 https
     */
    @Builder.Default
    private final String scheme = "http";

    private final String clientIp;

    @Builder.Default
    private final HttpHeaders requestHeaders = new DefaultHttpHeaders();

    /**
     * 待写回客户端的响应头，过滤器可在转发前追加
     */
    @Builder.Default
    private final HttpHeaders responseHeaders = new DefaultHttpHeaders();

    /**
     * 底层入站请求，单元测试中可以为空
     */
    private final HttpServerRequest request;

    private final HttpServerResponse response;

    private volatile RouteMatch route;

    private volatile PoolInstance selectedInstance;

    private volatile AuthenticatedPrincipal principal;

    /**
     * 实际写回客户端的状态码，0 表示尚未写出
     */
    private volatile int responseStatus;

    /**
     * 获取请求头（不区分大小写）
     */
    public String getHeader(String name) {
        return requestHeaders.get(name);
    }

    public Duration elapsed() {
        return Duration.between(startTime, Instant.now());
    }

    public RouteDefinition getRouteDefinition() {
        RouteMatch match = route;
        return match != null ? match.getRoute() : null;
    }
}
