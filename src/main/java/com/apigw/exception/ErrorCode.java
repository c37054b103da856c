package com.apigw.exception;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 网关错误码
 * 每个错误码对应一个 HTTP 状态码和稳定的错误类别字符串
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 客户端输入错误
    ROUTE_NOT_FOUND(HttpResponseStatus.NOT_FOUND, "Route not found"),
    UNAUTHORIZED(HttpResponseStatus.UNAUTHORIZED, "Authentication required"),
    FORBIDDEN(HttpResponseStatus.FORBIDDEN, "Access denied"),

    // 限流与熔断
    RATE_LIMIT_EXCEEDED(HttpResponseStatus.TOO_MANY_REQUESTS, "Too many requests, please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpResponseStatus.SERVICE_UNAVAILABLE, "Circuit breaker is open, service temporarily unavailable"),

    // 后端故障
    SERVICE_UNAVAILABLE(HttpResponseStatus.SERVICE_UNAVAILABLE, "No healthy instance available"),
    BAD_GATEWAY(HttpResponseStatus.BAD_GATEWAY, "Backend request failed"),
    GATEWAY_TIMEOUT(HttpResponseStatus.GATEWAY_TIMEOUT, "Backend request timed out"),

    INTERNAL_ERROR(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpResponseStatus status;
    private final String message;

    /**
     * 是否属于服务端故障（5xx）
     */
    public boolean isServerError() {
        return status.code() >= 500;
    }
}
