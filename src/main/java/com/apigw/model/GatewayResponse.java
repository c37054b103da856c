package com.apigw.model;

import com.apigw.exception.ErrorCode;
import com.apigw.exception.GatewayException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 网关响应模型
 * 由网关自身生成的响应（错误、健康检查），后端响应走流式转发不经过该模型
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayResponse {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * HTTP 状态码
     */
    private int statusCode;

    /**
     * 响应头
     */
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * 响应体
     */
    private byte[] body;

    /**
     * 错误类别（用于错误响应）
     */
    private String errorCode;

    /**
     * 错误消息（用于错误响应）
     */
    private String errorMessage;

    /**
     * 创建 JSON 响应
     *
     * @param statusCode 状态码
     * @param payload    响应对象
     * @return GatewayResponse
     */
    public static GatewayResponse json(int statusCode, Object payload) {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        return GatewayResponse.builder()
                .statusCode(statusCode)
                .headers(headers)
                .body(writeJson(payload))
                .build();
    }

    /**
     * 创建错误响应
     * 响应体结构：{error, message, status, timestamp, requestId}
     *
     * @param errorCode 错误码
     * @param message   错误消息，为空时使用错误码默认消息
     * @param requestId 请求 ID
     * @return GatewayResponse
     */
    public static GatewayResponse error(ErrorCode errorCode, String message, String requestId) {
        String text = message != null ? message : errorCode.getMessage();
        int status = errorCode.getStatus().code();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", errorCode.name());
        payload.put("message", text);
        payload.put("status", status);
        payload.put("timestamp", Instant.now().toString());
        if (requestId != null) {
            payload.put("requestId", requestId);
        }

        GatewayResponse response = json(status, payload);
        response.setErrorCode(errorCode.name());
        response.setErrorMessage(text);
        return response;
    }

    /**
     * 由网关异常创建错误响应
     */
    public static GatewayResponse error(GatewayException e, String requestId) {
        return error(e.getErrorCode(), e.getMessage(), requestId);
    }

    public static GatewayResponse notFound(String message, String requestId) {
        return error(ErrorCode.ROUTE_NOT_FOUND, message, requestId);
    }

    public static GatewayResponse unauthorized(String message, String requestId) {
        return error(ErrorCode.UNAUTHORIZED, message, requestId);
    }

    public static GatewayResponse forbidden(String message, String requestId) {
        return error(ErrorCode.FORBIDDEN, message, requestId);
    }

    /**
     * 创建 429 响应，附带 Retry-After（秒，向上取整）
     */
    public static GatewayResponse tooManyRequests(String message, String requestId, long retryAfterMillis) {
        GatewayResponse response = error(ErrorCode.RATE_LIMIT_EXCEEDED, message, requestId);
        response.addHeader("Retry-After", String.valueOf(toRetryAfterSeconds(retryAfterMillis)));
        return response;
    }

    /**
     * 创建 500 响应，不暴露内部细节
     */
    public static GatewayResponse internalServerError(String requestId) {
        return error(ErrorCode.INTERNAL_ERROR, null, requestId);
    }

    /**
     * 毫秒转换为 Retry-After 秒数，至少为 1
     */
    public static long toRetryAfterSeconds(long millis) {
        return Math.max(1, (millis + 999) / 1000);
    }

    /**
     * 添加响应头
     *
     * @param name  响应头名称
     * @param value 响应头值
     */
    public void addHeader(String name, String value) {
        if (headers == null) {
            headers = new HashMap<>();
        }
        headers.put(name, value);
    }

    public String bodyAsString() {
        return body != null ? new String(body, StandardCharsets.UTF_8) : "";
    }

    private static byte[] writeJson(Object payload) {
        try {
            return MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }
}
