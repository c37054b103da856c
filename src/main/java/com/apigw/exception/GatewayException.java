package com.apigw.exception;

import lombok.Getter;

/**
 * 网关异常
 * 组件通过该异常向调用方报告带类型的失败，由编排器统一映射为 HTTP 状态码
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    public GatewayException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
