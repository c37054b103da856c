package com.apigw.exception;

/**
 * 后端转发失败
 * 连接失败、提前关闭等传输错误对应 502，超时对应 504
 * 消息只使用错误码的默认文案，后端地址只写入日志
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public class ProxyException extends GatewayException {

    public ProxyException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ProxyException badGateway(Throwable cause) {
        return new ProxyException(ErrorCode.BAD_GATEWAY, ErrorCode.BAD_GATEWAY.getMessage(), cause);
    }

    public static ProxyException timeout(Throwable cause) {
        return new ProxyException(ErrorCode.GATEWAY_TIMEOUT, ErrorCode.GATEWAY_TIMEOUT.getMessage(), cause);
    }
}
