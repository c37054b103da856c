package com.apigw.event;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * 请求完成事件
 * 无论请求以何种方式结束都会发出，字段为只读快照
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
@Builder
public class RequestCompletedEvent {

    String requestId;

    String method;

    String path;

    /**
     * 写回客户端的状态码，连接中断时为 0
     */
    int status;

    Duration duration;

    String clientIp;

    /**
     * 匹配到的路由模式，未匹配时为空
     */
    String route;

    /**
     * 负载均衡选中的实例，未使用负载均衡时为空
     */
    String instance;

    Map<String, String> requestHeaders;
}
